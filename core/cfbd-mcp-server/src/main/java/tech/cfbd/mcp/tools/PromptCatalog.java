package tech.cfbd.mcp.tools;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Map;

/**
 * Prompt templates offered to MCP clients.
 *
 * All five are listed; analyze-team and compare-teams can be rendered.
 */
@ApplicationScoped
public class PromptCatalog {

    private static final List<Prompt> PROMPTS = List.of(
        new Prompt("analyze-game", "Get detailed analysis of a specific game", List.of(
            new PromptArgument("game_id", "Game ID to analyze", true),
            new PromptArgument("include_advanced_stats", "Whether to include advanced statistics (true/false)", false))),
        new Prompt("analyze-team", "Analyze a team's performance for a given season", List.of(
            new PromptArgument("team", "Team name (e.g. Alabama)", true),
            new PromptArgument("year", "Season year", true))),
        new Prompt("analyze-trends", "Analyze trends over a season", List.of(
            new PromptArgument("year", "Season year", true),
            new PromptArgument("metric", "Metric to analyze (scoring, attendance, upsets)", true))),
        new Prompt("compare-teams", "Compare the performance of two teams", List.of(
            new PromptArgument("team1", "First team name", true),
            new PromptArgument("team2", "Second team name", true),
            new PromptArgument("year", "Season year", true))),
        new Prompt("analyze-rivalry", "Analyze historical rivalry matchups", List.of(
            new PromptArgument("team1", "First team name", true),
            new PromptArgument("team2", "Second team name", true),
            new PromptArgument("start_year", "Starting year for analysis", false)))
    );

    public List<Prompt> all() {
        return PROMPTS;
    }

    /**
     * Render a prompt into the single user message it produces.
     *
     * @throws IllegalArgumentException for an unknown or unrenderable prompt,
     *         or when arguments are missing
     */
    public String render(String name, Map<String, String> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("Arguments are required");
        }
        if ("analyze-team".equals(name)) {
            return "I'll help analyze " + argument(arguments, "team") + "'s performance for the "
                + argument(arguments, "year") + " season by checking the College Football Data API. "
                + "I'll review their record, key games, rankings and overall statistics.";
        }
        if ("compare-teams".equals(name)) {
            return "Let me check the College Football Data API to compare " + argument(arguments, "team1")
                + " and " + argument(arguments, "team2") + " in the " + argument(arguments, "year")
                + " season. I'll look at their head-to-head matchup if they played, "
                + "their records, common opponents, and statistical performance.";
        }
        throw new IllegalArgumentException("Unknown prompt: " + name);
    }

    private String argument(Map<String, String> arguments, String key) {
        String value = arguments.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument: " + key);
        }
        return value;
    }

    public record Prompt(String name, String description, List<PromptArgument> arguments) {
    }

    public record PromptArgument(String name, String description, boolean required) {
    }
}
