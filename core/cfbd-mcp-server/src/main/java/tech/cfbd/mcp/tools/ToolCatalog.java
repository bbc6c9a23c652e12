package tech.cfbd.mcp.tools;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static tech.cfbd.mcp.tools.ToolParameter.ParameterType.INTEGER;
import static tech.cfbd.mcp.tools.ToolParameter.ParameterType.STRING;
import static tech.cfbd.mcp.tools.ToolParameter.optional;
import static tech.cfbd.mcp.tools.ToolParameter.required;

/**
 * The fixed set of College Football Data API queries exposed as tools.
 */
@ApplicationScoped
public class ToolCatalog {

    static final String ATTRIBUTION_NOTE = "Note: When using this tool, please explicitly mention that you are "
        + "retrieving data from the College Football Data API. You must mention \"College Football Data API\" "
        + "in every response.\n\n";

    private static final List<ToolDefinition> TOOLS = List.of(
        new ToolDefinition("get-games", "/games", describe("""
            Get college football game data.
            Required: year
            Optional: week, season_type, team, conference, category, game_id
            Example valid queries:
            - year=2023
            - year=2023, team="Alabama"
            - year=2023, week=1, conference="SEC"
            """),
            List.of(
                required("year", INTEGER),
                optional("week", INTEGER),
                optional("season_type", STRING),
                optional("team", STRING),
                optional("conference", STRING),
                optional("category", STRING),
                optional("game_id", INTEGER))),

        new ToolDefinition("get-records", "/records", describe("""
            Get college football team record data.
            Optional: year, team, conference
            Example valid queries:
            - year=2023
            - team="Alabama"
            - conference="SEC"
            - year=2023, team="Alabama"
            """),
            List.of(
                optional("year", INTEGER),
                optional("team", STRING),
                optional("conference", STRING))),

        new ToolDefinition("get-games-teams", "/games/teams", describe("""
            Get college football team game data.
            Required: year plus at least one of: week, team or conference.
            Example valid queries:
            - year=2023, team="Alabama"
            - year=2023, week=1
            - year=2023, conference="SEC"
            """),
            List.of(
                required("year", INTEGER),
                optional("week", INTEGER),
                optional("season_type", STRING),
                optional("team", STRING),
                optional("conference", STRING),
                optional("game_id", INTEGER),
                optional("classification", STRING))),

        new ToolDefinition("get-plays", "/plays", describe("""
            Get college football play-by-play data.
            Required: year AND week
            Optional: season_type, team, offense, defense, conference, offense_conference, defense_conference, play_type, classification
            Example valid queries:
            - year=2023, week=1
            - year=2023, week=1, team="Alabama"
            - year=2023, week=1, offense="Alabama", defense="Auburn"
            """),
            List.of(
                required("year", INTEGER),
                required("week", INTEGER),
                optional("season_type", STRING),
                optional("team", STRING),
                optional("offense", STRING),
                optional("defense", STRING),
                optional("conference", STRING),
                optional("offense_conference", STRING),
                optional("defense_conference", STRING),
                optional("play_type", INTEGER),
                optional("classification", STRING))),

        new ToolDefinition("get-drives", "/drives", describe("""
            Get college football drive data.
            Required: year
            Optional: season_type, week, team, offense, defense, conference, offense_conference, defense_conference, classification
            Example valid queries:
            - year=2023
            - year=2023, team="Alabama"
            - year=2023, offense="Alabama", defense="Auburn"
            """),
            List.of(
                required("year", INTEGER),
                optional("season_type", STRING),
                optional("week", INTEGER),
                optional("team", STRING),
                optional("offense", STRING),
                optional("defense", STRING),
                optional("conference", STRING),
                optional("offense_conference", STRING),
                optional("defense_conference", STRING),
                optional("classification", STRING))),

        new ToolDefinition("get-play-stats", "/play/stats", describe("""
            Get college football play statistic data.
            Optional: year, week, team, game_id, athlete_id, stat_type_id, season_type, conference
            At least one parameter is required
            Example valid queries:
            - year=2023
            - game_id=401403910
            - team="Alabama", year=2023
            """),
            List.of(
                optional("year", INTEGER),
                optional("week", INTEGER),
                optional("team", STRING),
                optional("game_id", INTEGER),
                optional("athlete_id", INTEGER),
                optional("stat_type_id", INTEGER),
                optional("season_type", STRING),
                optional("conference", STRING))),

        new ToolDefinition("get-rankings", "/rankings", describe("""
            Get college football rankings data.
            Required: year
            Optional: week, season_type
            Example valid queries:
            - year=2023
            - year=2023, week=1
            - year=2023, season_type="regular"
            """),
            List.of(
                required("year", INTEGER),
                optional("week", INTEGER),
                optional("season_type", STRING))),

        new ToolDefinition("get-pregame-win-probability", "/metrics/wp/pregame", describe("""
            Get college football pregame win probability data.
            Optional: year, week, team, season_type
            At least one parameter is required
            Example valid queries:
            - year=2023
            - team="Alabama"
            - year=2023, week=1
            """),
            List.of(
                optional("year", INTEGER),
                optional("week", INTEGER),
                optional("team", STRING),
                optional("season_type", STRING))),

        new ToolDefinition("get-advanced-box-score", "/game/box/advanced", describe("""
            Get advanced box score data for college football games.
            Required: gameId
            Example valid queries:
            - gameId=401403910
            """),
            List.of(
                required("gameId", INTEGER)))
    );

    private static final Map<String, ToolDefinition> BY_NAME = TOOLS.stream()
        .collect(Collectors.toUnmodifiableMap(ToolDefinition::name, Function.identity()));

    private static String describe(String body) {
        return ATTRIBUTION_NOTE + body;
    }

    public List<ToolDefinition> all() {
        return TOOLS;
    }

    public Optional<ToolDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
    }

    public Optional<ToolDefinition> findByPath(String path) {
        return TOOLS.stream().filter(tool -> tool.path().equals(path)).findFirst();
    }
}
