package tech.cfbd.mcp.tools;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Plain-text endpoint descriptions served as MCP resources under
 * {@code schema://}.
 *
 * Input parameters are rendered from the {@link ToolCatalog} so the two never
 * drift apart. Response fields are listed at the top level only.
 */
@Singleton
public class EndpointSchemas {

    static final String MIME_TYPE = "text/plain";

    private static final List<EndpointSchema> SCHEMAS = List.of(
        new EndpointSchema("schema://games", "Games endpoint schema",
            "Get game information with scores, teams and metadata",
            "/games", "Get game information for specified parameters", """
            - id: int
            - season: int
            - week: int
            - season_type: str
            - start_date: str
            - start_time_tbd: bool
            - completed: bool
            - neutral_site: bool
            - conference_game: bool
            - attendance: Optional[int]
            - venue_id: Optional[int]
            - venue: Optional[str]
            - home_id: int
            - home_team: str
            - home_conference: Optional[str]
            - home_division: Optional[str]
            - home_points: Optional[int]
            - home_line_scores: List[int]
            - home_post_win_prob: Optional[float]
            - home_pregame_elo: Optional[float]
            - home_postgame_elo: Optional[float]
            - away_id: int
            - away_team: str
            - away_conference: Optional[str]
            - away_division: Optional[str]
            - away_points: Optional[int]
            - away_line_scores: List[int]
            - away_post_win_prob: Optional[float]
            - away_pregame_elo: Optional[float]
            - away_postgame_elo: Optional[float]
            - excitement_index: Optional[float]
            - highlights: Optional[str]
            - notes: Optional[str]"""),

        new EndpointSchema("schema://records", "Team records endpoint schema",
            "Get team season records",
            "/records", "Get team records for specified parameters", """
            - year: int
            - teamId: int
            - team: str
            - conference: Optional[str]
            - division: Optional[str]
            - expectedWins: float
            - total: GameRecord
            - conferenceGames: GameRecord
            - homeGames: GameRecord
            - awayGames: GameRecord"""),

        new EndpointSchema("schema://plays", "Plays endpoint",
            "Schema for the /plays endpoint",
            "/plays", "Get play records for specified parameters", """
            - id: int
            - drive_id: int
            - game_id: int
            - drive_number: int
            - play_number: int
            - offense: str
            - offense_conference: Optional[str]
            - offense_score: int
            - defense: str
            - home: str
            - away: str
            - defense_conference: Optional[str]
            - defense_score: int
            - period: int
            - clock: GameClock
            - offense_timeouts: int
            - defense_timeouts: int
            - yard_line: int
            - yards_to_goal: int
            - down: Optional[int]
            - distance: Optional[int]
            - yards_gained: int
            - scoring: bool
            - play_type: str
            - play_text: str
            - ppa: Optional[float]
            - wallclock: Optional[str]"""),

        new EndpointSchema("schema://drives", "Drives endpoint",
            "Schema for the /drives endpoint",
            "/drives", "Get drive records for specified parameters", """
            - offense: str
            - offense_conference: Optional[str]
            - defense: str
            - defense_conference: Optional[str]
            - game_id: int
            - id: int
            - drive_number: int
            - scoring: bool
            - start_period: int
            - start_yardline: int
            - start_yards_to_goal: int
            - start_time: GameClock
            - end_period: int
            - end_yardline: int
            - end_yards_to_goal: int
            - end_time: GameClock
            - plays: int
            - yards: int
            - drive_result: str
            - is_home_offense: bool
            - start_offense_score: int
            - start_defense_score: int
            - end_offense_score: int
            - end_defense_score: int"""),

        new EndpointSchema("schema://play/stats", "Play/stats endpoint",
            "Schema for the /play/stats endpoint",
            "/play/stats", "Get play by play records for specified parameters", """
            - gameId: int
            - season: int
            - week: int
            - team: str
            - conference: Optional[str]
            - opponent: str
            - teamScore: Optional[int]
            - opponentScore: Optional[int]
            - driveId: int
            - playId: int
            - period: int
            - clock: GameClock
            - yardsToGoal: int
            - down: Optional[int]
            - distance: Optional[int]
            - athleteId: int
            - athleteName: str
            - statType: str
            - stat: int"""),

        new EndpointSchema("schema://rankings", "Rankings endpoint",
            "Schema for the /rankings endpoint",
            "/rankings", "Get rankings records for specified parameters", """
            - season: int
            - seasonType: str
            - week: int
            - polls: List[Poll]"""),

        new EndpointSchema("schema://metrics/wp/pregame", "Metrics/wp/pregame endpoint",
            "Schema for the pregame win probability endpoint",
            "/metrics/wp/pregame", "Get pregame win probability records for specified parameters", """
            - season: int
            - seasonType: str
            - week: int
            - gameId: int
            - homeTeam: str
            - awayTeam: str
            - spread: float
            - homeWinProb: float"""),

        new EndpointSchema("schema://game/box/advanced", "Advanced box score endpoint",
            "Schema for the advanced box score endpoint",
            "/game/box/advanced", "Get advanced box score data", """
            - teams: TeamStats
            - players: PlayerStats""")
    );

    private final ToolCatalog catalog;

    @Inject
    public EndpointSchemas(ToolCatalog catalog) {
        this.catalog = catalog;
    }

    public List<SchemaResource> list() {
        return SCHEMAS.stream()
            .map(schema -> new SchemaResource(schema.uri(), schema.name(), schema.summary(), MIME_TYPE))
            .collect(Collectors.toList());
    }

    /**
     * @return the rendered schema text, or empty for an unknown URI
     */
    public Optional<String> read(String uri) {
        return SCHEMAS.stream()
            .filter(schema -> schema.uri().equals(uri))
            .findFirst()
            .map(this::render);
    }

    private String render(EndpointSchema schema) {
        String parameters = catalog.findByPath(schema.endpoint())
            .map(tool -> tool.parameters().stream()
                .map(p -> "- " + p.name() + ": " + (p.required()
                    ? p.type().displayName()
                    : "Optional[" + p.type().displayName() + "]"))
                .collect(Collectors.joining("\n")))
            .orElse("");

        return "Endpoint: " + schema.endpoint() + "\n"
            + "Description: " + schema.description() + "\n"
            + "\n"
            + "Input Parameters:\n"
            + parameters + "\n"
            + "\n"
            + "Response Schema:\n"
            + schema.responseFields() + "\n"
            + "\n"
            + "Valid Values:\n"
            + "- Seasons: 2001 to 2023\n"
            + "- WEEKS: 1 to 15\n"
            + "- Season Types: regular, postseason\n"
            + "- Divisions: " + String.join(", ", ToolParameterValidator.VALID_DIVISIONS) + "\n";
    }

    /**
     * Entry in {@code resources/list}.
     */
    public record SchemaResource(String uri, String name, String description, String mimeType) {
    }

    private record EndpointSchema(String uri, String name, String summary,
                                  String endpoint, String description, String responseFields) {
    }
}
