package tech.cfbd.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ToolParameterValidator.
 */
class ToolParameterValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolCatalog catalog = new ToolCatalog();
    private final ToolParameterValidator validator = new ToolParameterValidator();

    private Map<String, Object> validate(String tool, String json) throws Exception {
        JsonNode arguments = objectMapper.readTree(json);
        return validator.validate(catalog.find(tool).orElseThrow(), arguments);
    }

    @Test
    @DisplayName("valid arguments should become query parameters")
    void validate_shouldConvertArguments() throws Exception {
        Map<String, Object> params = validate("get-games", "{\"year\": 2023, \"team\": \"Alabama\"}");

        assertThat(params).containsExactly(Map.entry("year", 2023L), Map.entry("team", "Alabama"));
    }

    @Test
    @DisplayName("an unknown argument should be rejected")
    void validate_shouldRejectUnexpectedParameter() {
        assertThatThrownBy(() -> validate("get-games", "{\"year\": 2023, \"color\": \"red\"}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Unexpected parameter: color");
    }

    @Test
    @DisplayName("a string where an int is expected should be rejected")
    void validate_shouldRejectWrongIntegerType() {
        assertThatThrownBy(() -> validate("get-games", "{\"year\": \"2023\"}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Parameter year must be of type int");
    }

    @Test
    @DisplayName("a number where a string is expected should be rejected")
    void validate_shouldRejectWrongStringType() {
        assertThatThrownBy(() -> validate("get-games", "{\"year\": 2023, \"team\": 7}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Parameter team must be of type str");
    }

    @Test
    @DisplayName("a fractional number should not pass as an int")
    void validate_shouldRejectFractionalInteger() {
        assertThatThrownBy(() -> validate("get-games", "{\"year\": 2023.5}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Parameter year must be of type int");
    }

    @Test
    @DisplayName("a missing required parameter should be rejected")
    void validate_shouldRejectMissingRequired() {
        assertThatThrownBy(() -> validate("get-plays", "{\"year\": 2023}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Missing required parameter: week");
    }

    @Test
    @DisplayName("null optional parameters should be dropped")
    void validate_shouldDropNullOptional() throws Exception {
        assertThat(validate("get-games", "{\"year\": 2023, \"week\": null}")).containsOnlyKeys("year");
    }

    @Test
    @DisplayName("a null required parameter should be a type error")
    void validate_shouldRejectNullRequired() {
        assertThatThrownBy(() -> validate("get-games", "{\"year\": null}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Parameter year must be of type int");
    }

    @Test
    @DisplayName("classification should be lower-cased")
    void validate_shouldNormalizeClassification() throws Exception {
        Map<String, Object> params = validate("get-plays", "{\"year\": 2023, \"week\": 1, \"classification\": \"FBS\"}");

        assertThat(params).containsEntry("classification", "fbs");
    }

    @Test
    @DisplayName("an unknown classification should be rejected")
    void validate_shouldRejectInvalidClassification() {
        assertThatThrownBy(() -> validate("get-plays", "{\"year\": 2023, \"week\": 1, \"classification\": \"d1\"}"))
            .isInstanceOf(ToolValidationException.class)
            .hasMessage("Invalid Classification: Must be one of: fbs, fcs, ii, iii");
    }

    @Test
    @DisplayName("the first problem in argument order should be reported")
    void validate_shouldReportFirstProblem() {
        assertThatThrownBy(() -> validate("get-plays", "{\"year\": \"x\", \"bogus\": 1}"))
            .hasMessage("Parameter year must be of type int");
    }
}
