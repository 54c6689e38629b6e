package com.simod.discovery.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.simod.discovery.service.config.DiscoveryConfig;
import com.simod.discovery.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryConfigurationValidatorTest {

    private static final String VALID = """
            version: 4
            common:
              train_log_path: /data/log.csv
              test_log_path: /data/test.csv
              num_final_evaluations: 10
              evaluation_metrics:
                - 3_gram_distance
                - circadian_emd
              log_ids:
                case: case_id
                activity: Activity
            preprocessing:
              multitasking: false
            control_flow:
              num_iterations: 20
              epsilon: [0.05, 0.4]
              replace_or_joins: [true, false]
            resource_model:
              discover_prioritization_rules: true
            """;

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    private DiscoveryConfig discoveryConfig;
    private DiscoveryConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        discoveryConfig = new DiscoveryConfig();
        validator = new DiscoveryConfigurationValidator(discoveryConfig);
    }

    @Test
    void validate_acceptsWellFormedConfiguration() {
        ObjectNode document = validator.validate(bytes(VALID));

        assertThat(document.path("version").asInt()).isEqualTo(4);
        assertThat(document.path("control_flow").path("num_iterations").asInt()).isEqualTo(20);
    }

    @Test
    void validate_rejectsEmptyAndNonMappingDocuments() {
        assertThatThrownBy(() -> validator.validate(new byte[0])).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(bytes("---\n"))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(bytes("- a\n- b\n")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    void validate_rejectsYamlSyntaxErrors() {
        assertThatThrownBy(() -> validator.validate(bytes("common: [unclosed\n")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not valid YAML");
    }

    @Test
    void validate_reportsEveryTypeMismatch() {
        String invalid = """
                version: four
                common:
                  num_final_evaluations: many
                  evaluation_metrics: dl
                control_flow: 3
                """;

        assertThatThrownBy(() -> validator.validate(bytes(invalid)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'version' must be an integer")
                .hasMessageContaining("'common.num_final_evaluations' must be an integer")
                .hasMessageContaining("'common.evaluation_metrics' must be a list of strings")
                .hasMessageContaining("'control_flow' must be a mapping");
    }

    @Test
    void unknownSections_ignoredUnlessStrict() {
        byte[] content = bytes("version: 4\nfuture_section:\n  enabled: true\n");

        assertThat(validator.validate(content).has("future_section")).isTrue();

        discoveryConfig.setStrictConfiguration(true);
        assertThatThrownBy(() -> validator.validate(content))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown section 'future_section'");
    }

    @Test
    void rewriteForLog_pointsAtStoredLogAndDropsTestLog() throws Exception {
        ObjectNode document = validator.validate(bytes(VALID));

        JsonNode rewritten = yaml.readTree(validator.rewriteForLog(document, "/store/job-1/event_log.csv"));

        assertThat(rewritten.path("common").path("train_log_path").asText()).isEqualTo("/store/job-1/event_log.csv");
        assertThat(rewritten.path("common").path("test_log_path").isNull()).isTrue();
        assertThat(rewritten.path("common").path("num_final_evaluations").asInt()).isEqualTo(10);
        assertThat(document.path("common").path("train_log_path").asText()).isEqualTo("/data/log.csv");
    }

    @Test
    void rewriteForLog_addsCommonSectionWhenMissing() throws Exception {
        ObjectNode document = validator.validate(bytes("version: 4\n"));

        JsonNode rewritten = yaml.readTree(validator.rewriteForLog(document, "/store/log.xes"));

        assertThat(rewritten.path("common").path("train_log_path").asText()).isEqualTo("/store/log.xes");
    }

    @Test
    void minimalFor_producesValidConfiguration() {
        byte[] minimal = validator.minimalFor("/store/log.csv");

        ObjectNode document = validator.validate(minimal);
        assertThat(document.path("version").asInt()).isEqualTo(DiscoveryConfigurationSchema.CURRENT_VERSION);
        assertThat(document.path("common").path("train_log_path").asText()).isEqualTo("/store/log.csv");
    }

    @Test
    void describe_listsEverySection() {
        assertThat(DiscoveryConfigurationSchema.describe())
                .containsKeys("version", "common", "preprocessing", "control_flow",
                        "resource_model", "extraneous_activity_delays");
    }

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
