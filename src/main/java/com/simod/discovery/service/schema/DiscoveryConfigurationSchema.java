package com.simod.discovery.service.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recognised fields of a discovery configuration document.
 *
 * Only the structure is described here; whether parameter values make sense
 * is decided by the discovery engine.
 */
public final class DiscoveryConfigurationSchema {

    public static final String VERSION = "version";
    public static final String COMMON = "common";
    public static final String TRAIN_LOG_PATH = "train_log_path";
    public static final String TEST_LOG_PATH = "test_log_path";

    /**
     * Configuration format version written into generated documents.
     */
    public static final int CURRENT_VERSION = 4;

    private static final Map<String, Map<String, FieldType>> SECTIONS = new LinkedHashMap<>();

    static {
        section(COMMON, Map.of(
                TRAIN_LOG_PATH, FieldType.STRING,
                TEST_LOG_PATH, FieldType.STRING,
                "num_final_evaluations", FieldType.INTEGER,
                "evaluation_metrics", FieldType.STRING_LIST,
                "log_ids", FieldType.STRING_MAP,
                "use_observed_arrival_distribution", FieldType.BOOLEAN,
                "clean_intermediate_files", FieldType.BOOLEAN,
                "discover_case_attributes", FieldType.BOOLEAN));
        section("preprocessing", Map.of(
                "multitasking", FieldType.BOOLEAN,
                "enable_time_concurrency_threshold", FieldType.NUMBER,
                "concurrency_df", FieldType.NUMBER,
                "concurrency_l2l", FieldType.NUMBER,
                "concurrency_l1l", FieldType.NUMBER));
        section("control_flow", Map.of(
                "optimization_metric", FieldType.STRING,
                "num_iterations", FieldType.INTEGER,
                "num_evaluations_per_iteration", FieldType.INTEGER,
                "gateway_probabilities", FieldType.STRING_OR_LIST,
                "discovery_algorithm", FieldType.STRING,
                "mining_algorithm", FieldType.STRING,
                "epsilon", FieldType.NUMBER_OR_LIST,
                "eta", FieldType.NUMBER_OR_LIST,
                "replace_or_joins", FieldType.BOOLEAN_OR_LIST,
                "prioritize_parallelism", FieldType.BOOLEAN_OR_LIST));
        section("resource_model", Map.of(
                "optimization_metric", FieldType.STRING,
                "num_iterations", FieldType.INTEGER,
                "num_evaluations_per_iteration", FieldType.INTEGER,
                "discover_prioritization_rules", FieldType.BOOLEAN,
                "discover_batching_rules", FieldType.BOOLEAN,
                "resource_profiles", FieldType.MAPPING));
        section("extraneous_activity_delays", Map.of(
                "optimization_metric", FieldType.STRING,
                "discovery_method", FieldType.STRING,
                "num_iterations", FieldType.INTEGER,
                "num_evaluations_per_iteration", FieldType.INTEGER));
    }

    private DiscoveryConfigurationSchema() {
    }

    private static void section(String name, Map<String, FieldType> fields) {
        SECTIONS.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static boolean isSection(String name) {
        return SECTIONS.containsKey(name);
    }

    public static Optional<FieldType> fieldType(String section, String field) {
        return Optional.ofNullable(SECTIONS.getOrDefault(section, Map.of()).get(field));
    }

    /**
     * Human-readable description of the schema, section by section.
     */
    public static Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put(VERSION, FieldType.INTEGER.description());
        SECTIONS.forEach((section, fields) -> {
            Map<String, String> fieldDescriptions = new LinkedHashMap<>();
            fields.forEach((field, type) -> fieldDescriptions.put(field, type.description()));
            description.put(section, fieldDescriptions);
        });
        return description;
    }
}
