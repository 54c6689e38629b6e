package com.simod.discovery.service.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.simod.discovery.service.config.DiscoveryConfig;
import com.simod.discovery.service.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Structural validation of uploaded discovery configurations.
 *
 * Checks that the document is a YAML mapping whose recognised sections have
 * the expected shapes. Parameter values are left to the engine.
 */
@Slf4j
@Component
public class DiscoveryConfigurationValidator {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private final DiscoveryConfig config;

    public DiscoveryConfigurationValidator(DiscoveryConfig config) {
        this.config = config;
    }

    /**
     * Parses and validates a configuration document.
     *
     * @return the parsed document
     * @throws ValidationException if the document is empty, not YAML or does not match the schema
     */
    public ObjectNode validate(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ValidationException("Configuration file is empty");
        }

        JsonNode document;
        try {
            document = yaml.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Configuration is not valid YAML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("Configuration could not be read", e);
        }

        if (document == null || document.isMissingNode() || document.isNull()) {
            throw new ValidationException("Configuration file is empty");
        }
        if (!document.isObject()) {
            throw new ValidationException("Configuration must be a YAML mapping");
        }

        List<String> errors = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            checkTopLevel(field.getKey(), field.getValue(), errors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid configuration: " + String.join("; ", errors));
        }
        return (ObjectNode) document;
    }

    /**
     * Points the configuration at the stored event log and drops any test log.
     *
     * @return the rewritten document as YAML
     */
    public byte[] rewriteForLog(ObjectNode document, String logPath) {
        ObjectNode copy = document.deepCopy();
        JsonNode common = copy.get(DiscoveryConfigurationSchema.COMMON);
        ObjectNode commonNode = common instanceof ObjectNode objectNode
                ? objectNode
                : copy.putObject(DiscoveryConfigurationSchema.COMMON);
        commonNode.put(DiscoveryConfigurationSchema.TRAIN_LOG_PATH, logPath);
        commonNode.putNull(DiscoveryConfigurationSchema.TEST_LOG_PATH);
        return write(copy);
    }

    /**
     * Builds the smallest configuration the engine accepts for a log.
     */
    public byte[] minimalFor(String logPath) {
        ObjectNode document = yaml.createObjectNode();
        document.put(DiscoveryConfigurationSchema.VERSION, DiscoveryConfigurationSchema.CURRENT_VERSION);
        document.putObject(DiscoveryConfigurationSchema.COMMON)
                .put(DiscoveryConfigurationSchema.TRAIN_LOG_PATH, logPath)
                .putNull(DiscoveryConfigurationSchema.TEST_LOG_PATH);
        return write(document);
    }

    /**
     * Renders any document as YAML.
     */
    public byte[] write(Object document) {
        try {
            return yaml.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render configuration", e);
        }
    }

    private void checkTopLevel(String name, JsonNode value, List<String> errors) {
        if (DiscoveryConfigurationSchema.VERSION.equals(name)) {
            if (!value.isIntegralNumber()) {
                errors.add("'version' must be an integer");
            }
            return;
        }
        if (!DiscoveryConfigurationSchema.isSection(name)) {
            if (config.isStrictConfiguration()) {
                errors.add("unknown section '" + name + "'");
            } else {
                log.debug("Ignoring unknown configuration section '{}'", name);
            }
            return;
        }
        if (value.isNull()) {
            return;
        }
        if (!value.isObject()) {
            errors.add("'" + name + "' must be a mapping");
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            DiscoveryConfigurationSchema.fieldType(name, field.getKey())
                    .filter(type -> !type.accepts(field.getValue()))
                    .ifPresent(type -> errors.add(
                            "'" + name + "." + field.getKey() + "' must be " + type.description()));
        }
    }
}
