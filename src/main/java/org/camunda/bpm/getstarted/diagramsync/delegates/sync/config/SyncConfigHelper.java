package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models.SyncConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads {@code sync-config.json} and checks it against {@code schemas/sync-config.schema.json}.
 */
@Slf4j
public class SyncConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "sync-config.json";
    public static final String CONFIG_SCHEMA_RESOURCE = "schemas/sync-config.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the configuration bundled on the classpath, or the built-in defaults when there is none.
     */
    public static SyncConfig loadDefault() {
        try (InputStream configStream = SyncConfigHelper.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (configStream == null) {
                log.info("No {} on the classpath, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return SyncConfig.defaults();
            }
            return toConfig(mapper.readTree(configStream), DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from the file system.
     *
     * @param configFilePath path to a JSON file shaped like {@code sync-config.json}
     * @return the validated configuration
     * @throws IllegalStateException if the file cannot be read or does not match the schema
     */
    public static SyncConfig loadConfigFile(String configFilePath) {
        try {
            return toConfig(mapper.readTree(new File(configFilePath)), configFilePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + configFilePath, e);
        }
    }

    public static Set<ValidationMessage> validate(JsonNode configNode) {
        return loadSchema().validate(configNode);
    }

    private static SyncConfig toConfig(JsonNode configNode, String source) throws IOException {
        Set<ValidationMessage> errors = validate(configNode);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalStateException("Config " + source + " is invalid: " + details);
        }

        SyncConfig config = mapper.treeToValue(configNode, SyncConfig.class);
        checkRanges(config, source);
        log.debug("Loaded sync config from {}", source);
        return config;
    }

    private static void checkRanges(SyncConfig config, String source) {
        if (config.ids.subprocessFloor >= config.ids.edgeFloor) {
            throw new IllegalStateException(String.format(
                    "Config %s: ids.subprocessFloor (%d) must be below ids.edgeFloor (%d)",
                    source, config.ids.subprocessFloor, config.ids.edgeFloor));
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream schemaStream = SyncConfigHelper.class.getClassLoader().getResourceAsStream(CONFIG_SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + CONFIG_SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_SCHEMA_RESOURCE, e);
        }
    }
}
