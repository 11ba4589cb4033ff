package org.camunda.bpm.getstarted.diagramsync.delegates.sync.form;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Connection;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramGraph;
import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.DiagramNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON exchange with the form surface.
 */
@Slf4j
public class FormPayloadHelper {
    public static final String NODES_SCHEMA_RESOURCE = "schemas/form-nodes.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final TypeReference<List<DiagramNode>> NODE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Connection>> CONNECTION_LIST = new TypeReference<>() {
    };

    private static JsonSchema nodesSchema;

    /**
     * Parses edited nodes sent back by the form.
     *
     * @param json a JSON array of nodes
     * @return the nodes in the order they were sent
     * @throws InvalidFormPayloadException if the JSON is malformed or does not match the schema
     */
    public static List<DiagramNode> readNodes(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode payload;
        try {
            payload = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidFormPayloadException("Form nodes are not valid JSON: " + e.getOriginalMessage(), e);
        }

        Set<ValidationMessage> errors = validate(payload);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new InvalidFormPayloadException("Form nodes do not match " + NODES_SCHEMA_RESOURCE + ": " + details);
        }

        try {
            return mapper.convertValue(payload, NODE_LIST);
        } catch (IllegalArgumentException e) {
            throw new InvalidFormPayloadException("Failed to map form nodes", e);
        }
    }

    /**
     * Parses a graph for the rebuild path: an object with a {@code nodes} array, checked like edited
     * form nodes, and an optional {@code connections} array.
     *
     * @throws InvalidFormPayloadException if the JSON is malformed or its nodes do not match the schema
     */
    public static DiagramGraph readGraph(String json) {
        JsonNode payload;
        try {
            payload = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidFormPayloadException("Graph is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (payload == null || !payload.isObject()) {
            throw new InvalidFormPayloadException("Graph must be a JSON object with a 'nodes' array");
        }
        List<DiagramNode> nodes = payload.has("nodes") ? readNodes(payload.get("nodes").toString()) : List.of();
        try {
            List<Connection> connections = payload.has("connections")
                    ? mapper.convertValue(payload.get("connections"), CONNECTION_LIST)
                    : List.of();
            return new DiagramGraph(nodes, connections);
        } catch (IllegalArgumentException e) {
            throw new InvalidFormPayloadException("Failed to map graph connections", e);
        }
    }

    /**
     * Reads the ids a form view written by {@link #writeFormView(FormView)} showed to the user.
     *
     * @throws InvalidFormPayloadException if the JSON is malformed or is not a form view
     */
    public static Set<String> readShownIds(String formViewJson) {
        FormView view;
        try {
            view = mapper.readValue(formViewJson, FormView.class);
        } catch (JsonProcessingException e) {
            throw new InvalidFormPayloadException("Form view is not valid: " + e.getOriginalMessage(), e);
        }
        if (view.steps() == null) {
            throw new InvalidFormPayloadException("Form view has no 'steps'");
        }
        return view.shownIds();
    }

    public static Set<ValidationMessage> validate(JsonNode payload) {
        return schema().validate(payload);
    }

    public static String writeNodes(List<DiagramNode> nodes) {
        return write(nodes);
    }

    public static String writeFormView(FormView view) {
        return write(view);
    }

    private static String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static synchronized JsonSchema schema() {
        if (nodesSchema == null) {
            try (InputStream schemaStream = FormPayloadHelper.class.getClassLoader().getResourceAsStream(NODES_SCHEMA_RESOURCE)) {
                if (schemaStream == null) {
                    throw new IllegalStateException("Schema resource not found: " + NODES_SCHEMA_RESOURCE);
                }
                nodesSchema = factory.getSchema(mapper.readTree(schemaStream));
                log.debug("Loaded {}", NODES_SCHEMA_RESOURCE);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read " + NODES_SCHEMA_RESOURCE, e);
            }
        }
        return nodesSchema;
    }
}
