package com.eventmirror.server;

import com.eventmirror.core.config.CollectorSettings;
import com.eventmirror.core.match.JsonMatchers;
import com.eventmirror.core.model.EventRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a mirrored request body into {@link EventRecord}s.
 *
 * <h3>Accepted shapes</h3>
 * <ul>
 * <li>a single JSON object – one event</li>
 * <li>a JSON array – one event per element</li>
 * <li>an envelope object carrying an array under the configured envelope
 * field ({@code {"meta":{..},"events":[..]}}) – one event per array
 * element; see {@link #isEnvelope(JsonNode)}</li>
 * </ul>
 *
 * <p>
 * A batch element holding serialized JSON as a string is parsed. Elements
 * that are not objects, or strings that do not parse, are skipped with a
 * warning so one bad element does not lose the rest of the batch. A body
 * that is not JSON at all raises {@link MalformedBatchException}.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchIngestor {

    private static final Logger LOG = LoggerFactory.getLogger(BatchIngestor.class);

    private final ObjectMapper mapper;
    private final String nameField;
    private final String envelopeField;

    /**
     * @param settings collector settings supplying the name and envelope
     *                 fields; must not be {@code null}
     */
    public BatchIngestor(CollectorSettings settings) {
        Objects.requireNonNull(settings, "CollectorSettings must not be null");
        this.mapper = EventJson.mapper();
        this.nameField = settings.getNameField();
        this.envelopeField = settings.getEnvelopeField();
    }

    /**
     * Parse {@code body} into unsequenced records.
     *
     * @param body       raw request body
     * @param batchId    identifier shared by every record of this request
     * @param receivedAt ingestion instant stamped on every record
     * @return records in batch order; skipped elements are absent
     * @throws MalformedBatchException if the body is empty, not JSON, or a
     *                                 JSON scalar
     */
    public List<EventRecord> parse(byte[] body, long batchId, Instant receivedAt) throws MalformedBatchException {
        JsonNode root = readBody(body);
        List<EventRecord> records = new ArrayList<>();

        List<JsonNode> elements = elementsOf(root);
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = resolveElement(elements.get(i), i, batchId);
            if (element == null) {
                continue;
            }
            records.add(EventRecord.builder()
                    .name(extractName(element))
                    .payload(element)
                    .receivedAt(receivedAt)
                    .sourceBatchId(batchId)
                    .build());
        }
        return records;
    }

    /**
     * Read the record name from the configured field path.
     *
     * @param event event object
     * @return the field's text, or {@value CollectorSettings#UNKNOWN_NAME}
     *         when absent, null, blank or not a scalar
     */
    String extractName(JsonNode event) {
        return JsonMatchers.at(event, nameField)
                .filter(node -> node.isValueNode() && !node.isNull())
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank())
                .orElse(CollectorSettings.UNKNOWN_NAME);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private JsonNode readBody(byte[] body) throws MalformedBatchException {
        if (body == null || body.length == 0) {
            throw new MalformedBatchException("Request body is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedBatchException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedBatchException("Request body could not be read: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MalformedBatchException("Request body is empty");
        }
        if (!root.isObject() && !root.isArray()) {
            throw new MalformedBatchException(
                    "Request body must be a JSON object or array, got: " + root.getNodeType());
        }
        return root;
    }

    private List<JsonNode> elementsOf(JsonNode root) {
        List<JsonNode> elements = new ArrayList<>();
        JsonNode container = isEnvelope(root) ? root.get(envelopeField) : root;
        if (container.isArray()) {
            container.forEach(elements::add);
        } else {
            elements.add(container);
        }
        return elements;
    }

    /**
     * An object is an envelope when its envelope field is an array and either
     * the object has no name of its own or the array carries at least one
     * event object. A named event with an array of scalars under that field
     * stays one event.
     */
    boolean isEnvelope(JsonNode root) {
        if (!root.isObject() || envelopeField == null || envelopeField.isBlank()) {
            return false;
        }
        JsonNode array = root.path(envelopeField);
        if (!array.isArray()) {
            return false;
        }
        if (CollectorSettings.UNKNOWN_NAME.equals(extractName(root))) {
            return true;
        }
        for (JsonNode element : array) {
            if (element.isObject() || (element.isTextual() && element.textValue().trim().startsWith("{"))) {
                return true;
            }
        }
        return false;
    }

    private JsonNode resolveElement(JsonNode element, int index, long batchId) {
        JsonNode resolved = element;
        if (element.isTextual()) {
            try {
                resolved = mapper.readTree(element.textValue());
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping element {} of batch {}: embedded JSON does not parse ({})",
                        index, batchId, e.getOriginalMessage());
                return null;
            }
        }
        if (resolved == null || !resolved.isObject()) {
            LOG.warn("Skipping element {} of batch {}: expected a JSON object, got {}",
                    index, batchId, resolved == null ? "nothing" : resolved.getNodeType());
            return null;
        }
        return resolved;
    }
}
