package socialjobs.worker.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns the raw payload column into a typed {@link JobPayload}.
 */
public class JobPayloadDecoder {

    private final ObjectMapper mapper;

    public JobPayloadDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decode a payload for the given job type.
     *
     * @throws JobExecutionException if the payload is not a JSON object
     */
    public JobPayload decode(String jobType, String rawJson) throws JobExecutionException {
        String json = rawJson == null || rawJson.isBlank() ? "{}" : rawJson;
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JobExecutionException("Invalid payload JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isNull()) {
            node = mapper.createObjectNode();
        }
        if (!(node instanceof ObjectNode)) {
            throw new JobExecutionException("Payload must be a JSON object, got " + node.getNodeType());
        }

        if (GenerateAssetsPayload.JOB_TYPE.equals(jobType)) {
            normalizeMeta((ObjectNode) node);
            try {
                return mapper.treeToValue(node, GenerateAssetsPayload.class);
            } catch (JsonProcessingException e) {
                throw new JobExecutionException("Invalid generate_assets payload: " + e.getOriginalMessage(), e);
            }
        }
        return new UnrecognizedPayload(jobType, json);
    }

    // Older producers write "metadata" instead of "meta"
    private static void normalizeMeta(ObjectNode node) {
        if (!node.hasNonNull("meta") && node.hasNonNull("metadata")) {
            node.set("meta", node.get("metadata"));
        }
        if (node.has("meta") && !node.get("meta").isObject()) {
            node.remove("meta");
        }
    }
}
