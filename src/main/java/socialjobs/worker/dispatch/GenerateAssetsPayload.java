package socialjobs.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Payload of a generate_assets job. Every field is optional here; the handler resolves
 * missing values from the job row or from {@code meta}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateAssetsPayload(
        @JsonProperty("org_id") String orgId,
        @JsonProperty("lead_id") String leadId,
        @JsonProperty("activity_id") String activityId,
        @JsonProperty("vertical_key") String verticalKey,
        @JsonProperty("locale") String locale,
        @JsonProperty("lead_name") String leadName,
        @JsonProperty("topic") String topic,
        @JsonProperty("offer") String offer,
        @JsonProperty("brief") String brief,
        @JsonProperty("meta") Map<String, Object> meta) implements JobPayload {

    public static final String JOB_TYPE = "generate_assets";

    public GenerateAssetsPayload {
        meta = meta == null ? Map.of() : meta;
    }

    @Override
    public String jobType() {
        return JOB_TYPE;
    }

    /**
     * Value from the payload itself, else from meta, else null. Blank values count as missing.
     */
    public String resolve(String direct, String metaKey) {
        if (direct != null && !direct.isBlank()) {
            return direct;
        }
        Object fromMeta = meta.get(metaKey);
        if (fromMeta == null) {
            return null;
        }
        String text = String.valueOf(fromMeta);
        return text.isBlank() ? null : text;
    }
}
