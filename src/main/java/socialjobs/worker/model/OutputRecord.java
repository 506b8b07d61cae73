package socialjobs.worker.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A generated social content kit, one per {@link OutputKey}.
 *
 * @param id           row id, assigned on first insert and kept across upserts
 * @param key          natural key
 * @param leadId       lead the content was written for, may be null
 * @param verticalKey  vertical profile that was used
 * @param status       publication status, {@code draft} when written by the worker
 * @param title        content title
 * @param hook         opening line
 * @param caption      post body
 * @param cta          call to action
 * @param hashtags     hashtags, each starting with '#'
 * @param imagePrompts prompts for the image generator
 * @param meta         trace_id, job_id and diagnostic timings
 * @param createdAt    first insert time
 * @param updatedAt    last upsert time
 */
public record OutputRecord(
        String id,
        OutputKey key,
        String leadId,
        String verticalKey,
        String status,
        String title,
        String hook,
        String caption,
        String cta,
        List<String> hashtags,
        List<String> imagePrompts,
        Map<String, Object> meta,
        Instant createdAt,
        Instant updatedAt) {

    public static final String STATUS_DRAFT = "draft";

    public OutputRecord {
        Objects.requireNonNull(key, "key is required");
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
        imagePrompts = imagePrompts == null ? List.of() : List.copyOf(imagePrompts);
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /** Trace id of the attempt that wrote the current content */
    public String traceId() {
        Object traceId = meta.get("trace_id");
        return traceId != null ? traceId.toString() : null;
    }
}
