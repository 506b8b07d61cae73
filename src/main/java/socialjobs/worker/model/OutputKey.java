package socialjobs.worker.model;

import java.util.Objects;

/**
 * Natural key of a generated output: which org, which source activity, which channel slot.
 * Retries of the same job resolve to the same key, so they converge on one row.
 */
public record OutputKey(String orgId, String activityId, String channel) {

    public static final String CHANNEL_MULTI = "multi";

    public OutputKey {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(activityId, "activityId is required");
        Objects.requireNonNull(channel, "channel is required");
    }

    @Override
    public String toString() {
        return orgId + "/" + activityId + "/" + channel;
    }
}
