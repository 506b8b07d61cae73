package socialjobs.worker.model;

/**
 * Lead context that enriches the generation prompt.
 */
public record Lead(
        String id,
        String orgId,
        String name,
        String company,
        String city,
        String notes,
        String source) {
}
