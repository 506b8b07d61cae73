package socialjobs.worker.repository;

import socialjobs.worker.model.OutputKey;
import socialjobs.worker.model.OutputRecord;

import java.util.Optional;

/**
 * Repository for generated outputs, addressed by natural key.
 */
public interface OutputRepository {

    /**
     * Insert the output, or replace the content of the existing row with the same key.
     * Must be a single atomic statement so concurrent retries of one key converge on one row.
     *
     * @param output the content to store; its id is only used when a new row is inserted
     * @return the stored row as read back after the write
     */
    OutputRecord upsert(OutputRecord output);

    /**
     * Find the output for a natural key.
     */
    Optional<OutputRecord> findByKey(OutputKey key);
}
