package socialjobs.worker.model;

/**
 * Result of moving a running job to its next state.
 */
public enum FinalizeResult {
    /** Job marked done */
    COMPLETED,

    /** Job failed and was put back in the queue */
    RETRIED,

    /** Job failed and its attempt budget is exhausted */
    FAILED,

    /** Row was no longer running under this worker (reaped or re-claimed) */
    LOST_OWNERSHIP
}
