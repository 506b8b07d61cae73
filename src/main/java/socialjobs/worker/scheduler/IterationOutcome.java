package socialjobs.worker.scheduler;

import socialjobs.worker.model.FinalizeResult;

/**
 * What a single worker loop iteration did.
 */
public enum IterationOutcome {
    /** Nothing to claim, or the claim race was lost */
    IDLE,
    COMPLETED,
    RETRIED,
    FAILED,
    /** The job was reaped while running; its outcome was discarded */
    LOST_OWNERSHIP,
    /** Store or other infrastructure error outside the handler */
    ERROR,
    /** Stop was requested before the iteration started */
    STOPPED;

    static IterationOutcome of(FinalizeResult result) {
        switch (result) {
            case COMPLETED:
                return COMPLETED;
            case RETRIED:
                return RETRIED;
            case FAILED:
                return FAILED;
            default:
                return LOST_OWNERSHIP;
        }
    }
}
