package com.faasrt.config;

import com.faasrt.worker.CycleOutcome;

/**
 * When a newly read input value counts as "seen" by the change detector.
 */
public enum ObservationPolicy {

    /**
     * The value is marked observed as soon as it is read. A cycle that fails
     * after the read is not repeated until the input changes again.
     */
    ADVANCE_ON_READ,

    /**
     * The value stays unobserved until a cycle publishes for it, so handler
     * failures, non-map results and failed writes are retried on the next poll.
     * Missing and undecodable input still advance: the same text cannot decode
     * differently next time.
     */
    RETRY_ON_FAILURE;

    public boolean keepsObservation(CycleOutcome outcome) {
        if (this == ADVANCE_ON_READ) {
            return true;
        }
        return switch (outcome) {
            case PUBLISHED, NO_INPUT, DECODE_FAILED -> true;
            default -> false;
        };
    }
}
