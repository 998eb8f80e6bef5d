package com.faasrt.worker;

/**
 * How a single poll cycle ended.
 */
public enum CycleOutcome {
    /** GET against the store failed. */
    READ_FAILED,
    /** Raw value equals the last observed one. */
    UNCHANGED,
    /** Key changed to "not set". */
    NO_INPUT,
    /** Raw value is not a JSON object. */
    DECODE_FAILED,
    /** Handler threw. */
    HANDLER_FAILED,
    /** Handler returned something other than a map. */
    INVALID_RESULT,
    /** Encoding the result or the SET failed. */
    PUBLISH_FAILED,
    PUBLISHED
}
