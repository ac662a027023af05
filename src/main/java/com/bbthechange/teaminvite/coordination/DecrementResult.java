package com.bbthechange.teaminvite.coordination;

/**
 * Outcome of {@link Coordinator#decrementIfPositive}.
 */
public enum DecrementResult {
    DECREMENTED,
    EXHAUSTED,
    MISSING
}
