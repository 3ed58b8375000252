package com.guardian.backend.service.advisor;

public enum DebateStance {
    /** High risk tolerance, maximize returns. */
    AGGRESSIVE,
    /** Risk averse, preserve capital. */
    CONSERVATIVE,
    /** Balanced. */
    NEUTRAL
}
