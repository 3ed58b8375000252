package com.guardian.backend.model;

import java.util.Locale;

public enum PositionAction {
    EXIT(1),
    REDUCE(2),
    REALLOCATE(3),
    ADD(4),
    HOLD(5);

    private final int priority;

    PositionAction(int priority) {
        this.priority = priority;
    }

    /**
     * Lower values are handled first when ranking suggestions.
     */
    public int priority() {
        return priority;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
