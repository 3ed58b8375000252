package com.guardian.backend.model;

public enum RebalanceAction {
    BUY,
    SELL,
    SELL_ALL,
    NO_ACTION;

    public boolean isSell() {
        return this == SELL || this == SELL_ALL;
    }
}
