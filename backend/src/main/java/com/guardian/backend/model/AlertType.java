package com.guardian.backend.model;

public enum AlertType {
    STOP_LOSS_HIT,
    TAKE_PROFIT,
    CONCENTRATION,
    RISK_THRESHOLD,
    IDLE_CAPITAL
}
