package com.guardian.backend.model;

public enum AlertUrgency {
    LOW,
    MEDIUM,
    HIGH,
    IMMEDIATE
}
