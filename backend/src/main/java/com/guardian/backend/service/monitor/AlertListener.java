package com.guardian.backend.service.monitor;

@FunctionalInterface
public interface AlertListener {
    void onAlert(Alert alert);
}
