package com.guardian.backend.service.notification;

@FunctionalInterface
public interface NotificationListener<E> {
    void onEvent(E event);
}
