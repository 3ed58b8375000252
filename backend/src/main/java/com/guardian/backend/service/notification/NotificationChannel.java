package com.guardian.backend.service.notification;

import com.guardian.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, fire-and-forget event channel. Publishing never blocks: events are queued and delivered
 * in order by a single drain task on the supplied executor. A full queue drops the event.
 */
@Slf4j
public class NotificationChannel<E> {

    private final String name;
    private final BlockingQueue<E> queue;
    private final Executor executor;
    private final MetricsService metricsService;
    private final List<NotificationListener<E>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    public NotificationChannel(String name, int capacity, Executor executor, MetricsService metricsService) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.executor = executor;
        this.metricsService = metricsService;
    }

    public void addListener(NotificationListener<E> listener) {
        listeners.add(listener);
    }

    public boolean publish(E event) {
        if (!queue.offer(event)) {
            log.warn("Notification channel {} full, dropping event {}", name, event);
            metricsService.recordNotificationDropped(name);
            return false;
        }
        scheduleDrain();
        return true;
    }

    public int pending() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Notification channel {} could not schedule delivery: {}", name, e.getMessage());
        }
    }

    private void drain() {
        try {
            E event;
            while ((event = queue.poll()) != null) {
                deliver(event);
            }
        } finally {
            draining.set(false);
        }
        if (!queue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void deliver(E event) {
        for (NotificationListener<E> listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener on channel {} failed: {}", name, e.getMessage(), e);
            }
        }
    }
}
