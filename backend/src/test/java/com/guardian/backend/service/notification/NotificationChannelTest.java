package com.guardian.backend.service.notification;

import com.guardian.backend.service.MetricsService;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class NotificationChannelTest {

    private final MetricsService metricsService = mock(MetricsService.class);

    @Test
    void deliversEventsInPublishOrder() {
        NotificationChannel<String> channel = new NotificationChannel<>("alerts-1", 16, Runnable::run, metricsService);
        List<String> received = new ArrayList<>();
        channel.addListener(received::add);

        channel.publish("first");
        channel.publish("second");
        channel.publish("third");

        assertThat(received).containsExactly("first", "second", "third");
        assertThat(channel.pending()).isZero();
    }

    @Test
    void failingListenerDoesNotStarveOthers() {
        NotificationChannel<String> channel = new NotificationChannel<>("alerts-1", 16, Runnable::run, metricsService);
        List<String> received = new ArrayList<>();
        channel.addListener(event -> {
            throw new IllegalStateException("chat endpoint down");
        });
        channel.addListener(received::add);

        assertThat(channel.publish("stop-loss")).isTrue();
        assertThat(channel.publish("take-profit")).isTrue();

        assertThat(received).containsExactly("stop-loss", "take-profit");
    }

    @Test
    void fullQueueDropsEventAndCountsIt() {
        List<Runnable> scheduled = new ArrayList<>();
        NotificationChannel<String> channel = new NotificationChannel<>("trades-7", 2, scheduled::add, metricsService);

        assertThat(channel.publish("a")).isTrue();
        assertThat(channel.publish("b")).isTrue();
        assertThat(channel.publish("c")).isFalse();

        assertThat(channel.pending()).isEqualTo(2);
        assertThat(scheduled).hasSize(1);
        verify(metricsService, times(1)).recordNotificationDropped("trades-7");
    }

    @Test
    void queuedEventsAreDeliveredOnceDrainRuns() {
        List<Runnable> scheduled = new ArrayList<>();
        NotificationChannel<String> channel = new NotificationChannel<>("trades-7", 8, scheduled::add, metricsService);
        List<String> received = new ArrayList<>();
        channel.addListener(received::add);

        channel.publish("a");
        channel.publish("b");
        assertThat(received).isEmpty();

        scheduled.get(0).run();

        assertThat(received).containsExactly("a", "b");
        verify(metricsService, never()).recordNotificationDropped("trades-7");
    }

    @Test
    void rejectedDrainIsRetriedOnNextPublish() {
        List<Runnable> scheduled = new ArrayList<>();
        boolean[] reject = {true};
        NotificationChannel<String> channel = new NotificationChannel<>("alerts-2", 8, task -> {
            if (reject[0]) {
                throw new RejectedExecutionException("pool shut down");
            }
            scheduled.add(task);
        }, metricsService);
        List<String> received = new ArrayList<>();
        channel.addListener(received::add);

        channel.publish("a");
        reject[0] = false;
        channel.publish("b");
        scheduled.forEach(Runnable::run);

        assertThat(received).containsExactly("a", "b");
    }

    @Test
    void concurrentPublishersAreDeliveredWithoutLoss() throws Exception {
        ExecutorService delivery = Executors.newSingleThreadExecutor();
        ExecutorService publishers = Executors.newFixedThreadPool(4);
        NotificationChannel<Integer> channel = new NotificationChannel<>("alerts-3", 1_000, delivery, metricsService);
        List<Integer> received = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(400);
        channel.addListener(event -> {
            received.add(event);
            done.countDown();
        });
        try {
            for (int i = 0; i < 400; i++) {
                int event = i;
                publishers.submit(() -> channel.publish(event));
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            publishers.shutdownNow();
            delivery.shutdownNow();
        }
        assertThat(received).hasSize(400).doesNotHaveDuplicates();
    }
}
