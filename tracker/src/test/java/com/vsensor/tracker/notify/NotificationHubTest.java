package com.vsensor.tracker.notify;

import com.vsensor.core.metrics.MetricsNames;
import com.vsensor.core.metrics.MetricsTags;
import com.vsensor.core.model.SensorState;
import com.vsensor.tracker.config.TrackerConfig;
import com.vsensor.tracker.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NotificationHubTest {

    private SimpleMeterRegistry registry;
    private NotificationHub hub;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(registry, TrackerConfig.fromEnv(Map.of("NODE_ID", "test-node")));
        hub = new NotificationHub(metrics, "test-node");
    }

    private static SensorState state(String id) {
        return SensorState.builder().id(id).active(true).lastUpdate(Instant.EPOCH).build();
    }

    @Test
    @DisplayName("Every observer receives every change")
    void testBroadcastToAllObservers() {
        // Given
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        Disposable a = hub.observe(16).subscribe(s -> first.add(s.getId()));
        Disposable b = hub.observe(16).subscribe(s -> second.add(s.getId()));
        assertEquals(2, hub.observerCount());

        // When
        hub.broadcast(state("H1"));
        hub.broadcast(state("H2"));

        // Then
        assertEquals(List.of("H1", "H2"), first);
        assertEquals(List.of("H1", "H2"), second);

        a.dispose();
        b.dispose();
        assertEquals(0, hub.observerCount());
    }

    @Test
    @DisplayName("Broadcast without observers is a no-op")
    void testBroadcastWithoutObservers() {
        assertDoesNotThrow(() -> hub.broadcast(state("H1")));
    }

    @Test
    @DisplayName("Slow observer keeps only its newest pending changes")
    void testSlowObserverDropsOldest() {
        StepVerifier.create(hub.observe(2), 0)
            .then(() -> {
                for (int i = 1; i <= 5; i++) {
                    hub.broadcast(state("H" + i));
                }
            })
            .thenRequest(5)
            .expectNextMatches(s -> s.getId().equals("H4"))
            .expectNextMatches(s -> s.getId().equals("H5"))
            .thenCancel()
            .verify();

        assertEquals(3.0, registry.get(MetricsNames.NOTIFICATIONS_DROPPED_TOTAL)
            .tag(MetricsTags.STAGE, "observer").counter().count());
    }
}
