package com.vsensor.tracker.liveness;

import com.vsensor.core.error.SensorNotFoundException;
import com.vsensor.core.error.StateCacheUnavailableException;
import com.vsensor.core.model.Heartbeat;
import com.vsensor.core.model.SensorInfo;
import com.vsensor.core.model.SensorState;
import com.vsensor.core.msg.HeartbeatParseResult;
import com.vsensor.core.msg.HeartbeatParser;
import com.vsensor.core.msg.RejectReason;
import com.vsensor.core.util.BytesUtils;
import com.vsensor.tracker.config.TrackerConfig;
import com.vsensor.tracker.heartbeat.IHeartbeatSource;
import com.vsensor.tracker.metrics.MetricsService;
import com.vsensor.tracker.redis.IStateCache;
import com.vsensor.tracker.repo.ISensorInfoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Tracks which sensors are alive.
 * <p>
 * Heartbeats mark a sensor active and refresh its {@code lastUpdate}. A recurring sweep
 * marks sensors dead once they have been silent for longer than the dead timeout. Every
 * write to the state cache goes through the sensor's lane in {@link KeyedMutationQueue},
 * so a heartbeat and a mark-dead for the same sensor are applied one after the other,
 * never interleaved. Each applied change is handed to the {@link NotificationDispatcher}.
 * </p>
 * <p>
 * Per sensor: {@code UNKNOWN -> ALIVE -> DEAD -> ALIVE ...}. Only the sweep turns an
 * active sensor dead because of silence; a departing heartbeat does it explicitly.
 * </p>
 */
public class LivenessManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LivenessManager.class);

    static final String OP_INGEST = "ingest";
    static final String OP_SWEEP = "sweep";

    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private final TrackerConfig config;
    private final IStateCache cache;
    private final ISensorInfoRepository repository;
    private final IHeartbeatSource source;
    private final NotificationDispatcher dispatcher;
    private final KeyedMutationQueue queue;
    private final MetricsService metrics;
    private final Clock clock;

    private volatile Disposable ingestion;
    private volatile Disposable sweeper;

    public LivenessManager(
        TrackerConfig config,
        IStateCache cache,
        ISensorInfoRepository repository,
        IHeartbeatSource source,
        NotificationDispatcher dispatcher,
        KeyedMutationQueue queue,
        MetricsService metrics,
        Clock clock
    ) {
        this.config = config;
        this.cache = cache;
        this.repository = repository;
        this.source = source;
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Subscribes to the heartbeat channel and starts the recurring sweep. Either part that is
     * already running is left as it is.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.warn("Heartbeat ingestion already started");
        } else {
            ingestion = source.heartbeats()
                .flatMap(this::ingest)
                .subscribe(
                    state -> log.debug("Heartbeat applied for {}", state.getId()),
                    err -> log.error("Heartbeat ingestion stopped", err),
                    () -> log.info("Heartbeat channel completed")
                );
        }

        Duration interval = config.getSweepInterval();
        if (isSweeping()) {
            log.warn("Sweep already started");
        } else {
            sweeper = Flux.interval(interval, interval)
                .onBackpressureDrop(tick -> log.warn("Previous sweep still running, skipping tick {}", tick))
                .concatMap(tick -> runSweepCycle(), 1)
                .subscribe(
                    dead -> { },
                    err -> log.error("Sweep stopped", err)
                );
        }

        log.info("Liveness manager started: dead timeout = {} ms, sweep interval = {} ms",
            config.getDeadTimeout().toMillis(), interval.toMillis());
    }

    /**
     * Validates a raw heartbeat and applies it on the sensor's lane.
     * <p>
     * The mutation is enqueued before this method returns, so its order relative to later
     * mutations of the same sensor is fixed even if the result is never subscribed.
     * </p>
     *
     * @param raw payload as received from the channel
     * @return the stored state, or empty when the heartbeat was rejected or could not be stored
     */
    public Mono<SensorState> ingest(String raw) {
        metrics.recordHeartbeatReceived(BytesUtils.utf8Length(raw));

        HeartbeatParseResult parsed = HeartbeatParser.parse(raw);
        if (!parsed.isAccepted()) {
            RejectReason reason = parsed.getRejectReason();
            if (reason == RejectReason.UNPARSEABLE) {
                log.error("Dropping unparseable heartbeat: {}", parsed.getReason());
            } else {
                log.warn("Dropping heartbeat ({}): {}", reason.tag(), parsed.getReason());
            }
            metrics.recordHeartbeatRejected(reason);
            return Mono.empty();
        }

        Heartbeat heartbeat = parsed.getHeartbeat();
        Instant acceptedAt = clock.instant();

        return queue.submit(heartbeat.getId(), () -> applyHeartbeat(heartbeat, acceptedAt)
            .doOnNext(this::publish)
            .onErrorResume(StateCacheUnavailableException.class, err -> {
                log.error("Heartbeat for {} not stored: {}", heartbeat.getId(), err.getMessage());
                metrics.recordCacheFailure(OP_INGEST);
                return Mono.empty();
            }));
    }

    private Mono<SensorState> applyHeartbeat(Heartbeat heartbeat, Instant acceptedAt) {
        return resolveInfo(heartbeat.getId(), heartbeat.toSensorInfo())
            .map(info -> SensorState.builder()
                .id(heartbeat.getId())
                .metadata(info)
                .active(!heartbeat.isDeparting())
                .lastUpdate(acceptedAt)
                .config(heartbeat.getConfig())
                .build())
            .flatMap(cache::upsertMerge)
            .doOnNext(state -> {
                if (heartbeat.isDeparting()) {
                    log.info("Sensor {} departed", state.getId());
                }
            });
    }

    /**
     * Marks every active sensor that has been silent for longer than {@code deadTimeout} as dead.
     *
     * @param now         reference instant
     * @param deadTimeout silence allowed before a sensor is considered dead
     * @return the states that were marked dead in this cycle
     */
    public Flux<SensorState> sweep(Instant now, Duration deadTimeout) {
        return cache.getAll()
            .filter(state -> state.getId() != null && state.isActive() && state.isExpired(now, deadTimeout))
            .map(SensorState::getId)
            .collectList()
            .onErrorResume(StateCacheUnavailableException.class, err -> {
                log.error("Sweep abandoned, snapshot unavailable: {}", err.getMessage());
                metrics.recordCacheFailure(OP_SWEEP);
                return Mono.empty();
            })
            .flatMapMany(expired -> {
                if (!expired.isEmpty()) {
                    log.debug("Sweep found {} expired sensor(s)", expired.size());
                }
                // Enqueue all mark-dead mutations before waiting on any of them
                List<Mono<SensorState>> marks = new ArrayList<>(expired.size());
                for (String sensorId : expired) {
                    marks.add(markDead(sensorId, now, deadTimeout));
                }
                return Flux.mergeSequential(marks);
            });
    }

    private Mono<SensorState> markDead(String sensorId, Instant now, Duration deadTimeout) {
        return queue.submit(sensorId, () -> cache.getOne(sensorId)
            // A heartbeat applied since the snapshot keeps the sensor alive
            .filter(current -> current.isActive() && current.isExpired(now, deadTimeout))
            .flatMap(current -> resolveInfo(sensorId, current.getMetadata())
                .flatMap(info -> cache.upsertMerge(current.toBuilder()
                    .metadata(info)
                    .active(false)
                    .build())))
            .doOnNext(dead -> {
                log.info("Sensor {} marked dead, last update {}", sensorId, dead.getLastUpdate());
                metrics.recordSensorDead();
                publish(dead);
            })
            .onErrorResume(err -> {
                log.error("Sensor {} not marked dead this cycle: {}", sensorId, err.getMessage());
                if (err instanceof StateCacheUnavailableException) {
                    metrics.recordCacheFailure(OP_SWEEP);
                }
                return Mono.empty();
            }));
    }

    private Mono<Void> runSweepCycle() {
        long start = System.nanoTime();
        return Mono.defer(() -> sweep(clock.instant(), config.getDeadTimeout()).then())
            .doFinally(signal -> metrics.recordSweep(start))
            .onErrorResume(err -> {
                log.error("Sweep cycle failed", err);
                return Mono.empty();
            });
    }

    /**
     * Best-effort metadata: the repository entry, or {@code fallback} when the repository has
     * none or fails.
     */
    private Mono<SensorInfo> resolveInfo(String sensorId, SensorInfo fallback) {
        return repository.lookup(sensorId)
            .onErrorResume(err -> {
                if (err instanceof SensorNotFoundException) {
                    log.debug("No metadata for sensor {}, using fallback", sensorId);
                } else {
                    log.warn("Metadata lookup failed for sensor {}: {}", sensorId, err.getMessage());
                }
                return Mono.justOrEmpty(fallback);
            })
            .defaultIfEmpty(fallback != null ? fallback : SensorInfo.builder().build());
    }

    private void publish(SensorState state) {
        dispatcher.dispatch(state);
    }

    public boolean isRunning() {
        Disposable current = ingestion;
        return current != null && !current.isDisposed();
    }

    public boolean isSweeping() {
        Disposable current = sweeper;
        return current != null && !current.isDisposed();
    }

    public synchronized void stopIngestion() {
        if (ingestion != null) {
            ingestion.dispose();
            log.info("Heartbeat ingestion stopped");
        }
    }

    public synchronized void stopSweep() {
        if (sweeper != null) {
            sweeper.dispose();
            log.info("Sweep stopped");
        }
    }

    /**
     * Stops ingestion and the sweep, waits for the mutations already queued, then closes
     * notification delivery so those mutations are still announced.
     */
    @Override
    public void close() {
        stopIngestion();
        stopSweep();
        queue.close();
        queue.whenDrained()
            .timeout(DRAIN_TIMEOUT)
            .onErrorResume(TimeoutException.class, err -> {
                log.warn("Mutation lanes not drained after {} ms, closing notifications anyway",
                    DRAIN_TIMEOUT.toMillis());
                return Mono.empty();
            })
            .block();
        dispatcher.close();
    }
}
