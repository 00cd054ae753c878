package com.vsensor.tracker;

import com.vsensor.core.msg.HeartbeatTransport;
import com.vsensor.tracker.config.TrackerConfig;
import com.vsensor.tracker.heartbeat.IHeartbeatSource;
import com.vsensor.tracker.heartbeat.KafkaHeartbeatSource;
import com.vsensor.tracker.heartbeat.RedisHeartbeatSource;
import com.vsensor.tracker.http.HttpServer;
import com.vsensor.tracker.liveness.KeyedMutationQueue;
import com.vsensor.tracker.liveness.LivenessManager;
import com.vsensor.tracker.liveness.NotificationDispatcher;
import com.vsensor.tracker.metrics.MetricsService;
import com.vsensor.tracker.metrics.PrometheusMetricsExporter;
import com.vsensor.tracker.notify.NotificationHub;
import com.vsensor.tracker.redis.IStateCache;
import com.vsensor.tracker.redis.RedisService;
import com.vsensor.tracker.redis.RedisStateCache;
import com.vsensor.tracker.repo.ISensorInfoRepository;
import com.vsensor.tracker.repo.JdbcSensorInfoRepository;
import com.vsensor.tracker.ws.WebSocketHandler;
import com.vsensor.tracker.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;

import java.time.Clock;

/**
 * Main entry point for a tracker node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Consume sensor heartbeats from Redis pub/sub or Kafka</li>
 *   <li>Keep the sensor state cache in Redis up to date</li>
 *   <li>Mark silent sensors dead on a recurring sweep</li>
 *   <li>Broadcast every state change to WebSocket observers at /ws</li>
 *   <li>Expose /healthz, /readyz, /metrics and /sensors endpoints</li>
 * </ul>
 * </p>
 */
public class TrackerApp {
    private static final Logger log = LoggerFactory.getLogger(TrackerApp.class);

    public static void main(String[] args) {
        TrackerConfig config = TrackerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting tracker node: {}", config.getNodeId());
        log.info("  {}", config.describe());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Sensor DB: {}", config.getSensorDbUrl());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RedisService redisService = new RedisService(config);
        IStateCache cache = new RedisStateCache(
            redisService.commands(), config.getStateCacheKey(), config.getRedisCommandTimeout()
        );
        ISensorInfoRepository repository = new JdbcSensorInfoRepository(config.getSensorDbUrl());
        IHeartbeatSource source = config.getHeartbeatTransport() == HeartbeatTransport.KAFKA
            ? new KafkaHeartbeatSource(config)
            : new RedisHeartbeatSource(redisService, config.getHeartbeatChannel());

        NotificationHub hub = new NotificationHub(metricsService, config.getNodeId());
        Scheduler notificationScheduler = Schedulers.newSingle("vsensor-notify");
        NotificationDispatcher dispatcher = new NotificationDispatcher(
            hub::broadcast, config.getNotificationBufferSize(), notificationScheduler, metricsService
        );
        KeyedMutationQueue queue = new KeyedMutationQueue(
            config.getMutationLanes(), metricsService.getRegistry(), config.getNodeId()
        );

        LivenessManager livenessManager = new LivenessManager(
            config, cache, repository, source, dispatcher, queue, metricsService, Clock.systemUTC()
        );

        WebSocketHandler wsHandler = new WebSocketHandler(config, cache, hub, metricsService);
        HttpServer httpServer = new HttpServer(
            config, cache, livenessManager, metricsExporter, new WebSocketUpgradeHandler(wsHandler)
        );
        DisposableServer server = httpServer.start();

        livenessManager.start();

        log.info("Tracker node {} is ready", config.getNodeId());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Stops ingestion and sweep, then lets queued mutations finish
            livenessManager.close();
            notificationScheduler.dispose();

            httpServer.stop();
            source.close();
            redisService.close();
            repository.close();

            log.info("Shutdown complete");
        }));

        server.onDispose().block();
    }
}
