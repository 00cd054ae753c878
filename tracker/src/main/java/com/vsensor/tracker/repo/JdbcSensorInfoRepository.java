package com.vsensor.tracker.repo;

import com.vsensor.core.error.SensorNotFoundException;
import com.vsensor.core.model.SensorInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Sensor metadata held in a relational table, SQLite by default.
 * <p>
 * JDBC is blocking, so lookups run on {@link Schedulers#boundedElastic()}. The single
 * connection and its prepared statement are shared under a lock.
 * </p>
 */
public class JdbcSensorInfoRepository implements ISensorInfoRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcSensorInfoRepository.class);

    private static final String SCHEMA_RESOURCE = "sql/sensors.sql";
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String SELECT_SENSOR =
        "SELECT name, cluster, description FROM sensors WHERE id = ?";

    private final Connection connection;
    private final PreparedStatement selectSensor;

    public JdbcSensorInfoRepository(String jdbcUrl) {
        try {
            ensureParentDirectory(jdbcUrl);
            this.connection = DriverManager.getConnection(jdbcUrl);
            applySchema();
            this.selectSensor = connection.prepareStatement(SELECT_SENSOR);
            log.info("Sensor metadata repository opened: {}", jdbcUrl);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to open sensor metadata repository " + jdbcUrl, e);
        }
    }

    @Override
    public Mono<SensorInfo> lookup(String sensorId) {
        return Mono.fromCallable(() -> query(sensorId))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(info -> info == null
                ? Mono.<SensorInfo>error(new SensorNotFoundException(sensorId))
                : Mono.just(info));
    }

    private SensorInfo query(String sensorId) throws SQLException {
        synchronized (selectSensor) {
            selectSensor.setString(1, sensorId);
            try (ResultSet rs = selectSensor.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return SensorInfo.builder()
                    .name(rs.getString("name"))
                    .cluster(rs.getString("cluster"))
                    .description(rs.getString("description"))
                    .build();
            }
        }
    }

    // SQLite creates the file but not its directory
    private static void ensureParentDirectory(String jdbcUrl) {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX) || jdbcUrl.contains(":memory:")) {
            return;
        }
        Path parent = Paths.get(jdbcUrl.substring(SQLITE_PREFIX.length())).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create directory " + parent, e);
        }
    }

    private void applySchema() throws SQLException {
        String ddl;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + SCHEMA_RESOURCE, e);
        }

        try (Statement statement = connection.createStatement()) {
            for (String sql : ddl.split(";")) {
                if (!sql.isBlank()) {
                    statement.execute(sql.trim());
                }
            }
        }
    }

    @Override
    public void close() {
        try {
            selectSensor.close();
            connection.close();
            log.info("Sensor metadata repository closed");
        } catch (SQLException e) {
            log.warn("Failed to close sensor metadata repository: {}", e.getMessage());
        }
    }
}
