package com.resultvault.config;

import com.resultvault.storage.blob.BlobStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Ready when the catalog database accepts connections. Reports the active blob backend.
 */
@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;
    private final BlobStore blobStore;

    public ReadinessHealthIndicator(DataSource dataSource, BlobStore blobStore) {
        this.dataSource = dataSource;
        this.blobStore = blobStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("backend", blobStore.backend().mode());

        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(5)) {
                details.put("catalog", "UP");
                return Health.up().withDetails(details).build();
            }
            details.put("catalog", "DOWN");
            return Health.down().withDetails(details).build();
        } catch (SQLException e) {
            details.put("catalog", "DOWN");
            details.put("error", e.getMessage());
            return Health.down().withDetails(details).build();
        }
    }
}
