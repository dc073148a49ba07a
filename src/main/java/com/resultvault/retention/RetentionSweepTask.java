package com.resultvault.retention;

import com.resultvault.catalog.ResultCatalog;
import com.resultvault.storage.ResultStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scheduled caller of {@link ResultStorage#enforceRetention(String)} for every user in the catalog.
 * Only loads when app.retention.sweep.enabled=true.
 */
@Service
@ConditionalOnProperty(prefix = "app.retention.sweep", name = "enabled", havingValue = "true")
public class RetentionSweepTask {

    private static final Logger logger = LoggerFactory.getLogger(RetentionSweepTask.class);

    private final ResultCatalog catalog;
    private final ResultStorage resultStorage;

    public RetentionSweepTask(ResultCatalog catalog, ResultStorage resultStorage) {
        this.catalog = catalog;
        this.resultStorage = resultStorage;
        logger.info("RetentionSweepTask initialized");
    }

    /**
     * Runs every hour by default. A failure for one user is logged and the sweep moves on.
     *
     * @return number of results evicted across all users
     */
    @Scheduled(fixedDelayString = "${app.retention.sweep.interval-ms:3600000}")
    public int sweep() {
        List<String> userIds = catalog.listUserIds();
        int evicted = 0;
        int failedUsers = 0;
        for (String userId : userIds) {
            try {
                evicted += resultStorage.enforceRetention(userId).getDeleted();
            } catch (RuntimeException e) {
                failedUsers++;
                logger.error("Retention sweep failed for user {}", userId, e);
            }
        }
        logger.info("Retention sweep completed: users={}, evicted={}, failedUsers={}",
                userIds.size(), evicted, failedUsers);
        return evicted;
    }
}
