package lkml.watch.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Cross-node mutual exclusion backed by a lock table.
 * Used to keep one monitoring run per subsystem and one card creation per message id at a time.
 */
@Slf4j
@Service
public class ProcessingLockService {
    private static final String LOCK_TABLE = "processing_locks";

    private final JdbcTemplate jdbcTemplate;
    private final int lockTimeoutMinutes;

    public ProcessingLockService(JdbcTemplate jdbcTemplate,
                                 @Value("${lkml.lock.timeout-minutes:10}") int lockTimeoutMinutes) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMinutes = lockTimeoutMinutes;
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "lock_key VARCHAR(600) PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Lock table initialized");
        } catch (Exception e) {
            log.warn("Could not initialize lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * Attempts to acquire a lock.
     * @param lockKey what to lock, e.g. {@code subsystem:netdev} or {@code card:<message-id>}
     * @param nodeId identifier of this node
     * @return true if the lock was acquired
     */
    public boolean tryLock(String lockKey, String nodeId) {
        try {
            Instant now = Instant.now();
            Instant expiresAt = now.plusSeconds(TimeUnit.MINUTES.toSeconds(lockTimeoutMinutes));

            if (insertLock(lockKey, nodeId, now, expiresAt)) {
                log.debug("Acquired lock {}", lockKey);
                return true;
            }

            // Held by someone: take it over only if it has expired
            int removed = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE lock_key = ? AND expires_at < ?",
                lockKey, Timestamp.from(now)
            );
            if (removed > 0 && insertLock(lockKey, nodeId, now, expiresAt)) {
                log.debug("Acquired lock {} after removing expired lock", lockKey);
                return true;
            }

            log.debug("Could not acquire lock {} (held by another worker)", lockKey);
            return false;
        } catch (Exception e) {
            log.error("Error acquiring lock {}: {}", lockKey, e.getMessage(), e);
            return false;
        }
    }

    private boolean insertLock(String lockKey, String nodeId, Instant now, Instant expiresAt) {
        try {
            int rows = jdbcTemplate.update(
                "INSERT INTO " + LOCK_TABLE + " (lock_key, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                lockKey, nodeId, Timestamp.from(now), Timestamp.from(expiresAt)
            );
            return rows > 0;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    public void releaseLock(String lockKey, String nodeId) {
        try {
            int rows = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE lock_key = ? AND locked_by = ?",
                lockKey, nodeId
            );
            if (rows > 0) {
                log.debug("Released lock {}", lockKey);
            } else {
                log.warn("Attempted to release lock {} but it was not found or is owned by another node", lockKey);
            }
        } catch (Exception e) {
            log.error("Error releasing lock {}: {}", lockKey, e.getMessage(), e);
        }
    }

    /**
     * Node id for this instance: NODE_ID, then HOSTNAME, then user and VM name.
     */
    public String getNodeId() {
        String nodeId = System.getenv("NODE_ID");
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getenv("HOSTNAME");
        }
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getProperty("user.name") + "-" + System.getProperty("java.vm.name");
        }
        return nodeId;
    }
}
