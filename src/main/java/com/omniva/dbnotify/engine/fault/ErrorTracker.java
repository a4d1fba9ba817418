package com.omniva.dbnotify.engine.fault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks error history of the listener for monitoring.
 * Thread-safe: written from poll, reconnect and handler threads.
 * Never holds more than {@code maxRecentErrors} entries.
 */
public class ErrorTracker {

    private static final Logger log = LoggerFactory.getLogger(ErrorTracker.class);
    private static final int DEFAULT_MAX_RECENT_ERRORS = 100;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final List<String> recentErrors = new CopyOnWriteArrayList<>();
    private final int maxRecentErrors;

    public ErrorTracker() {
        this(DEFAULT_MAX_RECENT_ERRORS);
    }

    public ErrorTracker(int maxRecentErrors) {
        if (maxRecentErrors <= 0) {
            throw new IllegalArgumentException("maxRecentErrors must be positive");
        }
        this.maxRecentErrors = maxRecentErrors;
    }

    /**
     * Add an error with timestamp
     */
    public void addError(String errorMessage) {
        addError(errorMessage, null);
    }

    /**
     * Add an error with exception details
     */
    public void addError(String errorMessage, Throwable throwable) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        String formattedError;

        if (throwable != null) {
            formattedError = String.format("[%s] %s - %s: %s",
                    timestamp, errorMessage, throwable.getClass().getSimpleName(), throwable.getMessage());
        } else {
            formattedError = String.format("[%s] %s", timestamp, errorMessage);
        }

        // readers take lock-free snapshots; writers append and evict as one step
        synchronized (recentErrors) {
            recentErrors.add(formattedError);
            while (recentErrors.size() > maxRecentErrors) {
                recentErrors.remove(0);
            }
        }
    }

    // ========================================
    // MONITORING AND UTILITY METHODS
    // ========================================

    /**
     * Get all recent errors, oldest first
     */
    public List<String> getRecentErrors() {
        return new ArrayList<>(recentErrors);
    }

    /**
     * Get the newest {@code limit} errors, oldest first
     */
    public List<String> getRecentErrors(int limit) {
        List<String> allErrors = getRecentErrors();
        int size = allErrors.size();
        int fromIndex = Math.max(0, size - limit);
        return allErrors.subList(fromIndex, size);
    }

    public int getRecentErrorCount() {
        return recentErrors.size();
    }

    /**
     * Get the most recent error, or null
     */
    public String getLastError() {
        List<String> snapshot = getRecentErrors();
        return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
    }

    public boolean hasRecentErrors() {
        return !recentErrors.isEmpty();
    }

    public void clearRecentErrors() {
        synchronized (recentErrors) {
            recentErrors.clear();
        }
        log.info("Recent listener errors cleared");
    }
}
