package com.strategyvault.util;

import lombok.extern.slf4j.Slf4j;

/**
 * Thread-bound caller identity, populated from the X-User-Id header.
 *
 * Uses InheritableThreadLocal so async tasks started inside a request keep the caller.
 * Executors that reuse threads must propagate it explicitly (see AsyncPersistenceConfig).
 */
@Slf4j
public final class CurrentUserContext {

    private static final InheritableThreadLocal<String> USER_ID = new InheritableThreadLocal<>();

    private CurrentUserContext() {}

    /**
     * Set user ID in the current thread context.
     *
     * @param userId User ID to set (will be trimmed if not null)
     */
    public static void setUserId(String userId) {
        if (userId != null && !userId.isBlank()) {
            String trimmed = userId.trim();
            USER_ID.set(trimmed);
            log.debug("User context SET: userId={}, thread={}", trimmed, Thread.currentThread().getName());
        } else {
            log.warn("Attempted to set null/blank userId in thread={}", Thread.currentThread().getName());
        }
    }

    /**
     * @return User ID or null if not set
     */
    public static String getUserId() {
        return USER_ID.get();
    }

    /**
     * Get required user ID, throwing exception if not present.
     *
     * @return User ID (never null or blank)
     * @throws IllegalStateException if user context is missing
     */
    public static String getRequiredUserId() {
        String id = USER_ID.get();
        if (id == null || id.isBlank()) {
            log.error("User context missing! thread={}", Thread.currentThread().getName());
            throw new IllegalStateException("User context is missing. Provide X-User-Id header.");
        }
        return id;
    }

    /**
     * Clear user context from current thread.
     * Always call this in a finally block after request processing.
     */
    public static void clear() {
        String previousId = USER_ID.get();
        USER_ID.remove();
        if (previousId != null) {
            log.debug("User context CLEARED: previousUserId={}, thread={}",
                    previousId, Thread.currentThread().getName());
        }
    }

    public static boolean isContextSet() {
        String id = USER_ID.get();
        return id != null && !id.isBlank();
    }

    /**
     * Execute a supplier with a specific user context and return the result.
     * The previous context is restored afterwards.
     */
    public static <T> T callWithUserContext(String userId, java.util.function.Supplier<T> supplier) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank for callWithUserContext");
        }
        String previousUserId = USER_ID.get();
        try {
            setUserId(userId);
            return supplier.get();
        } finally {
            if (previousUserId != null) {
                setUserId(previousUserId);
            } else {
                clear();
            }
        }
    }
}
