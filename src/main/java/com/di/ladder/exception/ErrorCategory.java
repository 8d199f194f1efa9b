package com.di.ladder.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories used to classify failures in rebalancing summaries and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    BOUNDARY_VIOLATION("Boundary tier violation", "Promotion from the top tier or demotion from the bottom tier"),
    CONTENTION("Assignment contention", "Tier lock not acquired or admission transaction aborted"),
    NOT_FOUND("Entity not found", "Referenced entity does not exist"),
    STORAGE_TRANSIENT("Transient storage error", "Lock timeout, deadlock or serialization failure in the store"),
    STORAGE_ERROR("Storage error", "General storage operation error"),
    VALIDATION_ERROR("Validation error", "Invalid argument or state"),
    UNKNOWN("Unknown error", "Unclassified error");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof BoundaryTierViolationException, BOUNDARY_VIOLATION);
        MATCHERS.put(t -> t instanceof AssignmentContentionException, CONTENTION);
        MATCHERS.put(t -> t instanceof EntityNotFoundException, NOT_FOUND);
        MATCHERS.put(ErrorCategory::isTransientStorageError, STORAGE_TRANSIENT);
        MATCHERS.put(t -> t instanceof DataAccessException || t instanceof SQLException, STORAGE_ERROR);
        MATCHERS.put(t -> t instanceof IllegalArgumentException || t instanceof IllegalStateException, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static boolean isTransientStorageError(Throwable t) {
        if (t instanceof TransientDataAccessException
                || t instanceof PessimisticLockingFailureException
                || t instanceof QueryTimeoutException) {
            return true;
        }
        if (t instanceof SQLException) {
            String state = ((SQLException) t).getSQLState();
            // 40xxx: transaction rollback (deadlock, serialization); 55P03: lock_not_available
            return state != null && (state.startsWith("40") || state.equals("55P03"));
        }
        return false;
    }
}
