package com.biocbot.content.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.function.Supplier;

/**
 * Maps data-access failures, query timeouts included, onto {@link StoreUnavailableException}.
 * Integrity violations are not outages and propagate unchanged.
 */
public final class StoreFailures {
    private StoreFailures() {
    }

    public static <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataIntegrityViolationException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(operation + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public static void run(String operation, Runnable call) {
        guard(operation, () -> {
            call.run();
            return null;
        });
    }
}
