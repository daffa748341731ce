package com.casework.core.exception;

/**
 * Thrown when a compare-and-swap update loses against a concurrent writer.
 * Callers reload the entity and retry; the engine never retries on its own.
 */
public class StaleVersionException extends CaseworkException {

    public static final String ERROR_CODE = "STALE_VERSION";

    public StaleVersionException(String entityType, Object entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Stale version on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }

    public StaleVersionException(String entityType, Object entityId) {
        super(ERROR_CODE, String.format(
            "%s[%s] was modified concurrently",
            entityType, entityId
        ));
    }
}
