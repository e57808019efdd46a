package io.trashlite.storage;

/**
 * Raised when the audit log cannot be written. Losing the log means losing the only
 * record of what was moved where, so callers treat this as fatal to the run.
 */
public class AuditLogException extends RuntimeException {
    public AuditLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
