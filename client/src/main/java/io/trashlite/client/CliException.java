package io.trashlite.client;

/**
 * Usage, configuration or lock problem the user can fix; printed without a stack trace.
 */
public final class CliException extends RuntimeException {
    public CliException(String msg) {
        super(msg);
    }

    public CliException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
