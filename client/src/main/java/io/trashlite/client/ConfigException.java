package io.trashlite.client;

/** Configuration file unreadable, malformed, or holding an unusable value. */
public final class ConfigException extends RuntimeException {
    public ConfigException(String msg) {
        super(msg);
    }

    public ConfigException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
