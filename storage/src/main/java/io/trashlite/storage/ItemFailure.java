package io.trashlite.storage;

import io.trashlite.core.ErrorKind;

/**
 * One failed item in a cleanup or restore run.
 *
 * @param path    the path the operation was acting on (source for cleanup, original
 *                location for restore)
 * @param message free-text error as written to the log
 * @param kind    classified kind
 */
public record ItemFailure(String path, String message, ErrorKind kind) {
}
