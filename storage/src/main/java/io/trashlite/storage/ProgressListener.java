package io.trashlite.storage;

/**
 * Synchronous progress hook, called before each item is processed.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (current, total) -> { };

    /**
     * @param current 1-based index of the item about to be processed
     * @param total   number of items in the run
     */
    void onProgress(int current, int total);
}
