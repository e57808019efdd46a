package io.trashlite.storage.lock;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Contents of the lock file: who holds the state directory and since when.
 *
 * @param pid                owner process id
 * @param mode               top-level operation the owner is running (cleanup, restore, ...)
 * @param hostname           owner host, informational only
 * @param startedAt          epoch millis the lock was taken
 * @param recoveredFromStale true when this lock replaced one whose owner was dead
 * @param recoveredAt        epoch millis of that recovery, when recovered
 * @param staleLockPid       pid named by the replaced lock, when recovered
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LockInfo(
        Long pid,
        String mode,
        String hostname,
        Long startedAt,
        Boolean recoveredFromStale,
        Long recoveredAt,
        Long staleLockPid
) {
    public String describe() {
        String since = startedAt == null ? "unknown time" : Instant.ofEpochMilli(startedAt).toString();
        return String.format("pid %s, mode %s, host %s, since %s",
                pid == null ? "?" : pid,
                mode == null ? "unknown" : mode,
                hostname == null ? "unknown" : hostname,
                since);
    }
}
