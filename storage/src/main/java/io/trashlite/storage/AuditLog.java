package io.trashlite.storage;

import io.trashlite.core.AuditRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Append-only audit log: the single durable source of recycle-bin state.
 * <p>
 * Contract:
 *  - append() writes exactly one record as one line in a single write and forces it to
 *    disk before returning. A crash can leave at most one torn trailing line.
 *  - readAll() never fails on corrupt content: unparsable lines are skipped and the
 *    records around them are returned in file order.
 *  - Records are never rewritten or removed.
 */
public interface AuditLog {

    /**
     * Append a single record and fsync it.
     *
     * @throws AuditLogException when the line cannot be written
     */
    void append(AuditRecord record);

    /** Every parsable record, in file order. A missing log reads as empty. */
    List<AuditRecord> readAll();

    /** Location of the log file. */
    Path path();
}
