// file: src/main/java/io/trashlite/storage/JsonlAuditLog.java
package io.trashlite.storage;

import io.trashlite.core.AuditRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed audit log holding one JSON object per line (JSONL).
 * <p>
 * Properties:
 *  - append():
 *      - creates parent directories on first use,
 *      - encodes the record plus '\n' into one buffer and writes it with a single
 *        channel write (looping only if the OS reports a short write),
 *      - calls force(false) so the line is on disk when append() returns.
 * <p>
 *  - readAll():
 *      - decodes the file as UTF-8 (malformed bytes become U+FFFD, never an error),
 *      - hands each non-blank line to {@link AuditRecordCodec#decode(String)},
 *      - skips lines the codec rejects (torn tail, garbage, non-object JSON).
 * <p>
 * There is no offset index: every reader scans the whole file.
 */
public final class JsonlAuditLog implements AuditLog {
    private static final Logger log = Logger.getLogger(JsonlAuditLog.class.getName());

    private final Path file;

    public JsonlAuditLog(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    }

    @Override
    public void append(AuditRecord record) {
        Objects.requireNonNull(record, "record");
        byte[] line = (AuditRecordCodec.encode(record) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            try (FileChannel ch = FileChannel.open(file, CREATE, WRITE, APPEND)) {
                ByteBuffer buf = ByteBuffer.wrap(line);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(false);
            }
        } catch (IOException e) {
            throw new AuditLogException("Audit log append failed: " + file, e);
        }
    }

    @Override
    public List<AuditRecord> readAll() {
        List<AuditRecord> out = new ArrayList<>();
        if (!Files.exists(file)) return out;

        int lineNo = 0;
        try (BufferedReader r = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file, READ), StandardCharsets.UTF_8))) {
            for (String line; (line = r.readLine()) != null; ) {
                lineNo++;
                if (line.isBlank()) continue;
                AuditRecord rec = AuditRecordCodec.decode(line);
                if (rec == null) {
                    log.log(Level.FINE, "Skipping unparsable audit line {0} in {1}", new Object[]{lineNo, file});
                    continue;
                }
                out.add(rec);
            }
        } catch (NoSuchFileException e) {
            return out;
        } catch (IOException e) {
            log.log(Level.WARNING, "Audit log read stopped at line " + lineNo + " of " + file, e);
        }
        return out;
    }

    @Override
    public Path path() {
        return file;
    }
}
