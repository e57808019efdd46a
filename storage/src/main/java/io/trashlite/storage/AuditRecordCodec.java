package io.trashlite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trashlite.core.AuditAction;
import io.trashlite.core.AuditRecord;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON framing for audit records, one compact object per line.
 * <p>
 * Layout (keys in write order):
 *   action, time, scope, batchId, sourcePath, recyclePath, restoredPath, status,
 *   error, errorType, invalid_reason, risk, sizeBytes, dryRun, then every metadata
 *   entry under its own key.
 * <p>
 * Writing:
 *  - null core fields are omitted, except recyclePath on cleanup records, which is
 *    always present (JSON null when nothing was moved);
 *  - metadata keys that collide with a core key are dropped.
 * <p>
 * Reading is schema-tolerant:
 *  - unknown keys land in metadata, missing keys default to null / 0 / false;
 *  - numbers given as strings are accepted;
 *  - anything that is not exactly one JSON object yields null (caller skips the line).
 */
final class AuditRecordCodec {
    static final String ACTION = "action";
    static final String TIME = "time";
    static final String SCOPE = "scope";
    static final String BATCH_ID = "batchId";
    static final String SOURCE_PATH = "sourcePath";
    static final String RECYCLE_PATH = "recyclePath";
    static final String RESTORED_PATH = "restoredPath";
    static final String STATUS = "status";
    static final String ERROR = "error";
    static final String ERROR_TYPE = "errorType";
    static final String INVALID_REASON = "invalid_reason";
    static final String RISK = "risk";
    static final String SIZE_BYTES = "sizeBytes";
    static final String DRY_RUN = "dryRun";

    private static final Set<String> CORE_KEYS = Set.of(
            ACTION, TIME, SCOPE, BATCH_ID, SOURCE_PATH, RECYCLE_PATH, RESTORED_PATH, STATUS,
            ERROR, ERROR_TYPE, INVALID_REASON, RISK, SIZE_BYTES, DRY_RUN);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private AuditRecordCodec() {
        // utility
    }

    /** Encode a record as a single line of JSON (no trailing newline). */
    static String encode(AuditRecord rec) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put(ACTION, rec.action().wire());
        n.put(TIME, rec.time());
        putIfPresent(n, SCOPE, rec.scope());
        putIfPresent(n, BATCH_ID, rec.batchId());
        putIfPresent(n, SOURCE_PATH, rec.sourcePath());
        if (rec.recyclePath() != null || rec.action() == AuditAction.CLEANUP) {
            n.put(RECYCLE_PATH, rec.recyclePath());
        }
        putIfPresent(n, RESTORED_PATH, rec.restoredPath());
        putIfPresent(n, STATUS, rec.status());
        putIfPresent(n, ERROR, rec.error());
        putIfPresent(n, ERROR_TYPE, rec.errorType());
        putIfPresent(n, INVALID_REASON, rec.invalidReason());
        putIfPresent(n, RISK, rec.risk());
        n.put(SIZE_BYTES, rec.sizeBytes());
        n.put(DRY_RUN, rec.dryRun());

        for (Map.Entry<String, Object> e : rec.metadata().entrySet()) {
            if (CORE_KEYS.contains(e.getKey())) continue;
            n.set(e.getKey(), MAPPER.valueToTree(e.getValue()));
        }
        try {
            return MAPPER.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit record is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /** Decode one line; null when it is not a single JSON object. */
    static AuditRecord decode(String line) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null || !root.isObject()) return null;

        AuditRecord.Builder b = AuditRecord.builder(AuditAction.fromWire(text(root, ACTION)))
                .time(root.path(TIME).asLong(0L))
                .scope(text(root, SCOPE))
                .batchId(text(root, BATCH_ID))
                .sourcePath(text(root, SOURCE_PATH))
                .recyclePath(text(root, RECYCLE_PATH))
                .restoredPath(text(root, RESTORED_PATH))
                .status(text(root, STATUS))
                .error(text(root, ERROR))
                .errorType(text(root, ERROR_TYPE))
                .invalidReason(text(root, INVALID_REASON))
                .risk(text(root, RISK))
                .sizeBytes(Math.max(0L, root.path(SIZE_BYTES).asLong(0L)))
                .dryRun(root.path(DRY_RUN).asBoolean(false));

        ObjectNode rest = MAPPER.createObjectNode();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!CORE_KEYS.contains(e.getKey())) rest.set(e.getKey(), e.getValue());
        }
        if (!rest.isEmpty()) {
            b.metadata(MAPPER.convertValue(rest, MAP_TYPE));
        }
        return b.build();
    }

    private static void putIfPresent(ObjectNode n, String key, String value) {
        if (value != null) n.put(key, value);
    }

    private static String text(JsonNode root, String key) {
        JsonNode v = root.get(key);
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isTextual()) return v.textValue();
        return v.isValueNode() ? v.asText() : v.toString();
    }
}
