// file: src/main/java/io/trashlite/core/AuditAction.java
package io.trashlite.core;

/**
 * Kind of mutation an {@link AuditRecord} describes.
 * <p>
 * Wire names are the lower-case values written to the audit log:
 *  - CLEANUP:          a target was (or would have been) moved into the recycle bin.
 *  - RESTORE:          a recycled item was (or would have been) moved back.
 *  - RECYCLE_MAINTAIN: one retention run over the whole recycle bin.
 *  - UNKNOWN:          any action name this version does not understand. Such records
 *                      are kept when reading but never take part in reconstruction.
 */
public enum AuditAction {
    CLEANUP("cleanup"),
    RESTORE("restore"),
    RECYCLE_MAINTAIN("recycle_maintain"),
    UNKNOWN("unknown");

    private final String wire;

    AuditAction(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static AuditAction fromWire(String value) {
        if (value == null) return UNKNOWN;
        for (AuditAction a : values()) {
            if (a.wire.equals(value)) return a;
        }
        return UNKNOWN;
    }
}
