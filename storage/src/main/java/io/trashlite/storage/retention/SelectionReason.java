package io.trashlite.storage.retention;

public enum SelectionReason {
    AGE("age"),
    SIZE("size");

    private final String wire;

    SelectionReason(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
