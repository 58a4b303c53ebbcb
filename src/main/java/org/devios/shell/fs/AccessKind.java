package org.devios.shell.fs;

/**
 * 访问类型，offset 为该位在三元组内的固定偏移。
 */
public enum AccessKind {
    READ(0),
    WRITE(1),
    EXECUTE(2);

    private final int offset;

    AccessKind(int offset) {
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
