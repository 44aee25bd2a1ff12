package io.chunkmesh.model;

public enum FrameKind {
    DATA((byte) 0x01),
    ACK((byte) 0x02);

    private final byte code;

    FrameKind(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static FrameKind fromCode(byte code) {
        for (FrameKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown frame kind: " + (code & 0xFF));
    }
}
