package io.relaybox.relay;

public enum FrameType {
    HELLO(1),
    ACCEPT(2),
    REJECT(3),
    DATA(4),
    ERROR(5),
    CLOSE(6);

    private final int code;

    FrameType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static FrameType fromCode(int code) {
        for (FrameType value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown frame type: " + code);
    }
}
