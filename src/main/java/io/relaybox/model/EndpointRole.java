package io.relaybox.model;

public enum EndpointRole {
    DEVICE(0),
    PEER(1);

    private final int wireCode;

    EndpointRole(int wireCode) {
        this.wireCode = wireCode;
    }

    public int wireCode() {
        return wireCode;
    }

    public static EndpointRole fromWire(int code) {
        for (EndpointRole value : values()) {
            if (value.wireCode == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown endpoint role: " + code);
    }
}
