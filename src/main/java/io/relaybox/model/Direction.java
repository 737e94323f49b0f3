package io.relaybox.model;

public enum Direction {
    DEVICE_TO_PEER,
    PEER_TO_DEVICE;

    public static Direction from(EndpointRole sender) {
        return sender == EndpointRole.DEVICE ? DEVICE_TO_PEER : PEER_TO_DEVICE;
    }

    public EndpointRole receiver() {
        return this == DEVICE_TO_PEER ? EndpointRole.PEER : EndpointRole.DEVICE;
    }
}
