package io.relaybox.relay;

import io.relaybox.model.ErrorKind;

import java.io.IOException;

/**
 * One attached endpoint of an allocation.
 */
public interface FrameSink {
    void sendData(byte[] payload) throws IOException;

    void close(ErrorKind reason);
}
