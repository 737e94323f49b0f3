package io.relaybox.relay;

import io.relaybox.model.Direction;
import io.relaybox.model.EndpointRole;
import io.relaybox.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One client stream: a HELLO that resolves to an allocation, then DATA frames in the
 * sender's direction until either side goes away.
 */
final class RelayConnection implements Runnable, FrameSink {
    private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);

    private final Socket socket;
    private final String source;
    private final RelayAdmission admission;
    private final AllocationTable table;
    private final RelayForwarder forwarder;
    private final int maxFrameSize;
    private final int handshakeTimeoutMs;
    private final Consumer<RelayConnection> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object writeLock = new Object();
    private DataOutputStream out;

    RelayConnection(
            Socket socket,
            String source,
            RelayAdmission admission,
            AllocationTable table,
            RelayForwarder forwarder,
            int maxFrameSize,
            int handshakeTimeoutMs,
            Consumer<RelayConnection> onClose
    ) {
        this.socket = socket;
        this.source = source;
        this.admission = admission;
        this.table = table;
        this.forwarder = forwarder;
        this.maxFrameSize = maxFrameSize;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        Allocation allocation = null;
        EndpointRole role = null;
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(handshakeTimeoutMs);
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            synchronized (writeLock) {
                out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
            }
            RelayFrame first = RelayFrames.read(in, maxFrameSize);
            if (first == null) {
                return;
            }
            RelayFrame.Hello hello;
            try {
                hello = first.asHello();
            } catch (IllegalArgumentException e) {
                send(RelayFrame.reject(ErrorKind.MALFORMED_REQUEST));
                return;
            }
            AllocationOutcome outcome = table.createOrResume(hello.deviceId(), hello.token(), () -> admission.admitAllocation(source));
            if (!outcome.ok()) {
                send(RelayFrame.reject(outcome.error()));
                return;
            }
            allocation = outcome.allocation();
            role = hello.role();
            send(RelayFrame.accept(allocation, outcome.resumed()));
            table.attach(allocation, role, this);
            socket.setSoTimeout(0);
            pump(in, allocation, Direction.from(role));
        } catch (RelayFrames.FrameTooLargeException e) {
            log.debug("Relay connection {} sent an oversized frame: {}", socket.getRemoteSocketAddress(), e.getMessage());
            close(ErrorKind.MALFORMED_REQUEST);
        } catch (SocketTimeoutException e) {
            log.debug("Relay connection {} timed out during handshake", socket.getRemoteSocketAddress());
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Relay connection {} failed: {}", socket.getRemoteSocketAddress(), e.getMessage());
            }
        } finally {
            if (allocation != null) {
                table.endpointClosed(allocation, role, this);
            }
            closeQuietly();
            onClose.accept(this);
        }
    }

    private void pump(DataInputStream in, Allocation allocation, Direction direction) throws IOException {
        while (!closed.get()) {
            RelayFrame frame = RelayFrames.read(in, maxFrameSize);
            if (frame == null || frame.type() == FrameType.CLOSE) {
                return;
            }
            if (frame.type() != FrameType.DATA) {
                send(RelayFrame.error(ErrorKind.MALFORMED_REQUEST));
                continue;
            }
            ForwardOutcome outcome = forwarder.forward(allocation.id(), direction, frame.body());
            if (outcome.forwarded()) {
                continue;
            }
            send(RelayFrame.error(outcome.error()));
            if (allocation.status().terminal()) {
                table.release(allocation);
                return;
            }
        }
    }

    @Override
    public void sendData(byte[] payload) throws IOException {
        if (closed.get()) {
            throw new IOException("connection closed");
        }
        send(RelayFrame.data(payload));
    }

    @Override
    public void close(ErrorKind reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            send(RelayFrame.close(reason));
        } catch (IOException e) {
            log.debug("Could not deliver CLOSE to {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
        closeQuietly();
    }

    private void send(RelayFrame frame) throws IOException {
        synchronized (writeLock) {
            if (out == null) {
                throw new IOException("connection not ready");
            }
            RelayFrames.write(out, frame);
        }
    }

    private void closeQuietly() {
        closed.set(true);
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Socket close failed: {}", e.getMessage());
        }
    }
}
