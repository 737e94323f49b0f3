package io.relaybox.relay;

import io.relaybox.model.EndpointRole;
import io.relaybox.model.ErrorKind;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

public record RelayFrame(FrameType type, byte[] body) {
    public static RelayFrame hello(EndpointRole role, byte[] deviceId, byte[] token) {
        ByteBuffer buf = ByteBuffer.allocate(1 + deviceId.length + token.length);
        buf.put((byte) role.wireCode());
        buf.put(deviceId);
        buf.put(token);
        return new RelayFrame(FrameType.HELLO, buf.array());
    }

    public static RelayFrame accept(Allocation allocation, boolean resumed) {
        byte[] id = HexFormat.of().parseHex(allocation.id());
        ByteBuffer buf = ByteBuffer.allocate(id.length + Long.BYTES * 3 + 1);
        buf.put(id);
        buf.putLong(allocation.quotaBytes());
        buf.putLong(allocation.bandwidthBps());
        buf.putLong(allocation.expiresAtMs());
        buf.put((byte) (resumed ? 1 : 0));
        return new RelayFrame(FrameType.ACCEPT, buf.array());
    }

    public static RelayFrame data(byte[] payload) {
        return new RelayFrame(FrameType.DATA, payload);
    }

    public static RelayFrame reject(ErrorKind error) {
        return new RelayFrame(FrameType.REJECT, error.code().getBytes(StandardCharsets.UTF_8));
    }

    public static RelayFrame error(ErrorKind error) {
        return new RelayFrame(FrameType.ERROR, error.code().getBytes(StandardCharsets.UTF_8));
    }

    public static RelayFrame close(ErrorKind reason) {
        return new RelayFrame(FrameType.CLOSE, reason.code().getBytes(StandardCharsets.UTF_8));
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Hello asHello() {
        if (type != FrameType.HELLO || body.length <= 1 + RelayToken.IDENTITY_BYTES) {
            throw new IllegalArgumentException("malformed HELLO frame");
        }
        EndpointRole role = EndpointRole.fromWire(body[0] & 0xff);
        byte[] deviceId = Arrays.copyOfRange(body, 1, 1 + RelayToken.IDENTITY_BYTES);
        byte[] token = Arrays.copyOfRange(body, 1 + RelayToken.IDENTITY_BYTES, body.length);
        return new Hello(role, deviceId, token);
    }

    public Accept asAccept() {
        if (type != FrameType.ACCEPT || body.length != 16 + Long.BYTES * 3 + 1) {
            throw new IllegalArgumentException("malformed ACCEPT frame");
        }
        ByteBuffer buf = ByteBuffer.wrap(body);
        byte[] id = new byte[16];
        buf.get(id);
        return new Accept(HexFormat.of().formatHex(id), buf.getLong(), buf.getLong(), buf.getLong(), buf.get() == 1);
    }

    public record Hello(EndpointRole role, byte[] deviceId, byte[] token) {
    }

    public record Accept(String allocationId, long quotaBytes, long bandwidthBps, long expiresAtMs, boolean resumed) {
    }
}
