package io.relaybox.relay;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * Framing codec: {@code type:u8 | length:u32 | body}.
 */
public final class RelayFrames {
    private RelayFrames() {
    }

    /**
     * Reads one frame, or returns null on a clean end of stream before a frame started.
     */
    public static RelayFrame read(DataInputStream in, int maxFrameSize) throws IOException {
        int type = in.read();
        if (type < 0) {
            return null;
        }
        int length = in.readInt();
        if (length < 0 || length > maxFrameSize) {
            throw new FrameTooLargeException(length, maxFrameSize);
        }
        byte[] body = new byte[length];
        try {
            in.readFully(body);
        } catch (EOFException e) {
            throw new EOFException("truncated frame body");
        }
        try {
            return new RelayFrame(FrameType.fromCode(type), body);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    public static void write(DataOutputStream out, RelayFrame frame) throws IOException {
        out.writeByte(frame.type().code());
        out.writeInt(frame.body().length);
        out.write(frame.body());
        out.flush();
    }

    public static final class FrameTooLargeException extends IOException {
        public FrameTooLargeException(int length, int max) {
            super("frame body of " + length + " bytes exceeds limit " + max);
        }
    }
}
