package db.runner.net;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Length-prefixed message codec: a 4-byte big-endian unsigned body length, then the body as UTF-8.
 * The length counts encoded bytes, not characters.
 */
public final class MessageFraming {
    public static final int HEADER_SIZE = 4;

    private final int maxMessageBytes;

    public MessageFraming(int maxMessageBytes) {
        if (maxMessageBytes < 1) throw new IllegalArgumentException("maxMessageBytes must be positive");
        this.maxMessageBytes = maxMessageBytes;
    }

    public void write(OutputStream out, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxMessageBytes) {
            throw new FramingException("Message of " + bytes.length + " bytes exceeds limit " + maxMessageBytes);
        }
        out.write(ByteBuffer.allocate(HEADER_SIZE).putInt(bytes.length).array());
        out.write(bytes);
        out.flush();
    }

    /**
     * Read one message. Returns null when the stream ends cleanly before a header starts.
     */
    public String read(InputStream in) throws IOException {
        int first = in.read();
        if (first == -1) return null;
        byte[] rest = in.readNBytes(HEADER_SIZE - 1);
        if (rest.length < HEADER_SIZE - 1) throw new FramingException("Truncated message header");

        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        header.put((byte) first).put(rest).flip();
        long length = Integer.toUnsignedLong(header.getInt());
        if (length > maxMessageBytes) {
            throw new FramingException("Declared message length " + length + " exceeds limit " + maxMessageBytes);
        }
        byte[] body = in.readNBytes((int) length);
        if (body.length < length) {
            throw new FramingException("Truncated message body: expected " + length + " bytes, got " + body.length);
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    public int maxMessageBytes() { return maxMessageBytes; }

    public static int encodedLength(String body) {
        return body.getBytes(StandardCharsets.UTF_8).length;
    }
}
