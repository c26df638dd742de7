package db.runner.net;

import java.io.IOException;

/**
 * The peer sent bytes that do not form a valid frame: a truncated header or body, or a declared length
 * above the configured limit. The connection cannot be resynchronised and must be closed.
 */
public class FramingException extends IOException {
    public FramingException(String message) {
        super(message);
    }
}
