package api.interfaces.http;

import java.io.IOException;

/**
 * Raised when the bytes on a connection do not form a request we can handle.
 * Subclasses name the exact part of the message that was wrong.
 */
public abstract class RequestParseException extends IOException {
    protected RequestParseException(String message) {
        super(message);
    }
}
