package api.interfaces.http;

/** First line did not carry method, path and version. */
public class MalformedRequestLineException extends RequestParseException {
    public MalformedRequestLineException(String message) {
        super(message);
    }
}
