package api.impl;

/** Status codes the handlers emit and their reason phrases. */
public final class HttpStatus {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private HttpStatus() {}

    /** Anything outside the small table reads as "Internal error". */
    public static String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case CREATED -> "Created";
            case NOT_FOUND -> "Not Found";
            default -> "Internal error";
        };
    }
}
