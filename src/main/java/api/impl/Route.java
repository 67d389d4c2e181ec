package api.impl;

/**
 * The fixed set of routes. {@link #match(String, String)} is checked in
 * declaration order of its branches, first match wins.
 * Paths are compared as raw strings: no query parsing, no trailing-slash folding.
 */
public enum Route {
    ECHO,
    USER_AGENT,
    FILE_GET,
    FILE_POST,
    ROOT,
    NOT_FOUND;

    public static final String ECHO_PREFIX = "/echo/";
    public static final String USER_AGENT_PATH = "/user-agent";
    public static final String FILES_PREFIX = "/files/";
    public static final String ROOT_PATH = "/";

    public static Route match(String method, String path) {
        if (path == null) return NOT_FOUND;
        if (path.startsWith(ECHO_PREFIX)) return ECHO;
        if (path.equals(USER_AGENT_PATH)) return USER_AGENT;
        if (path.startsWith(FILES_PREFIX)) {
            if ("GET".equals(method)) return FILE_GET;
            if ("POST".equals(method)) return FILE_POST;
            return NOT_FOUND;
        }
        if (path.equals(ROOT_PATH)) return ROOT;
        return NOT_FOUND;
    }
}
