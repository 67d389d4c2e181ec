package api.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteTest {

    @Test
    void echoMatchesAnyMethod() {
        assertEquals(Route.ECHO, Route.match("GET", "/echo/abc"));
        assertEquals(Route.ECHO, Route.match("DELETE", "/echo/"));
        assertEquals(Route.NOT_FOUND, Route.match("GET", "/echo"));
    }

    @Test
    void userAgentIsExactMatch() {
        assertEquals(Route.USER_AGENT, Route.match("GET", "/user-agent"));
        assertEquals(Route.NOT_FOUND, Route.match("GET", "/user-agent/"));
    }

    @Test
    void filesDependOnMethod() {
        assertEquals(Route.FILE_GET, Route.match("GET", "/files/a"));
        assertEquals(Route.FILE_POST, Route.match("POST", "/files/a"));
        assertEquals(Route.NOT_FOUND, Route.match("PUT", "/files/a"));
        assertEquals(Route.NOT_FOUND, Route.match("get", "/files/a"));
    }

    @Test
    void rootAndFallback() {
        assertEquals(Route.ROOT, Route.match("GET", "/"));
        assertEquals(Route.ROOT, Route.match("POST", "/"));
        assertEquals(Route.NOT_FOUND, Route.match("GET", "/nope"));
        assertEquals(Route.NOT_FOUND, Route.match("GET", "/?q=1"));
        assertEquals(Route.NOT_FOUND, Route.match("GET", "*"));
    }

    @Test
    void echoPrefixTakesPrecedenceOverFiles() {
        assertEquals(Route.ECHO, Route.match("POST", "/echo/files/x"));
    }
}
