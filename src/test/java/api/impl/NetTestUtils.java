package api.impl;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

public final class NetTestUtils {
    private NetTestUtils() {}

    /** Sends raw bytes, half-closes, and reads until the server closes. */
    public static byte[] sendRaw(String host, int port, byte[] request) throws IOException {
        try (Socket s = new Socket(host, port)) {
            s.setSoTimeout(5000);
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();
            out.write(request);
            out.flush();
            s.shutdownOutput();
            return in.readAllBytes();
        }
    }
}
