package pl.marcinmilkowski.line_search.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LineSearchClientTest {

    @Test
    @DisplayName("Sends the query as UTF-8 and returns the reply without its newline")
    void sendsQueryAndReadsLine() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        try (ServerSocket listener = new ServerSocket(0)) {
            Thread peer = new Thread(() -> {
                try (Socket socket = listener.accept()) {
                    byte[] buffer = new byte[1024];
                    int n = socket.getInputStream().read(buffer);
                    received.set(new String(buffer, 0, n, StandardCharsets.UTF_8));
                    OutputStream out = socket.getOutputStream();
                    out.write("STRING EXISTS\n".getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                } catch (IOException e) {
                    received.set("failed: " + e.getMessage());
                }
            });
            peer.start();

            String reply = new LineSearchClient("127.0.0.1", listener.getLocalPort()).query("żółw");
            peer.join(5_000);

            assertEquals("STRING EXISTS", reply);
            assertEquals("żółw", received.get());
        }
    }

    @Test
    @DisplayName("A peer that closes without answering yields an empty reply")
    void emptyReplyOnClose() throws Exception {
        try (ServerSocket listener = new ServerSocket(0)) {
            Thread peer = new Thread(() -> {
                try (Socket socket = listener.accept()) {
                    socket.getInputStream().read(new byte[64]);
                } catch (IOException e) {
                    // the client side of this test reports the outcome
                }
            });
            peer.start();

            String reply = new LineSearchClient("127.0.0.1", listener.getLocalPort()).query("anything");
            peer.join(5_000);

            assertEquals("", reply);
        }
    }

    @Test
    void connectionRefused() throws Exception {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }
        LineSearchClient client = new LineSearchClient("127.0.0.1", port);

        assertThrows(IOException.class, () -> client.query("x"));
    }
}
