package pl.marcinmilkowski.line_search.client;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Minimal client: one connection per query, reads the single response line.
 * With TLS the server certificate must match the host name or address.
 */
public class LineSearchClient {

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    private final String host;
    private final int port;
    private final SSLContext sslContext;
    private final int timeoutMillis;

    public LineSearchClient(String host, int port) {
        this(host, port, null, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * @param sslContext client TLS context, or null for plaintext
     */
    public LineSearchClient(String host, int port, SSLContext sslContext, int timeoutMillis) {
        this.host = host;
        this.port = port;
        this.sslContext = sslContext;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Send a query and return the server's response line without its newline,
     * e.g. "STRING EXISTS". Returns an empty string if the server closed the
     * connection without answering.
     */
    public String query(String query) throws IOException {
        return send(query.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Send raw bytes as the request payload.
     */
    public String send(byte[] payload) throws IOException {
        try (Socket socket = connect()) {
            OutputStream out = socket.getOutputStream();
            out.write(payload);
            out.flush();
            return readLine(socket);
        }
    }

    /**
     * Connect and send nothing; the server answers after its idle timeout.
     */
    public String sendNothing() throws IOException {
        try (Socket socket = connect()) {
            return readLine(socket);
        }
    }

    private Socket connect() throws IOException {
        Socket plain = new Socket();
        try {
            plain.connect(new InetSocketAddress(host, port), timeoutMillis);
            plain.setSoTimeout(timeoutMillis);
            if (sslContext == null) {
                return plain;
            }
            SSLSocket tls = (SSLSocket) sslContext.getSocketFactory().createSocket(plain, host, port, true);
            SSLParameters parameters = tls.getSSLParameters();
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
            tls.setSSLParameters(parameters);
            tls.startHandshake();
            return tls;
        } catch (IOException | RuntimeException e) {
            plain.close();
            throw e;
        }
    }

    private static String readLine(Socket socket) throws IOException {
        BufferedReader reader = new BufferedReader(
            new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        String line = reader.readLine();
        return line == null ? "" : line;
    }
}
