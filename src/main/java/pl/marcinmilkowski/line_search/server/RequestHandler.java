package pl.marcinmilkowski.line_search.server;

import org.slf4j.Logger;
import pl.marcinmilkowski.line_search.config.LoggingConfig;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.corpus.CorpusLoadException;
import pl.marcinmilkowski.line_search.search.SearchAlgorithm;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.CharacterCodingException;
import java.util.function.Consumer;

/**
 * Serves exactly one request on one connection.
 *
 * <p>Protocol: read a single chunk (no framing), decode it, answer with one
 * {@link Response} line, close. Every failure is handled here; nothing escapes
 * to the worker thread or the accept loop. The only exception is a corpus that
 * can no longer be loaded, which is answered with {@link Response#ERROR} and
 * then reported to the fatal-error handler.</p>
 */
public class RequestHandler implements Runnable {

    static final int HANDSHAKE_TIMEOUT_MILLIS = 5_000;
    private static final int MAX_DISCARD_BYTES = 64 * 1024;

    private final Socket socket;
    private final SearchAlgorithm algorithm;
    private final ServerConfig config;
    private final Logger logger;
    private final Consumer<Throwable> fatalErrorHandler;

    public RequestHandler(Socket socket, SearchAlgorithm algorithm, ServerConfig config, Logger logger,
                          Consumer<Throwable> fatalErrorHandler) {
        this.socket = socket;
        this.algorithm = algorithm;
        this.config = config;
        this.logger = logger;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    @Override
    public void run() {
        long start = System.nanoTime();
        SocketAddress client = socket.getRemoteSocketAddress();
        String query = null;
        Response response = Response.ERROR;
        boolean truncated = false;
        CorpusLoadException fatal = null;

        try (Socket s = socket) {
            if (s instanceof SSLSocket sslSocket && !handshake(sslSocket, client)) {
                return;
            }
            try {
                s.setSoTimeout(config.readTimeoutMillis());
                byte[] buffer = new byte[config.readChunkSize()];
                int read = s.getInputStream().read(buffer);
                truncated = read == buffer.length;
                query = QueryDecoder.decode(buffer, read, truncated);
                response = answer(query);
            } catch (SocketTimeoutException e) {
                logger.error("No query received from {} within {} ms", client, config.readTimeoutMillis());
                response = Response.NOT_FOUND;
            } catch (CharacterCodingException e) {
                logger.error("Query from {} is not valid UTF-8: {}", client, e.toString());
                response = Response.ERROR;
            } catch (CorpusLoadException e) {
                logger.error(LoggingConfig.FATAL, "Corpus became unavailable while serving {}: {}",
                    client, e.getMessage());
                response = Response.ERROR;
                fatal = e;
            } catch (IOException | RuntimeException e) {
                logger.error("Error handling client {}: {}", client, e.getMessage(), e);
                response = Response.ERROR;
            }

            send(s, response);
            if (truncated) {
                discardUnreadInput(s);
            }
        } catch (IOException e) {
            logger.warn("Could not answer client {}: {}", client, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while answering client {}", client, e);
        } finally {
            if (logger.isDebugEnabled()) {
                logger.debug("Query='{}', IP={}, Time={} ms, Response={}",
                    query, client, String.format("%.3f", (System.nanoTime() - start) / 1_000_000.0),
                    response.text());
            }
            if (fatal != null) {
                fatalErrorHandler.accept(fatal);
            }
        }
    }

    /**
     * Decide the reply for a decoded query. Empty queries never reach the engine;
     * reread-on-query is handled by the strategy decorator.
     */
    Response answer(String query) {
        if (query.isEmpty()) {
            return Response.NOT_FOUND;
        }
        return Response.of(algorithm.search(query));
    }

    private boolean handshake(SSLSocket sslSocket, SocketAddress client) {
        try {
            sslSocket.setSoTimeout(Math.max(HANDSHAKE_TIMEOUT_MILLIS, config.readTimeoutMillis()));
            sslSocket.startHandshake();
            return true;
        } catch (SSLException e) {
            logger.error("TLS handshake with {} failed: {}", client, e.getMessage());
        } catch (IOException e) {
            logger.error("TLS handshake with {} aborted: {}", client, e.getMessage());
        }
        return false;
    }

    private void send(Socket s, Response response) throws IOException {
        OutputStream out = s.getOutputStream();
        out.write(response.wireBytes());
        out.flush();
    }

    /**
     * Read and drop what is left of an over-long query so that closing the
     * socket ends with FIN rather than a reset that could discard the reply
     * on the client side.
     */
    private void discardUnreadInput(Socket s) {
        try {
            if (!(s instanceof SSLSocket)) {
                s.shutdownOutput();
            }
            InputStream in = s.getInputStream();
            byte[] sink = new byte[4096];
            int total = 0;
            int n;
            while (total < MAX_DISCARD_BYTES && (n = in.read(sink)) > 0) {
                total += n;
            }
        } catch (IOException e) {
            logger.debug("Stopped discarding input: {}", e.getMessage());
        }
    }
}
