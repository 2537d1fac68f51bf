package pl.marcinmilkowski.line_search.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.line_search.config.ServerConfig;
import pl.marcinmilkowski.line_search.search.SearchAlgorithm;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * TCP line-search server.
 *
 * <p>One acceptor thread admits connections through the {@link WorkerPool} and
 * hands each one to a {@link RequestHandler}. With TLS enabled the accepted
 * socket is layered in server mode and the handshake runs on the worker.</p>
 *
 * <p>The search strategy must already be loaded (or be a reread-on-query
 * decorator) when {@link #start()} is called.</p>
 */
public class LineSearchServer {

    private static final long STOP_TIMEOUT_SECONDS = 5L;

    private final ServerConfig config;
    private final SearchAlgorithm algorithm;
    private final SSLContext sslContext;
    private final Consumer<Throwable> fatalErrorHandler;
    private final Logger logger;
    private final WorkerPool pool;

    private ServerSocket serverSocket;
    private Thread acceptor;
    private volatile boolean running;

    private LineSearchServer(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.algorithm = Objects.requireNonNull(builder.algorithm, "algorithm");
        if (config.sslEnabled() && builder.sslContext == null) {
            throw new IllegalArgumentException("TLS is enabled but no SSL context was given");
        }
        this.sslContext = config.sslEnabled() ? builder.sslContext : null;
        this.fatalErrorHandler = builder.fatalErrorHandler;
        this.logger = builder.logger;
        this.pool = new WorkerPool(config.maxWorkers(), logger);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Bind the listening socket and start accepting.
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(config.port()), config.backlog());
        running = true;

        acceptor = new Thread(this::acceptLoop, "line-search-acceptor");
        acceptor.start();

        logger.info("Server listening on port {} (ssl={}, reread_on_query={}, algorithm={})",
            serverSocket.getLocalPort(), sslContext != null, config.rereadOnQuery(), algorithm.getName());
    }

    /**
     * Port actually bound, which differs from the configured one when that was 0.
     */
    public int getLocalPort() {
        ServerSocket s = serverSocket;
        return s == null ? -1 : s.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Block until the accept loop ends.
     */
    public void join() throws InterruptedException {
        Thread t = acceptor;
        if (t != null) {
            t.join();
        }
    }

    /**
     * Stop accepting, then give in-flight requests a short grace period.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing server socket: {}", e.getMessage());
        }
        acceptor.interrupt();
        pool.shutdown();
        try {
            acceptor.join(TimeUnit.SECONDS.toMillis(STOP_TIMEOUT_SECONDS));
            if (!pool.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers still busy after {} s; abandoning them", STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Server stopped");
    }

    private void acceptLoop() {
        while (running) {
            try {
                pool.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                pool.release();
                if (running) {
                    logger.error("Error accepting connection: {}", e.getMessage());
                    continue;
                }
                break;
            }
            logger.debug("Connection from {}", socket.getRemoteSocketAddress());

            Socket connection;
            try {
                connection = sslContext == null ? socket : layerTls(socket);
            } catch (IOException e) {
                pool.release();
                logger.error("Could not set up TLS for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                close(socket);
                continue;
            }

            try {
                pool.submit(new RequestHandler(connection, algorithm, config, logger, fatalErrorHandler));
            } catch (RejectedExecutionException e) {
                logger.warn("Dropping connection from {}: server is shutting down", socket.getRemoteSocketAddress());
                close(connection);
            }
        }
        logger.debug("Accept loop finished");
    }

    private Socket layerTls(Socket socket) throws IOException {
        SSLSocketFactory factory = sslContext.getSocketFactory();
        // the consumed-data overload yields a server-mode socket
        return factory.createSocket(socket, null, true);
    }

    private void close(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    /**
     * Builder for {@link LineSearchServer}. Config and algorithm are required;
     * the SSL context is required only when the config enables TLS.
     */
    public static class Builder {
        private ServerConfig config;
        private SearchAlgorithm algorithm;
        private SSLContext sslContext;
        private Consumer<Throwable> fatalErrorHandler = e -> { };
        private Logger logger = LoggerFactory.getLogger(LineSearchServer.class);

        private Builder() {
        }

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withAlgorithm(SearchAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder withSslContext(SSLContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        /**
         * Called on the worker thread after a request hit an unrecoverable
         * corpus failure and its error line was sent.
         */
        public Builder withFatalErrorHandler(Consumer<Throwable> fatalErrorHandler) {
            this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler");
            return this;
        }

        public Builder withLogger(Logger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        public LineSearchServer build() {
            return new LineSearchServer(this);
        }
    }
}
