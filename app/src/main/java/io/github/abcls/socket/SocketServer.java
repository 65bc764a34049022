package io.github.abcls.socket;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Newline-delimited JSON over a Unix domain socket. The first server to bind the path owns it; a later server that
 * finds a live socket does not bind and leaves it alone.
 */
public final class SocketServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SocketServer.class);

    static final long STALE_CHECK_TIMEOUT_MS = 1000;

    private final Path socketPath;
    private final SocketRequestHandler handler;
    private final ExecutorService connections = Executors.newCachedThreadPool(r -> {
        var t = new Thread(r, "abc-socket-connection");
        t.setDaemon(true);
        return t;
    });

    private @Nullable ServerSocketChannel server;
    private volatile boolean owner;

    public SocketServer(Path socketPath, SocketRequestHandler handler) {
        this.socketPath = socketPath;
        this.handler = handler;
    }

    /**
     * Binds the socket unless another live server holds it.
     *
     * @return true when this server owns the socket
     */
    public synchronized boolean start() throws IOException {
        if (Files.exists(socketPath)) {
            if (!isStale(socketPath)) {
                logger.info("Socket {} already in use by another server", socketPath);
                return false;
            }
            unlinkIfOwned(socketPath);
        }
        SocketPaths.forSocketPath(socketPath).ensureSocketDirExists();

        var channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            if (Files.exists(socketPath)) {
                logger.info("Socket {} already in use", socketPath);
                return false;
            }
            throw e;
        }
        server = channel;
        owner = true;

        var acceptor = new Thread(() -> acceptLoop(channel), "abc-socket-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        logger.info("Socket listening on {}", socketPath);
        return true;
    }

    public boolean isOwner() {
        return owner;
    }

    public Path socketPath() {
        return socketPath;
    }

    private void acceptLoop(ServerSocketChannel channel) {
        while (channel.isOpen()) {
            try {
                var client = channel.accept();
                connections.submit(() -> serve(client));
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                logger.warn("Socket accept failed on {}", socketPath, e);
            }
        }
        logger.debug("Socket acceptor for {} stopped", socketPath);
    }

    private void serve(SocketChannel client) {
        try (client;
                var reader = new BufferedReader(
                        new InputStreamReader(Channels.newInputStream(client), StandardCharsets.UTF_8));
                Writer writer = new OutputStreamWriter(Channels.newOutputStream(client), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                writer.write(handler.handle(line));
                writer.write('\n');
                writer.flush();
            }
        } catch (IOException e) {
            logger.debug("Socket client error: {}", e.getMessage());
        }
    }

    /** A socket file nobody answers on within the stale-check timeout. */
    static boolean isStale(Path path) {
        var attempt = CompletableFuture.supplyAsync(() -> {
            try (var channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
                return !channel.connect(UnixDomainSocketAddress.of(path));
            } catch (IOException e) {
                return true;
            }
        });
        try {
            return attempt.get(STALE_CHECK_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            return true;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static void unlinkIfOwned(Path path) {
        try {
            var fileOwner = Files.getOwner(path).getName();
            if (fileOwner.equals(System.getProperty("user.name"))) {
                Files.deleteIfExists(path);
            } else {
                logger.warn("Not removing socket {} owned by {}", path, fileOwner);
            }
        } catch (IOException e) {
            logger.warn("Could not remove stale socket {}", path, e);
        }
    }

    /** Closes the listener and removes the socket file this server created. */
    public synchronized void stop() {
        if (server != null) {
            try {
                server.close();
            } catch (IOException e) {
                logger.warn("Error closing socket {}", socketPath, e);
            }
            server = null;
        }
        connections.shutdownNow();
        if (owner && Files.exists(socketPath)) {
            unlinkIfOwned(socketPath);
        }
        owner = false;
    }

    @Override
    public void close() {
        stop();
    }
}
