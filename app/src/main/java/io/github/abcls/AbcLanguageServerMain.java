package io.github.abcls;

import io.github.abcls.server.AbcLanguageServer;
import io.github.abcls.socket.SocketPaths;
import io.github.abcls.socket.SocketRequestHandler;
import io.github.abcls.socket.SocketServer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "abcls",
        mixinStandardHelpOptions = true,
        version = AbcLanguageServer.VERSION,
        description = "Language server for ABC music notation, speaking LSP on stdin/stdout.")
public final class AbcLanguageServerMain implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(AbcLanguageServerMain.class);

    @CommandLine.Option(
            names = "--socket",
            negatable = true,
            defaultValue = "true",
            fallbackValue = "true",
            description = "Also serve selector and transform requests on a Unix socket (default: ${DEFAULT-VALUE}).")
    boolean socket = true;

    @CommandLine.Option(
            names = "--socket-path",
            description = "Socket path. Defaults to $XDG_RUNTIME_DIR/abc-lsp.sock, else /tmp/abc-lsp-$USER/lsp.sock.")
    @Nullable
    Path socketPath;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AbcLanguageServerMain()).execute(args);
        System.exit(exitCode);
    }

    /** The socket path this invocation would use. */
    Path resolveSocketPath() {
        return socketPath != null ? socketPath : SocketPaths.defaults().getSocketPath();
    }

    @Override
    @Blocking
    public Integer call() throws Exception {
        logger.info("Starting ABC language server {}", AbcLanguageServer.VERSION);
        var server = new AbcLanguageServer();

        if (socket) {
            var socketServer = new SocketServer(resolveSocketPath(), new SocketRequestHandler(server.editing()));
            try {
                socketServer.start();
                server.attachSocketServer(socketServer);
            } catch (IOException e) {
                logger.warn("Socket server not started on {}: {}", socketServer.socketPath(), e.getMessage());
            }
            Runtime.getRuntime().addShutdownHook(new Thread(socketServer::stop, "abc-socket-cleanup"));
        }

        var launcher = LSPLauncher.createServerLauncher(server, System.in, System.out);
        server.connect(launcher.getRemoteProxy());
        launcher.startListening().get();
        logger.info("Client stream closed");
        return 0;
    }
}
