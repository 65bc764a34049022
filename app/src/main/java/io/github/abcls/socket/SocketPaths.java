package io.github.abcls.socket;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the per-user socket location editor plugins connect to.
 *
 * Resolution order:
 * - $XDG_RUNTIME_DIR/abc-lsp.sock
 * - /tmp/abc-lsp-$USER/lsp.sock
 *
 * For tests and overrides use {@link #forSocketPath(Path)}.
 */
public final class SocketPaths {
    static final String RUNTIME_SOCKET_NAME = "abc-lsp.sock";
    static final String FALLBACK_SOCKET_NAME = "lsp.sock";

    private final Path socketPath;

    private SocketPaths(Path socketPath) {
        this.socketPath = Objects.requireNonNull(socketPath);
    }

    public static SocketPaths defaults() {
        return fromEnvironment(System.getenv());
    }

    static SocketPaths fromEnvironment(Map<String, String> env) {
        var xdg = env.get("XDG_RUNTIME_DIR");
        if (xdg != null && !xdg.isBlank()) {
            return new SocketPaths(Paths.get(xdg).resolve(RUNTIME_SOCKET_NAME));
        }
        var user = env.get("USER");
        if (user == null || user.isBlank()) {
            user = env.getOrDefault("USERNAME", "unknown");
        }
        return new SocketPaths(Paths.get("/tmp", "abc-lsp-" + user).resolve(FALLBACK_SOCKET_NAME));
    }

    public static SocketPaths forSocketPath(Path socketPath) {
        return new SocketPaths(socketPath);
    }

    public Path getSocketPath() {
        return socketPath;
    }

    /** Creates the socket's parent directory, owner-only, when it does not exist yet. */
    public Path ensureSocketDirExists() throws IOException {
        var dir = socketPath.toAbsolutePath().getParent();
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(
                        dir, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
            } catch (UnsupportedOperationException e) {
                // non-POSIX file system
                Files.createDirectories(dir);
            }
        }
        return dir;
    }
}
