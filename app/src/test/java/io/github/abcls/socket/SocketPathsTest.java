package io.github.abcls.socket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SocketPathsTest {

    @Test
    void usesRuntimeDirWhenSet() {
        var paths = SocketPaths.fromEnvironment(Map.of("XDG_RUNTIME_DIR", "/run/user/1000", "USER", "me"));
        assertEquals(Paths.get("/run/user/1000/abc-lsp.sock"), paths.getSocketPath());
    }

    @Test
    void fallsBackToPerUserTmpDir() {
        var paths = SocketPaths.fromEnvironment(Map.of("USER", "me"));
        assertEquals(Paths.get("/tmp/abc-lsp-me/lsp.sock"), paths.getSocketPath());
    }

    @Test
    void blankRuntimeDirIsIgnored() {
        var paths = SocketPaths.fromEnvironment(Map.of("XDG_RUNTIME_DIR", " ", "USERNAME", "win"));
        assertEquals(Paths.get("/tmp/abc-lsp-win/lsp.sock"), paths.getSocketPath());
    }

    @Test
    void ensureSocketDirCreatesParent(@TempDir Path tmp) throws Exception {
        var paths = SocketPaths.forSocketPath(tmp.resolve("nested").resolve("lsp.sock"));
        var dir = paths.ensureSocketDirExists();
        assertTrue(Files.isDirectory(dir));
        assertEquals(tmp.resolve("nested"), dir);
    }
}
