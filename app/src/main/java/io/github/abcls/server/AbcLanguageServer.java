package io.github.abcls.server;

import io.github.abcls.protocol.ApplySelectorParams;
import io.github.abcls.protocol.ApplyTransformParams;
import io.github.abcls.protocol.DocumentRegistry;
import io.github.abcls.protocol.EditingService;
import io.github.abcls.protocol.ProtocolException;
import io.github.abcls.protocol.SelectorResult;
import io.github.abcls.protocol.TransformResult;
import io.github.abcls.socket.SocketServer;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.jetbrains.annotations.Nullable;

/**
 * Language server for ABC files. Besides document sync it answers two custom requests, {@code abc.applySelector} and
 * {@code abc.applyTransform}, which share their implementation with the socket server.
 */
public class AbcLanguageServer implements LanguageServer, LanguageClientAware {
    private static final Logger logger = LogManager.getLogger(AbcLanguageServer.class);

    public static final String VERSION = "0.1.0";

    private final DocumentRegistry documents;
    private final EditingService editing;
    private final AbcTextDocumentService textDocumentService;
    private final AbcWorkspaceService workspaceService = new AbcWorkspaceService();

    private @Nullable LanguageClient client;
    private @Nullable SocketServer socketServer;
    private int exitCode = 1;

    public AbcLanguageServer() {
        this(new DocumentRegistry());
    }

    public AbcLanguageServer(DocumentRegistry documents) {
        this.documents = documents;
        this.editing = new EditingService(documents);
        this.textDocumentService = new AbcTextDocumentService(documents);
    }

    public EditingService editing() {
        return editing;
    }

    public DocumentRegistry documents() {
        return documents;
    }

    /** Stopped together with this server on shutdown. */
    public void attachSocketServer(SocketServer socketServer) {
        this.socketServer = socketServer;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    public @Nullable LanguageClient client() {
        return client;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        var capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        var clientInfo = params.getClientInfo();
        logger.info("Initialized for client {}", clientInfo == null ? "unknown" : clientInfo.getName());
        return CompletableFuture.completedFuture(new InitializeResult(capabilities, new ServerInfo("abcls", VERSION)));
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutdown requested");
        if (socketServer != null) {
            socketServer.stop();
        }
        exitCode = 0;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        logger.info("Exiting with code {}", exitCode);
        System.exit(exitCode);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    @JsonRequest("abc.applySelector")
    public CompletableFuture<SelectorResult> applySelector(ApplySelectorParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return editing.applySelector(params);
            } catch (ProtocolException e) {
                throw toResponseError(e);
            }
        });
    }

    @JsonRequest("abc.applyTransform")
    public CompletableFuture<TransformResult> applyTransform(ApplyTransformParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return editing.applyTransform(params);
            } catch (ProtocolException e) {
                throw toResponseError(e);
            }
        });
    }

    static ResponseErrorException toResponseError(ProtocolException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return new ResponseErrorException(new ResponseError(e.code(), e.getMessage(), null));
    }
}
