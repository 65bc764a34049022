package io.github.abcls.server;

import io.github.abcls.protocol.DocumentRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.services.TextDocumentService;

/** Keeps the document registry in step with the editor. Sync is full-text, so each change carries the whole file. */
public class AbcTextDocumentService implements TextDocumentService {
    private static final Logger logger = LogManager.getLogger(AbcTextDocumentService.class);

    private final DocumentRegistry documents;

    public AbcTextDocumentService(DocumentRegistry documents) {
        this.documents = documents;
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        var document = params.getTextDocument();
        documents.open(document.getUri(), document.getText());
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        var uri = params.getTextDocument().getUri();
        var changes = params.getContentChanges();
        if (changes.isEmpty()) {
            return;
        }
        var last = changes.get(changes.size() - 1);
        if (last.getRange() != null) {
            logger.warn("Ignoring incremental change for {}; the server asked for full sync", uri);
            return;
        }
        documents.update(uri, last.getText());
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        documents.close(params.getTextDocument().getUri());
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        var text = params.getText();
        if (text != null) {
            documents.update(params.getTextDocument().getUri(), text);
        }
    }
}
