package io.github.abcls.protocol;

import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.parser.AbcContext;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Open documents keyed by URI. Each entry holds the latest parse of the document together with the tree built from
 * it; a newer text replaces the whole entry, so a superseded tree is never handed out again. Every parse draws its
 * identities from the registry's one context, so identities captured against an older tree never name a node of a
 * newer one.
 */
public final class DocumentRegistry {
    private static final Logger logger = LogManager.getLogger(DocumentRegistry.class);

    private final Map<String, ParsedTree> documents = new ConcurrentHashMap<>();
    private final AbcContext ctx = new AbcContext();

    public void open(String uri, String text) {
        documents.put(uri, ParsedTree.parse(text, ctx));
        logger.debug("Opened {}", uri);
    }

    /** Replaces the text of {@code uri}, opening it if it was not open. */
    public void update(String uri, String text) {
        documents.put(uri, ParsedTree.parse(text, ctx));
    }

    public void close(String uri) {
        if (documents.remove(uri) == null) {
            logger.debug("Close for unknown document {}", uri);
        }
    }

    public Optional<ParsedTree> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public int size() {
        return documents.size();
    }
}
