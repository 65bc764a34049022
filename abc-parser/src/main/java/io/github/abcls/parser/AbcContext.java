package io.github.abcls.parser;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the identity generator. Identities are never reused within a context, so parses that share one never share
 * an identity; a long-lived owner such as the document registry hands the same context to every parse. Safe to
 * share between threads.
 */
public final class AbcContext {
    private final AtomicInteger nextId;

    public AbcContext() {
        this(0);
    }

    public AbcContext(int firstId) {
        this.nextId = new AtomicInteger(firstId);
    }

    public int generateId() {
        return nextId.getAndIncrement();
    }
}
