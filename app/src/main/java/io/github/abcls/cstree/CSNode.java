package io.github.abcls.cstree;

import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Generic tree node in left-child/right-sibling form. There are no parent pointers: anything that needs an ancestor
 * has to carry it down the recursion.
 *
 * <p>Leaves ({@link Tag#TOKEN}) carry {@link TokenData} and never have children; interior nodes carry no payload.
 */
public final class CSNode {
    private Tag tag;
    private final int id;
    private final @Nullable TokenData data;
    private @Nullable CSNode firstChild;
    private @Nullable CSNode nextSibling;

    private CSNode(Tag tag, int id, @Nullable TokenData data) {
        this.tag = tag;
        this.id = id;
        this.data = data;
    }

    public static CSNode interior(Tag tag, int id) {
        if (tag == Tag.TOKEN) {
            throw new IllegalArgumentException("Interior node cannot be tagged TOKEN");
        }
        return new CSNode(tag, id, null);
    }

    public static CSNode token(int id, TokenData data) {
        return new CSNode(Tag.TOKEN, id, Objects.requireNonNull(data));
    }

    /** Creates a positionless token node with a fresh identity from {@code ctx}. */
    public static CSNode token(AbcContext ctx, TT type, String lexeme) {
        return token(ctx.generateId(), new TokenData(lexeme, type, -1, -1));
    }

    /** Creates an interior node with a fresh identity and the given children linked in order. */
    public static CSNode interior(AbcContext ctx, Tag tag, List<CSNode> children) {
        var node = interior(tag, ctx.generateId());
        node.linkChildren(children);
        return node;
    }

    public Tag tag() {
        return tag;
    }

    /** Retags an interior node in place, keeping its identity. */
    public void retag(Tag newTag) {
        if (isToken() || newTag == Tag.TOKEN) {
            throw new IllegalStateException("Cannot retag between token and interior nodes");
        }
        this.tag = newTag;
    }

    public int id() {
        return id;
    }

    public boolean isToken() {
        return tag == Tag.TOKEN;
    }

    public boolean is(Tag candidate) {
        return tag == candidate;
    }

    public boolean isTokenOf(TT type) {
        return data != null && data.tokenType() == type;
    }

    public @Nullable TokenData data() {
        return data;
    }

    /** Token payload of a leaf; throws for interior nodes. */
    public TokenData tokenData() {
        if (data == null) {
            throw new IllegalStateException("Node " + id + " (" + tag + ") is not a token");
        }
        return data;
    }

    public @Nullable CSNode firstChild() {
        return firstChild;
    }

    public void setFirstChild(@Nullable CSNode firstChild) {
        if (isToken() && firstChild != null) {
            throw new IllegalStateException("Token nodes cannot have children");
        }
        this.firstChild = firstChild;
    }

    public @Nullable CSNode nextSibling() {
        return nextSibling;
    }

    public void setNextSibling(@Nullable CSNode nextSibling) {
        this.nextSibling = nextSibling;
    }

    /** Direct children in order. */
    public List<CSNode> children() {
        var result = new ArrayList<CSNode>();
        for (var child = firstChild; child != null; child = child.nextSibling) {
            result.add(child);
        }
        return result;
    }

    /** Replaces this node's children with {@code children}, relinking their sibling chain. */
    public void linkChildren(List<CSNode> children) {
        CSNode prev = null;
        for (var child : children) {
            if (prev == null) {
                setFirstChild(child);
            } else {
                prev.nextSibling = child;
            }
            prev = child;
        }
        if (prev == null) {
            setFirstChild(null);
        } else {
            prev.nextSibling = null;
        }
    }

    @Override
    public String toString() {
        if (data != null) {
            return "CSNode[" + id + " " + data.tokenType() + " '" + data.lexeme() + "']";
        }
        return "CSNode[" + id + " " + tag + "]";
    }
}
