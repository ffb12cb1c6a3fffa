package org.cexpr.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable {@link CstNode} over a span of a shared source string. The parent link is fixed
 * when the parent node is constructed.
 */
public final class SyntaxNode implements CstNode {

    private final String kindName;
    private final boolean named;
    private final String source;
    private final int startIndex;
    private final int endIndex;
    private final List<SyntaxNode> rawChildren;
    private final List<SyntaxNode> children;
    private SyntaxNode parent;

    private SyntaxNode(String kindName, boolean named, String source, int startIndex, int endIndex,
                       List<SyntaxNode> rawChildren) {
        if (startIndex < 0 || endIndex < startIndex || endIndex > source.length()) {
            throw new IllegalArgumentException("Invalid span [" + startIndex + ", " + endIndex + ") for " + kindName);
        }
        this.kindName = kindName;
        this.named = named;
        this.source = source;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.rawChildren = List.copyOf(rawChildren);

        List<SyntaxNode> namedChildren = new ArrayList<>();
        for (SyntaxNode child : this.rawChildren) {
            if (child.parent != null) {
                throw new IllegalArgumentException("Node " + child.kindName + " already has a parent");
            }
            child.parent = this;
            if (child.named) {
                namedChildren.add(child);
            }
        }
        this.children = List.copyOf(namedChildren);
    }

    public static SyntaxNode named(String kindName, String source, int startIndex, int endIndex,
                                   List<SyntaxNode> rawChildren) {
        return new SyntaxNode(kindName, true, source, startIndex, endIndex, rawChildren);
    }

    public static SyntaxNode named(CstKind kind, String source, int startIndex, int endIndex,
                                   List<SyntaxNode> rawChildren) {
        return named(kind.kindName(), source, startIndex, endIndex, rawChildren);
    }

    /**
     * An anonymous token leaf; its kind is the token text itself.
     */
    public static SyntaxNode token(String source, int startIndex, int endIndex) {
        return new SyntaxNode(source.substring(startIndex, endIndex), false, source, startIndex, endIndex, List.of());
    }

    @Override
    public String kindName() {
        return kindName;
    }

    @Override
    public String text() {
        return source.substring(startIndex, endIndex).strip();
    }

    @Override
    public int startIndex() {
        return startIndex;
    }

    @Override
    public int endIndex() {
        return endIndex;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public int childCount() {
        return children.size();
    }

    @Override
    public SyntaxNode child(int index) {
        return children.get(index);
    }

    @Override
    public int rawChildCount() {
        return rawChildren.size();
    }

    @Override
    public SyntaxNode rawChild(int index) {
        return rawChildren.get(index);
    }

    @Override
    public Optional<CstNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return "(" + kindName + " \"" + text() + "\")";
        }
        StringBuilder sb = new StringBuilder("(").append(kindName);
        for (SyntaxNode child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
