package com.pseudoparser.ast;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for all AST nodes.
 *
 * <p>The set of node kinds is closed; every kind has a matching method on
 * {@link NodeVisitor}. Equality is structural and ignores {@link Metadata}.</p>
 */
public abstract sealed class Node permits
    Program,
    Comment,
    NumberLiteral,
    StringLiteral,
    BoolLiteral,
    NullLiteral,
    Var,
    VarDecl,
    ArrayVarDecl,
    ObjectVarDecl,
    GraphVarDecl,
    ClassDef,
    SubroutineDef,
    Parameter,
    Assignment,
    VarTarget,
    ArrayTarget,
    FieldTarget,
    ForLoop,
    WhileLoop,
    RepeatUntil,
    IfElse,
    CallStmt,
    CallMethod,
    ReturnStmt,
    ArrayAccess,
    ArraySlice,
    FieldAccess,
    FuncCallExpr,
    BinOp,
    ShortCircuitBinOp,
    UnOp,
    LengthFunction,
    CeilFunction,
    FloorFunction,
    StrlenFunction,
    ConcatFunction,
    SubstringFunction,
    AddNodeFunction,
    AddEdgeFunction,
    NeighborsFunction,
    NewObject,
    NewGraph,
    GraphOperation,
    GraphTraversal {

    private static final Metadata FROZEN_EMPTY = Metadata.frozenEmpty();

    private Metadata metadata;
    private boolean frozen;

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * @return the node kind name, e.g. "ForLoop"
     */
    public abstract String type();

    /**
     * Field values in declaration order; drives equality and {@link #toString()}.
     */
    protected abstract List<Object> fields();

    public Optional<Metadata> metadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Returns the metadata of this node, creating it on first use. On a frozen
     * node that never had metadata, the result is a shared empty instance that
     * rejects writes.
     */
    public Metadata getOrCreateMetadata() {
        if (metadata == null) {
            if (frozen) {
                return FROZEN_EMPTY;
            }
            metadata = new Metadata();
        }
        return metadata;
    }

    /**
     * Makes the metadata of this node and of every node below it read-only.
     * Freezing an already frozen tree does nothing.
     */
    public void freezeMetadata() {
        if (frozen) {
            return;
        }
        frozen = true;
        if (metadata != null) {
            metadata.freeze();
        }
        for (Object field : fields()) {
            freeze(field);
        }
    }

    private static void freeze(Object value) {
        if (value instanceof Node node) {
            node.freezeMetadata();
        } else if (value instanceof Collection<?> values) {
            for (Object item : values) {
                freeze(item);
            }
        } else if (value instanceof Optional<?> optional) {
            optional.ifPresent(Node::freeze);
        } else if (value instanceof IndexRange range) {
            freeze(range.start());
            freeze(range.end());
        }
    }

    public Optional<SourcePosition> position() {
        return metadata().flatMap(Metadata::getPosition);
    }

    /**
     * Records the source span of this node. A position can only be set once.
     *
     * @throws IllegalStateException if the node already has a position
     */
    public void setPosition(SourcePosition position) {
        Objects.requireNonNull(position, "position");
        Metadata md = getOrCreateMetadata();
        if (md.getPosition().isPresent()) {
            throw new IllegalStateException(type() + " already positioned at " + md.getPosition().get());
        }
        md.setPosition(position);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields().equals(((Node) o).fields());
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), fields());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type()).append('(');
        List<Object> values = fields();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values.get(i));
        }
        return sb.append(')').toString();
    }
}
