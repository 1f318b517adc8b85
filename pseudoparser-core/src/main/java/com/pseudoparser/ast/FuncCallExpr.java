package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Call in expression position. The callee is the receiver expression the call
 * suffix was applied to: a {@link Var} for {@code f(x)}, or any other
 * expression for chains such as {@code a.b[0](x)}.
 */
public final class FuncCallExpr extends Node {

    private final Node callee;
    private final List<Node> args;

    public FuncCallExpr(Node callee, List<? extends Node> args) {
        this.callee = Objects.requireNonNull(callee, "callee");
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    public Node callee() {
        return callee;
    }

    public List<Node> args() {
        return args;
    }

    /**
     * @return the called name when the callee is a bare variable, empty otherwise
     */
    public Optional<String> name() {
        if (callee instanceof Var var) {
            return Optional.of(var.name());
        }
        return Optional.empty();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFuncCallExpr(this);
    }

    @Override
    public String type() {
        return "FuncCallExpr";
    }

    @Override
    protected List<Object> fields() {
        return List.of(callee, args);
    }
}
