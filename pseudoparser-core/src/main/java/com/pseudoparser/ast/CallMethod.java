package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code obj.method(args)} in statement position.
 */
public final class CallMethod extends Node {

    private final Node receiver;
    private final String method;
    private final List<Node> args;

    public CallMethod(Node receiver, String method, List<? extends Node> args) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.method = Objects.requireNonNull(method, "method");
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    public Node receiver() {
        return receiver;
    }

    public String method() {
        return method;
    }

    public List<Node> args() {
        return args;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallMethod(this);
    }

    @Override
    public String type() {
        return "CallMethod";
    }

    @Override
    protected List<Object> fields() {
        return List.of(receiver, method, args);
    }
}
