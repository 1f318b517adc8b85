package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class SubroutineDef extends Node {

    private final String name;
    private final List<Parameter> parameters;
    private final List<Node> body;

    public SubroutineDef(String name, List<Parameter> parameters, List<? extends Node> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        this.body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public String name() {
        return name;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<Node> body() {
        return body;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSubroutineDef(this);
    }

    @Override
    public String type() {
        return "SubroutineDef";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, parameters, body);
    }
}
