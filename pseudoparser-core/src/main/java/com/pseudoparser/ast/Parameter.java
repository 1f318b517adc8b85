package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Subroutine parameter. Dimensions are only present for
 * {@link ParameterType#ARRAY} and the class name only for
 * {@link ParameterType#OBJECT}.
 */
public final class Parameter extends Node {

    private final String name;
    private final ParameterType parameterType;
    private final List<Node> dimensions;  // Can be null
    private final String className;  // Can be null

    public Parameter(
        String name,
        ParameterType parameterType,
        List<? extends Node> dimensions,
        String className
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameterType = Objects.requireNonNull(parameterType, "parameterType");
        this.dimensions = dimensions == null ? null : List.copyOf(dimensions);
        this.className = className;
        if ((parameterType == ParameterType.ARRAY) != (dimensions != null)) {
            throw new IllegalArgumentException("Dimensions must be given for array parameters only: " + name);
        }
        if ((parameterType == ParameterType.OBJECT) != (className != null)) {
            throw new IllegalArgumentException("Class name must be given for object parameters only: " + name);
        }
    }

    public String name() {
        return name;
    }

    public ParameterType parameterType() {
        return parameterType;
    }

    public Optional<List<Node>> dimensions() {
        return Optional.ofNullable(dimensions);
    }

    public Optional<String> className() {
        return Optional.ofNullable(className);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public String type() {
        return "Parameter";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, parameterType, dimensions(), className());
    }
}
