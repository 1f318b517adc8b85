package com.pseudoparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.pseudoparser.ast.AddEdgeFunction;
import com.pseudoparser.ast.AddNodeFunction;
import com.pseudoparser.ast.ArrayAccess;
import com.pseudoparser.ast.ArraySlice;
import com.pseudoparser.ast.ArrayTarget;
import com.pseudoparser.ast.ArrayVarDecl;
import com.pseudoparser.ast.Assignment;
import com.pseudoparser.ast.BinOp;
import com.pseudoparser.ast.BoolLiteral;
import com.pseudoparser.ast.CallMethod;
import com.pseudoparser.ast.CallStmt;
import com.pseudoparser.ast.CeilFunction;
import com.pseudoparser.ast.ClassDef;
import com.pseudoparser.ast.Comment;
import com.pseudoparser.ast.ConcatFunction;
import com.pseudoparser.ast.FieldAccess;
import com.pseudoparser.ast.FieldTarget;
import com.pseudoparser.ast.FloorFunction;
import com.pseudoparser.ast.ForLoop;
import com.pseudoparser.ast.FuncCallExpr;
import com.pseudoparser.ast.GraphOperation;
import com.pseudoparser.ast.GraphTraversal;
import com.pseudoparser.ast.GraphVarDecl;
import com.pseudoparser.ast.IfElse;
import com.pseudoparser.ast.IndexRange;
import com.pseudoparser.ast.LengthFunction;
import com.pseudoparser.ast.NeighborsFunction;
import com.pseudoparser.ast.NewGraph;
import com.pseudoparser.ast.NewObject;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.NullLiteral;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.ObjectVarDecl;
import com.pseudoparser.ast.Parameter;
import com.pseudoparser.ast.ParameterType;
import com.pseudoparser.ast.Program;
import com.pseudoparser.ast.RepeatUntil;
import com.pseudoparser.ast.ReturnStmt;
import com.pseudoparser.ast.ShortCircuitBinOp;
import com.pseudoparser.ast.SourcePosition;
import com.pseudoparser.ast.StringLiteral;
import com.pseudoparser.ast.StrlenFunction;
import com.pseudoparser.ast.SubroutineDef;
import com.pseudoparser.ast.SubstringFunction;
import com.pseudoparser.ast.UnOp;
import com.pseudoparser.ast.Var;
import com.pseudoparser.ast.VarDecl;
import com.pseudoparser.ast.VarTarget;
import com.pseudoparser.ast.WhileLoop;
import com.pseudoparser.json.AstJsonException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds AST nodes from the tree written by {@link AstJsonWriter}.
 *
 * <p>Errors carry the JSON pointer of the offending value. Unknown fields are
 * ignored.</p>
 */
public class AstJsonReader {

    public Node read(JsonNode json) {
        return read(json, "");
    }

    private Node read(JsonNode json, String path) {
        if (json == null || !json.isObject()) {
            throw new AstJsonException("Expected an AST node object", path);
        }
        JsonNode typeNode = json.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new AstJsonException("Missing 'type' field", path);
        }
        String type = typeNode.asText();
        Node node;
        try {
            node = create(type, json, path);
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Invalid " + type + " at " + (path.isEmpty() ? "/" : path) + ": " + e.getMessage(), e);
        }
        JsonNode loc = json.get("loc");
        if (loc != null && !loc.isNull()) {
            node.setPosition(position(loc, path + "/loc"));
        }
        return node;
    }

    private Node create(String type, JsonNode json, String path) {
        return switch (type) {
            case "Program" -> new Program(nodes(json, "statements", path));
            case "Comment" -> new Comment(text(json, "text", path));
            case "NumberLiteral" -> new NumberLiteral(number(json, "value", path));
            case "StringLiteral" -> new StringLiteral(text(json, "value", path));
            case "BoolLiteral" -> new BoolLiteral(bool(json, "value", path));
            case "NullLiteral" -> new NullLiteral();
            case "Var" -> new Var(text(json, "name", path));
            case "VarDecl" -> new VarDecl(nodes(json, "items", path));
            case "ArrayVarDecl" -> new ArrayVarDecl(text(json, "name", path), nodes(json, "dimensions", path));
            case "ObjectVarDecl" -> new ObjectVarDecl(text(json, "className", path), text(json, "name", path));
            case "GraphVarDecl" -> new GraphVarDecl(text(json, "name", path));
            case "ClassDef" -> new ClassDef(text(json, "name", path), strings(json, "fieldNames", path));
            case "SubroutineDef" -> new SubroutineDef(
                text(json, "name", path),
                parameters(json, path),
                nodes(json, "body", path));
            case "Parameter" -> parameter(json, path);
            case "Assignment" -> new Assignment(node(json, "target", path), node(json, "value", path));
            case "VarTarget" -> new VarTarget(text(json, "name", path));
            case "ArrayTarget" -> new ArrayTarget(text(json, "name", path), nodes(json, "indices", path));
            case "FieldTarget" -> new FieldTarget(text(json, "object", path), text(json, "field", path));
            case "ForLoop" -> new ForLoop(
                optionalText(json, "variable", path),
                node(json, "start", path),
                node(json, "end", path),
                nodes(json, "body", path),
                bool(json, "preserveCounter", path));
            case "WhileLoop" -> new WhileLoop(node(json, "condition", path), nodes(json, "body", path));
            case "RepeatUntil" -> new RepeatUntil(nodes(json, "body", path), node(json, "condition", path));
            case "IfElse" -> new IfElse(
                node(json, "condition", path),
                nodes(json, "thenBranch", path),
                nodes(json, "elseBranch", path));
            case "CallStmt" -> new CallStmt(text(json, "name", path), nodes(json, "args", path));
            case "CallMethod" -> new CallMethod(
                node(json, "receiver", path),
                text(json, "method", path),
                nodes(json, "args", path));
            case "ReturnStmt" -> new ReturnStmt(optionalNode(json, "value", path).orElse(null));
            case "ArrayAccess" -> new ArrayAccess(node(json, "array", path), nodes(json, "indices", path));
            case "ArraySlice" -> new ArraySlice(node(json, "array", path), ranges(json, path));
            case "FieldAccess" -> new FieldAccess(node(json, "object", path), text(json, "field", path));
            case "FuncCallExpr" -> new FuncCallExpr(node(json, "callee", path), nodes(json, "args", path));
            case "BinOp" -> new BinOp(
                text(json, "operator", path),
                node(json, "left", path),
                node(json, "right", path),
                bool(json, "shortCircuit", path));
            case "ShortCircuitBinOp" -> new ShortCircuitBinOp(
                text(json, "operator", path),
                node(json, "left", path),
                node(json, "right", path));
            case "UnOp" -> new UnOp(text(json, "operator", path), node(json, "operand", path));
            case "LengthFunction" -> new LengthFunction(node(json, "array", path));
            case "CeilFunction" -> new CeilFunction(node(json, "expression", path));
            case "FloorFunction" -> new FloorFunction(node(json, "expression", path));
            case "StrlenFunction" -> new StrlenFunction(node(json, "expression", path));
            case "ConcatFunction" -> new ConcatFunction(node(json, "left", path), node(json, "right", path));
            case "SubstringFunction" -> new SubstringFunction(
                node(json, "string", path),
                node(json, "start", path),
                node(json, "length", path));
            case "AddNodeFunction" -> new AddNodeFunction(text(json, "graph", path), node(json, "node", path));
            case "AddEdgeFunction" -> new AddEdgeFunction(
                text(json, "graph", path),
                node(json, "from", path),
                node(json, "to", path));
            case "NeighborsFunction" -> new NeighborsFunction(text(json, "graph", path), node(json, "node", path));
            case "NewObject" -> new NewObject(text(json, "className", path));
            case "NewGraph" -> new NewGraph();
            case "GraphOperation" -> new GraphOperation(text(json, "graph", path), nodes(json, "nodes", path));
            case "GraphTraversal" -> new GraphTraversal(
                text(json, "graph", path),
                node(json, "start", path),
                node(json, "end", path));
            default -> throw new AstJsonException("Unknown node type '" + type + "'", path + "/type");
        };
    }

    private Parameter parameter(JsonNode json, String path) {
        String typeName = text(json, "parameterType", path);
        ParameterType parameterType;
        try {
            parameterType = ParameterType.valueOf(typeName);
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Unknown parameter type '" + typeName + "'", path + "/parameterType");
        }
        JsonNode dimensions = json.get("dimensions");
        List<Node> dims = dimensions == null || dimensions.isNull() ? null : nodes(json, "dimensions", path);
        return new Parameter(text(json, "name", path), parameterType, dims, optionalText(json, "className", path));
    }

    private List<Parameter> parameters(JsonNode json, String path) {
        List<Parameter> parameters = new ArrayList<>();
        for (Node node : nodes(json, "parameters", path)) {
            if (!(node instanceof Parameter parameter)) {
                throw new AstJsonException("Expected Parameter but found " + node.type(),
                    path + "/parameters/" + parameters.size());
            }
            parameters.add(parameter);
        }
        return parameters;
    }

    private List<IndexRange> ranges(JsonNode json, String path) {
        JsonNode array = array(json, "ranges", path);
        List<IndexRange> ranges = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode range = array.get(i);
            String rangePath = path + "/ranges/" + i;
            if (!range.isObject()) {
                throw new AstJsonException("Expected an index range object", rangePath);
            }
            ranges.add(new IndexRange(optionalNode(range, "start", rangePath), optionalNode(range, "end", rangePath)));
        }
        return ranges;
    }

    private SourcePosition position(JsonNode loc, String path) {
        if (!loc.isObject()) {
            throw new AstJsonException("Expected a location object", path);
        }
        try {
            return new SourcePosition(
                integer(loc, "line", path),
                integer(loc, "column", path),
                integer(loc, "endLine", path),
                integer(loc, "endColumn", path),
                optionalText(loc, "filename", path));
        } catch (IllegalArgumentException e) {
            throw new AstJsonException("Invalid location: " + e.getMessage(), path);
        }
    }

    // ==================== Field helpers ====================

    private JsonNode required(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new AstJsonException("Missing '" + field + "' field", path);
        }
        return value;
    }

    private Node node(JsonNode json, String field, String path) {
        return read(required(json, field, path), path + "/" + field);
    }

    private Optional<Node> optionalNode(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(read(value, path + "/" + field));
    }

    private JsonNode array(JsonNode json, String field, String path) {
        JsonNode value = required(json, field, path);
        if (!value.isArray()) {
            throw new AstJsonException("Expected an array", path + "/" + field);
        }
        return value;
    }

    private List<Node> nodes(JsonNode json, String field, String path) {
        JsonNode array = array(json, field, path);
        List<Node> nodes = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            nodes.add(read(array.get(i), path + "/" + field + "/" + i));
        }
        return nodes;
    }

    private List<String> strings(JsonNode json, String field, String path) {
        JsonNode array = array(json, field, path);
        List<String> strings = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode item = array.get(i);
            if (!item.isTextual()) {
                throw new AstJsonException("Expected a string", path + "/" + field + "/" + i);
            }
            strings.add(item.asText());
        }
        return strings;
    }

    private String text(JsonNode json, String field, String path) {
        JsonNode value = required(json, field, path);
        if (!value.isTextual()) {
            throw new AstJsonException("Expected a string", path + "/" + field);
        }
        return value.asText();
    }

    private String optionalText(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new AstJsonException("Expected a string", path + "/" + field);
        }
        return value.asText();
    }

    private boolean bool(JsonNode json, String field, String path) {
        JsonNode value = required(json, field, path);
        if (!value.isBoolean()) {
            throw new AstJsonException("Expected a boolean", path + "/" + field);
        }
        return value.booleanValue();
    }

    private int integer(JsonNode json, String field, String path) {
        JsonNode value = required(json, field, path);
        if (!value.isInt()) {
            throw new AstJsonException("Expected an integer", path + "/" + field);
        }
        return value.intValue();
    }

    private Number number(JsonNode json, String field, String path) {
        JsonNode value = required(json, field, path);
        if (value.isInt()) {
            return value.intValue();
        }
        if (value.isLong()) {
            return value.longValue();
        }
        if (value.isBigInteger()) {
            return value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        throw new AstJsonException("Expected a number", path + "/" + field);
    }
}
