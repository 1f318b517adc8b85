package com.pseudoparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import com.pseudoparser.ast.NodeVisitor;
import com.pseudoparser.ast.NullLiteral;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.ObjectVarDecl;
import com.pseudoparser.ast.Parameter;
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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Converts an AST into a Jackson tree. Field names follow the node accessors;
 * absent optional values are written as JSON {@code null}.
 */
public class AstJsonWriter implements NodeVisitor<ObjectNode> {

    private final JsonNodeFactory factory;

    public AstJsonWriter() {
        this(JsonNodeFactory.instance);
    }

    public AstJsonWriter(JsonNodeFactory factory) {
        this.factory = factory;
    }

    public ObjectNode write(Node node) {
        ObjectNode json = node.accept(this);
        node.position().ifPresent(position -> json.set("loc", loc(position)));
        return json;
    }

    // ==================== Program, comments, literals, names ====================

    @Override
    public ObjectNode visitProgram(Program node) {
        ObjectNode json = object(node);
        json.set("statements", array(node.statements()));
        return json;
    }

    @Override
    public ObjectNode visitComment(Comment node) {
        return object(node).put("text", node.text());
    }

    @Override
    public ObjectNode visitNumberLiteral(NumberLiteral node) {
        ObjectNode json = object(node);
        json.set("value", number(node.value()));
        return json;
    }

    @Override
    public ObjectNode visitStringLiteral(StringLiteral node) {
        return object(node).put("value", node.value());
    }

    @Override
    public ObjectNode visitBoolLiteral(BoolLiteral node) {
        return object(node).put("value", node.value());
    }

    @Override
    public ObjectNode visitNullLiteral(NullLiteral node) {
        return object(node);
    }

    @Override
    public ObjectNode visitVar(Var node) {
        return object(node).put("name", node.name());
    }

    // ==================== Declarations ====================

    @Override
    public ObjectNode visitVarDecl(VarDecl node) {
        ObjectNode json = object(node);
        json.set("items", array(node.items()));
        return json;
    }

    @Override
    public ObjectNode visitArrayVarDecl(ArrayVarDecl node) {
        ObjectNode json = object(node).put("name", node.name());
        json.set("dimensions", array(node.dimensions()));
        return json;
    }

    @Override
    public ObjectNode visitObjectVarDecl(ObjectVarDecl node) {
        return object(node)
            .put("className", node.className())
            .put("name", node.name());
    }

    @Override
    public ObjectNode visitGraphVarDecl(GraphVarDecl node) {
        return object(node).put("name", node.name());
    }

    @Override
    public ObjectNode visitClassDef(ClassDef node) {
        ObjectNode json = object(node).put("name", node.name());
        ArrayNode fields = json.putArray("fieldNames");
        node.fieldNames().forEach(fields::add);
        return json;
    }

    @Override
    public ObjectNode visitSubroutineDef(SubroutineDef node) {
        ObjectNode json = object(node).put("name", node.name());
        json.set("parameters", array(node.parameters()));
        json.set("body", array(node.body()));
        return json;
    }

    @Override
    public ObjectNode visitParameter(Parameter node) {
        ObjectNode json = object(node)
            .put("name", node.name())
            .put("parameterType", node.parameterType().name());
        json.set("dimensions", node.dimensions().<JsonNode>map(this::array).orElse(factory.nullNode()));
        json.put("className", node.className().orElse(null));
        return json;
    }

    // ==================== Assignment ====================

    @Override
    public ObjectNode visitAssignment(Assignment node) {
        ObjectNode json = object(node);
        json.set("target", write(node.target()));
        json.set("value", write(node.value()));
        return json;
    }

    @Override
    public ObjectNode visitVarTarget(VarTarget node) {
        return object(node).put("name", node.name());
    }

    @Override
    public ObjectNode visitArrayTarget(ArrayTarget node) {
        ObjectNode json = object(node).put("name", node.name());
        json.set("indices", array(node.indices()));
        return json;
    }

    @Override
    public ObjectNode visitFieldTarget(FieldTarget node) {
        return object(node)
            .put("object", node.object())
            .put("field", node.field());
    }

    // ==================== Control flow ====================

    @Override
    public ObjectNode visitForLoop(ForLoop node) {
        ObjectNode json = object(node).put("variable", node.variable().orElse(null));
        json.set("start", write(node.start()));
        json.set("end", write(node.end()));
        json.set("body", array(node.body()));
        json.put("preserveCounter", node.preserveCounter());
        return json;
    }

    @Override
    public ObjectNode visitWhileLoop(WhileLoop node) {
        ObjectNode json = object(node);
        json.set("condition", write(node.condition()));
        json.set("body", array(node.body()));
        return json;
    }

    @Override
    public ObjectNode visitRepeatUntil(RepeatUntil node) {
        ObjectNode json = object(node);
        json.set("body", array(node.body()));
        json.set("condition", write(node.condition()));
        return json;
    }

    @Override
    public ObjectNode visitIfElse(IfElse node) {
        ObjectNode json = object(node);
        json.set("condition", write(node.condition()));
        json.set("thenBranch", array(node.thenBranch()));
        json.set("elseBranch", array(node.elseBranch()));
        return json;
    }

    // ==================== Calls and access ====================

    @Override
    public ObjectNode visitCallStmt(CallStmt node) {
        ObjectNode json = object(node).put("name", node.name());
        json.set("args", array(node.args()));
        return json;
    }

    @Override
    public ObjectNode visitCallMethod(CallMethod node) {
        ObjectNode json = object(node);
        json.set("receiver", write(node.receiver()));
        json.put("method", node.method());
        json.set("args", array(node.args()));
        return json;
    }

    @Override
    public ObjectNode visitReturnStmt(ReturnStmt node) {
        ObjectNode json = object(node);
        json.set("value", optional(node.value()));
        return json;
    }

    @Override
    public ObjectNode visitArrayAccess(ArrayAccess node) {
        ObjectNode json = object(node);
        json.set("array", write(node.array()));
        json.set("indices", array(node.indices()));
        return json;
    }

    @Override
    public ObjectNode visitArraySlice(ArraySlice node) {
        ObjectNode json = object(node);
        json.set("array", write(node.array()));
        ArrayNode ranges = json.putArray("ranges");
        for (IndexRange range : node.ranges()) {
            ObjectNode r = ranges.addObject();
            r.set("start", optional(range.start()));
            r.set("end", optional(range.end()));
        }
        return json;
    }

    @Override
    public ObjectNode visitFieldAccess(FieldAccess node) {
        ObjectNode json = object(node);
        json.set("object", write(node.object()));
        json.put("field", node.field());
        return json;
    }

    @Override
    public ObjectNode visitFuncCallExpr(FuncCallExpr node) {
        ObjectNode json = object(node);
        json.set("callee", write(node.callee()));
        json.set("args", array(node.args()));
        return json;
    }

    // ==================== Operators ====================

    @Override
    public ObjectNode visitBinOp(BinOp node) {
        ObjectNode json = object(node).put("operator", node.operator());
        json.set("left", write(node.left()));
        json.set("right", write(node.right()));
        json.put("shortCircuit", node.shortCircuit());
        return json;
    }

    @Override
    public ObjectNode visitShortCircuitBinOp(ShortCircuitBinOp node) {
        ObjectNode json = object(node).put("operator", node.operator());
        json.set("left", write(node.left()));
        json.set("right", write(node.right()));
        return json;
    }

    @Override
    public ObjectNode visitUnOp(UnOp node) {
        ObjectNode json = object(node).put("operator", node.operator());
        json.set("operand", write(node.operand()));
        return json;
    }

    // ==================== Built-in functions ====================

    @Override
    public ObjectNode visitLengthFunction(LengthFunction node) {
        ObjectNode json = object(node);
        json.set("array", write(node.array()));
        return json;
    }

    @Override
    public ObjectNode visitCeilFunction(CeilFunction node) {
        ObjectNode json = object(node);
        json.set("expression", write(node.expression()));
        return json;
    }

    @Override
    public ObjectNode visitFloorFunction(FloorFunction node) {
        ObjectNode json = object(node);
        json.set("expression", write(node.expression()));
        return json;
    }

    @Override
    public ObjectNode visitStrlenFunction(StrlenFunction node) {
        ObjectNode json = object(node);
        json.set("expression", write(node.expression()));
        return json;
    }

    @Override
    public ObjectNode visitConcatFunction(ConcatFunction node) {
        ObjectNode json = object(node);
        json.set("left", write(node.left()));
        json.set("right", write(node.right()));
        return json;
    }

    @Override
    public ObjectNode visitSubstringFunction(SubstringFunction node) {
        ObjectNode json = object(node);
        json.set("string", write(node.string()));
        json.set("start", write(node.start()));
        json.set("length", write(node.length()));
        return json;
    }

    @Override
    public ObjectNode visitAddNodeFunction(AddNodeFunction node) {
        ObjectNode json = object(node).put("graph", node.graph());
        json.set("node", write(node.node()));
        return json;
    }

    @Override
    public ObjectNode visitAddEdgeFunction(AddEdgeFunction node) {
        ObjectNode json = object(node).put("graph", node.graph());
        json.set("from", write(node.from()));
        json.set("to", write(node.to()));
        return json;
    }

    @Override
    public ObjectNode visitNeighborsFunction(NeighborsFunction node) {
        ObjectNode json = object(node).put("graph", node.graph());
        json.set("node", write(node.node()));
        return json;
    }

    @Override
    public ObjectNode visitNewObject(NewObject node) {
        return object(node).put("className", node.className());
    }

    @Override
    public ObjectNode visitNewGraph(NewGraph node) {
        return object(node);
    }

    // ==================== Graph statements ====================

    @Override
    public ObjectNode visitGraphOperation(GraphOperation node) {
        ObjectNode json = object(node).put("graph", node.graph());
        json.set("nodes", array(node.nodes()));
        return json;
    }

    @Override
    public ObjectNode visitGraphTraversal(GraphTraversal node) {
        ObjectNode json = object(node).put("graph", node.graph());
        json.set("start", write(node.start()));
        json.set("end", write(node.end()));
        return json;
    }

    // ==================== Helpers ====================

    private ObjectNode object(Node node) {
        ObjectNode json = factory.objectNode();
        json.put("type", node.type());
        return json;
    }

    private ArrayNode array(List<? extends Node> nodes) {
        ArrayNode json = factory.arrayNode(nodes.size());
        for (Node node : nodes) {
            json.add(write(node));
        }
        return json;
    }

    private JsonNode optional(Optional<? extends Node> node) {
        if (node.isPresent()) {
            return write(node.get());
        }
        return factory.nullNode();
    }

    private JsonNode number(Number value) {
        if (value instanceof Integer i) {
            return factory.numberNode(i);
        }
        if (value instanceof Long l) {
            return factory.numberNode(l);
        }
        if (value instanceof Double d) {
            return factory.numberNode(d);
        }
        if (value instanceof BigInteger big) {
            return factory.numberNode(big);
        }
        return factory.numberNode(new BigDecimal(value.toString()));
    }

    private ObjectNode loc(SourcePosition position) {
        ObjectNode loc = factory.objectNode();
        loc.put("line", position.line());
        loc.put("column", position.column());
        loc.put("endLine", position.endLine());
        loc.put("endColumn", position.endColumn());
        loc.put("filename", position.filename());
        return loc;
    }
}
