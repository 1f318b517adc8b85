package com.pseudoparser.ast;

import java.util.List;
import java.util.Optional;

/**
 * Visitor that walks every child of every node in declaration order and does
 * nothing else. All methods return {@code null}.
 *
 * <p>Partial analyses override the kinds they care about and call
 * {@code super} to keep descending.</p>
 */
public class DefaultNodeVisitor<R> implements NodeVisitor<R> {

    protected void visitAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            node.accept(this);
        }
    }

    protected void visitOptional(Optional<? extends Node> node) {
        node.ifPresent(n -> n.accept(this));
    }

    @Override
    public R visitProgram(Program node) {
        visitAll(node.statements());
        return null;
    }

    @Override
    public R visitComment(Comment node) {
        return null;
    }

    @Override
    public R visitNumberLiteral(NumberLiteral node) {
        return null;
    }

    @Override
    public R visitStringLiteral(StringLiteral node) {
        return null;
    }

    @Override
    public R visitBoolLiteral(BoolLiteral node) {
        return null;
    }

    @Override
    public R visitNullLiteral(NullLiteral node) {
        return null;
    }

    @Override
    public R visitVar(Var node) {
        return null;
    }

    @Override
    public R visitVarDecl(VarDecl node) {
        visitAll(node.items());
        return null;
    }

    @Override
    public R visitArrayVarDecl(ArrayVarDecl node) {
        visitAll(node.dimensions());
        return null;
    }

    @Override
    public R visitObjectVarDecl(ObjectVarDecl node) {
        return null;
    }

    @Override
    public R visitGraphVarDecl(GraphVarDecl node) {
        return null;
    }

    @Override
    public R visitClassDef(ClassDef node) {
        return null;
    }

    @Override
    public R visitSubroutineDef(SubroutineDef node) {
        visitAll(node.parameters());
        visitAll(node.body());
        return null;
    }

    @Override
    public R visitParameter(Parameter node) {
        node.dimensions().ifPresent(this::visitAll);
        return null;
    }

    @Override
    public R visitAssignment(Assignment node) {
        node.target().accept(this);
        node.value().accept(this);
        return null;
    }

    @Override
    public R visitVarTarget(VarTarget node) {
        return null;
    }

    @Override
    public R visitArrayTarget(ArrayTarget node) {
        visitAll(node.indices());
        return null;
    }

    @Override
    public R visitFieldTarget(FieldTarget node) {
        return null;
    }

    @Override
    public R visitForLoop(ForLoop node) {
        node.start().accept(this);
        node.end().accept(this);
        visitAll(node.body());
        return null;
    }

    @Override
    public R visitWhileLoop(WhileLoop node) {
        node.condition().accept(this);
        visitAll(node.body());
        return null;
    }

    @Override
    public R visitRepeatUntil(RepeatUntil node) {
        visitAll(node.body());
        node.condition().accept(this);
        return null;
    }

    @Override
    public R visitIfElse(IfElse node) {
        node.condition().accept(this);
        visitAll(node.thenBranch());
        visitAll(node.elseBranch());
        return null;
    }

    @Override
    public R visitCallStmt(CallStmt node) {
        visitAll(node.args());
        return null;
    }

    @Override
    public R visitCallMethod(CallMethod node) {
        node.receiver().accept(this);
        visitAll(node.args());
        return null;
    }

    @Override
    public R visitReturnStmt(ReturnStmt node) {
        visitOptional(node.value());
        return null;
    }

    @Override
    public R visitArrayAccess(ArrayAccess node) {
        node.array().accept(this);
        visitAll(node.indices());
        return null;
    }

    @Override
    public R visitArraySlice(ArraySlice node) {
        node.array().accept(this);
        for (IndexRange range : node.ranges()) {
            visitOptional(range.start());
            visitOptional(range.end());
        }
        return null;
    }

    @Override
    public R visitFieldAccess(FieldAccess node) {
        node.object().accept(this);
        return null;
    }

    @Override
    public R visitFuncCallExpr(FuncCallExpr node) {
        node.callee().accept(this);
        visitAll(node.args());
        return null;
    }

    @Override
    public R visitBinOp(BinOp node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public R visitShortCircuitBinOp(ShortCircuitBinOp node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public R visitUnOp(UnOp node) {
        node.operand().accept(this);
        return null;
    }

    @Override
    public R visitLengthFunction(LengthFunction node) {
        node.array().accept(this);
        return null;
    }

    @Override
    public R visitCeilFunction(CeilFunction node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public R visitFloorFunction(FloorFunction node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public R visitStrlenFunction(StrlenFunction node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public R visitConcatFunction(ConcatFunction node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public R visitSubstringFunction(SubstringFunction node) {
        node.string().accept(this);
        node.start().accept(this);
        node.length().accept(this);
        return null;
    }

    @Override
    public R visitAddNodeFunction(AddNodeFunction node) {
        node.node().accept(this);
        return null;
    }

    @Override
    public R visitAddEdgeFunction(AddEdgeFunction node) {
        node.from().accept(this);
        node.to().accept(this);
        return null;
    }

    @Override
    public R visitNeighborsFunction(NeighborsFunction node) {
        node.node().accept(this);
        return null;
    }

    @Override
    public R visitNewObject(NewObject node) {
        return null;
    }

    @Override
    public R visitNewGraph(NewGraph node) {
        return null;
    }

    @Override
    public R visitGraphOperation(GraphOperation node) {
        visitAll(node.nodes());
        return null;
    }

    @Override
    public R visitGraphTraversal(GraphTraversal node) {
        node.start().accept(this);
        node.end().accept(this);
        return null;
    }
}
