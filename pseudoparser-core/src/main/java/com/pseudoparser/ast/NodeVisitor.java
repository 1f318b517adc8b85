package com.pseudoparser.ast;

/**
 * Double-dispatch visitor over the node catalogue. There is one method per
 * node kind, so a visitor that misses a kind does not compile.
 *
 * <p>Extend {@link DefaultNodeVisitor} to handle only some kinds and let the
 * rest be traversed.</p>
 *
 * @param <R> result type of the visit methods
 */
public interface NodeVisitor<R> {

    // Root
    R visitProgram(Program node);
    R visitComment(Comment node);

    // Literals
    R visitNumberLiteral(NumberLiteral node);
    R visitStringLiteral(StringLiteral node);
    R visitBoolLiteral(BoolLiteral node);
    R visitNullLiteral(NullLiteral node);
    R visitVar(Var node);

    // Declarations
    R visitVarDecl(VarDecl node);
    R visitArrayVarDecl(ArrayVarDecl node);
    R visitObjectVarDecl(ObjectVarDecl node);
    R visitGraphVarDecl(GraphVarDecl node);
    R visitClassDef(ClassDef node);
    R visitSubroutineDef(SubroutineDef node);
    R visitParameter(Parameter node);

    // Assignment and targets
    R visitAssignment(Assignment node);
    R visitVarTarget(VarTarget node);
    R visitArrayTarget(ArrayTarget node);
    R visitFieldTarget(FieldTarget node);

    // Control flow
    R visitForLoop(ForLoop node);
    R visitWhileLoop(WhileLoop node);
    R visitRepeatUntil(RepeatUntil node);
    R visitIfElse(IfElse node);

    // Calls and access
    R visitCallStmt(CallStmt node);
    R visitCallMethod(CallMethod node);
    R visitReturnStmt(ReturnStmt node);
    R visitArrayAccess(ArrayAccess node);
    R visitArraySlice(ArraySlice node);
    R visitFieldAccess(FieldAccess node);
    R visitFuncCallExpr(FuncCallExpr node);

    // Operators
    R visitBinOp(BinOp node);
    R visitShortCircuitBinOp(ShortCircuitBinOp node);
    R visitUnOp(UnOp node);

    // Built-ins
    R visitLengthFunction(LengthFunction node);
    R visitCeilFunction(CeilFunction node);
    R visitFloorFunction(FloorFunction node);
    R visitStrlenFunction(StrlenFunction node);
    R visitConcatFunction(ConcatFunction node);
    R visitSubstringFunction(SubstringFunction node);
    R visitAddNodeFunction(AddNodeFunction node);
    R visitAddEdgeFunction(AddEdgeFunction node);
    R visitNeighborsFunction(NeighborsFunction node);
    R visitNewObject(NewObject node);
    R visitNewGraph(NewGraph node);

    // Graph statements
    R visitGraphOperation(GraphOperation node);
    R visitGraphTraversal(GraphTraversal node);
}
