package com.pseudoparser;

import com.pseudoparser.ast.ArrayTarget;
import com.pseudoparser.ast.ArrayVarDecl;
import com.pseudoparser.ast.AddEdgeFunction;
import com.pseudoparser.ast.AddNodeFunction;
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
import com.pseudoparser.ast.LengthFunction;
import com.pseudoparser.ast.NeighborsFunction;
import com.pseudoparser.ast.NewGraph;
import com.pseudoparser.ast.NewObject;
import com.pseudoparser.ast.Node;
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
import com.pseudoparser.builder.BinaryOperationHandler;
import com.pseudoparser.builder.ExpressionHandler;
import com.pseudoparser.builder.IndexerProcessor;
import com.pseudoparser.builder.ParameterProcessor;
import com.pseudoparser.builder.TokenExtractor;
import com.pseudoparser.grammar.PseudoBaseVisitor;
import com.pseudoparser.grammar.PseudoParser;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single bottom-up pass from the ANTLR parse tree to the AST.
 *
 * <p>Every production either builds its node directly from the typed context
 * accessors, or collects its children as a flat item list (tokens plus already
 * built values) and hands them to one of the builders. Positions are attached
 * with {@link #ast(Node, ParserRuleContext)}, which never overwrites a position
 * that a lower production already set.</p>
 *
 * <p>When the token stream is available, comments on the hidden channel that
 * stand between statements of a block (or of the program) become
 * {@link Comment} statements in place. Comments anywhere else are dropped.</p>
 *
 * <p>Instances keep loop nesting state and must not be shared between
 * threads.</p>
 */
public class AstTransformer extends PseudoBaseVisitor<Object> {

    private final ParserSettings settings;
    private final String sourceName;  // Can be null
    private final BufferedTokenStream tokenStream;  // Can be null

    private final TokenExtractor tokens = new TokenExtractor();
    private final IndexerProcessor indexers = new IndexerProcessor();
    private final BinaryOperationHandler binaryOperations;
    private final ExpressionHandler expressions;
    private final ParameterProcessor parameters;
    private final SubroutineAnalyzer subroutineAnalyzer = new SubroutineAnalyzer();

    private int loopDepth;

    public AstTransformer(ParserSettings settings, String sourceName) {
        this(settings, sourceName, null);
    }

    public AstTransformer(ParserSettings settings, String sourceName, BufferedTokenStream tokenStream) {
        this.settings = settings;
        this.sourceName = sourceName;
        this.tokenStream = tokenStream;
        this.binaryOperations = new BinaryOperationHandler(tokens, settings.isDedicatedShortCircuitNodes());
        this.expressions = new ExpressionHandler(tokens);
        this.parameters = new ParameterProcessor(tokens);
    }

    public Program transform(PseudoParser.ProgramContext ctx) {
        loopDepth = 0;
        return (Program) visit(ctx);
    }

    /// PROGRAM STRUCTURE

    @Override
    public Program visitProgram(PseudoParser.ProgramContext ctx) {
        List<Node> statements = statements(ctx.statement(), ctx.EOF().getSymbol());
        Program program = new Program(statements);
        if (statements.isEmpty()) {
            return ast(program, ctx);
        }
        // EOF stands after any trailing whitespace, so span the statements instead
        Optional<SourcePosition> first = statements.get(0).position();
        Optional<SourcePosition> last = statements.get(statements.size() - 1).position();
        if (settings.isPropagatePositions() && first.isPresent() && last.isPresent()) {
            program.setPosition(first.get().span(last.get()));
        }
        return program;
    }

    private List<Node> block(PseudoParser.BlockContext ctx) {
        return statements(ctx.statement(), ctx.RBRACE().getSymbol());
    }

    private List<Node> statements(List<PseudoParser.StatementContext> contexts, Token closing) {
        List<Node> result = new ArrayList<>(contexts.size());
        for (PseudoParser.StatementContext statement : contexts) {
            comments(statement.getStart(), result);
            result.add(node(statement));
        }
        comments(closing, result);
        return result;
    }

    /// COMMENTS

    /**
     * Adds the comments found between the previous default channel token and
     * {@code token}.
     */
    private void comments(Token token, List<Node> result) {
        if (tokenStream == null || !settings.isRetainComments() || token.getTokenIndex() < 0) {
            return;
        }
        List<Token> hidden = tokenStream.getHiddenTokensToLeft(token.getTokenIndex(), Token.HIDDEN_CHANNEL);
        if (hidden == null) {
            return;
        }
        for (Token comment : hidden) {
            result.add(ast(new Comment(tokens.extractCommentText(comment)), comment, comment));
        }
    }

    /// DECLARATIONS

    @Override
    public ClassDef visitClassDef(PseudoParser.ClassDefContext ctx) {
        List<TerminalNode> ids = ctx.ID();
        List<String> fieldNames = new ArrayList<>(ids.size() - 1);
        for (TerminalNode id : ids.subList(1, ids.size())) {
            fieldNames.add(id.getText());
        }
        return ast(new ClassDef(ids.get(0).getText(), fieldNames), ctx);
    }

    @Override
    public SubroutineDef visitSubroutineDef(PseudoParser.SubroutineDefContext ctx) {
        List<Parameter> params = new ArrayList<>();
        for (PseudoParser.ParameterContext parameter : ctx.parameter()) {
            params.add((Parameter) visit(parameter));
        }

        // loops around a definition do not nest into its body
        int outerDepth = loopDepth;
        loopDepth = 0;
        List<Node> body;
        try {
            body = block(ctx.block());
        } finally {
            loopDepth = outerDepth;
        }

        SubroutineDef def = ast(new SubroutineDef(ctx.ID().getText(), params, body), ctx);
        if (settings.isCollectAnalysisHints()) {
            subroutineAnalyzer.analyze(def);
        }
        return def;
    }

    @Override
    public VarDecl visitVarDecl(PseudoParser.VarDeclContext ctx) {
        List<Node> items = new ArrayList<>();
        for (PseudoParser.VarItemContext item : ctx.varItem()) {
            items.add(node(item));
        }
        return ast(new VarDecl(items), ctx);
    }

    @Override
    public Node visitVarItem(PseudoParser.VarItemContext ctx) {
        VarTarget target = ast(new VarTarget(ctx.ID().getText()), ctx.ID());
        if (ctx.expression() == null) {
            return target;
        }
        return ast(new Assignment(target, node(ctx.expression())), ctx);
    }

    @Override
    public ArrayVarDecl visitArrayVarDecl(PseudoParser.ArrayVarDeclContext ctx) {
        return ast(new ArrayVarDecl(ctx.ID().getText(), nodes(ctx.expression())), ctx);
    }

    @Override
    public GraphVarDecl visitGraphVarDecl(PseudoParser.GraphVarDeclContext ctx) {
        return ast(new GraphVarDecl(ctx.ID().getText()), ctx);
    }

    @Override
    public ObjectVarDecl visitObjectVarDecl(PseudoParser.ObjectVarDeclContext ctx) {
        return ast(new ObjectVarDecl(ctx.ID(0).getText(), ctx.ID(1).getText()), ctx);
    }

    /// PARAMETERS

    @Override
    public Parameter visitSimpleParameter(PseudoParser.SimpleParameterContext ctx) {
        return ast(parameters.processSimpleParameter(items(ctx)), ctx);
    }

    @Override
    public Parameter visitArrayParameter(PseudoParser.ArrayParameterContext ctx) {
        return ast(parameters.processArrayParameter(items(ctx)), ctx);
    }

    @Override
    public Parameter visitObjectParameter(PseudoParser.ObjectParameterContext ctx) {
        return ast(parameters.processObjectParameter(items(ctx)), ctx);
    }

    @Override
    public Parameter visitGraphParameter(PseudoParser.GraphParameterContext ctx) {
        return ast(parameters.processGraphParameter(items(ctx)), ctx);
    }

    /// ASSIGNMENT

    @Override
    public Assignment visitAssignment(PseudoParser.AssignmentContext ctx) {
        return ast(new Assignment(node(ctx.target()), node(ctx.expression())), ctx);
    }

    @Override
    public VarTarget visitVarTarget(PseudoParser.VarTargetContext ctx) {
        return ast(new VarTarget(ctx.ID().getText()), ctx);
    }

    @Override
    public ArrayTarget visitArrayTarget(PseudoParser.ArrayTargetContext ctx) {
        return ast(new ArrayTarget(ctx.ID().getText(), nodes(ctx.expression())), ctx);
    }

    @Override
    public FieldTarget visitFieldTarget(PseudoParser.FieldTargetContext ctx) {
        return ast(new FieldTarget(ctx.ID(0).getText(), ctx.ID(1).getText()), ctx);
    }

    /// CONTROL FLOW

    @Override
    public ForLoop visitForLoop(PseudoParser.ForLoopContext ctx) {
        String variable = ctx.ASSIGN() != null ? ctx.ID().getText() : null;
        Node start = node(ctx.expression(0));
        Node end = node(ctx.expression(1));
        boolean preserveCounter = ctx.counterMode() == null || ctx.counterMode().RESET() == null;

        int depth = ++loopDepth;
        List<Node> body;
        try {
            body = block(ctx.block());
        } finally {
            loopDepth--;
        }
        return loop(ast(new ForLoop(variable, start, end, body, preserveCounter), ctx), depth);
    }

    @Override
    public WhileLoop visitWhileLoop(PseudoParser.WhileLoopContext ctx) {
        Node condition = node(ctx.expression());

        int depth = ++loopDepth;
        List<Node> body;
        try {
            body = block(ctx.block());
        } finally {
            loopDepth--;
        }
        return loop(ast(new WhileLoop(condition, body), ctx), depth);
    }

    @Override
    public RepeatUntil visitRepeatUntil(PseudoParser.RepeatUntilContext ctx) {
        int depth = ++loopDepth;
        List<Node> body;
        try {
            body = block(ctx.block());
        } finally {
            loopDepth--;
        }
        Node condition = node(ctx.expression());
        return loop(ast(new RepeatUntil(body, condition), ctx), depth);
    }

    private <T extends Node> T loop(T node, int depth) {
        if (settings.isCollectAnalysisHints()) {
            node.getOrCreateMetadata().setLoopDepth(depth);
        }
        return node;
    }

    @Override
    public IfElse visitIfElse(PseudoParser.IfElseContext ctx) {
        return (IfElse) visit(ctx.ifStatement());
    }

    @Override
    public IfElse visitIfStatement(PseudoParser.IfStatementContext ctx) {
        Node condition = node(ctx.expression());
        List<Node> thenBranch = block(ctx.block(0));
        List<Node> elseBranch;
        if (ctx.ifStatement() != null) {
            elseBranch = List.of(node(ctx.ifStatement()));
        } else if (ctx.block().size() > 1) {
            elseBranch = block(ctx.block(1));
        } else {
            elseBranch = List.of();
        }
        return ast(new IfElse(condition, thenBranch, elseBranch), ctx);
    }

    @Override
    public ReturnStmt visitReturnStmt(PseudoParser.ReturnStmtContext ctx) {
        Node value = ctx.expression() != null ? node(ctx.expression()) : null;
        return ast(new ReturnStmt(value), ctx);
    }

    /// GRAPHS

    @Override
    public GraphOperation visitGraphOperation(PseudoParser.GraphOperationContext ctx) {
        List<Node> nodes = ctx.argumentList() != null ? arguments(ctx.argumentList()) : List.of();
        return ast(new GraphOperation(ctx.ID().getText(), nodes), ctx);
    }

    @Override
    public GraphTraversal visitGraphTraversal(PseudoParser.GraphTraversalContext ctx) {
        return ast(new GraphTraversal(ctx.ID().getText(), node(ctx.expression(0)), node(ctx.expression(1))), ctx);
    }

    /// CALL STATEMENTS

    /**
     * A bare expression is only a statement when it ends in a call:
     * {@code f(x)} is a {@link CallStmt}, {@code obj.m(x)} a {@link CallMethod},
     * anything else that ends in a call stays a {@link FuncCallExpr}.
     */
    @Override
    public Node visitCallStatement(PseudoParser.CallStatementContext ctx) {
        Node expression = node(ctx.postfixExpression());
        if (!(expression instanceof FuncCallExpr call)) {
            SourcePosition position = position(ctx.getStart(), ctx.getStop());
            throw new ParsingException("Expression at " + position + " is not a statement: " + expression.type(),
                null, sourceName, position);
        }
        if (call.callee() instanceof Var callee) {
            return ast(new CallStmt(callee.name(), call.args()), ctx);
        }
        if (call.callee() instanceof FieldAccess access && access.object() instanceof Var) {
            return ast(new CallMethod(access.object(), access.field(), call.args()), ctx);
        }
        return call;
    }

    /// EXPRESSIONS

    @Override
    public Node visitExpression(PseudoParser.ExpressionContext ctx) {
        return node(ctx.orExpression());
    }

    @Override
    public Node visitOrExpression(PseudoParser.OrExpressionContext ctx) {
        return chain(ctx, ctx.andExpression());
    }

    @Override
    public Node visitAndExpression(PseudoParser.AndExpressionContext ctx) {
        return chain(ctx, ctx.notExpression());
    }

    @Override
    public UnOp visitLogicalNot(PseudoParser.LogicalNotContext ctx) {
        return ast(new UnOp("not", node(ctx.notExpression())), ctx);
    }

    @Override
    public Node visitComparisonExpression(PseudoParser.ComparisonExpressionContext ctx) {
        return node(ctx.comparison());
    }

    @Override
    public Node visitComparison(PseudoParser.ComparisonContext ctx) {
        return chain(ctx, ctx.additive());
    }

    @Override
    public Node visitAdditive(PseudoParser.AdditiveContext ctx) {
        return chain(ctx, ctx.multiplicative());
    }

    @Override
    public Node visitMultiplicative(PseudoParser.MultiplicativeContext ctx) {
        return chain(ctx, ctx.unary());
    }

    @Override
    public UnOp visitNegation(PseudoParser.NegationContext ctx) {
        return ast(new UnOp("-", node(ctx.unary())), ctx);
    }

    @Override
    public Node visitPowerExpression(PseudoParser.PowerExpressionContext ctx) {
        return node(ctx.power());
    }

    @Override
    public Node visitPower(PseudoParser.PowerContext ctx) {
        Node base = node(ctx.postfixExpression());
        if (ctx.CARET() == null) {
            return base;
        }
        return ast(binaryOperations.createBinaryOperation("^", base, node(ctx.unary())), ctx);
    }

    /**
     * Folds an operator chain and positions every intermediate node from the
     * first operand to the last operand it covers.
     */
    private Node chain(ParserRuleContext ctx, List<? extends ParserRuleContext> operands) {
        Node result = binaryOperations.processChain(items(ctx));
        Node current = result;
        for (int i = operands.size() - 1; i >= 1; i--) {
            ast(current, operands.get(0).getStart(), operands.get(i).getStop());
            current = leftOperand(current);
        }
        return result;
    }

    private static Node leftOperand(Node node) {
        if (node instanceof BinOp binOp) {
            return binOp.left();
        }
        if (node instanceof ShortCircuitBinOp binOp) {
            return binOp.left();
        }
        return node;
    }

    /// POSTFIX CHAINS

    @Override
    public Node visitPostfixExpression(PseudoParser.PostfixExpressionContext ctx) {
        Node result = node(ctx.primary());
        for (PseudoParser.SuffixContext suffix : ctx.suffix()) {
            result = ast(expressions.applySuffix(result, items(suffix)), ctx.getStart(), suffix.getStop());
        }
        return result;
    }

    @Override
    public List<Node> visitArgumentList(PseudoParser.ArgumentListContext ctx) {
        return arguments(ctx);
    }

    private List<Node> arguments(PseudoParser.ArgumentListContext ctx) {
        return nodes(ctx.expression());
    }

    @Override
    public Object visitRangeIndexer(PseudoParser.RangeIndexerContext ctx) {
        return indexers.processRange(node(ctx.expression(0)), node(ctx.expression(1)));
    }

    @Override
    public Object visitOpenStartIndexer(PseudoParser.OpenStartIndexerContext ctx) {
        return indexers.processOpenStart(node(ctx.expression()));
    }

    @Override
    public Object visitOpenEndIndexer(PseudoParser.OpenEndIndexerContext ctx) {
        return indexers.processOpenEnd(node(ctx.expression()));
    }

    @Override
    public Object visitOpenIndexer(PseudoParser.OpenIndexerContext ctx) {
        return indexers.processOpenBoth();
    }

    @Override
    public Object visitSingleIndexer(PseudoParser.SingleIndexerContext ctx) {
        return indexers.processSingle(node(ctx.expression()));
    }

    /// PRIMARY EXPRESSIONS

    @Override
    public NumberLiteral visitNumberLiteral(PseudoParser.NumberLiteralContext ctx) {
        return ast(new NumberLiteral((Number) tokens.extractValue(ctx.NUMBER())), ctx);
    }

    @Override
    public StringLiteral visitStringLiteral(PseudoParser.StringLiteralContext ctx) {
        return ast(new StringLiteral((String) tokens.extractValue(ctx.STRING())), ctx);
    }

    @Override
    public BoolLiteral visitBoolLiteral(PseudoParser.BoolLiteralContext ctx) {
        return ast(new BoolLiteral((Boolean) tokens.extractValue(ctx.getStart())), ctx);
    }

    @Override
    public NullLiteral visitNullLiteral(PseudoParser.NullLiteralContext ctx) {
        return ast(new NullLiteral(), ctx);
    }

    @Override
    public LengthFunction visitLengthCall(PseudoParser.LengthCallContext ctx) {
        return ast(new LengthFunction(node(ctx.expression())), ctx);
    }

    @Override
    public CeilFunction visitCeilCall(PseudoParser.CeilCallContext ctx) {
        return ast(new CeilFunction(node(ctx.expression())), ctx);
    }

    @Override
    public FloorFunction visitFloorCall(PseudoParser.FloorCallContext ctx) {
        return ast(new FloorFunction(node(ctx.expression())), ctx);
    }

    @Override
    public StrlenFunction visitStrlenCall(PseudoParser.StrlenCallContext ctx) {
        return ast(new StrlenFunction(node(ctx.expression())), ctx);
    }

    @Override
    public ConcatFunction visitConcatCall(PseudoParser.ConcatCallContext ctx) {
        return ast(new ConcatFunction(node(ctx.expression(0)), node(ctx.expression(1))), ctx);
    }

    @Override
    public SubstringFunction visitSubstringCall(PseudoParser.SubstringCallContext ctx) {
        return ast(new SubstringFunction(
            node(ctx.expression(0)),
            node(ctx.expression(1)),
            node(ctx.expression(2))), ctx);
    }

    @Override
    public AddNodeFunction visitAddNodeCall(PseudoParser.AddNodeCallContext ctx) {
        return ast(new AddNodeFunction(ctx.ID().getText(), node(ctx.expression())), ctx);
    }

    @Override
    public AddEdgeFunction visitAddEdgeCall(PseudoParser.AddEdgeCallContext ctx) {
        return ast(new AddEdgeFunction(ctx.ID().getText(), node(ctx.expression(0)), node(ctx.expression(1))), ctx);
    }

    @Override
    public NeighborsFunction visitNeighborsCall(PseudoParser.NeighborsCallContext ctx) {
        return ast(new NeighborsFunction(ctx.ID().getText(), node(ctx.expression())), ctx);
    }

    @Override
    public NewGraph visitNewGraph(PseudoParser.NewGraphContext ctx) {
        return ast(new NewGraph(), ctx);
    }

    @Override
    public NewObject visitNewObject(PseudoParser.NewObjectContext ctx) {
        return ast(new NewObject(ctx.ID().getText()), ctx);
    }

    @Override
    public Var visitVarReference(PseudoParser.VarReferenceContext ctx) {
        return ast(new Var(ctx.ID().getText()), ctx);
    }

    @Override
    public Node visitParenExpression(PseudoParser.ParenExpressionContext ctx) {
        return node(ctx.expression());
    }

    /// HELPERS

    private Node node(ParseTree tree) {
        Object result = visit(tree);
        if (result instanceof Node node) {
            return node;
        }
        throw new ValidationException("Expected a node for '" + tree.getText() + "' but got "
            + (result == null ? "nothing" : result.getClass().getSimpleName()));
    }

    private List<Node> nodes(List<? extends ParseTree> trees) {
        List<Node> result = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            result.add(node(tree));
        }
        return result;
    }

    /**
     * Children of {@code ctx} as builder items: terminals become their
     * {@link Token}, rule children their built value, with list values
     * flattened in place.
     */
    private List<Object> items(ParserRuleContext ctx) {
        List<Object> items = new ArrayList<>(ctx.getChildCount());
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof TerminalNode terminal) {
                items.add(terminal.getSymbol());
                continue;
            }
            Object value = visit(child);
            if (value instanceof List<?> values) {
                items.addAll(values);
            } else {
                items.add(value);
            }
        }
        return items;
    }

    private <T extends Node> T ast(T node, ParserRuleContext ctx) {
        return ast(node, ctx.getStart(), ctx.getStop());
    }

    private <T extends Node> T ast(T node, TerminalNode terminal) {
        return ast(node, terminal.getSymbol(), terminal.getSymbol());
    }

    private <T extends Node> T ast(T node, Token start, Token stop) {
        if (settings.isPropagatePositions() && node.position().isEmpty()) {
            node.setPosition(position(start, stop));
        }
        return node;
    }

    private SourcePosition position(Token start, Token stop) {
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            stop = start;
        }
        String text = stop.getType() == Token.EOF ? "" : stop.getText();
        int endLine = stop.getLine();
        int endColumn = stop.getCharPositionInLine() + text.length();
        int lastBreak = text.lastIndexOf('\n');
        if (lastBreak >= 0) {
            // block comments may span lines
            endLine += (int) text.chars().filter(c -> c == '\n').count();
            endColumn = text.length() - lastBreak - 1;
        }
        return new SourcePosition(
            start.getLine(),
            start.getCharPositionInLine() + 1,
            endLine,
            endColumn,
            sourceName);
    }
}
