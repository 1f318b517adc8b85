package com.pseudoparser;

import com.pseudoparser.ast.CallStmt;
import com.pseudoparser.ast.DefaultNodeVisitor;
import com.pseudoparser.ast.ForLoop;
import com.pseudoparser.ast.FuncCallExpr;
import com.pseudoparser.ast.Metadata;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.RepeatUntil;
import com.pseudoparser.ast.SubroutineDef;
import com.pseudoparser.ast.WhileLoop;

/**
 * Records recursion and loop nesting hints on a {@link SubroutineDef}.
 *
 * <p>Only the definition's own body is inspected; nested definitions are
 * analyzed when they are built.</p>
 */
public class SubroutineAnalyzer {

    public static final String MAX_LOOP_DEPTH = "maxLoopDepth";

    public void analyze(SubroutineDef def) {
        BodyScanner scanner = new BodyScanner(def.name());
        for (Node statement : def.body()) {
            statement.accept(scanner);
        }
        Metadata metadata = def.getOrCreateMetadata();
        metadata.setRecursive(scanner.selfCall);
        metadata.putComplexityHint(MAX_LOOP_DEPTH, scanner.maxDepth);
    }

    private static final class BodyScanner extends DefaultNodeVisitor<Void> {

        private final String name;
        private boolean selfCall;
        private int depth;
        private int maxDepth;

        BodyScanner(String name) {
            this.name = name;
        }

        @Override
        public Void visitSubroutineDef(SubroutineDef node) {
            return null;
        }

        @Override
        public Void visitCallStmt(CallStmt node) {
            if (node.name().equals(name)) {
                selfCall = true;
            }
            return super.visitCallStmt(node);
        }

        @Override
        public Void visitFuncCallExpr(FuncCallExpr node) {
            if (node.name().filter(name::equals).isPresent()) {
                selfCall = true;
            }
            return super.visitFuncCallExpr(node);
        }

        @Override
        public Void visitForLoop(ForLoop node) {
            enter();
            super.visitForLoop(node);
            depth--;
            return null;
        }

        @Override
        public Void visitWhileLoop(WhileLoop node) {
            enter();
            super.visitWhileLoop(node);
            depth--;
            return null;
        }

        @Override
        public Void visitRepeatUntil(RepeatUntil node) {
            enter();
            super.visitRepeatUntil(node);
            depth--;
            return null;
        }

        private void enter() {
            depth++;
            maxDepth = Math.max(maxDepth, depth);
        }
    }
}
