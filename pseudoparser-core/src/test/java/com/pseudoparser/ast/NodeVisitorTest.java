package com.pseudoparser.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NodeVisitorTest {

    @SuppressWarnings("unchecked")
    private static final NodeVisitor<String> METHOD_NAMES = (NodeVisitor<String>) Proxy.newProxyInstance(
        NodeVisitor.class.getClassLoader(),
        new Class<?>[]{NodeVisitor.class},
        (proxy, method, args) -> method.getName());

    @Test
    @DisplayName("Samples cover every node kind")
    void testSamplesCoverAllKinds() {
        Set<Class<?>> sampled = new HashSet<>();
        for (Node node : SampleNodes.all()) {
            sampled.add(node.getClass());
        }
        assertEquals(Set.of(Node.class.getPermittedSubclasses()), sampled);
        assertEquals(45, sampled.size());
    }

    @Test
    @DisplayName("accept calls exactly the matching visit method")
    void testAcceptDispatch() {
        for (Node node : SampleNodes.all()) {
            assertEquals("visit" + node.type(), node.accept(METHOD_NAMES), "dispatch of " + node.type());
        }
    }

    @Test
    @DisplayName("Default visitor returns null for every kind")
    void testDefaultVisitorReturnsNull() {
        DefaultNodeVisitor<String> visitor = new DefaultNodeVisitor<>();
        for (Node node : SampleNodes.all()) {
            assertNull(node.accept(visitor), node.type());
        }
    }

    @Test
    @DisplayName("Default traversal orders: if, repeat and for")
    void testDefaultTraversalOrder() {
        NameRecorder recorder = new NameRecorder();

        new IfElse(
            new Var("cond"),
            List.of(new CallStmt("t", List.of(new Var("then")))),
            List.of(new CallStmt("e", List.of(new Var("else"))))
        ).accept(recorder);
        assertEquals(List.of("cond", "then", "else"), recorder.names);

        recorder.names.clear();
        new RepeatUntil(List.of(new CallStmt("p", List.of(new Var("body")))), new Var("cond")).accept(recorder);
        assertEquals(List.of("body", "cond"), recorder.names);

        recorder.names.clear();
        new ForLoop("i", new Var("start"), new Var("end"), List.of(new CallStmt("p", List.of(new Var("body")))))
            .accept(recorder);
        assertEquals(List.of("start", "end", "body"), recorder.names);
    }

    @Test
    @DisplayName("Default traversal reaches slice bounds and optional children")
    void testDefaultTraversalReachesOptionals() {
        NameRecorder recorder = new NameRecorder();
        new ArraySlice(new Var("a"), List.of(IndexRange.of(new Var("lo"), new Var("hi")), IndexRange.openEnd(new Var("k"))))
            .accept(recorder);
        assertEquals(List.of("a", "lo", "hi", "k"), recorder.names);

        recorder.names.clear();
        new ReturnStmt(new Var("r")).accept(recorder);
        new ReturnStmt(null).accept(recorder);
        assertEquals(List.of("r"), recorder.names);

        recorder.names.clear();
        new SubroutineDef("f",
            List.of(new Parameter("A", ParameterType.ARRAY, List.of(new Var("n")), null)),
            List.of(new ReturnStmt(new Var("x")))
        ).accept(recorder);
        assertEquals(List.of("n", "x"), recorder.names);
    }

    @Test
    @DisplayName("Default traversal visits comments inside nested bodies")
    void testDefaultTraversalVisitsComments() {
        List<String> texts = new ArrayList<>();
        DefaultNodeVisitor<Void> collector = new DefaultNodeVisitor<>() {
            @Override
            public Void visitComment(Comment node) {
                texts.add(node.text());
                return null;
            }
        };
        new Program(List.of(
            new Comment("top"),
            new WhileLoop(new Var("x"), List.of(new Comment("inner"), new CallStmt("p", List.of()))),
            new Comment("end")
        )).accept(collector);
        assertEquals(List.of("top", "inner", "end"), texts);
    }

    private static final class NameRecorder extends DefaultNodeVisitor<Void> {
        final List<String> names = new ArrayList<>();

        @Override
        public Void visitVar(Var node) {
            names.add(node.name());
            return super.visitVar(node);
        }
    }
}
