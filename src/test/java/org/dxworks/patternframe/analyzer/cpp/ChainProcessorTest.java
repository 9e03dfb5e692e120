package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.model.ErrorKind;
import org.dxworks.patternframe.syntax.FakeSyntaxTree;
import org.dxworks.patternframe.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.dxworks.patternframe.syntax.FakeSyntaxTree.call;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.chain;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.comment;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.id;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.leaf;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.node;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.number;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.qualified;
import static org.dxworks.patternframe.syntax.FakeSyntaxTree.str;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChainProcessorTest {

    private static ChainProcessor processorFor(FakeSyntaxTree tree) {
        return processorFor(tree, new AccumulatorTracker(tree.source(), Set.of("StringBuilder"),
                UnresolvedAccumulatorPolicy.STRICT));
    }

    private static ChainProcessor processorFor(FakeSyntaxTree tree, AccumulatorTracker accumulators) {
        DuplicateGuard guard = new DuplicateGuard(tree.source(), 1000, 0.001);
        OperandClassifier classifier = new OperandClassifier(tree.source(),
                new LiteralNormalizer(tree.source(), guard), guard, Set.of("endl", "std::endl"));
        return new ChainProcessor(tree.source(), classifier, accumulators,
                Set.of("str::stream()", "std::stream()"), Set.of("std::cout", "std::cerr", "cout", "cerr"));
    }

    @Test
    void builderStartCallIsAnAnonymousSink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(call(qualified("str::stream")), str("Value is ")));
        Fragment fragment = processorFor(tree).process(tree.root());

        assertTrue(fragment.isPending());
        assertFalse(fragment.isNamed());
        assertEquals("Value is ", fragment.getText());
    }

    @Test
    void outputStreamIsAnAnonymousSink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(qualified("std::cerr"), id("code")));
        Fragment fragment = processorFor(tree).process(tree.root());

        assertTrue(fragment.isPending());
        assertNull(fragment.getSinkName());
        assertEquals("%s", fragment.getText());
    }

    @Test
    void unqualifiedOutputStreamIsAnAnonymousSink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("cout"), str("Hello there world"), id("endl")));
        Fragment fragment = processorFor(tree).process(tree.root());

        assertTrue(fragment.isPending());
        assertFalse(fragment.isNamed());
    }

    @Test
    void shiftOfAPlainVariableIsNotASink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("bits"), number("3")));
        assertSame(Fragment.NONE, processorFor(tree).process(tree.root()));

        FakeSyntaxTree twice = FakeSyntaxTree.layout(chain(id("mask"), id("offset"), number("1")));
        ChainProcessor processor = processorFor(twice);
        assertSame(Fragment.NONE, processor.process(twice.root()));
        assertSame(Fragment.NONE, processor.process(twice.root().getChildren().get(0)));
    }

    @Test
    void boundAccumulatorIsASinkWithoutLiterals() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("sb"), id("count")));
        AccumulatorTracker accumulators = new AccumulatorTracker(tree.source(), Set.of("StringBuilder"),
                UnresolvedAccumulatorPolicy.STRICT);
        accumulators.register("sb");

        Fragment fragment = processorFor(tree, accumulators).process(tree.root());

        assertEquals("sb", fragment.getSinkName());
        assertEquals("%s", fragment.getText());
    }

    @Test
    void literalAnywhereInTheChainMakesAPlainIdentifierASink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("out"), number("1"), str("done")));
        ChainProcessor processor = processorFor(tree);

        assertEquals("out", processor.process(tree.root()).getSinkName());
        assertEquals("out", processor.process(tree.root().getChildren().get(0)).getSinkName());
    }

    @Test
    void plainIdentifierIsANamedSink() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("sb"), str("a")));
        Fragment fragment = processorFor(tree).process(tree.root());

        assertTrue(fragment.isNamed());
        assertEquals("sb", fragment.getSinkName());
        assertEquals("a", fragment.getText());
    }

    @Test
    void continuationLinksShareTheSinkOfTheChainBase() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(id("sb"), str("a"), number("7")));
        ChainProcessor processor = processorFor(tree);

        SyntaxNode outer = tree.root();
        SyntaxNode inner = outer.getChildren().get(0);
        assertEquals("sb", tree.source().slice(processor.chainBase(outer)));
        assertEquals("sb", tree.source().slice(processor.chainBase(inner)));

        Fragment fragment = processor.process(outer);
        assertEquals("sb", fragment.getSinkName());
        assertEquals("%d", fragment.getText());
    }

    @Test
    void chainWithoutSinkContributesNothing() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(chain(str("field name"), number("1")));
        assertSame(Fragment.NONE, processorFor(tree).process(tree.root()));

        FakeSyntaxTree unknownCall = FakeSyntaxTree.layout(chain(call(id("BSON")), str("x")));
        assertSame(Fragment.NONE, processorFor(unknownCall).process(unknownCall.root()));

        FakeSyntaxTree unknownStream = FakeSyntaxTree.layout(chain(qualified("log::out"), str("x")));
        assertSame(Fragment.NONE, processorFor(unknownStream).process(unknownStream.root()));
    }

    @Test
    void otherOperatorsAreNotLinks() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(node("binary_expression", id("mask"), leaf(">>", ">>"), number("2")));
        ChainProcessor processor = processorFor(tree);

        assertFalse(processor.isLink(tree.root()));
        assertSame(Fragment.NONE, processor.process(tree.root()));
    }

    @Test
    void commentsBetweenOperandsAreIgnored() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(node("binary_expression",
                qualified("std::cout"), comment("/* note */"), leaf("<<", "<<"), str("shown")));
        Fragment fragment = processorFor(tree).process(tree.root());

        assertEquals("shown", fragment.getText());
    }

    @Test
    void moreThanOneRightOperandIsMalformed() {
        FakeSyntaxTree tree = FakeSyntaxTree.layout(node("binary_expression",
                qualified("std::cout"), leaf("<<", "<<"), str("one"), str("two")));
        ChainProcessor processor = processorFor(tree);

        ExtractionException e = assertThrows(ExtractionException.class, () -> processor.process(tree.root()));
        assertEquals(ErrorKind.MALFORMED_CHAIN, e.getKind());
        assertFalse(e.isFatalToUnit());
    }
}
