package com.slate.kernel.ast;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CodePrinterTest {

    @Test
    public void testSymbols() {
        assertEquals("x", new Symbol("x").gencode());
        assertEquals("A[i][j]", Symbol.indexed("A", "i", "j").gencode());
    }

    @Test
    public void testDeclarations() {
        assertEquals("double A[3][3]", new Decl("double", Symbol.indexed("A", "3", "3")).gencode());
        assertEquals("static const double c = 1.0",
                new Decl("double", new Symbol("c"), new Symbol("1.0"), List.of("static", "const")).gencode());
    }

    @Test
    public void testExpressions() {
        Node call = FunCall.of("subkernel0_cell", new Symbol("T0"), new Symbol("coords"));
        assertEquals("subkernel0_cell(T0, coords)", call.gencode());
        assertEquals("(a * (b + c))",
                BinaryExpr.prod(new Symbol("a"), BinaryExpr.sum(new Symbol("b"), new Symbol("c"))).gencode());
        assertEquals("x += y", Assign.incr(new Symbol("x"), new Symbol("y")).gencode());
        assertEquals("x = y", new Assign(new Symbol("x"), new Symbol("y")).gencode());
    }

    @Test
    public void testLoop() {
        For loop = new For("i", 0, 3, Block.of(Assign.incr(Symbol.indexed("A", "i"), new Symbol("1.0"))));
        assertEquals("for (int i = 0; i < 3; ++i)\n{\n  A[i] += 1.0;\n}", loop.gencode());
    }

    @Test
    public void testFunction() {
        FunDecl fn = new FunDecl("void", "k", List.of(new Decl("double", Symbol.indexed("A", "3"))),
                Block.of(new Assign(Symbol.indexed("A", "0"), new Symbol("0.0"))), List.of("static"))
                .withTemplate("template <typename T>");
        assertEquals("template <typename T>\nstatic void k(double A[3])\n{\n  A[0] = 0.0;\n}", fn.gencode());
    }

    @Test
    public void testOpenScopeBlock() {
        Block b = new Block(List.of(new FlatBlock("x = 1;")), true);
        assertEquals("{\n  x = 1;\n}", b.gencode());
    }

    @Test
    public void testCompilationUnitSeparatesTopLevelNodes() {
        FunDecl f = new FunDecl("void", "f", List.of(), Block.of(), List.of());
        FunDecl g = new FunDecl("void", "g", List.of(), Block.of(), List.of());
        assertEquals("void f()\n{\n}\n\nvoid g()\n{\n}", new CompilationUnit(List.of(f, g)).gencode());
    }

    @Test
    public void testStructuralEquality() {
        assertEquals(Symbol.indexed("A", "i"), new Symbol("A", List.of("i")));
        assertNotEquals(new Symbol("A"), Symbol.indexed("A", "i"));
    }

    @Test
    public void testRewriterSharesUnchangedSubtrees() {
        Block body = Block.of(new Assign(new Symbol("x"), new Symbol("y")));
        AstRewriter noop = new AstRewriter() {
        };
        assertSame(body, noop.rewrite(body));

        AstRewriter renameY = new AstRewriter() {
            @Override
            public Node visitSymbol(Symbol node) {
                return node.name().equals("y") ? new Symbol("z") : node;
            }
        };
        assertEquals("x = z;", renameY.rewrite(body).gencode());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlockRejectsNull() {
        new Block(java.util.Arrays.asList(new Symbol("x"), null));
    }
}
