package com.slate.kernel.transform;

import com.slate.kernel.ast.Assign;
import com.slate.kernel.ast.Block;
import com.slate.kernel.ast.Decl;
import com.slate.kernel.ast.FlatBlock;
import com.slate.kernel.ast.FunDecl;
import com.slate.kernel.ast.Node;
import com.slate.kernel.ast.Symbol;
import com.slate.kernel.testing.RecordingFormCompiler;
import org.junit.Test;

import java.util.List;

import static com.slate.kernel.testing.Tensors.matrix;
import static com.slate.kernel.testing.Tensors.tensor;
import static com.slate.kernel.testing.Tensors.vector;
import static org.junit.Assert.*;

public class EigenTransformerTest {

    private final EigenTransformer transformer = new EigenTransformer();

    @Test
    public void testMatrixKernel() {
        FunDecl kernel = new FunDecl("void", "k", List.of(new Decl("double", Symbol.indexed("A", "3", "3"))),
                Block.of(Assign.incr(Symbol.indexed("A", "i", "j"), new FlatBlock("w[i]"))), List.of());

        String expected = "template <typename Derived>\n"
                + "static inline void k(Eigen::MatrixBase<Derived> const & A_)\n"
                + "{\n"
                + "  Eigen::MatrixBase<Derived> & A = const_cast<Eigen::MatrixBase<Derived> &>(A_);\n"
                + "  A(i, j) += w[i];\n"
                + "}";
        assertEquals(expected, transformer.transform(kernel).gencode());
    }

    @Test
    public void testVectorKernelUsesColumnAccess() {
        FunDecl kernel = RecordingFormCompiler.kernelFor(vector("v"), "k");
        String code = transformer.transform(kernel).gencode();
        assertTrue(code, code.contains("A(i, 0) += 1.0;"));
        assertTrue(code, code.contains("double const *coords"));
    }

    @Test
    public void testLoopsAreRewritten() {
        FunDecl kernel = RecordingFormCompiler.kernelFor(matrix("M"), "k");
        FunDecl out = (FunDecl) transformer.transform(kernel);
        assertEquals(2, out.args().size());
        assertEquals(new Decl(EigenTransformer.MATRIX_TYPE + " const &", new Symbol("A_")), out.args().get(0));
        assertEquals(kernel.args().get(1), out.args().get(1));
        assertTrue(out.gencode().contains("A(i, j) += 1.0;"));
        assertFalse(out.gencode().contains("A[i]"));
    }

    @Test
    public void testExistingPredicatesKept() {
        FunDecl kernel = RecordingFormCompiler.kernelFor(matrix("M"), "k");
        FunDecl withPred = new FunDecl("void", "k", kernel.args(), kernel.body(), List.of("static"));
        assertEquals(List.of("static"), ((FunDecl) transformer.transform(withPred)).pred());
    }

    @Test
    public void testOtherSymbolsUntouched() {
        FunDecl kernel = new FunDecl("void", "k", List.of(new Decl("double", Symbol.indexed("A", "3"))),
                Block.of(new Assign(Symbol.indexed("B", "i"), Symbol.indexed("A", "i"))), List.of());
        String code = transformer.transform(kernel).gencode();
        assertTrue(code, code.contains("B[i] = A(i, 0);"));
    }

    @Test
    public void testScalarKernelUnchanged() {
        FunDecl kernel = RecordingFormCompiler.kernelFor(tensor("J", List.of()), "k");
        assertSame(kernel, transformer.transform(kernel));
    }

    @Test
    public void testNonFunctionUnchanged() {
        Node n = new FlatBlock("x = 1;");
        assertSame(n, transformer.transform(n));
    }
}
