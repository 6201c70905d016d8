package com.slate.kernel.engine;

import com.slate.kernel.api.CompilerParameters;
import com.slate.kernel.api.ContextKernel;
import com.slate.kernel.api.FormCompilationException;
import com.slate.kernel.api.IntegralType;
import com.slate.kernel.api.KernelTransformer;
import com.slate.kernel.ast.Block;
import com.slate.kernel.ast.CompilationUnit;
import com.slate.kernel.ast.FunDecl;
import com.slate.kernel.ast.Node;
import com.slate.kernel.ast.Symbol;
import com.slate.kernel.form.Coefficient;
import com.slate.kernel.form.FunctionSpace;
import com.slate.kernel.node.Action;
import com.slate.kernel.node.Add;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorBase;
import com.slate.kernel.node.TensorOp;
import com.slate.kernel.testing.RecordingFormCompiler;
import com.slate.kernel.transform.EigenTransformer;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static com.slate.kernel.testing.Tensors.P1;
import static com.slate.kernel.testing.Tensors.P2;
import static com.slate.kernel.testing.Tensors.matrix;
import static com.slate.kernel.testing.Tensors.tensor;
import static org.junit.Assert.*;

public class KernelBuilderTest {

    private static final KernelTransformer IDENTITY = k -> k;

    private final RecordingFormCompiler compiler = new RecordingFormCompiler();

    private KernelBuilder builder(Tensor... terminals) {
        Add expr = terminals[0].add(terminals[1]);
        return new KernelBuilder(expr, CompilerParameters.empty(), compiler, IDENTITY);
    }

    private static FunDecl driver() {
        return MacroKernels.construct("driver", List.of(), Block.of());
    }

    // ── Analysis ────────────────────────────────────────────────

    @Test
    public void testAnalysisAtConstruction() {
        Tensor a = matrix("A"), b = matrix("B");
        KernelBuilder kb = builder(a, b);

        assertEquals(BuildState.CONSTRUCTED, kb.state());
        assertFalse(kb.isFinalized());
        assertEquals(new Symbol("T0"), kb.temporaries().get(b));
        assertEquals(new Symbol("T1"), kb.temporaries().get(a));
        assertTrue(kb.auxiliaryExpressions().isEmpty());
        assertEquals(1, kb.referenceCounts().count(a));
        // Nothing is compiled until asked for.
        assertTrue(compiler.calls().isEmpty());
    }

    @Test
    public void testSelfSumNeedsNoAuxiliaryExpression() {
        Tensor a = matrix("A");
        KernelBuilder kb = new KernelBuilder(a.add(a), null, compiler, IDENTITY);

        assertEquals(1, kb.temporaries().size());
        assertEquals(2, kb.referenceCounts().count(a));
        assertTrue(kb.auxiliaryExpressions().isEmpty());
        assertEquals(CompilerParameters.empty(), kb.parameters());
    }

    @Test
    public void testActionIsAuxiliary() {
        Tensor b = matrix("B");
        Action act = b.action(new Coefficient("f", P1));
        KernelBuilder kb = new KernelBuilder(act, CompilerParameters.empty(), compiler, IDENTITY);

        assertEquals(List.of(act), kb.auxiliaryExpressions());
        assertEquals("T0", kb.temporaries().get(b).name());
    }

    @Test
    public void testIntegralTypeIsAlwaysCell() {
        Tensor a = matrix("A");
        KernelBuilder kb = new KernelBuilder(a, CompilerParameters.empty(), compiler, IDENTITY);
        assertEquals(IntegralType.CELL, kb.integralType());
        assertEquals("cell", kb.integralType().value());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullExpression() {
        new KernelBuilder(null, CompilerParameters.empty(), compiler);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullFormCompiler() {
        new KernelBuilder(matrix("A"), CompilerParameters.empty(), null);
    }

    @Test
    public void testIndependentGraphsAnalyseIdentically() {
        RecordingFormCompiler first = new RecordingFormCompiler();
        RecordingFormCompiler second = new RecordingFormCompiler();
        KernelBuilder kb1 = sharedActionBuilder(first);
        KernelBuilder kb2 = sharedActionBuilder(second);

        assertEquals(temporaryNames(kb1), temporaryNames(kb2));
        assertEquals(List.of("C=T0", "B=T1", "A=T2"), temporaryNames(kb1));
        assertEquals(auxiliarySignature(kb1), auxiliarySignature(kb2));
        assertEquals(List.of("Action:1", "Add:2", "Action:5"), auxiliarySignature(kb1));

        kb1.contextKernels();
        kb2.contextKernels();
        assertEquals(recordedPrefixes(first), recordedPrefixes(second));
        assertEquals(List.of("C:subkernel0_", "B:subkernel1_", "A:subkernel2_"), recordedPrefixes(first));
    }

    /** (A + B) * (A + B) acting on f, plus C acting on f, from fresh nodes. */
    private static KernelBuilder sharedActionBuilder(RecordingFormCompiler formCompiler) {
        Coefficient f = new Coefficient("f", P1);
        Tensor a = matrix("A"), b = matrix("B"), c = matrix("C");
        Add x = a.add(b);
        TensorBase expr = x.mul(x).action(f).add(c.action(f));
        return new KernelBuilder(expr, CompilerParameters.empty(), formCompiler, IDENTITY);
    }

    private static List<String> temporaryNames(KernelBuilder kb) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<Tensor, Symbol> e : kb.temporaries().entrySet())
            out.add(e.getKey().form().name() + "=" + e.getValue().name());
        return out;
    }

    private static List<String> auxiliarySignature(KernelBuilder kb) {
        List<String> out = new ArrayList<>();
        for (TensorOp op : kb.auxiliaryExpressions())
            out.add(op.label() + ":" + ExpressionAnalyzer.countOperands(op));
        return out;
    }

    private static List<String> recordedPrefixes(RecordingFormCompiler formCompiler) {
        List<String> out = new ArrayList<>();
        for (RecordingFormCompiler.Call call : formCompiler.calls())
            out.add(call.tensor().form().name() + ":" + call.prefix());
        return out;
    }

    // ── Coefficients ────────────────────────────────────────────

    @Test
    public void testCoefficientMap() {
        FunctionSpace mixed = FunctionSpace.mixed("W", P1, P2);
        Coefficient f = new Coefficient("f", P1);
        Coefficient g = new Coefficient("g", mixed);
        Tensor a = tensor("A", List.of(P1, P1), g, f);
        Tensor b = tensor("B", List.of(P1, P1), f);
        KernelBuilder kb = builder(a, b);

        Map<Coefficient, List<Symbol>> map = kb.coefficientMap();
        assertEquals(List.of(f, g), List.copyOf(map.keySet()));
        assertEquals(List.of(new Symbol("w_0")), kb.coefficient(f));
        assertEquals(List.of(new Symbol("w_1_0"), new Symbol("w_1_1")), kb.coefficient(g));
        assertSame(map, kb.coefficientMap());
    }

    @Test
    public void testNoCoefficients() {
        assertTrue(builder(matrix("A"), matrix("B")).coefficientMap().isEmpty());
    }

    @Test(expected = NoSuchElementException.class)
    public void testUnknownCoefficient() {
        builder(matrix("A"), matrix("B")).coefficient(new Coefficient("h", P1));
    }

    // ── Context kernels ─────────────────────────────────────────

    @Test
    public void testContextKernelsUseSubkernelPrefixes() {
        Tensor a = matrix("A"), b = matrix("B");
        CompilerParameters params = CompilerParameters.of(Map.of("mode", "tensor"));
        KernelBuilder kb = new KernelBuilder(a.add(b), params, compiler, IDENTITY);

        List<ContextKernel> kernels = kb.contextKernels();
        assertEquals(2, kernels.size());
        assertEquals(2, compiler.calls().size());
        assertSame(b, compiler.calls().get(0).tensor());
        assertEquals("subkernel0_", compiler.calls().get(0).prefix());
        assertSame(a, compiler.calls().get(1).tensor());
        assertEquals("subkernel1_", compiler.calls().get(1).prefix());
        assertSame(params, compiler.calls().get(0).parameters());
    }

    @Test
    public void testContextKernelsComputedOnce() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        List<ContextKernel> first = kb.contextKernels();
        assertSame(first, kb.contextKernels());
        assertEquals(2, compiler.calls().size());
    }

    @Test
    public void testCompilationFailureIsRetried() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        compiler.failNext(1);
        try {
            kb.contextKernels();
            fail("Expected FormCompilationException");
        } catch (FormCompilationException e) {
            assertEquals("B", e.formName());
        }
        assertEquals(2, kb.contextKernels().size());
        assertEquals(3, compiler.calls().size());
    }

    // ── Finalize / construct ────────────────────────────────────

    @Test
    public void testFinalizeAndConstruct() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        assertTrue(kb.isFinalized());

        List<Node> kernels = kb.finalizedKernels();
        assertEquals(2, kernels.size());
        assertEquals("subkernel0_cell_integral_otherwise", ((FunDecl) kernels.get(0)).name());
        assertEquals("subkernel1_cell_integral_otherwise", ((FunDecl) kernels.get(1)).name());

        FunDecl macro = driver();
        CompilationUnit unit = kb.construct(List.of(macro));
        assertEquals(3, unit.children().size());
        assertEquals(kernels, unit.children().subList(0, 2));
        assertSame(macro, unit.children().get(2));
    }

    @Test
    public void testConstructIsRepeatable() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        CompilationUnit first = kb.construct(List.of(driver()));
        CompilationUnit second = kb.construct(List.of(driver()));

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(2, kb.finalizedKernels().size());
    }

    @Test
    public void testConstructWithoutMacros() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        assertEquals(kb.finalizedKernels(), kb.construct(List.of()).children());
    }

    @Test
    public void testRepeatedFinalizeIsIgnored() {
        Tensor a = matrix("A");
        compiler.orient(a);
        KernelBuilder kb = builder(a, matrix("B"));
        kb.finalizeKernels();
        List<Node> kernels = kb.finalizedKernels();
        assertTrue(kb.isOriented());
        kb.finalizeKernels();

        assertSame(kernels, kb.finalizedKernels());
        assertEquals(2, kb.finalizedKernels().size());
        assertTrue(kb.isOriented());
        assertEquals(2, compiler.calls().size());
    }

    @Test(expected = IllegalStateException.class)
    public void testConstructBeforeFinalize() {
        builder(matrix("A"), matrix("B")).construct(List.of(driver()));
    }

    @Test(expected = IllegalStateException.class)
    public void testFinalizedKernelsBeforeFinalize() {
        builder(matrix("A"), matrix("B")).finalizedKernels();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructWithNullList() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        kb.construct(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructWithNullMacro() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        kb.construct(Arrays.asList(driver(), null));
    }

    @Test
    public void testDefaultTransformerRewritesForEigen() {
        Tensor a = matrix("A"), b = matrix("B");
        KernelBuilder kb = new KernelBuilder(a.add(b), CompilerParameters.empty(), compiler);
        kb.finalizeKernels();

        FunDecl k = (FunDecl) kb.finalizedKernels().get(0);
        assertEquals(EigenTransformer.TEMPLATE, k.template());
        assertEquals("A_", k.args().get(0).symbol().name());
    }

    @Test
    public void testTransformerReturningNull() {
        KernelBuilder kb = new KernelBuilder(matrix("A").add(matrix("B")), CompilerParameters.empty(), compiler,
                k -> null);
        try {
            kb.finalizeKernels();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals(BuildState.CONSTRUCTED, kb.state());
        }
    }

    // ── Orientation and subdomains ──────────────────────────────

    @Test
    public void testOrientationFromSubkernels() {
        Tensor a = matrix("A"), b = matrix("B");
        compiler.orient(a);
        KernelBuilder kb = builder(a, b);
        assertFalse(kb.isOriented());
        kb.finalizeKernels();
        assertTrue(kb.isOriented());
    }

    @Test
    public void testNoOrientation() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        assertFalse(kb.isOriented());
    }

    @Test
    public void testRequiredOrientationSurvivesFinalize() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.requireOrientation();
        kb.finalizeKernels();
        assertTrue(kb.isOriented());
    }

    @Test(expected = IllegalStateException.class)
    public void testRequireOrientationAfterFinalize() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        kb.finalizeKernels();
        kb.requireOrientation();
    }

    @Test
    public void testRequirementFlags() {
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        assertFalse(kb.needsCellFacets());
        assertFalse(kb.needsMeshLayers());
        kb.requireCellFacets();
        kb.requireMeshLayers();
        assertTrue(kb.needsCellFacets());
        assertTrue(kb.needsMeshLayers());
    }

    @Test
    public void testMarkedSubdomainIsRejected() {
        compiler.subdomain("1");
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        try {
            kb.finalizeKernels();
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            assertTrue(e.getMessage().contains("'1'"));
        }
        assertEquals(BuildState.CONSTRUCTED, kb.state());
        assertFalse(kb.isOriented());
    }

    @Test
    public void testFormCompilerFailureLeavesBuilderUnfinalized() {
        compiler.failNext(1);
        KernelBuilder kb = builder(matrix("A"), matrix("B"));
        try {
            kb.finalizeKernels();
            fail("Expected FormCompilationException");
        } catch (FormCompilationException expected) {
            assertFalse(kb.isFinalized());
        }
        kb.finalizeKernels();
        assertTrue(kb.isFinalized());
    }
}
