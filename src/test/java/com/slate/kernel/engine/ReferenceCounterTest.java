package com.slate.kernel.engine;

import com.slate.kernel.form.Coefficient;
import com.slate.kernel.node.Action;
import com.slate.kernel.node.Add;
import com.slate.kernel.node.Tensor;
import org.junit.Test;

import java.util.List;

import static com.slate.kernel.testing.Tensors.P1;
import static com.slate.kernel.testing.Tensors.matrix;
import static org.junit.Assert.*;

public class ReferenceCounterTest {

    @Test
    public void testTerminalHasNoCounts() {
        ReferenceCounts counts = ReferenceCounter.collect(matrix("A"));
        assertEquals(0, counts.size());
    }

    @Test
    public void testSameOperandTwice() {
        // A + A: two edges to A
        Tensor a = matrix("A");
        Add s = a.add(a);
        ReferenceCounts counts = ReferenceCounter.collect(s);

        assertEquals(2, counts.count(a));
        assertTrue(counts.isShared(a));
        assertEquals(0, counts.count(s));
        assertEquals(1, counts.size());
    }

    @Test
    public void testSharedSubexpression() {
        Tensor a = matrix("A"), b = matrix("B");
        Add x = a.add(b);
        Add s = x.add(x);
        ReferenceCounts counts = ReferenceCounter.collect(s);

        assertEquals(2, counts.count(x));
        // X is only walked once, so its operands are counted once each.
        assertEquals(1, counts.count(a));
        assertEquals(1, counts.count(b));
        assertFalse(counts.isShared(a));
    }

    @Test
    public void testActionOperand() {
        Tensor b = matrix("B");
        Action act = b.action(new Coefficient("f", P1));
        ReferenceCounts counts = ReferenceCounter.collect(act);

        assertEquals(1, counts.count(b));
        assertEquals(0, counts.count(act));
    }

    @Test
    public void testCountsOverSeveralRoots() {
        Tensor a = matrix("A");
        ReferenceCounts counts = ReferenceCounter.collect(List.of(a.negate(), a.transpose()));
        assertEquals(2, counts.count(a));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testMapIsUnmodifiable() {
        Tensor a = matrix("A");
        ReferenceCounter.collect(a.add(a)).asMap().put(a, 5);
    }
}
