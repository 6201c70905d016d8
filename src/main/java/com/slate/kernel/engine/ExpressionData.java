package com.slate.kernel.engine;

import com.slate.kernel.ast.Symbol;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorOp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of analysing an expression DAG.
 *
 * @param temporaries Terminal tensor to temporary symbol, in first-encounter order.
 * @param tensorOps   Every operator node once, sorted by operand count.
 */
public record ExpressionData(Map<Tensor, Symbol> temporaries, List<TensorOp> tensorOps) {

    public ExpressionData {
        temporaries = Collections.unmodifiableMap(new LinkedHashMap<>(temporaries));
        tensorOps = List.copyOf(tensorOps);
    }
}
