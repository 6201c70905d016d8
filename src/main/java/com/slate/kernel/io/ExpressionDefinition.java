package com.slate.kernel.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an expression definition file.
 *
 * <pre>{@code
 * {
 *   "expression": {
 *     "name": "schur", "root": "S",
 *     "parameters": { "mode": "tensor" },
 *     "spaces": [ { "name": "V", "dimension": 3 },
 *                 { "name": "W", "components": ["V", "V"] } ],
 *     "coefficients": [ { "name": "f", "space": "V" } ],
 *     "tensors": [ { "name": "A", "arguments": ["V", "V"], "coefficients": ["f"] } ],
 *     "nodes": [ { "name": "S", "type": "add", "operands": ["A", "A"] } ]
 *   }
 * }
 * }</pre>
 *
 * Nodes and tensors refer to each other by name; naming a node twice as an
 * operand shares that node.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExpressionDefinition {
    private ExpressionInfo expression;

    /** The expression and everything it is built from. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ExpressionInfo {
        private String name, version, root;
        private Map<String, Object> parameters;
        private List<SpaceDef> spaces;
        private List<CoefficientDef> coefficients;
        private List<TensorDef> tensors;
        private List<NodeDef> nodes;
    }

    /** A function space; mixed when {@code components} is non-empty. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SpaceDef {
        private String name;
        private int dimension;
        private List<String> components;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CoefficientDef {
        private String name, space;
    }

    /** A terminal tensor and the form behind it. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class TensorDef {
        private String name, description;
        private List<String> arguments;
        private List<String> coefficients;
        private List<String> integrals;
    }

    /** An operator node. {@code coefficient} is used by actions only. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description, coefficient;
        private List<String> operands;
    }
}
