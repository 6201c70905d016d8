package com.slate.kernel.io;

import com.slate.kernel.api.CompilerParameters;
import com.slate.kernel.api.IntegralType;
import com.slate.kernel.form.Coefficient;
import com.slate.kernel.form.Form;
import com.slate.kernel.form.FunctionSpace;
import com.slate.kernel.node.Tensor;
import com.slate.kernel.node.TensorBase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles an {@link ExpressionDefinition} into a tensor expression DAG.
 *
 * <p>
 * Spaces, coefficients and tensors are created in file order, so coefficient
 * numbering follows the definition. Operator nodes may appear in any order;
 * they are resolved iteratively once all their operands exist.
 */
@Log4j2
public final class JsonExpressionCompiler {

    /**
     * @throws IllegalArgumentException on unknown or duplicate names, bad node
     *                                  types or shapes, or a missing root.
     * @throws IllegalStateException    if the nodes reference each other in a
     *                                  cycle.
     */
    public CompiledExpression compile(ExpressionDefinition def) {
        ExpressionDefinition.ExpressionInfo info = def.getExpression();
        if (info == null)
            throw new IllegalArgumentException("Missing 'expression' section");

        Map<String, FunctionSpace> spaces = buildSpaces(orEmpty(info.getSpaces()));
        Map<String, Coefficient> coefficients = buildCoefficients(orEmpty(info.getCoefficients()), spaces);

        Map<String, TensorBase> nodesByName = new LinkedHashMap<>();
        for (ExpressionDefinition.TensorDef td : orEmpty(info.getTensors()))
            putUnique(nodesByName, td.getName(), buildTensor(td, spaces, coefficients));

        List<ExpressionDefinition.NodeDef> nodeDefs = orEmpty(info.getNodes());
        checkOperandNames(nodeDefs, nodesByName);
        resolveNodes(nodeDefs, nodesByName, coefficients);

        String rootName = info.getRoot();
        if (rootName == null || !nodesByName.containsKey(rootName))
            throw new IllegalArgumentException("Root node '" + rootName + "' is not defined");

        log.debug("Compiled expression {}: {} spaces, {} coefficients, {} nodes",
                info.getName(), spaces.size(), coefficients.size(), nodesByName.size());
        return new CompiledExpression(info.getName(), nodesByName.get(rootName),
                Collections.unmodifiableMap(nodesByName), Collections.unmodifiableMap(coefficients),
                CompilerParameters.of(info.getParameters()));
    }

    // ── Function spaces and coefficients ────────────────────────────

    private static Map<String, FunctionSpace> buildSpaces(List<ExpressionDefinition.SpaceDef> defs) {
        Map<String, FunctionSpace> spaces = new LinkedHashMap<>();
        for (ExpressionDefinition.SpaceDef sd : defs) {
            FunctionSpace space;
            if (sd.getComponents() != null && !sd.getComponents().isEmpty()) {
                List<FunctionSpace> parts = new ArrayList<>(sd.getComponents().size());
                for (String c : sd.getComponents())
                    parts.add(lookup(spaces, c, "space", sd.getName()));
                space = FunctionSpace.mixed(sd.getName(), parts);
            } else {
                space = FunctionSpace.of(sd.getName(), sd.getDimension());
            }
            putUnique(spaces, sd.getName(), space);
        }
        return spaces;
    }

    private static Map<String, Coefficient> buildCoefficients(List<ExpressionDefinition.CoefficientDef> defs,
            Map<String, FunctionSpace> spaces) {
        Map<String, Coefficient> coefficients = new LinkedHashMap<>();
        for (ExpressionDefinition.CoefficientDef cd : defs) {
            FunctionSpace space = lookup(spaces, cd.getSpace(), "space", cd.getName());
            putUnique(coefficients, cd.getName(), new Coefficient(cd.getName(), space));
        }
        return coefficients;
    }

    private static Tensor buildTensor(ExpressionDefinition.TensorDef td, Map<String, FunctionSpace> spaces,
            Map<String, Coefficient> coefficients) {
        List<FunctionSpace> args = new ArrayList<>();
        for (String s : orEmpty(td.getArguments()))
            args.add(lookup(spaces, s, "space", td.getName()));
        List<Coefficient> coeffs = new ArrayList<>();
        for (String c : orEmpty(td.getCoefficients()))
            coeffs.add(lookup(coefficients, c, "coefficient", td.getName()));
        Set<IntegralType> integrals = EnumSet.noneOf(IntegralType.class);
        for (String i : orEmpty(td.getIntegrals()))
            integrals.add(IntegralType.fromString(i));
        return new Tensor(new Form(td.getName(), args, coeffs, integrals));
    }

    // ── Operator nodes ──────────────────────────────────────────────

    private static void checkOperandNames(List<ExpressionDefinition.NodeDef> defs, Map<String, TensorBase> tensors) {
        Set<String> known = new HashSet<>(tensors.keySet());
        for (ExpressionDefinition.NodeDef nd : defs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name");
            if (!known.add(nd.getName()))
                throw new IllegalArgumentException("Duplicate name: " + nd.getName());
        }
        for (ExpressionDefinition.NodeDef nd : defs) {
            for (String op : orEmpty(nd.getOperands())) {
                if (!known.contains(op))
                    throw new IllegalArgumentException("Unknown operand '" + op + "' in node " + nd.getName());
            }
        }
    }

    private static void resolveNodes(List<ExpressionDefinition.NodeDef> defs, Map<String, TensorBase> nodesByName,
            Map<String, Coefficient> coefficients) {
        Deque<ExpressionDefinition.NodeDef> pending = new ArrayDeque<>(defs);
        int prevPendingSize = -1;

        while (!pending.isEmpty()) {
            if (pending.size() == prevPendingSize) {
                String unresolved = pending.stream()
                        .map(ExpressionDefinition.NodeDef::getName)
                        .collect(Collectors.joining(", "));
                throw new IllegalStateException("Cycle detected. Unresolved nodes: " + unresolved);
            }
            prevPendingSize = pending.size();

            Iterator<ExpressionDefinition.NodeDef> iter = pending.iterator();
            while (iter.hasNext()) {
                ExpressionDefinition.NodeDef nd = iter.next();
                List<String> operandNames = orEmpty(nd.getOperands());
                if (!nodesByName.keySet().containsAll(operandNames))
                    continue;

                TensorBase[] operands = new TensorBase[operandNames.size()];
                for (int i = 0; i < operands.length; i++)
                    operands[i] = nodesByName.get(operandNames.get(i));
                Coefficient c = nd.getCoefficient() == null ? null
                        : lookup(coefficients, nd.getCoefficient(), "coefficient", nd.getName());

                NodeType type = NodeType.fromString(nd.getType());
                nodesByName.put(nd.getName(), type.create(nd.getName(), operands, c));
                iter.remove();
            }
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private static <T> T lookup(Map<String, T> map, String name, String kind, String owner) {
        T value = map.get(name);
        if (value == null)
            throw new IllegalArgumentException("Unknown " + kind + " '" + name + "' referenced by " + owner);
        return value;
    }

    private static <T> void putUnique(Map<String, T> map, String name, T value) {
        if (name == null)
            throw new IllegalArgumentException("Definition without a name");
        if (map.putIfAbsent(name, value) != null)
            throw new IllegalArgumentException("Duplicate name: " + name);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
