package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Orders formulas so that every producer runs before its consumers (Kahn's algorithm).
 *
 * Ready formulas are taken by explicit calculation order first (unordered last),
 * then by output name, so equal input always yields the same order.
 */
final class DependencyResolver {

    static final String STEP = "dependency_resolution";

    private static final Comparator<Node> READY_ORDER = Comparator
        .comparing((Node n) -> n.explicitOrder() == null ? Integer.MAX_VALUE : n.explicitOrder())
        .thenComparing(Node::output);

    private DependencyResolver() {
    }

    record Node(String output, Set<String> references, Integer explicitOrder) {
    }

    static List<Node> order(List<Node> nodes) {
        Map<String, Node> byOutput = new HashMap<>();
        for (Node node : nodes) {
            if (byOutput.putIfAbsent(node.output(), node) != null) {
                throw invalid("more than one formula produces '" + node.output() + "'");
            }
        }

        Map<String, Set<String>> consumers = new HashMap<>();
        Map<String, Integer> pending = new HashMap<>();
        for (Node node : nodes) {
            if (node.references().contains(node.output())) {
                throw invalid("formula for '" + node.output() + "' references itself");
            }
            int inDegree = 0;
            for (String reference : node.references()) {
                Node producer = byOutput.get(reference);
                if (producer == null) {
                    continue;
                }
                if (producer.explicitOrder() != null && node.explicitOrder() != null
                    && producer.explicitOrder() >= node.explicitOrder()) {
                    throw invalid("calculation_order of '" + node.output() + "' (" + node.explicitOrder()
                        + ") does not come after its dependency '" + producer.output() + "' ("
                        + producer.explicitOrder() + ")");
                }
                consumers.computeIfAbsent(producer.output(), k -> new TreeSet<>()).add(node.output());
                inDegree++;
            }
            pending.put(node.output(), inDegree);
        }

        PriorityQueue<Node> ready = new PriorityQueue<>(READY_ORDER);
        nodes.stream().filter(n -> pending.get(n.output()) == 0).forEach(ready::add);
        List<Node> sorted = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node next = ready.poll();
            sorted.add(next);
            for (String consumer : consumers.getOrDefault(next.output(), Set.of())) {
                if (pending.merge(consumer, -1, Integer::sum) == 0) {
                    ready.add(byOutput.get(consumer));
                }
            }
        }
        if (sorted.size() < nodes.size()) {
            Set<String> cyclic = new LinkedHashSet<>();
            nodes.stream()
                .filter(n -> pending.get(n.output()) > 0)
                .map(Node::output)
                .sorted()
                .forEach(cyclic::add);
            throw invalid("dependency cycle between " + String.join(", ", cyclic));
        }
        return sorted;
    }

    private static RuleEngineException invalid(String message) {
        return new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, STEP, message);
    }
}
