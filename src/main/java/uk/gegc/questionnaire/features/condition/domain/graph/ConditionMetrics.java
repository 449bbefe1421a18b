package uk.gegc.questionnaire.features.condition.domain.graph;

import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.LogicalOperator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readability metrics of a condition tree.
 * <p>
 * Both metrics walk the tree with an explicit stack, so arbitrarily deep input is measured
 * without exhausting the call stack.
 */
public final class ConditionMetrics {

    private static final double AND_WEIGHT = 1.2;

    private ConditionMetrics() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Simple conditions score 1. A complex condition scores 1 plus its children, nested
     * complex children counting double, and the total is weighted by 1.2 for AND.
     * Every level is rounded half-up; the result saturates at {@link Integer#MAX_VALUE}.
     */
    public static int complexity(DisplayCondition condition) {
        if (condition == null) {
            return 0;
        }
        if (!(condition instanceof ComplexCondition root)) {
            return 1;
        }

        // pre-order; walked backwards every child is scored before its parent
        List<ComplexCondition> order = new ArrayList<>();
        Deque<ComplexCondition> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ComplexCondition current = pending.pop();
            order.add(current);
            for (DisplayCondition sub : current.conditions()) {
                if (sub instanceof ComplexCondition complexSub) {
                    pending.push(complexSub);
                }
            }
        }

        Map<ComplexCondition, Integer> scores = new IdentityHashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            ComplexCondition current = order.get(i);
            double score = 1;
            for (DisplayCondition sub : current.conditions()) {
                score += sub instanceof ComplexCondition complexSub ? 2.0 * scores.get(complexSub) : 1;
            }
            if (current.logicalOperator().filter(LogicalOperator.AND::equals).isPresent()) {
                score *= AND_WEIGHT;
            }
            scores.put(current, (int) Math.min(Math.round(score), Integer.MAX_VALUE));
        }
        return scores.get(root);
    }

    /**
     * Depth of complex-inside-complex nesting; simple children add nothing.
     */
    public static int nestingLevel(DisplayCondition condition) {
        if (!(condition instanceof ComplexCondition root)) {
            return 0;
        }
        int deepest = 0;
        Deque<ComplexCondition> pending = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        pending.push(root);
        levels.push(0);
        while (!pending.isEmpty()) {
            ComplexCondition current = pending.pop();
            int level = levels.pop();
            deepest = Math.max(deepest, level);
            for (DisplayCondition sub : current.conditions()) {
                if (sub instanceof ComplexCondition complexSub) {
                    pending.push(complexSub);
                    levels.push(level + 1);
                }
            }
        }
        return deepest;
    }

    /**
     * Number of simple conditions in the tree.
     */
    public static int leafCount(DisplayCondition condition) {
        if (condition == null) {
            return 0;
        }
        int leaves = 0;
        Deque<DisplayCondition> pending = new ArrayDeque<>();
        pending.push(condition);
        while (!pending.isEmpty()) {
            DisplayCondition current = pending.pop();
            if (current instanceof ComplexCondition complex) {
                complex.conditions().forEach(pending::push);
            } else {
                leaves++;
            }
        }
        return leaves;
    }

    /**
     * Effort score used when exporting a paper's condition logic: 1 for a simple condition,
     * otherwise 2 plus every simple condition in the tree plus 2 per nesting level.
     */
    public static int logicComplexity(DisplayCondition condition) {
        if (condition == null) {
            return 0;
        }
        if (!(condition instanceof ComplexCondition)) {
            return 1;
        }
        return 2 + leafCount(condition) + 2 * nestingLevel(condition);
    }
}
