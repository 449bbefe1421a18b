package uk.gegc.questionnaire.features.condition.domain.graph;

/**
 * Fixed bounds and thresholds used by the dependency analysis.
 */
public final class DependencyLimits {

    /** Recursion cap when expanding indirect dependencies of one question. */
    public static final int MAX_DEPENDENCY_CHAIN_DEPTH = 10;

    /** Recursion cap for reachability scans used by mutual dependency checks. */
    public static final int MAX_REACHABILITY_DEPTH = 20;

    /** Default cap on complex-inside-complex structural recursion. */
    public static final int DEFAULT_MAX_CONDITION_DEPTH = 32;

    public static final int MIN_SUB_CONDITIONS = 2;
    public static final int MAX_SUB_CONDITIONS = 10;
    public static final int MAX_RECOMMENDED_NESTING_LEVEL = 5;
    public static final int MAX_NESTED_COMPLEXITY = 50;

    private DependencyLimits() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
