package edu.uw.cse.outparam;

/**
 * Holds the flags that control analysis behavior.
 * Passed to all analysis components.
 */
public class AnalysisConfig {
    public final boolean debug;
    public final String methodFilter; // null means analyze all functions
    public final int threads;

    public static final AnalysisConfig DEFAULT = new AnalysisConfig(false, null, 1);

    public AnalysisConfig(boolean debug, String methodFilter, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.debug = debug;
        this.methodFilter = methodFilter;
        this.threads = threads;
    }

    public AnalysisConfig(boolean debug, String methodFilter) {
        this(debug, methodFilter, 1);
    }

    /** True if the function with this simple name should be analyzed. */
    public boolean accepts(String functionName) {
        return methodFilter == null || methodFilter.equals(functionName);
    }
}
