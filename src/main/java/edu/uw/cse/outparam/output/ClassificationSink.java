package edu.uw.cse.outparam.output;

import edu.uw.cse.outparam.analysis.FunctionClassification;

/**
 * Receives the outcome of each analyzed function. Implementations used with
 * more than one worker thread must be thread-safe.
 */
public interface ClassificationSink {

    void classified(FunctionClassification classification);

    /** The function is left as it is; {@code reason} says why. */
    void unchanged(String qualifiedName, String reason);
}
