package edu.uw.cse.outparam.output;

import edu.uw.cse.outparam.analysis.FunctionClassification;
import edu.uw.cse.outparam.analysis.OutputParam;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulates results from any number of worker threads.
 */
public class CollectingSink implements ClassificationSink {

    private final List<FunctionClassification> classifications = new ArrayList<>();
    private final Map<String, String> unchanged = new LinkedHashMap<>();

    @Override
    public synchronized void classified(FunctionClassification classification) {
        classifications.add(classification);
    }

    @Override
    public synchronized void unchanged(String qualifiedName, String reason) {
        unchanged.put(qualifiedName, reason);
    }

    /** Classified functions sorted by qualified name. */
    public synchronized List<FunctionClassification> getClassifications() {
        List<FunctionClassification> sorted = new ArrayList<>(classifications);
        sorted.sort(Comparator.comparing(FunctionClassification::getQualifiedName));
        return sorted;
    }

    public synchronized Map<String, String> getUnchanged() {
        return new TreeMap<>(unchanged);
    }

    public synchronized FunctionClassification get(String qualifiedName) {
        for (FunctionClassification c : classifications) {
            if (c.getQualifiedName().equals(qualifiedName)) return c;
        }
        return null;
    }

    /** Output parameters of every classified function, keyed by qualified name. */
    public synchronized Map<String, List<OutputParam>> outputParams() {
        Map<String, List<OutputParam>> map = new TreeMap<>();
        for (FunctionClassification c : classifications) {
            List<OutputParam> params = c.outputParams();
            if (!params.isEmpty()) {
                map.put(c.getQualifiedName(), params);
            }
        }
        return map;
    }
}
