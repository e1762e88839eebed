package edu.uw.cse.outparam.output;

import edu.uw.cse.outparam.analysis.FunctionClassification;
import edu.uw.cse.outparam.dataflow.PlaceSets;
import edu.uw.cse.outparam.ir.AggregateType;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Formats and prints output-parameter classifications.
 */
public class ResultPrinter {

    public static void print(CollectingSink sink) {
        print(sink.getClassifications(), sink.getUnchanged(), System.out);
    }

    public static void print(List<FunctionClassification> classifications,
                             Map<String, String> unchanged, PrintStream out) {
        if (classifications.isEmpty() && unchanged.isEmpty()) {
            out.println("No functions analyzed.");
            return;
        }

        out.println();
        out.println("=== Output Parameter Analysis Results ===");

        // Compute max name length for alignment
        int maxLen = 0;
        for (FunctionClassification c : classifications) {
            maxLen = Math.max(maxLen, c.getQualifiedName().length());
        }
        for (String name : unchanged.keySet()) {
            maxLen = Math.max(maxLen, name.length());
        }

        for (FunctionClassification c : classifications) {
            String padded = String.format("%-" + (maxLen + 2) + "s", c.getQualifiedName());
            out.println(padded + ": must " + PlaceSets.format(c.getMustWrites())
                + "  may " + PlaceSets.format(c.getMayWrites())
                + "  (" + c.getLocation() + ")");
            for (Map.Entry<Integer, AggregateType> e : c.getCandidateAggregates().entrySet()) {
                AggregateType aggregate = e.getValue();
                out.println("    " + e.getKey() + ": " + aggregate.name() + " " + aggregate.fields());
            }
        }
        for (Map.Entry<String, String> e : unchanged.entrySet()) {
            String padded = String.format("%-" + (maxLen + 2) + "s", e.getKey());
            out.println(padded + ": unchanged  (" + e.getValue() + ")");
        }
        out.println();
    }
}
