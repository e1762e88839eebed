package edu.uw.cse.outparam.output;

import edu.uw.cse.outparam.dataflow.DataflowResults;
import edu.uw.cse.outparam.dataflow.JoinSemiLattice;
import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;

import java.io.PrintStream;
import java.util.BitSet;
import java.util.List;

/**
 * Prints the fixpoint of an analysis statement by statement, for debug runs.
 * States are labelled in program order whatever the analysis direction:
 * "before" holds just ahead of the statement, "after" just past the terminator.
 */
public class DataflowTracer {

    public static <D extends JoinSemiLattice<D>> void trace(DataflowResults<D> results) {
        trace(results, System.out);
    }

    public static <D extends JoinSemiLattice<D>> void trace(DataflowResults<D> results, PrintStream out) {
        FunctionBody body = results.getBody();
        BitSet reachable = body.reachableBlocks();
        out.println("Debug== ===== " + results.getAnalysis().name() + " on "
            + body.getQualifiedName() + " (" + results.getAnalysis().direction().name().toLowerCase()
            + ", " + results.getBlockVisits() + " block visits) =====");
        for (BasicBlock block : body.getBlocks()) {
            if (!reachable.get(block.index())) continue;
            List<D> states = results.pointStates(block.index());
            out.println("Debug== Block " + block.index() + " starts");
            for (int i = 0; i < block.statements().size(); i++) {
                out.println("Debug==   before: " + states.get(i));
                out.println("Debug==   " + block.statements().get(i));
            }
            out.println("Debug==   before: " + states.get(block.statements().size()));
            out.println("Debug==   " + block.terminator());
            out.println("Debug==   after:  " + states.get(block.statements().size() + 1));
            out.println("Debug== Block " + block.index() + " ends");
        }
    }
}
