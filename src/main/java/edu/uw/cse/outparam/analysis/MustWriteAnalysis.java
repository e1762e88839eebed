package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.dataflow.DataflowAnalysis;
import edu.uw.cse.outparam.dataflow.DataflowResults;
import edu.uw.cse.outparam.dataflow.Direction;
import edu.uw.cse.outparam.dataflow.MustPlaceSet;
import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;
import edu.uw.cse.outparam.ir.Statement;

import java.util.BitSet;

/**
 * Forward analysis: at each point, the places behind pointers that every
 * path from the entry has written at least once. Writes are never undone.
 */
public final class MustWriteAnalysis implements DataflowAnalysis<MustPlaceSet> {

    public static final MustWriteAnalysis INSTANCE = new MustWriteAnalysis();

    private MustWriteAnalysis() {
    }

    @Override
    public String name() {
        return "must_write";
    }

    @Override
    public Direction direction() {
        return Direction.FORWARD;
    }

    /** Blocks nothing has reached yet impose no constraint. */
    @Override
    public MustPlaceSet bottomValue(FunctionBody body) {
        return MustPlaceSet.top();
    }

    /** Nothing is written on entry. */
    @Override
    public MustPlaceSet boundaryValue(FunctionBody body) {
        return MustPlaceSet.empty();
    }

    @Override
    public MustPlaceSet applyStatement(MustPlaceSet state, Statement statement, Location location) {
        if (statement instanceof Statement.Assign assign && assign.lhs().isIndirectFirstProjection()) {
            return state.gen(assign.lhs());
        }
        return state;
    }

    /**
     * Joins the facts at every reachable return. Without a reachable return
     * nothing is guaranteed, so the result is the empty set rather than Top.
     */
    public static MustPlaceSet returnSiteValue(DataflowResults<MustPlaceSet> results) {
        FunctionBody body = results.getBody();
        BitSet reachable = body.reachableBlocks();
        MustPlaceSet combined = MustPlaceSet.top();
        for (BasicBlock block : body.getBlocks()) {
            if (reachable.get(block.index()) && block.terminator().isReturn()) {
                combined = combined.join(results.stateBeforeTerminator(block.index()));
            }
        }
        return combined.isTop() ? MustPlaceSet.empty() : combined;
    }
}
