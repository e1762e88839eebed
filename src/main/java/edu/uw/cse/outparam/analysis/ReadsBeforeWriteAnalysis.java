package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.dataflow.DataflowAnalysis;
import edu.uw.cse.outparam.dataflow.Direction;
import edu.uw.cse.outparam.dataflow.MayPlaceSet;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.Statement;

/**
 * Backward analysis: at each point, the places behind pointers that some
 * path starting there reads before writing them.
 *
 * Walking an assignment {@code lhs = rhs} backwards, a write to {@code lhs}
 * satisfies any read demand further down, and every place read by
 * {@code rhs} becomes demand. Terminators, calls included, pass the demand
 * through untouched.
 */
public final class ReadsBeforeWriteAnalysis implements DataflowAnalysis<MayPlaceSet> {

    public static final ReadsBeforeWriteAnalysis INSTANCE = new ReadsBeforeWriteAnalysis();

    private ReadsBeforeWriteAnalysis() {
    }

    @Override
    public String name() {
        return "reads_before_write";
    }

    @Override
    public Direction direction() {
        return Direction.BACKWARD;
    }

    @Override
    public MayPlaceSet bottomValue(FunctionBody body) {
        return MayPlaceSet.bottom();
    }

    @Override
    public MayPlaceSet applyStatement(MayPlaceSet state, Statement statement, Location location) {
        if (!(statement instanceof Statement.Assign assign)) {
            return state;
        }
        if (assign.lhs().isIndirectFirstProjection()) {
            state = state.kill(assign.lhs());
        }
        for (Place read : RvalueReads.places(assign.rhs())) {
            if (read.isIndirectFirstProjection()) {
                state = state.gen(read);
            }
        }
        return state;
    }
}
