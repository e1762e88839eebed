package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;
import edu.uw.cse.outparam.ir.Statement;
import edu.uw.cse.outparam.ir.Terminator;

/**
 * A monotone dataflow problem over one function body, solved by
 * {@link DataflowSolver}.
 *
 * @param <D> the lattice of facts
 */
public interface DataflowAnalysis<D extends JoinSemiLattice<D>> {

    String name();

    Direction direction();

    /** Initial value of every block before anything flows into it. */
    D bottomValue(FunctionBody body);

    /**
     * Value of the boundary blocks: the entry block for a forward analysis,
     * the blocks without successors for a backward one.
     */
    default D boundaryValue(FunctionBody body) {
        return bottomValue(body);
    }

    D applyStatement(D state, Statement statement, Location location);

    /** Terminators leave the state unchanged unless an analysis says otherwise. */
    default D applyTerminator(D state, Terminator terminator, Location location) {
        return state;
    }
}
