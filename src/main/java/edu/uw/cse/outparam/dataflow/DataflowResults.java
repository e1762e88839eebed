package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixpoint of one analysis over one body. Facts inside a block are
 * recomputed on demand from the block's entry set.
 */
public final class DataflowResults<D extends JoinSemiLattice<D>> {

    private final FunctionBody body;
    private final DataflowAnalysis<D> analysis;
    private final List<D> entrySets;
    private final int blockVisits;

    DataflowResults(FunctionBody body, DataflowAnalysis<D> analysis, List<D> entrySets,
                    int blockVisits) {
        this.body = body;
        this.analysis = analysis;
        this.entrySets = List.copyOf(entrySets);
        this.blockVisits = blockVisits;
    }

    public FunctionBody getBody() {
        return body;
    }

    public DataflowAnalysis<D> getAnalysis() {
        return analysis;
    }

    /** Number of block transfers the solver ran before reaching the fixpoint. */
    public int getBlockVisits() {
        return blockVisits;
    }

    /** The stored fact: block start for forward analyses, block end for backward ones. */
    public D entrySet(int block) {
        return entrySets.get(block);
    }

    public D stateAtBlockStart(int block) {
        return pointStates(block).get(0);
    }

    /** The fact at the point just before the block's terminator executes. */
    public D stateBeforeTerminator(int block) {
        List<D> states = pointStates(block);
        return states.get(states.size() - 2);
    }

    /**
     * Facts at every point of a block in program order: before each statement,
     * then before the terminator, then after it.
     */
    public List<D> pointStates(int block) {
        BasicBlock bb = body.block(block);
        int size = bb.statements().size();
        List<D> states = new ArrayList<>(Collections.nCopies(size + 2, (D) null));

        D state = entrySets.get(block);
        if (analysis.direction() == Direction.FORWARD) {
            states.set(0, state);
            for (int i = 0; i < size; i++) {
                state = analysis.applyStatement(state, bb.statements().get(i), new Location(block, i));
                states.set(i + 1, state);
            }
            states.set(size + 1, analysis.applyTerminator(state, bb.terminator(), new Location(block, size)));
        } else {
            states.set(size + 1, state);
            state = analysis.applyTerminator(state, bb.terminator(), new Location(block, size));
            states.set(size, state);
            for (int i = size - 1; i >= 0; i--) {
                state = analysis.applyStatement(state, bb.statements().get(i), new Location(block, i));
                states.set(i, state);
            }
        }
        return states;
    }
}
