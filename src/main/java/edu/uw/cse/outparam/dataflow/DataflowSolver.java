package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Worklist fixpoint iteration shared by every analysis, in either direction.
 *
 * Each block keeps one "entry set": the fact at its start for a forward
 * analysis, at its end for a backward one. A visited block pushes its
 * transferred fact into the entry sets of its successors (forward) or
 * predecessors (backward); a block is queued again whenever its entry set
 * grows. Termination follows from the finite height of the lattices and the
 * monotonicity of the transfer functions.
 */
public final class DataflowSolver {

    private DataflowSolver() {
    }

    public static <D extends JoinSemiLattice<D>> DataflowResults<D> solve(
            FunctionBody body, DataflowAnalysis<D> analysis) {
        int n = body.blockCount();
        List<D> entrySets = new ArrayList<>(n);
        D bottom = analysis.bottomValue(body);
        for (int i = 0; i < n; i++) {
            entrySets.add(bottom);
        }

        boolean forward = analysis.direction() == Direction.FORWARD;
        if (forward) {
            entrySets.set(0, analysis.boundaryValue(body));
        } else {
            D boundary = analysis.boundaryValue(body);
            for (BasicBlock block : body.getBlocks()) {
                if (block.successors().isEmpty()) {
                    entrySets.set(block.index(), boundary);
                }
            }
        }

        // Seed in an order that visits most blocks after their inputs.
        Deque<Integer> worklist = new ArrayDeque<>(n);
        BitSet queued = new BitSet(n);
        for (int b : forward ? body.reversePostorder() : body.postorder()) {
            worklist.add(b);
            queued.set(b);
        }
        for (int b = 0; b < n; b++) {
            if (!queued.get(b)) {
                worklist.add(b);
                queued.set(b);
            }
        }

        int visits = 0;
        while (!worklist.isEmpty()) {
            int b = worklist.poll();
            queued.clear(b);
            visits++;

            BasicBlock block = body.block(b);
            D state = entrySets.get(b);
            List<Integer> targets;
            if (forward) {
                state = applyForward(analysis, block, state);
                targets = block.successors();
            } else {
                state = applyBackward(analysis, block, state);
                targets = body.predecessors(b);
            }

            for (int t : targets) {
                D old = entrySets.get(t);
                D joined = old.join(state);
                if (!joined.equals(old)) {
                    entrySets.set(t, joined);
                    if (!queued.get(t)) {
                        worklist.add(t);
                        queued.set(t);
                    }
                }
            }
        }

        return new DataflowResults<>(body, analysis, entrySets, visits);
    }

    static <D extends JoinSemiLattice<D>> D applyForward(
            DataflowAnalysis<D> analysis, BasicBlock block, D state) {
        int i = 0;
        for (; i < block.statements().size(); i++) {
            state = analysis.applyStatement(state, block.statements().get(i),
                new Location(block.index(), i));
        }
        return analysis.applyTerminator(state, block.terminator(), new Location(block.index(), i));
    }

    static <D extends JoinSemiLattice<D>> D applyBackward(
            DataflowAnalysis<D> analysis, BasicBlock block, D state) {
        int size = block.statements().size();
        state = analysis.applyTerminator(state, block.terminator(), new Location(block.index(), size));
        for (int i = size - 1; i >= 0; i--) {
            state = analysis.applyStatement(state, block.statements().get(i),
                new Location(block.index(), i));
        }
        return state;
    }
}
