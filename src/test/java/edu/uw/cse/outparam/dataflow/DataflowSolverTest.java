package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.TestBodies;
import edu.uw.cse.outparam.analysis.MustWriteAnalysis;
import edu.uw.cse.outparam.analysis.ReadsBeforeWriteAnalysis;
import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Location;
import edu.uw.cse.outparam.ir.Operand;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.Rvalue;
import edu.uw.cse.outparam.ir.Statement;
import edu.uw.cse.outparam.ir.Terminator;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Properties of the worklist solver over randomly generated small graphs.
 */
public class DataflowSolverTest {

    private static final int GRAPHS = 300;

    @Test
    public void testConvergesWithinLatticeHeightBound() {
        Random rnd = new Random(503);
        for (int i = 0; i < GRAPHS; i++) {
            FunctionBody body = randomBody(rnd);
            int places = indirectPlaces(body).size();
            int bound = body.blockCount() * (places + 2);

            DataflowResults<MayPlaceSet> reads = DataflowSolver.solve(body, ReadsBeforeWriteAnalysis.INSTANCE);
            DataflowResults<MustPlaceSet> writes = DataflowSolver.solve(body, MustWriteAnalysis.INSTANCE);

            assertTrue("reads took " + reads.getBlockVisits() + " > " + bound,
                reads.getBlockVisits() <= bound);
            assertTrue("writes took " + writes.getBlockVisits() + " > " + bound,
                writes.getBlockVisits() <= bound);
        }
    }

    @Test
    public void testResultsAreFixpoints() {
        Random rnd = new Random(17);
        for (int i = 0; i < GRAPHS; i++) {
            FunctionBody body = randomBody(rnd);

            DataflowResults<MustPlaceSet> forward = DataflowSolver.solve(body, MustWriteAnalysis.INSTANCE);
            for (BasicBlock block : body.getBlocks()) {
                List<MustPlaceSet> states = forward.pointStates(block.index());
                MustPlaceSet out = states.get(states.size() - 1);
                for (int succ : block.successors()) {
                    MustPlaceSet in = forward.entrySet(succ);
                    assertEquals(in, in.join(out));
                }
            }

            DataflowResults<MayPlaceSet> backward = DataflowSolver.solve(body, ReadsBeforeWriteAnalysis.INSTANCE);
            for (BasicBlock block : body.getBlocks()) {
                MayPlaceSet start = backward.stateAtBlockStart(block.index());
                for (int pred : body.predecessors(block.index())) {
                    MayPlaceSet end = backward.entrySet(pred);
                    assertEquals(end, end.join(start));
                }
            }
        }
    }

    @Test
    public void testSolvingTwiceGivesSameResult() {
        Random rnd = new Random(42);
        for (int i = 0; i < 50; i++) {
            FunctionBody body = randomBody(rnd);
            DataflowResults<MustPlaceSet> first = DataflowSolver.solve(body, MustWriteAnalysis.INSTANCE);
            DataflowResults<MustPlaceSet> second = DataflowSolver.solve(body, MustWriteAnalysis.INSTANCE);
            for (int b = 0; b < body.blockCount(); b++) {
                assertEquals(first.entrySet(b), second.entrySet(b));
            }
        }
    }

    @Test
    public void testMayTransferIsMonotone() {
        Random rnd = new Random(7);
        List<Place> universe = universe(2);
        for (int i = 0; i < 500; i++) {
            Statement stmt = randomStatement(rnd, 2, 3);
            MayPlaceSet a = MayPlaceSet.of(randomSubset(rnd, universe));
            MayPlaceSet b = a.join(MayPlaceSet.of(randomSubset(rnd, universe)));

            MayPlaceSet fa = ReadsBeforeWriteAnalysis.INSTANCE.applyStatement(a, stmt, new Location(0, 0));
            MayPlaceSet fb = ReadsBeforeWriteAnalysis.INSTANCE.applyStatement(b, stmt, new Location(0, 0));
            assertEquals("not monotone on " + stmt, fb, fa.join(fb));
        }
    }

    @Test
    public void testMustTransferIsMonotone() {
        Random rnd = new Random(11);
        List<Place> universe = universe(2);
        for (int i = 0; i < 500; i++) {
            Statement stmt = randomStatement(rnd, 2, 3);
            MustPlaceSet a = rnd.nextInt(5) == 0
                ? MustPlaceSet.top() : MustPlaceSet.of(randomSubset(rnd, universe));
            MustPlaceSet b = a.join(MustPlaceSet.of(randomSubset(rnd, universe)));

            MustPlaceSet fa = MustWriteAnalysis.INSTANCE.applyStatement(a, stmt, new Location(0, 0));
            MustPlaceSet fb = MustWriteAnalysis.INSTANCE.applyStatement(b, stmt, new Location(0, 0));
            assertEquals("not monotone on " + stmt, fb, fa.join(fb));
        }
    }

    // --- Helpers ---

    public static FunctionBody randomBody(Random rnd) {
        FunctionBody.Builder b = FunctionBody.builder("random");
        int params = 1 + rnd.nextInt(3);
        for (int p = 0; p < params; p++) {
            b.parameter("p" + p, TestBodies.POINT_PTR);
        }
        int temp = b.newLocal();
        int blocks = 2 + rnd.nextInt(7);
        for (int i = 0; i < blocks; i++) {
            List<Statement> stmts = new ArrayList<>();
            int count = rnd.nextInt(4);
            for (int s = 0; s < count; s++) {
                stmts.add(randomStatement(rnd, params, temp));
            }
            Terminator term = switch (rnd.nextInt(4)) {
                case 0 -> Terminator.returns();
                case 1 -> Terminator.gotoBlock(rnd.nextInt(blocks));
                default -> Terminator.branch(rnd.nextInt(blocks), rnd.nextInt(blocks));
            };
            b.block(stmts, term);
        }
        return b.build();
    }

    private static Statement randomStatement(Random rnd, int params, int temp) {
        Place target = randomPlace(rnd, params);
        return switch (rnd.nextInt(3)) {
            case 0 -> TestBodies.write(target);
            case 1 -> TestBodies.assign(Place.local(temp), TestBodies.use(target));
            default -> TestBodies.assign(target, new Rvalue.BinaryOp("Add",
                Operand.copy(randomPlace(rnd, params)), Operand.copy(Place.local(temp)), false));
        };
    }

    private static Place randomPlace(Random rnd, int params) {
        int p = 1 + rnd.nextInt(params);
        return switch (rnd.nextInt(3)) {
            case 0 -> Place.deref(p);
            case 1 -> Place.derefField(p, "x");
            default -> Place.derefField(p, "y");
        };
    }

    private static List<Place> universe(int params) {
        List<Place> places = new ArrayList<>();
        for (int p = 1; p <= params; p++) {
            places.add(Place.deref(p));
            places.add(Place.derefField(p, "x"));
            places.add(Place.derefField(p, "y"));
        }
        return places;
    }

    private static List<Place> randomSubset(Random rnd, List<Place> universe) {
        List<Place> subset = new ArrayList<>();
        for (Place p : universe) {
            if (rnd.nextBoolean()) subset.add(p);
        }
        return subset;
    }

    private static Set<Place> indirectPlaces(FunctionBody body) {
        Set<Place> places = new HashSet<>();
        for (BasicBlock block : body.getBlocks()) {
            for (Statement stmt : block.statements()) {
                if (stmt instanceof Statement.Assign assign) {
                    if (assign.lhs().isIndirectFirstProjection()) places.add(assign.lhs());
                    Rvalue rhs = assign.rhs();
                    if (rhs instanceof Rvalue.Use use) {
                        use.operand().place().filter(Place::isIndirectFirstProjection).ifPresent(places::add);
                    } else if (rhs instanceof Rvalue.BinaryOp op) {
                        op.left().place().filter(Place::isIndirectFirstProjection).ifPresent(places::add);
                        op.right().place().filter(Place::isIndirectFirstProjection).ifPresent(places::add);
                    }
                }
            }
        }
        return places;
    }
}
