package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.dataflow.DataflowResults;
import edu.uw.cse.outparam.dataflow.DataflowSolver;
import edu.uw.cse.outparam.dataflow.MayPlaceSet;
import edu.uw.cse.outparam.dataflow.MustPlaceSet;
import edu.uw.cse.outparam.dataflow.PlaceSets;
import edu.uw.cse.outparam.ir.AggregateType;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Parameter;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.ProgramContext;
import edu.uw.cse.outparam.output.DataflowTracer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which pointer parameters of a function are output parameters.
 *
 * Algorithm:
 * 1. W = places written through a pointer local anywhere in the body
 * 2. R = places read before written, at function entry (backward analysis)
 * 3. Keep the places of W rooted at a parameter and not in R; stop if none
 * 4. M = places written on every path to every reachable return (forward analysis)
 * 5. MustWrites = M ∩ W, MayWrites = W − MustWrites
 */
public class OutputParamClassifier {

    private final ProgramContext context;
    private final boolean debug;

    public OutputParamClassifier(ProgramContext context, boolean debug) {
        this.context = context;
        this.debug = debug;
    }

    public OutputParamClassifier(ProgramContext context) {
        this(context, false);
    }

    /**
     * Classify one function.
     *
     * @return the classification, or empty if the function has no candidate
     *         parameters and is left unchanged
     * @throws edu.uw.cse.outparam.ir.MalformedBodyException if the body refers
     *         to undefined locals or blocks
     */
    public Optional<FunctionClassification> classify(FunctionBody body) {
        String name = body.getQualifiedName();
        if (body.parameterCount() == 0) {
            if (debug) System.out.println("Debug== [outparam] " + name + ": no parameters, skipped");
            return Optional.empty();
        }
        body.validate();

        Set<Place> writes = WriteCollector.collect(body);
        DataflowResults<MayPlaceSet> readResults =
            DataflowSolver.solve(body, ReadsBeforeWriteAnalysis.INSTANCE);
        MayPlaceSet reads = readResults.stateAtBlockStart(0);

        if (debug) {
            DataflowTracer.trace(readResults);
            System.out.println("Debug== [outparam] " + name + ": writes W = " + PlaceSets.format(writes));
            System.out.println("Debug== [outparam] " + name + ": reads before write R = " + reads);
        }

        writes.removeIf(place -> !body.isParameter(place.local()) || reads.contains(place));
        if (writes.isEmpty()) {
            if (debug) System.out.println("Debug== [outparam] " + name + ": no candidate writes");
            return Optional.empty();
        }

        DataflowResults<MustPlaceSet> writeResults =
            DataflowSolver.solve(body, MustWriteAnalysis.INSTANCE);
        MustPlaceSet atReturns = MustWriteAnalysis.returnSiteValue(writeResults);

        Set<Place> mustWrites = new HashSet<>(atReturns.asSet().orElse(Set.of()));
        mustWrites.retainAll(writes);
        Set<Place> mayWrites = new HashSet<>(writes);
        mayWrites.removeAll(mustWrites);

        if (debug) {
            DataflowTracer.trace(writeResults);
            System.out.println("Debug== [outparam] " + name + ": written at returns M = " + atReturns);
            System.out.println("Debug== [outparam] " + name + ": must = " + PlaceSets.format(mustWrites)
                + ", may = " + PlaceSets.format(mayWrites));
        }

        Map<Integer, AggregateType> aggregates = new HashMap<>();
        for (Parameter param : body.getParameters()) {
            boolean classified = writes.stream().anyMatch(p -> p.local() == param.index());
            if (classified) {
                context.pointedAggregate(param.type())
                    .ifPresent(aggregate -> aggregates.put(param.index(), aggregate));
            }
        }

        return Optional.of(new FunctionClassification(name, body.getLocation(),
            body.getParameters(), mustWrites, mayWrites, aggregates));
    }
}
