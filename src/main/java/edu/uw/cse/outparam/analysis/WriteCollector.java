package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.Statement;

import java.util.HashSet;
import java.util.Set;

/**
 * Collects every place written through a pointer held in a local, on any path.
 */
public final class WriteCollector {

    private WriteCollector() {
    }

    public static Set<Place> collect(FunctionBody body) {
        Set<Place> writes = new HashSet<>();
        for (BasicBlock block : body.getBlocks()) {
            for (Statement stmt : block.statements()) {
                if (stmt instanceof Statement.Assign assign && assign.lhs().isIndirectFirstProjection()) {
                    writes.add(assign.lhs());
                }
            }
        }
        return writes;
    }
}
