package edu.uw.cse.outparam.ir;

import java.util.List;
import java.util.Objects;

public record BasicBlock(int index, List<Statement> statements, Terminator terminator) {

    public BasicBlock {
        statements = List.copyOf(statements);
        Objects.requireNonNull(terminator);
    }

    public List<Integer> successors() {
        return terminator.getSuccessors();
    }
}
