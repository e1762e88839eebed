package edu.uw.cse.outparam.ir;

import java.util.Objects;

/**
 * A non-terminating statement of a basic block.
 */
public interface Statement {

    /** {@code lhs = rhs} */
    record Assign(Place lhs, Rvalue rhs) implements Statement {
        public Assign {
            Objects.requireNonNull(lhs);
            Objects.requireNonNull(rhs);
        }

        @Override
        public String toString() {
            return lhs + " = " + rhs;
        }
    }

    /** A statement without dataflow effect, kept so locations stay stable. */
    record Nop(String description) implements Statement {
        @Override
        public String toString() {
            return "nop(" + description + ")";
        }
    }
}
