package edu.uw.cse.outparam.dataflow;

/**
 * A dataflow domain. Values are immutable; {@link #join} returns the least
 * upper bound without touching either operand, and the solver detects change
 * with {@link Object#equals}.
 */
public interface JoinSemiLattice<T extends JoinSemiLattice<T>> {

    T join(T other);
}
