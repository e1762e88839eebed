package edu.uw.cse.outparam.dataflow;

public enum Direction {
    /** Facts flow from the entry along control-flow edges. */
    FORWARD,
    /** Facts flow from exits against control-flow edges. */
    BACKWARD
}
