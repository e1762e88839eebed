package edu.uw.cse.outparam.ir;

/**
 * A program point: statement {@code statement} of block {@code block}.
 * The terminator sits at {@code statement == statements().size()}.
 */
public record Location(int block, int statement) {

    @Override
    public String toString() {
        return "bb" + block + "[" + statement + "]";
    }
}
