package edu.uw.cse.outparam.ir;

/**
 * Where a function comes from. {@code line} is -1 when unknown.
 */
public record SourceLocation(String unit, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", -1);

    @Override
    public String toString() {
        return line < 0 ? unit : unit + ":" + line;
    }
}
