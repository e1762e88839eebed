package edu.uw.cse.outparam.ir;

/**
 * A declared parameter. {@code index} is 1-based and equals the local that
 * holds the parameter inside the body.
 */
public record Parameter(int index, String name, TypeRef type) {
}
