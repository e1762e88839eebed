package edu.uw.cse.outparam.analysis;

/**
 * A parameter a rewriting transform may turn into part of the return value.
 *
 * @param index     1-based parameter index
 * @param name      declared parameter name
 * @param must      true when the parameter is written on every path to every return
 * @param aggregate name of the pointed-to aggregate, or null if the type is not one
 */
public record OutputParam(int index, String name, boolean must, String aggregate) {
}
