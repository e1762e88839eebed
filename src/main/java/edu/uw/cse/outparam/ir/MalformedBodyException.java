package edu.uw.cse.outparam.ir;

/**
 * Thrown when a function body refers to a local or block it does not define.
 * Fatal for that one function only.
 */
public class MalformedBodyException extends RuntimeException {

    private final String function;

    public MalformedBodyException(String function, String message) {
        super(function + ": " + message);
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
