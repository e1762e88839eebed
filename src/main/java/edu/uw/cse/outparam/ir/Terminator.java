package edu.uw.cse.outparam.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ends a basic block and names its successors explicitly.
 */
public final class Terminator {

    public enum Kind {
        GOTO,
        BRANCH,
        CALL,
        RETURN,
        THROW,
        UNREACHABLE
    }

    private final Kind kind;
    private final List<Integer> successors;

    // CALL only
    private final String callee;
    private final List<Operand> args;
    private final Place destination;

    private Terminator(Kind kind, List<Integer> successors, String callee,
                       List<Operand> args, Place destination) {
        this.kind = kind;
        this.successors = List.copyOf(successors);
        this.callee = callee;
        this.args = List.copyOf(args);
        this.destination = destination;
    }

    public static Terminator gotoBlock(int target) {
        return new Terminator(Kind.GOTO, List.of(target), null, List.of(), null);
    }

    public static Terminator branch(List<Integer> targets) {
        return new Terminator(Kind.BRANCH, targets, null, List.of(), null);
    }

    public static Terminator branch(int ifTrue, int ifFalse) {
        return branch(List.of(ifTrue, ifFalse));
    }

    /**
     * A call. {@code target} is the normal continuation (null when the callee
     * never returns), {@code unwind} lists exceptional continuations.
     */
    public static Terminator call(String callee, List<Operand> args, Place destination,
                                  Integer target, List<Integer> unwind) {
        List<Integer> succ = new ArrayList<>();
        if (target != null) succ.add(target);
        succ.addAll(unwind);
        return new Terminator(Kind.CALL, succ, callee, args, destination);
    }

    public static Terminator returns() {
        return new Terminator(Kind.RETURN, List.of(), null, List.of(), null);
    }

    public static Terminator throwsTo(List<Integer> handlers) {
        return new Terminator(Kind.THROW, handlers, null, List.of(), null);
    }

    public static Terminator unreachable() {
        return new Terminator(Kind.UNREACHABLE, List.of(), null, List.of(), null);
    }

    public Kind getKind() {
        return kind;
    }

    public List<Integer> getSuccessors() {
        return successors;
    }

    public boolean isReturn() {
        return kind == Kind.RETURN;
    }

    public List<Operand> getArgs() {
        return args;
    }

    public Optional<Place> getDestination() {
        return Optional.ofNullable(destination);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CALL -> (destination != null ? destination + " = " : "")
                + callee + args + " -> " + successors;
            case RETURN -> "return";
            case UNREACHABLE -> "unreachable";
            default -> kind.name().toLowerCase() + " -> " + successors;
        };
    }
}
