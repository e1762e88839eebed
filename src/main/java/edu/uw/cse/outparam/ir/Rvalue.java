package edu.uw.cse.outparam.ir;

import java.util.List;

/**
 * The right-hand side of an assignment. Each shape is a nested record;
 * {@link Opaque} stands for anything a front end could not map to one of
 * the others.
 */
public interface Rvalue {

    record Use(Operand operand) implements Rvalue {}

    /** {@code [operand; count]} */
    record Repeat(Operand operand, Operand count) implements Rvalue {}

    record Cast(Operand operand, TypeRef target) implements Rvalue {}

    record UnaryOp(String op, Operand operand) implements Rvalue {}

    /** Initialisation of a freshly allocated box from an operand. */
    record ShallowInitBox(Operand operand, TypeRef type) implements Rvalue {}

    /** Binary operation; {@code checked} marks the overflow-checked variant. */
    record BinaryOp(String op, Operand left, Operand right, boolean checked) implements Rvalue {}

    record Aggregate(String kind, List<Operand> operands) implements Rvalue {
        public Aggregate {
            operands = List.copyOf(operands);
        }
    }

    /** A copy of a place made only so that it can be dereferenced afterwards. */
    record CopyForDeref(Place place) implements Rvalue {}

    record Ref(Place place, boolean mutable) implements Rvalue {}

    record AddressOf(Place place, boolean mutable) implements Rvalue {}

    record Len(Place place) implements Rvalue {}

    record Discriminant(Place place) implements Rvalue {}

    record NullaryOp(String op, TypeRef type) implements Rvalue {}

    record ThreadLocalRef(String name) implements Rvalue {}

    /** An expression the front end does not model. */
    record Opaque(String description) implements Rvalue {}
}
