package edu.uw.cse.outparam.ir;

import java.util.Objects;

/**
 * The static type of a parameter, field or cast target, reduced to what the
 * analysis needs to know.
 */
public interface TypeRef {

    static TypeRef pointerTo(TypeRef pointee) {
        return new Pointer(pointee);
    }

    static TypeRef named(String name) {
        return new Named(name);
    }

    static TypeRef scalar(String name) {
        return new Scalar(name);
    }

    record Pointer(TypeRef pointee) implements TypeRef {
        public Pointer {
            Objects.requireNonNull(pointee);
        }

        @Override
        public String toString() {
            return "*" + pointee;
        }
    }

    /** A nominal type; it is an aggregate only if the program context declares it. */
    record Named(String name) implements TypeRef {
        @Override
        public String toString() {
            return name;
        }
    }

    record Scalar(String name) implements TypeRef {
        @Override
        public String toString() {
            return name;
        }
    }
}
