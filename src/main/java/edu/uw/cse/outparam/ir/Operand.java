package edu.uw.cse.outparam.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * An operand of a right-hand side: a copy or move out of a place, or a constant.
 */
public final class Operand {

    public enum Kind { COPY, MOVE, CONSTANT }

    private final Kind kind;
    private final Place place;    // null for constants
    private final String constant; // null for places

    private Operand(Kind kind, Place place, String constant) {
        this.kind = kind;
        this.place = place;
        this.constant = constant;
    }

    public static Operand copy(Place place) {
        return new Operand(Kind.COPY, Objects.requireNonNull(place), null);
    }

    public static Operand move(Place place) {
        return new Operand(Kind.MOVE, Objects.requireNonNull(place), null);
    }

    public static Operand constant(String text) {
        return new Operand(Kind.CONSTANT, null, Objects.requireNonNull(text));
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<Place> place() {
        return Optional.ofNullable(place);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand other)) return false;
        return kind == other.kind
            && Objects.equals(place, other.place)
            && Objects.equals(constant, other.constant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, place, constant);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case COPY -> "copy " + place;
            case MOVE -> "move " + place;
            case CONSTANT -> "const " + constant;
        };
    }
}
