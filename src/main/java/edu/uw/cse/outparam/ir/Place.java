package edu.uw.cse.outparam.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A storage location: a root local plus a chain of projections.
 * Equality is structural, so two places built independently for the
 * same access compare equal.
 *
 * Local 0 is the return slot, locals 1..n are the parameters.
 */
public record Place(int local, List<Projection> projections) {

    public Place {
        if (local < 0) {
            throw new IllegalArgumentException("negative local: " + local);
        }
        projections = List.copyOf(projections);
    }

    public static Place local(int local) {
        return new Place(local, List.of());
    }

    /** {@code *local} */
    public static Place deref(int local) {
        return new Place(local, List.of(Projection.DEREF));
    }

    /** {@code (*local).field} */
    public static Place derefField(int local, String field) {
        return new Place(local, List.of(Projection.DEREF, Projection.field(field)));
    }

    public Place project(Projection projection) {
        List<Projection> extended = new ArrayList<>(projections);
        extended.add(projection);
        return new Place(local, extended);
    }

    /**
     * True when the access starts by dereferencing the root local directly,
     * i.e. the place lives behind a pointer held in {@code local}.
     */
    public boolean isIndirectFirstProjection() {
        return !projections.isEmpty() && projections.get(0) instanceof Projection.Deref;
    }

    @Override
    public String toString() {
        String s = "_" + local;
        for (Projection p : projections) {
            s = p instanceof Projection.Deref ? "(*" + s + ")" : s + p;
        }
        return s;
    }
}
