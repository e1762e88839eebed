package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.Place;

import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Places guaranteed to hold on every path, with an explicit {@code Top} for
 * "nothing has flowed in yet".
 *
 * Join of two concrete sets is their intersection. {@code Top} is the
 * identity of join, so it plays the role of bottom in this lattice even
 * though it stands for "every place".
 */
public abstract class MustPlaceSet implements JoinSemiLattice<MustPlaceSet>, GenKill<MustPlaceSet> {

    private MustPlaceSet() {
    }

    public static MustPlaceSet top() {
        return Top.INSTANCE;
    }

    public static MustPlaceSet empty() {
        return Concrete.EMPTY;
    }

    public static MustPlaceSet of(Collection<Place> places) {
        return new Concrete(Set.copyOf(places));
    }

    public abstract boolean isTop();

    /** The concrete set, or empty for {@code Top}. */
    public abstract Optional<Set<Place>> asSet();

    public static final class Top extends MustPlaceSet {
        private static final Top INSTANCE = new Top();

        private Top() {
        }

        @Override
        public boolean isTop() {
            return true;
        }

        @Override
        public Optional<Set<Place>> asSet() {
            return Optional.empty();
        }

        @Override
        public MustPlaceSet join(MustPlaceSet other) {
            return other;
        }

        @Override
        public MustPlaceSet gen(Place place) {
            return this;
        }

        @Override
        public MustPlaceSet kill(Place place) {
            return this;
        }

        @Override
        public String toString() {
            return "Top";
        }
    }

    public static final class Concrete extends MustPlaceSet {
        private static final Concrete EMPTY = new Concrete(Set.of());

        private final Set<Place> places;

        private Concrete(Set<Place> places) {
            this.places = places;
        }

        public Set<Place> places() {
            return places;
        }

        @Override
        public boolean isTop() {
            return false;
        }

        @Override
        public Optional<Set<Place>> asSet() {
            return Optional.of(places);
        }

        @Override
        public MustPlaceSet join(MustPlaceSet other) {
            if (!(other instanceof Concrete c)) return this;
            if (c.places.containsAll(places)) return this;
            Set<Place> meet = new HashSet<>(places);
            meet.retainAll(c.places);
            return new Concrete(Set.copyOf(meet));
        }

        @Override
        public MustPlaceSet gen(Place place) {
            if (places.contains(place)) return this;
            Set<Place> s = new HashSet<>(places);
            s.add(place);
            return new Concrete(Set.copyOf(s));
        }

        @Override
        public MustPlaceSet kill(Place place) {
            if (!places.contains(place)) return this;
            Set<Place> s = new HashSet<>(places);
            s.remove(place);
            return new Concrete(Set.copyOf(s));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Concrete other)) return false;
            return places.equals(other.places);
        }

        @Override
        public int hashCode() {
            return places.hashCode();
        }

        @Override
        public String toString() {
            return PlaceSets.format(places);
        }
    }
}
