package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.Place;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Places that may hold on some path. Join is union, bottom is empty.
 */
public final class MayPlaceSet implements JoinSemiLattice<MayPlaceSet>, GenKill<MayPlaceSet> {

    private static final MayPlaceSet BOTTOM = new MayPlaceSet(Set.of());

    private final Set<Place> places;

    private MayPlaceSet(Set<Place> places) {
        this.places = places;
    }

    public static MayPlaceSet bottom() {
        return BOTTOM;
    }

    public static MayPlaceSet of(Collection<Place> places) {
        return new MayPlaceSet(Set.copyOf(places));
    }

    public Set<Place> places() {
        return places;
    }

    public boolean contains(Place place) {
        return places.contains(place);
    }

    @Override
    public MayPlaceSet join(MayPlaceSet other) {
        if (other.places.isEmpty() || places.containsAll(other.places)) return this;
        if (places.isEmpty()) return other;
        Set<Place> union = new HashSet<>(places);
        union.addAll(other.places);
        return new MayPlaceSet(Set.copyOf(union));
    }

    @Override
    public MayPlaceSet gen(Place place) {
        if (places.contains(place)) return this;
        Set<Place> s = new HashSet<>(places);
        s.add(place);
        return new MayPlaceSet(Set.copyOf(s));
    }

    @Override
    public MayPlaceSet kill(Place place) {
        if (!places.contains(place)) return this;
        Set<Place> s = new HashSet<>(places);
        s.remove(place);
        return new MayPlaceSet(Set.copyOf(s));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MayPlaceSet other)) return false;
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
