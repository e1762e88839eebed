package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.Place;

import java.util.Collection;
import java.util.List;

/**
 * Formatting of place sets for reports and debug traces.
 */
public final class PlaceSets {

    private PlaceSets() {
    }

    /** "{p1, p2, ...}" with places sorted by their printed form. */
    public static String format(Collection<Place> places) {
        List<String> strs = places.stream().map(Place::toString).sorted().toList();
        return "{" + String.join(", ", strs) + "}";
    }
}
