package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.Place;

/**
 * Domains whose transfer functions only add or remove single places.
 */
public interface GenKill<T> {

    T gen(Place place);

    T kill(Place place);
}
