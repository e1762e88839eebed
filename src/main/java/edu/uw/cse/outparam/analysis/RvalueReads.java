package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.ir.Operand;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.Rvalue;

import java.util.ArrayList;
import java.util.List;

/**
 * The places a right-hand side reads the value of.
 *
 * Taking a reference or an address, asking for a length or a discriminant,
 * and nullary or thread-local operations do not read the target. Unknown
 * shapes read nothing.
 */
final class RvalueReads {

    private RvalueReads() {
    }

    static List<Place> places(Rvalue rvalue) {
        List<Place> places = new ArrayList<>(2);
        if (rvalue instanceof Rvalue.Use r) {
            add(places, r.operand());
        } else if (rvalue instanceof Rvalue.Repeat r) {
            add(places, r.operand());
        } else if (rvalue instanceof Rvalue.Cast r) {
            add(places, r.operand());
        } else if (rvalue instanceof Rvalue.UnaryOp r) {
            add(places, r.operand());
        } else if (rvalue instanceof Rvalue.ShallowInitBox r) {
            add(places, r.operand());
        } else if (rvalue instanceof Rvalue.BinaryOp r) {
            add(places, r.left());
            add(places, r.right());
        } else if (rvalue instanceof Rvalue.Aggregate r) {
            for (Operand o : r.operands()) {
                add(places, o);
            }
        } else if (rvalue instanceof Rvalue.CopyForDeref r) {
            places.add(r.place());
        }
        return places;
    }

    private static void add(List<Place> places, Operand operand) {
        operand.place().ifPresent(places::add);
    }
}
