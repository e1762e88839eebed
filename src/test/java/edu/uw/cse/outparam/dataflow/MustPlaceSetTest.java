package edu.uw.cse.outparam.dataflow;

import edu.uw.cse.outparam.ir.Place;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class MustPlaceSetTest {

    private static final Place A = Place.derefField(1, "x");
    private static final Place B = Place.derefField(1, "y");
    private static final Place C = Place.deref(2);

    @Test
    public void testTopIsIdentityOfJoin() {
        MustPlaceSet s = MustPlaceSet.of(List.of(A, B));
        assertEquals(s, MustPlaceSet.top().join(s));
        assertEquals(s, s.join(MustPlaceSet.top()));
        assertTrue(MustPlaceSet.top().join(MustPlaceSet.top()).isTop());
    }

    @Test
    public void testConcreteJoinIsIntersection() {
        MustPlaceSet left = MustPlaceSet.of(List.of(A, B));
        MustPlaceSet right = MustPlaceSet.of(List.of(B, C));
        assertEquals(MustPlaceSet.of(List.of(B)), left.join(right));
        assertEquals(left.join(right), right.join(left));
    }

    @Test
    public void testJoinWithEmptyIsEmpty() {
        MustPlaceSet s = MustPlaceSet.of(List.of(A));
        assertEquals(MustPlaceSet.empty(), s.join(MustPlaceSet.empty()));
    }

    @Test
    public void testGenOnTopStaysTop() {
        assertTrue(MustPlaceSet.top().gen(A).isTop());
        assertFalse(MustPlaceSet.top().asSet().isPresent());
    }

    @Test
    public void testGenAndKillOnConcrete() {
        MustPlaceSet s = MustPlaceSet.empty().gen(A).gen(B).gen(A);
        assertEquals(Set.of(A, B), s.asSet().orElseThrow());
        assertEquals(Set.of(B), s.kill(A).asSet().orElseThrow());
        assertEquals(MustPlaceSet.empty(), MustPlaceSet.empty().kill(A));
    }

    @Test
    public void testJoinIsIdempotent() {
        MustPlaceSet s = MustPlaceSet.of(List.of(A, C));
        assertEquals(s, s.join(s));
    }

    @Test
    public void testToString() {
        assertEquals("Top", MustPlaceSet.top().toString());
        assertEquals("{(*_1).x, (*_1).y}", MustPlaceSet.of(List.of(B, A)).toString());
    }
}
