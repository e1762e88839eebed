package edu.uw.cse.outparam.ir;

import edu.uw.cse.outparam.TestBodies;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FunctionBodyTest {

    @Test
    public void testBuilderNumbersParametersFromOne() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        assertEquals(1, b.parameter("a", TestBodies.INT));
        assertEquals(2, b.parameter("b", TestBodies.POINT_PTR));
        assertEquals(3, b.newLocal());
        b.block(List.of(), Terminator.returns());
        FunctionBody body = b.build();

        assertEquals(2, body.parameterCount());
        assertEquals(4, body.getLocalCount());
        assertFalse(body.isParameter(0));
        assertTrue(body.isParameter(1));
        assertTrue(body.isParameter(2));
        assertFalse(body.isParameter(3));
        body.validate();
    }

    @Test(expected = IllegalStateException.class)
    public void testParametersAfterTemporariesRejected() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        b.newLocal();
        b.parameter("late", TestBodies.INT);
    }

    @Test
    public void testPredecessorsAndOrder() {
        FunctionBody body = TestBodies.conditionalWrite();
        assertEquals(List.of(0), body.predecessors(1));
        assertEquals(List.of(0, 1), body.predecessors(2));
        List<Integer> rpo = body.reversePostorder();
        assertEquals(Integer.valueOf(0), rpo.get(0));
        assertEquals(Integer.valueOf(2), rpo.get(2));
    }

    @Test
    public void testUnreachableBlockNotInPostorder() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        b.parameter("p", TestBodies.POINT_PTR);
        b.block(List.of(), Terminator.returns());
        b.block(List.of(), Terminator.gotoBlock(0));
        FunctionBody body = b.build();

        assertEquals(List.of(0), body.postorder());
        assertFalse(body.reachableBlocks().get(1));
    }

    @Test
    public void testUndefinedBlockIsMalformed() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        b.parameter("p", TestBodies.POINT_PTR);
        b.block(List.of(), Terminator.gotoBlock(7));
        try {
            b.build().validate();
            fail("expected MalformedBodyException");
        } catch (MalformedBodyException e) {
            assertEquals("f", e.getFunction());
            assertTrue(e.getMessage().contains("undefined block 7"));
        }
    }

    @Test
    public void testUndefinedLocalIsMalformed() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        b.parameter("p", TestBodies.POINT_PTR);
        b.block(List.of(TestBodies.write(Place.deref(5))), Terminator.returns());
        try {
            b.build().validate();
            fail("expected MalformedBodyException");
        } catch (MalformedBodyException e) {
            assertTrue(e.getMessage().contains("undefined local _5"));
        }
    }

    @Test
    public void testUndefinedIndexLocalIsMalformed() {
        FunctionBody.Builder b = FunctionBody.builder("f");
        int p = b.parameter("p", TestBodies.INT_PTR);
        b.block(List.of(TestBodies.write(Place.deref(p).project(Projection.index(9)))),
            Terminator.returns());
        try {
            b.build().validate();
            fail("expected MalformedBodyException");
        } catch (MalformedBodyException e) {
            assertTrue(e.getMessage().contains("_9"));
        }
    }

    @Test(expected = MalformedBodyException.class)
    public void testEmptyBodyIsMalformed() {
        FunctionBody.builder("f").build().validate();
    }
}
