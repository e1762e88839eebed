package edu.uw.cse.outparam.output;

import edu.uw.cse.outparam.TestBodies;
import edu.uw.cse.outparam.analysis.FunctionClassification;
import edu.uw.cse.outparam.analysis.OutputParamClassifier;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ResultPrinterTest {

    private static String print(List<FunctionClassification> classifications, Map<String, String> unchanged) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        ResultPrinter.print(classifications, unchanged, out);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testEmptyBatch() {
        assertEquals("No functions analyzed.", print(List.of(), Map.of()).trim());
    }

    @Test
    public void testAlignedRows() {
        FunctionClassification c = new OutputParamClassifier(TestBodies.CONTEXT)
            .classify(TestBodies.straightLineWrite()).orElseThrow();
        String text = print(List.of(c), Map.of("longer", "no output parameters"));

        String[] lines = text.split("\\R");
        assertEquals("", lines[0]);
        assertEquals("=== Output Parameter Analysis Results ===", lines[1]);
        assertEquals("f       : must {(*_1)}  may {}  (<unknown>)", lines[2]);
        assertEquals("    1: Point [x: int, y: int]", lines[3]);
        assertEquals("longer  : unchanged  (no output parameters)", lines[4]);
    }

    @Test
    public void testMayPlacesSorted() {
        FunctionClassification c = new OutputParamClassifier(TestBodies.CONTEXT)
            .classify(TestBodies.conditionalWrite()).orElseThrow();
        String text = print(List.of(c), Map.of());
        assertTrue(text, text.contains("f  : must {}  may {(*_1)}"));
    }
}
