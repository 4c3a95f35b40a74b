package org.pltl.trace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pltl.formula.Formula;
import org.pltl.formula.MalformedFormulaException;
import org.pltl.formula.Operator;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class TraceSampleReaderTest {

    static final String FULL_SAMPLE = String.join("\n",
            "p,q",
            "---",
            "0,1;1,1;1,1",
            "1,1::0",
            "---",
            "1,0;0,1",
            "---",
            "!,G",
            "---",
            "U,&",
            "---",
            "3",
            "---",
            "G(q)");

    @Test void readsAllSections() {
        TraceSample sample = TraceSampleReader.parse(FULL_SAMPLE);

        assertEquals(List.of("p", "q"), sample.getLiterals());
        assertEquals(2, sample.getPositiveTraces().size());
        assertEquals(1, sample.getNegativeTraces().size());
        assertEquals(List.of(Operator.NOT, Operator.GLOBALLY), sample.getUnaryOperators());
        assertEquals(List.of(Operator.UNTIL, Operator.AND), sample.getBinaryOperators());
        assertEquals(3, sample.getFormulaSize());
        assertEquals(Formula.globally(Formula.atom("q")), sample.getTargetFormula());
        assertEquals(3, sample.maxTraceLength());
    }

    @Test void traceIdsAreLineNumbers() {
        TraceSample sample = TraceSampleReader.parse(FULL_SAMPLE);

        assertEquals("3", sample.getPositiveTraces().get(0).getId());
        assertEquals("4", sample.getPositiveTraces().get(1).getId());
        assertEquals("6", sample.getNegativeTraces().get(0).getId());
        assertEquals(List.of("p", "q"), sample.getNegativeTraces().get(0).getLiterals());
    }

    @Test void optionalSectionsMayBeMissing() {
        TraceSample sample = TraceSampleReader.parse("a\n---\n1;0\n---\n\n---\n");

        assertEquals(1, sample.getPositiveTraces().size());
        assertTrue(sample.getNegativeTraces().isEmpty());
        assertTrue(sample.getUnaryOperators().isEmpty());
        assertNull(sample.getFormulaSize());
        assertFalse(sample.hasTargetFormula());
    }

    @Test void missingLiteralsFail() {
        assertThrows(MalformedTraceException.class, () -> TraceSampleReader.parse("---\n1;0\n---\n"));
    }

    @Test void sizeAndTargetWithoutOperatorSections() {
        TraceSample sample = TraceSampleReader.parse("p,q\n---\n0,1;1,1\n---\n1,0\n---\n5\n---\nG(q)");

        assertTrue(sample.getUnaryOperators().isEmpty());
        assertTrue(sample.getBinaryOperators().isEmpty());
        assertEquals(5, sample.getFormulaSize());
        assertEquals(Formula.globally(Formula.atom("q")), sample.getTargetFormula());
    }

    @Test void targetOnlyAfterNegatives() {
        TraceSample sample = TraceSampleReader.parse("p,q\n---\n0,1;1,1\n---\n1,0\n---\nG(q)");

        assertNull(sample.getFormulaSize());
        assertEquals(Formula.globally(Formula.atom("q")), sample.getTargetFormula());
    }

    @Test void binaryOperatorsWithoutUnarySection() {
        TraceSample sample = TraceSampleReader.parse("p\n---\n1\n---\n0\n---\nU,S\n---\n3\n---\n");

        assertTrue(sample.getUnaryOperators().isEmpty());
        assertEquals(List.of(Operator.UNTIL, Operator.SINCE), sample.getBinaryOperators());
        assertEquals(3, sample.getFormulaSize());
        assertFalse(sample.hasTargetFormula());
    }

    @Test void mixedOperatorArityFails() {
        MalformedTraceException e = assertThrows(MalformedTraceException.class,
                () -> TraceSampleReader.parse("p\n---\n1\n---\n0\n---\n!,U\n---\n"));
        assertTrue(e.getMessage().contains("Riga 7"));
    }

    @Test void sectionsOutOfOrderFail() {
        MalformedTraceException e = assertThrows(MalformedTraceException.class,
                () -> TraceSampleReader.parse("p\n---\n1\n---\n0\n---\n3\n---\n!\n"));
        assertTrue(e.getMessage().contains("Riga 9"));
    }

    @Test void oversizedFormulaSizeFails() {
        assertThrows(MalformedTraceException.class,
                () -> TraceSampleReader.parse("p\n---\n1\n---\n0\n---\n99999999999\n"));
    }

    @Test void badTargetFormulaReportsLine() {
        MalformedFormulaException e = assertThrows(MalformedFormulaException.class,
                () -> TraceSampleReader.parse("p\n---\n1\n---\n0\n---\n!\n---\n&\n---\n2\n---\nU(p\n"));
        assertTrue(e.getMessage().startsWith("Riga 13"));
    }

    @Test void traceWithWrongWidthFails() {
        assertThrows(MalformedTraceException.class, () -> TraceSampleReader.parse("p,q\n---\n1;0\n---\n"));
    }

    @Test void readsFromDisk(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sample.trace");
        Files.writeString(file, FULL_SAMPLE);

        TraceSample sample = TraceSampleReader.read(file);

        assertEquals(2, sample.getPositiveTraces().size());
    }
}
