package org.satba;

import org.satba.term.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssertionFileProcessorTest {

    @Test
    @DisplayName("Commenti e righe vuote sono ignorati, ogni asserzione produce i suoi vincoli")
    void testProcess_AssertsEachLine() {
        AssertionFileProcessor.ProcessingReport report = new AssertionFileProcessor(false).process(List.of(
                "# esempio",
                "",
                "atmost(2: x1, x2, x3)",
                "pb(2 x1 + 3 x2 + x3 >= 4)",
                "x1 | !x3"));

        assertAll(
                () -> assertEquals(2, report.store().getConstraintCount()),
                () -> assertEquals(2, report.formulas().size()),
                () -> assertEquals(Term.Type.AT_LEAST_K, report.formulas().get(0).getType()),
                () -> assertEquals(Term.Type.PB_GE, report.formulas().get(1).getType()),
                () -> assertEquals(2, report.statistics().getUnconditionalAssertions()),
                () -> assertTrue(report.rejectedLines().isEmpty()),
                () -> assertNull(report.parityCache())
        );
    }

    @Test
    @DisplayName("push e pop ritraggono le asserzioni dello scope")
    void testPushPop() {
        AssertionFileProcessor.ProcessingReport report = new AssertionFileProcessor(false).process(List.of(
                "atleast(1: a, b)",
                "push",
                "exactly(1: a, b)",
                "a <-> b",
                "pop"));

        assertEquals(1, report.store().getConstraintCount());
        assertEquals(0, report.store().getClauseCount());
        assertEquals(0, report.store().scopeDepth());
    }

    @Test
    @DisplayName("Una riga con coefficienti fuori range è riportata e l'elaborazione prosegue")
    void testRejectedLine_Reported() {
        AssertionFileProcessor.ProcessingReport report = new AssertionFileProcessor(false).process(List.of(
                "pb(-2 a + b >= 1)",
                "atleast(1: a, pb(2.5 b >= 1))",
                "atleast(1: a, b)"));

        assertAll(
                () -> assertEquals(2, report.rejectedLines().size()),
                () -> assertTrue(report.rejectedLines().get(0).startsWith("riga 1: ")),
                () -> assertTrue(report.rejectedLines().get(1).startsWith("riga 2: ")),
                () -> assertEquals(1, report.store().getConstraintCount()),
                () -> assertEquals(2, report.statistics().getRejectedTerms())
        );
    }

    @Test
    @DisplayName("Errori sintattici e pop senza scope interrompono il file con il numero di riga")
    void testFatalErrors_ReportLineNumber() {
        AssertionFileProcessor processor = new AssertionFileProcessor(false);

        IllegalArgumentException syntax = assertThrows(IllegalArgumentException.class,
                () -> processor.process(List.of("a", "atleast(1 a)")));
        IllegalArgumentException pop = assertThrows(IllegalArgumentException.class,
                () -> processor.process(List.of("pop")));

        assertTrue(syntax.getMessage().startsWith("Riga 2: "));
        assertTrue(pop.getMessage().startsWith("Riga 1: "));
    }

    @Test
    @DisplayName("Con -opt=x la cache XOR registra le catene")
    void testParityCache_Enabled() {
        AssertionFileProcessor.ProcessingReport report = new AssertionFileProcessor(true).process(List.of(
                "a <-> b <-> c",
                "a <-> b"));

        assertNotNull(report.parityCache());
        assertEquals(2, report.parityCache().size());
        assertEquals(2, report.store().getClauseCount(), "Ogni catena alla radice è fissata da una unità");
    }

    @Test
    @DisplayName("Lettura da file")
    void testProcess_FromFile(@TempDir Path tempDir) throws IOException {
        Path input = tempDir.resolve("input.txt");
        Files.write(input, List.of("exactly(1: a, b, c)"), StandardCharsets.UTF_8);

        AssertionFileProcessor.ProcessingReport report = new AssertionFileProcessor(false).process(input);

        assertEquals(2, report.store().getConstraintCount());
    }
}
