package org.natded;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Test del front end a linea di comando su flussi in memoria.
 */
public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        PrintStream console = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return Main.run(args, in, console);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testFormulaFromWords() {
        assertEquals(Main.EXIT_OK, run("", "A", "to", "A"));
        assertTrue(output().contains("A → A : 1\n+ A from: 1\n"));
    }

    @Test
    public void testTexFlag() {
        assertEquals(Main.EXIT_OK, run("", "-tex", "A to A"));
        assertTrue(output().contains("\\UnaryInfC{$A \\to A$}"));
    }

    @Test
    public void testFailureExitCode() {
        assertEquals(Main.EXIT_FAILURE, run("", "A and B and C"));
        assertTrue(output().contains("error when parsing:"));
    }

    @Test
    public void testNoArguments() {
        assertEquals(Main.EXIT_USAGE, run(""));
        assertTrue(output().startsWith("[E] "));
    }

    @Test
    public void testHelp() {
        assertEquals(Main.EXIT_OK, run("", "-h"));
        assertTrue(output().contains("UTILIZZO:"));
    }

    @Test
    public void testInvalidArguments() {
        assertEquals(Main.EXIT_USAGE, run("", "-t", "0", "A"));
        assertEquals(Main.EXIT_USAGE, run("", "-depth", "many", "A"));
        assertEquals(Main.EXIT_USAGE, run("", "-o"));
        assertEquals(Main.EXIT_USAGE, run("", "-i", "A"));
        assertEquals(Main.EXIT_USAGE, run("", "-tex"));
    }

    @Test
    public void testInteractiveStopsAtQuit() {
        int exitCode = run("A to A\n\nA to B\nquit\nB to B\n", "-i");

        String output = output();
        assertEquals(Main.EXIT_FAILURE, exitCode);
        assertTrue(output.contains("A → A : 1"));
        assertTrue(output.contains("error when checking:"));
        assertFalse(output.contains("B → B"));
    }

    @Test
    public void testInteractiveUntilEndOfInput() {
        assertEquals(Main.EXIT_OK, run("A to A\nA and B to A\n", "-i"));
        assertTrue(output().contains("A ∧ B → A : 1"));
    }

    @Test
    public void testOutputFile() throws IOException {
        File target = new File(folder.getRoot(), "prova.txt");

        assertEquals(Main.EXIT_OK, run("", "-o", target.getPath(), "A to A"));

        String written = Files.readString(target.toPath(), StandardCharsets.UTF_8);
        assertEquals("A → A : 1\n+ A from: 1\n", written);
        assertFalse(output().contains("from: 1"));
    }

    @Test
    public void testNoCheckFlag() {
        assertEquals(Main.EXIT_FAILURE, run("", "-nocheck", "A to B"));
        assertTrue(output().contains("could not infer: A → B"));
    }

    @Test
    public void testInteractiveSurvivesDeeplyNestedFormula() {
        int exitCode = run("not ".repeat(3000) + "A\nA to A\n", "-i");

        assertEquals(Main.EXIT_FAILURE, exitCode);
        assertTrue(output().contains("error when parsing:\nformula nested too deeply"));
        assertTrue(output().contains("A → A : 1\n+ A from: 1\n"));
    }

    @Test
    public void testInteractiveSurvivesWorkerError() {
        Prover crashing = new Prover() {
            @Override
            public ProofOutcome prove(String text, ProverOptions options) {
                if (text.startsWith("B")) {
                    throw new StackOverflowError();
                }
                return super.prove(text, options);
            }
        };
        InputStream in = new ByteArrayInputStream("B to B\nA to A\n".getBytes(StandardCharsets.UTF_8));
        PrintStream console = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-i"}, in, console, crashing));
        assertTrue(output().contains("[E] Errore durante la dimostrazione: java.lang.StackOverflowError"));
        assertTrue(output().contains("internal error:\njava.lang.StackOverflowError"));
        assertTrue(output().contains("A → A : 1\n+ A from: 1\n"));
    }

    @Test
    public void testUnicodeConnectivesWrittenAsUtf8() {
        assertEquals(Main.EXIT_OK, run("", "A and B to B or A"));

        byte[] expected = "A ∧ B → B ∨ A : 1\n".getBytes(StandardCharsets.UTF_8);
        byte[] written = Arrays.copyOf(buffer.toByteArray(), expected.length);
        assertArrayEquals(expected, written);
    }
}
