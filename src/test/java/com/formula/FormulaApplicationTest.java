package com.formula;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.cli.FormulaConsole;
import com.formula.cli.OutputFormat;
import com.formula.core.DefaultMoleculeAnalyzer;
import com.formula.parser.FormulaSyntax;
import com.formula.table.AtomicMassTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the FormulaApplication runner.
 * Tests cover:
 * - Formulas given as command-line arguments
 * - Option arguments being ignored as formulas
 * - Falling back to standard input without arguments
 */
class FormulaApplicationTest {

    private final InputStream originalIn = System.in;
    private final PrintStream originalOut = System.out;

    private ByteArrayOutputStream buffer;
    private ApplicationRunner runner;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        FormulaConsole console = new FormulaConsole(
                new DefaultMoleculeAnalyzer(AtomicMassTable.standard(), FormulaSyntax.DEFAULT_MAX_NESTING_DEPTH),
                OutputFormat.TEXT,
                new ObjectMapper());
        runner = new FormulaApplication().formulaRunner(console);
    }

    @AfterEach
    void tearDown() {
        System.setIn(originalIn);
        System.setOut(originalOut);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should analyse formulas given as arguments without prompting")
    void shouldAnalyzeArguments() throws Exception {
        System.setIn(new ByteArrayInputStream("NaCl\n".getBytes(StandardCharsets.UTF_8)));

        runner.run(new DefaultApplicationArguments("H2O", "Ca(NO3)2"));

        String text = output();
        assertTrue(text.contains("The molecular mass of H2O is 18.0148000"));
        assertTrue(text.contains("The molecular mass of Ca(NO3)2 is 164.0860000"));
        assertFalse(text.contains("Enter molecular formula: "));
        assertFalse(text.contains("NaCl"));
    }

    @Test
    @DisplayName("Should not treat option arguments as formulas")
    void shouldSkipOptionArguments() throws Exception {
        runner.run(new DefaultApplicationArguments("--formula.output-format=TEXT", "H2O"));

        String text = output();
        assertTrue(text.contains("The molecular mass of H2O is 18.0148000"));
        assertFalse(text.contains("Error:"));
    }

    @Test
    @DisplayName("Should read formulas from standard input when no arguments are given")
    void shouldReadStandardInput() throws Exception {
        System.setIn(new ByteArrayInputStream("NaCl\n\n".getBytes(StandardCharsets.UTF_8)));

        runner.run(new DefaultApplicationArguments());

        String text = output();
        assertTrue(text.contains("Enter molecular formula: "));
        assertTrue(text.contains("The elements of NaCl are:"));
        assertTrue(text.contains("(Cl, 1)"));
    }

    @Test
    @DisplayName("Should keep going after a failing argument")
    void shouldContinueAfterFailingArgument() throws Exception {
        runner.run(new DefaultApplicationArguments("H2$O", "H2O"));

        String text = output();
        assertTrue(text.contains("Error: "));
        assertTrue(text.contains("The molecular mass of H2O is 18.0148000"));
    }
}
