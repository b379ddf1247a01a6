package com.formula.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.core.MoleculeAnalyzer;
import com.formula.core.MoleculeReport;
import com.formula.evaluation.ElementCount;
import com.formula.exception.FormulaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Read-evaluate-print loop over molecular formulas.
 * <p>
 * Each formula is analysed independently; a formula that fails prints an
 * {@code Error:} line and the loop carries on with the next one.
 */
public class FormulaConsole {

    private static final Logger log = LoggerFactory.getLogger(FormulaConsole.class);

    static final String PROMPT = "Enter molecular formula: ";

    private final MoleculeAnalyzer analyzer;
    private final OutputFormat format;
    private final ObjectMapper objectMapper;

    public FormulaConsole(MoleculeAnalyzer analyzer, OutputFormat format, ObjectMapper objectMapper) {
        this.analyzer = analyzer;
        this.format = format;
        this.objectMapper = objectMapper;
    }

    /**
     * Prompt for formulas until a blank line or end of input.
     *
     * @param in  Source of formulas, one per line
     * @param out Destination for prompts and results
     * @return Number of formulas that failed
     */
    public int run(BufferedReader in, PrintStream out) throws IOException {
        int failures = 0;

        while (true) {
            if (format == OutputFormat.TEXT) {
                out.print(PROMPT);
                out.flush();
            }
            String line = in.readLine();
            if (line == null || line.isBlank()) {
                break;
            }
            if (!process(line.strip(), out)) {
                failures++;
            }
        }

        log.debug("Console finished with {} failed formulas", failures);
        return failures;
    }

    /**
     * Analyse the given formulas without prompting.
     *
     * @return Number of formulas that failed
     */
    public int analyzeAll(List<String> formulas, PrintStream out) throws IOException {
        int failures = 0;
        for (String formula : formulas) {
            if (!process(formula, out)) {
                failures++;
            }
        }
        return failures;
    }

    private boolean process(String formula, PrintStream out) throws IOException {
        MoleculeReport report;
        try {
            report = analyzer.analyze(formula);
        } catch (FormulaException e) {
            log.debug("Rejected formula '{}': {}", formula, e.getMessage());
            out.println("Error: " + e.getMessage());
            return false;
        }

        switch (format) {
            case TEXT -> printText(report, out);
            case JSON -> out.println(objectMapper.writeValueAsString(report));
        }
        return true;
    }

    private void printText(MoleculeReport report, PrintStream out) {
        out.println(String.format(Locale.ROOT, "The molecular mass of %s is %.7f",
                report.formula(), report.mass()));
        out.println();
        out.println("The elements of " + report.formula() + " are:");
        for (ElementCount element : report.elements()) {
            out.println(element);
        }
    }
}
