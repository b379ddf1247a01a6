package com.formula.validation;

import com.formula.table.AtomicMassTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaSanitizer.
 */
class FormulaSanitizerTest {

    private FormulaSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new FormulaSanitizer(new FormulaValidator(AtomicMassTable.standard()));
    }

    @ParameterizedTest
    @CsvSource({
            "H2$O, H2O",
            "Xx H2O, H2O",
            "'  Ca ( NO3 ) 2 ', Ca(NO3)2",
            "h2o, 2",
            "Na+Cl-, NaCl",
            "((H2, ((H2"
    })
    @DisplayName("Should drop rejected tokens and whitespace")
    void shouldDropRejectedTokens(String formula, String expected) {
        assertEquals(expected, sanitizer.cleanCopy(formula));
    }

    @Test
    @DisplayName("Should leave valid formulas unchanged")
    void shouldKeepValidFormula() {
        assertEquals("Be3Al2(SiO3)6", sanitizer.cleanCopy("Be3Al2(SiO3)6"));
    }

    @Test
    @DisplayName("Should never fail, even when nothing survives")
    void shouldNeverFail() {
        assertEquals("", sanitizer.cleanCopy(""));
        assertEquals("", sanitizer.cleanCopy("$%& xyz"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "H2$O", "Xx2yO", "2 3H", "a(b)C", "Ca(NO3)2", "!!", "Fe 2 O 3", "Q u a r k"})
    @DisplayName("Cleaning twice should equal cleaning once")
    void shouldBeIdempotent(String formula) {
        String once = sanitizer.cleanCopy(formula);

        assertEquals(once, sanitizer.cleanCopy(once));
    }
}
