package com.formula.parser;

import com.formula.exception.EmptyFormulaException;
import com.formula.exception.InvalidTokenException;
import com.formula.exception.NestingTooDeepException;
import com.formula.exception.UnbalancedParenthesesException;
import com.formula.exception.UnknownSymbolException;
import com.formula.tree.FormulaTree;
import com.formula.tree.GroupNode;
import com.formula.tree.SymbolNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaParser.
 */
class FormulaParserTest {

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("Should build symbol and group nodes in source order")
        void shouldBuildNestedTree() {
            FormulaTree tree = FormulaTrees.parse("Ca(NO3)2");

            assertEquals(2, tree.nodes().size());
            assertEquals(new SymbolNode("Ca", 1), tree.nodes().get(0));

            GroupNode group = assertInstanceOf(GroupNode.class, tree.nodes().get(1));
            assertEquals(2, group.multiplier());
            assertEquals(List.of(new SymbolNode("N", 1), new SymbolNode("O", 3)), group.tree().nodes());
        }

        @Test
        @DisplayName("Should default multiplier to 1 when no digits follow")
        void shouldDefaultMultiplierToOne() {
            FormulaTree tree = FormulaTrees.parse("NaCl");

            assertEquals(List.of(new SymbolNode("Na", 1), new SymbolNode("Cl", 1)), tree.nodes());
        }

        @Test
        @DisplayName("Should handle groups nested inside groups")
        void shouldParseNestedGroups() {
            FormulaTree tree = FormulaTrees.parse("((CH3)3C)2O");

            assertEquals(2, tree.depth());
            assertEquals("((CH3)3C)2O", tree.toString());
        }

        @Test
        @DisplayName("Should keep unknown symbols as plain symbol nodes")
        void shouldParseUnknownSymbolsStructurally() {
            FormulaTree tree = FormulaTrees.parse("Xx2");

            assertEquals(List.of(new SymbolNode("Xx", 2)), tree.nodes());
        }

        @Test
        @DisplayName("Should accept an empty group")
        void shouldAcceptEmptyGroup() {
            FormulaTree tree = FormulaTrees.parse("H2()3");

            GroupNode group = assertInstanceOf(GroupNode.class, tree.nodes().get(1));
            assertTrue(group.tree().isEmpty());
            assertEquals(3, group.multiplier());
        }

        @Test
        @DisplayName("Should ignore leading zeros in multipliers")
        void shouldParseLeadingZeros() {
            assertEquals(List.of(new SymbolNode("H", 2)), FormulaTrees.parse("H02").nodes());
        }

        @Test
        @DisplayName("Should ignore whitespace between tokens")
        void shouldIgnoreWhitespace() {
            assertEquals("Ca(NO3)2", FormulaTrees.parse(" Ca ( N O 3 ) 2 ").toString());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Should reject formulas without tokens")
        void shouldRejectEmptyFormula(String formula) {
            assertThrows(EmptyFormulaException.class, () -> FormulaTrees.parse(formula));
        }

        @Test
        @DisplayName("Should reject a multiplier with nothing before it")
        void shouldRejectLeadingMultiplier() {
            InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> FormulaTrees.parse("2H"));

            assertEquals(new Token(TokenType.NUMBER, "2", 0), e.getToken());
            assertTrue(e.getMessage().contains("position 0"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"H2 3", "((2))", "(2H)"})
        @DisplayName("Should reject multipliers that do not follow an element or group")
        void shouldRejectBareMultipliers(String formula) {
            InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> FormulaTrees.parse(formula));

            assertEquals(TokenType.NUMBER, e.getToken().type());
        }

        @ParameterizedTest
        @ValueSource(strings = {"H0", "(OH)0", "H2147483648"})
        @DisplayName("Should reject zero and out-of-range multipliers")
        void shouldRejectNonPositiveMultipliers(String formula) {
            assertThrows(InvalidTokenException.class, () -> FormulaTrees.parse(formula));
        }

        @Test
        @DisplayName("Should reject unrecognized characters")
        void shouldRejectOtherCharacters() {
            InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> FormulaTrees.parse("H2$O"));

            assertEquals("$", e.getToken().text());
        }

        @Test
        @DisplayName("Should report a stray lowercase letter as an unknown symbol")
        void shouldRejectLowercaseLetterAsUnknownSymbol() {
            UnknownSymbolException e = assertThrows(UnknownSymbolException.class, () -> FormulaTrees.parse("xH2"));

            assertEquals("x", e.getSymbol());
            assertTrue(e.getMessage().contains("position 0"));
        }

        @Test
        @DisplayName("Should report an unclosed group at its opening parenthesis")
        void shouldRejectUnclosedGroup() {
            UnbalancedParenthesesException e = assertThrows(UnbalancedParenthesesException.class,
                    () -> FormulaTrees.parse("Ca(NO3"));

            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Should report a stray closing parenthesis")
        void shouldRejectStrayClose() {
            UnbalancedParenthesesException e = assertThrows(UnbalancedParenthesesException.class,
                    () -> FormulaTrees.parse("H2)O"));

            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Should reject a formula starting with a closing parenthesis")
        void shouldRejectLeadingClose() {
            assertThrows(UnbalancedParenthesesException.class, () -> FormulaTrees.parse(")("));
        }
    }

    @Nested
    @DisplayName("Nesting limit")
    class NestingLimit {

        @Test
        @DisplayName("Should accept nesting up to the limit")
        void shouldAcceptNestingAtLimit() {
            FormulaTree tree = FormulaTrees.parse("(((H)))", 3);

            assertEquals(3, tree.depth());
        }

        @Test
        @DisplayName("Should reject nesting beyond the limit")
        void shouldRejectNestingBeyondLimit() {
            NestingTooDeepException e = assertThrows(NestingTooDeepException.class,
                    () -> FormulaTrees.parse("(((H)))", 2));

            assertEquals(2, e.getMaxDepth());
        }

        @Test
        @DisplayName("Should reject pathological nesting without exhausting the stack")
        void shouldRejectPathologicalNesting() {
            String formula = "(".repeat(100_000) + "H" + ")".repeat(100_000);

            assertThrows(NestingTooDeepException.class, () -> FormulaTrees.parse(formula));
        }

        @Test
        @DisplayName("Should reject a negative limit")
        void shouldRejectNegativeLimit() {
            assertThrows(IllegalArgumentException.class,
                    () -> new FormulaParser("H", FormulaTrees.tokenize("H"), -1));
        }
    }
}
