package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    @Nested
    @DisplayName("Precedence and rendering")
    class Rendering {

        @Test
        void multiplicationBindsTighterThanAddition() {
            assertEquals("(a + (b * c))", FormulaParser.parse("a + b * c").render());
            assertEquals("((a + b) * c)", FormulaParser.parse("(a + b) * c").render());
        }

        @Test
        void subtractionIsLeftAssociative() {
            assertEquals("((a - b) - c)", FormulaParser.parse("a - b - c").render());
        }

        @Test
        void typographicOperatorsAreAccepted() {
            assertEquals(FormulaParser.parse("a * b / c - d").render(),
                FormulaParser.parse("a × b ÷ c − d").render());
        }

        @Test
        void percentLiteral_isAFraction() {
            assertEquals("(income * 0.06)", FormulaParser.parse("income * 6%").render());
        }

        @Test
        void whitespaceDoesNotMatter() {
            assertEquals(FormulaParser.parse("max(0,gross-relief)").render(),
                FormulaParser.parse("  max( 0 , gross - relief )  ").render());
        }

        @Test
        void functionsAndComparisons() {
            assertEquals("if((income > 100), (income * 0.1), 0)",
                FormulaParser.parse("if(income > 100, income * 0.1, 0)").render());
            assertEquals("min(a, b, c)", FormulaParser.parse("MIN(a, b, c)").render());
        }
    }

    @Nested
    @DisplayName("References")
    class References {

        @Test
        void collectsEveryVariableOnce() {
            Set<String> references = new TreeSet<>();
            FormulaParser.parse("max(0, gross_income - relief) + gross_income * rate").collectReferences(references);
            assertEquals(Set.of("gross_income", "relief", "rate"), references);
        }

        @Test
        void bracketTaxIsDetected() {
            assertTrue(FormulaParser.parse("bracket_tax(taxable_income) - credit").usesBracketTax());
            assertFalse(FormulaParser.parse("taxable_income * 0.1").usesBracketTax());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unknownFunction_reportsPosition() {
            FormulaParseException ex = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("a + sqrt(b)"));
            assertEquals(ErrorType.FORMULA_PARSE_ERROR, ex.getErrorType());
            assertEquals(4, ex.getPosition());
        }

        @Test
        void wrongArity_isRejected() {
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("if(a, b)"));
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("bracket_tax()"));
        }

        @Test
        void unbalancedParentheses_areRejected() {
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("(a + b"));
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("a + b)"));
        }

        @Test
        void danglingOperator_isRejected() {
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("a +"));
        }

        @Test
        void unexpectedCharacter_isRejected() {
            FormulaParseException ex = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("a $ b"));
            assertEquals(2, ex.getPosition());
        }

        @Test
        void blankExpression_isRejected() {
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("   "));
        }

        @Test
        @DisplayName("Nesting beyond the depth limit is a parse error, not a stack overflow")
        void deepNesting_isRejected() {
            int levels = FormulaParser.MAX_DEPTH + 1;
            String nested = "(".repeat(levels) + "x" + ")".repeat(levels);

            FormulaParseException ex = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(nested));

            assertEquals(ErrorType.FORMULA_PARSE_ERROR, ex.getErrorType());
            assertTrue(ex.getMessage().contains("nested deeper"));
        }

        @Test
        void repeatedNegation_countsAsNesting() {
            assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("-".repeat(FormulaParser.MAX_DEPTH + 1) + "x"));
        }

        @Test
        void nestingAtTheLimit_parses() {
            int levels = FormulaParser.MAX_DEPTH - 1;
            assertEquals("x", FormulaParser.parse("(".repeat(levels) + "x" + ")".repeat(levels)).render());
        }

        @Test
        void overlongExpression_isRejected() {
            String chain = "x" + " + x".repeat(FormulaParser.MAX_LENGTH / 4);
            FormulaParseException ex = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(chain));
            assertTrue(ex.getMessage().contains("longer than"));
        }
    }
}
