package com.symcalc.simplify;

import com.symcalc.expression.*;
import com.symcalc.test.TestBase;
import com.symcalc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static com.symcalc.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for the Simplifier.
 *
 * <p>Covers:
 * <ul>
 *   <li>Integer and rational folding in sums and products</li>
 *   <li>Fraction reduction and sign normalization</li>
 *   <li>Radical factorization, including the unfactored edge cases</li>
 *   <li>Structural recursion through the remaining node kinds</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Simplifier Tests")
public class SimplifierTest extends TestBase {

    private static Expression simplify(Expression expression) {
        return Simplifier.get().simplify(expression);
    }

    // ==================== Sums ====================

    @Nested
    @DisplayName("Sum Folding")
    class Sums {

        @Test
        @DisplayName("Integer plus integer folds to an integer")
        void testIntegerSum() {
            assertThat(simplify(add(num(2), num(3)))).isEqualTo(num(5));
        }

        @Test
        @DisplayName("Fractions are added over a common denominator and reduced")
        void testFractionSum() {
            // 1/2 + 3/4 = (4 + 6) / 8 = 5/4
            Expression result = simplify(add(fraction(num(1), num(2)), fraction(num(3), num(4))));

            assertThat(result).isEqualTo(fraction(num(5), num(4)));
            assertThat(result.format()).isEqualTo("5/4");
        }

        @Test
        @DisplayName("Fractions summing to a whole number collapse to an integer")
        void testFractionSumCollapses() {
            assertThat(simplify(add(fraction(num(1), num(2)), fraction(num(1), num(2)))))
                .isEqualTo(num(1));
        }

        @Test
        @DisplayName("Integer plus fraction treats the integer as n/1")
        void testIntegerPlusFraction() {
            assertThat(simplify(add(num(1), fraction(num(1), num(3)))))
                .isEqualTo(fraction(num(4), num(3)));
        }

        @Test
        @DisplayName("1/2 + 2/10 reduces to 7/10")
        void testMixedReduction() {
            assertThat(simplify(add(fraction(num(1), num(2)), fraction(num(2), num(10)))))
                .isEqualTo(fraction(num(7), num(10)));
        }

        @Test
        @DisplayName("Sum with a variable keeps simplified children")
        void testSumWithVariable() {
            Expression result = simplify(add(variable("x"), add(num(2), num(3))));

            assertThat(result).isEqualTo(add(variable("x"), num(5)));
        }

        @Test
        @DisplayName("Sum with a non-integer fraction stays unreduced")
        void testSumWithSymbolicFraction() {
            Expression input = add(fraction(variable("x"), num(2)), num(1));

            assertThat(simplify(input)).isEqualTo(input);
        }

        @Test
        @DisplayName("Subtraction folds through the -1 product")
        void testSubtraction() {
            assertThat(simplify(subtract(num(7), num(2)))).isEqualTo(num(5));
        }
    }

    // ==================== Products ====================

    @Nested
    @DisplayName("Product Folding")
    class Products {

        @Test
        @DisplayName("Integer times integer folds to an integer")
        void testIntegerProduct() {
            assertThat(simplify(multiply(num(6), num(-7)))).isEqualTo(num(-42));
        }

        @Test
        @DisplayName("Fraction times fraction multiplies across and reduces")
        void testFractionProduct() {
            // 2/3 * 3/4 = 6/12 = 1/2
            assertThat(simplify(multiply(fraction(num(2), num(3)), fraction(num(3), num(4)))))
                .isEqualTo(fraction(num(1), num(2)));
        }

        @Test
        @DisplayName("Fraction times integer folds into the numerator")
        void testFractionTimesInteger() {
            assertThat(simplify(multiply(fraction(num(2), num(3)), num(3)))).isEqualTo(num(2));
        }

        @Test
        @DisplayName("Integer times fraction folds into the numerator")
        void testIntegerTimesFraction() {
            assertThat(simplify(multiply(num(3), fraction(num(1), num(6)))))
                .isEqualTo(fraction(num(1), num(2)));
        }

        @Test
        @DisplayName("Integer folds into a fraction with a symbolic denominator")
        void testIntegerIntoSymbolicDenominator() {
            assertThat(simplify(multiply(fraction(num(2), variable("x")), num(3))))
                .isEqualTo(fraction(num(6), variable("x")));
        }

        @Test
        @DisplayName("Product with a variable stays a product")
        void testProductWithVariable() {
            Expression result = simplify(multiply(variable("x"), multiply(num(2), num(4))));

            assertThat(result).isEqualTo(multiply(variable("x"), num(8)));
        }

        @Test
        @DisplayName("Folding is exact beyond the 64-bit range")
        void testArbitraryPrecision() {
            BigInteger big = BigInteger.valueOf(Long.MAX_VALUE);

            assertThat(simplify(multiply(num(big), num(big))))
                .isEqualTo(num(big.multiply(big)));
        }
    }

    // ==================== Fractions ====================

    @Nested
    @DisplayName("Fraction Reduction")
    class Fractions {

        @Test
        @DisplayName("12/18 reduces to 2/3")
        void testReduce() {
            Expression result = simplify(fraction(num(12), num(18)));

            assertThat(result).isEqualTo(fraction(num(2), num(3)));
            assertThat(result.format()).isEqualTo("2/3");
        }

        @Test
        @DisplayName("Negative denominator moves its sign to the numerator")
        void testSignNormalization() {
            assertThat(simplify(fraction(num(4), num(-6)))).isEqualTo(fraction(num(-2), num(3)));
            assertThat(simplify(fraction(num(-4), num(-6)))).isEqualTo(fraction(num(2), num(3)));
        }

        @Test
        @DisplayName("Denominator of one collapses to an integer")
        void testCollapse() {
            assertThat(simplify(fraction(num(6), num(3)))).isEqualTo(num(2));
            assertThat(simplify(fraction(num(6), num(-3)))).isEqualTo(num(-2));
            assertThat(simplify(fraction(num(0), num(5)))).isEqualTo(num(0));
        }

        @Test
        @DisplayName("Zero denominator passes through unreduced")
        void testZeroDenominator() {
            assertThat(simplify(fraction(num(5), num(0)))).isEqualTo(fraction(num(5), num(0)));
            assertThat(simplify(fraction(num(0), num(0)))).isEqualTo(fraction(num(0), num(0)));
        }

        @Test
        @DisplayName("Children are simplified before reduction")
        void testNestedChildren() {
            assertThat(simplify(fraction(add(num(1), num(1)), num(4))))
                .isEqualTo(fraction(num(1), num(2)));
        }

        @Test
        @DisplayName("Symbolic fraction keeps its simplified children")
        void testSymbolicFraction() {
            assertThat(simplify(fraction(variable("x"), multiply(num(2), num(3)))))
                .isEqualTo(fraction(variable("x"), num(6)));
        }

        @ParameterizedTest(name = "{0}/{1}")
        @CsvSource({
            "12, 18",
            "4, -6",
            "-4, -6",
            "-9, 3",
            "0, -7",
            "17, 5",
            "100, 250",
            "-1, 1000000"
        })
        @DisplayName("Reduced fraction has a positive denominator and the same value")
        void testReductionPreservesValue(long a, long b) {
            Expression result = simplify(fraction(num(a), num(b)));
            logData(a + "/" + b, result);

            BigInteger numerator;
            BigInteger denominator;
            if (result instanceof IntegerLiteral literal) {
                numerator = literal.value();
                denominator = BigInteger.ONE;
            } else {
                assertThat(result).isInstanceOf(Fraction.class);
                Fraction reduced = (Fraction) result;
                numerator = ((IntegerLiteral) reduced.numerator()).value();
                denominator = ((IntegerLiteral) reduced.denominator()).value();
            }

            assertThat(denominator.signum()).isPositive();
            assertThat(numerator.gcd(denominator)).isEqualTo(BigInteger.ONE);
            // n/d == a/b  <=>  n*b == a*d
            assertThat(numerator.multiply(BigInteger.valueOf(b)))
                .isEqualTo(BigInteger.valueOf(a).multiply(denominator));
        }

        @ParameterizedTest(name = "{0}/{1}")
        @CsvSource({
            "12, 18",
            "4, -6",
            "6, 3",
            "5, 0",
            "0, 0"
        })
        @DisplayName("Fraction reduction is idempotent")
        void testIdempotent(long a, long b) {
            Expression once = simplify(fraction(num(a), num(b)));

            assertThat(simplify(once)).isEqualTo(once);
        }
    }

    // ==================== Radicals ====================

    @Nested
    @DisplayName("Radical Factorization")
    class Radicals {

        @Test
        @DisplayName("√12 factors to 2 * √3")
        void testSquareRootFactor() {
            Expression result = simplify(sqrt(num(12)));

            assertThat(result).isEqualTo(multiply(num(2), sqrt(num(3))));
            assertThat(result.format()).isEqualTo("2 * √3");
        }

        @Test
        @DisplayName("Perfect square collapses to an integer")
        void testPerfectSquare() {
            assertThat(simplify(sqrt(num(16)))).isEqualTo(num(4));
            assertThat(simplify(sqrt(num(1)))).isEqualTo(num(1));
        }

        @Test
        @DisplayName("Square-free radicand is returned unchanged")
        void testSquareFree() {
            assertThat(simplify(sqrt(num(7)))).isEqualTo(sqrt(num(7)));
            assertThat(simplify(sqrt(num(30)))).isEqualTo(sqrt(num(30)));
        }

        @Test
        @DisplayName("Cube root of 54 factors to 3 * 3√2")
        void testCubeRoot() {
            Expression result = simplify(root(num(54), num(3)));

            assertThat(result).isEqualTo(multiply(num(3), root(num(2), num(3))));
            assertThat(result.format()).isEqualTo("3 * 3√2");
        }

        @Test
        @DisplayName("Degree one returns the radicand")
        void testDegreeOne() {
            assertThat(simplify(root(num(12), num(1)))).isEqualTo(num(12));
        }

        @Test
        @DisplayName("Radicand and degree are simplified first")
        void testSimplifiedChildren() {
            assertThat(simplify(root(add(num(8), num(4)), add(num(1), num(1)))))
                .isEqualTo(multiply(num(2), sqrt(num(3))));
        }

        @Test
        @DisplayName("Non-positive radicand or degree is left unfactored")
        void testUnfactoredEdgeCases() {
            assertThat(simplify(sqrt(num(0)))).isEqualTo(sqrt(num(0)));
            assertThat(simplify(sqrt(num(-8)))).isEqualTo(sqrt(num(-8)));
            assertThat(simplify(root(num(16), num(0)))).isEqualTo(root(num(16), num(0)));
            assertThat(simplify(root(num(16), num(-2)))).isEqualTo(root(num(16), num(-2)));
        }

        @Test
        @DisplayName("Degree wider than the radicand finds no factor")
        void testHugeDegree() {
            assertThat(simplify(root(num(8), num(100)))).isEqualTo(root(num(8), num(100)));
            assertThat(simplify(root(num(1), num(1_000_000)))).isEqualTo(num(1));
        }

        @Test
        @DisplayName("Symbolic radicand keeps its simplified children")
        void testSymbolicRadicand() {
            assertThat(simplify(sqrt(add(variable("x"), add(num(1), num(2))))))
                .isEqualTo(sqrt(add(variable("x"), num(3))));
        }

        @ParameterizedTest(name = "{1}√{0}")
        @CsvSource({
            "12, 2",
            "72, 2",
            "54, 3",
            "1024, 5",
            "97, 2",
            "360, 2",
            "4096, 3",
            "2000, 3"
        })
        @DisplayName("factor^d * remainder equals the radicand")
        void testFactorizationProperty(long radicand, int degree) {
            Expression result = simplify(root(num(radicand), num(degree)));
            logData(degree + "√" + radicand, result);

            BigInteger factor;
            BigInteger remainder;
            if (result instanceof IntegerLiteral literal) {
                factor = literal.value();
                remainder = BigInteger.ONE;
            } else if (result instanceof Product product) {
                factor = ((IntegerLiteral) product.left()).value();
                remainder = ((IntegerLiteral) ((Radical) product.right()).radicand()).value();
            } else {
                assertThat(result).isInstanceOf(Radical.class);
                factor = BigInteger.ONE;
                remainder = ((IntegerLiteral) ((Radical) result).radicand()).value();
            }

            assertThat(factor.pow(degree).multiply(remainder)).isEqualTo(BigInteger.valueOf(radicand));
        }
    }

    // ==================== Structural Recursion ====================

    @Nested
    @DisplayName("Structural Recursion")
    class Structural {

        @Test
        @DisplayName("Power simplifies its children only")
        void testPower() {
            assertThat(simplify(pow(add(num(1), num(2)), num(2))))
                .isEqualTo(pow(num(3), num(2)));
        }

        @Test
        @DisplayName("Logarithm simplifies argument and base")
        void testLogarithm() {
            assertThat(simplify(log(add(num(1), num(1)), multiply(num(2), num(4)))))
                .isEqualTo(log(num(2), num(8)));
        }

        @Test
        @DisplayName("Trigonometric functions keep their kind")
        void testTrigonometric() {
            Expression half = add(fraction(num(1), num(4)), fraction(num(1), num(4)));

            assertThat(simplify(sin(half))).isEqualTo(sin(fraction(num(1), num(2))));
            assertThat(simplify(cos(half))).isEqualTo(cos(fraction(num(1), num(2))));
            assertThat(simplify(tan(half))).isEqualTo(tan(fraction(num(1), num(2))));
            assertThat(simplify(cot(half))).isEqualTo(cot(fraction(num(1), num(2))));
            assertThat(simplify(sec(half))).isEqualTo(sec(fraction(num(1), num(2))));
            assertThat(simplify(csc(half))).isEqualTo(csc(fraction(num(1), num(2))));
        }

        @Test
        @DisplayName("Leaves and constants simplify to themselves")
        void testLeaves() {
            assertThat(simplify(num(3))).isEqualTo(num(3));
            assertThat(simplify(dec("2.5"))).isEqualTo(dec("2.5"));
            assertThat(simplify(variable("x"))).isEqualTo(variable("x"));
            assertThat(simplify(e())).isSameAs(ConstantE.get());
            assertThat(simplify(pi())).isSameAs(ConstantPi.get());
            assertThat(simplify(i())).isSameAs(ImaginaryUnit.get());
        }

        @Test
        @DisplayName("Input tree is never modified")
        void testInputUnchanged() {
            Expression input = add(fraction(num(12), num(18)), sqrt(num(12)));
            Expression copy = add(fraction(num(12), num(18)), sqrt(num(12)));

            simplify(input);

            assertThat(input).isEqualTo(copy);
        }

        @Test
        @DisplayName("Simplify accepts trees that cannot be evaluated")
        void testTotal() {
            Expression input = multiply(i(), fraction(variable("y"), num(0)));

            assertThatCode(() -> simplify(input)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Null input is rejected")
        void testNull() {
            assertThatThrownBy(() -> simplify(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("expression");
        }
    }
}
