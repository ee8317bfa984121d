/*
 * This file is part of NatNorm.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * NatNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * NatNorm is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NatNorm. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.natnorm;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

public class NormalizerTest {
    private final Variables variables = new Variables();

    private Sop normalize(String term) throws InvalidFormatException {
        return Normalizer.normalize(TermParser.parse(term, variables));
    }

    @Test
    public void testConstantFolding() throws InvalidFormatException {
        assertThat(normalize("2*3 + 4^2 - 5"), is(Sop.constant(17)));
        assertThat(normalize("3 - 5"), is(Sop.ZERO));
        assertThat(normalize("(1 + 1)^(2 + 1)"), is(Sop.constant(8)));
    }

    @Test
    public void testZeroToTheZero() throws InvalidFormatException {
        assertThat(normalize("0^0"), is(Sop.ONE));
        assertThat(normalize("x^0"), is(Sop.ONE));

        Sop power = normalize("0^x");
        Variable x = variables.get("x");
        assertThat(power.evaluate(ImmutableMap.of(x, BigInteger.ZERO)), is(BigInteger.ONE));
        assertThat(power.evaluate(ImmutableMap.of(x, BigInteger.TWO)), is(BigInteger.ZERO));
    }

    @Test
    public void testNeutralElements() throws InvalidFormatException {
        assertThat(normalize("x + 0"), is(normalize("x")));
        assertThat(normalize("1 * x"), is(normalize("x")));
        assertThat(normalize("x^1"), is(normalize("x")));
        assertThat(normalize("1^y"), is(Sop.ONE));
        assertThat(normalize("0 * x^y"), is(Sop.ZERO));
    }

    @Test
    public void testCanonicalIdentity() throws InvalidFormatException {
        Sop left = normalize("(x + 2)^(y + 2)");
        Sop right = normalize("4*x*(2 + x)^y + 4*(2 + x)^y + (2 + x)^y*x^2");
        assertThat(left, is(right));
        assertThat(left.products().size(), is(3));
    }

    @Test
    public void testBinomialExpansion() throws InvalidFormatException {
        assertThat(normalize("(x + y)^2"), is(normalize("x^2 + 2*x*y + y^2")));
        assertThat(normalize("(x + 1)^3"), is(normalize("x^3 + 3*x^2 + 3*x + 1")));
        assertThat(normalize("(x + 1)^3").isPolynomial(), is(true));
    }

    @Test
    public void testPowerLaws() throws InvalidFormatException {
        assertThat(normalize("x^y * x^z"), is(normalize("x^(y + z)")));
        assertThat(normalize("(x^y)^z"), is(normalize("x^(y*z)")));
        assertThat(normalize("(x*y)^z"), is(normalize("x^z * y^z")));
        assertThat(normalize("2 * 2^y"), is(normalize("2^(y + 1)")));
        assertThat(normalize("(3*x)^y"), is(normalize("3^y * x^y")));
        assertThat(normalize("x^y").isPolynomial(), is(false));
    }

    @Test
    public void testSymbolicCompoundBase() throws InvalidFormatException {
        Sop power = normalize("(x + 1)^y");
        assertThat(power.products().size(), is(1));
        Factor factor = power.products().get(0).factors().get(0);
        assertThat(factor.base() instanceof Compound, is(true));
        assertThat(((Compound) factor.base()).base(), is(normalize("x + 1")));
    }

    @Test
    public void testLargeConstantExponents() throws InvalidFormatException {
        assertThat(normalize("2^64"), is(Sop.constant(BigInteger.TWO.pow(64))));
        assertThat(normalize("(x + 1)^64").products().size(), is(65));

        Sop constant = normalize("2^(2^31)");
        assertThat(constant.isConstant(), is(false));
        assertThat(constant, is(normalize("2^2147483648")));
        assertThat(normalize("2^(2^31) * 2^(2^31)"), is(normalize("2^(2^32)")));

        Sop sum = normalize("(x + 1)^(2^31)");
        assertThat(sum.products().size(), is(1));
        Factor factor = sum.products().get(0).factors().get(0);
        assertThat(((Compound) factor.base()).base(), is(normalize("x + 1")));
        assertThat(factor.exponent(), is(Product.constant(BigInteger.TWO.pow(31))));
        assertThat(Normalizer.normalize(sum.toTerm()), is(sum));

        assertThat(normalize("(3*x)^(2^40)"), is(normalize("3^(2^40) * x^(2^40)")));
    }

    @Test
    public void testExactSubtraction() throws InvalidFormatException {
        assertThat(normalize("(x + 3) - x"), is(Sop.constant(3)));
        assertThat(normalize("x - x"), is(Sop.ZERO));
        assertThat(normalize("x - (x + 1)"), is(Sop.ZERO));
        assertThat(normalize("(x + 1)^2 - 2*x"), is(normalize("x^2 + 1")));
        assertThat(normalize("3*x*y - x*y"), is(normalize("2*x*y")));
    }

    @Test
    public void testResidualSubtraction() throws InvalidFormatException {
        Sop difference = normalize("x - y");
        assertThat(difference.products().size(), is(1));
        assertThat(difference.products().get(0).factors().get(0).base() instanceof Residual, is(true));
        assertThat(difference.isPolynomial(), is(false));

        Variable x = variables.get("x");
        Variable y = variables.get("y");
        assertThat(difference.evaluate(ImmutableMap.of(x, BigInteger.valueOf(5), y, BigInteger.TWO)),
                is(BigInteger.valueOf(3)));
        assertThat(difference.evaluate(ImmutableMap.of(x, BigInteger.TWO, y, BigInteger.valueOf(5))),
                is(BigInteger.ZERO));

        // Only the common part is cancelled
        assertThat(normalize("(x + z + 2) - (y + z)"), is(normalize("(x + 2) - y")));
        assertThat(normalize("(x - y) * 2"), is(normalize("2 * (x - y)")));
        assertThat(normalize("(x - y) + y"), not(normalize("x")));
    }

    @Test
    public void testSubstitutedEvaluation() throws InvalidFormatException {
        Sop sop = normalize("x^2 + 1");
        Variable x = variables.get("x");
        assertThat(sop.evaluate(ImmutableMap.of(x, BigInteger.TWO)), is(BigInteger.valueOf(5)));
        assertThat(sop.constantTerm(), is(BigInteger.ONE));
        assertThat(sop.variables(), contains(x));
    }

    @Test
    public void testUnboundVariableEvaluation() throws InvalidFormatException {
        Sop sop = normalize("x + 1");
        assertThrows(IllegalArgumentException.class, () -> sop.evaluate(ImmutableMap.of()));
    }

    @Test
    public void testToTermRoundTrip() throws InvalidFormatException {
        for (String term : new String[] {"(x + 2)^(y + 2)", "x - y", "3*2^y*x", "0^y + (x - 1)^2",
            "x^(2^y)"}) {
            Sop sop = normalize(term);
            assertThat(term, Normalizer.normalize(sop.toTerm()), is(sop));
            assertThat(term, normalize(sop.toString()), is(sop));
        }
    }

    @Test
    public void testPrinting() throws InvalidFormatException {
        assertThat(normalize("x*y + 2").toString(), is("2 + x*y"));
        assertThat(normalize("x^2*3").toString(), is("3*x^2"));
        assertThat(Sop.ZERO.toString(), is("0"));
    }
}
