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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class TermParserTest {
    private final Variables variables = new Variables();

    private Term parse(String input) throws InvalidFormatException {
        return TermParser.parse(input, variables);
    }

    private BigInteger value(String input) throws InvalidFormatException {
        return parse(input).evaluate(Map.of());
    }

    @Test
    public void testPrecedence() throws InvalidFormatException {
        assertThat(value("1 + 2 * 3"), is(BigInteger.valueOf(7)));
        assertThat(value("(1 + 2) * 3"), is(BigInteger.valueOf(9)));
        assertThat(value("2 * 3^2"), is(BigInteger.valueOf(18)));
        assertThat(value("2^3^2"), is(BigInteger.valueOf(512)));
        assertThat(value("10 - 3 - 2"), is(BigInteger.valueOf(5)));
        assertThat(value("10 - (3 - 2)"), is(BigInteger.valueOf(9)));
        assertThat(value("2 - 5 + 1"), is(BigInteger.ONE));
    }

    @Test
    public void testStructure() throws InvalidFormatException {
        Variable x = variables.get("x");
        Variable y = variables.get("y");
        assertThat(parse("x + y * 2"), is(Term.add(Term.variable(x),
                Term.multiply(Term.variable(y), Term.constant(2)))));
        assertThat(parse("x^y^2"), is(Term.power(Term.variable(x),
                Term.power(Term.variable(y), Term.constant(2)))));
        assertThat(parse("  ( x )  "), is(Term.variable(x)));
    }

    @Test
    public void testIdentifiers() throws InvalidFormatException {
        Term term = parse("x_1 + y' + x_1 + _z");
        assertThat(variables.numberOfVariables(), is(3));
        assertThat(variables.lookup("y'").name(), is("y'"));
        assertThat(term.variables().size(), is(3));
    }

    @Test
    public void testLargeLiteral() throws InvalidFormatException {
        assertThat(value("123456789012345678901234567890"),
                is(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    public void testPrinting() throws InvalidFormatException {
        for (String input : new String[] {"x + y*z", "(x + y)*z", "x - (y - z)", "x - y - z", "(x^y)^z",
            "x^y^z", "2*(x - 1)^3"}) {
            assertThat(parse(input).toString(), is(input));
        }
    }

    @Test
    public void testInvalid() {
        for (String input : new String[] {"", "x +", "(x", "x)", "2 $ 3", "x y", "-1", "x ^", "()"}) {
            assertThrows(InvalidFormatException.class, () -> parse(input), input);
        }
    }

    @Test
    public void testNonAsciiRejected() {
        // Letters and digits outside of ASCII, such as accented letters and Arabic-Indic digits
        for (String input : new String[] {"\u00e9", "x\u00e9", "\u0661", "2\u0661", "x + \u03b1"}) {
            assertThrows(InvalidFormatException.class, () -> parse(input), input);
        }
    }
}
