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
import static org.hamcrest.Matchers.not;

import org.junit.jupiter.api.Test;

public class UnifierTest {
    private final Variables variables = new Variables();
    private final Variable x = variables.create("x");
    private final Variable y = variables.create("y");
    private final Variable z = variables.create("z");
    private final Unifier unifier = new Unifier();

    private Sop sop(String term) throws InvalidFormatException {
        return Normalizer.normalize(TermParser.parse(term, variables));
    }

    private UnifyResult<String> unify(Origin origin, String lhs, String rhs) throws InvalidFormatException {
        return unifier.unify("h", origin, sop(lhs), sop(rhs));
    }

    private UnifyResult<String> binding(Variable variable, String replacement, Origin origin)
            throws InvalidFormatException {
        return UnifyResult.draw(SubstItem.bind(variable, sop(replacement), origin, "h"));
    }

    private UnifyResult<String> sufficientBinding(Variable variable, String replacement)
            throws InvalidFormatException {
        return UnifyResult.draw(SubstItem.bind(variable, sop(replacement), Origin.WANTED, "h").asSufficient());
    }

    @Test
    public void testWin() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "x + 1", "1 + x"), is(UnifyResult.win()));
        assertThat(unify(Origin.WANTED, "(x + 1)^2", "x^2 + 2*x + 1"), is(UnifyResult.win()));
        assertThat(unify(Origin.WANTED, "(x + 1)^2", "x^2 + 2*x + 1").isProgress(), is(false));
    }

    @Test
    public void testDifferentConstants() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "2", "3"), is(UnifyResult.lose()));
        assertThat(unify(Origin.GIVEN, "x", "x + 1"), is(UnifyResult.lose()));
    }

    @Test
    public void testConstantLowerBound() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "x + 5", "2"), is(UnifyResult.lose()));
        assertThat(unify(Origin.WANTED, "0", "x*y + 1"), is(UnifyResult.lose()));
    }

    @Test
    public void testDivisibility() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "2*x", "3"), is(UnifyResult.lose()));
        assertThat(unify(Origin.GIVEN, "4*x + 6*y", "9"), is(UnifyResult.lose()));
        assertThat(unify(Origin.GIVEN, "2*x + 4*y", "6"), is(UnifyResult.stuck()));
    }

    @Test
    public void testNoLoseForNonPolynomialUnsatisfiability() throws InvalidFormatException {
        // Same variables on both sides is no reason to give up: 2*x = x + 3 has x = 3
        assertThat(unify(Origin.GIVEN, "2*x", "x + 3"), is(binding(x, "3", Origin.GIVEN)));
    }

    @Test
    public void testBindVariable() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "x + 2", "5"), is(binding(x, "3", Origin.GIVEN)));
        assertThat(unify(Origin.WANTED, "x + 1", "y + 2"), is(binding(x, "y + 1", Origin.WANTED)));
        assertThat(unify(Origin.GIVEN, "x", "2*x"), is(binding(x, "0", Origin.GIVEN)));
    }

    @Test
    public void testBindVariableTieBreak() throws InvalidFormatException {
        // The variable with the larger identity is bound
        assertThat(unify(Origin.GIVEN, "x", "y"), is(binding(y, "x", Origin.GIVEN)));
        assertThat(unify(Origin.GIVEN, "y", "x"), is(binding(y, "x", Origin.GIVEN)));
    }

    @Test
    public void testOccursCheck() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "x", "x*y + 1"), is(UnifyResult.stuck()));
    }

    @Test
    public void testLogarithm() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "2^y", "8"), is(binding(y, "3", Origin.GIVEN)));
        assertThat(unify(Origin.GIVEN, "3^(y + 1)", "27"), is(binding(y, "2", Origin.GIVEN)));
        assertThat(unify(Origin.GIVEN, "2^y", "6"), is(UnifyResult.lose()));
    }

    @Test
    public void testInjectiveBase() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "3^x", "3^y"), is(binding(y, "x", Origin.GIVEN)));
    }

    @Test
    public void testRoot() throws InvalidFormatException {
        assertThat(unify(Origin.GIVEN, "x^2", "4"), is(binding(x, "2", Origin.GIVEN)));
        assertThat(unify(Origin.GIVEN, "x^3", "27"), is(binding(x, "3", Origin.GIVEN)));
        assertThat(unify(Origin.GIVEN, "x^2", "5"), is(UnifyResult.lose()));
    }

    @Test
    public void testCommonFactors() throws InvalidFormatException {
        assertThat(unify(Origin.WANTED, "x*y", "x*z"), is(sufficientBinding(z, "y")));
        assertThat(unify(Origin.GIVEN, "x*y", "x*z"), is(UnifyResult.stuck()));
        assertThat(unify(Origin.WANTED, "x^2", "x^3"), is(sufficientBinding(x, "1")));
    }

    @Test
    public void testSufficientBindingsMarked() throws InvalidFormatException {
        SubstItem<String> item = unify(Origin.WANTED, "x*z", "3*z").bindings().get(0);
        assertThat(item.isSufficient(), is(true));
        assertThat(item.toString(), is("x :=? 3"));
        assertThat(item, not(binding(x, "3", Origin.WANTED).bindings().get(0)));

        // Equivalent bindings of wanted equations stay unmarked
        assertThat(unify(Origin.WANTED, "x + 2", "5").bindings().get(0).isSufficient(), is(false));
        assertThat(unifier.unify("h", Origin.WANTED, sop("x*z"), sop("3*z"), false), is(UnifyResult.stuck()));
    }

    @Test
    public void testCommonFactorsWeakened() throws InvalidFormatException {
        // 2^y = 3 has no solution, but x * 2^y = 3 * x holds for x = 0
        assertThat(unify(Origin.WANTED, "x * 2^y", "3*x"), is(UnifyResult.stuck()));
        assertThat(unify(Origin.WANTED, "2*x*y", "3*x*y"), is(UnifyResult.stuck()));
    }

    @Test
    public void testSameBaseExponents() throws InvalidFormatException {
        assertThat(unify(Origin.WANTED, "y^x", "y^z"), is(sufficientBinding(z, "x")));
        assertThat(unify(Origin.GIVEN, "y^x", "y^z"), is(UnifyResult.stuck()));
    }

    @Test
    public void testCommonFactorsDisabled() throws InvalidFormatException {
        Unifier plain = new Unifier(false);
        assertThat(plain.unify("h", Origin.WANTED, sop("x*y"), sop("x*z")), is(UnifyResult.stuck()));
    }

    @Test
    public void testStuck() throws InvalidFormatException {
        UnifyResult<String> result = unify(Origin.WANTED, "x*y", "y + 2");
        assertThat(result, is(UnifyResult.stuck()));
        assertThat(result.kind(), is(UnifyResult.Kind.DRAW));
        assertThat(result.bindings().isEmpty(), is(true));
        assertThat(result.isProgress(), is(false));
    }
}
