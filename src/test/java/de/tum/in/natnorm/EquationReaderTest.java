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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.Test;

public class EquationReaderTest {
    private final Variables variables = new Variables();

    private List<Equation<Integer>> readResource(String name) throws IOException, InvalidFormatException {
        try (InputStream stream = Objects.requireNonNull(getClass().getResourceAsStream(name), name);
             BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return EquationReader.read(reader, variables);
        }
    }

    private List<Equation<Integer>> read(String input) throws IOException, InvalidFormatException {
        return EquationReader.read(new BufferedReader(new StringReader(input)), variables);
    }

    @Test
    public void testRead() throws IOException, InvalidFormatException {
        List<Equation<Integer>> equations = readResource("/equations/system.eqs");
        assertThat(equations, hasSize(7));

        List<Integer> handles = new ArrayList<>();
        for (Equation<Integer> equation : equations) {
            handles.add(equation.handle());
        }
        assertThat(handles, contains(2, 5, 6, 7, 10, 11, 14));
        assertThat(equations.get(0).isWanted(), is(true));
        assertThat(equations.get(1).origin(), is(Origin.GIVEN));
        assertThat(equations.get(1).rhs(), is(Normalizer.normalize(
                Term.add(Term.variable(variables.get("b")), Term.constant(1)))));
        assertThat(variables.numberOfVariables(), is(9));
    }

    @Test
    public void testSolveSystem() throws IOException, InvalidFormatException {
        List<Equation<Integer>> equations = readResource("/equations/system.eqs");
        SolveResult.Solved<Integer> solved = SolverFactory.buildSolver().solve(equations).asSolved();

        for (int handle : new int[] {2, 7, 10, 11}) {
            assertThat(String.valueOf(handle), solved.isProven(handle), is(true));
        }
        assertThat(solved.undecided(), hasSize(1));
        assertThat(solved.undecided().get(0).handle(), is(14));

        Substitution<Integer> substitution = solved.substitution();
        assertThat(substitution.boundVariables(), contains(variables.get("z"), variables.get("w")));
        assertThat(substitution.lookup(variables.get("w")), is(Sop.constant(3)));
        assertThat(solved.progressRounds(), is(4));
    }

    @Test
    public void testOriginCaseInsensitive() throws IOException, InvalidFormatException {
        List<Equation<Integer>> equations = read("\nGIVEN: x == 1\n  Wanted :x==x\n");
        assertThat(equations, hasSize(2));
        assertThat(equations.get(0).handle(), is(2));
        assertThat(equations.get(0).origin(), is(Origin.GIVEN));
        assertThat(equations.get(1).handle(), is(3));
        assertThat(equations.get(1).isWanted(), is(true));
    }

    @Test
    public void testInvalidLine() {
        InvalidFormatException exception =
                assertThrows(InvalidFormatException.class, () -> read("given: x == 1\nx == 2\n"));
        assertThat(exception.getMessage(), containsString("line 2"));
    }

    @Test
    public void testInvalidOrigin() {
        InvalidFormatException exception =
                assertThrows(InvalidFormatException.class, () -> read("assumed: x == 1\n"));
        assertThat(exception.getMessage(), containsString("line 1"));
    }

    @Test
    public void testInvalidTerm() {
        InvalidFormatException exception =
                assertThrows(InvalidFormatException.class, () -> read("# comment\nwanted: x + == 1\n"));
        assertThat(exception.getMessage(), containsString("line 2"));
    }
}
