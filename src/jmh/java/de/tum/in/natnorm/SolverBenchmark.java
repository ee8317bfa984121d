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

import java.util.ArrayList;
import java.util.List;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

public class SolverBenchmark extends BaseNatNormBenchmark {
    @State(Scope.Benchmark)
    public static class ChainState extends SolverState {
        @Param({"100", "400"})
        private int length;

        public List<Equation<Integer>> equations;

        /**
         * Builds {@code x_i == x_(i+1) + 1} for all {@code i}. The wanted equation comes first, without
         * factor cancellation it is parked until the chain is resolved.
         */
        @Setup(Level.Trial)
        public void setUpEquations() throws InvalidFormatException {
            Variables variables = new Variables();
            equations = new ArrayList<>(length + 2);
            equations.add(Equation.wanted(0, TermParser.parse("x0 * y", variables),
                    TermParser.parse(length + " * y", variables)));
            for (int i = 0; i < length; i++) {
                equations.add(Equation.given(i + 1, TermParser.parse("x" + i, variables),
                        TermParser.parse("x" + (i + 1) + " + 1", variables)));
            }
            equations.add(Equation.given(length + 1, TermParser.parse("x" + length, variables),
                    TermParser.parse("0", variables)));
        }
    }

    @Benchmark
    public static void benchmarkChain(ChainState state, Blackhole bh) {
        bh.consume(state.solver().solve(state.equations));
    }
}
