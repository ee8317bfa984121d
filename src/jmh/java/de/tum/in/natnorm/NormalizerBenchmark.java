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

import java.util.List;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

public class NormalizerBenchmark extends BaseNatNormBenchmark {
    @State(Scope.Benchmark)
    public static class TermState {
        private static final int SEED = 1234;
        private static final int TERM_COUNT = 5_000;
        private static final int TERM_DEPTH = 5;

        public List<Term> terms;

        @Setup(Level.Trial)
        public void setUpTerms() {
            Variables variables = new Variables();
            terms = TermGenerator.generate(SEED, List.of(variables.create("x"), variables.create("y"),
                    variables.create("z"), variables.create("w")), TERM_COUNT, TERM_DEPTH);
        }
    }

    @Benchmark
    public static void benchmarkNormalize(TermState state, Blackhole bh) {
        for (Term term : state.terms) {
            bh.consume(Normalizer.normalize(term));
        }
    }

    @Benchmark
    public static void benchmarkNormalizeTwice(TermState state, Blackhole bh) {
        for (Term term : state.terms) {
            bh.consume(Normalizer.normalize(Normalizer.normalize(term).toTerm()));
        }
    }
}
