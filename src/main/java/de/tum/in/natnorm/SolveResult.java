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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link EquationSolver#solve(List)}: either {@link Solved} or {@link Contradiction}.
 *
 * @param <H> The type of equation handles.
 */
public abstract class SolveResult<H> {
    private final int steps;
    private final int progressRounds;

    SolveResult(int steps, int progressRounds) {
        this.steps = steps;
        this.progressRounds = progressRounds;
    }

    public abstract boolean isContradiction();

    /**
     * Number of unifier invocations.
     */
    public int steps() {
        return steps;
    }

    /**
     * Number of unifier invocations which produced new bindings. Each of them eliminates a variable,
     * hence this is bounded by the number of distinct variables.
     */
    public int progressRounds() {
        return progressRounds;
    }

    public Solved<H> asSolved() {
        Util.checkState(!isContradiction(), "Result is a contradiction: %s", this);
        return (Solved<H>) this;
    }

    public Contradiction<H> asContradiction() {
        Util.checkState(isContradiction(), "Result is not a contradiction: %s", this);
        return (Contradiction<H>) this;
    }

    public static final class Solved<H> extends SolveResult<H> {
        private final Substitution<H> substitution;
        private final ImmutableList<Evidence<H>> evidence;
        private final ImmutableList<Equation<H>> undecided;

        Solved(Substitution<H> substitution, List<Evidence<H>> evidence, List<Equation<H>> undecided,
                int steps, int progressRounds) {
            super(steps, progressRounds);
            this.substitution = Objects.requireNonNull(substitution);
            this.evidence = ImmutableList.copyOf(evidence);
            this.undecided = ImmutableList.copyOf(undecided);
        }

        @Override
        public boolean isContradiction() {
            return false;
        }

        /**
         * The bindings derived from wanted equations.
         */
        public Substitution<H> substitution() {
            return substitution;
        }

        /**
         * Evidence for each wanted equation which was proven, in the order of proof.
         */
        public List<Evidence<H>> evidence() {
            return evidence;
        }

        /**
         * Equations on which no decision could be made, given or wanted.
         */
        public List<Equation<H>> undecided() {
            return undecided;
        }

        public boolean isProven(H handle) {
            for (Evidence<H> proof : evidence) {
                if (proof.equation().handle().equals(handle)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return "Solved" + substitution + evidence;
        }
    }

    public static final class Contradiction<H> extends SolveResult<H> {
        private final Equation<H> equation;

        Contradiction(Equation<H> equation, int steps, int progressRounds) {
            super(steps, progressRounds);
            this.equation = Objects.requireNonNull(equation);
        }

        @Override
        public boolean isContradiction() {
            return true;
        }

        public Equation<H> equation() {
            return equation;
        }

        public H handle() {
            return equation.handle();
        }

        @Override
        public String toString() {
            return "Contradiction[" + equation + "]";
        }
    }
}
