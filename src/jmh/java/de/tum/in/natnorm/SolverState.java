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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class SolverState {
    @Param({"true", "false"})
    private boolean cancelCommonFactors;

    private EquationSolver solver;

    @Setup(Level.Iteration)
    public void setUpSolver() {
        solver = SolverFactory.buildSolver(ImmutableSolverConfiguration.builder()
                .cancelCommonFactors(cancelCommonFactors)
                .build());
    }

    public EquationSolver solver() {
        return solver;
    }
}
