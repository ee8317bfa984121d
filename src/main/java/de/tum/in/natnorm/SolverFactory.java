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

public final class SolverFactory {
    private SolverFactory() {}

    public static EquationSolver buildSolver() {
        return buildSolver(ImmutableSolverConfiguration.builder().build());
    }

    public static EquationSolver buildSolver(SolverConfiguration configuration) {
        return new EquationSolver(configuration, new Unifier(configuration.cancelCommonFactors()));
    }
}
