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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class SolverConfiguration {
    public static final int DEFAULT_MAXIMUM_STEPS = 100_000;

    /**
     * Upper bound on the number of unifier invocations of a single {@link EquationSolver#solve}
     * call. Equations which are still pending when the bound is reached are reported as undecided.
     */
    @Value.Default
    public int maximumSteps() {
        return DEFAULT_MAXIMUM_STEPS;
    }

    /**
     * Whether wanted equations may be solved by bindings which are sufficient but not necessary.
     *
     * @see Unifier#Unifier(boolean)
     */
    @Value.Default
    public boolean cancelCommonFactors() {
        return true;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkState(maximumSteps() > 0, "Maximum steps must be positive, got %d", maximumSteps());
    }
}
