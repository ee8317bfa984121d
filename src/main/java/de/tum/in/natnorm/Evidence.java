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

import java.util.Objects;

/**
 * Evidence that both sides of a wanted equation are equal. The equality is asserted "by fiat", i.e.
 * no derivation is constructed. The substitution in force when the equation was proven is recorded
 * so that the claim can be re-checked with {@link #replay()}.
 *
 * @param <H> The type of equation handles.
 */
public final class Evidence<H> {
    public static final String BY_FIAT = "natnorm_by_fiat";

    private final Equation<H> equation;
    private final Substitution<H> substitution;

    Evidence(Equation<H> equation, Substitution<H> substitution) {
        this.equation = Objects.requireNonNull(equation);
        this.substitution = Objects.requireNonNull(substitution);
    }

    public Equation<H> equation() {
        return equation;
    }

    public Substitution<H> substitution() {
        return substitution;
    }

    public String name() {
        return BY_FIAT;
    }

    /**
     * Checks that applying the recorded substitution to both sides of the equation yields the same
     * normal form.
     */
    public boolean replay() {
        return substitution.apply(equation.lhs()).equals(substitution.apply(equation.rhs()));
    }

    @Override
    public String toString() {
        return String.format("%s(%s == %s)", BY_FIAT, equation.lhs(), equation.rhs());
    }
}
