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

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;

/**
 * The base of a {@link Factor}. Atoms are the indivisible units of a sum-of-products: a
 * {@link Variable}, an irreducible {@link Residual} subtraction or a {@link Compound} base of a
 * symbolic power.
 *
 * <p>Atoms are totally ordered, first by their kind and then structurally. Variables are ordered by
 * their identity only.</p>
 */
public abstract class Atom implements Comparable<Atom> {
    static final int VARIABLE = 0;
    static final int RESIDUAL = 1;
    static final int COMPOUND = 2;

    Atom() {
        // Only the three kinds defined in this package
    }

    abstract int kind();

    abstract int compareSameKind(Atom other);

    /**
     * Evaluates this atom under the given assignment. Unassigned variables are treated as errors.
     */
    public abstract BigInteger evaluate(Map<Variable, BigInteger> assignment);

    abstract void collectVariables(Set<Variable> variables);

    /**
     * Number of nodes in the structure of this atom.
     */
    public abstract int size();

    /**
     * Whether this atom is a plain variable, i.e. it does not hide a subtraction or a symbolic power.
     */
    public boolean isVariable() {
        return kind() == VARIABLE;
    }

    public abstract Term toTerm();

    @Override
    public final int compareTo(Atom other) {
        if (this == other) {
            return 0;
        }
        int kindComparison = Integer.compare(kind(), other.kind());
        return kindComparison == 0 ? compareSameKind(other) : kindComparison;
    }
}
