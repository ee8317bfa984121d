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
 * The base of a symbolic power which is not an atom itself, i.e. a sum of at least two products or
 * a constant other than one, as in {@code (x + 2)^y} or {@code 2^y}. Powers with a constant exponent
 * too large to expand, such as {@code (x + 2)^100}, also keep a compound base.
 */
public final class Compound extends Atom {
    private final Sop base;

    Compound(Sop base) {
        assert !base.equals(Sop.ONE);
        assert base.isConstant() || base.products().size() > 1;
        this.base = base;
    }

    public Sop base() {
        return base;
    }

    @Override
    int kind() {
        return COMPOUND;
    }

    @Override
    int compareSameKind(Atom other) {
        return base.compareTo(((Compound) other).base);
    }

    @Override
    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        return base.evaluate(assignment);
    }

    @Override
    void collectVariables(Set<Variable> variables) {
        base.collectVariables(variables);
    }

    @Override
    public int size() {
        return base.size();
    }

    @Override
    public Term toTerm() {
        return base.toTerm();
    }

    @Override
    public boolean equals(Object object) {
        return this == object || (object instanceof Compound && base.equals(((Compound) object).base));
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + 7;
    }

    @Override
    public String toString() {
        return "(" + base + ")";
    }
}
