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
import java.util.Objects;
import java.util.Set;

/**
 * A truncated subtraction {@code minuend - subtrahend} which could not be proven non-negative. It is
 * kept as an opaque unit. Both operands are non-zero and share no monomial.
 */
public final class Residual extends Atom {
    private final Sop minuend;
    private final Sop subtrahend;
    private final int hashCode;

    Residual(Sop minuend, Sop subtrahend) {
        assert !minuend.isZero() && !subtrahend.isZero();
        this.minuend = minuend;
        this.subtrahend = subtrahend;
        this.hashCode = Objects.hash(minuend, subtrahend);
    }

    public Sop minuend() {
        return minuend;
    }

    public Sop subtrahend() {
        return subtrahend;
    }

    @Override
    int kind() {
        return RESIDUAL;
    }

    @Override
    int compareSameKind(Atom other) {
        Residual that = (Residual) other;
        int comparison = minuend.compareTo(that.minuend);
        return comparison == 0 ? subtrahend.compareTo(that.subtrahend) : comparison;
    }

    @Override
    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        return Util.monus(minuend.evaluate(assignment), subtrahend.evaluate(assignment));
    }

    @Override
    void collectVariables(Set<Variable> variables) {
        minuend.collectVariables(variables);
        subtrahend.collectVariables(variables);
    }

    @Override
    public int size() {
        return 1 + minuend.size() + subtrahend.size();
    }

    @Override
    public Term toTerm() {
        return Term.subtract(minuend.toTerm(), subtrahend.toTerm());
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Residual)) {
            return false;
        }
        Residual that = (Residual) object;
        return hashCode == that.hashCode
                && minuend.equals(that.minuend)
                && subtrahend.equals(that.subtrahend);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + toTerm() + ")";
    }
}
