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
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A base {@link Atom} raised to an exponent. The exponent is a monomial: either a constant (a
 * {@link Product} without factors) or a symbolic product such as {@code 2*y}.
 */
public final class Factor implements Comparable<Factor> {
    /**
     * Orders factors by their base and the shape of their exponent, ignoring the exponent's
     * coefficient. Two factors of one product are never equal under this order.
     */
    static final Comparator<Factor> SHAPE_ORDER = (one, other) -> {
        int comparison = one.base.compareTo(other.base);
        return comparison == 0
                ? Product.FACTORS_ORDER.compare(one.exponent.factors(), other.exponent.factors())
                : comparison;
    };

    private final Atom base;
    private final Product exponent;

    Factor(Atom base, Product exponent) {
        this.base = Objects.requireNonNull(base);
        this.exponent = Objects.requireNonNull(exponent);
    }

    static Factor of(Atom base) {
        return new Factor(base, Product.ONE);
    }

    public Atom base() {
        return base;
    }

    public Product exponent() {
        return exponent;
    }

    /**
     * Whether the exponent of this factor contains variables.
     */
    public boolean isSymbolic() {
        return !exponent.isConstant();
    }

    boolean sameShape(Factor other) {
        return base.equals(other.base) && exponent.sameShape(other.exponent);
    }

    /**
     * Multiplies two factors of the same shape, i.e. {@code b^(c1*m) * b^(c2*m) = b^((c1+c2)*m)}.
     */
    Factor merge(Factor other) {
        assert sameShape(other);
        return new Factor(base, exponent.withCoefficient(exponent.coefficient().add(other.exponent.coefficient())));
    }

    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        return Util.pow(base.evaluate(assignment), exponent.evaluate(assignment));
    }

    void collectVariables(Set<Variable> variables) {
        base.collectVariables(variables);
        exponent.collectVariables(variables);
    }

    public int size() {
        return exponent.equals(Product.ONE) ? base.size() : base.size() + exponent.size();
    }

    public Term toTerm() {
        return exponent.equals(Product.ONE) ? base.toTerm() : Term.power(base.toTerm(), exponent.toTerm());
    }

    @Override
    public int compareTo(Factor other) {
        int comparison = base.compareTo(other.base);
        return comparison == 0 ? exponent.compareTo(other.exponent) : comparison;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Factor)) {
            return false;
        }
        Factor that = (Factor) object;
        return base.equals(that.base) && exponent.equals(that.exponent);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + exponent.hashCode();
    }

    @Override
    public String toString() {
        return toTerm().toString();
    }
}
