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

import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A positive coefficient times a product of {@link Factor}s. The factors are sorted and no two of
 * them have the same {@link Factor#SHAPE_ORDER shape}.
 */
public final class Product implements Comparable<Product> {
    static final Comparator<Iterable<Factor>> FACTORS_ORDER =
            Comparators.lexicographical(Comparator.<Factor>naturalOrder());
    static final Comparator<Product> SHAPE_ORDER = (one, other) -> FACTORS_ORDER.compare(one.factors, other.factors);
    public static final Product ONE = new Product(BigInteger.ONE, ImmutableList.of());

    private final BigInteger coefficient;
    private final ImmutableList<Factor> factors;
    private final int hashCode;

    Product(BigInteger coefficient, List<Factor> factors) {
        assert coefficient.signum() > 0 : "Non-positive coefficient " + coefficient;
        assert Comparators.isInStrictOrder(factors, Factor.SHAPE_ORDER) : "Unsorted factors " + factors;
        this.coefficient = coefficient;
        this.factors = ImmutableList.copyOf(factors);
        this.hashCode = 31 * coefficient.hashCode() + this.factors.hashCode();
    }

    public static Product constant(BigInteger coefficient) {
        return coefficient.equals(BigInteger.ONE) ? ONE : new Product(coefficient, ImmutableList.of());
    }

    static Product of(Factor factor) {
        return new Product(BigInteger.ONE, ImmutableList.of(factor));
    }

    public BigInteger coefficient() {
        return coefficient;
    }

    public List<Factor> factors() {
        return factors;
    }

    public boolean isConstant() {
        return factors.isEmpty();
    }

    /**
     * Whether both products are the same monomial, possibly with different coefficients.
     */
    public boolean sameShape(Product other) {
        return factors.equals(other.factors);
    }

    Product withCoefficient(BigInteger newCoefficient) {
        if (newCoefficient.equals(coefficient)) {
            return this;
        }
        return factors.isEmpty() ? constant(newCoefficient) : new Product(newCoefficient, factors);
    }

    /**
     * Multiplies two products: coefficients are multiplied and the factor lists are merged, combining
     * factors with the same shape.
     */
    Product multiply(Product other) {
        if (other.isConstant()) {
            return withCoefficient(coefficient.multiply(other.coefficient));
        }
        if (isConstant()) {
            return other.withCoefficient(coefficient.multiply(other.coefficient));
        }
        ImmutableList.Builder<Factor> merged =
                ImmutableList.builderWithExpectedSize(factors.size() + other.factors.size());
        int i = 0;
        int j = 0;
        while (i < factors.size() && j < other.factors.size()) {
            Factor left = factors.get(i);
            Factor right = other.factors.get(j);
            int comparison = Factor.SHAPE_ORDER.compare(left, right);
            if (comparison < 0) {
                merged.add(left);
                i += 1;
            } else if (comparison > 0) {
                merged.add(right);
                j += 1;
            } else {
                merged.add(left.merge(right));
                i += 1;
                j += 1;
            }
        }
        merged.addAll(factors.subList(i, factors.size()));
        merged.addAll(other.factors.subList(j, other.factors.size()));
        return new Product(coefficient.multiply(other.coefficient), merged.build());
    }

    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        BigInteger value = coefficient;
        for (Factor factor : factors) {
            if (value.signum() == 0) {
                break;
            }
            value = value.multiply(factor.evaluate(assignment));
        }
        return value;
    }

    void collectVariables(Set<Variable> variables) {
        for (Factor factor : factors) {
            factor.collectVariables(variables);
        }
    }

    public int size() {
        int size = coefficient.equals(BigInteger.ONE) && !factors.isEmpty() ? 0 : 1;
        for (Factor factor : factors) {
            size += factor.size();
        }
        return size;
    }

    public Term toTerm() {
        Term term = null;
        if (factors.isEmpty() || !coefficient.equals(BigInteger.ONE)) {
            term = Term.constant(coefficient);
        }
        for (Factor factor : factors) {
            term = term == null ? factor.toTerm() : Term.multiply(term, factor.toTerm());
        }
        return term;
    }

    @Override
    public int compareTo(Product other) {
        if (this == other) {
            return 0;
        }
        int comparison = FACTORS_ORDER.compare(factors, other.factors);
        return comparison == 0 ? coefficient.compareTo(other.coefficient) : comparison;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Product)) {
            return false;
        }
        Product that = (Product) object;
        return hashCode == that.hashCode && coefficient.equals(that.coefficient) && factors.equals(that.factors);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return toTerm().toString();
    }
}
