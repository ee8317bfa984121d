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
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * The canonical sum-of-products normal form of an expression over the naturals. An instance is a
 * sorted list of {@link Product}s with pairwise different monomials; the empty list represents zero.
 *
 * <p>Instances are only created by the {@link Normalizer}, which guarantees that structurally equal
 * expressions have equal normal forms. Hence {@link #equals(Object)} implies semantic equality.</p>
 */
public final class Sop implements Comparable<Sop> {
    private static final Comparator<Iterable<Product>> PRODUCTS_ORDER =
            Comparators.lexicographical(Comparator.<Product>naturalOrder());

    public static final Sop ZERO = new Sop(ImmutableList.of());
    public static final Sop ONE = new Sop(ImmutableList.of(Product.ONE));

    private final ImmutableList<Product> products;
    private final int hashCode;

    @Nullable
    private ImmutableSortedSet<Variable> variablesCache;

    Sop(List<Product> products) {
        assert Comparators.isInStrictOrder(products, Product.SHAPE_ORDER) : "Unsorted products " + products;
        this.products = ImmutableList.copyOf(products);
        this.hashCode = this.products.hashCode();
    }

    public static Sop constant(BigInteger value) {
        Util.checkNatural(value);
        if (value.signum() == 0) {
            return ZERO;
        }
        return value.equals(BigInteger.ONE) ? ONE : new Sop(ImmutableList.of(Product.constant(value)));
    }

    public static Sop constant(long value) {
        return constant(BigInteger.valueOf(value));
    }

    public static Sop of(Atom atom) {
        return of(Product.of(Factor.of(atom)));
    }

    static Sop of(Product product) {
        return product.equals(Product.ONE) ? ONE : new Sop(ImmutableList.of(product));
    }

    public List<Product> products() {
        return products;
    }

    public boolean isZero() {
        return products.isEmpty();
    }

    public boolean isConstant() {
        return products.isEmpty() || (products.size() == 1 && products.get(0).isConstant());
    }

    /**
     * Returns the value of this constant.
     *
     * @throws IllegalStateException if this expression is not constant.
     */
    public BigInteger constantValue() {
        Util.checkState(isConstant(), "%s is not constant", this);
        return constantTerm();
    }

    /**
     * Returns the coefficient of the constant monomial, which is a lower bound of the value of this
     * expression under any assignment.
     */
    public BigInteger constantTerm() {
        // The constant product has no factors and hence is sorted first
        if (products.isEmpty() || !products.get(0).isConstant()) {
            return BigInteger.ZERO;
        }
        return products.get(0).coefficient();
    }

    /**
     * Returns the variable if this expression is exactly a single variable and {@code null} otherwise.
     */
    @Nullable
    public Variable asVariable() {
        if (products.size() != 1) {
            return null;
        }
        Product product = products.get(0);
        if (!product.coefficient().equals(BigInteger.ONE) || product.factors().size() != 1) {
            return null;
        }
        Factor factor = product.factors().get(0);
        if (!factor.base().isVariable() || !factor.exponent().equals(Product.ONE)) {
            return null;
        }
        return (Variable) factor.base();
    }

    /**
     * Whether this is an ordinary polynomial, i.e. it contains neither residual subtractions nor
     * symbolic powers. Two different polynomials always denote different functions.
     */
    public boolean isPolynomial() {
        for (Product product : products) {
            for (Factor factor : product.factors()) {
                if (!factor.base().isVariable() || factor.isSymbolic()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns all variables occurring in this expression, including those in exponents, residuals and
     * compound bases, in canonical order.
     */
    public Set<Variable> variables() {
        ImmutableSortedSet<Variable> variables = variablesCache;
        if (variables == null) {
            Set<Variable> collected = new TreeSet<>();
            collectVariables(collected);
            variables = ImmutableSortedSet.copyOf(collected);
            variablesCache = variables;
        }
        return variables;
    }

    public boolean contains(Variable variable) {
        return variables().contains(variable);
    }

    void collectVariables(Set<Variable> variables) {
        if (variablesCache != null) {
            variables.addAll(variablesCache);
            return;
        }
        for (Product product : products) {
            product.collectVariables(variables);
        }
    }

    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        BigInteger value = BigInteger.ZERO;
        for (Product product : products) {
            value = value.add(product.evaluate(assignment));
        }
        return value;
    }

    /**
     * Number of nodes in the structure of this expression, used to prefer small substitutions.
     */
    public int size() {
        int size = Math.max(products.size() - 1, 0);
        for (Product product : products) {
            size += product.size();
        }
        return Math.max(size, 1);
    }

    /**
     * Reifies this normal form as a term. Normalizing the result yields this instance again.
     */
    public Term toTerm() {
        if (products.isEmpty()) {
            return Term.constant(BigInteger.ZERO);
        }
        Term term = products.get(0).toTerm();
        for (Product product : products.subList(1, products.size())) {
            term = Term.add(term, product.toTerm());
        }
        return term;
    }

    @Override
    public int compareTo(Sop other) {
        return this == other ? 0 : PRODUCTS_ORDER.compare(products, other.products);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Sop)) {
            return false;
        }
        Sop that = (Sop) object;
        return hashCode == that.hashCode && products.equals(that.products);
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
