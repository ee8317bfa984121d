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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts terms into their canonical {@link Sop sum-of-products} form and implements the arithmetic
 * on normal forms. All operations are total and pure.
 *
 * <p>Subtractions which cannot be shown to be non-negative are not truncated but kept as
 * {@link Residual} atoms. Powers with a constant exponent are fully expanded, so {@code (x+2)^2} and
 * {@code x^2 + 4*x + 4} have the same normal form, unless the expansion would be too large; then the
 * base becomes a {@link Compound} atom, as for {@code 2^(2^40)}. Powers with a symbolic exponent are split along
 * the monomials of the exponent and distributed over products, i.e. {@code a^(b+c) = a^b * a^c} and
 * {@code (a*b)^c = a^c * b^c}.</p>
 */
public final class Normalizer {
    /** Sums are expanded up to this constant exponent, larger powers remain symbolic. */
    static final BigInteger MAXIMAL_EXPANDED_EXPONENT = BigInteger.valueOf(64);
    /** Constant powers are computed as long as their value fits into this many bits. */
    static final BigInteger MAXIMAL_CONSTANT_BITS = BigInteger.valueOf(1 << 20);

    private Normalizer() {}

    public static Sop normalize(Term term) {
        if (term instanceof Term.Constant) {
            return Sop.constant(((Term.Constant) term).value());
        }
        if (term instanceof Term.Var) {
            return Sop.of(((Term.Var) term).variable());
        }
        if (term instanceof Term.Binary) {
            Term.Binary binary = (Term.Binary) term;
            Sop left = normalize(binary.left());
            Sop right = normalize(binary.right());
            switch (binary.operator()) {
                case ADD:
                    return add(left, right);
                case SUBTRACT:
                    return subtract(left, right);
                case MULTIPLY:
                    return multiply(left, right);
                case POWER:
                    return power(left, right);
                default:
                    throw new IllegalStateException("Unknown operator " + binary.operator());
            }
        }
        throw new IllegalArgumentException("Unknown type " + term.getClass().getSimpleName());
    }

    public static Sop add(Sop left, Sop right) {
        if (left.isZero()) {
            return right;
        }
        if (right.isZero()) {
            return left;
        }
        Map<List<Factor>, BigInteger> monomials = new TreeMap<>(Product.FACTORS_ORDER);
        accumulate(monomials, left.products());
        accumulate(monomials, right.products());
        return build(monomials);
    }

    public static Sop multiply(Sop left, Sop right) {
        if (left.isZero() || right.isZero()) {
            return Sop.ZERO;
        }
        if (left.equals(Sop.ONE)) {
            return right;
        }
        if (right.equals(Sop.ONE)) {
            return left;
        }
        Map<List<Factor>, BigInteger> monomials = new TreeMap<>(Product.FACTORS_ORDER);
        for (Product leftProduct : left.products()) {
            for (Product rightProduct : right.products()) {
                Product product = leftProduct.multiply(rightProduct);
                monomials.merge(product.factors(), product.coefficient(), BigInteger::add);
            }
        }
        return build(monomials);
    }

    /**
     * Truncated subtraction. The common part of both operands is cancelled monomial-wise. If the
     * minuend then dominates the subtrahend the difference is exact, if the minuend vanishes the
     * result is zero, and otherwise the remaining difference becomes a single {@link Residual}.
     */
    public static Sop subtract(Sop minuend, Sop subtrahend) {
        if (subtrahend.isZero()) {
            return minuend;
        }
        Sop[] remainders = cancel(minuend, subtrahend);
        if (remainders[1].isZero()) {
            return remainders[0];
        }
        if (remainders[0].isZero()) {
            return Sop.ZERO;
        }
        return Sop.of(new Residual(remainders[0], remainders[1]));
    }

    /**
     * Removes the common part of both expressions, i.e. for each monomial the smaller of the two
     * coefficients is subtracted from both sides. Since addition over the naturals is cancellative,
     * {@code left = right} holds iff the remainders are equal.
     *
     * @return The two remainders.
     */
    static Sop[] cancel(Sop left, Sop right) {
        List<Product> leftRemainder = new ArrayList<>(left.products().size());
        List<Product> rightRemainder = new ArrayList<>(right.products().size());
        List<Product> leftProducts = left.products();
        List<Product> rightProducts = right.products();
        int i = 0;
        int j = 0;
        while (i < leftProducts.size() && j < rightProducts.size()) {
            Product leftProduct = leftProducts.get(i);
            Product rightProduct = rightProducts.get(j);
            int comparison = Product.SHAPE_ORDER.compare(leftProduct, rightProduct);
            if (comparison < 0) {
                leftRemainder.add(leftProduct);
                i += 1;
            } else if (comparison > 0) {
                rightRemainder.add(rightProduct);
                j += 1;
            } else {
                int coefficientComparison = leftProduct.coefficient().compareTo(rightProduct.coefficient());
                if (coefficientComparison > 0) {
                    leftRemainder.add(leftProduct.withCoefficient(
                            leftProduct.coefficient().subtract(rightProduct.coefficient())));
                } else if (coefficientComparison < 0) {
                    rightRemainder.add(rightProduct.withCoefficient(
                            rightProduct.coefficient().subtract(leftProduct.coefficient())));
                }
                i += 1;
                j += 1;
            }
        }
        leftRemainder.addAll(leftProducts.subList(i, leftProducts.size()));
        rightRemainder.addAll(rightProducts.subList(j, rightProducts.size()));
        return new Sop[] {fromSorted(leftRemainder), fromSorted(rightRemainder)};
    }

    /**
     * Divides every coefficient by the given common divisor.
     */
    static Sop divide(Sop sop, BigInteger divisor) {
        List<Product> products = new ArrayList<>(sop.products().size());
        for (Product product : sop.products()) {
            BigInteger[] division = product.coefficient().divideAndRemainder(divisor);
            Util.checkState(division[1].signum() == 0, "%s does not divide %s", divisor, sop);
            products.add(product.withCoefficient(division[0]));
        }
        return fromSorted(products);
    }

    public static Sop power(Sop base, Sop exponent) {
        if (exponent.isConstant()) {
            return power(base, exponent.constantValue());
        }
        if (base.equals(Sop.ONE)) {
            return Sop.ONE;
        }
        Sop result = Sop.ONE;
        for (Product monomial : exponent.products()) {
            result = multiply(result, power(base, monomial));
        }
        return result;
    }

    /**
     * Whether {@code base^exponent} is small enough to be computed. Larger powers are kept symbolic.
     */
    private static boolean isExpandable(BigInteger base, BigInteger exponent) {
        if (base.signum() == 0 || base.equals(BigInteger.ONE)) {
            return true;
        }
        return exponent.compareTo(MAXIMAL_CONSTANT_BITS.divide(BigInteger.valueOf(base.bitLength()))) <= 0;
    }

    /**
     * Expands {@code base^exponent} by repeated multiplication.
     *
     * @throws ArithmeticException if the exponent is too large to be expanded.
     */
    public static Sop power(Sop base, BigInteger exponent) {
        Util.checkNatural(exponent);
        if (exponent.signum() == 0) {
            return Sop.ONE;
        }
        if (base.isConstant()) {
            BigInteger value = base.constantValue();
            if (isExpandable(value, exponent)) {
                return Sop.constant(Util.pow(value, exponent));
            }
            return Sop.of(Product.of(new Factor(new Compound(base), Product.constant(exponent))));
        }
        if (exponent.equals(BigInteger.ONE)) {
            return base;
        }
        if (base.products().size() == 1) {
            // A single monomial only needs its exponents scaled
            return Sop.of(power(base.products().get(0), Product.constant(exponent)));
        }
        if (exponent.compareTo(MAXIMAL_EXPANDED_EXPONENT) > 0) {
            return Sop.of(Product.of(new Factor(new Compound(base), Product.constant(exponent))));
        }
        int remaining = exponent.intValueExact();
        Sop result = Sop.ONE;
        Sop square = base;
        while (remaining > 0) {
            if ((remaining & 1) != 0) {
                result = multiply(result, square);
            }
            remaining >>= 1;
            if (remaining > 0) {
                square = multiply(square, square);
            }
        }
        return result;
    }

    private static Sop power(Sop base, Product monomial) {
        if (monomial.isConstant()) {
            return power(base, monomial.coefficient());
        }
        if (base.products().size() != 1) {
            // Either zero or a proper sum, both are kept as symbolic base
            return Sop.of(Product.of(new Factor(new Compound(base), monomial)));
        }
        Product product = base.products().get(0);
        if (product.isConstant() && product.coefficient().equals(BigInteger.ONE)) {
            return Sop.ONE;
        }
        return Sop.of(power(product, monomial));
    }

    /**
     * Raises a single product to a monomial exponent: {@code (c * b1^e1 * ... * bn^en)^m} equals
     * {@code c^m * b1^(e1*m) * ... * bn^(en*m)}. For a symbolic {@code m} the coefficient becomes a
     * {@link Compound} factor.
     */
    private static Product power(Product product, Product monomial) {
        List<Factor> factors = new ArrayList<>(product.factors().size());
        for (Factor factor : product.factors()) {
            factors.add(new Factor(factor.base(), factor.exponent().multiply(monomial)));
        }
        factors.sort(Factor.SHAPE_ORDER);

        BigInteger coefficient = product.coefficient();
        if (coefficient.equals(BigInteger.ONE)) {
            return new Product(BigInteger.ONE, factors);
        }
        if (monomial.isConstant() && isExpandable(coefficient, monomial.coefficient())) {
            return new Product(Util.pow(coefficient, monomial.coefficient()), factors);
        }
        // The coefficient power may share its shape with one of the scaled factors
        return new Product(BigInteger.ONE, factors)
                .multiply(Product.of(new Factor(new Compound(Sop.constant(coefficient)), monomial)));
    }

    private static void accumulate(Map<List<Factor>, BigInteger> monomials, List<Product> products) {
        for (Product product : products) {
            monomials.merge(product.factors(), product.coefficient(), BigInteger::add);
        }
    }

    private static Sop build(Map<List<Factor>, BigInteger> monomials) {
        List<Product> products = new ArrayList<>(monomials.size());
        for (Map.Entry<List<Factor>, BigInteger> entry : monomials.entrySet()) {
            if (entry.getValue().signum() != 0) {
                products.add(entry.getKey().isEmpty()
                        ? Product.constant(entry.getValue())
                        : new Product(entry.getValue(), entry.getKey()));
            }
        }
        return fromSorted(products);
    }

    private static Sop fromSorted(List<Product> products) {
        if (products.isEmpty()) {
            return Sop.ZERO;
        }
        if (products.size() == 1 && products.get(0).equals(Product.ONE)) {
            return Sop.ONE;
        }
        return new Sop(ImmutableList.copyOf(products));
    }
}
