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
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Compares two normal forms and classifies the outcome as a {@link UnifyResult}.
 *
 * <p>A {@link UnifyResult.Kind#LOSE} is only reported if the equation provably has no solution over
 * the naturals. Bindings derived from a {@link Origin#GIVEN} equation are always equivalent to it.
 * For {@link Origin#WANTED} equations, the unifier may additionally propose bindings which are
 * sufficient but not necessary, e.g. {@code y := z} for {@code x*y = x*z}, since proving the
 * stronger equation also proves the goal.</p>
 */
public final class Unifier {
    private final boolean cancelCommonFactors;

    public Unifier() {
        this(true);
    }

    /**
     * @param cancelCommonFactors
     *     Whether sufficient but not necessary bindings may be proposed for wanted equations.
     */
    public Unifier(boolean cancelCommonFactors) {
        this.cancelCommonFactors = cancelCommonFactors;
    }

    public <H> UnifyResult<H> unify(H handle, Origin origin, Sop lhs, Sop rhs) {
        return unify(handle, origin, lhs, rhs, cancelCommonFactors);
    }

    /**
     * Unifies the two sides, proposing sufficient bindings for a wanted equation only if
     * {@code sufficient} is set.
     */
    <H> UnifyResult<H> unify(H handle, Origin origin, Sop lhs, Sop rhs, boolean sufficient) {
        if (lhs.equals(rhs)) {
            return UnifyResult.win();
        }
        Sop[] sides = Normalizer.cancel(lhs, rhs);
        return unifyDifferent(handle, origin, sides[0], sides[1], sufficient);
    }


    /**
     * Unifies two different expressions without common monomials.
     */
    private <H> UnifyResult<H> unifyDifferent(H handle, Origin origin, Sop left, Sop right, boolean sufficient) {
        assert !left.equals(right);
        if (isUnsatisfiable(left, right)) {
            return UnifyResult.lose();
        }

        UnifyResult<H> result = bindVariable(handle, origin, left, right);
        if (result != null) {
            return result;
        }

        BigInteger divisor = coefficientGcd(left, right);
        if (divisor.compareTo(BigInteger.ONE) > 0) {
            return unifyDifferent(handle, origin, Normalizer.divide(left, divisor), Normalizer.divide(right, divisor),
                    sufficient);
        }

        result = unifyPowers(handle, origin, left, right, sufficient);
        if (result != null) {
            return result;
        }

        if (origin == Origin.WANTED && sufficient) {
            result = unifySufficient(handle, left, right);
            if (result != null) {
                return result;
            }
        }
        return UnifyResult.stuck();
    }

    /**
     * Checks necessary conditions for a solution: every expression is bounded from below by its
     * constant term, and the constant has to be a multiple of the gcd of all other coefficients.
     */
    private static boolean isUnsatisfiable(Sop left, Sop right) {
        if (left.isConstant() && right.isConstant()) {
            return true;
        }
        if ((left.isZero() && right.constantTerm().signum() > 0)
                || (right.isZero() && left.constantTerm().signum() > 0)) {
            return true;
        }
        // After cancellation, at most one side has a constant term
        BigInteger constant = left.constantTerm().add(right.constantTerm());
        if (constant.signum() == 0) {
            return false;
        }
        BigInteger divisor = BigInteger.ZERO;
        for (Sop side : new Sop[] {left, right}) {
            for (Product product : side.products()) {
                if (!product.isConstant()) {
                    divisor = divisor.gcd(product.coefficient());
                }
            }
        }
        return divisor.signum() > 0 && constant.mod(divisor).signum() != 0;
    }

    /**
     * Binds a side which is a single variable to the other side, provided the occurs check succeeds.
     * If both sides are candidates, the smaller replacement is chosen, and for equal sizes the
     * variable with the larger identity is bound.
     */
    @Nullable
    private static <H> UnifyResult<H> bindVariable(H handle, Origin origin, Sop left, Sop right) {
        Variable leftVariable = left.asVariable();
        Variable rightVariable = right.asVariable();
        SubstItem<H> leftBinding = leftVariable == null ? null : SubstItem.bind(leftVariable, right, origin, handle);
        SubstItem<H> rightBinding = rightVariable == null ? null : SubstItem.bind(rightVariable, left, origin, handle);
        if (leftBinding == null && rightBinding == null) {
            return null;
        }
        SubstItem<H> binding;
        if (leftBinding == null) {
            binding = rightBinding;
        } else if (rightBinding == null) {
            binding = leftBinding;
        } else {
            int sizeComparison = Integer.compare(right.size(), left.size());
            if (sizeComparison == 0) {
                binding = leftVariable.id() > rightVariable.id() ? leftBinding : rightBinding;
            } else {
                binding = sizeComparison < 0 ? leftBinding : rightBinding;
            }
        }
        return UnifyResult.draw(binding);
    }

    private static BigInteger coefficientGcd(Sop left, Sop right) {
        BigInteger divisor = BigInteger.ZERO;
        for (Product product : left.products()) {
            divisor = divisor.gcd(product.coefficient());
        }
        for (Product product : right.products()) {
            divisor = divisor.gcd(product.coefficient());
        }
        return divisor;
    }

    /**
     * Handles powers which can be inverted. For a constant base {@code c >= 2}, exponentiation is
     * injective: {@code c^a = c^b} iff {@code a = b}, and {@code c^a = j} iff {@code a = log_c j}.
     * Roots of naturals are unique, so {@code x^k = j} iff {@code x} is the exact {@code k}-th root
     * of {@code j}.
     */
    @Nullable
    private <H> UnifyResult<H> unifyPowers(H handle, Origin origin, Sop left, Sop right, boolean sufficient) {
        Factor leftPower = singleFactor(left);
        Factor rightPower = singleFactor(right);
        if (leftPower != null && rightPower != null) {
            if (leftPower.base().equals(rightPower.base()) && isInjectiveBase(leftPower.base())) {
                return unify(handle, origin, Sop.of(leftPower.exponent()), Sop.of(rightPower.exponent()), sufficient);
            }
            return null;
        }
        if (leftPower != null && right.isConstant()) {
            return unifyLogarithm(handle, origin, leftPower, right.constantValue(), sufficient);
        }
        if (rightPower != null && left.isConstant()) {
            return unifyLogarithm(handle, origin, rightPower, left.constantValue(), sufficient);
        }
        return null;
    }

    @Nullable
    private <H> UnifyResult<H> unifyLogarithm(H handle, Origin origin, Factor power, BigInteger value,
            boolean sufficient) {
        if (power.base().isVariable() && !power.isSymbolic()) {
            BigInteger root = Util.exactRoot(value, power.exponent().coefficient());
            if (root == null) {
                return UnifyResult.lose();
            }
            return unify(handle, origin, Sop.of(power.base()), Sop.constant(root), sufficient);
        }
        if (!isInjectiveBase(power.base())) {
            return null;
        }
        BigInteger logarithm = Util.exactLog(((Compound) power.base()).base().constantValue(), value);
        if (logarithm == null) {
            return UnifyResult.lose();
        }
        return unify(handle, origin, Sop.of(power.exponent()), Sop.constant(logarithm), sufficient);
    }

    /**
     * Proposes bindings which imply the equation without being implied by it: common factors of two
     * monomials are cancelled ({@code x*y = x*z} becomes {@code y = z}) and powers of the same base
     * are reduced to their exponents ({@code b^a = b^c} becomes {@code a = c}). Since the reduced
     * equation is stronger, its failure does not refute the original one.
     */
    @Nullable
    private <H> UnifyResult<H> unifySufficient(H handle, Sop left, Sop right) {
        if (left.products().size() != 1 || right.products().size() != 1) {
            return null;
        }
        Product leftProduct = left.products().get(0);
        Product rightProduct = right.products().get(0);

        List<Factor> leftRemainder = new ArrayList<>(leftProduct.factors().size());
        List<Factor> rightRemainder = new ArrayList<>(rightProduct.factors().size());
        if (cancelFactors(leftProduct.factors(), rightProduct.factors(), leftRemainder, rightRemainder)) {
            Sop reducedLeft = Sop.of(new Product(leftProduct.coefficient(), leftRemainder));
            Sop reducedRight = Sop.of(new Product(rightProduct.coefficient(), rightRemainder));
            return weaken(unify(handle, Origin.WANTED, reducedLeft, reducedRight, true));
        }

        Factor leftPower = singleFactor(left);
        Factor rightPower = singleFactor(right);
        if (leftPower != null && rightPower != null && leftPower.base().equals(rightPower.base())) {
            return weaken(unify(handle, Origin.WANTED,
                    Sop.of(leftPower.exponent()), Sop.of(rightPower.exponent()), true));
        }
        return null;
    }

    /**
     * Cancels the common part of two sorted factor lists. Factors of the same shape share the smaller
     * exponent coefficient.
     *
     * @return Whether anything was cancelled.
     */
    private static boolean cancelFactors(List<Factor> left, List<Factor> right,
            List<Factor> leftRemainder, List<Factor> rightRemainder) {
        boolean cancelled = false;
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            Factor leftFactor = left.get(i);
            Factor rightFactor = right.get(j);
            int comparison = Factor.SHAPE_ORDER.compare(leftFactor, rightFactor);
            if (comparison < 0) {
                leftRemainder.add(leftFactor);
                i += 1;
            } else if (comparison > 0) {
                rightRemainder.add(rightFactor);
                j += 1;
            } else {
                cancelled = true;
                BigInteger leftExponent = leftFactor.exponent().coefficient();
                BigInteger rightExponent = rightFactor.exponent().coefficient();
                int exponentComparison = leftExponent.compareTo(rightExponent);
                if (exponentComparison > 0) {
                    leftRemainder.add(new Factor(leftFactor.base(),
                            leftFactor.exponent().withCoefficient(leftExponent.subtract(rightExponent))));
                } else if (exponentComparison < 0) {
                    rightRemainder.add(new Factor(rightFactor.base(),
                            rightFactor.exponent().withCoefficient(rightExponent.subtract(leftExponent))));
                }
                i += 1;
                j += 1;
            }
        }
        leftRemainder.addAll(left.subList(i, left.size()));
        rightRemainder.addAll(right.subList(j, right.size()));
        return cancelled;
    }

    /**
     * Marks the outcome of a stronger equation as applying to the original one: a refutation becomes
     * stuck and bindings become sufficient.
     */
    private static <H> UnifyResult<H> weaken(UnifyResult<H> result) {
        switch (result.kind()) {
            case LOSE:
                return UnifyResult.stuck();
            case DRAW:
                List<SubstItem<H>> bindings = new ArrayList<>(result.bindings().size());
                for (SubstItem<H> binding : result.bindings()) {
                    bindings.add(binding.asSufficient());
                }
                return UnifyResult.draw(bindings);
            default:
                return result;
        }
    }

    private static boolean isInjectiveBase(Atom base) {
        if (!(base instanceof Compound)) {
            return false;
        }
        Sop value = ((Compound) base).base();
        return value.isConstant() && value.constantValue().compareTo(BigInteger.TWO) >= 0;
    }

    /**
     * Returns the factor if the expression is exactly {@code b^e} for some atom {@code b}.
     */
    @Nullable
    private static Factor singleFactor(Sop sop) {
        if (sop.products().size() != 1) {
            return null;
        }
        Product product = sop.products().get(0);
        if (!product.coefficient().equals(BigInteger.ONE) || product.factors().size() != 1) {
            return null;
        }
        return product.factors().get(0);
    }
}
