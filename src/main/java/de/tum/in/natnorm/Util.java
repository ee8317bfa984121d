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
import javax.annotation.Nullable;

final class Util {
    private Util() {}

    public static void checkState(boolean state, String formatString, Object... format) {
        if (!state) {
            throw new IllegalStateException(String.format(formatString, format));
        }
    }

    public static BigInteger checkNatural(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Not a natural number: " + value);
        }
        return value;
    }

    /**
     * Natural number exponentiation with {@code 0^0 = 1}.
     *
     * @throws ArithmeticException if the result is not representable.
     */
    public static BigInteger pow(BigInteger base, BigInteger exponent) {
        if (exponent.signum() == 0 || base.equals(BigInteger.ONE)) {
            return BigInteger.ONE;
        }
        if (base.signum() == 0) {
            return BigInteger.ZERO;
        }
        return base.pow(exponent.intValueExact());
    }

    /** Truncated subtraction over the naturals. */
    public static BigInteger monus(BigInteger minuend, BigInteger subtrahend) {
        BigInteger difference = minuend.subtract(subtrahend);
        return difference.signum() < 0 ? BigInteger.ZERO : difference;
    }

    /**
     * Returns {@code k} with {@code base^k == value} or {@code null} if there is no such natural.
     * The {@code base} must be at least two.
     */
    @Nullable
    public static BigInteger exactLog(BigInteger base, BigInteger value) {
        assert base.compareTo(BigInteger.TWO) >= 0;
        if (value.signum() <= 0) {
            return null;
        }
        BigInteger remaining = value;
        int exponent = 0;
        while (!remaining.equals(BigInteger.ONE)) {
            BigInteger[] division = remaining.divideAndRemainder(base);
            if (division[1].signum() != 0) {
                return null;
            }
            remaining = division[0];
            exponent += 1;
        }
        return BigInteger.valueOf(exponent);
    }

    /**
     * Returns {@code r} with {@code r^degree == value} or {@code null} if there is no such natural.
     */
    @Nullable
    public static BigInteger exactRoot(BigInteger value, BigInteger degree) {
        assert degree.signum() > 0;
        checkNatural(value);
        if (value.compareTo(BigInteger.ONE) <= 0 || degree.equals(BigInteger.ONE)) {
            return value;
        }
        if (degree.bitLength() > 31) {
            // Any base of at least two exceeds every representable value
            return null;
        }
        int exponent = degree.intValue();
        BigInteger low = BigInteger.ONE;
        BigInteger high = BigInteger.ONE.shiftLeft(value.bitLength() / exponent + 1);
        while (low.compareTo(high) <= 0) {
            BigInteger middle = low.add(high).shiftRight(1);
            int comparison = middle.pow(exponent).compareTo(value);
            if (comparison == 0) {
                return middle;
            }
            if (comparison < 0) {
                low = middle.add(BigInteger.ONE);
            } else {
                high = middle.subtract(BigInteger.ONE);
            }
        }
        return null;
    }
}
