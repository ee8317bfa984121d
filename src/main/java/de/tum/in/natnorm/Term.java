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
import java.util.TreeSet;

/**
 * An arithmetic expression over the natural numbers, built from constants, variables and the
 * operators {@code +}, {@code -}, {@code *} and {@code ^}. Subtraction is truncated at zero.
 */
public abstract class Term {
    Term() {
        // Closed hierarchy
    }

    public static Term constant(BigInteger value) {
        return new Constant(value);
    }

    public static Term constant(long value) {
        return new Constant(BigInteger.valueOf(value));
    }

    public static Term variable(Variable variable) {
        return new Var(variable);
    }

    public static Term add(Term left, Term right) {
        return new Binary(Operator.ADD, left, right);
    }

    public static Term subtract(Term left, Term right) {
        return new Binary(Operator.SUBTRACT, left, right);
    }

    public static Term multiply(Term left, Term right) {
        return new Binary(Operator.MULTIPLY, left, right);
    }

    public static Term power(Term base, Term exponent) {
        return new Binary(Operator.POWER, base, exponent);
    }

    public abstract BigInteger evaluate(Map<Variable, BigInteger> assignment);

    public Set<Variable> variables() {
        Set<Variable> variables = new TreeSet<>();
        gatherVariables(variables);
        return variables;
    }

    abstract void gatherVariables(Set<Variable> variables);

    abstract void appendTo(StringBuilder builder, int precedence);

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder, 0);
        return builder.toString();
    }

    public enum Operator {
        ADD("+", 1), SUBTRACT("-", 1), MULTIPLY("*", 2), POWER("^", 3);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }
    }

    public static final class Constant extends Term {
        private final BigInteger value;

        Constant(BigInteger value) {
            this.value = Util.checkNatural(Objects.requireNonNull(value));
        }

        public BigInteger value() {
            return value;
        }

        @Override
        public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
            return value;
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            // No variables
        }

        @Override
        void appendTo(StringBuilder builder, int precedence) {
            builder.append(value);
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Constant && value.equals(((Constant) object).value));
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    public static final class Var extends Term {
        private final Variable variable;

        Var(Variable variable) {
            this.variable = Objects.requireNonNull(variable);
        }

        public Variable variable() {
            return variable;
        }

        @Override
        public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
            return variable.evaluate(assignment);
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            variables.add(variable);
        }

        @Override
        void appendTo(StringBuilder builder, int precedence) {
            builder.append(variable.name());
        }

        @Override
        public boolean equals(Object object) {
            return this == object || (object instanceof Var && variable.equals(((Var) object).variable));
        }

        @Override
        public int hashCode() {
            return variable.hashCode() + 17;
        }
    }

    public static final class Binary extends Term {
        private final Operator operator;
        private final Term left;
        private final Term right;

        Binary(Operator operator, Term left, Term right) {
            this.operator = Objects.requireNonNull(operator);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public Operator operator() {
            return operator;
        }

        public Term left() {
            return left;
        }

        public Term right() {
            return right;
        }

        @Override
        public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
            BigInteger leftValue = left.evaluate(assignment);
            BigInteger rightValue = right.evaluate(assignment);
            switch (operator) {
                case ADD:
                    return leftValue.add(rightValue);
                case SUBTRACT:
                    return Util.monus(leftValue, rightValue);
                case MULTIPLY:
                    return leftValue.multiply(rightValue);
                case POWER:
                    return Util.pow(leftValue, rightValue);
                default:
                    throw new IllegalStateException("Unknown operator " + operator);
            }
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            left.gatherVariables(variables);
            right.gatherVariables(variables);
        }

        @Override
        void appendTo(StringBuilder builder, int precedence) {
            boolean parenthesize = operator.precedence < precedence;
            if (parenthesize) {
                builder.append('(');
            }
            // + and * are left associative, ^ is right associative and - is neither
            boolean rightAssociative = operator == Operator.POWER;
            left.appendTo(builder, rightAssociative ? operator.precedence + 1 : operator.precedence);
            builder.append(operator == Operator.POWER || operator == Operator.MULTIPLY ? "" : " ")
                    .append(operator.symbol)
                    .append(operator == Operator.POWER || operator == Operator.MULTIPLY ? "" : " ");
            right.appendTo(builder, rightAssociative ? operator.precedence : operator.precedence + 1);
            if (parenthesize) {
                builder.append(')');
            }
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Binary)) {
                return false;
            }
            Binary that = (Binary) object;
            return operator == that.operator && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, left, right);
        }
    }
}
