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
 * A free variable ranging over the natural numbers. Variables are identified by their {@link #id()},
 * which is allocated sequentially by a {@link Variables} pool; the name only serves as a label.
 */
public final class Variable extends Atom {
    private final int id;
    private final String name;

    Variable(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    @Override
    int kind() {
        return VARIABLE;
    }

    @Override
    int compareSameKind(Atom other) {
        return Integer.compare(id, ((Variable) other).id);
    }

    @Override
    public BigInteger evaluate(Map<Variable, BigInteger> assignment) {
        BigInteger value = assignment.get(this);
        if (value == null) {
            throw new IllegalArgumentException("No value assigned to " + name);
        }
        return Util.checkNatural(value);
    }

    @Override
    void collectVariables(Set<Variable> variables) {
        variables.add(this);
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public Term toTerm() {
        return Term.variable(this);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Variable)) {
            return false;
        }
        return id == ((Variable) object).id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name;
    }
}
