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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Allocates {@link Variable}s. The implementation guarantees that variables are allocated
 * sequentially starting from 0, i.e. {@code create(name).id() == numberOfVariables() - 1}. Since
 * the canonical form of an expression orders variables by their identity, building the same
 * expressions in the same order always yields the same normal forms.
 */
public final class Variables {
    private final List<Variable> variables = new ArrayList<>();
    private final Map<String, Variable> byName = new HashMap<>();

    /**
     * Creates a new variable. If a variable with the same name already exists, the new one is
     * distinct from it and subsequently returned by {@link #get(String)}.
     */
    public Variable create(String name) {
        Variable variable = new Variable(variables.size(), name);
        variables.add(variable);
        byName.put(name, variable);
        return variable;
    }

    /**
     * Returns the (most recently created) variable with the given name, creating it if necessary.
     */
    public Variable get(String name) {
        Variable variable = byName.get(name);
        return variable == null ? create(name) : variable;
    }

    @Nullable
    public Variable lookup(String name) {
        return byName.get(name);
    }

    public int numberOfVariables() {
        return variables.size();
    }

    @Override
    public String toString() {
        return "Variables" + variables;
    }
}
