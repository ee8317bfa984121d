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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates random terms for property based tests. Generation only depends on the seed, so test runs
 * are reproducible.
 */
public final class TermGenerator {
    private static final Logger logger = Logger.getLogger(TermGenerator.class.getName());
    private static final int MAX_CONSTANT = 4;

    private final Random random;
    private final List<Variable> variables;

    public TermGenerator(long seed, List<Variable> variables) {
        this.random = new Random(seed);
        this.variables = ImmutableList.copyOf(variables);
    }

    public static List<Term> generate(long seed, List<Variable> variables, int count, int depth) {
        logger.log(Level.FINE, "Generating {0} terms of depth {1} over {2}",
                new Object[] {count, depth, variables});
        TermGenerator generator = new TermGenerator(seed, variables);
        Set<Term> terms = new LinkedHashSet<>();
        int attempts = 0;
        while (terms.size() < count && attempts < count * 10) {
            terms.add(generator.term(depth));
            attempts += 1;
        }
        return new ArrayList<>(terms);
    }

    public Term term(int depth) {
        if (depth <= 1 || random.nextInt(5) == 0) {
            return leaf();
        }
        Term left = term(depth - 1);
        switch (random.nextInt(5)) {
            case 0:
            case 1:
                return Term.add(left, term(depth - 1));
            case 2:
                return Term.multiply(left, term(depth - 1));
            case 3:
                return Term.subtract(left, term(depth - 1));
            default:
                // Keep exponents small, otherwise evaluation explodes
                return Term.power(term(Math.min(depth - 1, 2)), exponent());
        }
    }

    private Term leaf() {
        return random.nextBoolean()
                ? Term.constant(random.nextInt(MAX_CONSTANT + 1))
                : Term.variable(variables.get(random.nextInt(variables.size())));
    }

    private Term exponent() {
        switch (random.nextInt(4)) {
            case 0:
                return Term.constant(random.nextInt(4));
            case 1:
                return Term.variable(variables.get(random.nextInt(variables.size())));
            case 2:
                return Term.add(Term.variable(variables.get(random.nextInt(variables.size()))),
                        Term.constant(1 + random.nextInt(2)));
            default:
                return Term.multiply(Term.constant(2), Term.variable(variables.get(random.nextInt(variables.size()))));
        }
    }
}
