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
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * An ordered, immutable sequence of {@link SubstItem bindings}. No variable is bound twice and no
 * replacement mentions a bound variable, so applying a substitution once already yields a fixed
 * point.
 *
 * @param <H> The type of equation handles.
 */
public final class Substitution<H> implements Iterable<SubstItem<H>> {
    @SuppressWarnings("rawtypes")
    private static final Substitution EMPTY = new Substitution<>(ImmutableList.of());

    private final ImmutableList<SubstItem<H>> items;
    private final ImmutableMap<Variable, SubstItem<H>> index;

    private Substitution(List<SubstItem<H>> items) {
        this.items = ImmutableList.copyOf(items);
        ImmutableMap.Builder<Variable, SubstItem<H>> builder = ImmutableMap.builderWithExpectedSize(items.size());
        for (SubstItem<H> item : items) {
            builder.put(item.variable(), item);
        }
        // Throws on duplicate keys
        this.index = builder.buildOrThrow();
        assert isIdempotent() : "Not idempotent: " + items;
    }

    @SuppressWarnings("unchecked")
    public static <H> Substitution<H> empty() {
        return (Substitution<H>) EMPTY;
    }

    public static <H> Substitution<H> of(List<SubstItem<H>> items) {
        return items.isEmpty() ? empty() : new Substitution<>(items);
    }

    /**
     * Composes two substitutions: {@code newer} is applied to every replacement of {@code older},
     * then the bindings of {@code newer} are appended. The variables bound by {@code newer} must
     * not be bound by {@code older} and its replacements must not contain variables bound by
     * {@code older}.
     */
    public static <H> Substitution<H> compose(Substitution<H> newer, Substitution<H> older) {
        if (newer.isEmpty()) {
            return older;
        }
        if (older.isEmpty()) {
            return newer;
        }
        ImmutableList.Builder<SubstItem<H>> composed =
                ImmutableList.builderWithExpectedSize(older.size() + newer.size());
        for (SubstItem<H> item : older.items) {
            composed.add(item.withReplacement(newer.apply(item.replacement())));
        }
        composed.addAll(newer.items);
        return new Substitution<>(composed.build());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public List<SubstItem<H>> items() {
        return items;
    }

    public Set<Variable> boundVariables() {
        return index.keySet();
    }

    @Nullable
    public Sop lookup(Variable variable) {
        SubstItem<H> item = index.get(variable);
        return item == null ? null : item.replacement();
    }

    /**
     * Returns the bindings derived from equations of the given origin.
     */
    public Substitution<H> restrictTo(Origin origin) {
        ImmutableList.Builder<SubstItem<H>> restricted = ImmutableList.builder();
        for (SubstItem<H> item : items) {
            if (item.origin() == origin) {
                restricted.add(item);
            }
        }
        ImmutableList<SubstItem<H>> list = restricted.build();
        return list.size() == items.size() ? this : of(list);
    }

    /**
     * Replaces every bound variable of the given expression, including those inside exponents,
     * residuals and compound bases, and normalizes the result again.
     */
    public Sop apply(Sop sop) {
        if (items.isEmpty() || Collections.disjoint(sop.variables(), index.keySet())) {
            return sop;
        }
        Sop result = Sop.ZERO;
        for (Product product : sop.products()) {
            result = Normalizer.add(result, apply(product));
        }
        return result;
    }

    private Sop apply(Product product) {
        Sop result = Sop.constant(product.coefficient());
        for (Factor factor : product.factors()) {
            Sop base = apply(factor.base());
            Sop exponent = apply(Sop.of(factor.exponent()));
            result = Normalizer.multiply(result, Normalizer.power(base, exponent));
        }
        return result;
    }

    private Sop apply(Atom atom) {
        if (atom instanceof Variable) {
            Sop replacement = lookup((Variable) atom);
            return replacement == null ? Sop.of(atom) : replacement;
        }
        if (atom instanceof Residual) {
            Residual residual = (Residual) atom;
            return Normalizer.subtract(apply(residual.minuend()), apply(residual.subtrahend()));
        }
        if (atom instanceof Compound) {
            return apply(((Compound) atom).base());
        }
        throw new IllegalArgumentException("Unknown type " + atom.getClass().getSimpleName());
    }

    private boolean isIdempotent() {
        for (SubstItem<H> item : items) {
            if (!Collections.disjoint(item.replacement().variables(), index.keySet())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<SubstItem<H>> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object object) {
        return this == object || (object instanceof Substitution && items.equals(((Substitution<?>) object).items));
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
