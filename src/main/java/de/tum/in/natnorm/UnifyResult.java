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
import java.util.List;
import java.util.Objects;

/**
 * Outcome of unifying two normal forms.
 *
 * <ul>
 *   <li>{@link Kind#WIN}: both sides are identical.</li>
 *   <li>{@link Kind#LOSE}: no assignment of natural numbers to the variables can make both sides
 *   equal.</li>
 *   <li>{@link Kind#DRAW}: undecided for now; the result may carry bindings which make progress.
 *   A draw without bindings means that the equation has to wait for other equations.</li>
 * </ul>
 *
 * @param <H> The type of equation handles.
 */
public final class UnifyResult<H> {
    @SuppressWarnings("rawtypes")
    private static final UnifyResult WIN = new UnifyResult<>(Kind.WIN, ImmutableList.of());
    @SuppressWarnings("rawtypes")
    private static final UnifyResult LOSE = new UnifyResult<>(Kind.LOSE, ImmutableList.of());
    @SuppressWarnings("rawtypes")
    private static final UnifyResult STUCK = new UnifyResult<>(Kind.DRAW, ImmutableList.of());

    private final Kind kind;
    private final ImmutableList<SubstItem<H>> bindings;

    private UnifyResult(Kind kind, List<SubstItem<H>> bindings) {
        this.kind = kind;
        this.bindings = ImmutableList.copyOf(bindings);
    }

    @SuppressWarnings("unchecked")
    public static <H> UnifyResult<H> win() {
        return (UnifyResult<H>) WIN;
    }

    @SuppressWarnings("unchecked")
    public static <H> UnifyResult<H> lose() {
        return (UnifyResult<H>) LOSE;
    }

    @SuppressWarnings("unchecked")
    public static <H> UnifyResult<H> draw(List<SubstItem<H>> bindings) {
        return bindings.isEmpty() ? (UnifyResult<H>) STUCK : new UnifyResult<>(Kind.DRAW, bindings);
    }

    public static <H> UnifyResult<H> draw(SubstItem<H> binding) {
        return new UnifyResult<>(Kind.DRAW, ImmutableList.of(binding));
    }

    public static <H> UnifyResult<H> stuck() {
        return draw(ImmutableList.of());
    }

    public Kind kind() {
        return kind;
    }

    public List<SubstItem<H>> bindings() {
        return bindings;
    }

    /**
     * Whether this result is a draw which carries new bindings.
     */
    public boolean isProgress() {
        return kind == Kind.DRAW && !bindings.isEmpty();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof UnifyResult)) {
            return false;
        }
        UnifyResult<?> that = (UnifyResult<?>) object;
        return kind == that.kind && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bindings);
    }

    @Override
    public String toString() {
        return kind == Kind.DRAW ? "DRAW" + bindings : kind.toString();
    }

    public enum Kind {
        WIN, LOSE, DRAW
    }
}
