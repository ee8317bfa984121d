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

import java.util.Objects;

/**
 * An equation between two normal forms. The handle is an opaque reference to the caller's original
 * constraint; it is only used for reporting and never inspected.
 *
 * @param <H> The type of the handle.
 */
public final class Equation<H> {
    private final H handle;
    private final Origin origin;
    private final Sop lhs;
    private final Sop rhs;

    public Equation(H handle, Origin origin, Sop lhs, Sop rhs) {
        this.handle = Objects.requireNonNull(handle);
        this.origin = Objects.requireNonNull(origin);
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    public static <H> Equation<H> of(H handle, Origin origin, Term lhs, Term rhs) {
        return new Equation<>(handle, origin, Normalizer.normalize(lhs), Normalizer.normalize(rhs));
    }

    public static <H> Equation<H> given(H handle, Term lhs, Term rhs) {
        return of(handle, Origin.GIVEN, lhs, rhs);
    }

    public static <H> Equation<H> wanted(H handle, Term lhs, Term rhs) {
        return of(handle, Origin.WANTED, lhs, rhs);
    }

    public H handle() {
        return handle;
    }

    public Origin origin() {
        return origin;
    }

    public boolean isWanted() {
        return origin == Origin.WANTED;
    }

    public Sop lhs() {
        return lhs;
    }

    public Sop rhs() {
        return rhs;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Equation)) {
            return false;
        }
        Equation<?> that = (Equation<?>) object;
        return handle.equals(that.handle) && origin == that.origin && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle, origin, lhs, rhs);
    }

    @Override
    public String toString() {
        return String.format("%s[%s]: %s == %s", origin, handle, lhs, rhs);
    }
}
