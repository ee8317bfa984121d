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
import javax.annotation.Nullable;

/**
 * A single binding {@code variable := replacement}, together with the origin and handle of the
 * equation it was derived from. A binding is <em>sufficient</em> if it implies its equation without
 * being implied by it; such a binding is a choice and not a consequence of the equation.
 *
 * @param <H> The type of equation handles.
 */
public final class SubstItem<H> {
    private final Variable variable;
    private final Sop replacement;
    private final Origin origin;
    private final H handle;
    private final boolean sufficient;

    private SubstItem(Variable variable, Sop replacement, Origin origin, H handle, boolean sufficient) {
        this.variable = variable;
        this.replacement = replacement;
        this.origin = origin;
        this.handle = handle;
        this.sufficient = sufficient;
    }

    /**
     * Creates the binding {@code variable := replacement}, unless the replacement contains the
     * variable itself (occurs check), in which case {@code null} is returned.
     */
    @Nullable
    public static <H> SubstItem<H> bind(Variable variable, Sop replacement, Origin origin, H handle) {
        if (replacement.contains(variable)) {
            return null;
        }
        return new SubstItem<>(Objects.requireNonNull(variable), replacement, Objects.requireNonNull(origin),
                Objects.requireNonNull(handle), false);
    }

    public Variable variable() {
        return variable;
    }

    public Sop replacement() {
        return replacement;
    }

    public Origin origin() {
        return origin;
    }

    public H handle() {
        return handle;
    }

    public boolean isSufficient() {
        return sufficient;
    }

    SubstItem<H> asSufficient() {
        return sufficient ? this : new SubstItem<>(variable, replacement, origin, handle, true);
    }

    SubstItem<H> withReplacement(Sop newReplacement) {
        if (newReplacement.equals(replacement)) {
            return this;
        }
        Util.checkState(!newReplacement.contains(variable), "Cyclic binding %s := %s", variable, newReplacement);
        return new SubstItem<>(variable, newReplacement, origin, handle, sufficient);
    }

    /**
     * Reifies this binding as the equation {@code variable == replacement}, e.g. to be handed back to
     * a host solver as a new constraint.
     */
    public Equation<H> toEquation() {
        return new Equation<>(handle, origin, Sop.of(variable), replacement);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof SubstItem)) {
            return false;
        }
        SubstItem<?> that = (SubstItem<?>) object;
        return variable.equals(that.variable)
                && replacement.equals(that.replacement)
                && origin == that.origin
                && handle.equals(that.handle)
                && sufficient == that.sufficient;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, replacement, origin, handle, sufficient);
    }

    @Override
    public String toString() {
        return variable + (sufficient ? " :=? " : " := ") + replacement;
    }
}
