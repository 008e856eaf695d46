/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.celestial;

import com.github.tinemuz.celestial.time.Epoch;

/**
 * Optional targets for {@code retarget}, {@code snapshot} and
 * {@link FrameSwitcher#convertTo(FrameCode, RetargetOptions)}.
 *
 * <p>Every getter returns {@code null} when the field was not set; an absent field keeps
 * the receiver's current state. Fields that do not apply to a frame kind are ignored.</p>
 */
public final class RetargetOptions {

    private static final RetargetOptions NONE = new Builder().build();

    private final Epoch epoch;
    private final Boolean withNutation;
    private final Boolean withAnnualAberration;
    private final Boolean withGravitationalDeflection;
    private final Boolean onFk5;
    private final EclipticCenter eclipticCenter;
    private final HorizontalCenter horizontalCenter;
    private final Boolean withRefraction;
    private final ObservingCondition observingCondition;

    private RetargetOptions(Builder b) {
        this.epoch = b.epoch;
        this.withNutation = b.withNutation;
        this.withAnnualAberration = b.withAnnualAberration;
        this.withGravitationalDeflection = b.withGravitationalDeflection;
        this.onFk5 = b.onFk5;
        this.eclipticCenter = b.eclipticCenter;
        this.horizontalCenter = b.horizontalCenter;
        this.withRefraction = b.withRefraction;
        this.observingCondition = b.observingCondition;
    }

    /** Options with no field set. */
    public static RetargetOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this value's fields. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.epoch = epoch;
        b.withNutation = withNutation;
        b.withAnnualAberration = withAnnualAberration;
        b.withGravitationalDeflection = withGravitationalDeflection;
        b.onFk5 = onFk5;
        b.eclipticCenter = eclipticCenter;
        b.horizontalCenter = horizontalCenter;
        b.withRefraction = withRefraction;
        b.observingCondition = observingCondition;
        return b;
    }

    public Epoch epoch() {
        return epoch;
    }

    public Boolean withNutation() {
        return withNutation;
    }

    public Boolean withAnnualAberration() {
        return withAnnualAberration;
    }

    public Boolean withGravitationalDeflection() {
        return withGravitationalDeflection;
    }

    public Boolean onFk5() {
        return onFk5;
    }

    public EclipticCenter eclipticCenter() {
        return eclipticCenter;
    }

    public HorizontalCenter horizontalCenter() {
        return horizontalCenter;
    }

    public Boolean withRefraction() {
        return withRefraction;
    }

    public ObservingCondition observingCondition() {
        return observingCondition;
    }

    /** Builder for {@link RetargetOptions}. */
    public static final class Builder {
        private Epoch epoch;
        private Boolean withNutation;
        private Boolean withAnnualAberration;
        private Boolean withGravitationalDeflection;
        private Boolean onFk5;
        private EclipticCenter eclipticCenter;
        private HorizontalCenter horizontalCenter;
        private Boolean withRefraction;
        private ObservingCondition observingCondition;

        private Builder() {}

        public Builder epoch(Epoch epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder withNutation(boolean value) {
            this.withNutation = value;
            return this;
        }

        public Builder withAnnualAberration(boolean value) {
            this.withAnnualAberration = value;
            return this;
        }

        public Builder withGravitationalDeflection(boolean value) {
            this.withGravitationalDeflection = value;
            return this;
        }

        public Builder onFk5(boolean value) {
            this.onFk5 = value;
            return this;
        }

        /** Shorthand that sets all four equatorial corrections at once. */
        public Builder apparentPlace(boolean value) {
            return withNutation(value).withAnnualAberration(value).withGravitationalDeflection(value).onFk5(value);
        }

        public Builder eclipticCenter(EclipticCenter center) {
            this.eclipticCenter = center;
            return this;
        }

        public Builder horizontalCenter(HorizontalCenter center) {
            this.horizontalCenter = center;
            return this;
        }

        public Builder withRefraction(boolean value) {
            this.withRefraction = value;
            return this;
        }

        public Builder observingCondition(ObservingCondition condition) {
            this.observingCondition = condition;
            return this;
        }

        public RetargetOptions build() {
            return new RetargetOptions(this);
        }
    }
}
