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

import com.github.tinemuz.celestial.error.MissingRequiredFieldException;
import com.github.tinemuz.celestial.error.RangeValidationException;
import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.physics.AngularCorrection;
import com.github.tinemuz.celestial.physics.AnnualAberration;
import com.github.tinemuz.celestial.physics.EarthHeliocentricPosition;
import com.github.tinemuz.celestial.physics.Fk5Correction;
import com.github.tinemuz.celestial.physics.GravitationalDeflection;
import com.github.tinemuz.celestial.physics.Nutation;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.Precession;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.time.Epoch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.function.BiFunction;

/**
 * Ecliptic longitude and latitude referred to the ecliptic and equinox of an epoch,
 * centred on the Earth or on the Sun.
 *
 * <p>Nutation on the ecliptic is a single turn about the ecliptic pole by the nutation in
 * longitude. Precession is carried out on the equator: the position is tilted onto the
 * mean equator of its epoch, precessed like an equatorial position and tilted back with
 * the obliquity of the new epoch. Aberration, deflection and the FK5 correction are
 * geocentric effects and are always computed on the geocentric position.</p>
 */
public final class EclipticFrame extends CommonFrame {
    private static final Logger log = LoggerFactory.getLogger(EclipticFrame.class);

    private Epoch epoch;
    private final PrecessionModel precessionModel;
    private final NutationModel nutationModel;
    private EclipticCenter center;

    private boolean withNutation;
    private boolean withAnnualAberration;
    private boolean withGravitationalDeflection;
    private boolean onFk5;
    private final EnumSet<Correction> enabled;

    private AngularCorrection fk5Applied;
    private AngularCorrection aberrationApplied;
    private AngularCorrection deflectionApplied;

    private EclipticFrame(Builder b, SphericalPosition position) {
        super(position, b.continuous);
        this.epoch = b.epoch;
        this.precessionModel = b.precessionModel != null ? b.precessionModel : FrameDefaults.precessionModel();
        this.nutationModel = b.nutationModel != null ? b.nutationModel : FrameDefaults.nutationModel();
        this.center = b.center;
        this.withNutation = b.withNutation;
        this.withAnnualAberration = b.withAnnualAberration;
        this.withGravitationalDeflection = b.withGravitationalDeflection;
        this.onFk5 = b.onFk5;
        this.enabled = EnumSet.copyOf(b.enabled);
    }

    private EclipticFrame(EclipticFrame other) {
        super(other.position(), other.isContinuous());
        copyPositionFrom(other);
        this.epoch = other.epoch;
        this.precessionModel = other.precessionModel;
        this.nutationModel = other.nutationModel;
        this.center = other.center;
        this.withNutation = other.withNutation;
        this.withAnnualAberration = other.withAnnualAberration;
        this.withGravitationalDeflection = other.withGravitationalDeflection;
        this.onFk5 = other.onFk5;
        this.enabled = EnumSet.copyOf(other.enabled);
        this.fk5Applied = other.fk5Applied;
        this.aberrationApplied = other.aberrationApplied;
        this.deflectionApplied = other.deflectionApplied;
    }

    public static Builder builder() {
        return new Builder();
    }

    public EclipticFrame copy() {
        return new EclipticFrame(this);
    }

    @Override
    public FrameCode code() {
        return FrameCode.ECLIPTIC;
    }

    public Epoch epoch() {
        return epoch;
    }

    public PrecessionModel precessionModel() {
        return precessionModel;
    }

    public NutationModel nutationModel() {
        return nutationModel;
    }

    public EclipticCenter center() {
        return center;
    }

    public boolean isWithNutation() {
        return withNutation;
    }

    public boolean isWithAnnualAberration() {
        return withAnnualAberration;
    }

    public boolean isWithGravitationalDeflection() {
        return withGravitationalDeflection;
    }

    public boolean isOnFk5() {
        return onFk5;
    }

    /** Whether the apply and remove verbs of {@code correction} rotate the position. */
    public boolean isEnabled(Correction correction) {
        return enabled.contains(correction);
    }

    /** Disabling keeps the current flag as a label; later verbs leave it and the position alone. */
    public void setEnabled(Correction correction, boolean value) {
        MissingRequiredFieldException.require("correction", correction);
        if (value) enabled.add(correction);
        else enabled.remove(correction);
    }

    EnumSet<Correction> enabledCorrections() {
        return EnumSet.copyOf(enabled);
    }

    /** Obliquity relating this position to the equator: mean, plus delta-epsilon under nutation. */
    public double obliquity() {
        double eps = Angles.arcsecondsToRadians(Precession.meanObliquity(epoch, precessionModel));
        if (withNutation) {
            eps += Angles.milliarcsecondsToRadians(Nutation.at(epoch, nutationModel).obliquity());
        }
        return eps;
    }

    /**
     * Move to geocentric, apply epoch and corrections in the order epoch, FK5, annual
     * aberration, gravitational deflection, nutation, then settle on the requested
     * center (the current one when none is given).
     */
    public EclipticFrame retarget(RetargetOptions options) {
        if (options == null) return this;
        EclipticCenter target = options.eclipticCenter() != null ? options.eclipticCenter() : center;
        toGeocentric();
        if (options.epoch() != null) retargetEpoch(options.epoch());
        if (options.onFk5() != null) {
            if (options.onFk5()) applyFk5();
            else removeFk5();
        }
        if (options.withAnnualAberration() != null) {
            if (options.withAnnualAberration()) applyAnnualAberration();
            else removeAnnualAberration();
        }
        if (options.withGravitationalDeflection() != null) {
            if (options.withGravitationalDeflection()) applyGravitationalDeflection();
            else removeGravitationalDeflection();
        }
        if (options.withNutation() != null) {
            if (options.withNutation()) applyNutation();
            else removeNutation();
        }
        if (target == EclipticCenter.HELIOCENTRIC) toHeliocentric();
        return this;
    }

    /** Precess to {@code target}, keeping flags and center. */
    public EclipticFrame retargetEpoch(Epoch target) {
        MissingRequiredFieldException.require("epoch", target);
        if (target.equals(epoch)) return this;
        EclipticCenter originalCenter = center;
        boolean nutation = withNutation;
        boolean deflection = withGravitationalDeflection;
        boolean aberration = withAnnualAberration;
        boolean fk5 = onFk5;

        toGeocentric();
        removeNutation();
        removeGravitationalDeflection();
        removeAnnualAberration();
        removeFk5();

        SphericalPosition p = working();
        if (!epoch.isJ2000()) {
            Precession old = Precession.at(epoch, precessionModel);
            p = EquinoctialFrame.precessToJ2000(toEquatorial(p, Angles.arcsecondsToRadians(old.epsilon())), old);
            p = fromEquatorial(p, Angles.arcsecondsToRadians(old.epsilon0()));
        }
        if (!target.isJ2000()) {
            Precession next = Precession.at(target, precessionModel);
            p = EquinoctialFrame.precessFromJ2000(toEquatorial(p, Angles.arcsecondsToRadians(next.epsilon0())), next);
            p = fromEquatorial(p, Angles.arcsecondsToRadians(next.epsilon()));
        }
        changePosition(p);
        log.debug("Ecliptic position moved from {} to {}", epoch, target);
        epoch = target;

        if (fk5) applyFk5();
        if (aberration) applyAnnualAberration();
        if (deflection) applyGravitationalDeflection();
        if (nutation) applyNutation();
        if (originalCenter == EclipticCenter.HELIOCENTRIC) toHeliocentric();
        return this;
    }

    public EclipticFrame applyNutation() {
        if (withNutation || !isEnabled(Correction.NUTATION)) return this;
        changePosition(working().rotateZ(nutationInLongitude()));
        withNutation = true;
        return this;
    }

    public EclipticFrame removeNutation() {
        if (!withNutation || !isEnabled(Correction.NUTATION)) return this;
        changePosition(working().rotateZ(-nutationInLongitude()));
        withNutation = false;
        return this;
    }

    public EclipticFrame applyFk5() {
        if (onFk5 || !isEnabled(Correction.FK5)) return this;
        fk5Applied = applyCorrection(Fk5Correction::ecliptic);
        onFk5 = true;
        return this;
    }

    public EclipticFrame removeFk5() {
        if (!onFk5 || !isEnabled(Correction.FK5)) return this;
        removeCorrection(fk5Applied, Fk5Correction::ecliptic);
        fk5Applied = null;
        onFk5 = false;
        return this;
    }

    public EclipticFrame applyAnnualAberration() {
        if (withAnnualAberration || !isEnabled(Correction.ANNUAL_ABERRATION)) return this;
        aberrationApplied = applyCorrection(AnnualAberration::ecliptic);
        withAnnualAberration = true;
        return this;
    }

    public EclipticFrame removeAnnualAberration() {
        if (!withAnnualAberration || !isEnabled(Correction.ANNUAL_ABERRATION)) return this;
        removeCorrection(aberrationApplied, AnnualAberration::ecliptic);
        aberrationApplied = null;
        withAnnualAberration = false;
        return this;
    }

    public EclipticFrame applyGravitationalDeflection() {
        if (withGravitationalDeflection || !isEnabled(Correction.GRAVITATIONAL_DEFLECTION)) return this;
        deflectionApplied = applyCorrection(GravitationalDeflection::ecliptic);
        withGravitationalDeflection = true;
        return this;
    }

    public EclipticFrame removeGravitationalDeflection() {
        if (!withGravitationalDeflection || !isEnabled(Correction.GRAVITATIONAL_DEFLECTION)) return this;
        removeCorrection(deflectionApplied, GravitationalDeflection::ecliptic);
        deflectionApplied = null;
        withGravitationalDeflection = false;
        return this;
    }

    /** Translate a heliocentric position to the centre of the Earth. */
    public EclipticFrame toGeocentric() {
        if (center == EclipticCenter.GEOCENTRIC) return this;
        changePosition(translatedByEarth(-1.0));
        center = EclipticCenter.GEOCENTRIC;
        log.debug("Ecliptic position moved to geocentric at {}", epoch);
        return this;
    }

    /**
     * Translate a geocentric position to the centre of the Sun.
     *
     * @throws RangeValidationException when the position is the Sun itself, so that the
     *         heliocentric radius would fall below {@link #MIN_RADIUS}; the frame is unchanged
     */
    public EclipticFrame toHeliocentric() {
        if (center == EclipticCenter.HELIOCENTRIC) return this;
        changePosition(translatedByEarth(1.0));
        center = EclipticCenter.HELIOCENTRIC;
        log.debug("Ecliptic position moved to heliocentric at {}", epoch);
        return this;
    }

    public EclipticFrame snapshot(RetargetOptions options) {
        return copy().retarget(options);
    }

    @Override
    public EquinoctialFrame toEquinoctial() {
        return FrameSwitcher.adopt(this).hub();
    }

    @Override
    public EclipticFrame toEcliptic(RetargetOptions options) {
        return snapshot(options);
    }

    @Override
    public GalacticFrame toGalactic(RetargetOptions options) {
        return FrameSwitcher.adopt(this).toGalactic(options);
    }

    @Override
    public HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options) {
        return FrameSwitcher.adopt(this).toHorizontal(condition, options);
    }

    @Override
    public HourAngleFrame toHourAngle(ObservingCondition condition) {
        return FrameSwitcher.adopt(this).toHourAngle(condition);
    }

    @Override
    protected String longitudeParameter() {
        return "longitude";
    }

    @Override
    protected String latitudeParameter() {
        return "latitude";
    }

    @Override
    protected void positionReplaced() {
        fk5Applied = null;
        aberrationApplied = null;
        deflectionApplied = null;
    }

    /** Equatorial position to the ecliptic tilted by {@code obliquity} radians. */
    static SphericalPosition fromEquatorial(SphericalPosition p, double obliquity) {
        return p.rotateX(-obliquity);
    }

    static SphericalPosition toEquatorial(SphericalPosition p, double obliquity) {
        return p.rotateX(obliquity);
    }

    private double nutationInLongitude() {
        return Angles.milliarcsecondsToRadians(Nutation.at(epoch, nutationModel).longitude());
    }

    // Earth seen from the Sun, in the axes of the stored position
    private double[] earthVector() {
        SphericalPosition earth = EarthHeliocentricPosition.at(epoch).position();
        if (withNutation) {
            earth = earth.rotateZ(nutationInLongitude());
        }
        return earth.toCartesian();
    }

    private SphericalPosition translatedByEarth(double sign) {
        double[] earth = earthVector();
        SphericalPosition moved = working().translate(sign * earth[0], sign * earth[1], sign * earth[2]);
        if (moved.r() < MIN_RADIUS) {
            throw new RangeValidationException("radius",
                    "The param radius should be in [" + MIN_RADIUS + ", +inf) after the change of center, got "
                            + moved.r());
        }
        return moved;
    }

    private AngularCorrection applyCorrection(BiFunction<SphericalPosition, Epoch, AngularCorrection> provider) {
        EclipticCenter original = center;
        toGeocentric();
        SphericalPosition p = working();
        AngularCorrection correction = provider.apply(p, epoch);
        changePosition(correction.applyTo(p));
        if (original == EclipticCenter.HELIOCENTRIC) toHeliocentric();
        return correction;
    }

    private void removeCorrection(AngularCorrection applied,
                                  BiFunction<SphericalPosition, Epoch, AngularCorrection> provider) {
        EclipticCenter original = center;
        toGeocentric();
        SphericalPosition p = working();
        AngularCorrection correction = applied != null
                ? applied
                : AngularCorrection.recover(p, q -> provider.apply(q, epoch));
        changePosition(correction.removeFrom(p));
        if (original == EclipticCenter.HELIOCENTRIC) toHeliocentric();
    }

    /** Builder for {@link EclipticFrame}. */
    public static final class Builder {
        private SphericalPosition position;
        private Double longitude;
        private double latitude = 0.0;
        private double radius = 1.0;
        private Epoch epoch = Epoch.j2000();
        private EclipticCenter center = EclipticCenter.GEOCENTRIC;
        private boolean withNutation;
        private boolean withAnnualAberration;
        private boolean withGravitationalDeflection;
        private boolean onFk5;
        private final EnumSet<Correction> enabled = EnumSet.allOf(Correction.class);
        private PrecessionModel precessionModel;
        private NutationModel nutationModel;
        private boolean continuous;

        private Builder() {}

        public Builder position(SphericalPosition position) {
            this.position = position;
            return this;
        }

        public Builder longitude(double degrees) {
            this.longitude = degrees;
            return this;
        }

        public Builder latitude(double degrees) {
            this.latitude = degrees;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        public Builder epoch(Epoch epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder center(EclipticCenter center) {
            this.center = center;
            return this;
        }

        public Builder center(String name) {
            this.center = EclipticCenter.fromName(name);
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

        /** Corrections are enabled unless switched off here. */
        public Builder enable(Correction correction, boolean value) {
            MissingRequiredFieldException.require("correction", correction);
            if (value) enabled.add(correction);
            else enabled.remove(correction);
            return this;
        }

        Builder enabled(EnumSet<Correction> corrections) {
            enabled.clear();
            enabled.addAll(corrections);
            return this;
        }

        public Builder precessionModel(PrecessionModel model) {
            this.precessionModel = model;
            return this;
        }

        public Builder precessionModel(String name) {
            this.precessionModel = PrecessionModel.fromName(name);
            return this;
        }

        public Builder nutationModel(NutationModel model) {
            this.nutationModel = model;
            return this;
        }

        public Builder nutationModel(String name) {
            this.nutationModel = NutationModel.fromName(name);
            return this;
        }

        public Builder continuous(boolean continuous) {
            this.continuous = continuous;
            return this;
        }

        public EclipticFrame build() {
            MissingRequiredFieldException.require("epoch", epoch);
            MissingRequiredFieldException.require("center", center);
            SphericalPosition p = resolve(position, longitude, latitude, radius,
                    RangePolicy.STRICT, "longitude", "latitude");
            return new EclipticFrame(this, p);
        }
    }
}
