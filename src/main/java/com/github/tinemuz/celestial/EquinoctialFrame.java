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
import com.github.tinemuz.celestial.math.Angles;
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.physics.AngularCorrection;
import com.github.tinemuz.celestial.physics.AnnualAberration;
import com.github.tinemuz.celestial.physics.Fk5Correction;
import com.github.tinemuz.celestial.physics.GravitationalDeflection;
import com.github.tinemuz.celestial.physics.Nutation;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.Precession;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.physics.SiderealTime;
import com.github.tinemuz.celestial.time.Epoch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;

/**
 * Right ascension and declination referred to the equator and equinox of an epoch.
 *
 * <p>This is the hub every other frame converts through. The stored position is the mean
 * place of the epoch, optionally carrying nutation (true place), annual aberration,
 * gravitational light deflection and the FK5 correction. Each correction is tracked by a
 * flag; applying an applied correction, or removing an absent one, does nothing.</p>
 *
 * <p>Corrections other than nutation are computed on the mean place. The exact rotation
 * used to apply them is remembered so the matching removal restores the previous
 * position; when a position arrives already corrected, the removal solves for the
 * correction instead.</p>
 */
public final class EquinoctialFrame extends CommonFrame {
    private static final Logger log = LoggerFactory.getLogger(EquinoctialFrame.class);

    private Epoch epoch;
    private final PrecessionModel precessionModel;
    private final NutationModel nutationModel;

    private boolean withNutation;
    private boolean withAnnualAberration;
    private boolean withGravitationalDeflection;
    private boolean onFk5;
    private final EnumSet<Correction> enabled;

    // exact corrections applied by this frame; null when unknown
    private AngularCorrection fk5Applied;
    private AngularCorrection aberrationApplied;
    private AngularCorrection deflectionApplied;

    private EquinoctialFrame(Builder b, SphericalPosition position) {
        super(position, b.continuous);
        this.epoch = b.epoch;
        this.precessionModel = b.precessionModel != null ? b.precessionModel : FrameDefaults.precessionModel();
        this.nutationModel = b.nutationModel != null ? b.nutationModel : FrameDefaults.nutationModel();
        this.withNutation = b.withNutation;
        this.withAnnualAberration = b.withAnnualAberration;
        this.withGravitationalDeflection = b.withGravitationalDeflection;
        this.onFk5 = b.onFk5;
        this.enabled = EnumSet.copyOf(b.enabled);
    }

    private EquinoctialFrame(EquinoctialFrame other) {
        super(other.position(), other.isContinuous());
        copyPositionFrom(other);
        this.epoch = other.epoch;
        this.precessionModel = other.precessionModel;
        this.nutationModel = other.nutationModel;
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

    /** Independent copy carrying the same position, epoch, flags and models. */
    public EquinoctialFrame copy() {
        return new EquinoctialFrame(this);
    }

    @Override
    public FrameCode code() {
        return FrameCode.EQUINOCTIAL;
    }

    public double rightAscension() {
        return longitude();
    }

    public double declination() {
        return latitude();
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

    /** Mean obliquity of the ecliptic at the frame epoch, radians. */
    public double meanObliquity() {
        return Angles.arcsecondsToRadians(Precession.meanObliquity(epoch, precessionModel));
    }

    /** Obliquity the stored position is referred to: true when nutation is applied, else mean. */
    public double obliquity() {
        double eps = meanObliquity();
        if (withNutation) {
            eps += Angles.milliarcsecondsToRadians(Nutation.at(epoch, nutationModel).obliquity());
        }
        return eps;
    }

    /**
     * Apply the given options in the order: epoch, FK5, annual aberration, gravitational
     * deflection, nutation. Fields that are not set keep the current state.
     */
    public EquinoctialFrame retarget(RetargetOptions options) {
        if (options == null) return this;
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
        return this;
    }

    /**
     * Precess the position to {@code target}. Applied corrections are taken off at the old
     * epoch and put back at the new one, so the flags are unchanged.
     */
    public EquinoctialFrame retargetEpoch(Epoch target) {
        MissingRequiredFieldException.require("epoch", target);
        if (target.equals(epoch)) return this;
        boolean nutation = withNutation;
        boolean deflection = withGravitationalDeflection;
        boolean aberration = withAnnualAberration;
        boolean fk5 = onFk5;

        // STEP 1: back to the mean place of the current epoch
        removeNutation();
        removeGravitationalDeflection();
        removeAnnualAberration();
        removeFk5();

        // STEP 2: current epoch to J2000, then J2000 to the target epoch
        SphericalPosition p = working();
        if (!epoch.isJ2000()) {
            p = precessToJ2000(p, Precession.at(epoch, precessionModel));
        }
        if (!target.isJ2000()) {
            p = precessFromJ2000(p, Precession.at(target, precessionModel));
        }
        changePosition(p);
        log.debug("Equinoctial position moved from {} to {}", epoch, target);
        epoch = target;

        // STEP 3: corrections of the new epoch
        if (fk5) applyFk5();
        if (aberration) applyAnnualAberration();
        if (deflection) applyGravitationalDeflection();
        if (nutation) applyNutation();
        return this;
    }

    public EquinoctialFrame applyNutation() {
        if (withNutation || !isEnabled(Correction.NUTATION)) return this;
        Nutation n = Nutation.at(epoch, nutationModel);
        changePosition(nutate(working(), meanObliquity(),
                Angles.milliarcsecondsToRadians(n.longitude()), Angles.milliarcsecondsToRadians(n.obliquity())));
        withNutation = true;
        return this;
    }

    public EquinoctialFrame removeNutation() {
        if (!withNutation || !isEnabled(Correction.NUTATION)) return this;
        Nutation n = Nutation.at(epoch, nutationModel);
        changePosition(denutate(working(), meanObliquity(),
                Angles.milliarcsecondsToRadians(n.longitude()), Angles.milliarcsecondsToRadians(n.obliquity())));
        withNutation = false;
        return this;
    }

    public EquinoctialFrame applyFk5() {
        if (onFk5 || !isEnabled(Correction.FK5)) return this;
        fk5Applied = applyCorrection(Fk5Correction::equinoctial);
        onFk5 = true;
        return this;
    }

    public EquinoctialFrame removeFk5() {
        if (!onFk5 || !isEnabled(Correction.FK5)) return this;
        removeCorrection(fk5Applied, Fk5Correction::equinoctial);
        fk5Applied = null;
        onFk5 = false;
        return this;
    }

    public EquinoctialFrame applyAnnualAberration() {
        if (withAnnualAberration || !isEnabled(Correction.ANNUAL_ABERRATION)) return this;
        aberrationApplied = applyCorrection(AnnualAberration::equinoctial);
        withAnnualAberration = true;
        return this;
    }

    public EquinoctialFrame removeAnnualAberration() {
        if (!withAnnualAberration || !isEnabled(Correction.ANNUAL_ABERRATION)) return this;
        removeCorrection(aberrationApplied, AnnualAberration::equinoctial);
        aberrationApplied = null;
        withAnnualAberration = false;
        return this;
    }

    public EquinoctialFrame applyGravitationalDeflection() {
        if (withGravitationalDeflection || !isEnabled(Correction.GRAVITATIONAL_DEFLECTION)) return this;
        deflectionApplied = applyCorrection(GravitationalDeflection::equinoctial);
        withGravitationalDeflection = true;
        return this;
    }

    public EquinoctialFrame removeGravitationalDeflection() {
        if (!withGravitationalDeflection || !isEnabled(Correction.GRAVITATIONAL_DEFLECTION)) return this;
        removeCorrection(deflectionApplied, GravitationalDeflection::equinoctial);
        deflectionApplied = null;
        withGravitationalDeflection = false;
        return this;
    }

    /** A retargeted copy; this frame is left untouched. */
    public EquinoctialFrame snapshot(RetargetOptions options) {
        return copy().retarget(options);
    }

    @Override
    public EquinoctialFrame toEquinoctial() {
        return copy();
    }

    @Override
    public EclipticFrame toEcliptic(RetargetOptions options) {
        EquinoctialFrame source = snapshot(options);
        SphericalPosition p = EclipticFrame.fromEquatorial(source.working(), source.obliquity());
        EclipticFrame ecliptic = EclipticFrame.builder()
                .position(p)
                .epoch(source.epoch)
                .withNutation(source.withNutation)
                .withAnnualAberration(source.withAnnualAberration)
                .withGravitationalDeflection(source.withGravitationalDeflection)
                .onFk5(source.onFk5)
                .enabled(source.enabled)
                .precessionModel(precessionModel)
                .nutationModel(nutationModel)
                .continuous(isContinuous())
                .build();
        if (options != null && options.eclipticCenter() == EclipticCenter.HELIOCENTRIC) {
            ecliptic.toHeliocentric();
        }
        return ecliptic;
    }

    /**
     * Horizontal position seen under {@code condition}. The apparent place at the observing
     * time is rotated by the true local sidereal time and the observer latitude; the
     * options may ask for the topocentric center and refraction.
     */
    @Override
    public HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options) {
        MissingRequiredFieldException.require("observingCondition", condition);
        EquinoctialFrame apparent = apparentAt(condition.time());
        double lst = siderealTime(condition);
        HorizontalFrame horizontal = HorizontalFrame.builder()
                .position(HorizontalFrame.fromEquatorial(apparent.working(), lst, condition.geoLatitude()))
                .observingCondition(condition)
                .precessionModel(precessionModel)
                .nutationModel(nutationModel)
                .continuous(isContinuous())
                .build();
        if (options != null) {
            if (options.horizontalCenter() == HorizontalCenter.TOPOCENTRIC) horizontal.toTopocentric();
            if (Boolean.TRUE.equals(options.withRefraction())) horizontal.applyRefraction();
        }
        return horizontal;
    }

    @Override
    public HourAngleFrame toHourAngle(ObservingCondition condition) {
        MissingRequiredFieldException.require("observingCondition", condition);
        EquinoctialFrame apparent = apparentAt(condition.time());
        return HourAngleFrame.builder()
                .position(HourAngleFrame.fromEquatorial(apparent.working(), siderealTime(condition)))
                .observingCondition(condition)
                .precessionModel(precessionModel)
                .nutationModel(nutationModel)
                .continuous(isContinuous())
                .build();
    }

    /**
     * Galactic position. The mean J2000 place is rotated with the J2000 pole and centre,
     * then the galactic frame is moved to the requested epoch (J2000 when none is given).
     */
    @Override
    public GalacticFrame toGalactic(RetargetOptions options) {
        Epoch target = options != null && options.epoch() != null ? options.epoch() : Epoch.j2000();
        EquinoctialFrame mean = copy().retarget(RetargetOptions.builder()
                .epoch(Epoch.j2000())
                .apparentPlace(false)
                .build());
        GalacticFrame galactic = GalacticFrame.fromJ2000Equatorial(
                mean.working(), precessionModel, isContinuous());
        galactic.retargetEpoch(target);
        return galactic;
    }

    @Override
    protected String longitudeParameter() {
        return "rightAscension";
    }

    @Override
    protected String latitudeParameter() {
        return "declination";
    }

    @Override
    protected void positionReplaced() {
        fk5Applied = null;
        aberrationApplied = null;
        deflectionApplied = null;
    }

    /** Mean J2000 equatorial position carried to the mean equator and equinox of date. */
    static SphericalPosition precessFromJ2000(SphericalPosition p, Precession pr) {
        return p.rotateZ(Angles.arcsecondsToRadians(pr.zeta()))
                .rotateY(-Angles.arcsecondsToRadians(pr.theta()))
                .rotateZ(Angles.arcsecondsToRadians(pr.z()));
    }

    static SphericalPosition precessToJ2000(SphericalPosition p, Precession pr) {
        return p.rotateZ(-Angles.arcsecondsToRadians(pr.z()))
                .rotateY(Angles.arcsecondsToRadians(pr.theta()))
                .rotateZ(-Angles.arcsecondsToRadians(pr.zeta()));
    }

    static SphericalPosition nutate(SphericalPosition p, double epsilon, double dpsi, double deps) {
        return p.rotateX(-epsilon).rotateZ(dpsi).rotateX(epsilon + deps);
    }

    static SphericalPosition denutate(SphericalPosition p, double epsilon, double dpsi, double deps) {
        return p.rotateX(-epsilon - deps).rotateZ(-dpsi).rotateX(epsilon);
    }

    /** Frame at the observing time with every correction applied. */
    private EquinoctialFrame apparentAt(Epoch time) {
        return copy().retarget(RetargetOptions.builder().epoch(time).apparentPlace(true).build());
    }

    private double siderealTime(ObservingCondition condition) {
        return SiderealTime.at(condition.time(), condition.geoLongitude(), precessionModel, nutationModel)
                .trueRadians();
    }

    private AngularCorrection applyCorrection(CorrectionProvider provider) {
        boolean nutated = withNutation;
        removeNutation();
        SphericalPosition mean = working();
        AngularCorrection correction = provider.compute(mean, epoch, meanObliquity());
        changePosition(correction.applyTo(mean));
        if (nutated) applyNutation();
        return correction;
    }

    private void removeCorrection(AngularCorrection applied, CorrectionProvider provider) {
        boolean nutated = withNutation;
        removeNutation();
        SphericalPosition corrected = working();
        double eps = meanObliquity();
        AngularCorrection correction = applied != null
                ? applied
                : AngularCorrection.recover(corrected, p -> provider.compute(p, epoch, eps));
        changePosition(correction.removeFrom(corrected));
        if (nutated) applyNutation();
    }

    @FunctionalInterface
    private interface CorrectionProvider {
        AngularCorrection compute(SphericalPosition position, Epoch epoch, double obliquity);
    }

    /** Builder for {@link EquinoctialFrame}. */
    public static final class Builder {
        private SphericalPosition position;
        private Double rightAscension;
        private double declination = 0.0;
        private double radius = 1.0;
        private Epoch epoch = Epoch.j2000();
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

        /** Degrees in [0, 360). */
        public Builder rightAscension(double degrees) {
            this.rightAscension = degrees;
            return this;
        }

        /** Degrees in [-90, 90]. */
        public Builder declination(double degrees) {
            this.declination = degrees;
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

        public EquinoctialFrame build() {
            MissingRequiredFieldException.require("epoch", epoch);
            SphericalPosition p = resolve(position, rightAscension, declination, radius,
                    RangePolicy.STRICT, "rightAscension", "declination");
            return new EquinoctialFrame(this, p);
        }
    }
}
