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
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.time.Epoch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Galactic longitude and latitude.
 *
 * <p>The frame is defined by two equatorial directions fixed at J2000, the north galactic
 * pole and the galactic centre. There is no precession formula for galactic coordinates:
 * moving to another epoch goes through the equinoctial frame, which precesses both the
 * position and the defining directions.</p>
 */
public final class GalacticFrame extends CommonFrame {
    private static final Logger log = LoggerFactory.getLogger(GalacticFrame.class);

    /** J2000 right ascension and declination of the north galactic pole, degrees. */
    public static final double POLE_RA_J2000 = 192.85948;
    public static final double POLE_DEC_J2000 = 27.12825;
    /** J2000 right ascension and declination of the galactic centre, degrees. */
    public static final double CENTER_RA_J2000 = 266.405;
    public static final double CENTER_DEC_J2000 = -28.936;

    private Epoch epoch;
    private final PrecessionModel precessionModel;
    private final RangePolicy rangePolicy;
    private SphericalPosition pole;
    private SphericalPosition center;
    private double nodeAngle;

    private GalacticFrame(Builder b, SphericalPosition position) {
        super(position, b.continuous);
        this.epoch = b.epoch;
        this.precessionModel = b.precessionModel != null ? b.precessionModel : FrameDefaults.precessionModel();
        this.rangePolicy = b.rangePolicy != null ? b.rangePolicy : FrameDefaults.galacticRangePolicy();
        defineAt(epoch);
    }

    private GalacticFrame(GalacticFrame other) {
        super(other.position(), other.isContinuous());
        copyPositionFrom(other);
        this.epoch = other.epoch;
        this.precessionModel = other.precessionModel;
        this.rangePolicy = other.rangePolicy;
        this.pole = other.pole;
        this.center = other.center;
        this.nodeAngle = other.nodeAngle;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Galactic frame at J2000 for a mean J2000 equatorial position. */
    static GalacticFrame fromJ2000Equatorial(SphericalPosition equatorial, PrecessionModel model,
                                             boolean continuous) {
        GalacticFrame frame = builder()
                .position(SphericalPosition.of(1.0, Angles.HALF_PI, 0.0))
                .precessionModel(model)
                .continuous(continuous)
                .build();
        frame.changePosition(fromEquatorial(equatorial, frame.pole, frame.nodeAngle));
        return frame;
    }

    public GalacticFrame copy() {
        return new GalacticFrame(this);
    }

    @Override
    public FrameCode code() {
        return FrameCode.GALACTIC;
    }

    public Epoch epoch() {
        return epoch;
    }

    public PrecessionModel precessionModel() {
        return precessionModel;
    }

    @Override
    public RangePolicy rangePolicy() {
        return rangePolicy;
    }

    /** North galactic pole at the frame epoch, as a mean equatorial position. */
    public SphericalPosition pole() {
        return pole;
    }

    /** Galactic centre at the frame epoch, as a mean equatorial position. */
    public SphericalPosition center() {
        return center;
    }

    /** Angle from the ascending node of the galactic plane to the galactic centre, radians. */
    public double nodeAngle() {
        return nodeAngle;
    }

    public GalacticFrame retarget(RetargetOptions options) {
        if (options != null && options.epoch() != null) retargetEpoch(options.epoch());
        return this;
    }

    public GalacticFrame retargetEpoch(Epoch target) {
        MissingRequiredFieldException.require("epoch", target);
        if (target.equals(epoch)) return this;

        // STEP 1-2: back to equatorial coordinates of the old epoch
        EquinoctialFrame equatorial = EquinoctialFrame.builder()
                .position(equatorialPosition())
                .epoch(epoch)
                .precessionModel(precessionModel)
                .build();

        // STEP 3: precess through the hub
        equatorial.retargetEpoch(target);

        // STEP 4: defining directions at the new epoch
        defineAt(target);
        epoch = target;

        // STEP 5: back to galactic coordinates
        changePosition(fromEquatorial(equatorial.position(), pole, nodeAngle));
        log.debug("Galactic frame moved to {}", target);
        return this;
    }

    public GalacticFrame snapshot(RetargetOptions options) {
        return copy().retarget(options);
    }

    @Override
    public EquinoctialFrame toEquinoctial() {
        return FrameSwitcher.adopt(this).hub();
    }

    @Override
    public EclipticFrame toEcliptic(RetargetOptions options) {
        return FrameSwitcher.adopt(this).toEcliptic(options);
    }

    @Override
    public GalacticFrame toGalactic(RetargetOptions options) {
        return snapshot(options);
    }

    @Override
    public HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options) {
        return FrameSwitcher.adopt(this).toHorizontal(condition, options);
    }

    @Override
    public HourAngleFrame toHourAngle(ObservingCondition condition) {
        return FrameSwitcher.adopt(this).toHourAngle(condition);
    }

    /** Mean equatorial position of the frame epoch. */
    SphericalPosition equatorialPosition() {
        return toEquatorial(working(), pole, nodeAngle);
    }

    @Override
    protected String longitudeParameter() {
        return "longitude";
    }

    @Override
    protected String latitudeParameter() {
        return "latitude";
    }

    static SphericalPosition fromEquatorial(SphericalPosition p, SphericalPosition pole, double nodeAngle) {
        return p.rotateZ(-pole.phi() - Angles.HALF_PI)
                .rotateX(-pole.theta())
                .rotateZ(nodeAngle);
    }

    static SphericalPosition toEquatorial(SphericalPosition p, SphericalPosition pole, double nodeAngle) {
        return p.rotateZ(-nodeAngle)
                .rotateX(pole.theta())
                .rotateZ(pole.phi() + Angles.HALF_PI);
    }

    private void defineAt(Epoch at) {
        this.pole = definingDirection(POLE_RA_J2000, POLE_DEC_J2000, at);
        this.center = definingDirection(CENTER_RA_J2000, CENTER_DEC_J2000, at);
        // a = 90 deg - (ra_gc - ra_ngp), theta = acos(cos a cos dec_gc)
        double a = Angles.HALF_PI - (center.phi() - pole.phi());
        double decCenter = Angles.HALF_PI - center.theta();
        this.nodeAngle = Math.acos(Math.cos(a) * Math.cos(decCenter));
    }

    private SphericalPosition definingDirection(double ra, double dec, Epoch at) {
        return EquinoctialFrame.builder()
                .rightAscension(ra)
                .declination(dec)
                .precessionModel(precessionModel)
                .build()
                .retargetEpoch(at)
                .position();
    }

    /** Builder for {@link GalacticFrame}. */
    public static final class Builder {
        private SphericalPosition position;
        private Double longitude;
        private double latitude = 0.0;
        private double radius = 1.0;
        private Epoch epoch = Epoch.j2000();
        private PrecessionModel precessionModel;
        private RangePolicy rangePolicy;
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

        public Builder precessionModel(PrecessionModel model) {
            this.precessionModel = model;
            return this;
        }

        public Builder rangePolicy(RangePolicy policy) {
            this.rangePolicy = policy;
            return this;
        }

        public Builder continuous(boolean continuous) {
            this.continuous = continuous;
            return this;
        }

        public GalacticFrame build() {
            MissingRequiredFieldException.require("epoch", epoch);
            RangePolicy policy = rangePolicy != null ? rangePolicy : FrameDefaults.galacticRangePolicy();
            SphericalPosition p = resolve(position, longitude, latitude, radius, policy, "longitude", "latitude");
            return new GalacticFrame(this, p);
        }
    }
}
