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
import com.github.tinemuz.celestial.physics.AtmosphericRefraction;
import com.github.tinemuz.celestial.physics.DiurnalParallax;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import com.github.tinemuz.celestial.physics.SiderealTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Azimuth and altitude for one observer.
 *
 * <p>The polar angle of the stored position is the zenith distance and the azimuth is
 * measured from the south point toward the west. On top of the geometric position the
 * frame tracks two independent states: the center (geocentric or topocentric, related by
 * diurnal parallax) and whether atmospheric refraction is applied. Refraction is always
 * applied last, on top of the chosen center.</p>
 */
public final class HorizontalFrame extends CommonFrame {
    private static final Logger log = LoggerFactory.getLogger(HorizontalFrame.class);

    private ObservingCondition observingCondition;
    private final PrecessionModel precessionModel;
    private final NutationModel nutationModel;
    private final RangePolicy rangePolicy;
    private HorizontalCenter center;
    private boolean withRefraction;
    private boolean refractionEnabled;

    // altitude raise applied by this frame, degrees; null when unknown
    private Double refractionApplied;
    // raise taken off by the last removal and the position it left behind
    private Double refractionRemoved;
    private SphericalPosition removedAt;

    private HorizontalFrame(Builder b, RangePolicy policy, SphericalPosition position) {
        super(position, b.continuous);
        this.observingCondition = b.observingCondition;
        this.precessionModel = b.precessionModel != null ? b.precessionModel : FrameDefaults.precessionModel();
        this.nutationModel = b.nutationModel != null ? b.nutationModel : FrameDefaults.nutationModel();
        this.rangePolicy = policy;
        this.center = b.center;
        this.withRefraction = b.withRefraction;
        this.refractionEnabled = b.refractionEnabled;
    }

    private HorizontalFrame(HorizontalFrame other) {
        super(other.position(), other.isContinuous());
        copyPositionFrom(other);
        this.observingCondition = other.observingCondition;
        this.precessionModel = other.precessionModel;
        this.nutationModel = other.nutationModel;
        this.rangePolicy = other.rangePolicy;
        this.center = other.center;
        this.withRefraction = other.withRefraction;
        this.refractionEnabled = other.refractionEnabled;
        this.refractionApplied = other.refractionApplied;
        this.refractionRemoved = other.refractionRemoved;
        this.removedAt = other.removedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HorizontalFrame copy() {
        return new HorizontalFrame(this);
    }

    @Override
    public FrameCode code() {
        return FrameCode.HORIZONTAL;
    }

    /** Azimuth in degrees, from the south point toward the west. */
    public double azimuth() {
        return longitude();
    }

    public double altitude() {
        return latitude();
    }

    public double zenithDistance() {
        return Math.toDegrees(position().theta());
    }

    public ObservingCondition observingCondition() {
        return observingCondition;
    }

    public PrecessionModel precessionModel() {
        return precessionModel;
    }

    public NutationModel nutationModel() {
        return nutationModel;
    }

    @Override
    public RangePolicy rangePolicy() {
        return rangePolicy;
    }

    public HorizontalCenter center() {
        return center;
    }

    public boolean isWithRefraction() {
        return withRefraction;
    }

    /** Whether the refraction verbs move the position; when off the flag is only a label. */
    public boolean isRefractionEnabled() {
        return refractionEnabled;
    }

    public void setRefractionEnabled(boolean refractionEnabled) {
        this.refractionEnabled = refractionEnabled;
    }

    /** True local sidereal time of the observing condition, radians. */
    public double siderealTime() {
        return siderealTime(observingCondition);
    }

    /**
     * Move to a new observing condition (or a new time at the same place when only
     * {@code epoch} is given), then apply the requested center and refraction.
     *
     * <p>A new time takes the position through the apparent equatorial place so that the
     * sky is followed correctly; a new place alone is a plain re-rotation.</p>
     */
    public HorizontalFrame retarget(RetargetOptions options) {
        if (options == null) return this;
        ObservingCondition next = options.observingCondition();
        if (next == null && options.epoch() != null) {
            next = observingCondition.withTime(options.epoch());
        }
        if (next != null && !next.equals(observingCondition)) {
            moveTo(next);
        }
        if (options.horizontalCenter() != null) {
            if (options.horizontalCenter() == HorizontalCenter.TOPOCENTRIC) toTopocentric();
            else toGeocentric();
        }
        if (options.withRefraction() != null) {
            if (options.withRefraction()) applyRefraction();
            else removeRefraction();
        }
        return this;
    }

    public HorizontalFrame toTopocentric() {
        if (center == HorizontalCenter.TOPOCENTRIC) return this;
        boolean refracted = withRefraction;
        removeRefraction();
        changePosition(DiurnalParallax.toTopocentric(working(), siderealTime(),
                observingCondition.geoLatitude(), observingCondition.elevation(), DiurnalParallax.Frame.HORIZONTAL));
        center = HorizontalCenter.TOPOCENTRIC;
        if (refracted) applyRefraction();
        return this;
    }

    public HorizontalFrame toGeocentric() {
        if (center == HorizontalCenter.GEOCENTRIC) return this;
        boolean refracted = withRefraction;
        removeRefraction();
        changePosition(DiurnalParallax.toGeocentric(working(), siderealTime(),
                observingCondition.geoLatitude(), observingCondition.elevation(), DiurnalParallax.Frame.HORIZONTAL));
        center = HorizontalCenter.GEOCENTRIC;
        if (refracted) applyRefraction();
        return this;
    }

    /** Topocentric position with refraction, as the observer sees it. */
    public HorizontalFrame toObservedView() {
        return toTopocentric().applyRefraction();
    }

    /**
     * Raise the true altitude to the apparent one. Does nothing below the horizon, except
     * right after {@link #removeRefraction()}, which is undone exactly.
     */
    public HorizontalFrame applyRefraction() {
        if (withRefraction || !refractionEnabled) return this;
        SphericalPosition p = working();
        double altitude = 90.0 - Math.toDegrees(p.theta());
        double raise = 0.0;
        if (refractionRemoved != null && p.equals(removedAt)) {
            raise = refractionRemoved;
        } else if (altitude > 0.0) {
            raise = AtmosphericRefraction.trueToApparent(altitude) - altitude;
        } else {
            log.debug("Refraction skipped at altitude {}", altitude);
        }
        changePosition(p.withTheta(p.theta() - Math.toRadians(raise)));
        refractionApplied = raise;
        refractionRemoved = null;
        removedAt = null;
        withRefraction = true;
        return this;
    }

    /** Lower the apparent altitude to the true one. Does nothing below the horizon. */
    public HorizontalFrame removeRefraction() {
        if (!withRefraction || !refractionEnabled) return this;
        SphericalPosition p = working();
        double altitude = 90.0 - Math.toDegrees(p.theta());
        double raise;
        if (refractionApplied != null) {
            raise = refractionApplied;
        } else if (altitude > 0.0) {
            raise = altitude - AtmosphericRefraction.apparentToTrue(altitude);
        } else {
            log.debug("Refraction removal skipped at altitude {}", altitude);
            raise = 0.0;
        }
        changePosition(p.withTheta(p.theta() + Math.toRadians(raise)));
        refractionRemoved = raise;
        removedAt = working();
        refractionApplied = null;
        withRefraction = false;
        return this;
    }

    public HorizontalFrame snapshot(RetargetOptions options) {
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

    /** Geocentric, unrefracted position as apparent equatorial coordinates. */
    SphericalPosition equatorialPosition() {
        HorizontalFrame geometric = copy().retarget(RetargetOptions.builder()
                .withRefraction(false)
                .horizontalCenter(HorizontalCenter.GEOCENTRIC)
                .build());
        return toEquatorial(geometric.working(), siderealTime(), observingCondition.geoLatitude());
    }

    @Override
    protected String longitudeParameter() {
        return "azimuth";
    }

    @Override
    protected String latitudeParameter() {
        return "altitude";
    }

    @Override
    protected void positionReplaced() {
        refractionApplied = null;
        refractionRemoved = null;
        removedAt = null;
    }

    static SphericalPosition fromEquatorial(SphericalPosition p, double siderealTime, double geoLatitude) {
        return p.rotateZ(-siderealTime)
                .rotateY(-(Angles.HALF_PI - Math.toRadians(geoLatitude)))
                .inverse(SphericalPosition.Axis.Y);
    }

    static SphericalPosition toEquatorial(SphericalPosition p, double siderealTime, double geoLatitude) {
        return p.inverse(SphericalPosition.Axis.Y)
                .rotateY(Angles.HALF_PI - Math.toRadians(geoLatitude))
                .rotateZ(siderealTime);
    }

    private void moveTo(ObservingCondition next) {
        HorizontalCenter originalCenter = center;
        boolean refracted = withRefraction;

        // STEP 1: geometric geocentric position
        removeRefraction();
        toGeocentric();

        // STEP 2: apparent equatorial place, carried to the new time if it changed
        SphericalPosition equatorial = toEquatorial(working(), siderealTime(), observingCondition.geoLatitude());
        if (!next.time().equals(observingCondition.time())) {
            EquinoctialFrame apparent = EquinoctialFrame.builder()
                    .position(equatorial)
                    .epoch(observingCondition.time())
                    .withNutation(true)
                    .withAnnualAberration(true)
                    .withGravitationalDeflection(true)
                    .onFk5(true)
                    .precessionModel(precessionModel)
                    .nutationModel(nutationModel)
                    .build();
            apparent.retargetEpoch(next.time());
            equatorial = apparent.position();
        }

        // STEP 3: rotate in with the new sidereal time and latitude
        changePosition(fromEquatorial(equatorial, siderealTime(next), next.geoLatitude()));
        observingCondition = next;
        log.debug("Horizontal frame moved to {}", next);

        // STEP 4: restore center and refraction
        if (originalCenter == HorizontalCenter.TOPOCENTRIC) toTopocentric();
        if (refracted) applyRefraction();
    }

    private double siderealTime(ObservingCondition condition) {
        return SiderealTime.at(condition.time(), condition.geoLongitude(), precessionModel, nutationModel)
                .trueRadians();
    }

    /** Builder for {@link HorizontalFrame}. */
    public static final class Builder {
        private SphericalPosition position;
        private Double azimuth;
        private double altitude = 0.0;
        private double radius = 1.0;
        private ObservingCondition observingCondition;
        private HorizontalCenter center = HorizontalCenter.GEOCENTRIC;
        private boolean withRefraction;
        private boolean refractionEnabled = true;
        private PrecessionModel precessionModel;
        private NutationModel nutationModel;
        private RangePolicy rangePolicy;
        private boolean continuous;

        private Builder() {}

        public Builder position(SphericalPosition position) {
            this.position = position;
            return this;
        }

        /** Degrees from south toward west. */
        public Builder azimuth(double degrees) {
            this.azimuth = degrees;
            return this;
        }

        public Builder altitude(double degrees) {
            this.altitude = degrees;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        public Builder observingCondition(ObservingCondition condition) {
            this.observingCondition = condition;
            return this;
        }

        public Builder center(HorizontalCenter center) {
            this.center = center;
            return this;
        }

        public Builder center(String name) {
            this.center = HorizontalCenter.fromName(name);
            return this;
        }

        /** When true, the supplied position is already refracted. */
        public Builder withRefraction(boolean value) {
            this.withRefraction = value;
            return this;
        }

        /** Refraction is enabled unless switched off here. */
        public Builder refractionEnabled(boolean value) {
            this.refractionEnabled = value;
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

        public Builder rangePolicy(RangePolicy policy) {
            this.rangePolicy = policy;
            return this;
        }

        public Builder continuous(boolean continuous) {
            this.continuous = continuous;
            return this;
        }

        public HorizontalFrame build() {
            MissingRequiredFieldException.require("observingCondition", observingCondition);
            MissingRequiredFieldException.require("center", center);
            RangePolicy policy = rangePolicy != null ? rangePolicy : FrameDefaults.horizontalRangePolicy();
            SphericalPosition p = resolve(position, azimuth, altitude, radius, policy, "azimuth", "altitude");
            return new HorizontalFrame(this, policy, p);
        }
    }
}
