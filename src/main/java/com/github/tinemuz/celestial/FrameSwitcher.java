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
import com.github.tinemuz.celestial.error.TypeValidationException;
import com.github.tinemuz.celestial.math.SphericalPosition;
import com.github.tinemuz.celestial.time.Epoch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts any frame to any other through the equinoctial hub.
 *
 * <p>{@link #adopt} reads the source frame and builds the hub by inverting the same
 * transform the hub uses to produce that frame kind, with the sidereal time, obliquity
 * or galactic pole taken from the source's own state. Converting back to the source kind
 * with no options therefore returns the source position up to rounding.</p>
 *
 * <p>The source's observer, centers, refraction flag and galactic epoch are remembered
 * and used as defaults by the conversion methods.</p>
 */
public final class FrameSwitcher {
    private static final Logger log = LoggerFactory.getLogger(FrameSwitcher.class);

    private final EquinoctialFrame hub;
    private final FrameCode sourceCode;
    private final SourceContext context;

    private FrameSwitcher(EquinoctialFrame hub, FrameCode sourceCode, SourceContext context) {
        this.hub = hub;
        this.sourceCode = sourceCode;
        this.context = context;
    }

    public static FrameSwitcher adopt(CelestialFrame frame) {
        MissingRequiredFieldException.require("frame", frame);
        FrameSwitcher switcher;
        if (frame instanceof EquinoctialFrame) {
            switcher = fromEquinoctial((EquinoctialFrame) frame);
        } else if (frame instanceof EclipticFrame) {
            switcher = fromEcliptic((EclipticFrame) frame);
        } else if (frame instanceof GalacticFrame) {
            switcher = fromGalactic((GalacticFrame) frame);
        } else if (frame instanceof HorizontalFrame) {
            switcher = fromHorizontal((HorizontalFrame) frame);
        } else if (frame instanceof HourAngleFrame) {
            switcher = fromHourAngle((HourAngleFrame) frame);
        } else {
            throw new TypeValidationException("frame",
                    "The param frame should be one of the five frame kinds, got " + frame.getClass().getName());
        }
        log.debug("Adopted {} frame", switcher.sourceCode);
        return switcher;
    }

    /** Kind of the adopted frame. */
    public FrameCode sourceCode() {
        return sourceCode;
    }

    /** Copy of the hub derived from the source. */
    public EquinoctialFrame hub() {
        return hub.copy();
    }

    public CelestialFrame convertTo(FrameCode code) {
        return convertTo(code, RetargetOptions.none());
    }

    /**
     * Convert to the frame named by its short code: {@code hc}, {@code hac}, {@code eqc},
     * {@code ecc} or {@code gc}.
     */
    public CelestialFrame convertTo(String code, RetargetOptions options) {
        return convertTo(FrameCode.fromCode(code), options);
    }

    public CelestialFrame convertTo(FrameCode code, RetargetOptions options) {
        MissingRequiredFieldException.require("frameCode", code);
        RetargetOptions opts = options != null ? options : RetargetOptions.none();
        switch (code) {
            case HORIZONTAL:
                return toHorizontal(opts.observingCondition(), opts);
            case HOUR_ANGLE:
                return toHourAngle(opts.observingCondition());
            case ECLIPTIC:
                return toEcliptic(opts);
            case GALACTIC:
                return toGalactic(opts);
            default:
                return toEquinoctial(opts);
        }
    }

    public EquinoctialFrame toEquinoctial(RetargetOptions options) {
        return hub.snapshot(options);
    }

    public EclipticFrame toEcliptic(RetargetOptions options) {
        RetargetOptions.Builder b = builderOf(options);
        if (options == null || options.eclipticCenter() == null) {
            b.eclipticCenter(context.eclipticCenter());
        }
        return tracked(hub.toEcliptic(b.build()));
    }

    public GalacticFrame toGalactic(RetargetOptions options) {
        RetargetOptions.Builder b = builderOf(options);
        if (options == null || options.epoch() == null) {
            b.epoch(context.galacticEpoch() != null ? context.galacticEpoch() : Epoch.j2000());
        }
        return tracked(hub.toGalactic(b.build()));
    }

    /**
     * Horizontal frame. The observing condition is taken from {@code condition}, then from
     * the options, then from a horizontal source; center and refraction default to those of
     * a horizontal source.
     */
    public HorizontalFrame toHorizontal(ObservingCondition condition, RetargetOptions options) {
        ObservingCondition resolved = condition;
        if (resolved == null && options != null) resolved = options.observingCondition();
        if (resolved == null && sourceCode == FrameCode.HORIZONTAL) resolved = context.observingCondition();
        MissingRequiredFieldException.require("observingCondition", resolved);

        RetargetOptions.Builder b = builderOf(options);
        if ((options == null || options.horizontalCenter() == null) && context.horizontalCenter() != null) {
            b.horizontalCenter(context.horizontalCenter());
        }
        if ((options == null || options.withRefraction() == null) && context.withRefraction() != null) {
            b.withRefraction(context.withRefraction());
        }
        return tracked(hub.toHorizontal(resolved, b.build()));
    }

    /** Hour angle frame; the observing condition defaults to that of an observer-bound source. */
    public HourAngleFrame toHourAngle(ObservingCondition condition) {
        ObservingCondition resolved = condition != null ? condition : context.observingCondition();
        MissingRequiredFieldException.require("observingCondition", resolved);
        return tracked(hub.toHourAngle(resolved));
    }

    // a continuous source converted back to its own kind keeps its tracked angles
    private <T extends CommonFrame> T tracked(T frame) {
        if (frame.code() == sourceCode) {
            frame.trackFrom(context.trackedPosition());
        }
        return frame;
    }

    private static RetargetOptions.Builder builderOf(RetargetOptions options) {
        return options != null ? options.toBuilder() : RetargetOptions.builder();
    }

    private static FrameSwitcher fromEquinoctial(EquinoctialFrame source) {
        return new FrameSwitcher(source.copy(), FrameCode.EQUINOCTIAL, SourceContext.EMPTY);
    }

    private static FrameSwitcher fromEcliptic(EclipticFrame source) {
        EclipticFrame geocentric = source.copy().toGeocentric();
        SphericalPosition equatorial = EclipticFrame.toEquatorial(geocentric.position(), geocentric.obliquity());
        EquinoctialFrame hub = EquinoctialFrame.builder()
                .position(equatorial)
                .epoch(source.epoch())
                .withNutation(source.isWithNutation())
                .withAnnualAberration(source.isWithAnnualAberration())
                .withGravitationalDeflection(source.isWithGravitationalDeflection())
                .onFk5(source.isOnFk5())
                .enabled(source.enabledCorrections())
                .precessionModel(source.precessionModel())
                .nutationModel(source.nutationModel())
                .continuous(source.isContinuous())
                .build();
        return new FrameSwitcher(hub, FrameCode.ECLIPTIC,
                new SourceContext(null, null, null, source.center(), null, trackedOf(source)));
    }

    private static FrameSwitcher fromGalactic(GalacticFrame source) {
        EquinoctialFrame hub = EquinoctialFrame.builder()
                .position(source.equatorialPosition())
                .epoch(source.epoch())
                .precessionModel(source.precessionModel())
                .continuous(source.isContinuous())
                .build();
        return new FrameSwitcher(hub, FrameCode.GALACTIC,
                new SourceContext(null, null, null, null, source.epoch(), trackedOf(source)));
    }

    private static FrameSwitcher fromHorizontal(HorizontalFrame source) {
        ObservingCondition condition = source.observingCondition();
        EquinoctialFrame hub = apparentHub(source.equatorialPosition(), condition.time(), source.isContinuous(),
                EquinoctialFrame.builder()
                        .precessionModel(source.precessionModel())
                        .nutationModel(source.nutationModel()));
        return new FrameSwitcher(hub, FrameCode.HORIZONTAL,
                new SourceContext(condition, source.center(), source.isWithRefraction(), null, null,
                        trackedOf(source)));
    }

    private static FrameSwitcher fromHourAngle(HourAngleFrame source) {
        ObservingCondition condition = source.observingCondition();
        SphericalPosition equatorial = HourAngleFrame.toEquatorial(source.position(), source.siderealTime());
        EquinoctialFrame hub = apparentHub(equatorial, condition.time(), source.isContinuous(),
                EquinoctialFrame.builder()
                        .precessionModel(source.precessionModel())
                        .nutationModel(source.nutationModel()));
        return new FrameSwitcher(hub, FrameCode.HOUR_ANGLE,
                new SourceContext(condition, null, null, null, null, trackedOf(source)));
    }

    private static SphericalPosition trackedOf(CommonFrame source) {
        return source.isContinuous() ? source.storedPosition() : null;
    }

    // observer-bound frames hold apparent places of their observing time
    private static EquinoctialFrame apparentHub(SphericalPosition equatorial, Epoch time, boolean continuous,
                                                EquinoctialFrame.Builder models) {
        return models
                .position(equatorial)
                .epoch(time)
                .withNutation(true)
                .withAnnualAberration(true)
                .withGravitationalDeflection(true)
                .onFk5(true)
                .continuous(continuous)
                .build();
    }

    private record SourceContext(ObservingCondition observingCondition, HorizontalCenter horizontalCenter,
                                 Boolean withRefraction, EclipticCenter eclipticCenter, Epoch galacticEpoch,
                                 SphericalPosition trackedPosition) {
        static final SourceContext EMPTY = new SourceContext(null, null, null, null, null, null);
    }
}
