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
package com.github.tinemuz.celestial.math;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless angle helpers: unit conversions used by the providers, range wrapping and
 * sexagesimal parsing.
 *
 * <p>Providers report arcseconds, milliarcseconds or seconds of time; these conversions
 * are the only place where those units meet radians.</p>
 */
public final class Angles {
    public static final double TWO_PI = 2.0 * Math.PI;
    public static final double HALF_PI = 0.5 * Math.PI;
    public static final double ARCSEC_TO_RAD = Math.PI / (180.0 * 3600.0);
    public static final double MAS_TO_RAD = ARCSEC_TO_RAD / 1000.0;
    // one second of time is fifteen arcseconds
    public static final double TIME_SECOND_TO_RAD = 15.0 * ARCSEC_TO_RAD;

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");

    private Angles() {}

    public static double arcsecondsToRadians(double arcseconds) {
        return arcseconds * ARCSEC_TO_RAD;
    }

    public static double milliarcsecondsToRadians(double mas) {
        return mas * MAS_TO_RAD;
    }

    public static double timeSecondsToRadians(double seconds) {
        return seconds * TIME_SECOND_TO_RAD;
    }

    public static double radiansToArcseconds(double radians) {
        return radians / ARCSEC_TO_RAD;
    }

    /** Wrap an angle in radians into [0, 2π). */
    public static double normalizeRadians(double radians) {
        double r = radians - TWO_PI * Math.floor(radians / TWO_PI);
        return r >= TWO_PI ? 0.0 : r;
    }

    /** Wrap an angle in radians into [-π, π). */
    public static double wrapPi(double radians) {
        return normalizeRadians(radians + Math.PI) - Math.PI;
    }

    /** Wrap an angle in degrees into [0, 360). */
    public static double normalizeDegrees(double degrees) {
        double d = degrees - 360.0 * Math.floor(degrees / 360.0);
        return d >= 360.0 ? 0.0 : d;
    }

    /** Degrees from sexagesimal parts; the sign of the whole value is given separately. */
    public static double fromDms(boolean negative, double degrees, double minutes, double seconds) {
        double value = degrees + minutes / 60.0 + seconds / 3600.0;
        return negative ? -value : value;
    }

    /** Degrees from hours, minutes and seconds of time. */
    public static double fromHms(double hours, double minutes, double seconds) {
        return 15.0 * (hours + minutes / 60.0 + seconds / 3600.0);
    }

    /**
     * Parse an hour-angle string such as {@code 23h 09m 16.641s} or {@code 7:45:18.946}
     * and return degrees.
     *
     * @throws IllegalArgumentException if the text holds no number or more than three
     */
    public static double parseHours(String text) {
        Sexagesimal s = parse(text, false);
        return (s.negative ? -1.0 : 1.0) * fromHms(s.parts[0], s.parts[1], s.parts[2]);
    }

    /**
     * Parse a degree string such as {@code -6°43′11.61″}, {@code 77°03'56"W} or
     * {@code 38 55 17 N} and return degrees. A trailing S or W makes the value negative.
     *
     * @throws IllegalArgumentException if the text holds no number or more than three
     */
    public static double parseDegrees(String text) {
        Sexagesimal s = parse(text, true);
        return fromDms(s.negative, s.parts[0], s.parts[1], s.parts[2]);
    }

    private static Sexagesimal parse(String text, boolean hemisphereSuffix) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Angle text should not be empty");
        }
        String trimmed = text.trim();
        char last = Character.toUpperCase(trimmed.charAt(trimmed.length() - 1));
        boolean negative = trimmed.startsWith("-") || hemisphereSuffix && (last == 'S' || last == 'W');
        List<Double> values = new ArrayList<>();
        Matcher m = NUMBER.matcher(trimmed);
        while (m.find()) {
            values.add(Double.parseDouble(m.group()));
        }
        if (values.isEmpty() || values.size() > 3) {
            throw new IllegalArgumentException("Cannot parse sexagesimal angle '" + text + "'");
        }
        double[] parts = new double[3];
        for (int i = 0; i < values.size(); i++) parts[i] = values.get(i);
        return new Sexagesimal(negative, parts);
    }

    private record Sexagesimal(boolean negative, double[] parts) {}
}
