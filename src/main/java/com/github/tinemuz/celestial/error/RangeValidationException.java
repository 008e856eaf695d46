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
package com.github.tinemuz.celestial.error;

/** A numeric value outside its documented domain, or not finite. */
public class RangeValidationException extends FrameValidationException {

    private static final long serialVersionUID = 1L;

    public RangeValidationException(String parameter, String message) {
        super(parameter, message);
    }

    /**
     * Check that {@code value} lies in the closed interval [min, max].
     *
     * @return the value, for use in assignments
     */
    public static double requireClosed(String parameter, double value, double min, double max) {
        requireFinite(parameter, value);
        if (value < min || value > max) {
            throw new RangeValidationException(
                    parameter,
                    "The param " + parameter + " should be in [" + min + ", " + max + "], got " + value);
        }
        return value;
    }

    /**
     * Check that {@code value} lies in the half-open interval [min, max).
     *
     * @return the value, for use in assignments
     */
    public static double requireHalfOpen(String parameter, double value, double min, double max) {
        requireFinite(parameter, value);
        if (value < min || value >= max) {
            throw new RangeValidationException(
                    parameter,
                    "The param " + parameter + " should be in [" + min + ", " + max + "), got " + value);
        }
        return value;
    }

    public static double requireFinite(String parameter, double value) {
        if (!Double.isFinite(value)) {
            throw new RangeValidationException(
                    parameter, "The param " + parameter + " should be a finite number, got " + value);
        }
        return value;
    }
}
