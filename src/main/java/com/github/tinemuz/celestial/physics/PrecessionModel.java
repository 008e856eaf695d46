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
package com.github.tinemuz.celestial.physics;

import com.github.tinemuz.celestial.error.UnknownEnumException;

import java.util.Locale;

/** Precession theories understood by {@link Precession} and {@link SiderealTime}. */
public enum PrecessionModel {
    IAU2006("iau2006"),
    IAU2000("iau2000"),
    IAU1976("iau1976");

    private final String modelName;

    PrecessionModel(String modelName) {
        this.modelName = modelName;
    }

    public String modelName() {
        return modelName;
    }

    /**
     * Resolve a model from its lower-case name ({@code iau2006}, {@code iau2000},
     * {@code iau1976}); case is ignored.
     */
    public static PrecessionModel fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (PrecessionModel model : values()) {
                if (model.modelName.equals(key)) return model;
            }
        }
        throw new UnknownEnumException("precessionModel", name, "[iau2006, iau2000, iau1976]");
    }
}
