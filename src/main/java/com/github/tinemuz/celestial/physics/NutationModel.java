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

/** Nutation theories understood by {@link Nutation}. */
public enum NutationModel {
    /** IAU 2000B: 77 luni-solar terms plus fixed planetary offsets. */
    IAU2000B("iau2000b"),
    /** Four-term low precision series, good to about half an arcsecond. */
    LP("lp");

    private final String modelName;

    NutationModel(String modelName) {
        this.modelName = modelName;
    }

    public String modelName() {
        return modelName;
    }

    public static NutationModel fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (NutationModel model : values()) {
                if (model.modelName.equals(key)) return model;
            }
        }
        throw new UnknownEnumException("nutationModel", name, "[iau2000b, lp]");
    }
}
