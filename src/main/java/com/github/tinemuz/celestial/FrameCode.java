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

import com.github.tinemuz.celestial.error.UnknownEnumException;

/** The five supported frames and their short system codes. */
public enum FrameCode {
    HORIZONTAL("hc"),
    HOUR_ANGLE("hac"),
    EQUINOCTIAL("eqc"),
    ECLIPTIC("ecc"),
    GALACTIC("gc");

    private final String code;

    FrameCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static FrameCode fromCode(String code) {
        if (code != null) {
            for (FrameCode c : values()) {
                if (c.code.equals(code)) return c;
            }
        }
        throw new UnknownEnumException("frameCode", code, "[hc, hac, eqc, ecc, gc]");
    }
}
