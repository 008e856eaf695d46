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

import com.github.tinemuz.celestial.error.FrameValidationException;
import com.github.tinemuz.celestial.physics.NutationModel;
import com.github.tinemuz.celestial.physics.PrecessionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Builder defaults read from the classpath resource {@code celestial-frames.properties}.
 *
 * <p>The file is read on first use; a missing file or an unknown value is a packaging
 * error and raises {@link IllegalStateException}.</p>
 */
public final class FrameDefaults {
    private static final Logger log = LoggerFactory.getLogger(FrameDefaults.class);

    static final String RESOURCE = "celestial-frames.properties";

    private static volatile boolean loaded = false;
    private static PrecessionModel precessionModel;
    private static NutationModel nutationModel;
    private static RangePolicy galacticRangePolicy;
    private static RangePolicy horizontalRangePolicy;

    private FrameDefaults() {}

    public static PrecessionModel precessionModel() {
        ensureLoaded();
        return precessionModel;
    }

    public static NutationModel nutationModel() {
        ensureLoaded();
        return nutationModel;
    }

    public static RangePolicy galacticRangePolicy() {
        ensureLoaded();
        return galacticRangePolicy;
    }

    public static RangePolicy horizontalRangePolicy() {
        ensureLoaded();
        return horizontalRangePolicy;
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        Properties props = readProperties();
        try {
            precessionModel = PrecessionModel.fromName(props.getProperty("precession.model", "iau2006"));
            nutationModel = NutationModel.fromName(props.getProperty("nutation.model", "iau2000b"));
            galacticRangePolicy = RangePolicy.fromName(props.getProperty("galactic.range-policy", "lenient"));
            horizontalRangePolicy = RangePolicy.fromName(props.getProperty("horizontal.range-policy", "strict"));
        } catch (FrameValidationException e) {
            log.error("Invalid value in {}", RESOURCE, e);
            throw new IllegalStateException("Invalid value in " + RESOURCE + ": " + e.getMessage(), e);
        }
        log.debug("Frame defaults: precession={}, nutation={}, galactic={}, horizontal={}",
                precessionModel, nutationModel, galacticRangePolicy, horizontalRangePolicy);
        loaded = true;
    }

    private static Properties readProperties() {
        InputStream in = FrameDefaults.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Configuration file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Configuration file '" + RESOURCE + "' not found on classpath");
        }
        try (InputStream stream = in) {
            Properties props = new Properties();
            props.load(stream);
            return props;
        } catch (IOException e) {
            log.error("Failed to read {}", RESOURCE, e);
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }
}
