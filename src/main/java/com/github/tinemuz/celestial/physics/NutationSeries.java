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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * IAU 2000B luni-solar nutation series, loaded once from the classpath resource
 * {@code nutation-iau2000b.txt}.
 */
final class NutationSeries {
    private static final Logger log = LoggerFactory.getLogger(NutationSeries.class);

    static final String RESOURCE = "nutation-iau2000b.txt";
    static final int EXPECTED_TERMS = 77;

    // 0.1 microarcsecond to arcsecond
    private static final double UNIT_TO_ARCSEC = 1e-7;
    private static final double ARCSEC_PER_TURN = 1296000.0;

    private static volatile boolean loaded = false;
    private static Term[] terms;

    private NutationSeries() {}

    /**
     * Luni-solar nutation at {@code t} Julian centuries since J2000.
     *
     * @return {delta-psi, delta-epsilon} in arcseconds
     */
    static double[] evaluate(double t) {
        ensureLoaded();
        // Delaunay arguments (IERS 2003), arcseconds reduced to one turn
        double l = delaunay(t, 485868.249036, 1717915923.2178);
        double lp = delaunay(t, 1287104.79305, 129596581.0481);
        double f = delaunay(t, 335779.526232, 1739527262.8478);
        double d = delaunay(t, 1072260.70369, 1602961601.2090);
        double om = delaunay(t, 450160.398036, -6962890.5431);

        double dp = 0.0;
        double de = 0.0;
        // smallest terms first
        for (int i = terms.length - 1; i >= 0; i--) {
            Term term = terms[i];
            double arg = (term.nl * l + term.nlp * lp + term.nf * f + term.nd * d + term.nom * om)
                    % (2.0 * Math.PI);
            double sin = Math.sin(arg);
            double cos = Math.cos(arg);
            dp += (term.ps + term.pst * t) * sin + term.pc * cos;
            de += (term.ec + term.ect * t) * cos + term.es * sin;
        }
        return new double[] {dp * UNIT_TO_ARCSEC, de * UNIT_TO_ARCSEC};
    }

    static int size() {
        ensureLoaded();
        return terms.length;
    }

    private static double delaunay(double t, double a0, double a1) {
        double arcsec = (a0 + a1 * t) % ARCSEC_PER_TURN;
        return Math.toRadians(arcsec / 3600.0);
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        terms = loadTerms();
        loaded = true;
    }

    private static Term[] loadTerms() {
        InputStream in = NutationSeries.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Nutation series '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Nutation series '" + RESOURCE + "' not found on classpath");
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<Term> rows = new ArrayList<>();
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 11) {
                    throw new IllegalStateException("Expected 11 columns, got " + toks.length + ": " + line);
                }
                rows.add(new Term(
                        Integer.parseInt(toks[0]), Integer.parseInt(toks[1]), Integer.parseInt(toks[2]),
                        Integer.parseInt(toks[3]), Integer.parseInt(toks[4]),
                        Double.parseDouble(toks[5]), Double.parseDouble(toks[6]), Double.parseDouble(toks[7]),
                        Double.parseDouble(toks[8]), Double.parseDouble(toks[9]), Double.parseDouble(toks[10])));
            }
            if (rows.size() != EXPECTED_TERMS) {
                throw new IllegalStateException("Expected " + EXPECTED_TERMS + " terms, got " + rows.size());
            }
            log.debug("Loaded {} nutation terms from {}", rows.size(), RESOURCE);
            return rows.toArray(new Term[0]);
        } catch (IOException e) {
            log.error("Failed to read nutation series", e);
            throw new IllegalStateException("Failed to read nutation series", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse nutation series", e);
            throw new IllegalStateException("Failed to parse nutation series", e);
        }
    }

    private record Term(int nl, int nlp, int nf, int nd, int nom,
                        double ps, double pst, double pc, double ec, double ect, double es) {}
}
