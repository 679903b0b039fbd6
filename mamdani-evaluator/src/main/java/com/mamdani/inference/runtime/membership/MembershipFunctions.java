/*
 * Copyright (c) 2025 Mamdani Inference Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mamdani.inference.runtime.membership;

import com.mamdani.inference.api.model.MembershipFunction;

/**
 * Membership-function formulas.
 *
 * <p>All functions are pure and map a crisp value to a degree in [0, 1] for
 * well-formed parameters. Piecewise shapes use half-open segments
 * ({@code x < breakpoint}), so the right foot of a triangle or trapezoid
 * evaluates to 0.
 *
 * <h2>Degenerate parameters</h2>
 * <p>A segment of zero (or negative) width never divides: the segment is
 * treated as a step and the function returns the plateau value on the
 * corresponding side. A Gaussian with zero spread and a bell with zero width
 * collapse to a spike that is 1 exactly at the centre and 0 elsewhere.
 */
public final class MembershipFunctions {

    private MembershipFunctions() {
    }

    /**
     * Evaluates {@code fn} at {@code x} by dispatching on its shape.
     */
    public static double evaluate(MembershipFunction fn, double x) {
        switch (fn.shape()) {
            case TRI:
                return tri(x, fn.parameter(0), fn.parameter(1), fn.parameter(2));
            case TRAP:
                return trap(x, fn.parameter(0), fn.parameter(1), fn.parameter(2), fn.parameter(3));
            case LINZ:
                return linz(x, fn.parameter(0), fn.parameter(1));
            case LINS:
                return lins(x, fn.parameter(0), fn.parameter(1));
            case GAUSS:
                return gauss(x, fn.parameter(0), fn.parameter(1));
            case GAUSS2:
                return gauss2(x, fn.parameter(0), fn.parameter(1), fn.parameter(2), fn.parameter(3));
            case GBELL:
                return gbell(x, fn.parameter(0), fn.parameter(1), fn.parameter(2));
            case SIG:
                return sig(x, fn.parameter(0), fn.parameter(1));
            case DSIG:
                return dsig(x, fn.parameter(0), fn.parameter(1), fn.parameter(2), fn.parameter(3));
            case PSIG:
                return psig(x, fn.parameter(0), fn.parameter(1), fn.parameter(2), fn.parameter(3));
            case Z:
                return z(x, fn.parameter(0), fn.parameter(1));
            case S:
                return s(x, fn.parameter(0), fn.parameter(1));
            case PI:
                return pi(x, fn.parameter(0), fn.parameter(1), fn.parameter(2), fn.parameter(3));
            default:
                throw new IllegalArgumentException("Unsupported shape: " + fn.shape());
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // PIECEWISE LINEAR
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Triangle with feet {@code a}, {@code c} and peak {@code b}.
     */
    public static double tri(double x, double a, double b, double c) {
        if (x < a) {
            return 0.0;
        }
        if (x < b) {
            return rise(x, a, b);
        }
        if (x == b) {
            // Peak, also when the right ramp has zero width.
            return 1.0;
        }
        if (x < c) {
            return fall(x, b, c);
        }
        return 0.0;
    }

    /**
     * Trapezoid with feet {@code a}, {@code d} and shoulders {@code b},
     * {@code c}. With {@code b == c} it is the triangle {@code (a, b, d)}.
     */
    public static double trap(double x, double a, double b, double c, double d) {
        if (x < a) {
            return 0.0;
        }
        if (x < b) {
            return rise(x, a, b);
        }
        if (x < c || (x == b && b == c)) {
            return 1.0;
        }
        if (x < d) {
            return fall(x, c, d);
        }
        return 0.0;
    }

    /**
     * Linear z-shaped saturation: 1 below {@code a}, 0 from {@code b} on.
     */
    public static double linz(double x, double a, double b) {
        if (x < a) {
            return 1.0;
        }
        if (x < b) {
            return fall(x, a, b);
        }
        return 0.0;
    }

    /**
     * Linear s-shaped saturation: 0 below {@code a}, 1 from {@code b} on.
     */
    public static double lins(double x, double a, double b) {
        if (x < a) {
            return 0.0;
        }
        if (x < b) {
            return rise(x, a, b);
        }
        return 1.0;
    }

    // ════════════════════════════════════════════════════════════════════════
    // GAUSSIAN
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Gaussian with standard deviation {@code s} and mean {@code c}.
     */
    public static double gauss(double x, double s, double c) {
        if (s == 0.0) {
            return x == c ? 1.0 : 0.0;
        }
        double d = x - c;
        return Math.exp(-(d * d) / (2.0 * s * s));
    }

    /**
     * Left Gaussian {@code (s1, c1)} below {@code c1}, 1 on
     * {@code [c1, c2)}, right Gaussian {@code (s2, c2)} from {@code c2} on.
     */
    public static double gauss2(double x, double s1, double c1, double s2, double c2) {
        if (x < c1) {
            return gauss(x, s1, c1);
        }
        if (x < c2) {
            return 1.0;
        }
        return gauss(x, s2, c2);
    }

    /**
     * Generalized bell of width {@code a}, slope {@code b} and centre
     * {@code c}.
     */
    public static double gbell(double x, double a, double b, double c) {
        if (a == 0.0) {
            return x == c ? 1.0 : 0.0;
        }
        return 1.0 / (1.0 + Math.pow(Math.abs((x - c) / a), 2.0 * b));
    }

    // ════════════════════════════════════════════════════════════════════════
    // SIGMOID
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Sigmoid with slope {@code a} centred at {@code c}.
     */
    public static double sig(double x, double a, double c) {
        return 1.0 / (1.0 + Math.exp(-a * (x - c)));
    }

    public static double dsig(double x, double a1, double c1, double a2, double c2) {
        return sig(x, a1, c1) - sig(x, a2, c2);
    }

    public static double psig(double x, double a1, double c1, double a2, double c2) {
        return sig(x, a1, c1) * sig(x, a2, c2);
    }

    // ════════════════════════════════════════════════════════════════════════
    // QUADRATIC CURVES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Z-curve: 1 below {@code a}, quadratic fall to 0 at {@code b},
     * symmetric about the midpoint.
     */
    public static double z(double x, double a, double b) {
        return 1.0 - s(x, a, b);
    }

    /**
     * S-curve: 0 below {@code a}, quadratic rise to 1 at {@code b},
     * symmetric about the midpoint.
     */
    public static double s(double x, double a, double b) {
        if (x < a) {
            return 0.0;
        }
        if (x >= b) {
            return 1.0;
        }
        // a <= x < b, so b - a > 0
        double width = b - a;
        if (x < (a + b) / 2.0) {
            double t = (x - a) / width;
            return 2.0 * t * t;
        }
        double t = (x - b) / width;
        return 1.0 - 2.0 * t * t;
    }

    /**
     * S-rise from {@code a} to {@code b}, plateau to {@code c}, z-fall to
     * {@code d}.
     */
    public static double pi(double x, double a, double b, double c, double d) {
        if (x < b) {
            return s(x, a, b);
        }
        if (x < c) {
            return 1.0;
        }
        return z(x, c, d);
    }

    // Linear ramps. Callers only reach these for from <= x < to.

    private static double rise(double x, double from, double to) {
        double width = to - from;
        return width > 0.0 ? (x - from) / width : 1.0;
    }

    private static double fall(double x, double from, double to) {
        double width = to - from;
        return width > 0.0 ? (to - x) / width : 0.0;
    }
}
