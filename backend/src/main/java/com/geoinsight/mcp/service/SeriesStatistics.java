package com.geoinsight.mcp.service;

import java.util.List;

/**
 * Null-aware descriptive statistics. Undefined results are null, never NaN or zero.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    /** (current - prior) / prior; null when either is absent or the prior is zero. */
    public static Double relativeChange(Double current, Double prior) {
        if (current == null || prior == null || prior == 0.0) {
            return null;
        }
        return (current - prior) / prior;
    }

    /** Mean of the present values; null when there are none. */
    public static Double mean(List<Double> values) {
        double sum = 0.0;
        int n = 0;
        for (Double value : values) {
            if (value != null) {
                sum += value;
                n++;
            }
        }
        return n == 0 ? null : sum / n;
    }

    /** Sample standard deviation of the present values; null below two observations. */
    public static Double sampleStd(List<Double> values) {
        Double mean = mean(values);
        int n = 0;
        double squares = 0.0;
        for (Double value : values) {
            if (value != null) {
                double d = value - mean;
                squares += d * d;
                n++;
            }
        }
        if (n < 2) {
            return null;
        }
        return Math.sqrt(squares / (n - 1));
    }

    /** (value - mean) / std; null when any input is absent or std is zero. */
    public static Double zscore(Double value, Double mean, Double std) {
        if (value == null || mean == null || std == null || std == 0.0) {
            return null;
        }
        return (value - mean) / std;
    }

    /** Pearson correlation of paired samples; null below two pairs or with a constant side. */
    public static Double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n < 2 || y.length != n) {
            return null;
        }
        double mx = average(x);
        double my = average(y);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return null;
        }
        return sxy / Math.sqrt(sxx * syy);
    }

    /** OLS slope of y regressed on x; null below two pairs or when x is constant. */
    public static Double olsSlope(double[] x, double[] y) {
        int n = x.length;
        if (n < 2 || y.length != n) {
            return null;
        }
        double mx = average(x);
        double my = average(y);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            sxy += dx * (y[i] - my);
            sxx += dx * dx;
        }
        if (sxx == 0.0) {
            return null;
        }
        return sxy / sxx;
    }

    /** Mean of |value| over the present values; null when there are none. */
    public static Double meanAbsolute(List<Double> values) {
        double sum = 0.0;
        int n = 0;
        for (Double value : values) {
            if (value != null) {
                sum += Math.abs(value);
                n++;
            }
        }
        return n == 0 ? null : sum / n;
    }

    private static double average(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }
}
