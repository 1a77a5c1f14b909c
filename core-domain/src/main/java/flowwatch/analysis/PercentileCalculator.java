package flowwatch.analysis;

import java.util.Arrays;
import java.util.Collection;

/**
 * Percentiles por interpolación lineal entre estadísticos de orden.
 * <p>
 * Para {@code n} valores ordenados {@code x[0..n-1]} y probabilidad {@code p}:
 * <pre>
 *   h = (n - 1) * p
 *   q = x[floor(h)] + (h - floor(h)) * (x[floor(h) + 1] - x[floor(h)])
 * </pre>
 * Es el método "linear" (tipo 7 de Hyndman y Fan). Con {@code [5, 10, 15, 20, 90]}
 * y {@code p = 0.9} da {@code 62.0}.
 */
public final class PercentileCalculator {

    private PercentileCalculator() {}

    public static double percentile(Collection<Double> values, double p) {
        return percentile(values.stream().mapToDouble(Double::doubleValue).toArray(), p);
    }

    public static double percentile(double[] values, double p) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0, 1]: " + p);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double h = (sorted.length - 1) * p;
        int lower = (int) Math.floor(h);
        if (lower >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double fraction = h - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }
}
