package io.arbor.core.calculation;

/// Aggregate helpers for variadic calculation operators.
///
/// Variance and standard deviation are sample statistics (divisor `n - 1`).
final class Statistics {

    private Statistics() {}

    static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    static double product(double[] values) {
        double total = 1.0;
        for (double v : values) {
            total *= v;
        }
        return total;
    }

    static double mean(double[] values) {
        return sum(values) / values.length;
    }

    static double hypot(double[] values) {
        double squares = 0.0;
        for (double v : values) {
            squares += v * v;
        }
        return Math.sqrt(squares);
    }

    static double geometricMean(double[] values) {
        double logSum = 0.0;
        for (double v : values) {
            if (v == 0) {
                return 0.0;
            }
            logSum += Math.log(v);
        }
        return Math.exp(logSum / values.length);
    }

    static double harmonicMean(double[] values) {
        double reciprocalSum = 0.0;
        for (double v : values) {
            reciprocalSum += 1.0 / v;
        }
        return values.length / reciprocalSum;
    }

    static double variance(double[] values) {
        double mean = mean(values);
        double squared = 0.0;
        for (double v : values) {
            squared += (v - mean) * (v - mean);
        }
        return squared / (values.length - 1);
    }

    static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    static double range(double[] values) {
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return max - min;
    }
}
