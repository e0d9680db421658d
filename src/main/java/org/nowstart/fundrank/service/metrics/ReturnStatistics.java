package org.nowstart.fundrank.service.metrics;

import java.util.Arrays;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Return/risk statistics over simple periodic returns. Undefined results are {@link Double#NaN}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReturnStatistics {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double sampleStdev(double[] values) {
        if (values == null || values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squared = 0.0;
        for (double value : values) {
            squared += (value - mean) * (value - mean);
        }
        return Math.sqrt(squared / (values.length - 1));
    }

    public static double sampleCovariance(double[] left, double[] right) {
        if (left == null || right == null || left.length != right.length || left.length < 2) {
            return Double.NaN;
        }
        double leftMean = mean(left);
        double rightMean = mean(right);
        double sum = 0.0;
        for (int i = 0; i < left.length; i++) {
            sum += (left[i] - leftMean) * (right[i] - rightMean);
        }
        return sum / (left.length - 1);
    }

    public static double annualizedVolatilityPct(double[] returns) {
        return sampleStdev(returns) * Math.sqrt(TRADING_DAYS_PER_YEAR) * 100.0;
    }

    public static double sharpeRatio(double[] returns, double annualRiskFreeRate) {
        double stdev = sampleStdev(returns);
        if (!Double.isFinite(stdev) || stdev == 0.0) {
            return Double.NaN;
        }
        double annualMean = mean(returns) * TRADING_DAYS_PER_YEAR;
        return (annualMean - annualRiskFreeRate) / (stdev * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    public static double sortinoRatio(double[] returns, double annualRiskFreeRate) {
        if (returns == null || returns.length < 2) {
            return Double.NaN;
        }
        double dailyTarget = annualRiskFreeRate / TRADING_DAYS_PER_YEAR;
        double squared = 0.0;
        for (double value : returns) {
            double shortfall = Math.min(value - dailyTarget, 0.0);
            squared += shortfall * shortfall;
        }
        double downsideDeviation = Math.sqrt(squared / returns.length) * Math.sqrt(TRADING_DAYS_PER_YEAR);
        if (downsideDeviation == 0.0) {
            return Double.NaN;
        }
        return (mean(returns) * TRADING_DAYS_PER_YEAR - annualRiskFreeRate) / downsideDeviation;
    }

    /**
     * Largest peak-to-trough decline as a positive percentage, tracked with a running peak.
     */
    public static double maxDrawdownPct(double[] values) {
        if (values == null || values.length == 0) {
            return Double.NaN;
        }
        double peak = values[0];
        double maxDrawdown = 0.0;
        for (double value : values) {
            if (value > peak) {
                peak = value;
            }
            if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown * 100.0;
    }

    public static double annualizedReturnPct(double startValue, double endValue, long days) {
        if (days <= 0 || startValue <= 0.0 || endValue <= 0.0) {
            return Double.NaN;
        }
        return (Math.pow(endValue / startValue, 365.0 / days) - 1.0) * 100.0;
    }

    /**
     * One-period 95% historical value-at-risk as a positive loss percentage.
     */
    public static double valueAtRisk95Pct(double[] returns) {
        if (returns == null || returns.length == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(returns, returns.length);
        Arrays.sort(sorted);
        int index = (int) Math.floor(0.05 * sorted.length);
        return -sorted[Math.min(index, sorted.length - 1)] * 100.0;
    }

    /**
     * Mean asset return over mean benchmark return on benchmark up (or down) periods, as a percentage.
     */
    public static double captureRatioPct(double[] assetReturns, double[] benchmarkReturns, boolean upside) {
        if (assetReturns == null || benchmarkReturns == null || assetReturns.length != benchmarkReturns.length) {
            return Double.NaN;
        }
        double assetSum = 0.0;
        double benchmarkSum = 0.0;
        int count = 0;
        for (int i = 0; i < benchmarkReturns.length; i++) {
            boolean matches = upside ? benchmarkReturns[i] > 0.0 : benchmarkReturns[i] < 0.0;
            if (matches) {
                assetSum += assetReturns[i];
                benchmarkSum += benchmarkReturns[i];
                count++;
            }
        }
        if (count == 0 || benchmarkSum == 0.0) {
            return Double.NaN;
        }
        return (assetSum / count) / (benchmarkSum / count) * 100.0;
    }

    public static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
