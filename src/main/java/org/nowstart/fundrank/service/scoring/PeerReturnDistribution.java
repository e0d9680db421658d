package org.nowstart.fundrank.service.scoring;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.type.ReturnPeriod;

/**
 * Peer group return samples per period, sorted from best to worst.
 */
public final class PeerReturnDistribution {

    private static final PeerReturnDistribution EMPTY = new PeerReturnDistribution(new EnumMap<>(ReturnPeriod.class));

    private final Map<ReturnPeriod, double[]> descendingReturns;

    private PeerReturnDistribution(Map<ReturnPeriod, double[]> descendingReturns) {
        this.descendingReturns = descendingReturns;
    }

    public static PeerReturnDistribution empty() {
        return EMPTY;
    }

    public static PeerReturnDistribution of(Collection<MetricSet> peers) {
        Map<ReturnPeriod, double[]> samples = new EnumMap<>(ReturnPeriod.class);
        for (ReturnPeriod period : ReturnPeriod.values()) {
            double[] ascending = peers.stream()
                    .map(metrics -> metrics.scoringReturn(period))
                    .filter(value -> value != null && Double.isFinite(value))
                    .mapToDouble(Double::doubleValue)
                    .sorted()
                    .toArray();
            double[] descending = new double[ascending.length];
            for (int i = 0; i < ascending.length; i++) {
                descending[i] = ascending[ascending.length - 1 - i];
            }
            samples.put(period, descending);
        }
        return new PeerReturnDistribution(samples);
    }

    public int sampleSize(ReturnPeriod period) {
        double[] values = descendingReturns.get(period);
        return values == null ? 0 : values.length;
    }

    /**
     * Position of the first peer value not above {@code value}, as a percentage of the sample (0 = best).
     */
    public double percentileOf(ReturnPeriod period, double value) {
        double[] values = descendingReturns.get(period);
        if (values == null || values.length == 0) {
            return Double.NaN;
        }
        int position = values.length;
        for (int i = 0; i < values.length; i++) {
            if (values[i] <= value) {
                position = i;
                break;
            }
        }
        return position * 100.0 / values.length;
    }
}
