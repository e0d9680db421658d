package org.nowstart.fundrank.data.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.nowstart.fundrank.data.type.ScoreComponent;
import org.nowstart.fundrank.data.type.DataStatus;

public record CompositeScore(
        Map<ScoreComponent, Double> components,
        double returnsTotal,
        double riskTotal,
        double fundamentalsTotal,
        double otherTotal,
        double total,
        DataStatus status
) {

    public CompositeScore {
        EnumMap<ScoreComponent, Double> copy = new EnumMap<>(ScoreComponent.class);
        if (components != null) {
            copy.putAll(components);
        }
        components = Collections.unmodifiableMap(copy);
    }
}
