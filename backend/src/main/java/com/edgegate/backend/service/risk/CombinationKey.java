package com.edgegate.backend.service.risk;

import com.edgegate.backend.model.ConditionDimension;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

public record CombinationKey(String strategyId, Map<ConditionDimension, String> conditions) {

    public CombinationKey {
        EnumMap<ConditionDimension, String> copy = new EnumMap<>(ConditionDimension.class);
        copy.putAll(conditions);
        conditions = Collections.unmodifiableMap(copy);
    }

    public boolean matches(String strategy, Map<ConditionDimension, String> labels) {
        if (!strategyId.equals(strategy)) {
            return false;
        }
        for (Map.Entry<ConditionDimension, String> condition : conditions.entrySet()) {
            if (!condition.getValue().equals(labels.get(condition.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return strategyId + "|" + conditions.values().stream().collect(Collectors.joining("|"));
    }
}
