package com.energy.reconcile.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个累计计数器的有序读数序列。
 * 目标不变式：两个相邻已知值满足 value[i+1] >= value[i]。
 */
public class CumulativeSeries {

    private final String name;
    private final List<Instant> timestamps;
    private final ValueColumn values;

    public CumulativeSeries(String name, List<Instant> timestamps, ValueColumn values) {
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException("Series '" + name + "' has " + timestamps.size()
                    + " timestamps but " + values.size() + " values");
        }
        this.name = name;
        this.timestamps = timestamps;
        this.values = values;
    }

    public String getName() { return name; }
    public List<Instant> getTimestamps() { return timestamps; }
    public ValueColumn getValues() { return values; }

    public int size() {
        return timestamps.size();
    }

    public Reading getReading(int row) {
        return new Reading(timestamps.get(row), values.get(row));
    }

    public List<Reading> readings() {
        List<Reading> result = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            result.add(getReading(i));
        }
        return result;
    }
}
