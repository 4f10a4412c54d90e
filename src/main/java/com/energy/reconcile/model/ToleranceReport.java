package com.energy.reconcile.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 对齐容差影响报告：不同容差下有多少读数能落入设备时钟或统一时钟的网格。
 */
public final class ToleranceReport {

    /** 单个设备、单列、单个容差的统计 */
    public static final class Entry {
        private final String device;
        private final String column;
        private final int toleranceSeconds;
        private final int knownReadings;
        private final int withinDeviceClock;
        private final int withinFleetClock;

        public Entry(String device, String column, int toleranceSeconds,
                     int knownReadings, int withinDeviceClock, int withinFleetClock) {
            this.device = device;
            this.column = column;
            this.toleranceSeconds = toleranceSeconds;
            this.knownReadings = knownReadings;
            this.withinDeviceClock = withinDeviceClock;
            this.withinFleetClock = withinFleetClock;
        }

        public String getDevice() { return device; }
        public String getColumn() { return column; }
        public int getToleranceSeconds() { return toleranceSeconds; }
        public int getKnownReadings() { return knownReadings; }
        public int getWithinDeviceClock() { return withinDeviceClock; }
        public int getWithinFleetClock() { return withinFleetClock; }

        @Override
        public String toString() {
            return device + "/" + column + " @" + toleranceSeconds + "s: device="
                    + withinDeviceClock + ", fleet=" + withinFleetClock + " of " + knownReadings;
        }
    }

    private final List<Entry> entries;

    public ToleranceReport(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /** 查找指定统计项，不存在时返回 null */
    public Entry find(String device, String column, int toleranceSeconds) {
        for (Entry e : entries) {
            if (e.device.equals(device) && e.column.equals(column) && e.toleranceSeconds == toleranceSeconds) {
                return e;
            }
        }
        return null;
    }
}
