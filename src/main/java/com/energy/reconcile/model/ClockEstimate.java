package com.energy.reconcile.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 时钟估计结果：每个设备各自的时钟，以及基于全部时间戳求出的统一时钟。
 */
public final class ClockEstimate {

    private final Map<String, Clock> deviceClocks;
    private final Clock fleetClock;

    public ClockEstimate(Map<String, Clock> deviceClocks, Clock fleetClock) {
        this.deviceClocks = Collections.unmodifiableMap(new LinkedHashMap<>(deviceClocks));
        this.fleetClock = fleetClock;
    }

    public Map<String, Clock> getDeviceClocks() { return deviceClocks; }
    public Clock getFleetClock() { return fleetClock; }

    public Clock getDeviceClock(String device) {
        return deviceClocks.get(device);
    }
}
