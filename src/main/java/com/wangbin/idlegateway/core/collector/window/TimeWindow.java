package com.wangbin.idlegateway.core.collector.window;

import java.time.Duration;
import java.time.Instant;

/**
 * 左闭右开时间窗口 [start, end)
 */
public record TimeWindow(Instant start, Instant end) {

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
