package com.wangbin.idlegateway.common.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NumberUtilTest {

    @Test
    void roundsHalfUp() {
        assertEquals(66.67, NumberUtil.round2(200.0 / 3));
        assertEquals(0.13, NumberUtil.round2(0.125));
        assertEquals(1.0, NumberUtil.round2(1.0));
    }

    @Test
    void percentageOfZeroTotalIsZero() {
        assertEquals(0.0, NumberUtil.percentage(0, 0));
        assertEquals(33.33, NumberUtil.percentage(1, 3));
        assertEquals(100.0, NumberUtil.percentage(4, 4));
    }

    @Test
    void durationFormat() {
        assertEquals("30d", DateUtil.formatDuration(Duration.ofDays(30)));
        assertEquals("5d 12h", DateUtil.formatDuration(Duration.ofDays(5).plusHours(12)));
        assertEquals("6h", DateUtil.formatDuration(Duration.ofHours(6)));
    }
}
