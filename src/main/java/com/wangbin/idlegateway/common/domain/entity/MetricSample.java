package com.wangbin.idlegateway.common.domain.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 指标采样点
 * 同一 (gatewayId, metricName, timestamp) 只出现一次
 */
@Value
@Builder
public class MetricSample {

    String gatewayId;

    String metricName;

    /**
     * 周期起点
     */
    Instant timestamp;

    double sum;

    double average;

    double maximum;

    double minimum;

    /**
     * 零值占位采样（指标无数据时使用）
     */
    public static MetricSample zero(String gatewayId, String metricName, Instant timestamp) {
        return MetricSample.builder()
                .gatewayId(gatewayId)
                .metricName(metricName)
                .timestamp(timestamp)
                .build();
    }
}
