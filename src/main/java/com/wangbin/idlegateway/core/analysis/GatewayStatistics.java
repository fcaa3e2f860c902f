package com.wangbin.idlegateway.core.analysis;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 单个网关的聚合统计
 */
@Value
@Builder
public class GatewayStatistics {

    Gateway gateway;

    long totalPeriods;

    long idlePeriods;

    double idlePercentage;

    /**
     * 分组求和，缺失的指标组为 0
     */
    Map<SummaryField, Double> totals;

    /**
     * 活跃连接数峰值（仅 NAT）
     */
    double maxActiveConnections;

    /**
     * 活跃连接数均值（仅 NAT）
     */
    double avgActiveConnections;

    /**
     * 全部采样 sum 均为 0
     */
    boolean allSumsZero;

    public double total(SummaryField field) {
        if (totals == null) {
            return 0.0;
        }
        return totals.getOrDefault(field, 0.0);
    }
}
