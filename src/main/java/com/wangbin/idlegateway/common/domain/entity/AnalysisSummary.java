package com.wangbin.idlegateway.common.domain.entity;

import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.enums.GatewayStatus;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 网关分析汇总
 * 每个网关一条，构造后不可变
 */
@Value
@Builder
public class AnalysisSummary {

    // ===== 身份信息 =====
    String gatewayId;

    GatewayKind kind;

    String gatewayName;

    String networkId;

    String networkName;

    // ===== 空闲统计 =====
    long totalPeriods;

    long idlePeriods;

    /**
     * 空闲百分比（0-100，两位小数）
     */
    double idlePercentage;

    // ===== 流量汇总 =====
    /**
     * 按类型分组的求和结果
     */
    Map<SummaryField, Double> totals;

    double totalBytes;

    double totalPackets;

    double bytesPerSecondAvg;

    double packetsPerSecondAvg;

    /**
     * 活跃连接数峰值，IGW 为 null
     */
    Double maxActiveConnections;

    /**
     * 活跃连接数均值，IGW 为 null
     */
    Double avgActiveConnections;

    /**
     * 活跃状态，NAT 为 null
     */
    GatewayStatus status;

    public double total(SummaryField field) {
        return totals.getOrDefault(field, 0.0);
    }
}
