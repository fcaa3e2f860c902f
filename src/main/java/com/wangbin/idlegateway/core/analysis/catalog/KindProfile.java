package com.wangbin.idlegateway.core.analysis.catalog;

import com.wangbin.idlegateway.common.enums.GatewayKind;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单一网关类型的指标配置
 *
 * @param kind               网关类型
 * @param metrics            按拉取顺序排列的指标目录
 * @param trafficMetrics     参与空闲判定的流量指标（名称含 Bytes / Packets）
 * @param fieldGroups        汇总字段 -> 来源指标
 * @param connectionMetric   活跃连接数指标，没有则为 null
 * @param probeBeforeFetch   拉取前先探测指标是否存在，不存在时补零
 * @param statusClassified   是否输出 Active / Inactive 状态
 */
public record KindProfile(GatewayKind kind,
                          List<String> metrics,
                          Set<String> trafficMetrics,
                          Map<SummaryField, List<String>> fieldGroups,
                          String connectionMetric,
                          boolean probeBeforeFetch,
                          boolean statusClassified) {

    public boolean contains(String metricName) {
        return metrics.contains(metricName);
    }

    public boolean isTrafficMetric(String metricName) {
        return trafficMetrics.contains(metricName);
    }

    public boolean hasConnectionMetric() {
        return connectionMetric != null;
    }
}
