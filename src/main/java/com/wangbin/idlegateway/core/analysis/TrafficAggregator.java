package com.wangbin.idlegateway.core.analysis;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.utils.NumberUtil;
import com.wangbin.idlegateway.core.analysis.catalog.KindProfile;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 流量/空闲聚合器
 * <p>
 * 一次遍历完成：
 * <ul>
 *     <li>totalPeriods：该网关所有指标出现过的不同时间戳数</li>
 *     <li>idlePeriods：出现过流量指标且这些流量采样 sum 全为 0 的时间戳数。
 *     不校验该时间戳下流量指标是否齐全，部分指标缺失时仍可能判为空闲</li>
 *     <li>按指标目录分组求和，缺失的指标组记为 0</li>
 * </ul>
 */
@Slf4j
@Component
public class TrafficAggregator {

    public GatewayStatistics aggregate(Gateway gateway, List<MetricSample> samples) {
        KindProfile profile = MetricCatalog.profile(gateway.getKind());
        Map<String, List<SummaryField>> fieldsByMetric = invert(profile.fieldGroups());

        Set<Instant> timestamps = new HashSet<>();
        // 时间戳 -> 该时刻已观测到的流量采样是否全为 0
        Map<Instant, Boolean> trafficZeroAt = new HashMap<>();
        Map<SummaryField, Double> totals = new EnumMap<>(SummaryField.class);
        for (SummaryField field : profile.fieldGroups().keySet()) {
            totals.put(field, 0.0);
        }

        boolean allSumsZero = true;
        boolean connectionSeen = false;
        double maxActive = 0.0;
        double activeAverageSum = 0.0;
        int activeCount = 0;
        int ignored = 0;

        for (MetricSample sample : samples) {
            if (!gateway.getId().equals(sample.getGatewayId()) || !profile.contains(sample.getMetricName())) {
                ignored++;
                continue;
            }
            String metric = sample.getMetricName();
            Instant timestamp = sample.getTimestamp();
            double sum = sample.getSum();

            timestamps.add(timestamp);
            if (sum != 0.0) {
                allSumsZero = false;
            }
            if (profile.isTrafficMetric(metric)) {
                trafficZeroAt.merge(timestamp, sum == 0.0, Boolean::logicalAnd);
            }
            for (SummaryField field : fieldsByMetric.getOrDefault(metric, Collections.emptyList())) {
                totals.merge(field, sum, Double::sum);
            }
            if (metric.equals(profile.connectionMetric())) {
                maxActive = connectionSeen ? Math.max(maxActive, sample.getMaximum()) : sample.getMaximum();
                activeAverageSum += sample.getAverage();
                activeCount++;
                connectionSeen = true;
            }
        }

        if (ignored > 0) {
            log.warn("网关 {} 有 {} 条采样不属于其指标目录，已忽略", gateway.getId(), ignored);
        }

        long totalPeriods = timestamps.size();
        long idlePeriods = trafficZeroAt.values().stream().filter(Boolean::booleanValue).count();

        return GatewayStatistics.builder()
                .gateway(gateway)
                .totalPeriods(totalPeriods)
                .idlePeriods(idlePeriods)
                .idlePercentage(NumberUtil.percentage(idlePeriods, totalPeriods))
                .totals(Collections.unmodifiableMap(totals))
                .maxActiveConnections(maxActive)
                .avgActiveConnections(activeCount > 0 ? activeAverageSum / activeCount : 0.0)
                .allSumsZero(allSumsZero)
                .build();
    }

    private Map<String, List<SummaryField>> invert(Map<SummaryField, List<String>> fieldGroups) {
        Map<String, List<SummaryField>> fieldsByMetric = new HashMap<>();
        fieldGroups.forEach((field, metrics) -> {
            for (String metric : metrics) {
                fieldsByMetric.computeIfAbsent(metric, k -> new ArrayList<>()).add(field);
            }
        });
        return fieldsByMetric;
    }
}
