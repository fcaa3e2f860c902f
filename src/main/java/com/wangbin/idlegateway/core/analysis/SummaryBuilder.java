package com.wangbin.idlegateway.core.analysis;

import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.enums.GatewayStatus;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.common.utils.NumberUtil;
import com.wangbin.idlegateway.core.analysis.catalog.KindProfile;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 汇总构建器
 * 计算派生总量与平均速率，组装不可变的 {@link AnalysisSummary}
 */
@Component
public class SummaryBuilder {

    public AnalysisSummary build(GatewayStatistics statistics, long periodSeconds) {
        validate(statistics, periodSeconds);
        Gateway gateway = statistics.getGateway();
        KindProfile profile = MetricCatalog.profile(gateway.getKind());

        double totalBytes = statistics.total(SummaryField.BYTES_IN) + statistics.total(SummaryField.BYTES_OUT);
        double totalPackets = statistics.total(SummaryField.PACKETS_IN) + statistics.total(SummaryField.PACKETS_OUT);
        // 与空闲百分比一致，0 个周期时分母取 1
        long seconds = Math.max(statistics.getTotalPeriods() * periodSeconds, 1L);

        Map<SummaryField, Double> totals = new EnumMap<>(SummaryField.class);
        for (SummaryField field : profile.fieldGroups().keySet()) {
            totals.put(field, statistics.total(field));
        }

        return AnalysisSummary.builder()
                .gatewayId(gateway.getId())
                .kind(gateway.getKind())
                .gatewayName(gateway.getDisplayName())
                .networkId(gateway.getNetworkId())
                .networkName(gateway.getNetworkName())
                .totalPeriods(statistics.getTotalPeriods())
                .idlePeriods(statistics.getIdlePeriods())
                .idlePercentage(statistics.getIdlePercentage())
                .totals(Collections.unmodifiableMap(totals))
                .totalBytes(totalBytes)
                .totalPackets(totalPackets)
                .bytesPerSecondAvg(NumberUtil.round2(totalBytes / seconds))
                .packetsPerSecondAvg(NumberUtil.round2(totalPackets / seconds))
                .maxActiveConnections(profile.hasConnectionMetric() ? statistics.getMaxActiveConnections() : null)
                .avgActiveConnections(profile.hasConnectionMetric() ? statistics.getAvgActiveConnections() : null)
                .status(profile.statusClassified() ? GatewayStatus.of(statistics.isAllSumsZero()) : null)
                .build();
    }

    private void validate(GatewayStatistics statistics, long periodSeconds) {
        if (statistics == null || statistics.getGateway() == null) {
            throw BusinessException.paramError("聚合结果缺少网关信息");
        }
        if (statistics.getGateway().getKind() == null) {
            throw BusinessException.paramError("未知网关类型: " + statistics.getGateway().getId());
        }
        if (statistics.getTotalPeriods() < 0 || statistics.getIdlePeriods() < 0) {
            throw BusinessException.paramError(String.format("周期数不能为负: total=%d, idle=%d",
                    statistics.getTotalPeriods(), statistics.getIdlePeriods()));
        }
        if (statistics.getIdlePeriods() > statistics.getTotalPeriods()) {
            throw BusinessException.paramError(String.format("空闲周期数大于总周期数: total=%d, idle=%d",
                    statistics.getTotalPeriods(), statistics.getIdlePeriods()));
        }
        if (periodSeconds <= 0) {
            throw BusinessException.paramError("采样周期必须为正: " + periodSeconds);
        }
    }
}
