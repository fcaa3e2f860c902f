package com.wangbin.idlegateway.core.analysis.catalog;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.exception.BusinessException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 指标目录
 * 每种网关类型一份静态配置，驱动拉取、分组求和、补零与状态判定
 */
public final class MetricCatalog {

    // NAT Gateway 指标
    public static final String BYTES_IN_FROM_DESTINATION = "BytesInFromDestination";
    public static final String BYTES_IN_FROM_SOURCE = "BytesInFromSource";
    public static final String BYTES_OUT_TO_DESTINATION = "BytesOutToDestination";
    public static final String BYTES_OUT_TO_SOURCE = "BytesOutToSource";
    public static final String PACKETS_IN_FROM_DESTINATION = "PacketsInFromDestination";
    public static final String PACKETS_IN_FROM_SOURCE = "PacketsInFromSource";
    public static final String PACKETS_OUT_TO_DESTINATION = "PacketsOutToDestination";
    public static final String PACKETS_OUT_TO_SOURCE = "PacketsOutToSource";
    public static final String CONNECTION_ATTEMPT_COUNT = "ConnectionAttemptCount";
    public static final String CONNECTION_ESTABLISHED_COUNT = "ConnectionEstablishedCount";
    public static final String ERROR_PORT_ALLOCATION = "ErrorPortAllocation";
    public static final String IDLE_TIMEOUT_COUNT = "IdleTimeoutCount";
    public static final String ACTIVE_CONNECTION_COUNT = "ActiveConnectionCount";
    public static final String CONNECTION_ESTABLISHED_RATE = "ConnectionEstablishedRate";

    // Internet Gateway 丢包指标
    public static final String BYTES_DROP_BLACKHOLE = "BytesDropCountBlackholeIPv4";
    public static final String BYTES_DROP_NO_ROUTE = "BytesDropCountNoRouteIPv4";
    public static final String PACKETS_DROP_BLACKHOLE = "PacketsDropCountBlackholeIPv4";
    public static final String PACKETS_DROP_NO_ROUTE = "PacketsDropCountNoRouteIPv4";

    private static final Map<GatewayKind, KindProfile> PROFILES = new EnumMap<>(GatewayKind.class);

    static {
        PROFILES.put(GatewayKind.NAT, buildProfile(GatewayKind.NAT,
                ImmutableList.of(
                        BYTES_IN_FROM_DESTINATION,
                        BYTES_IN_FROM_SOURCE,
                        BYTES_OUT_TO_DESTINATION,
                        BYTES_OUT_TO_SOURCE,
                        PACKETS_IN_FROM_DESTINATION,
                        PACKETS_IN_FROM_SOURCE,
                        PACKETS_OUT_TO_DESTINATION,
                        PACKETS_OUT_TO_SOURCE,
                        CONNECTION_ATTEMPT_COUNT,
                        CONNECTION_ESTABLISHED_COUNT,
                        ERROR_PORT_ALLOCATION,
                        IDLE_TIMEOUT_COUNT,
                        ACTIVE_CONNECTION_COUNT,
                        CONNECTION_ESTABLISHED_RATE),
                ImmutableMap.<SummaryField, List<String>>builder()
                        .put(SummaryField.BYTES_IN, ImmutableList.of(BYTES_IN_FROM_SOURCE, BYTES_IN_FROM_DESTINATION))
                        .put(SummaryField.BYTES_OUT, ImmutableList.of(BYTES_OUT_TO_SOURCE, BYTES_OUT_TO_DESTINATION))
                        .put(SummaryField.PACKETS_IN, ImmutableList.of(PACKETS_IN_FROM_SOURCE, PACKETS_IN_FROM_DESTINATION))
                        .put(SummaryField.PACKETS_OUT, ImmutableList.of(PACKETS_OUT_TO_SOURCE, PACKETS_OUT_TO_DESTINATION))
                        .put(SummaryField.CONNECTION_ATTEMPTS, ImmutableList.of(CONNECTION_ATTEMPT_COUNT))
                        .put(SummaryField.CONNECTION_TIMEOUTS, ImmutableList.of(IDLE_TIMEOUT_COUNT))
                        .put(SummaryField.PORT_ALLOCATION_ERRORS, ImmutableList.of(ERROR_PORT_ALLOCATION))
                        .build(),
                ACTIVE_CONNECTION_COUNT,
                false,
                false));

        // IGW 只有 Destination 方向，不做 Source/Destination 合并
        PROFILES.put(GatewayKind.IGW, buildProfile(GatewayKind.IGW,
                ImmutableList.of(
                        BYTES_IN_FROM_DESTINATION,
                        BYTES_OUT_TO_DESTINATION,
                        PACKETS_IN_FROM_DESTINATION,
                        PACKETS_OUT_TO_DESTINATION,
                        BYTES_DROP_BLACKHOLE,
                        BYTES_DROP_NO_ROUTE,
                        PACKETS_DROP_BLACKHOLE,
                        PACKETS_DROP_NO_ROUTE),
                ImmutableMap.<SummaryField, List<String>>builder()
                        .put(SummaryField.BYTES_IN, ImmutableList.of(BYTES_IN_FROM_DESTINATION))
                        .put(SummaryField.BYTES_OUT, ImmutableList.of(BYTES_OUT_TO_DESTINATION))
                        .put(SummaryField.PACKETS_IN, ImmutableList.of(PACKETS_IN_FROM_DESTINATION))
                        .put(SummaryField.PACKETS_OUT, ImmutableList.of(PACKETS_OUT_TO_DESTINATION))
                        .put(SummaryField.BLACKHOLE_DROP_BYTES, ImmutableList.of(BYTES_DROP_BLACKHOLE))
                        .put(SummaryField.NOROUTE_DROP_BYTES, ImmutableList.of(BYTES_DROP_NO_ROUTE))
                        .put(SummaryField.BLACKHOLE_DROP_PACKETS, ImmutableList.of(PACKETS_DROP_BLACKHOLE))
                        .put(SummaryField.NOROUTE_DROP_PACKETS, ImmutableList.of(PACKETS_DROP_NO_ROUTE))
                        .build(),
                null,
                true,
                true));
    }

    private MetricCatalog() {
    }

    /**
     * 获取网关类型对应的指标配置
     */
    public static KindProfile profile(GatewayKind kind) {
        if (kind == null) {
            throw BusinessException.paramError("网关类型不能为空");
        }
        KindProfile profile = PROFILES.get(kind);
        if (profile == null) {
            throw BusinessException.paramError("未知网关类型: " + kind);
        }
        return profile;
    }

    /**
     * 流量指标：名称包含 Bytes 或 Packets
     */
    static boolean isTrafficName(String metricName) {
        return metricName.contains("Bytes") || metricName.contains("Packets");
    }

    private static KindProfile buildProfile(GatewayKind kind,
                                            List<String> metrics,
                                            Map<SummaryField, List<String>> fieldGroups,
                                            String connectionMetric,
                                            boolean probeBeforeFetch,
                                            boolean statusClassified) {
        ImmutableSet<String> trafficMetrics = metrics.stream()
                .filter(MetricCatalog::isTrafficName)
                .collect(ImmutableSet.toImmutableSet());
        return new KindProfile(kind, metrics, trafficMetrics, fieldGroups,
                connectionMetric, probeBeforeFetch, statusClassified);
    }
}
