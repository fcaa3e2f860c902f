package com.wangbin.idlegateway.core.collector.statistics;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 采集统计管理器
 * 只做观测，不参与聚合
 */
@Slf4j
@Service
public class CollectionStatistics {

    // 网关统计：gatewayId -> GatewayFetchStatistics
    private final Map<String, GatewayFetchStatistics> gatewayStatistics = new ConcurrentHashMap<>();

    /**
     * 记录一次子窗口拉取
     */
    public void chunkFetched(String gatewayId, int sampleCount, long executionTime) {
        stats(gatewayId).recordChunk(sampleCount, executionTime);
    }

    /**
     * 记录一次存在性探测
     */
    public void probed(String gatewayId) {
        stats(gatewayId).probes.incrementAndGet();
    }

    /**
     * 记录一次补零
     */
    public void zeroFilled(String gatewayId) {
        stats(gatewayId).zeroFills.incrementAndGet();
    }

    /**
     * 记录一次拉取失败
     */
    public void fetchFailed(String gatewayId) {
        stats(gatewayId).failures.incrementAndGet();
    }

    /**
     * 获取网关统计
     */
    public Map<String, Object> getGatewayStatistics(String gatewayId) {
        GatewayFetchStatistics stats = gatewayStatistics.get(gatewayId);
        if (stats != null) {
            return stats.getStatistics();
        }
        return Collections.emptyMap();
    }

    /**
     * 获取所有网关统计
     */
    public Map<String, Map<String, Object>> getAllStatistics() {
        Map<String, Map<String, Object>> allStats = new HashMap<>();
        for (Map.Entry<String, GatewayFetchStatistics> entry : gatewayStatistics.entrySet()) {
            allStats.put(entry.getKey(), entry.getValue().getStatistics());
        }
        return allStats;
    }

    /**
     * 清空所有统计
     */
    public void clearAllStatistics() {
        gatewayStatistics.clear();
    }

    private GatewayFetchStatistics stats(String gatewayId) {
        return gatewayStatistics.computeIfAbsent(gatewayId, GatewayFetchStatistics::new);
    }

    /**
     * 网关拉取统计内部类
     */
    @Getter
    private static class GatewayFetchStatistics {
        private final String gatewayId;

        private final AtomicInteger chunks = new AtomicInteger(0);
        private final AtomicInteger probes = new AtomicInteger(0);
        private final AtomicInteger zeroFills = new AtomicInteger(0);
        private final AtomicInteger failures = new AtomicInteger(0);
        private final AtomicLong samples = new AtomicLong(0);
        private final AtomicLong totalExecutionTime = new AtomicLong(0);

        GatewayFetchStatistics(String gatewayId) {
            this.gatewayId = gatewayId;
        }

        void recordChunk(int sampleCount, long executionTime) {
            chunks.incrementAndGet();
            samples.addAndGet(sampleCount);
            totalExecutionTime.addAndGet(executionTime);
        }

        Map<String, Object> getStatistics() {
            Map<String, Object> stats = new HashMap<>();
            stats.put("gatewayId", gatewayId);
            stats.put("chunks", chunks.get());
            stats.put("probes", probes.get());
            stats.put("zeroFills", zeroFills.get());
            stats.put("failures", failures.get());
            stats.put("samples", samples.get());
            stats.put("averageExecutionTime", chunks.get() > 0 ?
                    totalExecutionTime.get() / chunks.get() : 0);
            return stats;
        }
    }
}
