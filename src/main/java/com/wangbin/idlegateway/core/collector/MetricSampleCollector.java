package com.wangbin.idlegateway.core.collector;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.common.exception.CollectorException;
import com.wangbin.idlegateway.common.utils.DateUtil;
import com.wangbin.idlegateway.core.analysis.catalog.KindProfile;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.collector.source.MetricSource;
import com.wangbin.idlegateway.core.collector.statistics.CollectionStatistics;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;
import com.wangbin.idlegateway.core.collector.window.WindowChunker;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 指标采样收集器
 * 按子窗口顺序拉取单个 (网关, 指标) 的全部采样并拼接成有序序列
 */
@Slf4j
@Component
public class MetricSampleCollector {

    private final MetricSource metricSource;
    private final AnalyzerProperties properties;
    private final CollectionStatistics statistics;

    public MetricSampleCollector(MetricSource metricSource,
                                 AnalyzerProperties properties,
                                 CollectionStatistics statistics) {
        this.metricSource = metricSource;
        this.properties = properties;
        this.statistics = statistics;
    }

    /**
     * 收集 [start, end) 内单个指标的采样
     *
     * @throws CollectorException 任一子窗口拉取失败，已拉取的部分结果全部丢弃
     */
    public List<MetricSample> collect(Gateway gateway, String metricName, Instant start, Instant end) {
        KindProfile profile = MetricCatalog.profile(gateway.getKind());
        if (!profile.contains(metricName)) {
            throw BusinessException.paramError(
                    "指标不属于 " + gateway.getKind() + " 指标目录: " + metricName);
        }
        Duration maxChunk = properties.getChunkDuration();
        Iterable<TimeWindow> windows = WindowChunker.chunk(start, end, maxChunk);

        if (profile.probeBeforeFetch()) {
            if (!probe(gateway, metricName)) {
                log.info("  No data for {}", metricName);
                return zeroFill(gateway, metricName, start);
            }
            log.info("  Found {}", metricName);
        }

        // 子窗口按时间先后拼接，同一时间戳只保留第一次出现的采样
        Map<Instant, MetricSample> byTimestamp = new LinkedHashMap<>();
        for (TimeWindow window : windows) {
            List<MetricSample> chunk = fetchChunk(gateway, metricName, window);
            for (MetricSample sample : chunk) {
                MetricSample previous = byTimestamp.putIfAbsent(sample.getTimestamp(), sample);
                if (previous != null) {
                    log.debug("重复采样已忽略: gateway={}, metric={}, timestamp={}",
                            gateway.getId(), metricName, sample.getTimestamp());
                }
            }
        }

        if (byTimestamp.isEmpty() && profile.probeBeforeFetch()) {
            return zeroFill(gateway, metricName, start);
        }
        return new ArrayList<>(byTimestamp.values());
    }

    private boolean probe(Gateway gateway, String metricName) {
        try {
            boolean exists = metricSource.exists(gateway, metricName);
            statistics.probed(gateway.getId());
            return exists;
        } catch (CollectorException e) {
            statistics.fetchFailed(gateway.getId());
            throw e;
        } catch (RuntimeException e) {
            statistics.fetchFailed(gateway.getId());
            throw CollectorException.probeException(gateway.getId(), metricName, e);
        }
    }

    private List<MetricSample> fetchChunk(Gateway gateway, String metricName, TimeWindow window) {
        long begin = System.currentTimeMillis();
        List<MetricSample> chunk;
        try {
            chunk = metricSource.fetch(gateway, metricName, window);
        } catch (CollectorException e) {
            statistics.fetchFailed(gateway.getId());
            if (e.getWindow() != null) {
                throw e;
            }
            throw CollectorException.fetchException(gateway.getId(), metricName, window, e);
        } catch (RuntimeException e) {
            statistics.fetchFailed(gateway.getId());
            throw CollectorException.fetchException(gateway.getId(), metricName, window, e);
        }
        if (chunk == null) {
            chunk = List.of();
        }
        statistics.chunkFetched(gateway.getId(), chunk.size(), System.currentTimeMillis() - begin);
        log.debug("拉取完成: gateway={}, metric={}, window={} ({}), samples={}",
                gateway.getId(), metricName, window, DateUtil.formatDuration(window.duration()), chunk.size());

        List<MetricSample> ordered = new ArrayList<>(chunk);
        ordered.sort(Comparator.comparing(MetricSample::getTimestamp));
        return ordered;
    }

    private List<MetricSample> zeroFill(Gateway gateway, String metricName, Instant start) {
        statistics.zeroFilled(gateway.getId());
        List<MetricSample> samples = new ArrayList<>(1);
        samples.add(MetricSample.zero(gateway.getId(), metricName, start));
        return samples;
    }
}
