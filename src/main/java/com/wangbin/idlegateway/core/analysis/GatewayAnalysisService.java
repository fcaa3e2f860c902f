package com.wangbin.idlegateway.core.analysis;

import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.core.analysis.catalog.KindProfile;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.collector.MetricSampleCollector;
import com.wangbin.idlegateway.core.collector.statistics.CollectionStatistics;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 网关分析服务
 * 每个网关独立执行 拉取 -> 聚合 -> 汇总，网关之间按线程池并行，结果按输入顺序汇合。
 * 单个网关失败只记录在结果中，不影响其他网关。
 */
@Slf4j
@Service
public class GatewayAnalysisService {

    private final MetricSampleCollector collector;
    private final TrafficAggregator aggregator;
    private final SummaryBuilder summaryBuilder;
    private final CollectionStatistics statistics;
    private final AnalyzerProperties properties;
    private final Executor executor;
    private final Clock clock;

    public GatewayAnalysisService(MetricSampleCollector collector,
                                  TrafficAggregator aggregator,
                                  SummaryBuilder summaryBuilder,
                                  CollectionStatistics statistics,
                                  AnalyzerProperties properties,
                                  @Qualifier("gatewayAnalysisExecutor") Executor executor,
                                  Clock clock) {
        this.collector = collector;
        this.aggregator = aggregator;
        this.summaryBuilder = summaryBuilder;
        this.statistics = statistics;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 分析最近 lookbackDays 天内的网关空闲情况
     */
    public AnalysisResult analyze(List<Gateway> gateways, int lookbackDays) {
        if (gateways == null || gateways.stream().anyMatch(Objects::isNull)) {
            throw BusinessException.paramError("网关列表不能为空");
        }
        if (lookbackDays < 1) {
            throw BusinessException.paramError("回溯天数必须大于0: " + lookbackDays);
        }
        Instant end = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant start = end.minus(Duration.ofDays(lookbackDays));
        TimeWindow window = new TimeWindow(start, end);
        log.info("开始分析 {} 个网关, 时间窗口: {}", gateways.size(), window);
        statistics.clearAllStatistics();

        List<CompletableFuture<GatewayAnalysis>> futures = new ArrayList<>(gateways.size());
        for (Gateway gateway : gateways) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzeGateway(gateway, window), executor));
        }

        List<AnalysisSummary> summaries = new ArrayList<>();
        Map<String, List<MetricSample>> samplesByGateway = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (int i = 0; i < gateways.size(); i++) {
            Gateway gateway = gateways.get(i);
            try {
                GatewayAnalysis analysis = futures.get(i).join();
                summaries.add(analysis.summary());
                samplesByGateway.put(gateway.getId(), analysis.samples());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("网关分析失败: {} ({})", gateway.getDisplayName(), gateway.getId(), cause);
                failures.put(gateway.getId(), cause.getMessage());
            }
        }

        log.info("分析完成: 成功 {} 个, 失败 {} 个", summaries.size(), failures.size());
        log.debug("拉取统计汇总: {}", statistics.getAllStatistics());
        return AnalysisResult.builder()
                .window(window)
                .lookbackDays(lookbackDays)
                .summaries(List.copyOf(summaries))
                .samplesByGateway(Collections.unmodifiableMap(samplesByGateway))
                .failures(Collections.unmodifiableMap(failures))
                .build();
    }

    private GatewayAnalysis analyzeGateway(Gateway gateway, TimeWindow window) {
        if (gateway.getId() == null) {
            throw BusinessException.paramError("网关ID不能为空");
        }
        KindProfile profile = MetricCatalog.profile(gateway.getKind());
        log.info("Collecting metrics for {}: {} ({})",
                gateway.getKind().getDescription(), gateway.getDisplayName(), gateway.getId());
        log.info("  VPC: {} ({})", gateway.getNetworkName(), gateway.getNetworkId());

        List<MetricSample> samples = new ArrayList<>();
        for (String metricName : profile.metrics()) {
            samples.addAll(collector.collect(gateway, metricName, window.start(), window.end()));
        }

        GatewayStatistics gatewayStatistics = aggregator.aggregate(gateway, samples);
        AnalysisSummary summary = summaryBuilder.build(gatewayStatistics, properties.getPeriodSeconds());
        log.debug("网关 {} 拉取统计: {}", gateway.getId(), statistics.getGatewayStatistics(gateway.getId()));
        return new GatewayAnalysis(summary, List.copyOf(samples));
    }

    private record GatewayAnalysis(AnalysisSummary summary, List<MetricSample> samples) {
    }
}
