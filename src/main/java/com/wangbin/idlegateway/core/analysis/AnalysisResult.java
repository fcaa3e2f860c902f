package com.wangbin.idlegateway.core.analysis;

import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次分析运行的结果
 */
@Value
@Builder
public class AnalysisResult {

    TimeWindow window;

    int lookbackDays;

    /**
     * 汇总，按输入网关顺序
     */
    List<AnalysisSummary> summaries;

    /**
     * 明细采样：gatewayId -> 有序采样
     */
    Map<String, List<MetricSample>> samplesByGateway;

    /**
     * 失败网关：gatewayId -> 错误信息
     */
    Map<String, String> failures;

    public List<MetricSample> allSamples() {
        return samplesByGateway.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    /**
     * 没有任何采样
     */
    public boolean hasNoSamples() {
        return samplesByGateway.values().stream().allMatch(List::isEmpty);
    }
}
