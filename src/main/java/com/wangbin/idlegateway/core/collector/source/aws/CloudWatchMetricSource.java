package com.wangbin.idlegateway.core.collector.source.aws;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.exception.CollectorException;
import com.wangbin.idlegateway.core.collector.source.MetricSource;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.DimensionFilter;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsRequest;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.util.ArrayList;
import java.util.List;

/**
 * CloudWatch 指标数据源
 */
@Slf4j
@Component
public class CloudWatchMetricSource implements MetricSource {

    private final CloudWatchClient cloudWatchClient;
    private final AnalyzerProperties properties;

    public CloudWatchMetricSource(CloudWatchClient cloudWatchClient, AnalyzerProperties properties) {
        this.cloudWatchClient = cloudWatchClient;
        this.properties = properties;
    }

    @Override
    public List<MetricSample> fetch(Gateway gateway, String metricName, TimeWindow window) {
        GatewayKind kind = gateway.getKind();
        GetMetricStatisticsRequest request = GetMetricStatisticsRequest.builder()
                .namespace(kind.getNamespace())
                .metricName(metricName)
                .dimensions(Dimension.builder()
                        .name(kind.getDimensionName())
                        .value(gateway.getId())
                        .build())
                .startTime(window.start())
                .endTime(window.end())
                .period(Math.toIntExact(properties.getPeriodSeconds()))
                .statistics(Statistic.SUM, Statistic.AVERAGE, Statistic.MAXIMUM, Statistic.MINIMUM)
                .build();

        GetMetricStatisticsResponse response;
        try {
            response = cloudWatchClient.getMetricStatistics(request);
        } catch (SdkException ex) {
            throw CollectorException.fetchException(gateway.getId(), metricName, window, ex);
        }

        List<MetricSample> samples = new ArrayList<>(response.datapoints().size());
        for (Datapoint datapoint : response.datapoints()) {
            samples.add(MetricSample.builder()
                    .gatewayId(gateway.getId())
                    .metricName(metricName)
                    .timestamp(datapoint.timestamp())
                    .sum(valueOrZero(datapoint.sum()))
                    .average(valueOrZero(datapoint.average()))
                    .maximum(valueOrZero(datapoint.maximum()))
                    .minimum(valueOrZero(datapoint.minimum()))
                    .build());
        }
        return samples;
    }

    @Override
    public boolean exists(Gateway gateway, String metricName) {
        GatewayKind kind = gateway.getKind();
        ListMetricsRequest request = ListMetricsRequest.builder()
                .namespace(kind.getNamespace())
                .metricName(metricName)
                .dimensions(DimensionFilter.builder()
                        .name(kind.getDimensionName())
                        .value(gateway.getId())
                        .build())
                .build();
        try {
            ListMetricsResponse response = cloudWatchClient.listMetrics(request);
            return response.hasMetrics() && !response.metrics().isEmpty();
        } catch (SdkException ex) {
            throw CollectorException.probeException(gateway.getId(), metricName, ex);
        }
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }
}
