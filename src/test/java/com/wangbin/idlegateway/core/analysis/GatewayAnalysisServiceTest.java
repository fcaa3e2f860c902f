package com.wangbin.idlegateway.core.analysis;

import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.enums.GatewayStatus;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import com.wangbin.idlegateway.core.collector.FakeMetricSource;
import com.wangbin.idlegateway.core.collector.MetricSampleCollector;
import com.wangbin.idlegateway.core.collector.statistics.CollectionStatistics;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GatewayAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00.500Z");
    private static final Instant END = Instant.parse("2024-04-01T00:00:00Z");
    private static final Instant START = END.minus(Duration.ofDays(90));

    private final Gateway nat = Gateway.builder()
            .id("nat-1").kind(GatewayKind.NAT).displayName("egress").networkId("vpc-1").networkName("main").build();
    private final Gateway igw = Gateway.builder()
            .id("igw-1").kind(GatewayKind.IGW).displayName("igw-1").networkId("vpc-2").networkName("vpc-2").build();

    private FakeMetricSource source;
    private AnalyzerProperties properties;
    private CollectionStatistics statistics;

    @BeforeEach
    void setUp() {
        source = new FakeMetricSource();
        properties = new AnalyzerProperties();
        statistics = new CollectionStatistics();
    }

    @Test
    void igwWithoutAnyMetricIsFullyIdleAndInactive() {
        for (String metric : MetricCatalog.profile(GatewayKind.IGW).metrics()) {
            source.missing("igw-1", metric);
        }

        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(igw), 90);

        AnalysisSummary summary = result.getSummaries().get(0);
        assertEquals(1, summary.getTotalPeriods());
        assertEquals(1, summary.getIdlePeriods());
        assertEquals(100.0, summary.getIdlePercentage());
        assertEquals(GatewayStatus.INACTIVE, summary.getStatus());
        assertEquals(0.0, summary.getTotalBytes());

        List<MetricSample> samples = result.getSamplesByGateway().get("igw-1");
        assertEquals(8, samples.size());
        assertTrue(samples.stream().allMatch(s -> s.getTimestamp().equals(START) && s.getSum() == 0.0));
        assertTrue(source.getFetchedWindows().isEmpty());
    }

    @Test
    void windowEndsAtTheClockTruncatedToSeconds() {
        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(nat), 90);

        assertEquals(START, result.getWindow().start());
        assertEquals(END, result.getWindow().end());
        assertEquals(90, result.getLookbackDays());
        // 90 天按 30 天切分，NAT 每个指标 3 次拉取
        assertEquals(3 * MetricCatalog.profile(GatewayKind.NAT).metrics().size(), source.getFetchedWindows().size());
        assertTrue(result.hasNoSamples());
        assertEquals(0, result.getSummaries().get(0).getTotalPeriods());
    }

    @Test
    void natSamplesFlowIntoTheSummary() {
        Instant t1 = START.plus(Duration.ofHours(6));
        Instant t2 = START.plus(Duration.ofDays(45));
        source.add("nat-1", MetricCatalog.BYTES_IN_FROM_SOURCE, t1, 0)
                .add("nat-1", MetricCatalog.BYTES_OUT_TO_DESTINATION, t1, 0)
                .add("nat-1", MetricCatalog.BYTES_IN_FROM_SOURCE, t2, 21600)
                .add("nat-1", MetricCatalog.BYTES_OUT_TO_DESTINATION, t2, 21600);

        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(nat), 90);

        AnalysisSummary summary = result.getSummaries().get(0);
        assertEquals(2, summary.getTotalPeriods());
        assertEquals(1, summary.getIdlePeriods());
        assertEquals(50.0, summary.getIdlePercentage());
        assertEquals(21600.0, summary.total(SummaryField.BYTES_IN));
        assertEquals(43200.0, summary.getTotalBytes());
        assertEquals(1.0, summary.getBytesPerSecondAvg());
        assertEquals(4, result.allSamples().size());
        assertFalse(result.hasNoSamples());
    }

    @Test
    void failingGatewayDoesNotAffectOthers() {
        Gateway broken = Gateway.builder().id("nat-2").kind(GatewayKind.NAT).displayName("broken").build();
        source.failWhenWindowContains("nat-2", MetricCatalog.PACKETS_OUT_TO_SOURCE, START.plus(Duration.ofDays(70)));
        for (String metric : MetricCatalog.profile(GatewayKind.IGW).metrics()) {
            source.missing("igw-1", metric);
        }

        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(nat, broken, igw), 90);

        assertEquals(List.of("nat-1", "igw-1"),
                result.getSummaries().stream().map(AnalysisSummary::getGatewayId).toList());
        assertEquals(1, result.getFailures().size());
        assertTrue(result.getFailures().get("nat-2").contains(MetricCatalog.PACKETS_OUT_TO_SOURCE));
        assertFalse(result.getSamplesByGateway().containsKey("nat-2"));
    }

    @Test
    void resultMapsAreReadOnly() {
        Gateway unknown = Gateway.builder().id("gw-x").displayName("gw-x").build();

        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(unknown, nat), 90);

        assertThrows(UnsupportedOperationException.class, () -> result.getFailures().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> result.getSamplesByGateway().put("nat-9", List.of()));
    }

    @Test
    void gatewayWithoutKindBecomesAFailure() {
        Gateway unknown = Gateway.builder().id("gw-x").displayName("gw-x").build();

        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(unknown, nat), 90);

        assertEquals(1, result.getSummaries().size());
        assertTrue(result.getFailures().containsKey("gw-x"));
    }

    @Test
    void parallelRunKeepsInputOrder() {
        List<Gateway> gateways = List.of(
                Gateway.builder().id("nat-a").kind(GatewayKind.NAT).displayName("a").build(),
                Gateway.builder().id("nat-b").kind(GatewayKind.NAT).displayName("b").build(),
                Gateway.builder().id("nat-c").kind(GatewayKind.NAT).displayName("c").build(),
                Gateway.builder().id("nat-d").kind(GatewayKind.NAT).displayName("d").build());
        for (Gateway gateway : gateways) {
            source.add(gateway.getId(), MetricCatalog.BYTES_IN_FROM_SOURCE, START.plus(Duration.ofDays(1)), 10);
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            AnalysisResult result = service(executor).analyze(gateways, 90);

            assertEquals(List.of("nat-a", "nat-b", "nat-c", "nat-d"),
                    result.getSummaries().stream().map(AnalysisSummary::getGatewayId).toList());
            assertTrue(result.getFailures().isEmpty());
            result.getSummaries().forEach(s -> assertEquals(10.0, s.total(SummaryField.BYTES_IN)));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void invalidArgumentsAreRejected() {
        GatewayAnalysisService service = service(MoreExecutors.directExecutor());

        assertThrows(BusinessException.class, () -> service.analyze(List.of(nat), 0));
        assertThrows(BusinessException.class, () -> service.analyze(null, 90));
    }

    @Test
    void emptyGatewayListGivesEmptyResult() {
        AnalysisResult result = service(MoreExecutors.directExecutor()).analyze(List.of(), 30);

        assertTrue(result.getSummaries().isEmpty());
        assertTrue(result.getFailures().isEmpty());
        assertTrue(result.hasNoSamples());
    }

    private GatewayAnalysisService service(Executor executor) {
        MetricSampleCollector collector = new MetricSampleCollector(source, properties, statistics);
        return new GatewayAnalysisService(collector, new TrafficAggregator(), new SummaryBuilder(),
                statistics, properties, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
