package com.wangbin.idlegateway.core.runner;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.enums.ResultCode;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.core.analysis.GatewayAnalysisService;
import com.wangbin.idlegateway.core.analysis.SummaryBuilder;
import com.wangbin.idlegateway.core.analysis.TrafficAggregator;
import com.wangbin.idlegateway.core.analysis.catalog.MetricCatalog;
import com.wangbin.idlegateway.core.collector.FakeMetricSource;
import com.wangbin.idlegateway.core.collector.MetricSampleCollector;
import com.wangbin.idlegateway.core.collector.source.GatewayDiscovery;
import com.wangbin.idlegateway.core.collector.statistics.CollectionStatistics;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import com.wangbin.idlegateway.core.report.JsonReportWriter;
import com.wangbin.idlegateway.core.report.SummaryPrinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisRunnerTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");

    private final Gateway nat = Gateway.builder()
            .id("nat-1").kind(GatewayKind.NAT).displayName("egress").networkId("vpc-1").networkName("main").build();

    @TempDir
    Path tempDir;

    private FakeMetricSource source;
    private AnalyzerProperties properties;

    @BeforeEach
    void setUp() {
        source = new FakeMetricSource();
        properties = new AnalyzerProperties();
        properties.setRegion("us-east-1");
        properties.setLookbackDays(30);
        properties.setOutput(tempDir.resolve("report.json").toString());
    }

    @Test
    void writesReportWhenSamplesExist() throws IOException {
        source.add("nat-1", MetricCatalog.BYTES_IN_FROM_SOURCE, NOW.minus(Duration.ofDays(2)), 0)
                .add("nat-1", MetricCatalog.BYTES_IN_FROM_SOURCE, NOW.minus(Duration.ofDays(1)), 500);

        Optional<Path> report = runner(() -> List.of(nat)).execute();

        assertTrue(report.isPresent());
        assertEquals(tempDir.resolve("report.json"), report.get());
        JSONObject document = JSON.parseObject(Files.readString(report.get()));
        assertEquals("123456789012", document.getString("accountId"));
        assertEquals(30, document.getIntValue("lookbackDays"));
        assertEquals(50.0, document.getJSONArray("summary").getJSONObject(0).getDoubleValue("Idle_Percentage"));
    }

    @Test
    void noSamplesMeansNoReport() {
        Optional<Path> report = runner(() -> List.of(nat)).execute();

        assertFalse(report.isPresent());
        assertFalse(Files.exists(tempDir.resolve("report.json")));
    }

    @Test
    void noGatewaysMeansNoReport() {
        assertFalse(runner(List::of).execute().isPresent());
    }

    @Test
    void missingRegionStopsBeforeDiscovery() {
        properties.setRegion(" ");

        BusinessException ex = assertThrows(BusinessException.class,
                () -> runner(() -> {
                    throw new AssertionError("discovery must not run");
                }).execute());

        assertEquals(ResultCode.CONFIG_ERROR, ex.getResultCode());
    }

    @Test
    void failedOnlyGatewayIsReportedNotTreatedAsMissingData() throws IOException {
        source.failWhenWindowContains("nat-1", MetricCatalog.BYTES_IN_FROM_DESTINATION, NOW.minus(Duration.ofDays(1)));

        BusinessException ex = assertThrows(BusinessException.class, () -> runner(() -> List.of(nat)).execute());

        assertEquals(ResultCode.COLLECTION_ERROR, ex.getResultCode());
        assertTrue(ex.getMessage().contains("nat-1"));
        Path report = tempDir.resolve("report.json");
        assertTrue(Files.exists(report));
        JSONObject document = JSON.parseObject(Files.readString(report));
        assertTrue(document.getJSONObject("failures").containsKey("nat-1"));
        assertTrue(document.getJSONArray("summary").isEmpty());
    }

    @Test
    void failureBesideEmptyGatewayStillWritesReport() throws IOException {
        Gateway quiet = Gateway.builder().id("nat-2").kind(GatewayKind.NAT).displayName("quiet").build();
        source.failWhenWindowContains("nat-1", MetricCatalog.BYTES_IN_FROM_DESTINATION, NOW.minus(Duration.ofDays(1)));

        Optional<Path> report = runner(() -> List.of(nat, quiet)).execute();

        assertTrue(report.isPresent());
        JSONObject document = JSON.parseObject(Files.readString(report.get()));
        assertTrue(document.getJSONObject("failures").containsKey("nat-1"));
        assertEquals("nat-2", document.getJSONArray("summary").getJSONObject(0).getString("Gateway_ID"));
    }

    @Test
    void runPropagatesFailures() {
        properties.setLookbackDays(0);

        assertThrows(BusinessException.class, () -> runner(() -> List.of(nat)).run());
    }

    private AnalysisRunner runner(GatewayDiscovery discovery) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CollectionStatistics statistics = new CollectionStatistics();
        GatewayAnalysisService service = new GatewayAnalysisService(
                new MetricSampleCollector(source, properties, statistics),
                new TrafficAggregator(),
                new SummaryBuilder(),
                statistics,
                properties,
                MoreExecutors.directExecutor(),
                clock);
        return new AnalysisRunner(properties, () -> "123456789012", discovery, service,
                new JsonReportWriter(clock), new SummaryPrinter());
    }
}
