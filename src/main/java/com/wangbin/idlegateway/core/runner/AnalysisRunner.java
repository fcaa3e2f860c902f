package com.wangbin.idlegateway.core.runner;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.enums.ResultCode;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.core.analysis.AnalysisResult;
import com.wangbin.idlegateway.core.analysis.GatewayAnalysisService;
import com.wangbin.idlegateway.core.collector.source.AccountResolver;
import com.wangbin.idlegateway.core.collector.source.GatewayDiscovery;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import com.wangbin.idlegateway.core.report.JsonReportWriter;
import com.wangbin.idlegateway.core.report.ReportContext;
import com.wangbin.idlegateway.core.report.SummaryPrinter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 命令行入口：解析账号 -> 发现网关 -> 分析 -> 输出报告
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "analyzer", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class AnalysisRunner implements CommandLineRunner {

    private final AnalyzerProperties properties;
    private final AccountResolver accountResolver;
    private final GatewayDiscovery gatewayDiscovery;
    private final GatewayAnalysisService analysisService;
    private final JsonReportWriter reportWriter;
    private final SummaryPrinter summaryPrinter;

    public AnalysisRunner(AnalyzerProperties properties,
                          AccountResolver accountResolver,
                          GatewayDiscovery gatewayDiscovery,
                          GatewayAnalysisService analysisService,
                          JsonReportWriter reportWriter,
                          SummaryPrinter summaryPrinter) {
        this.properties = properties;
        this.accountResolver = accountResolver;
        this.gatewayDiscovery = gatewayDiscovery;
        this.analysisService = analysisService;
        this.reportWriter = reportWriter;
        this.summaryPrinter = summaryPrinter;
    }

    @Override
    public void run(String... args) {
        try {
            execute();
        } catch (BusinessException e) {
            log.error("分析失败 [{} {}]: {}", e.getCode(), e.getResultCode().getMessage(), e.getMessage());
            throw e;
        }
    }

    /**
     * 执行一次完整分析，返回报告路径；没有任何采样且没有失败时不输出报告，全部网关失败时输出报告后抛出采集错误
     */
    public Optional<Path> execute() {
        properties.validate();
        String accountId = accountResolver.resolveAccountId();
        ReportContext context = new ReportContext(accountId, properties.getRegion());
        log.info("Analyzing gateways for Account: {}, Region: {}", accountId, properties.getRegion());

        List<Gateway> gateways = gatewayDiscovery.discover();
        AnalysisResult result = analysisService.analyze(gateways, properties.getLookbackDays());

        if (result.getFailures().isEmpty() && result.hasNoSamples()) {
            log.info("No metrics data found for the specified period.");
            return Optional.empty();
        }

        Path output = reportWriter.resolveOutputPath(context, properties.getOutput());
        reportWriter.write(result, context, output);
        summaryPrinter.print(result, context);
        log.info("Detailed analysis saved to: {}", output);

        if (result.getSummaries().isEmpty()) {
            throw new BusinessException(ResultCode.COLLECTION_ERROR,
                    "全部网关分析失败: " + String.join(", ", result.getFailures().keySet()));
        }
        return Optional.of(output);
    }
}
