package com.wangbin.idlegateway.core.report;

import com.wangbin.idlegateway.common.constant.GatewayConstant;
import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.enums.ResultCode;
import com.wangbin.idlegateway.common.exception.BusinessException;
import com.wangbin.idlegateway.common.utils.DateUtil;
import com.wangbin.idlegateway.common.utils.JsonUtil;
import com.wangbin.idlegateway.core.analysis.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 报告输出
 * 汇总 + 每个网关的明细采样
 */
@Slf4j
@Component
public class JsonReportWriter {

    private final Clock clock;

    public JsonReportWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * 报告路径：配置优先，否则 gateway_analysis_{account}_{region}_{时间}.json
     */
    public Path resolveOutputPath(ReportContext context, String configuredOutput) {
        if (configuredOutput != null && !configuredOutput.isBlank()) {
            return Paths.get(configuredOutput.trim());
        }
        String timestamp = DateUtil.format(clock, GatewayConstant.REPORT_TIMESTAMP_FORMAT);
        return Paths.get(GatewayConstant.REPORT_FILE_PREFIX + context.accountId() + "_" + context.region()
                + "_" + timestamp + GatewayConstant.REPORT_FILE_SUFFIX);
    }

    public Path write(AnalysisResult result, ReportContext context, Path output) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("accountId", context.accountId());
        document.put("region", context.region());
        document.put("lookbackDays", result.getLookbackDays());
        document.put("windowStart", result.getWindow().start().toString());
        document.put("windowEnd", result.getWindow().end().toString());
        document.put("generatedAt", clock.instant().toString());
        document.put("summary", result.getSummaries().stream()
                .map(summary -> summaryRow(summary, context))
                .toList());
        document.put("gateways", result.getSamplesByGateway());
        document.put("failures", result.getFailures());

        String json = JsonUtil.toJsonStringPretty(document);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("报告写入失败: {}", output, e);
            throw new BusinessException(ResultCode.REPORT_ERROR, "报告写入失败: " + output, e);
        }
        log.info("报告已写入: {}", output);
        return output;
    }

    /**
     * 汇总行，按报告列名展开
     */
    Map<String, Object> summaryRow(AnalysisSummary summary, ReportContext context) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Account_ID", context.accountId());
        row.put("Region", context.region());
        row.put("VPC_ID", summary.getNetworkId());
        row.put("VPC_Name", summary.getNetworkName());
        row.put("Gateway_Type", summary.getKind().getCode());
        row.put("Gateway_ID", summary.getGatewayId());
        row.put("Gateway_Name", summary.getGatewayName());
        row.put("Total_Periods", summary.getTotalPeriods());
        row.put("Idle_Periods", summary.getIdlePeriods());
        row.put("Idle_Percentage", summary.getIdlePercentage());
        summary.getTotals().forEach((field, value) -> row.put(field.getColumnName(), value));
        if (summary.getMaxActiveConnections() != null) {
            row.put("Max_Active_Connections", summary.getMaxActiveConnections());
            row.put("Avg_Active_Connections", summary.getAvgActiveConnections());
        }
        if (summary.getStatus() != null) {
            row.put("Status", summary.getStatus().getLabel());
        }
        row.put("Total_Bytes", summary.getTotalBytes());
        row.put("Total_Packets", summary.getTotalPackets());
        row.put("Bytes_Per_Second_Avg", summary.getBytesPerSecondAvg());
        row.put("Packets_Per_Second_Avg", summary.getPacketsPerSecondAvg());
        return row;
    }
}
