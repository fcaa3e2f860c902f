package com.wangbin.idlegateway.core.report;

import com.wangbin.idlegateway.common.domain.entity.AnalysisSummary;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.core.analysis.AnalysisResult;
import com.wangbin.idlegateway.core.analysis.catalog.SummaryField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 控制台汇总输出
 */
@Slf4j
@Component
public class SummaryPrinter {

    private static final String RULE = "=".repeat(80);

    public void print(AnalysisResult result, ReportContext context) {
        for (String line : render(result, context)) {
            log.info(line);
        }
    }

    List<String> render(AnalysisResult result, ReportContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("Gateway Analysis Summary");
        lines.add(RULE);
        lines.add(String.format(Locale.ROOT, "Account: %s  |  Region: %s", context.accountId(), context.region()));
        lines.add(RULE);

        for (AnalysisSummary summary : result.getSummaries()) {
            lines.add("");
            lines.add(String.format(Locale.ROOT, "%s Gateway: %s (%s)",
                    summary.getKind().getCode(), summary.getGatewayName(), summary.getGatewayId()));
            lines.add(String.format(Locale.ROOT, "  VPC: %s (%s)", summary.getNetworkName(), summary.getNetworkId()));
            lines.add(String.format(Locale.ROOT, "  Idle: %.2f%% (%d of %d periods)",
                    summary.getIdlePercentage(), summary.getIdlePeriods(), summary.getTotalPeriods()));
            lines.add(String.format(Locale.ROOT, "  Traffic: %,.0f bytes in / %,.0f bytes out",
                    summary.total(SummaryField.BYTES_IN), summary.total(SummaryField.BYTES_OUT)));
            lines.add(String.format(Locale.ROOT, "  Packets: %,.0f in / %,.0f out",
                    summary.total(SummaryField.PACKETS_IN), summary.total(SummaryField.PACKETS_OUT)));
            lines.add(String.format(Locale.ROOT, "  Avg rates: %,.2f B/s, %,.2f pkt/s",
                    summary.getBytesPerSecondAvg(), summary.getPacketsPerSecondAvg()));

            if (summary.getKind() == GatewayKind.NAT) {
                lines.add(String.format(Locale.ROOT, "  Connections: %,.0f attempts, %,.0f timeouts, %,.0f port errors",
                        summary.total(SummaryField.CONNECTION_ATTEMPTS),
                        summary.total(SummaryField.CONNECTION_TIMEOUTS),
                        summary.total(SummaryField.PORT_ALLOCATION_ERRORS)));
                lines.add(String.format(Locale.ROOT, "  Active connections: max %,.0f, avg %,.2f",
                        summary.getMaxActiveConnections(), summary.getAvgActiveConnections()));
            } else {
                lines.add(String.format(Locale.ROOT, "  Status: %s", summary.getStatus().getLabel()));
                lines.add(String.format(Locale.ROOT, "  Drops: %,.0f blackhole bytes, %,.0f no-route bytes",
                        summary.total(SummaryField.BLACKHOLE_DROP_BYTES),
                        summary.total(SummaryField.NOROUTE_DROP_BYTES)));
            }
        }

        if (!result.getFailures().isEmpty()) {
            lines.add("");
            lines.add("Failed gateways:");
            for (Map.Entry<String, String> failure : result.getFailures().entrySet()) {
                lines.add(String.format(Locale.ROOT, "  %s: %s", failure.getKey(), failure.getValue()));
            }
        }
        return lines;
    }
}
