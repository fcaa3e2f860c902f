package com.wangbin.idlegateway.core.report;

/**
 * 报告上下文
 *
 * @param accountId 账号ID
 * @param region    区域
 */
public record ReportContext(String accountId, String region) {
}
