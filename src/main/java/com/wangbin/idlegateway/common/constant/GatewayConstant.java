package com.wangbin.idlegateway.common.constant;

/**
 * 网关分析常量
 */
public class GatewayConstant {

    private GatewayConstant() {
    }

    // 采样周期
    public static final long PERIOD_SECONDS = 21600L; // 6小时

    // 单次拉取窗口上限
    public static final int MAX_CHUNK_DAYS = 30;

    // 默认回溯天数
    public static final int DEFAULT_LOOKBACK_DAYS = 90;

    // 默认并行网关数
    public static final int DEFAULT_PARALLELISM = 4;

    // 标签
    public static final String TAG_NAME = "Name";

    // 未知账号
    public static final String UNKNOWN_ACCOUNT = "Unknown";

    // 报告文件
    public static final String REPORT_FILE_PREFIX = "gateway_analysis_";
    public static final String REPORT_FILE_SUFFIX = ".json";
    public static final String REPORT_TIMESTAMP_FORMAT = "yyyyMMdd_HHmmss";

    // 线程名称
    public static final String THREAD_NAME_PREFIX_ANALYSIS = "gateway-analysis";
}
