package com.wangbin.idlegateway.core.config;

import com.wangbin.idlegateway.common.constant.GatewayConstant;
import com.wangbin.idlegateway.common.exception.BusinessException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 分析器配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    /**
     * AWS 区域（必填）
     */
    private String region;

    /**
     * AWS CLI profile，留空走默认凭证链
     */
    private String profile;

    /**
     * 回溯天数
     */
    private int lookbackDays = GatewayConstant.DEFAULT_LOOKBACK_DAYS;

    /**
     * 报告输出路径，留空按账号/区域/时间生成
     */
    private String output;

    /**
     * 单次拉取窗口上限（天）
     */
    private int chunkDays = GatewayConstant.MAX_CHUNK_DAYS;

    /**
     * 采样周期（秒）
     */
    private long periodSeconds = GatewayConstant.PERIOD_SECONDS;

    /**
     * 并行分析的网关数
     */
    private int parallelism = GatewayConstant.DEFAULT_PARALLELISM;

    /**
     * 启动时执行分析
     */
    private boolean runOnStartup = true;

    public Duration getChunkDuration() {
        return Duration.ofDays(chunkDays);
    }

    /**
     * 校验配置，非法时抛出配置错误
     */
    public void validate() {
        if (region == null || region.isBlank()) {
            throw BusinessException.configError("analyzer.region 不能为空");
        }
        if (lookbackDays < 1) {
            throw BusinessException.configError("analyzer.lookback-days 必须大于0: " + lookbackDays);
        }
        if (chunkDays < 1) {
            throw BusinessException.configError("analyzer.chunk-days 必须大于0: " + chunkDays);
        }
        if (periodSeconds < 1) {
            throw BusinessException.configError("analyzer.period-seconds 必须大于0: " + periodSeconds);
        }
        if (parallelism < 1) {
            throw BusinessException.configError("analyzer.parallelism 必须大于0: " + parallelism);
        }
    }
}
