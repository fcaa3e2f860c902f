package com.wangbin.idlegateway.common.exception;

import com.wangbin.idlegateway.common.enums.ResultCode;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;
import lombok.Getter;

/**
 * 采集器异常
 * 携带网关、指标与失败窗口，便于调用方重试
 */
@Getter
public class CollectorException extends BusinessException {

    private final String gatewayId;
    private final String metricName;
    private final TimeWindow window;

    public CollectorException(ResultCode resultCode, String message, String gatewayId,
                              String metricName, TimeWindow window, Throwable cause) {
        super(resultCode, message, cause);
        this.gatewayId = gatewayId;
        this.metricName = metricName;
        this.window = window;
    }

    // 指标拉取失败
    public static CollectorException fetchException(String gatewayId, String metricName,
                                                    TimeWindow window, Throwable cause) {
        String message = String.format("指标拉取失败: gateway=%s, metric=%s, window=%s",
                gatewayId, metricName, window);
        return new CollectorException(ResultCode.COLLECTION_ERROR, message, gatewayId, metricName, window, cause);
    }

    // 指标存在性探测失败
    public static CollectorException probeException(String gatewayId, String metricName, Throwable cause) {
        String message = String.format("指标探测失败: gateway=%s, metric=%s", gatewayId, metricName);
        return new CollectorException(ResultCode.COLLECTION_ERROR, message, gatewayId, metricName, null, cause);
    }

    // 网关发现失败
    public static CollectorException discoveryException(String message, Throwable cause) {
        return new CollectorException(ResultCode.DISCOVERY_ERROR, message, null, null, null, cause);
    }
}
