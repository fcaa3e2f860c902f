package com.wangbin.idlegateway.core.collector.source;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.domain.entity.MetricSample;
import com.wangbin.idlegateway.common.exception.CollectorException;
import com.wangbin.idlegateway.core.collector.window.TimeWindow;

import java.util.List;

/**
 * 指标数据源接口
 */
public interface MetricSource {

    /**
     * 拉取单个子窗口内的指标采样
     */
    List<MetricSample> fetch(Gateway gateway, String metricName, TimeWindow window) throws CollectorException;

    /**
     * 指标对该网关是否存在任何数据
     */
    boolean exists(Gateway gateway, String metricName) throws CollectorException;
}
