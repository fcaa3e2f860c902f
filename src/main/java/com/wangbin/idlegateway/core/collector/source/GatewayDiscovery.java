package com.wangbin.idlegateway.core.collector.source;

import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.exception.CollectorException;

import java.util.List;

/**
 * 网关发现接口
 */
public interface GatewayDiscovery {

    /**
     * 列出当前区域下的全部网关，NAT 在前，IGW 在后
     */
    List<Gateway> discover() throws CollectorException;
}
