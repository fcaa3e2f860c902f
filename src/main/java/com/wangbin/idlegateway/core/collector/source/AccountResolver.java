package com.wangbin.idlegateway.core.collector.source;

/**
 * 账号解析接口
 */
public interface AccountResolver {

    /**
     * 当前凭证所属账号ID，无法解析时返回 Unknown
     */
    String resolveAccountId();
}
