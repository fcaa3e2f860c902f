package com.wangbin.idlegateway.core.collector.source.aws;

import com.wangbin.idlegateway.common.constant.GatewayConstant;
import com.wangbin.idlegateway.core.collector.source.AccountResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

/**
 * 基于 STS 的账号解析
 */
@Slf4j
@Component
public class StsAccountResolver implements AccountResolver {

    private final StsClient stsClient;

    public StsAccountResolver(StsClient stsClient) {
        this.stsClient = stsClient;
    }

    @Override
    public String resolveAccountId() {
        try {
            return stsClient.getCallerIdentity(GetCallerIdentityRequest.builder().build()).account();
        } catch (SdkException ex) {
            log.warn("无法获取账号ID: {}", ex.getMessage());
            return GatewayConstant.UNKNOWN_ACCOUNT;
        }
    }
}
