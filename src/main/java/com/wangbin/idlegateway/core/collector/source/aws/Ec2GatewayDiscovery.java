package com.wangbin.idlegateway.core.collector.source.aws;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.idlegateway.common.constant.GatewayConstant;
import com.wangbin.idlegateway.common.domain.entity.Gateway;
import com.wangbin.idlegateway.common.enums.GatewayKind;
import com.wangbin.idlegateway.common.exception.CollectorException;
import com.wangbin.idlegateway.core.collector.source.GatewayDiscovery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInternetGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeNatGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.InternetGateway;
import software.amazon.awssdk.services.ec2.model.NatGateway;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Vpc;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 EC2 API 的网关发现
 */
@Slf4j
@Component
public class Ec2GatewayDiscovery implements GatewayDiscovery {

    private final Ec2Client ec2Client;

    // vpcId -> VPC 名称，单次运行内复用
    private final Cache<String, String> vpcNames = Caffeine.newBuilder()
            .maximumSize(1000)
            .build();

    public Ec2GatewayDiscovery(Ec2Client ec2Client) {
        this.ec2Client = ec2Client;
    }

    @Override
    public List<Gateway> discover() {
        List<Gateway> gateways = new ArrayList<>();
        try {
            for (NatGateway nat : ec2Client.describeNatGatewaysPaginator(
                    DescribeNatGatewaysRequest.builder().build()).natGateways()) {
                gateways.add(toGateway(nat.natGatewayId(), GatewayKind.NAT, nat.tags(), nat.vpcId()));
            }
            for (InternetGateway igw : ec2Client.describeInternetGatewaysPaginator(
                    DescribeInternetGatewaysRequest.builder().build()).internetGateways()) {
                String vpcId = igw.hasAttachments() && !igw.attachments().isEmpty()
                        ? igw.attachments().get(0).vpcId()
                        : null;
                gateways.add(toGateway(igw.internetGatewayId(), GatewayKind.IGW, igw.tags(), vpcId));
            }
        } catch (SdkException ex) {
            throw CollectorException.discoveryException("网关列表获取失败: " + ex.getMessage(), ex);
        }
        log.info("发现网关 {} 个", gateways.size());
        return gateways;
    }

    private Gateway toGateway(String gatewayId, GatewayKind kind, List<Tag> tags, String vpcId) {
        String vpcName = vpcId != null ? vpcName(vpcId) : null;
        return Gateway.builder()
                .id(gatewayId)
                .kind(kind)
                .displayName(resolveDisplayName(gatewayId, kind, tags, vpcName))
                .networkId(vpcId)
                .networkName(vpcName)
                .build();
    }

    /**
     * VPC 名称，未打 Name 标签或查询失败时退回 vpcId
     */
    String vpcName(String vpcId) {
        return vpcNames.get(vpcId, this::lookupVpcName);
    }

    private String lookupVpcName(String vpcId) {
        try {
            List<Vpc> vpcs = ec2Client.describeVpcs(DescribeVpcsRequest.builder().vpcIds(vpcId).build()).vpcs();
            if (vpcs.isEmpty()) {
                return vpcId;
            }
            String name = nameTag(vpcs.get(0).tags());
            return name != null ? name : vpcId;
        } catch (SdkException ex) {
            log.warn("VPC 名称查询失败, 使用 vpcId: {}, error={}", vpcId, ex.getMessage());
            return vpcId;
        }
    }

    /**
     * 显示名称：Name 标签 > {类型}-{VPC名称} > 网关ID
     */
    static String resolveDisplayName(String gatewayId, GatewayKind kind, List<Tag> tags, String vpcName) {
        String name = nameTag(tags);
        if (name != null) {
            return name;
        }
        if (vpcName != null) {
            return kind.getCode() + "-" + vpcName;
        }
        return gatewayId;
    }

    private static String nameTag(List<Tag> tags) {
        if (tags == null) {
            return null;
        }
        return tags.stream()
                .filter(tag -> GatewayConstant.TAG_NAME.equals(tag.key()))
                .map(Tag::value)
                .filter(value -> value != null && !value.isEmpty())
                .findFirst()
                .orElse(null);
    }
}
