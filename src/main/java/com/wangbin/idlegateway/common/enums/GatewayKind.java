package com.wangbin.idlegateway.common.enums;

/**
 * 网关类型枚举
 */
public enum GatewayKind {

    NAT("NAT", "NAT Gateway", "AWS/NATGateway", "NatGatewayId"),
    IGW("IGW", "Internet Gateway", "AWS/IGW", "InternetGatewayId");

    private final String code;
    private final String description;
    private final String namespace;
    private final String dimensionName;

    GatewayKind(String code, String description, String namespace, String dimensionName) {
        this.code = code;
        this.description = description;
        this.namespace = namespace;
        this.dimensionName = dimensionName;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * CloudWatch 命名空间
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * CloudWatch 维度名
     */
    public String getDimensionName() {
        return dimensionName;
    }
}
