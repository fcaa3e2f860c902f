package com.wangbin.idlegateway.common.enums;

/**
 * Internet Gateway 活跃状态
 */
public enum GatewayStatus {

    ACTIVE("Active"),
    INACTIVE("Inactive");

    private final String label;

    GatewayStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static GatewayStatus of(boolean allSumsZero) {
        return allSumsZero ? INACTIVE : ACTIVE;
    }
}
