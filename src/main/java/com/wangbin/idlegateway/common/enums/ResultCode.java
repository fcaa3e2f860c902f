package com.wangbin.idlegateway.common.enums;

/**
 * 错误码枚举
 */
public enum ResultCode {

    // 参数错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_INVALID(1003, "数据无效"),

    // 采集相关错误
    COLLECTION_ERROR(2004, "采集错误"),
    DISCOVERY_ERROR(2007, "网关发现错误"),
    REPORT_ERROR(2006, "报告输出错误"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
