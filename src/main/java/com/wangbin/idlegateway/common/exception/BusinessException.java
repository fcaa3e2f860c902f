package com.wangbin.idlegateway.common.exception;

import com.wangbin.idlegateway.common.enums.ResultCode;
import lombok.Getter;

/**
 * 业务异常
 */
@Getter
public class BusinessException extends RuntimeException {

    private final int code;
    private final ResultCode resultCode;

    public BusinessException(ResultCode resultCode, String message) {
        super(message);
        this.code = resultCode.getCode();
        this.resultCode = resultCode;
    }

    public BusinessException(ResultCode resultCode, String message, Throwable cause) {
        super(message, cause);
        this.code = resultCode.getCode();
        this.resultCode = resultCode;
    }

    // 参数错误
    public static BusinessException paramError(String message) {
        return new BusinessException(ResultCode.PARAM_ERROR, message);
    }

    // 配置错误
    public static BusinessException configError(String message) {
        return new BusinessException(ResultCode.CONFIG_ERROR, message);
    }
}
