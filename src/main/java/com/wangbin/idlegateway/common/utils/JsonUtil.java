package com.wangbin.idlegateway.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONWriter;
import com.wangbin.idlegateway.common.enums.ResultCode;
import com.wangbin.idlegateway.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串（格式化）
     */
    public static String toJsonStringPretty(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteMapNullValue);
        } catch (JSONException e) {
            log.error("对象转JSON字符串失败", e);
            throw new BusinessException(ResultCode.DATA_INVALID, "对象转JSON字符串失败", e);
        }
    }
}
