package com.wangbin.idlegateway.common.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 数值工具类
 */
public class NumberUtil {

    private NumberUtil() {
    }

    /**
     * 四舍五入保留两位小数
     */
    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 百分比，分母为0时返回0
     */
    public static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round2(part * 100.0 / total);
    }
}
