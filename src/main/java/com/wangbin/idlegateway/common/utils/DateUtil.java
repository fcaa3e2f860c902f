package com.wangbin.idlegateway.common.utils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 日期时间工具类
 */
public class DateUtil {

    private DateUtil() {
        // 工具类，防止实例化
    }

    /**
     * 按本地时区格式化当前时间
     */
    public static String format(Clock clock, String pattern) {
        return LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern(pattern));
    }

    /**
     * 可读的时长描述，如 30d / 5d 12h
     */
    public static String formatDuration(Duration duration) {
        long days = duration.toDays();
        long hours = duration.minusDays(days).toHours();
        if (hours == 0) {
            return days + "d";
        }
        return days > 0 ? days + "d " + hours + "h" : hours + "h";
    }
}
