package com.wangbin.idlegateway.core.collector.window;

import com.google.common.collect.AbstractIterator;
import com.wangbin.idlegateway.common.exception.BusinessException;

import java.time.Duration;
import java.time.Instant;

/**
 * 时间窗口切分器
 * 上游指标接口拒绝过长的时间范围，按上限切成首尾相接的子窗口。
 * 返回的 Iterable 惰性计算，可重复遍历。
 */
public final class WindowChunker {

    private WindowChunker() {
    }

    public static Iterable<TimeWindow> chunk(Instant start, Instant end, Duration maxDuration) {
        if (start == null || end == null) {
            throw BusinessException.paramError("时间窗口起止不能为空");
        }
        if (maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()) {
            throw BusinessException.paramError("窗口上限必须为正: " + maxDuration);
        }
        if (end.isBefore(start)) {
            throw BusinessException.paramError("结束时间早于开始时间: " + start + " > " + end);
        }
        return () -> new ChunkIterator(start, end, maxDuration);
    }

    private static final class ChunkIterator extends AbstractIterator<TimeWindow> {

        private final Instant end;
        private final Duration maxDuration;
        private Instant cursor;

        private ChunkIterator(Instant start, Instant end, Duration maxDuration) {
            this.cursor = start;
            this.end = end;
            this.maxDuration = maxDuration;
        }

        @Override
        protected TimeWindow computeNext() {
            if (!cursor.isBefore(end)) {
                return endOfData();
            }
            Instant candidate = cursor.plus(maxDuration);
            Instant chunkEnd = candidate.isBefore(end) ? candidate : end;
            TimeWindow window = new TimeWindow(cursor, chunkEnd);
            cursor = chunkEnd;
            return window;
        }
    }
}
