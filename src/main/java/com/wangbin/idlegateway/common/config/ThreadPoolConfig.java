package com.wangbin.idlegateway.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.idlegateway.common.constant.GatewayConstant;
import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 网关分析线程池（IO密集型，按网关扇出）
     */
    @Bean(name = "gatewayAnalysisExecutor", destroyMethod = "shutdown")
    public ExecutorService gatewayAnalysisExecutor(AnalyzerProperties properties) {
        int poolSize = Math.max(1, properties.getParallelism());
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                buildNamedThreadFactory(GatewayConstant.THREAD_NAME_PREFIX_ANALYSIS, true)
        );
    }

    /**
     * 分析时钟
     */
    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }
}
