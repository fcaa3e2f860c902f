package com.wangbin.idlegateway.common.config;

import com.wangbin.idlegateway.core.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * AWS 客户端配置
 */
@Slf4j
@Configuration
public class AwsClientConfig {

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(AnalyzerProperties properties) {
        String profile = properties.getProfile();
        if (profile != null && !profile.isBlank()) {
            log.info("使用 AWS profile: {}", profile);
            return ProfileCredentialsProvider.create(profile.trim());
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    public CloudWatchClient cloudWatchClient(AnalyzerProperties properties, AwsCredentialsProvider credentials) {
        return CloudWatchClient.builder()
                .region(resolveRegion(properties))
                .credentialsProvider(credentials)
                .build();
    }

    @Bean(destroyMethod = "close")
    public Ec2Client ec2Client(AnalyzerProperties properties, AwsCredentialsProvider credentials) {
        return Ec2Client.builder()
                .region(resolveRegion(properties))
                .credentialsProvider(credentials)
                .build();
    }

    @Bean(destroyMethod = "close")
    public StsClient stsClient(AnalyzerProperties properties, AwsCredentialsProvider credentials) {
        return StsClient.builder()
                .region(resolveRegion(properties))
                .credentialsProvider(credentials)
                .build();
    }

    private Region resolveRegion(AnalyzerProperties properties) {
        properties.validate();
        return Region.of(properties.getRegion().trim());
    }
}
