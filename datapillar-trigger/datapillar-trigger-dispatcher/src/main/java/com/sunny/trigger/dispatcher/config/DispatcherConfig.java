package com.sunny.trigger.dispatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.cron.CronEvaluator;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import com.sunny.trigger.core.queue.QueueProperties;
import com.sunny.trigger.core.queue.SqsTriggerQueue;
import com.sunny.trigger.core.queue.TriggerQueue;
import com.sunny.trigger.dispatcher.source.HttpScheduleSource;
import com.sunny.trigger.dispatcher.source.ScheduleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Dispatcher 装配
 * <p>
 * 队列与 HTTP 客户端在这里显式构造后注入分发器
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Configuration
public class DispatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatcherConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConfigurationProperties(prefix = "datapillar.trigger.queue")
    public QueueProperties queueProperties() {
        return new QueueProperties();
    }

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient(QueueProperties queueProperties) {
        log.info("初始化 SQS 客户端: queueUrl={}, endpoint={}, region={}",
                queueProperties.getQueueUrl(), queueProperties.getEndpoint(), queueProperties.getRegion());
        return SqsTriggerQueue.buildClient(queueProperties);
    }

    @Bean
    public TriggerMessageCodec triggerMessageCodec(ObjectMapper objectMapper) {
        return new TriggerMessageCodec(objectMapper);
    }

    @Bean
    public TriggerQueue triggerQueue(SqsClient sqsClient, QueueProperties queueProperties, TriggerMessageCodec codec) {
        return new SqsTriggerQueue(sqsClient, queueProperties, codec);
    }

    @Bean
    public CronEvaluator cronEvaluator(DispatcherProperties properties, Clock clock) {
        return new CronEvaluator(properties.getWindow(), clock);
    }

    @Bean
    public HttpClient scheduleSourceHttpClient(DispatcherProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    @Bean
    public ScheduleSource scheduleSource(HttpClient scheduleSourceHttpClient,
                                         DispatcherProperties properties,
                                         ObjectMapper objectMapper) {
        return new HttpScheduleSource(scheduleSourceHttpClient, properties.getScheduleSourceUrl(),
                properties.getServiceKey(), properties.getRequestTimeout(), objectMapper);
    }
}
