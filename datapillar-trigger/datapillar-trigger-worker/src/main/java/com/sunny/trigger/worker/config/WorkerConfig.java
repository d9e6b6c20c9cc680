package com.sunny.trigger.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import com.sunny.trigger.core.queue.QueueProperties;
import com.sunny.trigger.core.queue.SqsTriggerQueue;
import com.sunny.trigger.core.queue.TriggerQueue;
import com.sunny.trigger.store.config.TriggerStoreConfig;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import com.sunny.trigger.worker.executor.HttpWorkflowExecutor;
import com.sunny.trigger.worker.executor.WorkflowExecutor;
import com.sunny.trigger.worker.runtime.OutcomeRecorder;
import com.sunny.trigger.worker.runtime.RuntimeContext;
import com.sunny.trigger.worker.runtime.ShutdownTimeouts;
import com.sunny.trigger.worker.runtime.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Lazy;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.http.HttpClient;

/**
 * Worker 装配
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
@Configuration
@Import(TriggerStoreConfig.class)
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    @Bean
    @ConfigurationProperties(prefix = "datapillar.trigger.queue")
    public QueueProperties queueProperties() {
        return new QueueProperties();
    }

    /**
     * execution 模式不访问队列，延迟到首次使用再创建客户端
     */
    @Bean(destroyMethod = "close")
    @Lazy
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
    @Lazy
    public TriggerQueue triggerQueue(@Lazy SqsClient sqsClient, QueueProperties queueProperties,
                                     TriggerMessageCodec codec) {
        return new SqsTriggerQueue(sqsClient, queueProperties, codec);
    }

    @Bean
    public HttpClient workflowHttpClient(WorkerProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getExecutorConnectTimeout())
                .build();
    }

    @Bean
    public WorkflowExecutor workflowExecutor(HttpClient workflowHttpClient, WorkerProperties properties,
                                             ObjectMapper objectMapper) {
        return new HttpWorkflowExecutor(workflowHttpClient, properties.getExecutorBaseUrl(),
                properties.getServiceKey(), properties.getExecutorTimeout(), objectMapper);
    }

    @Bean
    public RuntimeContext runtimeContext() {
        return new RuntimeContext();
    }

    @Bean
    public OutcomeRecorder outcomeRecorder(WorkflowExecutionService executionService,
                                           WorkflowScheduleService scheduleService) {
        return new OutcomeRecorder(executionService, scheduleService);
    }

    /**
     * 启动时校验，时限配置错误直接拒绝启动
     */
    @Bean
    public ShutdownTimeouts shutdownTimeouts(WorkerProperties properties) {
        return new ShutdownTimeouts(properties.getShutdownGracePeriod(), properties.getShutdownBuffer());
    }

    @Bean
    public WorkerRuntime workerRuntime(WorkerProperties properties,
                                       RuntimeContext runtimeContext,
                                       WorkflowExecutionService executionService,
                                       WorkflowScheduleService scheduleService,
                                       OutcomeRecorder outcomeRecorder,
                                       WorkflowExecutor workflowExecutor,
                                       @Lazy TriggerQueue triggerQueue,
                                       TriggerMessageCodec triggerMessageCodec,
                                       ObjectMapper objectMapper) {
        return new WorkerRuntime(properties, runtimeContext, executionService, scheduleService, outcomeRecorder,
                workflowExecutor, triggerQueue, triggerMessageCodec, objectMapper);
    }
}
