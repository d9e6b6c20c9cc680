package com.sunny.trigger.core.queue;

import java.time.Duration;

/**
 * 触发队列配置
 * <p>
 * 默认值面向本地 LocalStack：配置了 endpoint 时使用静态测试凭证，
 * 否则走 AWS 默认凭证链。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class QueueProperties {

    public static final String DEFAULT_QUEUE_URL =
            "http://sqs.us-east-1.localhost.localstack.cloud:4566/000000000000/datapillar-trigger-queue";

    private String queueUrl = DEFAULT_QUEUE_URL;

    /**
     * 死信队列地址，为空时格式错误的消息只删除不转发
     */
    private String deadLetterQueueUrl;

    /**
     * 本地模拟器地址（如 http://localhost:4566）
     */
    private String endpoint;

    private String region = "us-east-1";

    private String accessKeyId = "test";

    private String secretAccessKey = "test";

    /**
     * 长轮询等待时间，SQS 上限 20 秒
     */
    private Duration waitTime = Duration.ofSeconds(20);

    /**
     * 可见性超时
     */
    private Duration visibilityTimeout = Duration.ofSeconds(300);

    /**
     * 单次接收最大消息数，SQS 上限 10
     */
    private int maxMessages = 10;

    /**
     * 单次 API 调用超时，必须大于长轮询等待时间
     */
    private Duration apiCallTimeout = Duration.ofSeconds(30);

    public String getQueueUrl() {
        return queueUrl;
    }

    public void setQueueUrl(String queueUrl) {
        this.queueUrl = queueUrl;
    }

    public String getDeadLetterQueueUrl() {
        return deadLetterQueueUrl;
    }

    public void setDeadLetterQueueUrl(String deadLetterQueueUrl) {
        this.deadLetterQueueUrl = deadLetterQueueUrl;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public void setAccessKeyId(String accessKeyId) {
        this.accessKeyId = accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    public void setSecretAccessKey(String secretAccessKey) {
        this.secretAccessKey = secretAccessKey;
    }

    public Duration getWaitTime() {
        return waitTime;
    }

    public void setWaitTime(Duration waitTime) {
        this.waitTime = waitTime;
    }

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public void setVisibilityTimeout(Duration visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    public void setMaxMessages(int maxMessages) {
        this.maxMessages = maxMessages;
    }

    public Duration getApiCallTimeout() {
        return apiCallTimeout;
    }

    public void setApiCallTimeout(Duration apiCallTimeout) {
        this.apiCallTimeout = apiCallTimeout;
    }
}
