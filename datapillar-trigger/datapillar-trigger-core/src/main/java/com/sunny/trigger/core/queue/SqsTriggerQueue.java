package com.sunny.trigger.core.queue;

import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * 基于 AWS SQS 的触发队列
 * <p>
 * 客户端由外部构造后注入，测试时可替换为 mock。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class SqsTriggerQueue implements TriggerQueue {

    private static final Logger log = LoggerFactory.getLogger(SqsTriggerQueue.class);

    private static final String STRING_TYPE = "String";

    private final SqsClient sqsClient;
    private final QueueProperties properties;
    private final TriggerMessageCodec codec;

    public SqsTriggerQueue(SqsClient sqsClient, QueueProperties properties, TriggerMessageCodec codec) {
        this.sqsClient = Assert.notNull(sqsClient, "SqsClient 不能为空");
        this.properties = Assert.notNull(properties, "队列配置不能为空");
        this.codec = Assert.notNull(codec, "消息编解码器不能为空");
        Assert.notBlank(properties.getQueueUrl(), "队列地址不能为空");
        Assert.isTrue(properties.getApiCallTimeout().compareTo(properties.getWaitTime()) > 0,
                "API 调用超时必须大于长轮询等待时间");
    }

    /**
     * 按配置构造 SqsClient
     * <p>
     * 配置了 endpoint 时指向本地模拟器并使用静态凭证
     */
    public static SqsClient buildClient(QueueProperties properties) {
        SqsClientBuilder builder = SqsClient.builder()
                .region(Region.of(properties.getRegion()))
                .overrideConfiguration(config -> config.apiCallTimeout(properties.getApiCallTimeout()));

        String endpoint = normalizeText(properties.getEndpoint());
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint));
        }
        builder.credentialsProvider(resolveCredentials(properties, endpoint != null));
        return builder.build();
    }

    private static AwsCredentialsProvider resolveCredentials(QueueProperties properties, boolean local) {
        if (!local) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey()));
    }

    @Override
    public String send(TriggerMessage message) {
        SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(properties.getQueueUrl())
                .messageBody(codec.encode(message))
                .messageAttributes(Map.of(
                        Constants.ATTR_TRIGGER_TYPE, stringAttribute(message.triggerType().getCode()),
                        Constants.ATTR_WORKFLOW_ID, stringAttribute(message.workflowId())))
                .build();
        try {
            SendMessageResponse response = sqsClient.sendMessage(request);
            return response.messageId();
        } catch (SdkException e) {
            throw new TriggerQueueException("发送触发消息失败: scheduleId=" + message.scheduleId(), e);
        }
    }

    @Override
    public List<ReceivedTrigger> receive(int maxMessages) {
        int batch = Math.max(1, Math.min(maxMessages, properties.getMaxMessages()));
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(properties.getQueueUrl())
                .maxNumberOfMessages(batch)
                .waitTimeSeconds((int) properties.getWaitTime().getSeconds())
                .visibilityTimeout((int) properties.getVisibilityTimeout().getSeconds())
                .messageAttributeNames("All")
                .build();
        try {
            List<Message> messages = sqsClient.receiveMessage(request).messages();
            return messages.stream()
                    .map(m -> new ReceivedTrigger(m.messageId(), m.receiptHandle(), m.body()))
                    .toList();
        } catch (SdkException e) {
            throw new TriggerQueueException("接收触发消息失败", e);
        }
    }

    @Override
    public void acknowledge(ReceivedTrigger received) {
        DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(properties.getQueueUrl())
                .receiptHandle(received.receiptHandle())
                .build();
        try {
            sqsClient.deleteMessage(request);
        } catch (SdkException e) {
            throw new TriggerQueueException("删除触发消息失败: messageId=" + received.messageId(), e);
        }
    }

    @Override
    public void deadLetter(ReceivedTrigger received, String reason) {
        String deadLetterQueueUrl = normalizeText(properties.getDeadLetterQueueUrl());
        if (deadLetterQueueUrl == null) {
            log.warn("未配置死信队列，丢弃格式错误的消息: messageId={}, reason={}", received.messageId(), reason);
        } else {
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(deadLetterQueueUrl)
                    .messageBody(received.body() == null ? "" : received.body())
                    .messageAttributes(Map.of(Constants.ATTR_DEAD_LETTER_REASON, stringAttribute(reason)))
                    .build();
            try {
                sqsClient.sendMessage(request);
            } catch (SdkException e) {
                throw new TriggerQueueException("转发死信失败: messageId=" + received.messageId(), e);
            }
            log.warn("消息已转入死信队列: messageId={}, reason={}", received.messageId(), reason);
        }
        acknowledge(received);
    }

    private static MessageAttributeValue stringAttribute(String value) {
        return MessageAttributeValue.builder()
                .dataType(STRING_TYPE)
                .stringValue(value)
                .build();
    }

    private static String normalizeText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
