package com.sunny.trigger.core.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqsTriggerQueueTest {

    @Mock
    private SqsClient sqsClient;

    private QueueProperties properties;
    private SqsTriggerQueue queue;

    @BeforeEach
    void setUp() {
        properties = new QueueProperties();
        properties.setQueueUrl("http://localhost:4566/000000000000/trigger");
        queue = new SqsTriggerQueue(sqsClient, properties, new TriggerMessageCodec(new ObjectMapper()));
    }

    @Test
    void buildClient_shouldTargetLocalEndpoint() {
        properties.setEndpoint("http://localhost:4566");
        properties.setRegion("us-east-1");
        properties.setAccessKeyId("test");
        properties.setSecretAccessKey("test");

        try (SqsClient client = SqsTriggerQueue.buildClient(properties)) {
            assertEquals("sqs", client.serviceName());
            assertEquals("us-east-1", client.serviceClientConfiguration().region().id());
            assertEquals("http://localhost:4566",
                    client.serviceClientConfiguration().endpointOverride().orElseThrow().toString());
        }
    }

    @Test
    void send_shouldAttachTriggerAttributes() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenReturn(SendMessageResponse.builder().messageId("m-1").build());

        String messageId = queue.send(TriggerMessage.schedule("wf-1", "sch-1", Instant.parse("2025-03-10T10:00:30Z")));

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(captor.capture());
        SendMessageRequest request = captor.getValue();
        assertEquals("m-1", messageId);
        assertEquals(properties.getQueueUrl(), request.queueUrl());
        assertEquals("schedule", request.messageAttributes().get("TriggerType").stringValue());
        assertEquals("wf-1", request.messageAttributes().get("WorkflowId").stringValue());
    }

    @Test
    void send_shouldWrapSdkFailure() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
                .thenThrow(SqsException.builder().message("queue unavailable").build());

        assertThrows(TriggerQueueException.class,
                () -> queue.send(TriggerMessage.schedule("wf-1", "sch-1", Instant.now())));
    }

    @Test
    void receive_shouldLongPollWithVisibilityTimeout() {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
                .messages(Message.builder().messageId("m-1").receiptHandle("r-1").body("{}").build())
                .build());

        List<ReceivedTrigger> received = queue.receive(50);

        ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(sqsClient).receiveMessage(captor.capture());
        assertEquals(10, captor.getValue().maxNumberOfMessages());
        assertEquals(20, captor.getValue().waitTimeSeconds());
        assertEquals(300, captor.getValue().visibilityTimeout());
        assertEquals(List.of(new ReceivedTrigger("m-1", "r-1", "{}")), received);
    }

    @Test
    void deadLetter_withoutDeadLetterQueueShouldOnlyDelete() {
        queue.deadLetter(new ReceivedTrigger("m-1", "r-1", "garbage"), "消息体不是合法 JSON");

        verify(sqsClient, never()).sendMessage(any(SendMessageRequest.class));
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void deadLetter_shouldForwardThenDelete() {
        properties.setDeadLetterQueueUrl("http://localhost:4566/000000000000/trigger-dlq");

        queue.deadLetter(new ReceivedTrigger("m-1", "r-1", "garbage"), "消息体不是合法 JSON");

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(captor.capture());
        assertEquals("http://localhost:4566/000000000000/trigger-dlq", captor.getValue().queueUrl());
        assertEquals("garbage", captor.getValue().messageBody());
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void constructor_shouldRequireApiTimeoutAboveWaitTime() {
        QueueProperties invalid = new QueueProperties();
        invalid.setApiCallTimeout(Duration.ofSeconds(10));

        assertThrows(IllegalArgumentException.class,
                () -> new SqsTriggerQueue(sqsClient, invalid, new TriggerMessageCodec(new ObjectMapper())));
    }
}
