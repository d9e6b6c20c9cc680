package com.sunny.trigger.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.enums.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerMessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TriggerMessageCodec codec;

    @BeforeEach
    void setUp() {
        codec = new TriggerMessageCodec(objectMapper);
    }

    @Test
    void encode_shouldWriteFixedSchema() throws Exception {
        TriggerMessage message = TriggerMessage.schedule("wf-1", "sch-1", Instant.parse("2025-03-10T10:00:30Z"));

        JsonNode node = objectMapper.readTree(codec.encode(message));

        assertEquals(4, node.size());
        assertEquals("wf-1", node.get("workflowId").asText());
        assertEquals("sch-1", node.get("scheduleId").asText());
        assertEquals("2025-03-10T10:00:30Z", node.get("triggerTime").asText());
        assertEquals("schedule", node.get("triggerType").asText());
    }

    @Test
    void decode_shouldReadValidMessage() {
        TriggerMessage message = codec.decode("""
                {"workflowId":"wf-1","scheduleId":"sch-1","triggerTime":"2025-03-10T10:00:30.123Z","triggerType":"schedule"}
                """);

        assertEquals("wf-1", message.workflowId());
        assertEquals("sch-1", message.scheduleId());
        assertEquals(Instant.parse("2025-03-10T10:00:30.123Z"), message.triggerTime());
        assertEquals(TriggerType.SCHEDULE, message.triggerType());
    }

    @Test
    void decode_shouldRejectMissingField() {
        MalformedTriggerMessageException ex = assertThrows(MalformedTriggerMessageException.class,
                () -> codec.decode("{\"workflowId\":\"wf-1\",\"triggerTime\":\"2025-03-10T10:00:30Z\",\"triggerType\":\"schedule\"}"));

        assertTrue(ex.getMessage().contains("scheduleId"));
    }

    @Test
    void decode_shouldRejectUnknownField() {
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode(
                "{\"workflowId\":\"wf-1\",\"scheduleId\":\"s\",\"triggerTime\":\"2025-03-10T10:00:30Z\","
                        + "\"triggerType\":\"schedule\",\"extra\":1}"));
    }

    @Test
    void decode_shouldRejectWrongTypes() {
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode(
                "{\"workflowId\":42,\"scheduleId\":\"s\",\"triggerTime\":\"2025-03-10T10:00:30Z\",\"triggerType\":\"schedule\"}"));
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode(
                "{\"workflowId\":\"w\",\"scheduleId\":\"s\",\"triggerTime\":\"yesterday\",\"triggerType\":\"schedule\"}"));
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode(
                "{\"workflowId\":\"w\",\"scheduleId\":\"s\",\"triggerTime\":\"2025-03-10T10:00:30Z\",\"triggerType\":\"webhook\"}"));
    }

    @Test
    void decode_shouldRejectNonObjectBodies() {
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode(""));
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode("{not json"));
        assertThrows(MalformedTriggerMessageException.class, () -> codec.decode("[1,2]"));
    }

    @Test
    void triggerKey_shouldTruncateToMinute() {
        TriggerMessage first = TriggerMessage.schedule("wf-1", "sch-1", Instant.parse("2025-03-10T10:00:01Z"));
        TriggerMessage second = TriggerMessage.schedule("wf-1", "sch-1", Instant.parse("2025-03-10T10:00:59.900Z"));

        assertEquals("sch-1:2025-03-10T10:00:00Z", first.triggerKey());
        assertEquals(first.triggerKey(), second.triggerKey());
    }
}
