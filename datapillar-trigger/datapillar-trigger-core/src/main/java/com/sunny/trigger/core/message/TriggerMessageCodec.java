package com.sunny.trigger.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sunny.trigger.core.enums.TriggerType;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * 触发消息编解码
 * <p>
 * 固定结构：
 * <pre>
 * { "workflowId": string, "scheduleId": string, "triggerTime": ISO-8601, "triggerType": "schedule" }
 * </pre>
 * 四个字段都必填，未知字段视为格式错误。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class TriggerMessageCodec {

    private static final String WORKFLOW_ID = "workflowId";
    private static final String SCHEDULE_ID = "scheduleId";
    private static final String TRIGGER_TIME = "triggerTime";
    private static final String TRIGGER_TYPE = "triggerType";
    private static final Set<String> FIELDS = Set.of(WORKFLOW_ID, SCHEDULE_ID, TRIGGER_TIME, TRIGGER_TYPE);

    private final ObjectMapper objectMapper;

    public TriggerMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(TriggerMessage message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(WORKFLOW_ID, message.workflowId());
        node.put(SCHEDULE_ID, message.scheduleId());
        node.put(TRIGGER_TIME, message.triggerTime().toString());
        node.put(TRIGGER_TYPE, message.triggerType().getCode());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("触发消息序列化失败: " + message, e);
        }
    }

    /**
     * 解析并校验消息体
     *
     * @throws MalformedTriggerMessageException 消息不符合固定结构
     */
    public TriggerMessage decode(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedTriggerMessageException("消息体为空");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedTriggerMessageException("消息体不是合法 JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedTriggerMessageException("消息体必须是 JSON 对象");
        }
        root.fieldNames().forEachRemaining(name -> {
            if (!FIELDS.contains(name)) {
                throw new MalformedTriggerMessageException("未知字段: " + name);
            }
        });

        String workflowId = requireText(root, WORKFLOW_ID);
        String scheduleId = requireText(root, SCHEDULE_ID);
        Instant triggerTime = parseTime(requireText(root, TRIGGER_TIME));
        String triggerType = requireText(root, TRIGGER_TYPE);
        if (!TriggerType.SCHEDULE.getCode().equals(triggerType)) {
            throw new MalformedTriggerMessageException("不支持的触发类型: " + triggerType);
        }
        return TriggerMessage.schedule(workflowId, scheduleId, triggerTime);
    }

    private String requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new MalformedTriggerMessageException("缺少字段或类型错误: " + field);
        }
        return node.asText();
    }

    private Instant parseTime(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedTriggerMessageException("triggerTime 不是 ISO-8601 时间: " + text, e);
        }
    }
}
