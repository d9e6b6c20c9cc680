package com.sunny.trigger.core.queue;

import com.sunny.trigger.core.message.TriggerMessage;

import java.util.List;

/**
 * 触发队列
 * <p>
 * 至少一次投递：读取后的消息在可见性超时内对其他消费者不可见，
 * 未确认删除则超时后重新出现。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public interface TriggerQueue {

    /**
     * 发送触发消息
     *
     * @return 队列分配的消息 ID
     * @throws TriggerQueueException 队列不可用
     */
    String send(TriggerMessage message);

    /**
     * 长轮询接收原始消息，可能返回空列表
     */
    List<ReceivedTrigger> receive(int maxMessages);

    /**
     * 确认处理完成，删除消息
     */
    void acknowledge(ReceivedTrigger received);

    /**
     * 格式错误的消息转入死信队列并从原队列删除
     */
    void deadLetter(ReceivedTrigger received, String reason);
}
