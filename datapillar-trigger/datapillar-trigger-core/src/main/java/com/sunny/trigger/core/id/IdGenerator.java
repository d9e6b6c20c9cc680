package com.sunny.trigger.core.id;

/**
 * 调度与执行记录的 ID 生成器（Snowflake 变种）
 * <p>
 * 64 位结构：
 * - 1 位：符号位（始终为 0）
 * - 41 位：时间戳（毫秒级）
 * - 10 位：节点 ID（0-1023，由主机名哈希得到）
 * - 12 位：序列号（每毫秒 4096 个）
 * <p>
 * Server 与 Worker 都会写 Execution，各进程节点 ID 不同即可避免冲突。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class IdGenerator {

    /**
     * 起始时间戳（2024-01-01 00:00:00 UTC）
     */
    private static final long EPOCH = 1704067200000L;

    private static final int NODE_ID_BITS = 10;

    private static final int SEQUENCE_BITS = 12;

    private static final int MAX_NODE_ID = (1 << NODE_ID_BITS) - 1;

    private static final int MAX_SEQUENCE = (1 << SEQUENCE_BITS) - 1;

    private static final int TIMESTAMP_SHIFT = NODE_ID_BITS + SEQUENCE_BITS;

    /**
     * 允许等待追平的最大时钟回拨
     */
    private static final long MAX_BACKWARD_MS = 5;

    private final int nodeId;

    private long lastTimestamp = -1L;

    private int sequence = 0;

    public IdGenerator(int nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException("节点 ID 必须在 0-" + MAX_NODE_ID + " 之间，当前值: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * 由主机名或进程标识派生节点 ID
     */
    public static IdGenerator fromAddress(String address) {
        int nodeId = Math.floorMod(address.hashCode(), MAX_NODE_ID + 1);
        return new IdGenerator(nodeId);
    }

    public synchronized long nextId() {
        long currentTimestamp = System.currentTimeMillis();

        if (currentTimestamp < lastTimestamp) {
            long offset = lastTimestamp - currentTimestamp;
            if (offset > MAX_BACKWARD_MS) {
                throw new IllegalStateException("时钟回拨超过 " + MAX_BACKWARD_MS + "ms，拒绝生成 ID，回拨: " + offset + "ms");
            }
            try {
                Thread.sleep(offset + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("时钟回拨等待被中断", e);
            }
            currentTimestamp = System.currentTimeMillis();
        }

        if (currentTimestamp == lastTimestamp) {
            sequence = (sequence + 1) & MAX_SEQUENCE;
            if (sequence == 0) {
                currentTimestamp = waitNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0;
        }

        lastTimestamp = currentTimestamp;
        return ((currentTimestamp - EPOCH) << TIMESTAMP_SHIFT)
                | ((long) nodeId << SEQUENCE_BITS)
                | sequence;
    }

    /**
     * 字符串形式的 ID，调度与执行表主键使用
     */
    public String nextIdString() {
        return Long.toString(nextId());
    }

    private long waitNextMillis(long lastTimestamp) {
        long timestamp = System.currentTimeMillis();
        while (timestamp <= lastTimestamp) {
            timestamp = System.currentTimeMillis();
        }
        return timestamp;
    }

    public int getNodeId() {
        return nodeId;
    }
}
