package com.casinohub.casinoservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * 传输消息外壳
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：type / roomId / sequence / payload / ts
 * - sequence 为房间动作日志序号；与日志无关的消息（心跳应答、拒绝通知）取当前已知的最新序号
 *
 * 用法示例：
 *   Envelope<RoomEvent> msg = Envelope.of(MessageType.ACTION_ACCEPTED, roomId, entry.sequence(), event, now);
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    private final MessageType type;
    private final String roomId;
    private final long sequence;
    private final T payload;
    private final long ts;         // 服务器时间戳（ms）

    private Envelope(MessageType type, String roomId, long sequence, T payload, long ts) {
        this.type = Objects.requireNonNull(type, "type");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.sequence = sequence;
        this.payload = payload;
        this.ts = ts;
    }

    public static <T> Envelope<T> of(MessageType type, String roomId, long sequence, T payload, long ts) {
        return new Envelope<>(type, roomId, sequence, payload, ts);
    }

    // 只读访问器，不提供 setter
    public MessageType type() { return type; }
    public String roomId()    { return roomId; }
    public long sequence()    { return sequence; }
    public T payload()        { return payload; }
    public long ts()          { return ts; }

    @Override public String toString() {
        return "Envelope{" +
                "type=" + type +
                ", roomId='" + roomId + '\'' +
                ", sequence=" + sequence +
                ", ts=" + ts +
                '}';
    }
}
