package com.casinohub.casinoservice.platform.broadcast;

import com.alibaba.fastjson2.JSON;
import com.casinohub.casinoservice.platform.transport.Envelope;
import com.casinohub.casinoservice.platform.transport.MessageType;
import lombok.Data;

/**
 * 总线上传输的消息体，origin 用于忽略本实例发出的回声。
 */
@Data
public class BusMessage {
    private String origin;
    private MessageType type;
    private long sequence;
    private long ts;
    /** 载荷 JSON */
    private String payload;

    public static BusMessage of(String origin, Envelope<?> envelope) {
        BusMessage m = new BusMessage();
        m.setOrigin(origin);
        m.setType(envelope.type());
        m.setSequence(envelope.sequence());
        m.setTs(envelope.ts());
        m.setPayload(JSON.toJSONString(envelope.payload()));
        return m;
    }

    /** 还原为信封，载荷为通用 JSON 结构 */
    public Envelope<Object> toEnvelope(String roomId) {
        return Envelope.of(type, roomId, sequence, payload == null ? null : JSON.parse(payload), ts);
    }
}
