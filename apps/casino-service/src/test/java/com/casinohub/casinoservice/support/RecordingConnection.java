package com.casinohub.casinoservice.support;

import com.casinohub.casinoservice.platform.broadcast.RoomConnection;
import com.casinohub.casinoservice.platform.transport.Envelope;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录收到的消息与关闭原因的测试连接。
 */
public class RecordingConnection implements RoomConnection {

    private final String connectionId;
    private final String token;
    public final List<Envelope<?>> received = new CopyOnWriteArrayList<>();
    public volatile String closedReason;

    public RecordingConnection(String connectionId, String token) {
        this.connectionId = connectionId;
        this.token = token;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public void deliver(Envelope<?> envelope) {
        received.add(envelope);
    }

    @Override
    public void close(String reason) {
        closedReason = reason;
    }

    public List<Long> sequences() {
        return received.stream().map(Envelope::sequence).toList();
    }
}
