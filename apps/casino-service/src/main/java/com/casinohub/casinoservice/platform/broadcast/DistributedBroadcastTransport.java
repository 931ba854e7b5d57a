package com.casinohub.casinoservice.platform.broadcast;

import com.casinohub.casinoservice.common.GameError;
import com.casinohub.casinoservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;

/**
 * 多实例部署：本地投递之后再经 {@link RoomEventBus} 转发。
 * 总线不可用时记录降级告警并继续，只影响其他实例上的观察者。
 */
@Slf4j
public class DistributedBroadcastTransport implements BroadcastTransport {

    private final RoomEventBus bus;
    private volatile boolean lastPublishFailed;

    public DistributedBroadcastTransport(RoomEventBus bus) {
        this.bus = bus;
    }

    @Override
    public void start(LocalDelivery localDelivery) {
        try {
            bus.subscribe(localDelivery);
            log.info("房间广播使用分布式模式");
        } catch (Exception e) {
            lastPublishFailed = true;
            log.warn("{}: 订阅分布式总线失败，仅本地投递", GameError.BROADCAST_DEGRADED, e);
        }
    }

    @Override
    public void forward(String roomId, Envelope<?> envelope) {
        try {
            bus.publish(roomId, envelope);
            lastPublishFailed = false;
        } catch (Exception e) {
            if (!lastPublishFailed) {
                log.warn("{}: 分布式总线不可用，仅本地投递: roomId={}, sequence={}",
                        GameError.BROADCAST_DEGRADED, roomId, envelope.sequence(), e);
            }
            lastPublishFailed = true;
        }
    }

    @Override
    public boolean degraded() {
        return lastPublishFailed || !bus.healthy();
    }
}
