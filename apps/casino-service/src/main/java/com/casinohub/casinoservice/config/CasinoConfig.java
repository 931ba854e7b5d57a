package com.casinohub.casinoservice.config;

import com.casinohub.casinoservice.application.SessionReaper;
import com.casinohub.casinoservice.games.casino.domain.ai.CasinoMoveAdvisor;
import com.casinohub.casinoservice.games.casino.domain.repository.ActionLogRepository;
import com.casinohub.casinoservice.games.casino.domain.repository.RoomRepository;
import com.casinohub.casinoservice.games.casino.domain.rule.CasinoRules;
import com.casinohub.casinoservice.games.casino.domain.rule.RuleConfig;
import com.casinohub.casinoservice.games.casino.log.ActionLog;
import com.casinohub.casinoservice.games.casino.room.DurableWriteQueue;
import com.casinohub.casinoservice.games.casino.room.RoomPersistence;
import com.casinohub.casinoservice.games.casino.room.RoomStateMachine;
import com.casinohub.casinoservice.games.casino.room.RoomStateStore;
import com.casinohub.casinoservice.games.casino.service.CasinoGameService;
import com.casinohub.casinoservice.games.casino.service.impl.CasinoGameServiceImpl;
import com.casinohub.casinoservice.platform.broadcast.BroadcastHub;
import com.casinohub.casinoservice.platform.broadcast.BroadcastTransport;
import com.casinohub.casinoservice.platform.broadcast.LocalBroadcastTransport;
import com.casinohub.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 对局核心装配：规则引擎 → 状态机 → 房间仓库 → 门面 → 回收任务。
 * 广播传输与持久化按配置选择，Redis 相关 Bean 见 {@link com.casinohub.casinoservice.infrastructure.redis.RedisConfig}。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CasinoProperties.class)
public class CasinoConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleConfig ruleConfig(CasinoProperties props) {
        RuleConfig config = props.getRules().toRuleConfig();
        log.info("规则配置: hand={}, table={}, rounds={}, ace={}, buildTurnPolicy={}",
                config.handSize(), config.tableSize(), config.roundsPerGame(), config.aceMode(), config.buildTurnPolicy());
        return config;
    }

    @Bean
    public CasinoRules casinoRules(RuleConfig ruleConfig) {
        return new CasinoRules(ruleConfig);
    }

    @Bean
    public CasinoMoveAdvisor casinoMoveAdvisor(CasinoRules rules) {
        return new CasinoMoveAdvisor(rules);
    }

    @Bean
    public ActionLog actionLog(CasinoProperties props) {
        return new ActionLog(props.getLog().getRetainedEntries());
    }

    @Bean
    @ConditionalOnProperty(prefix = "casino.broadcast", name = "mode", havingValue = "local", matchIfMissing = true)
    public BroadcastTransport localBroadcastTransport() {
        return new LocalBroadcastTransport();
    }

    @Bean
    public BroadcastHub broadcastHub(BroadcastTransport transport) {
        return new BroadcastHub(transport);
    }

    /**
     * 仓储与写队列只在 casino.persistence.mode=redis 时存在，否则不做持久化。
     */
    @Bean
    public RoomPersistence roomPersistence(CasinoProperties props,
                                           ObjectProvider<RoomRepository> rooms,
                                           ObjectProvider<ActionLogRepository> logs,
                                           ObjectProvider<DurableWriteQueue> queue) {
        RoomRepository roomRepo = rooms.getIfAvailable();
        ActionLogRepository logRepo = logs.getIfAvailable();
        DurableWriteQueue writeQueue = queue.getIfAvailable();
        if (roomRepo == null || logRepo == null || writeQueue == null) {
            log.info("房间持久化未启用（casino.persistence.mode={}）", props.getPersistence().getMode());
            return RoomPersistence.disabled();
        }
        return new RoomPersistence(roomRepo, logRepo, writeQueue, props.getPersistence().getRoomTtl());
    }

    @Bean
    public RoomStateStore roomStateStore(CasinoRules rules, ActionLog actionLog, BroadcastHub hub,
                                         RoomPersistence persistence, Clock clock) {
        return new RoomStateStore(new RoomStateMachine(rules), actionLog, hub, persistence, clock);
    }

    @Bean
    public CasinoGameService casinoGameService(RoomStateStore store, ActionLog actionLog, SessionRegistry sessions,
                                               BroadcastHub hub, CasinoMoveAdvisor advisor, Clock clock) {
        return new CasinoGameServiceImpl(store, actionLog, sessions, hub, advisor, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SessionReaper sessionReaper(SessionRegistry sessions, RoomStateStore store, RoomPersistence persistence,
                                       CasinoProperties props,
                                       @Qualifier("reaperScheduler") ScheduledExecutorService scheduler) {
        return new SessionReaper(sessions, store, persistence, props.getPersistence().getRoomTtl(),
                scheduler, props.getReaper().getInterval());
    }
}
