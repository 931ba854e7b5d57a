package com.casinohub.casinoservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话回收专用调度器，与 WebSocket 心跳调度器分开，避免相互影响。
 */
@Configuration
public class ReaperSchedulerConfig {

	@Bean(name = "reaperScheduler", destroyMethod = "shutdownNow")
	public ScheduledExecutorService reaperScheduler() {
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "session-reaper-" + idx.getAndIncrement());
				// 设置为守护线程
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
