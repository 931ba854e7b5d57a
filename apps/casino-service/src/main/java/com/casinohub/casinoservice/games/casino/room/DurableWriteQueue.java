package com.casinohub.casinoservice.games.casino.room;

import com.casinohub.casinoservice.common.GameError;
import lombok.extern.slf4j.Slf4j;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 持久化写队列：内存提交之后由单个写线程执行，不占用房间锁。
 * 写入失败记 PERSISTENCE_UNAVAILABLE 告警并保留，下次 flush 时重试。
 */
@Slf4j
public class DurableWriteQueue implements AutoCloseable {

    private final Executor writer;
    private final Deque<PendingWrite> failed = new ConcurrentLinkedDeque<>();

    public DurableWriteQueue() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "durable-writer");
            t.setDaemon(true);
            return t;
        }));
    }

    public DurableWriteQueue(Executor writer) {
        this.writer = writer;
    }

    public void submit(String description, Runnable write) {
        writer.execute(() -> attempt(new PendingWrite(description, write)));
    }

    /**
     * 重试此前失败的写入。
     */
    public void flush() {
        if (failed.isEmpty()) {
            return;
        }
        writer.execute(() -> {
            int n = failed.size();
            AtomicInteger recovered = new AtomicInteger();
            for (int i = 0; i < n; i++) {
                PendingWrite w = failed.pollFirst();
                if (w == null) {
                    break;
                }
                if (attempt(w)) {
                    recovered.incrementAndGet();
                }
            }
            if (recovered.get() > 0) {
                log.info("持久化重试成功: count={}, remaining={}", recovered.get(), failed.size());
            }
        });
    }

    public int pendingRetries() {
        return failed.size();
    }

    private boolean attempt(PendingWrite w) {
        try {
            w.write().run();
            return true;
        } catch (Exception e) {
            failed.addLast(w);
            log.warn("{}: 持久化写入失败，等待重试: {}", GameError.PERSISTENCE_UNAVAILABLE, w.description(), e);
            return false;
        }
    }

    @Override
    public void close() throws InterruptedException {
        if (writer instanceof ExecutorService es) {
            es.shutdown();
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("持久化写线程未在超时内结束，剩余写入将丢失");
            }
        }
    }

    private record PendingWrite(String description, Runnable write) {
    }
}
