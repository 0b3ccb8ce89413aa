package com.poc.svc.ingestion.service.consumer;

import com.poc.svc.ingestion.config.IngestionProperties;
import com.poc.svc.ingestion.dto.ConsumerHealth;
import com.poc.svc.ingestion.dto.DrainReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 每個設定的 queue 啟動一條專屬 consumer thread，queue 之間平行、queue 內循序。
 * 關閉時先 drain：等待各 consumer 完成手上的訊息，逾時後中斷剩餘的 thread。
 */
@Service
public class ConsumerManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConsumerManager.class);
    private static final Duration CANCEL_GRACE = Duration.ofSeconds(1);

    private record Worker(QueueConsumer consumer, Thread thread) {
    }

    private final IngestionProperties properties;
    private final QueueConsumerFactory consumerFactory;
    private final Clock clock;

    private final Map<String, Worker> workers = new ConcurrentHashMap<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile boolean running;
    private ScheduledExecutorService watchdog;

    public ConsumerManager(IngestionProperties properties, QueueConsumerFactory consumerFactory, Clock ingestionClock) {
        this.properties = properties;
        this.consumerFactory = consumerFactory;
        this.clock = ingestionClock;
    }

    @Override
    public void start() {
        lifecycleLock.lock();
        try {
            if (running) {
                log.debug("Consumers already running, ignoring start()");
                return;
            }
            for (String queue : properties.getQueues()) {
                String queueName = queue.trim();
                if (queueName.isEmpty() || workers.containsKey(queueName)) {
                    continue;
                }
                QueueConsumer consumer = consumerFactory.create(queueName);
                Thread thread = new Thread(consumer, "consumer-" + queueName);
                workers.put(queueName, new Worker(consumer, thread));
                thread.start();
            }
            startWatchdog();
            running = true;
            log.info("Started {} queue consumer(s): {}", workers.size(), workers.keySet());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void stop() {
        drainAndStop(properties.getConsumers().getDrainTimeout());
    }

    /**
     * 通知所有 consumer 停止拉取，最多等待 {@code timeout} 讓手上的訊息到達 terminal 狀態，之後強制中斷。
     */
    public DrainReport drainAndStop(Duration timeout) {
        lifecycleLock.lock();
        try {
            long started = System.nanoTime();
            if (workers.isEmpty()) {
                running = false;
                return new DrainReport(List.of(), List.of(), Duration.ZERO);
            }
            log.info("Draining {} consumer(s) with timeout {}ms", workers.size(), timeout.toMillis());
            workers.values().forEach(worker -> worker.consumer().requestStop());

            long deadline = started + timeout.toNanos();
            List<String> stopped = new ArrayList<>();
            List<String> cancelled = new ArrayList<>();
            for (Map.Entry<String, Worker> entry : workers.entrySet()) {
                Worker worker = entry.getValue();
                if (joinUntil(worker.thread(), deadline)) {
                    stopped.add(entry.getKey());
                } else {
                    log.warn("Consumer queue={} did not drain within {}ms, interrupting", entry.getKey(), timeout.toMillis());
                    worker.consumer().markCancelled();
                    worker.thread().interrupt();
                    joinUntil(worker.thread(), System.nanoTime() + CANCEL_GRACE.toNanos());
                    cancelled.add(entry.getKey());
                }
            }
            workers.clear();
            stopWatchdog();
            running = false;
            DrainReport report = new DrainReport(stopped, cancelled, Duration.ofNanos(System.nanoTime() - started));
            log.info("Consumers drained stopped={} cancelled={} elapsed={}ms",
                    report.stopped(), report.cancelled(), report.elapsed().toMillis());
            return report;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 讀取各 consumer 狀態，不需取得 lifecycle lock。
     */
    public List<ConsumerHealth> health() {
        Instant now = clock.instant();
        Duration watchdogInterval = properties.getConsumers().getWatchdogInterval();
        List<ConsumerHealth> result = new ArrayList<>();
        for (String queue : properties.getQueues()) {
            Worker worker = workers.get(queue.trim());
            if (worker == null) {
                continue;
            }
            boolean alive = worker.thread().isAlive();
            boolean progressing = Duration.between(worker.consumer().lastProgressAt(), now).compareTo(watchdogInterval) <= 0;
            result.add(worker.consumer().snapshot(alive, alive && progressing));
        }
        return result;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getConsumers().isAutoStartup();
    }

    private boolean joinUntil(Thread thread, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            if (remaining > 0) {
                thread.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)));
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private void startWatchdog() {
        long intervalMillis = properties.getConsumers().getWatchdogInterval().toMillis();
        watchdog = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("consumer-watchdog-"));
        watchdog.scheduleAtFixedRate(this::reportStalledConsumers, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    private void stopWatchdog() {
        if (watchdog != null) {
            watchdog.shutdownNow();
            watchdog = null;
        }
    }

    private void reportStalledConsumers() {
        for (ConsumerHealth consumer : health()) {
            if (!consumer.healthy()) {
                log.warn("Consumer queue={} unhealthy state={} alive={} lastProgressAt={}",
                        consumer.queue(), consumer.state(), consumer.alive(), consumer.lastProgressAt());
            }
        }
    }
}
