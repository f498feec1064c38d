package com.market.pulse.enricher.bus;

import com.market.pulse.enricher.common.Result;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * In-process bus. Each subscription owns a queue drained by its own worker thread,
 * which blocks until a message arrives and stops when cancelled.
 * Intended for local runs and tests (single JVM).
 */
@Slf4j
public final class InMemoryEventBus implements EventBus {

    private final Map<String, List<QueueSubscription>> subscribers = new ConcurrentHashMap<>();

    @Override
    public Result<Long> publish(String channel, String payload) {
        if (payload == null) payload = "{}";
        long delivered = 0;
        for (QueueSubscription s : subscribers.getOrDefault(channel, List.of())) {
            if (s.offer(payload)) delivered++;
        }
        log.debug("Published message to {} ({} subscribers)", channel, delivered);
        return Result.ok(delivered);
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        QueueSubscription s = new QueueSubscription(channel, handler);
        subscribers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(s);
        s.start();
        log.info("Subscribed to channel: {}", channel);
        return s;
    }

    /**
     * Cancels every subscription.
     */
    public void shutdown() {
        subscribers.values().forEach(list -> list.forEach(QueueSubscription::cancel));
        subscribers.clear();
    }

    private final class QueueSubscription implements Subscription {
        private final String channel;
        private final Consumer<String> handler;
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        private final ExecutorService worker;
        private volatile boolean active = true;

        QueueSubscription(String channel, Consumer<String> handler) {
            this.channel = channel;
            this.handler = handler;
            this.worker = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "bus-" + channel);
                t.setDaemon(true);
                return t;
            });
        }

        void start() {
            worker.execute(this::drain);
        }

        boolean offer(String payload) {
            return active && queue.offer(payload);
        }

        private void drain() {
            while (active && !Thread.currentThread().isInterrupted()) {
                String message;
                try {
                    message = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                try {
                    handler.accept(message);
                } catch (Exception e) {
                    log.error("Error processing message on {}: {}", channel, e.getMessage(), e);
                }
            }
            log.info("Subscription to {} stopped", channel);
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public void cancel() {
            if (!active) return;
            active = false;
            List<QueueSubscription> list = subscribers.get(channel);
            if (list != null) list.remove(this);
            worker.shutdownNow();
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
