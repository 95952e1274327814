package org.vivarium.datapipeline.resources.logging;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.vivarium.runtime.spi.IStructuredLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Structured log sink backed by a bounded queue and a daemon writer thread. Each record is
 * written as one JSON line to the {@code vivarium.structured} logger; Logback decides where
 * the lines end up.
 * <p>
 * {@link #log(String, Map)} never blocks. When the queue is full the record is dropped and
 * counted.
 */
public class AsyncStructuredLogger implements IStructuredLogSink, AutoCloseable {

    public static final String LOGGER_NAME = "vivarium.structured";

    private static final Logger LOG = LoggerFactory.getLogger(AsyncStructuredLogger.class);

    private record Entry(String type, long timestampMillis, Map<String, Object> fields) {
    }

    private final Logger sink;
    private final BlockingQueue<Entry> queue;
    private final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final Thread writer;
    private volatile boolean closed;

    /**
     * @param options {@code queueCapacity} (default 1000).
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public AsyncStructuredLogger(Config options) {
        this(options, LoggerFactory.getLogger(LOGGER_NAME));
    }

    AsyncStructuredLogger(Config options, Logger sink) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("queueCapacity", 1000)));
        int capacity;
        try {
            capacity = finalConfig.getInt("queueCapacity");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for AsyncStructuredLogger", e);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.writer = new Thread(this::drainLoop, "structured-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
    }

    @Override
    public void log(String type, Map<String, Object> fields) {
        if (closed) {
            dropped.incrementAndGet();
            return;
        }
        Entry entry = new Entry(type, System.currentTimeMillis(),
            fields == null ? Map.of() : new LinkedHashMap<>(fields));
        if (!queue.offer(entry)) {
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 1000 == 0) {
                LOG.warn("Structured log queue is full, {} records dropped so far", total);
            }
        }
    }

    private void drainLoop() {
        try {
            while (!closed || !queue.isEmpty()) {
                Entry entry = queue.poll(100, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    write(entry);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        List<Entry> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        remaining.forEach(this::write);
    }

    private void write(Entry entry) {
        try {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("type", entry.type());
            line.put("ts", entry.timestampMillis());
            line.putAll(entry.fields());
            sink.info(gson.toJson(line));
            written.incrementAndGet();
        } catch (RuntimeException e) {
            dropped.incrementAndGet();
            LOG.warn("Failed to write structured '{}' record: {}", entry.type(), e.getMessage());
        }
    }

    /**
     * Stops accepting records and waits up to one second for the queue to drain.
     */
    @Override
    public void close() {
        closed = true;
        try {
            writer.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while flushing structured log");
        }
        if (writer.isAlive()) {
            writer.interrupt();
        }
    }

    public long getWrittenCount() {
        return written.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueueSize() {
        return queue.size();
    }
}
