package com.example.schedulerservice.messaging;

import com.example.schedulerservice.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running poll loop feeding queue messages to a {@link ControlMessageHandler}.
 */
@Slf4j
public class ControlPlaneConsumer implements AutoCloseable {
    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);
    private static final long ERROR_BACKOFF_MS = 1000;

    private final Consumer<String, String> consumer;
    private final ControlMessageHandler handler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread thread;

    public ControlPlaneConsumer(Consumer<String, String> consumer, ControlMessageHandler handler) {
        this.consumer = consumer;
        this.handler = handler;
    }

    public static ControlPlaneConsumer create(SchedulerConfig.KafkaSettings kafka, ControlMessageHandler handler) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBrokers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, kafka.getGroupId());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        KafkaConsumer<String, String> consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(kafka.getTopic()));
        log.info("Kafka consumer initialized for topic {} (group {})", kafka.getTopic(), kafka.getGroupId());
        return new ControlPlaneConsumer(consumer, handler);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("consumer already started");
        }
        thread = new Thread(this::run, "control-plane-consumer");
        thread.setDaemon(true);
        thread.start();
    }

    void run() {
        try {
            while (running.get()) {
                try {
                    ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                    for (ConsumerRecord<String, String> record : records) {
                        log.debug("Control message at {}-{}@{}", record.topic(), record.partition(), record.offset());
                        handler.handle(record.value());
                    }
                } catch (WakeupException e) {
                    log.debug("Consumer woken up");
                } catch (KafkaException e) {
                    log.error("Error reading control messages", e);
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (RuntimeException e) {
                    log.error("Unexpected error in control consumer", e);
                    Thread.sleep(ERROR_BACKOFF_MS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            consumer.close();
            log.info("Kafka consumer closed");
        }
    }

    @Override
    public void close() {
        running.set(false);
        consumer.wakeup();
        Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t == null) {
            consumer.close();
            return;
        }
        try {
            t.join(10_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
