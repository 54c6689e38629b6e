package com.simod.discovery.service.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.exception.DispatchException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Task queue backed by a RabbitMQ broker.
 *
 * Tasks are published as persistent JSON messages. Workers pull with
 * {@code basicGet} and manual acknowledgement, each delivery on its own
 * channel; closing the channel without an ack returns the message to the
 * queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "discovery.dispatch", name = "transport", havingValue = "rabbit")
public class RabbitTaskQueue implements TaskQueue {

    private static final long POLL_BACKOFF_MS = 100;

    private final RabbitTemplate rabbitTemplate;
    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin amqpAdmin;
    private final ObjectMapper objectMapper;
    private final DispatchConfig config;
    private final MetricsConfig metricsConfig;

    @PostConstruct
    void init() {
        metricsConfig.registerQueueGauge(
                "discovery.queue.size",
                "Current discovery task queue size",
                this::size
        );
        log.info("RabbitMQ TaskQueue using exchange '{}', queue '{}', routing key '{}'",
                rabbit().getExchange(), rabbit().getQueue(), rabbit().getRoutingKey());
    }

    @Override
    public void enqueue(DiscoveryTask task) {
        Message message = toMessage(task);
        try {
            rabbitTemplate.send(rabbit().getExchange(), rabbit().getRoutingKey(), message);
            log.debug("Published task for job {} (attempt {})", task.jobId(), task.attempt());
        } catch (AmqpException e) {
            throw new DispatchException("Broker rejected task: " + e.getMessage(), task.jobId(), e);
        }
    }

    @Override
    public Optional<TaskDelivery> dequeue(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        do {
            Optional<TaskDelivery> delivery = pollOnce();
            if (delivery.isPresent()) {
                return delivery;
            }
            if (!sleepUntilNextPoll(deadline)) {
                break;
            }
        } while (System.currentTimeMillis() < deadline);
        return Optional.empty();
    }

    @Override
    public int size() {
        try {
            QueueInformation info = amqpAdmin.getQueueInfo(rabbit().getQueue());
            return info == null ? 0 : info.getMessageCount();
        } catch (AmqpException e) {
            log.debug("Could not read queue depth: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public int getCapacity() {
        return config.getQueue().getCapacity();
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    // ==================== Consuming ====================

    private Optional<TaskDelivery> pollOnce() {
        Channel channel = null;
        try {
            Connection connection = connectionFactory.createConnection();
            channel = connection.createChannel(false);
            GetResponse response = channel.basicGet(rabbit().getQueue(), false);
            if (response == null) {
                closeQuietly(channel);
                return Optional.empty();
            }
            return decode(channel, response);
        } catch (IOException | AmqpException e) {
            log.warn("Failed to poll task queue: {}", e.getMessage());
            closeQuietly(channel);
            return Optional.empty();
        }
    }

    private Optional<TaskDelivery> decode(Channel channel, GetResponse response) throws IOException {
        long tag = response.getEnvelope().getDeliveryTag();
        try {
            DiscoveryTask task = objectMapper.readValue(response.getBody(), DiscoveryTask.class);
            log.debug("Received task for job {} (tag {})", task.jobId(), tag);
            return Optional.of(new RabbitDelivery(channel, tag, task));
        } catch (IOException e) {
            log.error("Discarding malformed task message (tag {}): {}", tag, e.getMessage());
            channel.basicNack(tag, false, false);
            closeQuietly(channel);
            return Optional.empty();
        }
    }

    private boolean sleepUntilNextPoll(long deadline) {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0) {
            return false;
        }
        try {
            Thread.sleep(Math.min(POLL_BACKOFF_MS, remaining));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Helper Methods ====================

    private Message toMessage(DiscoveryTask task) {
        try {
            return MessageBuilder.withBody(objectMapper.writeValueAsBytes(task))
                    .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                    .setContentEncoding("UTF-8")
                    .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                    .setMessageId(task.jobId() + ":" + task.attempt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize task", task.jobId(), e);
        }
    }

    private DispatchConfig.RabbitConfig rabbit() {
        return config.getRabbit();
    }

    private static void closeQuietly(Channel channel) {
        if (channel == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException e) {
            log.debug("Error closing channel: {}", e.getMessage());
        }
    }

    private static final class RabbitDelivery implements TaskDelivery {

        private final Channel channel;
        private final long tag;
        private final DiscoveryTask task;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private RabbitDelivery(Channel channel, long tag, DiscoveryTask task) {
            this.channel = channel;
            this.tag = tag;
            this.task = task;
        }

        @Override
        public DiscoveryTask task() {
            return task;
        }

        @Override
        public void ack() {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            try {
                channel.basicAck(tag, false);
            } catch (IOException e) {
                throw new DispatchException("Failed to acknowledge task", task.jobId(), e);
            } finally {
                closeQuietly(channel);
            }
        }

        @Override
        public void nack(boolean requeue) {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            try {
                channel.basicNack(tag, false, requeue);
            } catch (IOException e) {
                throw new DispatchException("Failed to reject task", task.jobId(), e);
            } finally {
                closeQuietly(channel);
            }
        }
    }
}
