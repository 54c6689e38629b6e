package com.simod.discovery.service.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.exception.DispatchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RabbitTaskQueueTest {

    private static final DiscoveryTask TASK = new DiscoveryTask(
            "job-1", "job-1/event_log.csv", "job-1/configuration.yaml", 1, Instant.parse("2024-05-01T10:00:00Z"));

    @Mock
    private RabbitTemplate rabbitTemplate;
    @Mock
    private ConnectionFactory connectionFactory;
    @Mock
    private Connection connection;
    @Mock
    private Channel channel;
    @Mock
    private AmqpAdmin amqpAdmin;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private RabbitTaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RabbitTaskQueue(rabbitTemplate, connectionFactory, amqpAdmin, objectMapper,
                new DispatchConfig(), new MetricsConfig(new SimpleMeterRegistry()));
    }

    @Test
    void enqueue_publishesPersistentJsonToTopicExchange() throws Exception {
        queue.enqueue(TASK);

        ArgumentCaptor<Message> message = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq("simod"), eq("discoveries.status.pending"), message.capture());
        assertThat(message.getValue().getMessageProperties().getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);
        var body = objectMapper.readTree(message.getValue().getBody());
        assertThat(body.path("job_id").asText()).isEqualTo("job-1");
        assertThat(body.path("log_ref").asText()).isEqualTo("job-1/event_log.csv");
        assertThat(body.path("config_ref").asText()).isEqualTo("job-1/configuration.yaml");
    }

    @Test
    void enqueue_brokerFailure_throwsDispatchException() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).send(any(String.class), any(String.class), any(Message.class));

        assertThatThrownBy(() -> queue.enqueue(TASK))
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("Broker rejected task");
    }

    @Test
    void dequeue_acknowledgesOnlyWhenTold() throws Exception {
        when(connectionFactory.createConnection()).thenReturn(connection);
        when(connection.createChannel(false)).thenReturn(channel);
        when(channel.basicGet("discoveries", false)).thenReturn(response(7, objectMapper.writeValueAsBytes(TASK)));
        when(channel.isOpen()).thenReturn(true);

        Optional<TaskDelivery> delivery = queue.dequeue(100);

        assertThat(delivery).get().extracting(TaskDelivery::task).isEqualTo(TASK);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());

        delivery.get().ack();
        verify(channel).basicAck(7, false);
        verify(channel).close();
    }

    @Test
    void nack_requeuesOnTheBroker() throws Exception {
        when(connectionFactory.createConnection()).thenReturn(connection);
        when(connection.createChannel(false)).thenReturn(channel);
        when(channel.basicGet("discoveries", false)).thenReturn(response(9, objectMapper.writeValueAsBytes(TASK)));

        queue.dequeue(100).orElseThrow().nack(true);

        verify(channel).basicNack(9, false, true);
    }

    @Test
    void dequeue_malformedMessage_isDiscarded() throws Exception {
        when(connectionFactory.createConnection()).thenReturn(connection);
        when(connection.createChannel(false)).thenReturn(channel);
        when(channel.basicGet("discoveries", false))
                .thenReturn(response(3, "{not json".getBytes()))
                .thenReturn(null);

        assertThat(queue.dequeue(50)).isEmpty();
        verify(channel).basicNack(3, false, false);
    }

    @Test
    void size_readsQueueDepthFromBroker() {
        when(amqpAdmin.getQueueInfo("discoveries")).thenReturn(new QueueInformation("discoveries", 12, 1));

        assertThat(queue.size()).isEqualTo(12);
        assertThat(queue.isDurable()).isTrue();
    }

    private static GetResponse response(long tag, byte[] body) {
        return new GetResponse(new Envelope(tag, false, "simod", "discoveries.status.pending"), null, body, 0);
    }
}
