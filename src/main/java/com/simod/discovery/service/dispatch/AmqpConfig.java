package com.simod.discovery.service.dispatch;

import com.simod.discovery.service.config.DispatchConfig;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Broker topology for the RabbitMQ transport.
 *
 * Declared by Spring's RabbitAdmin on first connection: a durable topic
 * exchange, a durable task queue and the binding for pending discoveries.
 */
@Configuration
@ConditionalOnProperty(prefix = "discovery.dispatch", name = "transport", havingValue = "rabbit")
public class AmqpConfig {

    @Bean
    public Declarables discoveryTopology(DispatchConfig dispatchConfig) {
        var rabbit = dispatchConfig.getRabbit();

        TopicExchange exchange = ExchangeBuilder.topicExchange(rabbit.getExchange())
                .durable(true)
                .build();
        Queue queue = QueueBuilder.durable(rabbit.getQueue()).build();

        return new Declarables(
                exchange,
                queue,
                BindingBuilder.bind(queue).to(exchange).with(rabbit.getRoutingKey()));
    }
}
