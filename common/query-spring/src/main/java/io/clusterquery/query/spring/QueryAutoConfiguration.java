package io.clusterquery.query.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterquery.query.QueryHandler;
import io.clusterquery.query.QueryManager;
import io.clusterquery.query.QueryMetrics;
import io.clusterquery.query.QuerySsids;
import io.clusterquery.query.cluster.QueryCluster;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration that wires a {@link QueryManager} onto RabbitMQ.
 * <p>
 * Every {@link QueryHandler} bean is registered, in bean order, before the manager subscribes.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(RabbitAutoConfiguration.class)
@ConditionalOnClass({TopicExchange.class, RabbitTemplate.class})
@ConditionalOnProperty(prefix = "clusterquery.query", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(QueryProperties.class)
public class QueryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QueryAutoConfiguration.class);

    @Bean(name = "clusterQueryExchange")
    @ConditionalOnMissingBean(name = "clusterQueryExchange")
    TopicExchange clusterQueryExchange(QueryProperties properties) {
        return ExchangeBuilder.topicExchange(properties.getExchange()).durable(true).build();
    }

    @Bean(name = "clusterQueryQueueName")
    @ConditionalOnMissingBean(name = "clusterQueryQueueName")
    String clusterQueryQueueName(QueryProperties properties) {
        return properties.queueName();
    }

    @Bean(name = "clusterQueryDeclarables")
    @ConditionalOnMissingBean(name = "clusterQueryDeclarables")
    Declarables clusterQueryDeclarables(QueryProperties properties,
                                        @Qualifier("clusterQueryExchange") TopicExchange exchange,
                                        @Qualifier("clusterQueryQueueName") String queueName) {
        if (!properties.isDeclareTopology()) {
            return new Declarables(List.of());
        }
        Queue queue = QueueBuilder.nonDurable(queueName).autoDelete().build();
        String broadcast = AmqpQueryTransport.broadcastBinding(QuerySsids.QUERY);
        String direct = AmqpQueryTransport.nodeBinding(properties.getNodeAddress());
        log.info("Declaring query queue {} on exchange {} with bindings [{}, {}]",
            queueName, exchange.getName(), broadcast, direct);
        return new Declarables(
            queue,
            BindingBuilder.bind(queue).to(exchange).with(broadcast),
            BindingBuilder.bind(queue).to(exchange).with(direct));
    }

    @Bean
    @ConditionalOnBean(AmqpTemplate.class)
    @ConditionalOnMissingBean
    AmqpQueryTransport amqpQueryTransport(AmqpTemplate template, QueryProperties properties) {
        Long nodeAddress = properties.getNodeAddress();
        if (nodeAddress == null) {
            throw new IllegalArgumentException("clusterquery.query.node-address must not be null");
        }
        return new AmqpQueryTransport(template, properties.getExchange(), nodeAddress);
    }

    @Bean
    @ConditionalOnBean(AmqpQueryTransport.class)
    @ConditionalOnMissingBean(QueryCluster.class)
    QueryCluster staticQueryCluster(AmqpQueryTransport transport, QueryProperties properties) {
        return new StaticQueryCluster(transport, properties.getPeers());
    }

    @Bean
    @ConditionalOnMissingBean
    QueryMetrics queryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new MicrometerQueryMetrics(registry) : QueryMetrics.NOOP;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnBean(AmqpQueryTransport.class)
    @ConditionalOnMissingBean
    QueryManager queryManager(AmqpQueryTransport transport,
                              QueryCluster cluster,
                              QueryMetrics metrics,
                              QueryProperties properties,
                              ObjectProvider<QueryHandler> handlers) {
        QueryManager.Builder builder = QueryManager.builder(transport, cluster)
            .subscriberId(properties.getSubscriberId())
            .metrics(metrics);
        handlers.orderedStream().forEach(builder::handler);
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(AmqpQueryTransport.class)
    @ConditionalOnMissingBean
    QueryTrafficListener queryTrafficListener(AmqpQueryTransport transport) {
        return new QueryTrafficListener(transport);
    }

    @Bean
    @ConditionalOnBean(QueryManager.class)
    @ConditionalOnMissingBean
    QueryTemplate queryTemplate(QueryManager manager,
                                ObjectProvider<ObjectMapper> objectMapper,
                                QueryProperties properties) {
        return new QueryTemplate(manager, objectMapper.getIfAvailable(ObjectMapper::new), properties.getDefaultTimeout());
    }
}
