package io.clusterquery.query.spring;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties that drive the cluster query auto-configuration.
 */
@Validated
@ConfigurationProperties(prefix = "clusterquery.query")
public class QueryProperties {

    private boolean enabled = true;
    private boolean declareTopology = true;
    @NotBlank
    private String exchange = "cq.query";
    @NotBlank
    private String queuePrefix = "cq.query";
    @NotNull
    private Long nodeAddress;
    private List<Long> peers = new ArrayList<>();
    private String subscriberId;
    private Duration defaultTimeout = Duration.ofSeconds(2);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDeclareTopology() {
        return declareTopology;
    }

    public void setDeclareTopology(boolean declareTopology) {
        this.declareTopology = declareTopology;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = requireText(exchange, "clusterquery.query.exchange");
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    public void setQueuePrefix(String queuePrefix) {
        this.queuePrefix = requireText(queuePrefix, "clusterquery.query.queue-prefix");
    }

    public Long getNodeAddress() {
        return nodeAddress;
    }

    public void setNodeAddress(Long nodeAddress) {
        this.nodeAddress = Objects.requireNonNull(nodeAddress, "clusterquery.query.node-address must not be null");
    }

    public List<Long> getPeers() {
        return peers;
    }

    public void setPeers(List<Long> peers) {
        this.peers = peers == null ? new ArrayList<>() : new ArrayList<>(peers);
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public void setSubscriberId(String subscriberId) {
        this.subscriberId = requireText(subscriberId, "clusterquery.query.subscriber-id");
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        Objects.requireNonNull(defaultTimeout, "clusterquery.query.default-timeout must not be null");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("clusterquery.query.default-timeout must be positive");
        }
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Queue name of this node: {@code <queue-prefix>.<node-address>}.
     */
    public String queueName() {
        if (nodeAddress == null) {
            throw new IllegalArgumentException("clusterquery.query.node-address must not be null");
        }
        return queuePrefix + "." + nodeAddress;
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be null or blank");
        }
        return value;
    }
}
