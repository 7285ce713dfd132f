/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spring3;

import java.time.Duration;
import java.util.Optional;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import com.macstab.oss.redis.bridge.RedisBridgeClient;
import com.macstab.oss.redis.bridge.RedisBridgeOptions;
import com.macstab.oss.redis.bridge.lettuce.LettuceRedisTransport;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.RedisTransport;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.resource.ClientResources;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot 3 auto-configuration for {@link RedisBridgeClient}.
 *
 * <p><strong>Activation:</strong> Lettuce on the classpath and {@code redis.bridge.enabled} not
 * {@code false}.
 *
 * <p><strong>Beans</strong> (each backs off when the application defines its own):
 *
 * <ul>
 *   <li>{@link RedisClient} built from {@code spring.data.redis.*} (URL, or host, port, username,
 *       password, database, SSL, timeouts and client name)
 *   <li>{@link RedisTransport} over that client
 *   <li>{@link RedisBridgeOptions} from {@link RedisBridgeProperties}
 *   <li>{@link RedisBridgeClient}, cleaned up on context shutdown
 * </ul>
 *
 * <p>The client connects lazily (on the first command, see {@code redis.bridge.auto-connect}), so
 * the context starts without a reachable server.
 *
 * <p><strong>Metrics:</strong> when {@code redis-bridge-metrics} is present its {@link
 * RedisBridgeMetrics} bean is passed to the client.
 *
 * <p><strong>Topology:</strong> standalone only. Sentinel and cluster settings are ignored with a
 * warning.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.redis.bridge.metrics.autoconfigure.RedisBridgeMetricsAutoConfiguration")
@ConditionalOnClass(RedisClient.class)
@ConditionalOnProperty(
    prefix = "redis.bridge",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties({RedisProperties.class, RedisBridgeProperties.class})
public class RedisBridgeAutoConfiguration {

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(RedisClient.class)
  public RedisClient redisBridgeRedisClient(
      final RedisProperties redisProperties,
      final ObjectProvider<ClientResources> clientResources) {

    warnOnUnsupportedTopology(redisProperties);

    final var uri = buildRedisUri(redisProperties);
    final var resources = clientResources.getIfAvailable();
    final var client =
        resources != null ? RedisClient.create(resources, uri) : RedisClient.create(uri);

    final Duration connectTimeout = redisProperties.getConnectTimeout();
    if (connectTimeout != null) {
      client.setOptions(
          ClientOptions.builder()
              .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
              .build());
    }

    if (log.isInfoEnabled()) {
      log.info(
          "Redis bridge client target: {}:{} (db {}, ssl={})",
          uri.getHost(),
          Integer.valueOf(uri.getPort()),
          Integer.valueOf(uri.getDatabase()),
          Boolean.valueOf(uri.isSsl()));
    }

    return client;
  }

  @Bean
  @ConditionalOnMissingBean(RedisTransport.class)
  public RedisTransport redisBridgeTransport(final RedisClient redisClient) {
    return new LettuceRedisTransport(redisClient);
  }

  @Bean
  @ConditionalOnMissingBean(RedisBridgeOptions.class)
  public RedisBridgeOptions redisBridgeOptions(final RedisBridgeProperties properties) {
    return properties.toOptions();
  }

  @Bean(destroyMethod = "cleanup")
  @ConditionalOnMissingBean(RedisBridgeClient.class)
  public RedisBridgeClient redisBridgeClient(
      final RedisTransport transport,
      final RedisBridgeOptions options,
      final ObjectProvider<RedisBridgeMetrics> metricsProvider) {

    final var metrics = Optional.ofNullable(metricsProvider.getIfAvailable());

    if (log.isInfoEnabled()) {
      log.info(
          "Redis bridge client '{}': counting={}, autoConnect={}, metrics={}",
          options.getConnectionName(),
          options.getSubscriptionCounting(),
          Boolean.valueOf(options.isAutoConnect()),
          metrics.isPresent() ? "enabled" : "disabled");
    }

    return new RedisBridgeClient(transport, options, metrics);
  }

  /** URL overrides the individual properties. */
  static RedisURI buildRedisUri(final RedisProperties props) {
    final RedisURI uri;
    if (StringUtils.hasText(props.getUrl())) {
      uri = RedisURI.create(props.getUrl());
    } else {
      final var builder =
          RedisURI.builder()
              .withHost(props.getHost())
              .withPort(props.getPort())
              .withDatabase(props.getDatabase())
              .withSsl(props.getSsl() != null && props.getSsl().isEnabled());

      if (StringUtils.hasText(props.getUsername()) && StringUtils.hasText(props.getPassword())) {
        builder.withAuthentication(props.getUsername(), props.getPassword());
      } else if (StringUtils.hasText(props.getPassword())) {
        builder.withPassword(props.getPassword());
      }
      uri = builder.build();
    }

    if (props.getTimeout() != null) {
      uri.setTimeout(props.getTimeout());
    }
    if (StringUtils.hasText(props.getClientName())) {
      uri.setClientName(props.getClientName());
    }
    return uri;
  }

  private void warnOnUnsupportedTopology(final RedisProperties props) {
    final var sentinel = props.getSentinel();
    if (sentinel != null && StringUtils.hasText(sentinel.getMaster())) {
      log.warn("spring.data.redis.sentinel.* is not supported by the Redis bridge, ignoring");
    }
    final var cluster = props.getCluster();
    if (cluster != null && cluster.getNodes() != null && !cluster.getNodes().isEmpty()) {
      log.warn("spring.data.redis.cluster.* is not supported by the Redis bridge, ignoring");
    }
  }
}
