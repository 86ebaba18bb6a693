package com.example.planner.config;

import com.example.planner.properties.ApplicationProperties;
import com.example.planner.properties.ApplicationProperties.RedisProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Lettuce connection shared by the progress cache, anomaly windows, notification cooldowns
 * and the cleanup lock. {@code app.redis.mode} picks standalone or cluster.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  private static final Duration TOPOLOGY_REFRESH_PERIOD = Duration.ofMinutes(1);
  private static final Duration MIN_EVICTABLE_IDLE = Duration.ofMinutes(1);

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.create();
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(ClientResources clientResources) {
    RedisProperties redis = properties.redis();
    if (isCluster(redis)) {
      List<RedisNode> nodes = clusterNodes(redis.cluster().nodes());
      log.info("Connecting to Redis cluster ({} seed node(s))", nodes.size());

      RedisClusterConfiguration cluster = new RedisClusterConfiguration();
      cluster.setClusterNodes(nodes);
      cluster.setMaxRedirects(redis.cluster().maxRedirects());
      if (hasPassword(redis)) {
        cluster.setPassword(redis.password());
      }
      return new LettuceConnectionFactory(cluster, clientConfiguration(clientResources, clusterOptions(redis)));
    }

    log.info("Connecting to standalone Redis at {}:{}", redis.host(), redis.port());
    RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(redis.host(), redis.port());
    if (hasPassword(redis)) {
      standalone.setPassword(redis.password());
    }
    LettuceConnectionFactory factory =
        new LettuceConnectionFactory(standalone, clientConfiguration(clientResources, standaloneOptions(redis)));
    factory.setShareNativeConnection(true);
    return factory;
  }

  /**
   * Plain string template. Callers that keep structured values serialize them to JSON themselves.
   */
  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisSerializer serializer = StringRedisSerializer.UTF_8;
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);
    template.setKeySerializer(serializer);
    template.setValueSerializer(serializer);
    template.setHashKeySerializer(serializer);
    template.setHashValueSerializer(serializer);
    template.afterPropertiesSet();
    return template;
  }

  static List<RedisNode> clusterNodes(String nodes) {
    return Arrays.stream(nodes.split(","))
        .map(String::trim)
        .filter(node -> !node.isEmpty())
        .map(RedisNode::fromString)
        .toList();
  }

  private LettuceClientConfiguration clientConfiguration(ClientResources clientResources, ClientOptions options) {
    RedisProperties redis = properties.redis();
    LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig(redis.pool()))
            .clientResources(clientResources)
            .clientOptions(options)
            .commandTimeout(redis.timeout());
    if (redis.ssl().enabled()) {
      builder.useSsl();
    }
    return builder.build();
  }

  private GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig(RedisProperties.PoolProperties pool) {
    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(pool.maxActive());
    config.setMaxIdle(pool.maxIdle());
    config.setMinIdle(pool.minIdle());
    config.setMaxWait(pool.maxWait());
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(pool.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(MIN_EVICTABLE_IDLE);
    return config;
  }

  private ClientOptions standaloneOptions(RedisProperties redis) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(socketOptions(redis.timeout()))
        .timeoutOptions(TimeoutOptions.enabled(redis.timeout()))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS);
    if (redis.ssl().enabled()) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }
    return builder.build();
  }

  private ClusterClientOptions clusterOptions(RedisProperties redis) {
    ClusterClientOptions.Builder builder = ClusterClientOptions.builder()
        .topologyRefreshOptions(ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(TOPOLOGY_REFRESH_PERIOD)
            .enableAllAdaptiveRefreshTriggers()
            .build())
        .socketOptions(socketOptions(redis.timeout()))
        .timeoutOptions(TimeoutOptions.enabled(redis.timeout()))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .maxRedirects(redis.cluster().maxRedirects());
    if (redis.ssl().enabled()) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }
    return builder.build();
  }

  private static SocketOptions socketOptions(Duration timeout) {
    return SocketOptions.builder()
        .connectTimeout(timeout)
        .keepAlive(true)
        .build();
  }

  private static boolean isCluster(RedisProperties redis) {
    return "cluster".equalsIgnoreCase(redis.mode())
        && redis.cluster() != null
        && redis.cluster().nodes() != null
        && !redis.cluster().nodes().isBlank();
  }

  private static boolean hasPassword(RedisProperties redis) {
    return redis.password() != null && !redis.password().isBlank();
  }
}
