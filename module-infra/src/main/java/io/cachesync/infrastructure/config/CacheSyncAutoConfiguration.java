package io.cachesync.infrastructure.config;

import io.cachesync.common.executor.DefaultLogicExecutor;
import io.cachesync.common.executor.LogicExecutor;
import io.cachesync.core.port.CacheAdapter;
import io.cachesync.core.port.CachePubSub;
import io.cachesync.core.service.CacheService;
import io.cachesync.infrastructure.memory.MemoryCacheAdapter;
import io.cachesync.infrastructure.pubsub.ChannelNames;
import io.cachesync.infrastructure.pubsub.CacheEventCodec;
import io.cachesync.infrastructure.pubsub.RedisCachePubSub;
import io.cachesync.infrastructure.redis.RedisCacheAdapter;
import io.cachesync.infrastructure.redis.RedissonClientFactory;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * cache-sync Auto-Configuration
 *
 * <h3>등록 빈</h3>
 *
 * <ul>
 *   <li>{@link LogicExecutor}: 공통 실행기 (없을 때만)
 *   <li>{@link CacheAdapter}: {@code cache-sync.adapter}에 따라 Memory 또는 Redis
 *   <li>{@link CachePubSub}: {@code cache-sync.pubsub.enabled=true}일 때만 Redis Pub/Sub
 *   <li>{@link CacheService}: 시작 시 connect/subscribe, 종료 시 close
 * </ul>
 *
 * <p>모든 빈은 {@code @ConditionalOnMissingBean}이므로 애플리케이션에서 교체할 수 있습니다.
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(CacheSyncProperties.class)
public class CacheSyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry cacheSyncMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor cacheSyncLogicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry);
  }

  @Bean(destroyMethod = "disconnect")
  @ConditionalOnMissingBean
  public CacheAdapter cacheAdapter(CacheSyncProperties properties, LogicExecutor executor) {
    if (properties.adapter() == CacheSyncProperties.AdapterType.REDIS) {
      CacheSyncProperties.Redis redis = properties.redis();
      log.info("[CacheSync] Using Redis adapter: {}:{}", redis.host(), redis.port());
      return new RedisCacheAdapter(
          redis.toSettings(),
          RedissonClientFactory.defaultFactory(),
          executor,
          circuitBreaker(redis.circuitBreaker()),
          Clock.systemUTC());
    }
    CacheSyncProperties.Memory memory = properties.memory();
    log.info("[CacheSync] Using in-memory adapter: capacity={}", memory.capacity());
    return new MemoryCacheAdapter(memory.capacity(), memory.effectiveDefaultTtl());
  }

  @Bean(destroyMethod = "disconnect")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "cache-sync.pubsub", name = "enabled", havingValue = "true")
  public CachePubSub cachePubSub(
      CacheSyncProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    return new RedisCachePubSub(
        properties.redis().toSettings(),
        RedissonClientFactory.defaultFactory(),
        new CacheEventCodec(),
        executor,
        meterRegistry);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public CacheService cacheService(
      CacheSyncProperties properties,
      CacheAdapter adapter,
      ObjectProvider<CachePubSub> pubSub,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    CachePubSub channel = pubSub.getIfAvailable();
    CacheService.Builder builder =
        CacheService.builder().adapter(adapter).executor(executor).meterRegistry(meterRegistry);
    if (channel != null) {
      String channelPattern = properties.pubsub().channelPattern();
      // 발행 채널을 만들 수 없는 패턴은 기동 시점에 거부
      ChannelNames.forPattern(channelPattern);
      builder
          .pubSub(channel)
          .originId(resolveOriginId(properties))
          .channelPattern(channelPattern);
    }
    return builder.build();
  }

  static String resolveOriginId(CacheSyncProperties properties) {
    String configured = properties.originId();
    return configured == null || configured.isBlank() ? UUID.randomUUID().toString() : configured;
  }

  private static CircuitBreaker circuitBreaker(CacheSyncProperties.CircuitBreaker props) {
    return RedisCacheAdapter.circuitBreaker(
        props.failureRateThreshold(), props.slidingWindowSize(), props.waitDurationInOpenState());
  }

}
