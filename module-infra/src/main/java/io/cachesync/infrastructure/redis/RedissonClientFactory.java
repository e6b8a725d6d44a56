package io.cachesync.infrastructure.redis;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;

/**
 * RedissonClient 생성 팩토리
 *
 * <p>테스트에서는 mock 클라이언트를 반환하는 팩토리로 교체합니다.
 */
@FunctionalInterface
public interface RedissonClientFactory {

  RedissonClient create(Config config);

  static RedissonClientFactory defaultFactory() {
    return Redisson::create;
  }

  /**
   * 단일 서버 Config 생성
   *
   * <p>Redisson 내부 명령 재시도는 끄고({@code retryAttempts=0}) 재연결은 {@link RetryStrategy}가 담당합니다. 명령 1회의
   * 최대 대기 시간이 commandTimeout을 넘지 않습니다.
   */
  static Config singleServerConfig(RedisConnectionSettings settings, String clientName) {
    Config config = new Config();
    config.setCodec(StringCodec.INSTANCE);
    config
        .useSingleServer()
        .setAddress(settings.address())
        .setUsername(settings.username())
        .setPassword(settings.password())
        .setDatabase(settings.database())
        .setClientName(clientName)
        .setConnectTimeout((int) settings.connectTimeout().toMillis())
        .setTimeout((int) settings.commandTimeout().toMillis())
        .setRetryAttempts(0)
        .setConnectionPoolSize(16)
        .setConnectionMinimumIdleSize(2);
    return config;
  }
}
