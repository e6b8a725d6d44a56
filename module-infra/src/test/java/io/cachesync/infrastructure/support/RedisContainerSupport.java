package io.cachesync.infrastructure.support;

import io.cachesync.infrastructure.redis.RedisConnectionSettings;
import java.time.Duration;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Redis 7.0 단일 노드 통합 테스트 베이스
 *
 * <p>Docker가 없으면 테스트 클래스 전체가 비활성화됩니다.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
public abstract class RedisContainerSupport {

  @Container
  protected static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7.0"))
          .withExposedPorts(6379)
          .waitingFor(Wait.forListeningPort())
          .withStartupTimeout(Duration.ofMinutes(2));

  protected static RedisConnectionSettings redisSettings() {
    return RedisConnectionSettings.of(REDIS.getHost(), REDIS.getMappedPort(6379));
  }
}
