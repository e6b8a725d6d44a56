package io.cachesync.infrastructure.pubsub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * PubSub 전송 포맷
 *
 * <pre>{@code
 * {"type":"set","key":"user:1","value":"alice","timestamp":"2026-03-01T10:15:30.123Z",
 *  "originId":"api-1","sequence":42}
 * }</pre>
 *
 * <p>{@code value}는 set에서만, {@code originId}/{@code sequence}는 있을 때만 포함됩니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEventPayload(
    String type, String key, String value, String timestamp, String originId, Long sequence) {}
