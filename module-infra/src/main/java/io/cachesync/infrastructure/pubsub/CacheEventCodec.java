package io.cachesync.infrastructure.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cachesync.core.domain.CacheChangeEvent;
import io.cachesync.core.domain.ChangeType;
import io.cachesync.error.exception.CacheEventCodecException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import lombok.RequiredArgsConstructor;

/** {@link CacheChangeEvent} ↔ JSON 변환 */
@RequiredArgsConstructor
public class CacheEventCodec {

  private final ObjectMapper objectMapper;

  public CacheEventCodec() {
    this(new ObjectMapper());
  }

  public String encode(CacheChangeEvent event) {
    CacheEventPayload payload =
        new CacheEventPayload(
            event.type().wireName(),
            event.key(),
            event.value(),
            event.timestamp().toString(),
            event.originId(),
            event.sequence());
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new CacheEventCodecException("encode key=" + event.key(), e);
    }
  }

  /**
   * @throws CacheEventCodecException JSON 형식 오류, 필수 필드 누락, 알 수 없는 type
   */
  public CacheChangeEvent decode(String json) {
    try {
      CacheEventPayload payload = objectMapper.readValue(json, CacheEventPayload.class);
      if (payload.type() == null || payload.key() == null || payload.timestamp() == null) {
        throw new CacheEventCodecException("missing type/key/timestamp", null);
      }
      return new CacheChangeEvent(
          ChangeType.fromWireName(payload.type()),
          payload.key(),
          payload.value(),
          Instant.parse(payload.timestamp()),
          payload.originId(),
          payload.sequence());
    } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException e) {
      throw new CacheEventCodecException("decode", e);
    }
  }
}
