package io.cachesync.error.exception;

import io.cachesync.error.CacheErrorCode;
import io.cachesync.error.exception.base.ServerBaseException;

public class CacheEventCodecException extends ServerBaseException {

  public CacheEventCodecException(String detail, Throwable cause) {
    super(CacheErrorCode.EVENT_CODEC_FAILED, cause, detail);
  }
}
