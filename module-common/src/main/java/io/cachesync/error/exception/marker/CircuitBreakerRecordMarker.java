package io.cachesync.error.exception.marker;

/** 서킷 브레이커가 실패로 기록해야 하는 예외 (연결 장애, 명령 실패) */
public interface CircuitBreakerRecordMarker {}
