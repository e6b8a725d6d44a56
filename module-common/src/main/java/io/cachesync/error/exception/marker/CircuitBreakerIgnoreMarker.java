package io.cachesync.error.exception.marker;

/** 서킷 브레이커 집계에서 제외되는 예외 (호출자 입력 오류) */
public interface CircuitBreakerIgnoreMarker {}
