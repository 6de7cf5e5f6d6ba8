package com.example.sessionguard.domain.entity;

/**
 * States an inbound request passes through in the edge interceptor.
 */
public enum PipelineState {
  RECEIVED,
  SESSION_DECODED,
  REFRESH_ATTEMPTED,
  SKIP_REFRESH,
  GUARDED,
  RESPONDED
}
