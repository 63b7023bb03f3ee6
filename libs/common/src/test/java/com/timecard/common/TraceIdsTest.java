package com.timecard.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsUnique() {
    assertThat(TraceIds.newTraceId()).isNotEqualTo(TraceIds.newTraceId());
  }

  @Test
  void sanitizeDropsBlankAndOversizedValues() {
    assertThat(TraceIds.sanitize(null)).isNull();
    assertThat(TraceIds.sanitize("   ")).isNull();
    assertThat(TraceIds.sanitize("x".repeat(129))).isNull();
    assertThat(TraceIds.sanitize(" req-1 ")).isEqualTo("req-1");
  }
}
