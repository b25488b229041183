/*
 * どこで: profile のログ設定テスト
 * 何を: JSON encoder と、RequestMdcInterceptor が積む MDC キーがログ出力へ載ることを検証する
 * なぜ: 統合失敗の調査で account_id / request_id が欠けると追跡できなくなるため
 */
package com.nomen.profile;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  private String configText;

  @BeforeEach
  void loadConfiguration() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();
    configText = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
  }

  @Test
  void usesJsonEncoderWithTraceCorrelation() {
    assertThat(configText)
        .contains("LoggingEventCompositeJsonEncoder")
        .contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"")
        .contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"");
  }

  @Test
  void emitsEveryRequestMdcKey() {
    for (String key :
        new String[] {"request_id", "http_method", "http_path", "client_ip", "account_id"}) {
      assertThat(configText).contains("\"" + key + "\":\"%X{" + key + ":-}\"");
    }
  }
}
