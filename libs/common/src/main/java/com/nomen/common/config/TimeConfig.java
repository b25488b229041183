/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 時刻依存の処理 (TTL 判定や作成順) をテストで固定できるようにするため
 */
package com.nomen.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
