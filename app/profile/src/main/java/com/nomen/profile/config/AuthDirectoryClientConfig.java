package com.nomen.profile.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(AuthDirectoryClientProperties.class)
public class AuthDirectoryClientConfig {

  @Bean
  RestClient authDirectoryRestClient(
      RestClient.Builder builder, AuthDirectoryClientProperties properties) {
    // 外部認証基盤 (principal 管理) 呼び出し専用 RestClient。
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
