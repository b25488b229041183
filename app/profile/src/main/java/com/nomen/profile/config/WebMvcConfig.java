/*
 * どこで: Profile Web 設定
 * 何を: RequestMdcInterceptor を業務 API へ適用する
 * なぜ: 統合や preference 変更のログを account_id / request_id で追えるようにするため
 */
package com.nomen.profile.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // actuator の scrape は件数が多く、業務ログの相関には不要。
    registry.addInterceptor(requestMdcInterceptor).excludePathPatterns("/actuator/**");
  }
}
