/*
 * どこで: Beacon Web 設定
 * 何を: RequestMdcInterceptor を業務 API (/v1) に適用する
 * なぜ: actuator のスクレイプでログの MDC を汚さず、API ログにだけ運用キーを埋め込むため
 */
package com.example.beacon.config;

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
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**");
  }
}
