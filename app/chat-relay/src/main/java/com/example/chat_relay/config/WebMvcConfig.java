/*
 * どこで: Chat Relay Web 設定
 * 何を: MDC と認証のインターセプタを適用する
 * なぜ: API ログへ運用キーを安定して埋め込み、/v1 を認証必須にするため
 */
package com.example.chat_relay.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final SessionAuthenticationInterceptor sessionAuthenticationInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
    registry.addInterceptor(sessionAuthenticationInterceptor).addPathPatterns("/v1/**");
  }
}
