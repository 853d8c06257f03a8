/*
 * どこで: Chat Relay Web 設定
 * 何を: /v1 配下の REST 呼び出しをセッション Cookie で認証する
 * なぜ: WebSocket と同じ解決器で呼び出し元ユーザを確定させるため
 */
package com.example.chat_relay.config;

import com.example.chat_relay.service.IdentityResolver;
import com.example.chat_relay.service.SessionCookieExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class SessionAuthenticationInterceptor implements HandlerInterceptor {

  public static final String ATTRIBUTE_USER_ID = "chat.authenticatedUserId";

  private final SessionCookieExtractor cookieExtractor;
  private final IdentityResolver identityResolver;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> cookieHeaders = Collections.list(request.getHeaders(HttpHeaders.COOKIE));
    // 失敗時の AuthFailureException は ApiExceptionHandler が 401 へ変換する
    final String userId = identityResolver.resolve(cookieExtractor.extract(cookieHeaders));
    request.setAttribute(ATTRIBUTE_USER_ID, userId);
    RequestMdcInterceptor.putTracked(request, "user_id", userId);
    return true;
  }
}
