/*
 * どこで: Chat Relay WebSocket ハンドシェイク
 * 何を: アップグレード前にセッション Cookie からユーザを解決する
 * なぜ: 未認証の接続にはアプリケーションデータを一切送らないため
 */
package com.example.chat_relay.ws;

import com.example.chat_relay.service.AuthFailureException;
import com.example.chat_relay.service.IdentityResolver;
import com.example.chat_relay.service.SessionCookieExtractor;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
@RequiredArgsConstructor
public class SessionHandshakeInterceptor implements HandshakeInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(SessionHandshakeInterceptor.class);
  public static final String ATTRIBUTE_USER_ID = "chat.userId";

  private final SessionCookieExtractor cookieExtractor;
  private final IdentityResolver identityResolver;

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String credential = cookieExtractor.extract(request.getHeaders().get(HttpHeaders.COOKIE));
    try {
      final String userId = identityResolver.resolve(credential);
      attributes.put(ATTRIBUTE_USER_ID, userId);
      return true;
    } catch (AuthFailureException ex) {
      logger.info(
          "handshake rejected reason={} remote_address={}",
          ex.getReason(),
          request.getRemoteAddress());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    } catch (DataAccessException ex) {
      // 解決できない間は接続させない
      logger.error(
          "handshake identity lookup failed remote_address={}", request.getRemoteAddress(), ex);
      response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
      return false;
    }
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      @Nullable Exception exception) {
    // no-op
  }
}
