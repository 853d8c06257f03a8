/*
 * どこで: Chat Relay 認証
 * 何を: Cookie ヘッダから設定名のセッション値を取り出す
 * なぜ: WebSocket ハンドシェイクと REST で同じ取り出し規則を使うため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.config.ChatSessionProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionCookieExtractor {

  private final ChatSessionProperties sessionProperties;

  /** Cookie ヘッダ群から最初に見つかった値を返す。見つからなければ null。 */
  public String extract(List<String> cookieHeaders) {
    if (cookieHeaders == null) {
      return null;
    }
    final String cookieName = sessionProperties.cookieName();
    for (String header : cookieHeaders) {
      if (header == null) {
        continue;
      }
      for (String part : header.split(";")) {
        final int eq = part.indexOf('=');
        if (eq <= 0) {
          continue;
        }
        if (part.substring(0, eq).trim().equals(cookieName)) {
          return unquote(part.substring(eq + 1).trim());
        }
      }
    }
    return null;
  }

  private String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
