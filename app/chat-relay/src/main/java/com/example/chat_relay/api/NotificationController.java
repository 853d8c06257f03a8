/*
 * どこで: Chat Relay API
 * 何を: 通知一覧と既読化のエンドポイントを提供する
 * なぜ: オフライン中に届いたマッチ/メッセージを利用者へ知らせるため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.config.SessionAuthenticationInterceptor;
import com.example.chat_relay.service.NotificationService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationService notificationService;

  @GetMapping
  public NotificationListResponse list(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId) {
    return new NotificationListResponse(
        notificationService.list(userId).stream().map(NotificationSummary::from).toList());
  }

  @PostMapping("/{notification_id}/read")
  public ResponseEntity<Void> markRead(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId,
      @PathVariable("notification_id") UUID notificationId) {
    notificationService.markRead(userId, notificationId);
    return ResponseEntity.noContent().build();
  }
}
