/*
 * どこで: Chat Relay API
 * 何を: like/unmatch と関係一覧のエンドポイントを提供する
 * なぜ: マッチの成立と解除を Web クライアントから操作できるようにするため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.config.SessionAuthenticationInterceptor;
import com.example.chat_relay.connection.ConnectionRegistry;
import com.example.chat_relay.service.RelationshipService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
@Validated
public class RelationshipController {

  private final RelationshipService relationshipService;
  private final ConnectionRegistry connectionRegistry;

  @PostMapping("/{target_id}/like")
  public LikeResponse like(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId,
      @PathVariable("target_id") @NotBlank(message = "target_id is required") String targetId) {
    return LikeResponse.from(relationshipService.like(userId, targetId));
  }

  @DeleteMapping("/{target_id}/match")
  public UnmatchResponse unmatch(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId,
      @PathVariable("target_id") @NotBlank(message = "target_id is required") String targetId) {
    return new UnmatchResponse(relationshipService.unmatch(userId, targetId));
  }

  @GetMapping("/me/liked")
  public UserListResponse liked(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId) {
    return new UserListResponse(
        relationshipService.likedUsers(userId).stream().map(UserSummary::from).toList());
  }

  @GetMapping("/me/liked-by")
  public UserListResponse likedBy(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId) {
    return new UserListResponse(
        relationshipService.likedBy(userId).stream().map(UserSummary::from).toList());
  }

  @GetMapping("/me/matches")
  public MatchListResponse matches(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId) {
    return new MatchListResponse(
        relationshipService.matches(userId).stream()
            .map(
                user ->
                    new MatchSummary(
                        user.userId(),
                        user.displayName(),
                        connectionRegistry.isOnline(user.userId())))
            .toList());
  }
}
