/*
 * どこで: Chat Relay サービス層
 * 何を: like/unmatch の状態遷移とマッチ通知、関係一覧の参照を担う
 * なぜ: 対単位のロック下で遷移表を適用し、マッチの対称性を保つため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.api.InvalidRelationshipRequestException;
import com.example.chat_relay.api.UserNotFoundException;
import com.example.chat_relay.model.LikeOutcome;
import com.example.chat_relay.model.NotificationType;
import com.example.chat_relay.model.RelationshipRecord;
import com.example.chat_relay.model.RelationshipState;
import com.example.chat_relay.model.RelationshipTransitions;
import com.example.chat_relay.model.RelationshipTransitions.Transition;
import com.example.chat_relay.model.UnmatchOutcome;
import com.example.chat_relay.model.UserPair;
import com.example.chat_relay.model.UserRecord;
import com.example.chat_relay.repository.RelationshipRepository;
import com.example.chat_relay.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RelationshipService implements RelationshipGate {

  private static final Logger logger = LoggerFactory.getLogger(RelationshipService.class);
  static final String MATCH_NOTIFICATION_PREFIX = "You matched with ";

  private final RelationshipRepository relationshipRepository;
  private final UserRepository userRepository;
  private final MessageStore messageStore;
  private final PairLockKeyGenerator lockKeyGenerator;
  private final ChatRelayMetrics metrics;
  private final Clock clock;

  @Override
  public boolean isMatched(String a, String b) {
    if (isBlank(a) || isBlank(b) || a.equals(b)) {
      return false;
    }
    return relationshipRepository.isMatched(UserPair.of(a, b));
  }

  @Transactional
  public LikeOutcome like(String actorId, String targetId) {
    validatePair(actorId, targetId, "like");
    final UserRecord actor = requireUser(actorId);
    final UserRecord target = requireUser(targetId);
    final UserPair pair = UserPair.of(actorId, targetId);
    // 同じ対への操作をロックで直列化してから現在状態を読む
    relationshipRepository.lockPair(lockKeyGenerator.generate(pair));
    final Optional<RelationshipRecord> current = relationshipRepository.findByPair(pair);
    final RelationshipState state =
        current.map(record -> record.stateFor(actorId)).orElse(RelationshipState.UNRELATED);
    final Transition<LikeOutcome> transition = RelationshipTransitions.onLike(state);
    final Instant now = Instant.now(clock);

    if (transition.changesState()) {
      switch (transition.to()) {
        case ACTOR_LIKED -> requireUpdated(relationshipRepository.insertLiked(pair, actorId, now));
        case MATCHED -> {
          requireUpdated(relationshipRepository.markMatched(pair, current.get().version(), now));
          notifyMatch(actor, target);
        }
        default -> throw new IllegalStateException("unexpected like transition: " + transition);
      }
    }
    metrics.recordLike(transition.outcome());
    logger.info(
        "like applied actor_id={} target_id={} from={} to={} outcome={}",
        actorId,
        targetId,
        transition.from(),
        transition.to(),
        transition.outcome());
    return transition.outcome();
  }

  @Transactional
  public UnmatchOutcome unmatch(String actorId, String targetId) {
    validatePair(actorId, targetId, "unmatch");
    requireUser(targetId);
    final UserPair pair = UserPair.of(actorId, targetId);
    relationshipRepository.lockPair(lockKeyGenerator.generate(pair));
    final Optional<RelationshipRecord> current = relationshipRepository.findByPair(pair);
    final RelationshipState state =
        current.map(record -> record.stateFor(actorId)).orElse(RelationshipState.UNRELATED);
    final Transition<UnmatchOutcome> transition = RelationshipTransitions.onUnmatch(state);
    if (transition.changesState()) {
      requireUpdated(relationshipRepository.deleteMatched(pair, current.get().version()));
    }
    logger.info(
        "unmatch applied actor_id={} target_id={} outcome={}",
        actorId,
        targetId,
        transition.outcome());
    return transition.outcome();
  }

  public List<UserRecord> likedUsers(String userId) {
    return resolveUsers(relationshipRepository.findLikedUserIds(userId));
  }

  public List<UserRecord> likedBy(String userId) {
    return resolveUsers(relationshipRepository.findLikedByUserIds(userId));
  }

  public List<UserRecord> matches(String userId) {
    return resolveUsers(relationshipRepository.findMatchedUserIds(userId));
  }

  private void notifyMatch(UserRecord actor, UserRecord target) {
    // 両者に 1 件ずつ。遷移と同じトランザクションで確定させる
    messageStore.appendNotification(
        actor.userId(), NotificationType.MATCH, MATCH_NOTIFICATION_PREFIX + target.displayName());
    messageStore.appendNotification(
        target.userId(), NotificationType.MATCH, MATCH_NOTIFICATION_PREFIX + actor.displayName());
  }

  private List<UserRecord> resolveUsers(List<String> userIds) {
    // リポジトリの並び順を保つ
    final Map<String, UserRecord> byId =
        userRepository.findByIds(userIds).stream()
            .collect(Collectors.toMap(UserRecord::userId, Function.identity()));
    return userIds.stream().map(byId::get).filter(user -> user != null).toList();
  }

  private UserRecord requireUser(String userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new UserNotFoundException("user not found: " + userId));
  }

  private void validatePair(String actorId, String targetId, String action) {
    if (isBlank(actorId) || isBlank(targetId)) {
      throw new InvalidRelationshipRequestException("user id is required");
    }
    if (actorId.equals(targetId)) {
      throw new InvalidRelationshipRequestException("cannot " + action + " yourself");
    }
  }

  private void requireUpdated(int updated) {
    if (updated != 1) {
      // ロック下で読んだ version と食い違うのは不変条件違反
      throw new IllegalStateException("relationship changed concurrently");
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
