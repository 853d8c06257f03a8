/*
 * どこで: Chat Relay 関係サービスのユニットテスト
 * 何を: like/unmatch の入力検証と遷移ごとの書き込みを検証する
 * なぜ: 遷移表の結果がリポジトリ操作とマッチ通知へ正しく反映されることを保証するため
 */
package com.example.chat_relay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.chat_relay.api.InvalidRelationshipRequestException;
import com.example.chat_relay.api.UserNotFoundException;
import com.example.chat_relay.model.LikeOutcome;
import com.example.chat_relay.model.NotificationType;
import com.example.chat_relay.model.RelationshipRecord;
import com.example.chat_relay.model.RelationshipStatus;
import com.example.chat_relay.model.UnmatchOutcome;
import com.example.chat_relay.model.UserPair;
import com.example.chat_relay.model.UserRecord;
import com.example.chat_relay.repository.RelationshipRepository;
import com.example.chat_relay.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RelationshipServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final UserRecord ALICE = new UserRecord("alice", "Alice", FIXED_NOW);
  private static final UserRecord BOB = new UserRecord("bob", "Bob", FIXED_NOW);
  private static final UserPair PAIR = UserPair.of("alice", "bob");

  @Mock private RelationshipRepository relationshipRepository;
  @Mock private UserRepository userRepository;
  @Mock private MessageStore messageStore;
  @Mock private ChatRelayMetrics metrics;

  private RelationshipService service;

  @BeforeEach
  void setUp() {
    service =
        new RelationshipService(
            relationshipRepository,
            userRepository,
            messageStore,
            new PairLockKeyGenerator(),
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void selfLikeIsRejectedWithoutTransition() {
    assertThatThrownBy(() -> service.like("alice", "alice"))
        .isInstanceOf(InvalidRelationshipRequestException.class);
    verifyNoInteractions(relationshipRepository);
  }

  @Test
  void likingUnknownUserIsRejected() {
    when(userRepository.findById("alice")).thenReturn(Optional.of(ALICE));
    when(userRepository.findById("ghost")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.like("alice", "ghost"))
        .isInstanceOf(UserNotFoundException.class);
    verifyNoInteractions(relationshipRepository);
  }

  @Test
  void firstLikeInsertsOneWayRow() {
    stubUsers();
    when(relationshipRepository.findByPair(PAIR)).thenReturn(Optional.empty());
    when(relationshipRepository.insertLiked(PAIR, "alice", FIXED_NOW)).thenReturn(1);

    assertThat(service.like("alice", "bob")).isEqualTo(LikeOutcome.LIKED);
    verify(relationshipRepository).lockPair(anyLong());
    verify(metrics).recordLike(LikeOutcome.LIKED);
  }

  @Test
  void likingTwiceIsNoOp() {
    stubUsers();
    when(relationshipRepository.findByPair(PAIR))
        .thenReturn(Optional.of(row(RelationshipStatus.LIKED, "alice", 0L)));

    assertThat(service.like("alice", "bob")).isEqualTo(LikeOutcome.ALREADY_LIKED);
    verify(relationshipRepository, never()).insertLiked(any(), anyString(), any());
    verify(relationshipRepository, never()).markMatched(any(), anyLong(), any());
  }

  @Test
  void likeBackMatchesAndNotifiesBothParties() {
    stubUsers();
    when(relationshipRepository.findByPair(PAIR))
        .thenReturn(Optional.of(row(RelationshipStatus.LIKED, "alice", 4L)));
    when(relationshipRepository.markMatched(PAIR, 4L, FIXED_NOW)).thenReturn(1);

    assertThat(service.like("bob", "alice")).isEqualTo(LikeOutcome.MATCHED);
    verify(messageStore).appendNotification("bob", NotificationType.MATCH, "You matched with Alice");
    verify(messageStore).appendNotification("alice", NotificationType.MATCH, "You matched with Bob");
  }

  @Test
  void lostVersionRaceFailsTheTransaction() {
    stubUsers();
    when(relationshipRepository.findByPair(PAIR))
        .thenReturn(Optional.of(row(RelationshipStatus.LIKED, "alice", 4L)));
    when(relationshipRepository.markMatched(PAIR, 4L, FIXED_NOW)).thenReturn(0);

    assertThatThrownBy(() -> service.like("bob", "alice"))
        .isInstanceOf(IllegalStateException.class);
    verify(messageStore, never()).appendNotification(anyString(), any(), anyString());
  }

  @Test
  void unmatchRemovesMatchedRow() {
    when(userRepository.findById("bob")).thenReturn(Optional.of(BOB));
    when(relationshipRepository.findByPair(PAIR))
        .thenReturn(Optional.of(row(RelationshipStatus.MATCHED, null, 2L)));
    when(relationshipRepository.deleteMatched(PAIR, 2L)).thenReturn(1);

    assertThat(service.unmatch("alice", "bob")).isEqualTo(UnmatchOutcome.UNMATCHED);
  }

  @Test
  void unmatchWithoutMatchIsNoOp() {
    when(userRepository.findById("bob")).thenReturn(Optional.of(BOB));
    when(relationshipRepository.findByPair(PAIR))
        .thenReturn(Optional.of(row(RelationshipStatus.LIKED, "bob", 0L)));

    assertThat(service.unmatch("alice", "bob")).isEqualTo(UnmatchOutcome.NOT_MATCHED);
    verify(relationshipRepository, never()).deleteMatched(any(), anyLong());
  }

  @Test
  void isMatchedIsFalseForSelfWithoutLookup() {
    assertThat(service.isMatched("alice", "alice")).isFalse();
    assertThat(service.isMatched("alice", null)).isFalse();
    verifyNoInteractions(relationshipRepository);
  }

  @Test
  void listsKeepRepositoryOrder() {
    when(relationshipRepository.findMatchedUserIds("alice")).thenReturn(List.of("bob", "carol"));
    final UserRecord carol = new UserRecord("carol", "Carol", FIXED_NOW);
    when(userRepository.findByIds(List.of("bob", "carol"))).thenReturn(List.of(carol, BOB));

    assertThat(service.matches("alice")).containsExactly(BOB, carol);
  }

  private void stubUsers() {
    when(userRepository.findById("alice")).thenReturn(Optional.of(ALICE));
    when(userRepository.findById("bob")).thenReturn(Optional.of(BOB));
  }

  private RelationshipRecord row(RelationshipStatus status, String likedBy, long version) {
    return new RelationshipRecord("alice", "bob", status, likedBy, version, FIXED_NOW, FIXED_NOW);
  }
}
