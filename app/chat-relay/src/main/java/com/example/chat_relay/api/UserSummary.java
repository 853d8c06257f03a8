package com.example.chat_relay.api;

import com.example.chat_relay.model.UserRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserSummary(String userId, String displayName) {

  public static UserSummary from(UserRecord record) {
    return new UserSummary(record.userId(), record.displayName());
  }
}
