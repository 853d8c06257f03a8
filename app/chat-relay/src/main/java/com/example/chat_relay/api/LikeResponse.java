package com.example.chat_relay.api;

import com.example.chat_relay.model.LikeOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LikeResponse(boolean matched, LikeOutcome outcome) {

  public static LikeResponse from(LikeOutcome outcome) {
    return new LikeResponse(outcome.matched(), outcome);
  }
}
