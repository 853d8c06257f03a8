package com.example.chat_relay.api;

import com.example.chat_relay.model.UnmatchOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnmatchResponse(UnmatchOutcome outcome) {}
