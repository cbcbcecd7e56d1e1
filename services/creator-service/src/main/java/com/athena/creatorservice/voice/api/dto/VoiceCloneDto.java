package com.athena.creatorservice.voice.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VoiceCloneDto(
    @NotBlank(message = "user_id is required")
    @Size(max = 255, message = "user_id must be at most 255 characters")
    String userId,

    @NotBlank(message = "voice_id is required")
    @Size(max = 255, message = "voice_id must be at most 255 characters")
    String voiceId
) {}
