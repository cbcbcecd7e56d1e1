package com.athena.creatorservice.voice.domain.models;

import java.time.OffsetDateTime;

/**
 * A built-in voice a user saved. The (user, voice) pair is unique.
 */
public record UserVoice(
    Long id,
    String userId,
    String voiceId,
    OffsetDateTime createdAt
) {}
