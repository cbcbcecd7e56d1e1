package com.athena.creatorservice.voice.domain.models;

import java.util.List;
import java.util.Optional;

public interface UserVoiceRepository {
  /**
   * Inserts the pair unless it already exists, in a single statement.
   *
   * @return the inserted row, empty when the pair was already saved
   */
  Optional<UserVoice> insertIfAbsent(String userId, String voiceId);

  Optional<UserVoice> find(String userId, String voiceId);

  List<UserVoice> findByUserId(String userId);

  Optional<Long> delete(String userId, String voiceId);
}
