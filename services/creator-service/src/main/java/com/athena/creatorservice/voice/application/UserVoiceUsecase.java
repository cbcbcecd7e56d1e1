package com.athena.creatorservice.voice.application;

import com.athena.creatorservice.common.exception.ValidationException;
import com.athena.creatorservice.voice.domain.VoiceNotFoundException;
import com.athena.creatorservice.voice.domain.models.UserVoice;
import com.athena.creatorservice.voice.domain.models.UserVoiceRepository;
import com.athena.creatorservice.voice.domain.models.VoiceSaveResult;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserVoiceUsecase {
  private final UserVoiceRepository userVoiceRepository;

  /**
   * Saves a built-in voice for the user. Saving the same voice again returns the stored row.
   */
  public VoiceSaveResult cloneBuiltInVoice(String userId, String voiceId) {
    requireIds(userId, voiceId);

    Optional<UserVoice> inserted = userVoiceRepository.insertIfAbsent(userId, voiceId);
    if (inserted.isPresent()) {
      log.info("Voice {} saved for user {}", voiceId, userId);
      return VoiceSaveResult.created(inserted.get());
    }

    UserVoice existing = userVoiceRepository.find(userId, voiceId)
        .orElseThrow(() -> new IllegalStateException(
            "Voice " + voiceId + " conflicted on insert but is missing for user " + userId));
    return VoiceSaveResult.existing(existing);
  }

  public List<UserVoice> findUserVoices(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("user_id is required");
    }
    return userVoiceRepository.findByUserId(userId);
  }

  public long removeUserVoice(String userId, String voiceId) {
    requireIds(userId, voiceId);
    long deletedId = userVoiceRepository.delete(userId, voiceId)
        .orElseThrow(VoiceNotFoundException::new);
    log.info("Voice {} removed for user {}", voiceId, userId);
    return deletedId;
  }

  private static void requireIds(String userId, String voiceId) {
    if (userId == null || userId.isBlank() || voiceId == null || voiceId.isBlank()) {
      throw new ValidationException("user_id and voice_id are required");
    }
  }
}
