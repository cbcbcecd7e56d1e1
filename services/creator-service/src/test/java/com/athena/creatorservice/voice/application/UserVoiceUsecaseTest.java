package com.athena.creatorservice.voice.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.athena.creatorservice.common.exception.ValidationException;
import com.athena.creatorservice.voice.domain.VoiceNotFoundException;
import com.athena.creatorservice.voice.domain.models.UserVoice;
import com.athena.creatorservice.voice.domain.models.UserVoiceRepository;
import com.athena.creatorservice.voice.domain.models.VoiceSaveResult;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserVoiceUsecaseTest {
  private static final UserVoice ALLOY =
      new UserVoice(1L, "u-1", "alloy", OffsetDateTime.parse("2024-05-01T10:00:00Z"));

  @Mock
  private UserVoiceRepository userVoiceRepository;

  @InjectMocks
  private UserVoiceUsecase userVoiceUsecase;

  @Test
  void firstCloneCreatesRow() {
    when(userVoiceRepository.insertIfAbsent("u-1", "alloy")).thenReturn(Optional.of(ALLOY));

    VoiceSaveResult result = userVoiceUsecase.cloneBuiltInVoice("u-1", "alloy");

    assertTrue(result.created());
    assertSame(ALLOY, result.voice());
    verify(userVoiceRepository, never()).find(any(), any());
  }

  @Test
  void repeatedCloneReturnsStoredRow() {
    when(userVoiceRepository.insertIfAbsent("u-1", "alloy")).thenReturn(Optional.empty());
    when(userVoiceRepository.find("u-1", "alloy")).thenReturn(Optional.of(ALLOY));

    VoiceSaveResult result = userVoiceUsecase.cloneBuiltInVoice("u-1", "alloy");

    assertFalse(result.created());
    assertEquals(1L, result.voice().id());
  }

  @Test
  void cloneRequiresBothIds() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> userVoiceUsecase.cloneBuiltInVoice("u-1", " "));

    assertEquals("user_id and voice_id are required", ex.getMessage());
    verifyNoInteractions(userVoiceRepository);
  }

  @Test
  void listingRequiresUserId() {
    assertThrows(ValidationException.class, () -> userVoiceUsecase.findUserVoices(null));
  }

  @Test
  void listingReturnsRepositoryOrder() {
    when(userVoiceRepository.findByUserId("u-1")).thenReturn(List.of(ALLOY));

    assertEquals(List.of(ALLOY), userVoiceUsecase.findUserVoices("u-1"));
  }

  @Test
  void removingUnsavedVoiceFails() {
    when(userVoiceRepository.delete("u-1", "echo")).thenReturn(Optional.empty());

    VoiceNotFoundException ex = assertThrows(VoiceNotFoundException.class,
        () -> userVoiceUsecase.removeUserVoice("u-1", "echo"));

    assertEquals("Voice not found for this user", ex.getMessage());
  }

  @Test
  void removingSavedVoiceReturnsRowId() {
    when(userVoiceRepository.delete("u-1", "alloy")).thenReturn(Optional.of(1L));

    assertEquals(1L, userVoiceUsecase.removeUserVoice("u-1", "alloy"));
  }
}
