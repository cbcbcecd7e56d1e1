package com.athena.creatorservice.voice.api.controller;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.athena.creatorservice.common.exception.ValidationException;
import com.athena.creatorservice.voice.application.UserVoiceUsecase;
import com.athena.creatorservice.voice.domain.VoiceNotFoundException;
import com.athena.creatorservice.voice.domain.models.UserVoice;
import com.athena.creatorservice.voice.domain.models.VoiceSaveResult;
import java.time.OffsetDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(UserVoiceController.class)
class UserVoiceControllerTest {
  private static final UserVoice ALLOY =
      new UserVoice(3L, "u-1", "alloy", OffsetDateTime.parse("2024-05-01T10:00:00Z"));

  @Autowired
  private MockMvc mvc;

  @MockitoBean
  private UserVoiceUsecase userVoiceUsecase;

  @Test
  void firstSaveIsCreated() throws Exception {
    when(userVoiceUsecase.cloneBuiltInVoice("u-1", "alloy"))
        .thenReturn(VoiceSaveResult.created(ALLOY));

    mvc.perform(post("/creator/voices").contentType(MediaType.APPLICATION_JSON)
            .content("{\"user_id\":\"u-1\",\"voice_id\":\"alloy\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.message").value("Voice saved successfully"))
        .andExpect(jsonPath("$.data.voice_id").value("alloy"))
        .andExpect(jsonPath("$.data.user_id").value("u-1"));
  }

  @Test
  void repeatedSaveReturnsExistingRow() throws Exception {
    when(userVoiceUsecase.cloneBuiltInVoice("u-1", "alloy"))
        .thenReturn(VoiceSaveResult.existing(ALLOY));

    mvc.perform(post("/creator/voices").contentType(MediaType.APPLICATION_JSON)
            .content("{\"user_id\":\"u-1\",\"voice_id\":\"alloy\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Voice already saved for this user"))
        .andExpect(jsonPath("$.data.id").value(3));
  }

  @Test
  void saveRequiresBothIds() throws Exception {
    mvc.perform(post("/creator/voices").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Validation failed"))
        .andExpect(jsonPath("$.errors").value(
            containsInAnyOrder("user_id is required", "voice_id is required")));

    verifyNoInteractions(userVoiceUsecase);
  }

  @Test
  void saveRejectsIdsLongerThanTheirColumn() throws Exception {
    String voiceId = "v".repeat(256);

    mvc.perform(post("/creator/voices").contentType(MediaType.APPLICATION_JSON)
            .content("{\"user_id\":\"u-1\",\"voice_id\":\"" + voiceId + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors").value(
            containsInAnyOrder("voice_id must be at most 255 characters")));

    verifyNoInteractions(userVoiceUsecase);
  }

  @Test
  void listCarriesCount() throws Exception {
    when(userVoiceUsecase.findUserVoices("u-1")).thenReturn(List.of(ALLOY));

    mvc.perform(get("/creator/voices").param("user_id", "u-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.data[0].voice_id").value("alloy"));
  }

  @Test
  void listWithoutUserIsBadRequest() throws Exception {
    when(userVoiceUsecase.findUserVoices(null))
        .thenThrow(new ValidationException("user_id is required"));

    mvc.perform(get("/creator/voices"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("user_id is required"));
  }

  @Test
  void deletingUnsavedVoiceIs404() throws Exception {
    when(userVoiceUsecase.removeUserVoice("u-1", "echo")).thenThrow(new VoiceNotFoundException());

    mvc.perform(delete("/creator/voices/echo").param("user_id", "u-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Voice not found for this user"));
  }

  @Test
  void deleteReturnsRemovedRowId() throws Exception {
    when(userVoiceUsecase.removeUserVoice("u-1", "alloy")).thenReturn(3L);

    mvc.perform(delete("/creator/voices/alloy").param("user_id", "u-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Voice deleted successfully"))
        .andExpect(jsonPath("$.data.id").value(3));
  }
}
