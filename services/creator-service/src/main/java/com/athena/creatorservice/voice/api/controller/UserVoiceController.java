package com.athena.creatorservice.voice.api.controller;

import com.athena.creatorservice.common.dto.ApiResponse;
import com.athena.creatorservice.common.dto.DeletedResource;
import com.athena.creatorservice.voice.api.dto.VoiceCloneDto;
import com.athena.creatorservice.voice.application.UserVoiceUsecase;
import com.athena.creatorservice.voice.domain.models.UserVoice;
import com.athena.creatorservice.voice.domain.models.VoiceSaveResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RequestMapping("/creator/voices")
@RestController
public class UserVoiceController {
  private final UserVoiceUsecase userVoiceUsecase;

  @PostMapping
  public ResponseEntity<ApiResponse<UserVoice>> cloneBuiltInVoice(
      @RequestBody @Validated VoiceCloneDto dto) {
    VoiceSaveResult result = userVoiceUsecase.cloneBuiltInVoice(dto.userId(), dto.voiceId());
    if (result.created()) {
      return ResponseEntity.status(HttpStatus.CREATED)
          .body(ApiResponse.ok("Voice saved successfully", result.voice()));
    }
    return ResponseEntity.ok(ApiResponse.ok("Voice already saved for this user", result.voice()));
  }

  @GetMapping
  public ApiResponse<List<UserVoice>> getUserVoices(
      @RequestParam(name = "user_id", required = false) String userId) {
    List<UserVoice> voices = userVoiceUsecase.findUserVoices(userId);
    return ApiResponse.list("User voices retrieved successfully", voices);
  }

  @DeleteMapping("/{voiceId}")
  public ApiResponse<DeletedResource> deleteUserVoice(
      @PathVariable("voiceId") String voiceId,
      @RequestParam(name = "user_id", required = false) String userId) {
    long deletedId = userVoiceUsecase.removeUserVoice(userId, voiceId);
    return ApiResponse.ok("Voice deleted successfully", new DeletedResource(deletedId));
  }
}
