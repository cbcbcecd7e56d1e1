package com.athena.creatorservice.voice.domain.models;

public record VoiceSaveResult(UserVoice voice, boolean created) {
  public static VoiceSaveResult created(UserVoice voice) {
    return new VoiceSaveResult(voice, true);
  }

  public static VoiceSaveResult existing(UserVoice voice) {
    return new VoiceSaveResult(voice, false);
  }
}
