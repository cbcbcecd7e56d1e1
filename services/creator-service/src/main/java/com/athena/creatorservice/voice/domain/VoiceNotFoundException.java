package com.athena.creatorservice.voice.domain;

import com.athena.creatorservice.common.dto.ErrorCode;
import com.athena.creatorservice.common.exception.CreatorServiceException;

public class VoiceNotFoundException extends CreatorServiceException {
  public VoiceNotFoundException() {
    super(ErrorCode.VOICE_NOT_FOUND);
  }
}
