package com.athena.creatorservice.agent.domain;

import com.athena.creatorservice.common.dto.ErrorCode;
import com.athena.creatorservice.common.exception.CreatorServiceException;

/**
 * Raised both for missing agents and for agents owned by someone else, so callers cannot test
 * for the existence of other users' agents.
 */
public class AgentNotFoundException extends CreatorServiceException {
  public AgentNotFoundException() {
    super(ErrorCode.AGENT_NOT_FOUND);
  }
}
