package com.athena.creatorservice.agent.domain.models;

/**
 * Public identity of the user owning an agent, joined in on reads.
 */
public record AgentOwner(
    String userId,
    String name,
    String email
) {}
