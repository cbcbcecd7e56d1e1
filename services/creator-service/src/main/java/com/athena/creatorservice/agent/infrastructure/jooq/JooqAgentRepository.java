package com.athena.creatorservice.agent.infrastructure.jooq;

import static com.athena.creatorservice.agent.infrastructure.mapper.AgentRecordMapper.CREATOR_EMAIL;
import static com.athena.creatorservice.agent.infrastructure.mapper.AgentRecordMapper.CREATOR_NAME;
import static com.athena.creatorservice.jooq.Tables.AGENTS;
import static com.athena.creatorservice.jooq.Tables.USERS;

import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentIdentifier;
import com.athena.creatorservice.agent.domain.models.AgentPatch;
import com.athena.creatorservice.agent.domain.models.AgentRepository;
import com.athena.creatorservice.agent.infrastructure.mapper.AgentRecordMapper;
import com.athena.creatorservice.common.infrastructure.SqlStates;
import com.athena.creatorservice.jooq.tables.records.AgentsRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Record1;
import org.jooq.SelectOnConditionStep;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JooqAgentRepository implements AgentRepository {
  static final String UNKNOWN_CREATOR_MESSAGE = "Invalid creator_id - user does not exist";

  private final DSLContext dsl;
  private final AgentRecordMapper agentRecordMapper;

  @Override
  public Agent save(Agent agent) {
    try {
      AgentsRecord record = dsl
          .insertInto(AGENTS)
          .set(agentRecordMapper.toRecord(agent))
          .returning()
          .fetchOne();
      return agentRecordMapper.toDomain(record);
    } catch (org.springframework.dao.DataAccessException
             | org.jooq.exception.DataAccessException e) {
      throw SqlStates.translate(e, UNKNOWN_CREATOR_MESSAGE);
    }
  }

  @Override
  public List<Agent> findByCreatorId(long creatorId) {
    return selectWithOwner()
        .where(AGENTS.CREATOR_ID.eq(creatorId))
        .orderBy(AGENTS.CREATED_AT.desc())
        .fetch(agentRecordMapper::toDomainWithOwner);
  }

  @Override
  public Optional<Agent> findByIdAndCreatorId(AgentIdentifier agentId, long creatorId) {
    return selectWithOwner()
        .where(matches(agentId), AGENTS.CREATOR_ID.eq(creatorId))
        .fetchOptional()
        .map(agentRecordMapper::toDomainWithOwner);
  }

  @Override
  public Optional<Agent> update(AgentIdentifier agentId, long creatorId, AgentPatch patch) {
    try {
      return dsl
          .update(AGENTS)
          .set(agentRecordMapper.toChangedRecord(patch))
          .set(AGENTS.UPDATED_AT, DSL.currentOffsetDateTime())
          .where(matches(agentId), AGENTS.CREATOR_ID.eq(creatorId))
          .returning()
          .fetchOptional()
          .map(agentRecordMapper::toDomain);
    } catch (org.springframework.dao.DataAccessException
             | org.jooq.exception.DataAccessException e) {
      throw SqlStates.translate(e, UNKNOWN_CREATOR_MESSAGE);
    }
  }

  @Override
  public Optional<Long> delete(AgentIdentifier agentId, long creatorId) {
    return dsl
        .deleteFrom(AGENTS)
        .where(matches(agentId), AGENTS.CREATOR_ID.eq(creatorId))
        .returningResult(AGENTS.ID)
        .fetchOptional()
        .map(Record1::value1);
  }

  @Override
  public void attachTrainingId(long agentId, UUID trainingApiUuid) {
    dsl
        .update(AGENTS)
        .set(AGENTS.TRAINING_API_UUID, trainingApiUuid)
        .where(AGENTS.ID.eq(agentId))
        .execute();
  }

  private SelectOnConditionStep<Record> selectWithOwner() {
    return dsl
        .select(AGENTS.fields())
        .select(USERS.USER_ID, CREATOR_NAME, CREATOR_EMAIL)
        .from(AGENTS)
        .leftJoin(USERS).on(AGENTS.CREATOR_ID.eq(USERS.ID));
  }

  private static Condition matches(AgentIdentifier agentId) {
    if (agentId instanceof AgentIdentifier.External external) {
      return AGENTS.TRAINING_API_UUID.eq(external.value());
    }
    if (agentId instanceof AgentIdentifier.Numeric numeric) {
      return AGENTS.ID.eq(numeric.value());
    }
    throw new IllegalArgumentException("Unsupported agent identifier: " + agentId);
  }
}
