package com.athena.creatorservice.voice.infrastructure.jooq;

import static com.athena.creatorservice.jooq.Tables.USER_VOICES;

import com.athena.creatorservice.common.infrastructure.SqlStates;
import com.athena.creatorservice.jooq.tables.records.UserVoicesRecord;
import com.athena.creatorservice.voice.domain.models.UserVoice;
import com.athena.creatorservice.voice.domain.models.UserVoiceRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Record1;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JooqUserVoiceRepository implements UserVoiceRepository {
  private final DSLContext dsl;

  @Override
  public Optional<UserVoice> insertIfAbsent(String userId, String voiceId) {
    try {
      return dsl
          .insertInto(USER_VOICES, USER_VOICES.USER_ID, USER_VOICES.VOICE_ID)
          .values(userId, voiceId)
          .onConflict(USER_VOICES.USER_ID, USER_VOICES.VOICE_ID)
          .doNothing()
          .returning()
          .fetchOptional()
          .map(JooqUserVoiceRepository::toDomain);
    } catch (org.springframework.dao.DataAccessException
             | org.jooq.exception.DataAccessException e) {
      throw SqlStates.translate(e);
    }
  }

  @Override
  public Optional<UserVoice> find(String userId, String voiceId) {
    return dsl
        .selectFrom(USER_VOICES)
        .where(USER_VOICES.USER_ID.eq(userId), USER_VOICES.VOICE_ID.eq(voiceId))
        .fetchOptional()
        .map(JooqUserVoiceRepository::toDomain);
  }

  @Override
  public List<UserVoice> findByUserId(String userId) {
    return dsl
        .selectFrom(USER_VOICES)
        .where(USER_VOICES.USER_ID.eq(userId))
        .orderBy(USER_VOICES.CREATED_AT.desc())
        .fetch(JooqUserVoiceRepository::toDomain);
  }

  @Override
  public Optional<Long> delete(String userId, String voiceId) {
    return dsl
        .deleteFrom(USER_VOICES)
        .where(USER_VOICES.USER_ID.eq(userId), USER_VOICES.VOICE_ID.eq(voiceId))
        .returningResult(USER_VOICES.ID)
        .fetchOptional()
        .map(Record1::value1);
  }

  private static UserVoice toDomain(UserVoicesRecord record) {
    return new UserVoice(
        record.getId(), record.getUserId(), record.getVoiceId(), record.getCreatedAt());
  }
}
