package com.knowledgechat.dbu.factory;

import static org.assertj.core.api.Assertions.assertThat;

import com.knowledgechat.dbu.model.ImmutableDatabase;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.immutables.value.Value;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JdbiFactoryTest {

  private Jdbi jdbi;

  @BeforeEach
  void setup() {
    jdbi = new JdbiFactory(ImmutableDatabase.builder()
        .url("jdbc:hsqldb:mem:" + getClass().getSimpleName() + ":" + UUID.randomUUID())
        .username("SA")
        .build(), Set.of(Grant.class))
        .createJdbi();
    jdbi.useHandle(handle -> handle.execute(
        "create table GRANT_ROW (SUBJECT_ID varchar(64) primary key, SOURCE_TYPE varchar(32) not null)"));
  }

  @Test
  void createJdbi_mapsSnakeCaseColumnsToRowTypes() {
    final GrantDao dao = jdbi.onDemand(GrantDao.class);
    final Grant grant = ImmutableGrant.builder().subjectId("user-1").sourceType("drive").build();

    assertThat(dao.insert(grant)).isTrue();

    assertThat(dao.read("user-1")).contains(grant);
    assertThat(dao.read("user-2")).isEmpty();
  }

  @Value.Immutable
  public interface Grant {
    String subjectId();

    String sourceType();
  }

  public interface GrantDao {
    @SqlUpdate("insert into GRANT_ROW (SUBJECT_ID, SOURCE_TYPE) values (:subjectId, :sourceType)")
    boolean insert(@BindPojo Grant grant);

    @SqlQuery("select * from GRANT_ROW where SUBJECT_ID = :subjectId")
    Optional<Grant> read(@Bind("subjectId") String subjectId);
  }
}
