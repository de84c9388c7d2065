package com.sandstormtracker.service.store;

import com.sandstormtracker.dto.stats.WeaponTotals;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchPlayerStat;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.MatchWeaponStat;
import com.sandstormtracker.model.mongo.PlayerMatchStatus;
import com.sandstormtracker.repository.mongo.FriendlyFireIncidentRepository;
import com.sandstormtracker.repository.mongo.MatchPlayerStatRepository;
import com.sandstormtracker.repository.mongo.MatchRepository;
import com.sandstormtracker.repository.mongo.PlayerRepository;
import com.sandstormtracker.repository.mongo.ServerRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoStatStoreTest {

    private static final LocalDateTime AT = LocalDateTime.of(2025, 11, 15, 12, 0);

    @Mock
    private MongoTemplate mongoTemplate;
    @Mock
    private ServerRepository serverRepository;
    @Mock
    private MatchRepository matchRepository;
    @Mock
    private PlayerRepository playerRepository;
    @Mock
    private MatchPlayerStatRepository matchPlayerStatRepository;
    @Mock
    private FriendlyFireIncidentRepository friendlyFireIncidentRepository;

    private final ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
    private final ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

    private MongoStatStore store;

    @BeforeEach
    void setUp() {
        store = new MongoStatStore(mongoTemplate, serverRepository, matchRepository, playerRepository,
            matchPlayerStatRepository, friendlyFireIncidentRepository);
    }

    private Document section(String operator) {
        return update.getValue().getUpdateObject().get(operator, Document.class);
    }

    @Test
    void countersAreIncrementedInPlace() {
        store.incrementStat("m1", "p1", StatCounter.FRIENDLY_FIRE_KILLS);

        verify(mongoTemplate).upsert(query.capture(), update.capture(), eq(MatchPlayerStat.class));
        assertThat(query.getValue().getQueryObject())
            .containsEntry("matchId", "m1")
            .containsEntry("playerId", "p1");
        assertThat(section("$inc")).containsEntry("friendlyFireKills", 1);
    }

    @Test
    void ensureStatSetsDefaultsOnlyOnInsert() {
        store.ensureStat("m1", "p1", 1, AT);

        verify(mongoTemplate).upsert(query.capture(), update.capture(), eq(MatchPlayerStat.class));
        assertThat(section("$setOnInsert"))
            .containsEntry("firstJoinedAt", AT)
            .containsEntry("sessionCount", 1)
            .containsEntry("currentlyConnected", true);
        assertThat(section("$set")).containsEntry("team", 1);
    }

    @Test
    void ensureStatWithoutTeamLeavesTeamAlone() {
        store.ensureStat("m1", "p1", null, AT);

        verify(mongoTemplate).upsert(query.capture(), update.capture(), eq(MatchPlayerStat.class));
        assertThat(section("$set")).doesNotContainKey("team");
    }

    @Test
    void endMatchOnlyClosesOngoingMatch() {
        store.endMatch("m1", MatchStatus.CRASHED, AT);

        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(Match.class));
        assertThat(query.getValue().getQueryObject())
            .containsEntry("_id", "m1")
            .containsEntry("status", MatchStatus.ONGOING);
        assertThat(section("$set"))
            .containsEntry("status", MatchStatus.CRASHED)
            .containsEntry("endTime", AT);
    }

    @Test
    void closingStatsLeavesDisconnectedRowsAlone() {
        store.closeAllStats("m1", PlayerMatchStatus.FINISHED, AT);

        verify(mongoTemplate).updateMulti(query.capture(), update.capture(), eq(MatchPlayerStat.class));
        assertThat(query.getValue().getQueryObject())
            .containsEntry("matchId", "m1")
            .containsEntry("currentlyConnected", true);
        assertThat(section("$set"))
            .containsEntry("status", PlayerMatchStatus.FINISHED)
            .containsEntry("lastLeftAt", AT);
    }

    @Test
    void playTimeNeverShrinks() {
        store.updateScore("m1", "p1", 150, 480);

        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(MatchPlayerStat.class));
        assertThat(section("$max")).containsEntry("totalPlayTime", 480L);
        assertThat(section("$set")).containsEntry("score", 150);
    }

    @Test
    void weaponTotalsComeFromAggregation() {
        List<WeaponTotals> totals = List.of(new WeaponTotals("M16A4", 3), new WeaponTotals("Molotov", 1));
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(MatchWeaponStat.class), eq(WeaponTotals.class)))
            .thenReturn(new AggregationResults<>(totals, new Document()));

        assertThat(store.weaponTotals("p1")).containsExactlyElementsOf(totals);
    }
}
