package com.sandstormtracker.model.mongo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// ========== Match Player Stat Entity ==========
// One row per (match, player), reused across reconnects.
@Document(collection = "match_player_stats")
@CompoundIndex(name = "match_player", def = "{'matchId': 1, 'playerId': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchPlayerStat {
    @Id
    private String id;

    @Indexed
    private String matchId;

    @Indexed
    private String playerId;

    private Integer team;

    private int kills;
    private int assists;
    private int deaths;
    private int friendlyFireKills;
    private int objectivesCaptured;
    private int objectivesDestroyed;
    private int score;

    private long totalPlayTime; // seconds
    private int sessionCount;

    private boolean currentlyConnected;
    private PlayerMatchStatus status;

    private LocalDateTime firstJoinedAt;
    private LocalDateTime lastLeftAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
