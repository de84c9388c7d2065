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

// ========== Match Entity ==========
@Document(collection = "matches")
@CompoundIndex(name = "server_status", def = "{'serverId': 1, 'status': 1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Match {
    @Id
    private String id;

    @Indexed
    private String serverId; // external id

    private String map;
    private String scenario;
    private String mode;       // e.g. "Checkpoint", "Push"
    private String playerTeam; // "Security" / "Insurgents", null when the scenario has no side
    private Integer maxPlayers;
    private String lighting;

    private MatchOrigin origin;

    private int round;
    private int roundObjective;
    private Integer winnerTeam;

    @Indexed
    private MatchStatus status;

    private LocalDateTime startTime;
    private LocalDateTime endTime;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
