package com.sandstormtracker.model.mongo;

import com.sandstormtracker.event.WeaponType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// ========== Friendly Fire Incident ==========
// Append-only; consumed by downstream accident classification.
@Document(collection = "friendly_fire_incidents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FriendlyFireIncident {
    @Id
    private String id;

    @Indexed
    private String matchId;

    private String serverId;

    @Indexed
    private String killerId;

    private String victimId;

    private String weapon;
    private WeaponType weaponType;

    private LocalDateTime timestamp;

    private Integer killerTeam;
    private Integer victimTeam;

    private Double timeSinceMatchStartSeconds;
    private Double timeSinceLastFfSeconds;
    private Integer killerTotalKillsInMatch;
    private Integer killerFfCountInMatch;

    private boolean explosiveWeapon;
    private boolean vehicleWeapon;

    private String map;
    private String mode;
}
