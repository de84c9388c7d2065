package com.sandstormtracker.model.mongo;

import com.sandstormtracker.event.WeaponType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

// ========== Match Weapon Stat Entity ==========
@Document(collection = "match_weapon_stats")
@CompoundIndex(name = "match_player_weapon",
    def = "{'matchId': 1, 'playerId': 1, 'weaponName': 1, 'weaponType': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchWeaponStat {
    @Id
    private String id;

    @Indexed
    private String matchId;

    @Indexed
    private String playerId;

    @Indexed
    private String weaponName;

    private WeaponType weaponType;

    private int kills;
}
