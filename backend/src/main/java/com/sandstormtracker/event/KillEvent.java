package com.sandstormtracker.event;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Attackers are in log order: index 0 is the credited killer, the rest assisted.
 * An empty attacker list means the kill had no player source ({@code ?}).
 */
public record KillEvent(
        LocalDateTime timestamp,
        List<PlayerRef> attackers,
        PlayerRef victim,
        String rawWeapon,
        String weapon,
        WeaponType weaponType) implements GameEvent {

    public KillEvent {
        attackers = List.copyOf(attackers);
    }

    @Override
    public EventType type() {
        return EventType.KILL;
    }
}
