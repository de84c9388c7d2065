package com.sandstormtracker.service;

import com.sandstormtracker.event.PlayerRef;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.parser.ServerContext;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

// ========== Player Service ==========
// Players come only from log lines carrying a real platform id. Bots never get one.
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerService {

    private final StatStore statStore;
    private final StatWriteService statWriteService;

    /** Player credited by a kill or objective token, created on first sight. */
    public Optional<Player> resolve(String serverId, PlayerRef ref) {
        if (ref == null || ref.isBot()) {
            return Optional.empty();
        }
        Optional<Player> existing = statStore.findPlayerByPlatformId(ref.platformId());
        if (existing.isPresent()) {
            return existing;
        }
        return create(serverId, ref.platformId(), ref.name());
    }

    /** Anti-cheat registration: the platform id is authenticated, so the player is created if needed. */
    public Optional<Player> register(ServerContext context, String platformId) {
        Optional<String> pendingName = context.pendingName(platformId);
        pendingName.ifPresent(context::forgetLogin);

        Optional<Player> existing = statStore.findPlayerByPlatformId(platformId);
        if (existing.isPresent() && pendingName.isEmpty()) {
            return existing;
        }
        String name = pendingName.orElse(platformId);
        if (existing.isPresent() && name.equals(existing.get().getName())) {
            return existing;
        }
        return create(context.getServerId(), platformId, name);
    }

    /** Name-only lines: pending logins first, then the most recently seen player with that name. */
    public Optional<Player> resolveByName(ServerContext context, String name) {
        Optional<String> pending = context.pendingPlatformId(name);
        if (pending.isPresent()) {
            context.forgetLogin(name);
            return statStore.findPlayerByPlatformId(pending.get())
                .filter(player -> name.equals(player.getName()))
                .or(() -> create(context.getServerId(), pending.get(), name));
        }
        return statStore.findPlayerByName(name);
    }

    private Optional<Player> create(String serverId, String platformId, String name) {
        Player player = statWriteService.executeAndGet("upsertPlayer", serverId,
            () -> statStore.upsertPlayer(platformId, name));
        if (player != null) {
            log.debug("[{}] Player {} ({}) recorded", serverId, name, platformId);
        }
        return Optional.ofNullable(player);
    }
}
