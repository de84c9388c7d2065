package com.sandstormtracker.service.rcon;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decodes the pipe-delimited {@code listplayers} table:
 * <pre>
 * ID | Name | NetID | IP | Score |
 * ===============================
 * 256 | ArmoredBear | SteamNWI:76561198995742987 | 127.0.0.1 | 150 |
 * </pre>
 * Rows may arrive without line breaks, so cells are regrouped five at a time.
 * Role placeholders and rows without a platform id are discarded.
 */
@Component
@Slf4j
public class RconPlayerListDecoder {

    public static final String LIST_PLAYERS = "listplayers";

    static final String PLATFORM_PREFIX = "SteamNWI";
    private static final int COLUMNS = 5;
    private static final Set<String> PLACEHOLDER_NAMES = Set.of("Observer", "Commander", "Marksman", "0", "1", "2");

    public List<RconPlayer> decode(String response) {
        List<RconPlayer> players = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return players;
        }

        String[] cells = tableBody(response).split("\\|", -1);
        for (int i = 0; i + COLUMNS <= cells.length; i += COLUMNS) {
            String name = cells[i + 1].trim();
            String netId = cells[i + 2].trim();
            String score = cells[i + 4].trim();

            if (name.isEmpty() || PLACEHOLDER_NAMES.contains(name)) {
                continue;
            }
            if (!netId.startsWith(PLATFORM_PREFIX + ":")) {
                continue;
            }
            players.add(new RconPlayer(name, netId.substring(PLATFORM_PREFIX.length() + 1), netId, parseScore(score)));
        }
        return players;
    }

    private static String tableBody(String response) {
        int separator = response.indexOf("===");
        if (separator >= 0) {
            int end = separator;
            while (end < response.length() && response.charAt(end) == '=') {
                end++;
            }
            return response.substring(end);
        }
        // no separator: drop a header row if present
        if (response.trim().startsWith("ID")) {
            int newline = response.indexOf('\n');
            return newline >= 0 ? response.substring(newline + 1) : "";
        }
        return response;
    }

    private static int parseScore(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("Unreadable score '{}', using 0", value);
            return 0;
        }
    }
}
