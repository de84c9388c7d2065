package com.sandstormtracker.service.rcon;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RconPlayerListDecoderTest {

    private final RconPlayerListDecoder decoder = new RconPlayerListDecoder();

    @Test
    void decodesTableRows() {
        List<RconPlayer> players = decoder.decode("ID | Name | NetID | IP | Score |\n"
            + "===============================\n"
            + "256 | ArmoredBear | SteamNWI:76561198995742987 | 127.0.0.1 | 150 |\n");

        assertThat(players).containsExactly(
            new RconPlayer("ArmoredBear", "76561198995742987", "SteamNWI:76561198995742987", 150));
    }

    @Test
    void decodesRowsWithoutLineBreaks() {
        List<RconPlayer> players = decoder.decode("ID | Name | NetID | IP | Score |"
            + "======================"
            + "256 | ArmoredBear | SteamNWI:76561198995742987 | 127.0.0.1 | 150 | "
            + "257 | -=312th=- Rabbit | SteamNWI:76561198262186571 | 10.0.0.2 | 45 |");

        assertThat(players).extracting(RconPlayer::name).containsExactly("ArmoredBear", "-=312th=- Rabbit");
        assertThat(players).extracting(RconPlayer::score).containsExactly(150, 45);
    }

    @Test
    void dropsBotsAndPlaceholders() {
        List<RconPlayer> players = decoder.decode("ID | Name | NetID | IP | Score |\n"
            + "=====\n"
            + "0 | Marksman | None:INVALID | | 0 |\n"
            + "1 | Observer | SteamNWI:1 | | 0 |\n"
            + "2 | Rifleman | INVALID | | 0 |\n");

        assertThat(players).isEmpty();
    }

    @Test
    void unreadableScoreCountsAsZero() {
        List<RconPlayer> players = decoder.decode("===\n256 | Bear | SteamNWI:765 | 127.0.0.1 | n/a |\n");

        assertThat(players).singleElement().extracting(RconPlayer::score).isEqualTo(0);
    }

    @Test
    void emptyResponseHasNoPlayers() {
        assertThat(decoder.decode("")).isEmpty();
        assertThat(decoder.decode(null)).isEmpty();
    }
}
