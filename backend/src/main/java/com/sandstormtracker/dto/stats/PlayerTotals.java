package com.sandstormtracker.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// Lifetime totals across all matches for one player.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerTotals {
    private String playerId;
    private long kills;
    private long deaths;
    private long score;
    private long totalPlayTime; // seconds

    public double scorePerMinute() {
        return totalPlayTime > 0 ? score / (totalPlayTime / 60.0) : 0.0;
    }

    public double killDeathRatio() {
        return deaths > 0 ? (double) kills / deaths : kills;
    }
}
