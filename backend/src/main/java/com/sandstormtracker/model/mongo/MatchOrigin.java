package com.sandstormtracker.model.mongo;

/**
 * Which log marker opened a match.
 */
public enum MatchOrigin {
    MAP_LOAD,
    MAP_TRAVEL,
    // gameplay arrived with no ongoing match, after a crash or a start at end of file
    REOPENED
}
