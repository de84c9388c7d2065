package com.sandstormtracker.model.mongo;

public enum MatchStatus {
    ONGOING,
    FINISHED,
    CRASHED
}
