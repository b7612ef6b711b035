package com.example.pvp.model;

import java.time.Instant;

public record SeasonRecord(
    String seasonId,
    String seasonName,
    int seasonNumber,
    boolean active,
    Instant startTime,
    Instant endTime) {}
