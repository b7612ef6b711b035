package com.example.pvp.model;

public record QueuedPlayer(QueueEntry entry, long waitSeconds) {}
