package com.example.pvp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pvp.nats")
public record PvpNatsProperties(String subject) {}
