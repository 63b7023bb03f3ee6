package com.timecard.auth_gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth")
public record EmailAllowlistProperties(String allowedEmails) {}
