package com.timecard.auth_gateway.model;

public record AntiForgeryState(String redirectTarget, String nonce) {}
