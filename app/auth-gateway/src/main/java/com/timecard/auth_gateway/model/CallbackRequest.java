package com.timecard.auth_gateway.model;

// callback の query と state Cookie をまとめたもの。origin は redirect_uri の再構築に使う。
public record CallbackRequest(
    String origin, String code, String state, String error, String stateCookie) {}
