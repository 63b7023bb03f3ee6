/*
 * どこで: Auth Gateway API
 * 何を: API エラー応答の共通 DTO
 * なぜ: 画面側がエラーコードで分岐できるようにするため
 */
package com.timecard.auth_gateway.api;

public record ApiErrorResponse(String code, String message) {}
