package com.timecard.auth_gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timecard.auth_gateway.model.AntiForgeryState;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * state パラメータの符号化。
 *
 * <p>署名はしない。改ざん検知は state Cookie との完全一致比較に任せる。base64url（padding なし）なので
 * query と Cookie のどちらにもそのまま載る。
 */
@Component
@RequiredArgsConstructor
public class StateCodec {

  private static final String FIELD_REDIRECT = "redirect";
  private static final String FIELD_NONCE = "nonce";

  private final ObjectMapper objectMapper;

  public String encode(String redirectTarget, String nonce) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_REDIRECT, redirectTarget);
    node.put(FIELD_NONCE, nonce);
    try {
      final byte[] json = objectMapper.writeValueAsBytes(node);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("state encoding failed", ex);
    }
  }

  public AntiForgeryState decode(String value) {
    if (value == null || value.isBlank()) {
      throw malformed(null);
    }
    final JsonNode node;
    try {
      final byte[] json = Base64.getUrlDecoder().decode(value);
      node = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException | JsonProcessingException ex) {
      throw malformed(ex);
    }
    if (node == null
        || !node.isObject()
        || !node.path(FIELD_REDIRECT).isTextual()
        || !node.path(FIELD_NONCE).isTextual()) {
      throw malformed(null);
    }
    return new AntiForgeryState(node.get(FIELD_REDIRECT).asText(), node.get(FIELD_NONCE).asText());
  }

  private AuthProtocolException malformed(Throwable cause) {
    return new AuthProtocolException(
        AuthProtocolException.Reason.MALFORMED_STATE, "Invalid state", cause);
  }
}
