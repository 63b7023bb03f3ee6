package com.timecard.auth_gateway.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timecard.auth_gateway.model.ProviderClientConfig;
import com.timecard.auth_gateway.service.AuthConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// Google は配列（先頭を採用）、LINE WORKS はオブジェクトで渡される。どちらの形でも受け付ける。
@Component
@RequiredArgsConstructor
public class ProviderClientConfigParser {

  private final ObjectMapper objectMapper;

  public ProviderClientConfig parse(String raw, String settingName) {
    if (raw == null || raw.isBlank()) {
      throw new AuthConfigurationException(settingName + " is not configured");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(raw);
    } catch (JsonProcessingException ex) {
      throw new AuthConfigurationException(settingName + " is not valid JSON", ex);
    }
    JsonNode entry = root;
    if (root != null && root.isArray()) {
      if (root.isEmpty()) {
        throw new AuthConfigurationException(settingName + " has no client entry");
      }
      entry = root.get(0);
    }
    if (entry == null || !entry.isObject()) {
      throw new AuthConfigurationException(settingName + " must be a JSON object or array");
    }
    final ProviderClientConfig config;
    try {
      config = objectMapper.treeToValue(entry, ProviderClientConfig.class);
    } catch (JsonProcessingException ex) {
      throw new AuthConfigurationException(settingName + " has an unexpected shape", ex);
    }
    if (isBlank(config.clientId()) || isBlank(config.clientSecret())) {
      throw new AuthConfigurationException(
          settingName + " requires client_id and client_secret");
    }
    return config;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
