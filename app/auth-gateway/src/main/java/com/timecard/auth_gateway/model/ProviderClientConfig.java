package com.timecard.auth_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderClientConfig(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret) {

  @Override
  public String toString() {
    return "ProviderClientConfig[clientId=" + clientId + ", clientSecret=***]";
  }
}
