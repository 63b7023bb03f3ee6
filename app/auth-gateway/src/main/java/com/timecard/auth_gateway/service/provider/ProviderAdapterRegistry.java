package com.timecard.auth_gateway.service.provider;

import com.timecard.auth_gateway.service.UnknownProviderException;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ProviderAdapterRegistry {

  private final List<ProviderAdapter> adapters;

  public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
    this.adapters = List.copyOf(adapters);
  }

  public ProviderAdapter require(String pathId) {
    return adapters.stream()
        .filter(adapter -> adapter.pathId().equals(pathId))
        .findFirst()
        .orElseThrow(() -> new UnknownProviderException(pathId));
  }

  /** ログイン画面に並べる順序で返す。 */
  public List<ProviderAdapter> all() {
    return adapters;
  }
}
