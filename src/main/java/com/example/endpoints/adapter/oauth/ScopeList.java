package com.example.endpoints.adapter.oauth;

import java.util.Arrays;

final class ScopeList {

  private ScopeList() {}

  /**
   * Whether a space-separated scope list grants {@code scope}.
   */
  static boolean grants(String scopeList, String scope) {
    if (scopeList == null || scopeList.isBlank()) {
      return false;
    }
    return Arrays.asList(scopeList.trim().split("\\s+")).contains(scope);
  }
}
