package com.example.endpoints.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    public static final String API_BASE = "/api";
    public static final String ME = "/me";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
