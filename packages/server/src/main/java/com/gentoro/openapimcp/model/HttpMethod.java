package com.gentoro.openapimcp.model;

/** HTTP methods that are exposed as tools. */
public enum HttpMethod {
  GET(false),
  POST(true),
  PUT(true),
  DELETE(false),
  PATCH(true);

  private final boolean carriesBody;

  HttpMethod(boolean carriesBody) {
    this.carriesBody = carriesBody;
  }

  /** POST, PUT and PATCH send their arguments as a body; GET and DELETE as a query string. */
  public boolean carriesBody() {
    return carriesBody;
  }
}
