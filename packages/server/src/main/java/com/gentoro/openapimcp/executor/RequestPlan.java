package com.gentoro.openapimcp.executor;

import com.gentoro.openapimcp.model.HttpMethod;
import java.util.Objects;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/** A fully resolved outbound request for one tool call. */
public final class RequestPlan {
  public enum BodyKind {
    NONE,
    JSON,
    MULTIPART
  }

  private final HttpMethod method;
  private final HttpUrl url;
  private final Headers headers;
  private final BodyKind bodyKind;
  private final RequestBody body;

  RequestPlan(HttpMethod method, HttpUrl url, Headers headers, BodyKind bodyKind, RequestBody body) {
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.bodyKind = Objects.requireNonNull(bodyKind, "bodyKind");
    if ((bodyKind == BodyKind.NONE) != (body == null)) {
      throw new IllegalArgumentException("Body kind " + bodyKind + " does not match body");
    }
    this.body = body;
  }

  public HttpMethod method() {
    return method;
  }

  public HttpUrl url() {
    return url;
  }

  public Headers headers() {
    return headers;
  }

  public BodyKind bodyKind() {
    return bodyKind;
  }

  /** Request body, {@code null} for {@link BodyKind#NONE}. */
  public RequestBody body() {
    return body;
  }

  public Request toRequest() {
    return new Request.Builder().url(url).headers(headers).method(method.name(), body).build();
  }

  @Override
  public String toString() {
    return method + " " + url + " (" + bodyKind + ")";
  }
}
