package com.delta.cnpjresolver.resolve.util;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import javax.net.ssl.SSLException;

public final class ReasonCodes {
  public static final String OK = "ok";
  public static final String SHORT_BODY = "short_body";
  public static final String BLOCK_INDICATOR = "block_indicator";
  public static final String CONTENT_MARKER_MISSING = "content_marker_missing";
  public static final String TIMEOUT = "timeout";
  public static final String CONNECT_TIMEOUT = "connect_timeout";
  public static final String CONNECT_FAILED = "connect_failed";
  public static final String DNS_FAILURE = "dns_failure";
  public static final String TLS_FAILURE = "tls_failure";
  public static final String IO_ERROR = "io_error";
  public static final String INTERRUPTED = "interrupted";
  public static final String INVALID_URL = "invalid_url";
  public static final String CANCELLED = "cancelled";
  public static final String DEADLINE_EXCEEDED = "deadline_exceeded";
  public static final String LAYER_ERROR = "layer_error";
  public static final String NO_API_KEY = "no_api_key";

  private ReasonCodes() {}

  public static String fromHttpStatus(int status) {
    if (status <= 0) {
      return IO_ERROR;
    }
    return "http_" + status;
  }

  public static String fromException(Throwable error) {
    if (error == null) {
      return IO_ERROR;
    }
    if (error instanceof HttpConnectTimeoutException) {
      return CONNECT_TIMEOUT;
    }
    if (error instanceof HttpTimeoutException) {
      return TIMEOUT;
    }
    if (error instanceof InterruptedException) {
      return INTERRUPTED;
    }
    Throwable root = error;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root instanceof UnknownHostException || error instanceof UnknownHostException) {
      return DNS_FAILURE;
    }
    if (root instanceof SSLException || error instanceof SSLException) {
      return TLS_FAILURE;
    }
    if (root instanceof ConnectException || error instanceof ConnectException) {
      return CONNECT_FAILED;
    }
    String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    if (message.contains("name or service not known") || message.contains("no such host")) {
      return DNS_FAILURE;
    }
    if (message.contains("ssl") || message.contains("handshake")) {
      return TLS_FAILURE;
    }
    return IO_ERROR;
  }
}
