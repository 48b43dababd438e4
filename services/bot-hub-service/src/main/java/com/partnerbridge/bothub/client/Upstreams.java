package com.partnerbridge.bothub.client;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

final class Upstreams {

  private Upstreams() {}

  static UpstreamException translate(String operation, RestClientException e) {
    if (e instanceof ResourceAccessException && isTimeout(e)) {
      return new UpstreamException(UpstreamException.Kind.TIMEOUT, operation, "timed out", e);
    }
    if (e instanceof RestClientResponseException r) {
      return new UpstreamException(
          UpstreamException.Kind.ERROR, operation, "HTTP " + r.getStatusCode().value(), e);
    }
    return new UpstreamException(UpstreamException.Kind.ERROR, operation, e.getMessage(), e);
  }

  private static boolean isTimeout(Throwable e) {
    Throwable t = e;
    while (t != null) {
      if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
        return true;
      }
      t = t.getCause();
    }
    return false;
  }
}
