/*
 * Copyright 2026 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package brave.request_tracing;

import brave.internal.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the attributes passed to {@link Recorder#addHttpInformation}. Values may be null, for
 * example when there is no {@code User-Agent} header.
 */
final class HttpAttributes {
  static final String REQUEST = "request", RESPONSE = "response";

  static final String URL = "url", USER_AGENT = "user_agent", METHOD = "method",
    CLIENT_IP = "client_ip", X_FORWARDED_FOR = "x_forwarded_for", STATUS = "status";

  static Map<String, Object> requestAttributes(InboundRequest request) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put(URL, request.url());
    result.put(USER_AGENT, request.header("User-Agent"));
    result.put(METHOD, request.method());

    String forwardedFor = xForwardedFor(request);
    if (forwardedFor == null) {
      result.put(CLIENT_IP, request.remoteAddress());
    } else {
      result.put(CLIENT_IP, forwardedFor);
      result.put(X_FORWARDED_FOR, true);
    }
    return result;
  }

  static Map<String, Object> responseAttributes(OutboundResponse response) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put(STATUS, response.statusCode());
    return result;
  }

  /** The leftmost entry is the original client; the rest are proxies it passed through. */
  @Nullable static String xForwardedFor(InboundRequest request) {
    String value = request.header("X-Forwarded-For");
    if (value == null || value.isEmpty()) return null;
    int comma = value.indexOf(',');
    return (comma == -1 ? value : value.substring(0, comma)).trim();
  }

  HttpAttributes() {
  }
}
