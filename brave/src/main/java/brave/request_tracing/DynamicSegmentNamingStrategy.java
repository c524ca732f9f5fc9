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

import java.util.Locale;

import static brave.request_tracing.FixedSegmentNamingStrategy.validateName;

/**
 * Names the segment after the request's {@code Host} header when it matches a pattern, falling
 * back to a fixed name otherwise. This is useful when one deployment serves several domains.
 *
 * <p>Patterns are case-insensitive. {@code *} matches any run of characters, and {@code ?} matches
 * exactly one. For example, {@code *.example.com} matches {@code api.example.com}.
 */
public final class DynamicSegmentNamingStrategy implements SegmentNamingStrategy {
  /** Uses the {@code Host} header whenever it is present. */
  public static DynamicSegmentNamingStrategy create(String fallbackName) {
    return create(fallbackName, "*");
  }

  public static DynamicSegmentNamingStrategy create(String fallbackName, String hostPattern) {
    if (hostPattern == null) throw new NullPointerException("hostPattern == null");
    return new DynamicSegmentNamingStrategy(validateName(fallbackName), hostPattern);
  }

  final String fallbackName, hostPattern;

  DynamicSegmentNamingStrategy(String fallbackName, String hostPattern) {
    this.fallbackName = fallbackName;
    this.hostPattern = hostPattern.toLowerCase(Locale.ROOT);
  }

  @Override public String segmentName(InboundRequest request) {
    String host = request.header("Host");
    if (host == null || host.isEmpty()) return fallbackName;
    return wildcardMatches(hostPattern, host.toLowerCase(Locale.ROOT)) ? host : fallbackName;
  }

  /** Greedy match which backtracks to the most recent {@code *}. */
  static boolean wildcardMatches(String pattern, String text) {
    int p = 0, t = 0, star = -1, mark = 0;
    while (t < text.length()) {
      if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == text.charAt(t))) {
        p++;
        t++;
      } else if (p < pattern.length() && pattern.charAt(p) == '*') {
        star = p++;
        mark = t;
      } else if (star != -1) {
        p = star + 1;
        t = ++mark;
      } else {
        return false;
      }
    }
    while (p < pattern.length() && pattern.charAt(p) == '*') p++;
    return p == pattern.length();
  }

  @Override public String toString() {
    return "DynamicSegmentNamingStrategy(fallbackName="
      + fallbackName
      + ", hostPattern="
      + hostPattern
      + ")";
  }
}
