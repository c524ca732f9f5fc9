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
import brave.sampler.Matcher;
import java.util.Locale;

/**
 * Null safe matchers for use in {@link RuleSamplingStrategy}. Combine them with {@link
 * brave.sampler.Matchers#and(Matcher[])}.
 */
public final class SamplingInputMatchers {
  /** Matches the {@code Host} header, ignoring case. */
  public static Matcher<SamplingInput> hostEquals(String host) {
    return new HostEquals(validate(host, "host").toLowerCase(Locale.ROOT));
  }

  /** Matches the HTTP method, such as {@code GET}, ignoring case. */
  public static Matcher<SamplingInput> methodEquals(String method) {
    return new MethodEquals(validate(method, "method").toUpperCase(Locale.ROOT));
  }

  public static Matcher<SamplingInput> pathStartsWith(String pathPrefix) {
    return new PathStartsWith(validate(pathPrefix, "pathPrefix"));
  }

  public static Matcher<SamplingInput> segmentNameEquals(String segmentName) {
    return new SegmentNameEquals(validate(segmentName, "segmentName"));
  }

  static final class HostEquals implements Matcher<SamplingInput> {
    final String host;

    HostEquals(String host) {
      this.host = host;
    }

    @Override public boolean matches(SamplingInput input) {
      return input.host() != null && host.equals(input.host().toLowerCase(Locale.ROOT));
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof HostEquals)) return false;
      return host.equals(((HostEquals) o).host);
    }

    @Override public int hashCode() {
      return host.hashCode();
    }

    @Override public String toString() {
      return "HostEquals(" + host + ")";
    }
  }

  static final class MethodEquals implements Matcher<SamplingInput> {
    final String method;

    MethodEquals(String method) {
      this.method = method;
    }

    @Override public boolean matches(SamplingInput input) {
      return method.equalsIgnoreCase(input.httpMethod());
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof MethodEquals)) return false;
      return method.equals(((MethodEquals) o).method);
    }

    @Override public int hashCode() {
      return method.hashCode();
    }

    @Override public String toString() {
      return "MethodEquals(" + method + ")";
    }
  }

  static final class PathStartsWith implements Matcher<SamplingInput> {
    final String pathPrefix;

    PathStartsWith(String pathPrefix) {
      this.pathPrefix = pathPrefix;
    }

    @Override public boolean matches(SamplingInput input) {
      String path = input.urlPath();
      return path != null && path.startsWith(pathPrefix);
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof PathStartsWith)) return false;
      return pathPrefix.equals(((PathStartsWith) o).pathPrefix);
    }

    @Override public int hashCode() {
      return pathPrefix.hashCode();
    }

    @Override public String toString() {
      return "PathStartsWith(" + pathPrefix + ")";
    }
  }

  static final class SegmentNameEquals implements Matcher<SamplingInput> {
    final String segmentName;

    SegmentNameEquals(String segmentName) {
      this.segmentName = segmentName;
    }

    @Override public boolean matches(SamplingInput input) {
      return segmentName.equals(input.segmentName());
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof SegmentNameEquals)) return false;
      return segmentName.equals(((SegmentNameEquals) o).segmentName);
    }

    @Override public int hashCode() {
      return segmentName.hashCode();
    }

    @Override public String toString() {
      return "SegmentNameEquals(" + segmentName + ")";
    }
  }

  static String validate(@Nullable String value, String name) {
    if (value == null) throw new NullPointerException(name + " == null");
    if (value.isEmpty()) throw new IllegalArgumentException(name + " is empty");
    return value;
  }

  SamplingInputMatchers() {
  }
}
