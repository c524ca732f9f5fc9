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

/** The {@code Sampled} field of a {@link TraceHeader}. */
public enum SampleDecision {
  /** No decision was propagated. Written as nothing. */
  UNKNOWN(null),
  /** The caller asks this node to decide, and to send the decision back. Written as {@code ?}. */
  REQUESTED("?"),
  SAMPLED("1"),
  NOT_SAMPLED("0");

  @Nullable final String headerValue;

  SampleDecision(@Nullable String headerValue) {
    this.headerValue = headerValue;
  }

  /** True when this is {@link #SAMPLED} or {@link #NOT_SAMPLED}. */
  public boolean isResolved() {
    return this == SAMPLED || this == NOT_SAMPLED;
  }

  /** Returns the value written after {@code Sampled=}, or null for {@link #UNKNOWN}. */
  @Nullable public String headerValue() {
    return headerValue;
  }

  /** Returns null if the input isn't a valid {@code Sampled} value. */
  @Nullable static SampleDecision fromHeaderValue(String value) {
    switch (value) {
      case "1":
        return SAMPLED;
      case "0":
        return NOT_SAMPLED;
      case "?":
        return REQUESTED;
      default:
        return null;
    }
  }
}
