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

/** A sampling decision, and the name of the rule that made it, if any. */
public final class SamplingResponse {
  public static SamplingResponse create(@Nullable String ruleName, SampleDecision decision) {
    if (decision == null) throw new NullPointerException("decision == null");
    return new SamplingResponse(ruleName, decision);
  }

  @Nullable final String ruleName;
  final SampleDecision decision;

  SamplingResponse(@Nullable String ruleName, SampleDecision decision) {
    this.ruleName = ruleName;
    this.decision = decision;
  }

  /** Null when the decision was inherited from the caller or no rule was involved. */
  @Nullable public String ruleName() {
    return ruleName;
  }

  public SampleDecision decision() {
    return decision;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SamplingResponse)) return false;
    SamplingResponse that = (SamplingResponse) o;
    return (ruleName == null ? that.ruleName == null : ruleName.equals(that.ruleName))
      && decision == that.decision;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= ruleName == null ? 0 : ruleName.hashCode();
    h *= 1000003;
    h ^= decision.hashCode();
    return h;
  }

  @Override public String toString() {
    return "SamplingResponse(ruleName=" + ruleName + ", decision=" + decision + ")";
  }
}
