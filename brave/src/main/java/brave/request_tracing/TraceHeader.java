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

/**
 * The trace state carried by the {@link TraceHeaderCodec#HEADER_KEY} header of one request.
 *
 * <p>Only {@link #sampled()} changes after construction, and only when a decision is resolved for
 * this request.
 *
 * @see TraceHeaderCodec
 */
public final class TraceHeader {
  public static TraceHeader create(String rootTraceId, @Nullable String parentId,
    SampleDecision sampled) {
    if (rootTraceId == null) throw new NullPointerException("rootTraceId == null");
    if (sampled == null) throw new NullPointerException("sampled == null");
    return new TraceHeader(rootTraceId, parentId, sampled);
  }

  /** A header for a request that arrived without usable trace state. */
  public static TraceHeader newRoot() {
    return new TraceHeader(TraceIds.newRootTraceId(), null, SampleDecision.UNKNOWN);
  }

  final String rootTraceId;
  @Nullable final String parentId;
  SampleDecision sampled;

  TraceHeader(String rootTraceId, @Nullable String parentId, SampleDecision sampled) {
    this.rootTraceId = rootTraceId;
    this.parentId = parentId;
    this.sampled = sampled;
  }

  public String rootTraceId() {
    return rootTraceId;
  }

  /** The upstream segment, or null when this request is the root of the trace. */
  @Nullable public String parentId() {
    return parentId;
  }

  public SampleDecision sampled() {
    return sampled;
  }

  public TraceHeader sampled(SampleDecision sampled) {
    if (sampled == null) throw new NullPointerException("sampled == null");
    this.sampled = sampled;
    return this;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceHeader)) return false;
    TraceHeader that = (TraceHeader) o;
    return rootTraceId.equals(that.rootTraceId)
      && (parentId == null ? that.parentId == null : parentId.equals(that.parentId))
      && sampled == that.sampled;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= rootTraceId.hashCode();
    h *= 1000003;
    h ^= parentId == null ? 0 : parentId.hashCode();
    h *= 1000003;
    h ^= sampled.hashCode();
    return h;
  }

  @Override public String toString() {
    return "TraceHeader(rootTraceId="
      + rootTraceId
      + ", parentId="
      + parentId
      + ", sampled="
      + sampled
      + ")";
  }
}
