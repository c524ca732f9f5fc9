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

import brave.Span;
import brave.Tracer;
import brave.Tracing;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import brave.propagation.TraceContextOrSamplingFlags;
import brave.propagation.TraceIdContext;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records segments as Brave server spans, so they are reported by whatever {@link
 * brave.handler.SpanHandler} the {@link Tracing} instance was built with.
 *
 * <ul>
 *   <li>The root trace ID becomes the 128-bit trace ID, and the parent ID the parent span ID.</li>
 *   <li>The segment name becomes the span name, and the request timestamp its start.</li>
 *   <li>HTTP attributes become tags prefixed with {@code http.}</li>
 *   <li>The span is in scope until the segment ends, so application code can add child spans.</li>
 * </ul>
 *
 * <p>Segments must be ended on the thread that began them. The span scope lives in Brave's {@link
 * brave.propagation.CurrentTraceContext}, which is usually thread-local.
 *
 * <p>Tracing is disabled when the {@link Tracing#isNoop() Tracing instance is noop}.
 */
public final class BraveRecorder implements Recorder {
  static final String RULE_TAG = "sampling.rule";

  public static Builder newBuilder(Tracing tracing) {
    return new Builder(tracing);
  }

  public static final class Builder {
    final Tracing tracing;
    SamplingStrategy samplingStrategy = RuleSamplingStrategy.newBuilder().build();
    @Nullable String origin;

    Builder(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
    }

    /** Optional: Defaults to a {@link RuleSamplingStrategy} with no rules, which samples all. */
    public Builder samplingStrategy(SamplingStrategy samplingStrategy) {
      if (samplingStrategy == null) throw new NullPointerException("samplingStrategy == null");
      this.samplingStrategy = samplingStrategy;
      return this;
    }

    /** Optional: The kind of platform this service runs on, such as {@code AWS::EC2::Instance}. */
    public Builder origin(String origin) {
      if (origin == null) throw new NullPointerException("origin == null");
      this.origin = origin;
      return this;
    }

    public BraveRecorder build() {
      return new BraveRecorder(this);
    }
  }

  final Tracing tracing;
  final Tracer tracer;
  final SamplingStrategy samplingStrategy;
  @Nullable final String origin;
  final Map<TraceContext, BraveSegment> openSegments = new ConcurrentHashMap<>();

  BraveRecorder(Builder builder) {
    this.tracing = builder.tracing;
    this.tracer = builder.tracing.tracer();
    this.samplingStrategy = builder.samplingStrategy;
    this.origin = builder.origin;
  }

  @Override public Entity beginSegment(String name, String rootTraceId, @Nullable String parentId,
    SamplingResponse samplingResponse, long startTimestamp) {
    if (name == null) throw new NullPointerException("name == null");
    if (rootTraceId == null) throw new NullPointerException("rootTraceId == null");
    if (samplingResponse == null) throw new NullPointerException("samplingResponse == null");
    if (!TraceIds.isValidRootTraceId(rootTraceId)) {
      throw new IllegalArgumentException("Invalid rootTraceId: " + rootTraceId);
    }
    if (parentId != null && !TraceIds.isValidParentId(parentId)) {
      throw new IllegalArgumentException("Invalid parentId: " + parentId);
    }

    Span span = tracer.nextSpan(extract(rootTraceId, parentId, samplingResponse.decision()))
      .kind(Span.Kind.SERVER)
      .name(name);
    if (samplingResponse.ruleName() != null) span.tag(RULE_TAG, samplingResponse.ruleName());
    span.start(startTimestamp);

    BraveSegment segment = new BraveSegment(name, span, tracer.withSpanInScope(span));
    openSegments.put(span.context(), segment);
    return segment;
  }

  /** Creates a child of the parent, if there is one, or a new root span in the given trace. */
  static TraceContextOrSamplingFlags extract(String rootTraceId, @Nullable String parentId,
    SampleDecision decision) {
    long traceIdHigh = TraceIds.traceIdHigh(rootTraceId), traceId = TraceIds.traceId(rootTraceId);
    if (parentId != null) {
      TraceContext.Builder parent = TraceContext.newBuilder()
        .traceIdHigh(traceIdHigh)
        .traceId(traceId)
        .spanId(TraceIds.parentId(parentId));
      if (decision.isResolved()) parent.sampled(decision == SampleDecision.SAMPLED);
      return TraceContextOrSamplingFlags.create(parent.build());
    }

    TraceIdContext.Builder trace = TraceIdContext.newBuilder()
      .traceIdHigh(traceIdHigh)
      .traceId(traceId);
    if (decision.isResolved()) trace.sampled(decision == SampleDecision.SAMPLED);
    return TraceContextOrSamplingFlags.create(trace.build());
  }

  @Override public void endSegment(Entity segment) {
    BraveSegment braveSegment = braveSegment(segment);
    openSegments.remove(braveSegment.span.context());
    braveSegment.scope.close();
    braveSegment.span.finish();
  }

  @Override
  public void addHttpInformation(Entity entity, String direction, Map<String, Object> attributes) {
    if (direction == null) throw new NullPointerException("direction == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    Span span = braveSegment(entity).span;
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      Object value = entry.getValue();
      if (value == null) continue;
      span.tag(tagName(entry.getKey()), value.toString());
      if (HttpAttributes.CLIENT_IP.equals(entry.getKey())) {
        span.remoteIpAndPort(value.toString(), 0);
      }
    }
  }

  /** Follows Brave's naming of HTTP tags, such as {@code http.status_code}. */
  static String tagName(String attribute) {
    if (HttpAttributes.STATUS.equals(attribute)) return "http.status_code";
    return "http." + attribute;
  }

  @Override public void addException(Entity entity, Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    braveSegment(entity).span.error(error);
  }

  /** Returns the segment whose span is in scope. */
  @Override public Entity getEntity() {
    TraceContext current = tracing.currentTraceContext().get();
    if (current == null) throw new EntityNotAvailableException("No span in scope");
    BraveSegment result = openSegments.get(current);
    if (result == null) {
      throw new EntityNotAvailableException("Span in scope is not a segment: " + current);
    }
    return result;
  }

  @Override public boolean isTracingDisabled() {
    return tracing.isNoop();
  }

  @Override public SamplingStrategy samplingStrategy() {
    return samplingStrategy;
  }

  @Override @Nullable public String origin() {
    return origin;
  }

  static BraveSegment braveSegment(Entity entity) {
    if (entity == null) throw new NullPointerException("entity == null");
    if (!(entity instanceof BraveSegment)) {
      throw new IllegalArgumentException(entity + " was not begun by " + BraveRecorder.class);
    }
    return (BraveSegment) entity;
  }

  @Override public String toString() {
    return "BraveRecorder(samplingStrategy=" + samplingStrategy + ", origin=" + origin + ")";
  }
}
