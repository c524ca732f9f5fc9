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
import brave.Tracer.SpanInScope;

/**
 * A segment recorded as a Brave span. Zipkin only understands the {@code error} tag, so faults are
 * tagged both {@code fault} and {@code error}.
 */
final class BraveSegment implements Segment {
  final String name;
  final Span span;
  final SpanInScope scope;

  BraveSegment(String name, Span span, SpanInScope scope) {
    this.name = name;
    this.span = span;
    this.scope = scope;
  }

  @Override public String name() {
    return name;
  }

  @Override public SampleDecision sampleDecision() {
    Boolean sampled = span.context().sampled();
    if (sampled == null) return SampleDecision.UNKNOWN;
    return sampled ? SampleDecision.SAMPLED : SampleDecision.NOT_SAMPLED;
  }

  @Override public void annotate(String key, String value) {
    span.tag(key, value);
  }

  @Override public void markError() {
    span.tag("error", "true");
  }

  @Override public void markFault() {
    span.tag("fault", "true");
    span.tag("error", "true");
  }

  @Override public void markThrottle() {
    span.tag("throttle", "true");
  }

  @Override public String toString() {
    return "BraveSegment(name=" + name + ", context=" + span.context() + ")";
  }
}
