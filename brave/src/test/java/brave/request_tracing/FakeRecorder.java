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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Records what request processing did, in order, so tests can assert on it. */
final class FakeRecorder implements Recorder {
  static final class FakeSegment implements Segment {
    final String name, rootTraceId, parentId;
    final SamplingResponse samplingResponse;
    final long startTimestamp;
    final Map<String, String> annotations = new LinkedHashMap<>();
    final Map<String, Map<String, Object>> http = new LinkedHashMap<>();
    final List<Throwable> exceptions = new ArrayList<>();
    boolean error, fault, throttle;
    SampleDecision sampleDecision;
    RuntimeException sampleDecisionFailure;

    FakeSegment(String name, String rootTraceId, String parentId,
      SamplingResponse samplingResponse, long startTimestamp) {
      this.name = name;
      this.rootTraceId = rootTraceId;
      this.parentId = parentId;
      this.samplingResponse = samplingResponse;
      this.startTimestamp = startTimestamp;
      this.sampleDecision = samplingResponse.decision();
    }

    @Override public String name() {
      return name;
    }

    @Override public SampleDecision sampleDecision() {
      if (sampleDecisionFailure != null) throw sampleDecisionFailure;
      return sampleDecision;
    }

    @Override public void annotate(String key, String value) {
      annotations.put(key, value);
    }

    @Override public void markError() {
      error = true;
    }

    @Override public void markFault() {
      fault = true;
    }

    @Override public void markThrottle() {
      throttle = true;
    }
  }

  /** An entity that isn't a segment, like a subsegment would be. */
  static final class FakeEntity implements Entity {
    @Override public void annotate(String key, String value) {
    }

    @Override public void markError() {
    }

    @Override public void markFault() {
    }

    @Override public void markThrottle() {
    }
  }

  final List<String> events = new ArrayList<>();
  final List<FakeSegment> begun = new ArrayList<>();
  final List<Entity> ended = new ArrayList<>();
  SamplingStrategy samplingStrategy =
    input -> SamplingResponse.create("default", SampleDecision.SAMPLED);
  boolean tracingDisabled;
  String origin = "AWS::EC2::Instance";
  Entity current; // what getEntity returns
  SampleDecision overrideDecision; // simulates the recorder deciding differently, e.g. rate limits
  RuntimeException beginFailure, addHttpFailure;
  RuntimeException getEntityFailure, tracingDisabledFailure, originFailure;

  @Override public Entity beginSegment(String name, String rootTraceId, String parentId,
    SamplingResponse samplingResponse, long startTimestamp) {
    events.add("beginSegment");
    if (beginFailure != null) throw beginFailure;
    FakeSegment segment =
      new FakeSegment(name, rootTraceId, parentId, samplingResponse, startTimestamp);
    if (overrideDecision != null) segment.sampleDecision = overrideDecision;
    begun.add(segment);
    return segment;
  }

  @Override public void endSegment(Entity segment) {
    events.add("endSegment");
    ended.add(segment);
  }

  @Override
  public void addHttpInformation(Entity entity, String direction, Map<String, Object> attributes) {
    events.add("addHttpInformation:" + direction);
    if (addHttpFailure != null) throw addHttpFailure;
    ((FakeSegment) entity).http.put(direction, attributes);
  }

  @Override public void addException(Entity entity, Throwable error) {
    events.add("addException");
    ((FakeSegment) entity).exceptions.add(error);
  }

  @Override public Entity getEntity() {
    events.add("getEntity");
    if (getEntityFailure != null) throw getEntityFailure;
    if (current == null) throw new EntityNotAvailableException("No entity in scope");
    return current;
  }

  @Override public boolean isTracingDisabled() {
    if (tracingDisabledFailure != null) throw tracingDisabledFailure;
    return tracingDisabled;
  }

  @Override public SamplingStrategy samplingStrategy() {
    return samplingStrategy;
  }

  @Override public String origin() {
    if (originFailure != null) throw originFailure;
    return origin;
  }

  FakeSegment onlySegment() {
    if (begun.size() != 1) throw new AssertionError("expected one segment, but was " + begun);
    return begun.get(0);
  }
}
