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
import java.util.Map;

/**
 * Owns segments: their storage, their IDs and their transmission to a collector. Implementations
 * must be safe for use by concurrent requests.
 *
 * @see BraveRecorder
 */
public interface Recorder {
  /**
   * Starts a segment.
   *
   * @param name from the {@link SegmentNamingStrategy}
   * @param rootTraceId {@link TraceHeader#rootTraceId()}
   * @param parentId {@link TraceHeader#parentId()}
   * @param samplingResponse the decision made for this request
   * @param startTimestamp epoch microseconds when the host reported the request
   * @return a handle to the segment, to be passed to {@link #endSegment(Entity)}
   */
  Entity beginSegment(String name, String rootTraceId, @Nullable String parentId,
    SamplingResponse samplingResponse, long startTimestamp);

  void endSegment(Entity segment);

  /**
   * Adds HTTP attributes, such as those from {@link HttpAttributes}.
   *
   * @param direction {@code "request"} or {@code "response"}
   */
  void addHttpInformation(Entity entity, String direction, Map<String, Object> attributes);

  void addException(Entity entity, Throwable error);

  /**
   * Returns the entity in scope of the current thread, for callers that weren't handed one.
   *
   * @throws EntityNotAvailableException if there is none
   */
  Entity getEntity();

  /** When true, segments are still opened and closed, but not annotated. */
  boolean isTracingDisabled();

  SamplingStrategy samplingStrategy();

  /** The kind of platform this service runs on, or null if unknown. */
  @Nullable String origin();
}
