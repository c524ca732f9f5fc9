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

/** The top-level {@link Entity} recorded for one service's handling of one request. */
public interface Segment extends Entity {
  String name();

  /**
   * The decision the recorder actually applied to this segment. This can differ from what was
   * passed to {@link Recorder#beginSegment}, for example when the recorder rate limits.
   */
  SampleDecision sampleDecision();
}
