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

/**
 * Converts a request into a human-readable segment name. The strategy is chosen once per process,
 * via {@link RequestTracing}.
 *
 * @see FixedSegmentNamingStrategy
 * @see DynamicSegmentNamingStrategy
 */
public interface SegmentNamingStrategy {
  String segmentName(InboundRequest request);
}
