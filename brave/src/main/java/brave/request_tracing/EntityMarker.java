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

/** Annotates an {@link Entity} with state derived from the request. */
public interface EntityMarker {
  /** Flags error, throttle or fault state according to the HTTP status code. */
  void markEntityFromStatus(Entity entity, int statusCode);

  /** Notes that the entity was recorded by instrumentation rather than by application code. */
  void addAutoInstrumentationMark(Entity entity);
}
