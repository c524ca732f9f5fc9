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
 * Handle to recorded work, returned by {@link Recorder#beginSegment}. The {@link Recorder} owns the
 * underlying data: this type only exposes what request processing needs to annotate it.
 */
public interface Entity {
  /** Adds an indexed key/value pair, such as {@code auto_instrumentation=true}. */
  void annotate(String key, String value);

  /** Indicates a client error, such as an HTTP 4xx status. */
  void markError();

  /** Indicates a server error, such as an HTTP 5xx status. */
  void markFault();

  /** Indicates the request was rejected due to rate limiting, such as an HTTP 429 status. */
  void markThrottle();
}
