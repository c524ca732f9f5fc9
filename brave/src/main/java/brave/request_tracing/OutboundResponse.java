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

import brave.http.HttpServerResponse;

/**
 * The host's view of an outbound HTTP response. This must accept headers until the request has
 * ended, as the {@link TraceHeaderCodec#HEADER_KEY trace header} is added last.
 */
public abstract class OutboundResponse extends HttpServerResponse {
  /** Sets a response header, replacing any existing value. */
  public abstract void header(String name, String value);
}
