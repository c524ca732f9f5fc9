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

import brave.http.HttpServerRequest;
import brave.internal.Nullable;

/**
 * The host's view of an inbound HTTP request. Besides the usual {@link HttpServerRequest} fields,
 * this exposes the address of the directly connected peer, which may be a proxy.
 *
 * <p>{@link #url()} must be absolute, as it is recorded as-is.
 */
public abstract class InboundRequest extends HttpServerRequest {
  /** The IP address of the directly connected peer, or null if unknown. */
  @Nullable public abstract String remoteAddress();
}
