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
 * The three request events a host HTTP pipeline reports. The host owns dispatch: it only needs to
 * call these methods with the same {@link RequestContext} for the life of a request.
 *
 * <p>Hosts differ in which events fire. Some report {@link #error(RequestContext)} without ever
 * reporting {@link #beginRequest(RequestContext)}, for example when a request fails early in the
 * pipeline. Implementations must tolerate that, and also both events firing for the same request.
 */
public interface RequestLifecycleListener {
  /** Called when the host receives a request, before it is processed. */
  void beginRequest(RequestContext context);

  /**
   * Called once the request has been processed. {@link RequestContext#response()} and {@link
   * RequestContext#error()} should be populated beforehand, when available.
   */
  void endRequest(RequestContext context);

  /** Called when the host fails a request, which may happen before it was begun. */
  void error(RequestContext context);
}
