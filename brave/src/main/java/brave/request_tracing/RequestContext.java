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

/**
 * State of one request, from the moment the host first reports it until it ends. The host creates
 * one per request and passes the same instance to every {@link RequestLifecycleListener} callback.
 *
 * <p>This is not thread-safe. The host must not report events for the same request concurrently.
 * With {@link BraveRecorder}, begin and end must also be reported on the same thread, as the
 * segment's span is in scope in between.
 *
 * <p><pre>{@code
 * RequestContext context = RequestContext.create(request); // captures the start timestamp
 * listener.beginRequest(context);
 * try {
 *   process(request, response);
 * } catch (Throwable e) {
 *   context.error(e);
 *   listener.error(context);
 *   throw e;
 * } finally {
 *   listener.endRequest(context.response(response));
 * }
 * }</pre>
 */
public final class RequestContext {
  enum State {
    IDLE, OPEN, CLOSED
  }

  /** Creates a context whose start timestamp is now. */
  public static RequestContext create(InboundRequest request) {
    return create(request, System.currentTimeMillis() * 1000L);
  }

  /**
   * @param startTimestamp epoch microseconds when the host received the request. This becomes the
   * start of the segment, regardless of how long it takes to report the request.
   */
  public static RequestContext create(InboundRequest request, long startTimestamp) {
    if (request == null) throw new NullPointerException("request == null");
    if (startTimestamp <= 0L) {
      throw new IllegalArgumentException("startTimestamp <= 0: " + startTimestamp);
    }
    return new RequestContext(request, startTimestamp);
  }

  final InboundRequest request;
  final long startTimestamp;
  @Nullable OutboundResponse response;
  @Nullable Throwable error;
  @Nullable TraceHeader traceHeader;
  @Nullable Entity segment;
  State state = State.IDLE;

  RequestContext(InboundRequest request, long startTimestamp) {
    this.request = request;
    this.startTimestamp = startTimestamp;
  }

  public InboundRequest request() {
    return request;
  }

  public long startTimestamp() {
    return startTimestamp;
  }

  @Nullable public OutboundResponse response() {
    return response;
  }

  /** Sets the response, once the host has one. */
  public RequestContext response(@Nullable OutboundResponse response) {
    this.response = response;
    return this;
  }

  /**
   * Returns the error that failed this request. When unset, this falls back to {@link
   * OutboundResponse#error()}.
   */
  @Nullable public Throwable error() {
    if (error != null) return error;
    return response != null ? response.error() : null;
  }

  public RequestContext error(@Nullable Throwable error) {
    this.error = error;
    return this;
  }

  /** The header parsed when the request began, or null if it hasn't. */
  @Nullable public TraceHeader traceHeader() {
    return traceHeader;
  }

  /** The segment opened for this request, or null if none is open. */
  @Nullable public Entity segment() {
    return state == State.OPEN ? segment : null;
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  public boolean isClosed() {
    return state == State.CLOSED;
  }

  @Override public String toString() {
    return "RequestContext(method="
      + request.method()
      + ", path="
      + request.path()
      + ", state="
      + state
      + ")";
  }
}
