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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Traces a request from the events reported by its host.
 *
 * <ol>
 *   <li>On begin, parse or create the {@link TraceHeaderCodec#HEADER_KEY trace header}, decide
 *   whether to sample and open a segment starting at the request's timestamp.</li>
 *   <li>On end, record the response and any error, then close the segment. If the caller sent
 *   {@code Sampled=?}, the decision is sent back in the response header.</li>
 *   <li>On error, behave as on begin. This opens the segment if the host never reported begin.</li>
 * </ol>
 *
 * <p>Tracing problems never fail the request: they are logged, and the worst outcome is a request
 * that isn't traced or is missing some data.
 */
final class RequestInterceptor implements RequestLifecycleListener {
  static final Logger LOG = Logger.getLogger(RequestInterceptor.class.getName());

  final Recorder recorder;
  final SegmentNamingStrategy segmentNamingStrategy;
  final EntityMarker entityMarker;
  final SamplingArbiter samplingArbiter;
  final SegmentLifecycle segmentLifecycle;

  RequestInterceptor(RequestTracing requestTracing, SegmentNamingStrategy segmentNamingStrategy) {
    this.recorder = requestTracing.recorder;
    this.segmentNamingStrategy = segmentNamingStrategy;
    this.entityMarker = requestTracing.entityMarker;
    this.samplingArbiter = new SamplingArbiter(recorder);
    this.segmentLifecycle = new SegmentLifecycle(recorder, entityMarker,
      requestTracing.contextMissingStrategy);
  }

  @Override public void beginRequest(RequestContext context) {
    if (context == null) throw new NullPointerException("context == null");
    if (context.state != RequestContext.State.IDLE) {
      LOG.fine("Ignoring begin of " + context + ": a segment was already opened");
      return;
    }

    InboundRequest request = context.request;
    TraceHeader header = traceHeader(request);
    String segmentName;
    try {
      segmentName = segmentNamingStrategy.segmentName(request);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to name the segment of " + context + ". Not tracing.", e);
      return;
    }
    if (segmentName == null) {
      LOG.warning(segmentNamingStrategy + " returned no name for " + context + ". Not tracing.");
      return;
    }

    SamplingResponse samplingResponse =
      samplingArbiter.decide(header, samplingInput(request, segmentName));

    if (!segmentLifecycle.open(context, segmentName, header, samplingResponse)) return;
    Entity segment = context.segment;

    Throwable markFailure = segmentLifecycle.markAutoInstrumented(segment);
    if (markFailure != null) {
      LOG.log(Level.FINE, "Failed to mark " + segment + " as auto-instrumented", markFailure);
    }

    try {
      if (recorder.isTracingDisabled()) return;
      recorder.addHttpInformation(segment, HttpAttributes.REQUEST,
        HttpAttributes.requestAttributes(request));
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to record request attributes of " + context, e);
    }
  }

  @Override public void endRequest(RequestContext context) {
    if (context == null) throw new NullPointerException("context == null");
    if (context.isClosed()) {
      LOG.fine("Ignoring end of " + context + ": already ended");
      return;
    }

    Entity segment = segmentLifecycle.currentSegment(context);
    if (segment == null) return; // ContextMissingStrategy was notified

    OutboundResponse response = context.response;
    TraceHeader header = null;
    boolean decisionRequested = false;
    try {
      if (response != null) recordResponse(segment, response);
      recordError(segment, context.error());

      // parsed again as the host may not report begin and end with the same context
      header = traceHeader(context.request);
      decisionRequested = header.sampled() == SampleDecision.REQUESTED;
      segmentLifecycle.resolveDecision(segment, header);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to record the end of " + context, e);
    } finally {
      segmentLifecycle.close(context, segment);
    }

    if (!decisionRequested) return;
    if (response == null) {
      LOG.fine("Not returning the sampling decision of " + context + ": there's no response");
    } else if (!header.sampled().isResolved()) {
      LOG.fine("Not returning the sampling decision of " + context + ": it is unresolved");
    } else {
      try {
        response.header(TraceHeaderCodec.HEADER_KEY, TraceHeaderCodec.serialize(header));
      } catch (RuntimeException e) {
        LOG.log(Level.WARNING, "Failed to return the sampling decision of " + context, e);
      }
    }
  }

  /** Opens a segment for requests that fail before {@link #beginRequest} is reported. */
  @Override public void error(RequestContext context) {
    beginRequest(context);
  }

  void recordResponse(Entity segment, OutboundResponse response) {
    try {
      if (recorder.isTracingDisabled()) return;
      recorder.addHttpInformation(segment, HttpAttributes.RESPONSE,
        HttpAttributes.responseAttributes(response));
      entityMarker.markEntityFromStatus(segment, response.statusCode());
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to record response attributes of " + segment, e);
    }
  }

  void recordError(Entity segment, Throwable error) {
    if (error == null) return;
    try {
      recorder.addException(segment, error);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to record exception on " + segment, e);
    }
  }

  SamplingInput samplingInput(InboundRequest request, String segmentName) {
    String origin = null;
    try {
      origin = recorder.origin();
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to read the origin from " + recorder, e);
    }
    return new SamplingInput(request.header("Host"), request.path(), request.method(),
      segmentName, origin);
  }

  static TraceHeader traceHeader(InboundRequest request) {
    return TraceHeaderCodec.parseOrCreate(request.header(TraceHeaderCodec.HEADER_KEY));
  }

  @Override public String toString() {
    return "RequestInterceptor(recorder="
      + recorder
      + ", segmentNamingStrategy="
      + segmentNamingStrategy
      + ")";
  }
}
