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
import brave.request_tracing.RequestContext.State;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens and closes the segment of a {@link RequestContext}, which moves from {@code IDLE} to
 * {@code OPEN} to {@code CLOSED}. Each transition happens at most once: repeated calls are logged
 * and ignored.
 */
final class SegmentLifecycle {
  static final Logger LOG = Logger.getLogger(SegmentLifecycle.class.getName());

  final Recorder recorder;
  final EntityMarker entityMarker;
  final ContextMissingStrategy contextMissingStrategy;

  SegmentLifecycle(Recorder recorder, EntityMarker entityMarker,
    ContextMissingStrategy contextMissingStrategy) {
    this.recorder = recorder;
    this.entityMarker = entityMarker;
    this.contextMissingStrategy = contextMissingStrategy;
  }

  /** Returns false if the context was already opened, or the recorder failed. */
  boolean open(RequestContext context, String name, TraceHeader header,
    SamplingResponse samplingResponse) {
    if (context.state != State.IDLE) {
      LOG.fine("Ignoring request to open a segment for " + context + ": already " + context.state);
      return false;
    }

    Entity segment;
    try {
      segment = recorder.beginSegment(name, header.rootTraceId(), header.parentId(),
        samplingResponse, context.startTimestamp);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to begin segment " + name + " for " + context, e);
      return false;
    }
    if (segment == null) {
      LOG.warning("Recorder returned no segment for " + context);
      return false;
    }

    context.traceHeader = header;
    context.segment = segment;
    context.state = State.OPEN;
    return true;
  }

  /** Returns the failure, if the mark couldn't be added. */
  @Nullable Throwable markAutoInstrumented(Entity segment) {
    try {
      entityMarker.addAutoInstrumentationMark(segment);
      return null;
    } catch (RuntimeException e) {
      return e;
    }
  }

  /**
   * Returns the open segment of this request, or the recorder's current entity if the context
   * doesn't have one. Returns null after notifying the {@link ContextMissingStrategy} when neither
   * exists.
   */
  @Nullable Entity currentSegment(RequestContext context) {
    Entity segment = context.segment();
    if (segment != null) return segment;
    try {
      segment = recorder.getEntity();
      if (segment == null) throw new EntityNotAvailableException("Recorder returned no entity");
      return segment;
    } catch (EntityNotAvailableException e) {
      contextMissingStrategy.handleEntityMissing(recorder, e,
        "Failed to get entity since it is not available in trace context while processing "
          + context);
      return null;
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to get the current entity of " + context, e);
      return null;
    }
  }

  /**
   * Copies the decision the recorder applied to the segment into the header. This only has an
   * effect when the header's decision is unresolved. Failures leave the header unchanged.
   */
  void resolveDecision(Entity entity, TraceHeader header) {
    if (header.sampled().isResolved()) return;
    if (!(entity instanceof Segment)) {
      LOG.log(Level.SEVERE, "Failed to get the segment for setting the sampling decision",
        new EntityNotAvailableException("Failed to cast " + entity + " to Segment"));
      return;
    }

    SampleDecision applied;
    try {
      applied = ((Segment) entity).sampleDecision();
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to read the sampling decision of " + entity, e);
      return;
    }
    if (applied == null || !applied.isResolved()) {
      LOG.fine("Segment " + entity + " has no sampling decision. Leaving " + header);
      return;
    }
    header.sampled(applied);
  }

  /** Ends the segment, unless this context was already closed. */
  void close(RequestContext context, Entity segment) {
    if (context.state == State.CLOSED) {
      LOG.fine("Ignoring request to close a segment for " + context + ": already closed");
      return;
    }
    context.state = State.CLOSED;
    context.segment = null;
    try {
      recorder.endSegment(segment);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to end segment " + segment + " for " + context, e);
    }
  }
}
