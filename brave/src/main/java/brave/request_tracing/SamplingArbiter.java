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
 * Chooses between the caller's sampling decision and the local {@link SamplingStrategy}.
 *
 * <p>A caller that sent {@code Sampled=1} or {@code Sampled=0} has already decided for the whole
 * trace, so the strategy isn't consulted. Otherwise, the strategy decides and its decision is
 * written back to the {@link TraceHeader}.
 */
final class SamplingArbiter {
  static final Logger LOG = Logger.getLogger(SamplingArbiter.class.getName());

  final Recorder recorder;

  SamplingArbiter(Recorder recorder) {
    this.recorder = recorder;
  }

  SamplingResponse decide(TraceHeader header, SamplingInput input) {
    SampleDecision upstream = header.sampled();
    if (upstream.isResolved()) return new SamplingResponse(null, upstream);

    SamplingResponse response = shouldTrace(input);
    header.sampled(response.decision);
    return response;
  }

  /** A failing strategy results in an unsampled request, not a failed one. */
  SamplingResponse shouldTrace(SamplingInput input) {
    SamplingResponse response;
    try {
      response = recorder.samplingStrategy().shouldTrace(input);
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Sampling strategy failed for " + input + ". Not sampling.", e);
      return new SamplingResponse(null, SampleDecision.NOT_SAMPLED);
    }

    if (response == null || !response.decision.isResolved()) {
      LOG.warning("Sampling strategy returned " + response + " for " + input + ". Not sampling.");
      return new SamplingResponse(response != null ? response.ruleName : null,
        SampleDecision.NOT_SAMPLED);
    }
    return response;
  }
}
