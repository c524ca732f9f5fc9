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
 * Makes the local sampling decision for a request whose caller didn't send one, or asked for one
 * with {@code Sampled=?}.
 *
 * <p>Implementations are invoked on the request thread, so should not block.
 *
 * <p>Here's an example that samples everything under {@code /api} and nothing else.
 * <pre>{@code
 * SamplingStrategy strategy = input -> input.urlPath() != null && input.urlPath().startsWith("/api")
 *   ? SamplingResponse.create("api", SampleDecision.SAMPLED)
 *   : SamplingResponse.create(null, SampleDecision.NOT_SAMPLED);
 * }</pre>
 *
 * @see RuleSamplingStrategy
 */
public interface SamplingStrategy {
  /**
   * Returns a response whose {@link SamplingResponse#decision() decision} is either {@link
   * SampleDecision#SAMPLED} or {@link SampleDecision#NOT_SAMPLED}.
   */
  SamplingResponse shouldTrace(SamplingInput input);
}
