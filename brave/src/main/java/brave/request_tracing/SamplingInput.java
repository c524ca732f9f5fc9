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
 * What a {@link SamplingStrategy} sees of a request. This is built for each request that needs a
 * decision and is not retained after it.
 */
public final class SamplingInput {
  public static SamplingInput create(@Nullable String host, @Nullable String urlPath,
    @Nullable String httpMethod, String segmentName, @Nullable String serviceOrigin) {
    if (segmentName == null) throw new NullPointerException("segmentName == null");
    return new SamplingInput(host, urlPath, httpMethod, segmentName, serviceOrigin);
  }

  @Nullable final String host, urlPath, httpMethod, serviceOrigin;
  final String segmentName;

  SamplingInput(@Nullable String host, @Nullable String urlPath, @Nullable String httpMethod,
    String segmentName, @Nullable String serviceOrigin) {
    this.host = host;
    this.urlPath = urlPath;
    this.httpMethod = httpMethod;
    this.segmentName = segmentName;
    this.serviceOrigin = serviceOrigin;
  }

  /** The {@code Host} header of the request, if present. */
  @Nullable public String host() {
    return host;
  }

  @Nullable public String urlPath() {
    return urlPath;
  }

  @Nullable public String httpMethod() {
    return httpMethod;
  }

  public String segmentName() {
    return segmentName;
  }

  /** The kind of platform this service runs on, as reported by the {@link Recorder}. */
  @Nullable public String serviceOrigin() {
    return serviceOrigin;
  }

  @Override public String toString() {
    return "SamplingInput(host="
      + host
      + ", urlPath="
      + urlPath
      + ", httpMethod="
      + httpMethod
      + ", segmentName="
      + segmentName
      + ", serviceOrigin="
      + serviceOrigin
      + ")";
  }
}
