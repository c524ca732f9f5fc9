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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Process-wide configuration of request tracing. Build one at startup and share it with every
 * host pipeline that should be traced.
 *
 * <p><pre>{@code
 * requestTracing = RequestTracing.newBuilder()
 *   .recorder(BraveRecorder.newBuilder(tracing).samplingStrategy(strategy).build())
 *   .serviceName("api")
 *   .environment(System.getenv())
 *   .build();
 *
 * // in each host pipeline
 * RequestLifecycleListener listener = requestTracing.requestLifecycleListener();
 * }</pre>
 */
public final class RequestTracing {
  static final Logger LOG = Logger.getLogger(RequestTracing.class.getName());

  /** Overrides {@link Builder#serviceName(String)} when set. */
  public static final String TRACING_NAME_ENV = "AWS_XRAY_TRACING_NAME";
  /** {@code LOG_ERROR} or {@code IGNORE_ERROR}: see {@link ContextMissingStrategy}. */
  public static final String CONTEXT_MISSING_ENV = "AWS_XRAY_CONTEXT_MISSING";

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Recorder recorder;
    @Nullable SegmentNamingStrategy segmentNamingStrategy;
    @Nullable String serviceName;
    EntityMarker entityMarker = DefaultEntityMarker.INSTANCE;
    ContextMissingStrategy contextMissingStrategy = ContextMissingStrategy.LOG_ERROR;
    Map<String, String> environment = Collections.emptyMap();

    /** Required: Begins and ends the segments of each request. */
    public Builder recorder(Recorder recorder) {
      if (recorder == null) throw new NullPointerException("recorder == null");
      this.recorder = recorder;
      return this;
    }

    /**
     * Optional: Names each segment. This takes precedence over {@link #serviceName(String)}.
     *
     * <p>When neither is set, a strategy must be passed to {@link
     * RequestTracing#initializeSegmentNaming(SegmentNamingStrategy)} before requests are traced.
     */
    public Builder segmentNamingStrategy(SegmentNamingStrategy segmentNamingStrategy) {
      if (segmentNamingStrategy == null) {
        throw new NullPointerException("segmentNamingStrategy == null");
      }
      this.segmentNamingStrategy = segmentNamingStrategy;
      return this;
    }

    /**
     * Optional: Names all segments after this service, via {@link FixedSegmentNamingStrategy}. The
     * environment variable {@value #TRACING_NAME_ENV} overrides this.
     */
    public Builder serviceName(String serviceName) {
      this.serviceName = FixedSegmentNamingStrategy.validateName(serviceName);
      return this;
    }

    /** Optional: Defaults to {@link DefaultEntityMarker}. */
    public Builder entityMarker(EntityMarker entityMarker) {
      if (entityMarker == null) throw new NullPointerException("entityMarker == null");
      this.entityMarker = entityMarker;
      return this;
    }

    /** Optional: Defaults to {@link ContextMissingStrategy#LOG_ERROR}. */
    public Builder contextMissingStrategy(ContextMissingStrategy contextMissingStrategy) {
      if (contextMissingStrategy == null) {
        throw new NullPointerException("contextMissingStrategy == null");
      }
      this.contextMissingStrategy = contextMissingStrategy;
      return this;
    }

    /**
     * Optional: Variables such as {@link System#getenv()}, read when {@link #build() building}.
     *
     * <ul>
     *   <li>{@value #TRACING_NAME_ENV} overrides the {@link #serviceName(String)}</li>
     *   <li>{@value #CONTEXT_MISSING_ENV} overrides the {@link
     *   #contextMissingStrategy(ContextMissingStrategy)}</li>
     * </ul>
     */
    public Builder environment(Map<String, String> environment) {
      if (environment == null) throw new NullPointerException("environment == null");
      this.environment = new LinkedHashMap<>(environment);
      return this;
    }

    public RequestTracing build() {
      if (recorder == null) throw new NullPointerException("recorder == null");
      return new RequestTracing(this);
    }

    @Nullable SegmentNamingStrategy segmentNamingStrategy() {
      if (segmentNamingStrategy != null) return segmentNamingStrategy;
      String name = environment.get(TRACING_NAME_ENV);
      if (name == null || name.trim().isEmpty()) name = serviceName;
      return name != null ? FixedSegmentNamingStrategy.create(name) : null;
    }

    ContextMissingStrategy contextMissingStrategy() {
      String value = environment.get(CONTEXT_MISSING_ENV);
      if (value == null || value.trim().isEmpty()) return contextMissingStrategy;
      switch (value.trim().toUpperCase(Locale.ROOT)) {
        case "LOG_ERROR":
          return ContextMissingStrategy.LOG_ERROR;
        case "IGNORE_ERROR":
          return ContextMissingStrategy.IGNORE_ERROR;
        default:
          LOG.warning("Ignoring invalid " + CONTEXT_MISSING_ENV + ": " + value
            + ". Using " + contextMissingStrategy);
          return contextMissingStrategy;
      }
    }

    Builder() {
    }
  }

  final Recorder recorder;
  final EntityMarker entityMarker;
  final ContextMissingStrategy contextMissingStrategy;
  final AtomicReference<SegmentNamingStrategy> segmentNamingStrategy;

  RequestTracing(Builder builder) {
    this.recorder = builder.recorder;
    this.entityMarker = builder.entityMarker;
    this.contextMissingStrategy = builder.contextMissingStrategy();
    this.segmentNamingStrategy = new AtomicReference<>(builder.segmentNamingStrategy());
  }

  public Recorder recorder() {
    return recorder;
  }

  /** Returns the naming strategy, or null if it hasn't been initialized. */
  @Nullable public SegmentNamingStrategy segmentNamingStrategy() {
    return segmentNamingStrategy.get();
  }

  /**
   * Sets the naming strategy, unless it was already set. This allows each of several host
   * pipelines to initialize tracing while only the first takes effect.
   *
   * @return false if a strategy was already set, in which case this call had no effect.
   */
  public boolean initializeSegmentNaming(SegmentNamingStrategy segmentNamingStrategy) {
    if (segmentNamingStrategy == null) {
      throw new NullPointerException("segmentNamingStrategy == null");
    }
    if (this.segmentNamingStrategy.compareAndSet(null, segmentNamingStrategy)) return true;
    LOG.fine("Segment naming already initialized. Ignoring " + segmentNamingStrategy);
    return false;
  }

  /**
   * Returns a listener to register with a host pipeline.
   *
   * @throws IllegalStateException if there is no {@link SegmentNamingStrategy} yet.
   */
  public RequestLifecycleListener requestLifecycleListener() {
    SegmentNamingStrategy namingStrategy = segmentNamingStrategy.get();
    if (namingStrategy == null) {
      throw new IllegalStateException(
        "segmentNamingStrategy not initialized: set serviceName or segmentNamingStrategy");
    }
    return new RequestInterceptor(this, namingStrategy);
  }

  @Override public String toString() {
    return "RequestTracing(recorder="
      + recorder
      + ", segmentNamingStrategy="
      + segmentNamingStrategy.get()
      + ", contextMissingStrategy="
      + contextMissingStrategy
      + ")";
  }
}
