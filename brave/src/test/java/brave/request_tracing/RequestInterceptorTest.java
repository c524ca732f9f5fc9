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

import brave.request_tracing.FakeRecorder.FakeSegment;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RequestInterceptorTest {
  static final String ROOT = "1-5759e988-bd862e3fe1be46a994272793", PARENT = "53995c3f42cd8ad8";

  FakeRecorder recorder = new FakeRecorder();
  List<String> missing = new ArrayList<>();
  RequestTracing requestTracing = RequestTracing.newBuilder()
    .recorder(recorder)
    .serviceName("api")
    .contextMissingStrategy((recorder, error, message) -> missing.add(message))
    .build();
  RequestLifecycleListener listener = requestTracing.requestLifecycleListener();

  FakeInboundRequest request = new FakeInboundRequest("/orders");
  FakeOutboundResponse response = new FakeOutboundResponse();
  RequestContext context = RequestContext.create(request, 1_600_000_000_000_000L);

  @Test public void noTraceHeader_startsNewTrace() {
    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    FakeSegment segment = recorder.onlySegment();
    assertThat(segment.name).isEqualTo("api");
    assertThat(TraceIds.isValidRootTraceId(segment.rootTraceId)).isTrue();
    assertThat(segment.parentId).isNull();
    assertThat(segment.samplingResponse)
      .isEqualTo(SamplingResponse.create("default", SampleDecision.SAMPLED));
    assertThat(segment.annotations).containsEntry("auto_instrumentation", "true");
    assertThat(segment.http.get(HttpAttributes.REQUEST))
      .containsEntry("url", "http://api.example.com/orders")
      .containsEntry("method", "GET")
      .containsEntry("client_ip", "10.0.0.1");
    assertThat(segment.http.get(HttpAttributes.RESPONSE)).containsEntry("status", 200);

    assertThat(recorder.events).containsExactly(
      "beginSegment",
      "addHttpInformation:request",
      "addHttpInformation:response",
      "endSegment"
    );
    assertThat(context.isClosed()).isTrue();
    assertThat(response.headers()).isEmpty();
  }

  @Test public void traceHeader_continuesTrace() {
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Parent=" + PARENT + ";Sampled=0");

    listener.beginRequest(context);

    FakeSegment segment = recorder.onlySegment();
    assertThat(segment.rootTraceId).isEqualTo(ROOT);
    assertThat(segment.parentId).isEqualTo(PARENT);
    assertThat(segment.samplingResponse)
      .isEqualTo(SamplingResponse.create(null, SampleDecision.NOT_SAMPLED));
    assertThat(context.traceHeader())
      .isEqualTo(TraceHeader.create(ROOT, PARENT, SampleDecision.NOT_SAMPLED));
  }

  @Test public void samplingInput_describesRequest() {
    List<SamplingInput> inputs = new ArrayList<>();
    recorder.samplingStrategy = input -> {
      inputs.add(input);
      return SamplingResponse.create("orders", SampleDecision.NOT_SAMPLED);
    };

    listener.beginRequest(context);

    assertThat(inputs).hasSize(1);
    SamplingInput input = inputs.get(0);
    assertThat(input.host()).isEqualTo("api.example.com");
    assertThat(input.urlPath()).isEqualTo("/orders");
    assertThat(input.httpMethod()).isEqualTo("GET");
    assertThat(input.segmentName()).isEqualTo("api");
    assertThat(input.serviceOrigin()).isEqualTo("AWS::EC2::Instance");
  }

  @Test public void requestedDecision_isReturnedInResponse() {
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Parent=" + PARENT + ";Sampled=?");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(response.headerWrites()).containsExactly("X-Amzn-Trace-Id");
    assertThat(response.header("X-Amzn-Trace-Id"))
      .isEqualTo("Root=" + ROOT + ";Parent=" + PARENT + ";Sampled=1");
  }

  @Test public void requestedDecision_returnsDecisionAppliedByRecorder() {
    recorder.overrideDecision = SampleDecision.NOT_SAMPLED;
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Sampled=?");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(response.header("X-Amzn-Trace-Id")).isEqualTo("Root=" + ROOT + ";Sampled=0");
  }

  @Test public void requestedDecision_unresolvedIsNotReturned() {
    recorder.overrideDecision = SampleDecision.UNKNOWN;
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Sampled=?");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(response.headerWrites()).isEmpty();
    assertThat(context.isClosed()).isTrue();
  }

  @Test public void unrequestedDecision_isNotReturned() {
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT);

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(response.headerWrites()).isEmpty();
  }

  @Test public void invalidTraceHeader_startsNewTrace() {
    request.header("X-Amzn-Trace-Id", "Root=1-5759e988;Sampled=1");

    listener.beginRequest(context);

    assertThat(recorder.onlySegment().rootTraceId).isNotEqualTo("1-5759e988");
    assertThat(recorder.onlySegment().samplingResponse.ruleName()).isEqualTo("default");
  }

  @Test public void errorThenBegin_opensOnce() {
    listener.error(context.error(new IllegalStateException("boom")));
    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(recorder.begun).hasSize(1);
    assertThat(recorder.ended).hasSize(1);
  }

  @Test public void beginThenError_opensOnce() {
    listener.beginRequest(context);
    listener.error(context.error(new IllegalStateException("boom")));
    listener.endRequest(context.response(response));

    assertThat(recorder.begun).hasSize(1);
    assertThat(recorder.ended).hasSize(1);
  }

  @Test public void errorWithoutBegin_opensSegment() {
    listener.error(context);

    assertThat(recorder.begun).hasSize(1);
    assertThat(context.isOpen()).isTrue();
  }

  @Test public void error_addedBeforeSegmentEnds() {
    IllegalStateException error = new IllegalStateException("boom");

    listener.beginRequest(context);
    listener.error(context.error(error));
    listener.endRequest(context);

    assertThat(recorder.onlySegment().exceptions).containsExactly(error);
    assertThat(recorder.events).containsSubsequence("addException", "endSegment");
    assertThat(recorder.events).doesNotContain("addHttpInformation:response");
  }

  @Test public void responseError_isAdded() {
    IllegalStateException error = new IllegalStateException("boom");

    listener.beginRequest(context);
    listener.endRequest(context.response(new FakeOutboundResponse(500).error(error)));

    FakeSegment segment = recorder.onlySegment();
    assertThat(segment.exceptions).containsExactly(error);
    assertThat(segment.fault).isTrue();
  }

  @Test public void noResponse_stillEndsSegment() {
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Sampled=?");

    listener.beginRequest(context);
    listener.endRequest(context);

    assertThat(recorder.ended).hasSize(1);
    assertThat(context.isClosed()).isTrue();
  }

  @Test public void endTwice_endsOnce() {
    listener.beginRequest(context);
    listener.endRequest(context.response(response));
    listener.endRequest(context);

    assertThat(recorder.ended).hasSize(1);
  }

  @Test public void tracingDisabled_skipsHttpInformation() {
    recorder.tracingDisabled = true;

    listener.beginRequest(context);
    listener.endRequest(context.response(new FakeOutboundResponse(500)));

    assertThat(recorder.events).containsExactly("beginSegment", "endSegment");
    assertThat(recorder.onlySegment().fault).isFalse();
  }

  @Test public void startTimestamp_isRequestTimestamp() {
    listener.beginRequest(context);

    assertThat(recorder.onlySegment().startTimestamp).isEqualTo(1_600_000_000_000_000L);
  }

  @Test public void httpInformationFailure_stillEndsSegment() {
    recorder.addHttpFailure = new IllegalStateException("emitter closed");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(recorder.ended).hasSize(1);
    assertThat(context.isClosed()).isTrue();
  }

  @Test public void beginFailure_doesNotFailRequest() {
    recorder.beginFailure = new IllegalStateException("queue full");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(recorder.ended).isEmpty();
    assertThat(missing).hasSize(1);
  }

  @Test public void endWithoutBegin_notifiesContextMissingStrategy() {
    listener.endRequest(context.response(response));

    assertThat(recorder.events).containsExactly("getEntity");
    assertThat(missing).hasSize(1);
    assertThat(context.isClosed()).isFalse();
  }

  @Test public void endWithoutBegin_usesRecorderCurrentSegment() {
    FakeSegment current = new FakeSegment("api", ROOT, null,
      SamplingResponse.create(null, SampleDecision.SAMPLED), 1L);
    recorder.current = current;

    listener.endRequest(context.response(response));

    assertThat(current.http).containsKey(HttpAttributes.RESPONSE);
    assertThat(recorder.ended).containsExactly(current);
    assertThat(context.isClosed()).isTrue();
  }

  @Test public void endWithoutBegin_defaultStrategyDoesNotThrow() {
    for (ContextMissingStrategy strategy : new ContextMissingStrategy[] {
      ContextMissingStrategy.LOG_ERROR, ContextMissingStrategy.IGNORE_ERROR}) {
      RequestLifecycleListener listener = RequestTracing.newBuilder()
        .recorder(recorder)
        .serviceName("api")
        .contextMissingStrategy(strategy)
        .build().requestLifecycleListener();

      listener.endRequest(RequestContext.create(request));
    }

    assertThat(recorder.ended).isEmpty();
  }

  @Test public void clientErrorStatus_marksError() {
    listener.beginRequest(context);
    listener.endRequest(context.response(new FakeOutboundResponse(429)));

    FakeSegment segment = recorder.onlySegment();
    assertThat(segment.error).isTrue();
    assertThat(segment.throttle).isTrue();
    assertThat(segment.fault).isFalse();
  }

  @Test public void namingFailure_doesNotFailRequest() {
    RequestLifecycleListener listener = RequestTracing.newBuilder()
      .recorder(recorder)
      .segmentNamingStrategy(request -> {
        throw new IllegalStateException("no host");
      })
      .build().requestLifecycleListener();

    listener.beginRequest(context);

    assertThat(recorder.begun).isEmpty();
    assertThat(context.isOpen()).isFalse();
  }

  @Test public void dynamicNaming_usesHost() {
    RequestLifecycleListener listener = RequestTracing.newBuilder()
      .recorder(recorder)
      .segmentNamingStrategy(DynamicSegmentNamingStrategy.create("api", "*.example.com"))
      .build().requestLifecycleListener();

    listener.beginRequest(context);

    assertThat(recorder.onlySegment().name).isEqualTo("api.example.com");
  }

  @Test public void currentEntityFailure_doesNotFailRequest() {
    recorder.getEntityFailure = new IllegalStateException("context storage broken");

    listener.endRequest(context.response(response));

    assertThat(recorder.events).containsExactly("getEntity");
    assertThat(missing).isEmpty();
  }

  @Test public void tracingDisabledFailure_stillOpensAndEndsSegment() {
    recorder.tracingDisabledFailure = new IllegalStateException("config unavailable");

    listener.beginRequest(context);
    listener.endRequest(context.response(response));

    assertThat(recorder.events).containsExactly("beginSegment", "endSegment");
    assertThat(context.isClosed()).isTrue();
  }

  @Test public void originFailure_stillSamples() {
    recorder.originFailure = new IllegalStateException("no instance metadata");
    List<SamplingInput> inputs = new ArrayList<>();
    recorder.samplingStrategy = input -> {
      inputs.add(input);
      return SamplingResponse.create("default", SampleDecision.SAMPLED);
    };

    listener.beginRequest(context);

    assertThat(inputs).hasSize(1);
    assertThat(inputs.get(0).serviceOrigin()).isNull();
    assertThat(context.isOpen()).isTrue();
  }

  @Test public void sampleDecisionFailure_stillEndsSegment() {
    request.header("X-Amzn-Trace-Id", "Root=" + ROOT + ";Sampled=?");
    listener.beginRequest(context);
    recorder.onlySegment().sampleDecisionFailure = new IllegalStateException("span finished");

    listener.endRequest(context.response(response));

    assertThat(recorder.ended).hasSize(1);
    assertThat(response.headerWrites()).isEmpty();
  }
}
