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

import brave.sampler.Matcher;
import brave.sampler.Sampler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Evaluates named rules in the order they were added. The first rule whose {@link Matcher} accepts
 * the input decides with its {@link Sampler}, and its name is reported with the decision. When no
 * rule matches, the {@link #DEFAULT_RULE default rule} decides.
 *
 * <p>Ex. Here's a strategy that rate limits health checks and samples 10% of everything else
 * <pre>{@code
 * strategy = RuleSamplingStrategy.newBuilder()
 *   .putRule("health", pathStartsWith("/health"), RateLimitingSampler.create(1))
 *   .defaultSampler(Sampler.create(0.1f))
 *   .build();
 * }</pre>
 *
 * @see SamplingInputMatchers
 */
public final class RuleSamplingStrategy implements SamplingStrategy {
  public static final String DEFAULT_RULE = "default";

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    final Map<String, Rule> rules = new LinkedHashMap<>();
    Sampler defaultSampler = Sampler.ALWAYS_SAMPLE;

    /**
     * Adds a rule, or replaces the one with the same name. A replaced rule keeps its position.
     *
     * @param ruleName reported in {@link SamplingResponse#ruleName()} when this rule decides
     */
    public Builder putRule(String ruleName, Matcher<SamplingInput> matcher, Sampler sampler) {
      if (ruleName == null) throw new NullPointerException("ruleName == null");
      if (ruleName.isEmpty()) throw new IllegalArgumentException("ruleName is empty");
      if (matcher == null) throw new NullPointerException("matcher == null");
      if (sampler == null) throw new NullPointerException("sampler == null");
      rules.put(ruleName, new Rule(ruleName, matcher, sampler));
      return this;
    }

    /** Optional: Decides when no rule matches. Defaults to {@link Sampler#ALWAYS_SAMPLE}. */
    public Builder defaultSampler(Sampler defaultSampler) {
      if (defaultSampler == null) throw new NullPointerException("defaultSampler == null");
      this.defaultSampler = defaultSampler;
      return this;
    }

    public RuleSamplingStrategy build() {
      return new RuleSamplingStrategy(this);
    }

    Builder() {
    }
  }

  static final class Rule {
    final String name;
    final Matcher<SamplingInput> matcher;
    final Sampler sampler;

    Rule(String name, Matcher<SamplingInput> matcher, Sampler sampler) {
      this.name = name;
      this.matcher = matcher;
      this.sampler = sampler;
    }

    @Override public String toString() {
      return "Rule(name=" + name + ", matcher=" + matcher + ", sampler=" + sampler + ")";
    }
  }

  final List<Rule> rules;
  final Rule defaultRule;

  RuleSamplingStrategy(Builder builder) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules.values()));
    this.defaultRule = new Rule(DEFAULT_RULE, input -> true, builder.defaultSampler);
  }

  @Override public SamplingResponse shouldTrace(SamplingInput input) {
    if (input == null) throw new NullPointerException("input == null");
    for (Rule rule : rules) {
      if (rule.matcher.matches(input)) return decide(rule);
    }
    return decide(defaultRule);
  }

  /** Samplers like {@code BoundarySampler} need a trace ID, but the input doesn't have one. */
  static SamplingResponse decide(Rule rule) {
    boolean sampled = rule.sampler.isSampled(ThreadLocalRandom.current().nextLong());
    return new SamplingResponse(rule.name,
      sampled ? SampleDecision.SAMPLED : SampleDecision.NOT_SAMPLED);
  }

  @Override public String toString() {
    return "RuleSamplingStrategy(rules=" + rules + ", defaultSampler=" + defaultRule.sampler + ")";
  }
}
