/*
 * どこで: Profile サービス層
 * 何を: 集約/統合/統合トークン/preferred 変更のアプリ固有メトリクスを記録する
 * なぜ: 統合失敗やトークン失効の傾向を Prometheus から直接観測できるようにするため
 */
package com.nomen.profile.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ProfileMetrics {

  private static final String METRIC_CONSOLIDATION_TOTAL = "profile.consolidation.total";
  private static final String METRIC_MERGE_TOTAL = "profile.merge.total";
  private static final String METRIC_MERGE_REQUEST_TOTAL = "profile.merge_request.total";
  private static final String METRIC_PREFERENCE_CHANGE_TOTAL = "profile.preference.change.total";
  private static final String METRIC_MERGE_DURATION = "profile.merge.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> consolidationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> mergeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> mergeRequestCounters = new ConcurrentHashMap<>();
  private final Counter preferenceChangeCounter;
  private final Timer mergeDurationTimer;

  public ProfileMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.preferenceChangeCounter =
        Counter.builder(METRIC_PREFERENCE_CHANGE_TOTAL)
            .description("Total number of preferred attribute changes")
            .register(meterRegistry);
    this.mergeDurationTimer =
        Timer.builder(METRIC_MERGE_DURATION)
            .description("Duration of account merge transactions")
            .register(meterRegistry);
  }

  public void recordConsolidation(String result) {
    increment(
        consolidationCounters,
        METRIC_CONSOLIDATION_TOTAL,
        "result",
        result,
        "Identity consolidation outcomes");
  }

  public void recordMerge(String result) {
    increment(mergeCounters, METRIC_MERGE_TOTAL, "result", result, "Account merge outcomes");
  }

  public void recordMergeRequest(String action) {
    increment(
        mergeRequestCounters,
        METRIC_MERGE_REQUEST_TOTAL,
        "action",
        action,
        "Merge request lifecycle events");
  }

  public void recordPreferenceChange() {
    preferenceChangeCounter.increment();
  }

  public void recordMergeDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    mergeDurationTimer.record(duration);
  }

  private void increment(
      ConcurrentMap<String, Counter> counters,
      String name,
      String tagKey,
      String tagValue,
      String description) {
    counters
        .computeIfAbsent(
            tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
