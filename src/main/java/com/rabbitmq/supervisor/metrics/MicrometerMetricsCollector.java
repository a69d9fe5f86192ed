// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.supervisor.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong channels;
  private final AtomicLong workers;
  private final AtomicLong blockedConnections;
  private final Counter connectionAttemptFailures;
  private final Counter blocked, unblocked;
  private final Counter tasksExecuted, tasksFailed, tasksRejected;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.supervisor");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.channels = registry.gauge(prefix + ".channels", tags, new AtomicLong(0));
    this.workers = registry.gauge(prefix + ".workers", tags, new AtomicLong(0));
    this.blockedConnections =
        registry.gauge(prefix + ".blocked_connections", tags, new AtomicLong(0));
    this.connectionAttemptFailures =
        registry.counter(prefix + ".connection_attempt_failures", tags);
    this.blocked = registry.counter(prefix + ".blocked", tags);
    this.unblocked = registry.counter(prefix + ".unblocked", tags);
    this.tasksExecuted = registry.counter(prefix + ".tasks_executed", tags);
    this.tasksFailed = registry.counter(prefix + ".tasks_failed", tags);
    this.tasksRejected = registry.counter(prefix + ".tasks_rejected", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void connectionAttemptFailure() {
    this.connectionAttemptFailures.increment();
  }

  @Override
  public void openChannel() {
    this.channels.incrementAndGet();
  }

  @Override
  public void closeChannel() {
    this.channels.decrementAndGet();
  }

  @Override
  public void openWorker() {
    this.workers.incrementAndGet();
  }

  @Override
  public void closeWorker() {
    this.workers.decrementAndGet();
  }

  @Override
  public void blocked() {
    this.blockedConnections.set(1);
    this.blocked.increment();
  }

  @Override
  public void unblocked() {
    this.blockedConnections.set(0);
    this.unblocked.increment();
  }

  @Override
  public void task(TaskOutcome outcome) {
    switch (outcome) {
      case EXECUTED:
        this.tasksExecuted.increment();
        break;
      case FAILED:
        this.tasksFailed.increment();
        break;
      case REJECTED:
        this.tasksRejected.increment();
        break;
      default:
        break;
    }
  }
}
