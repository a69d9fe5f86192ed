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

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

public class MicrometerMetricsCollectorTest {

  @Test
  void simple() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector = new MicrometerMetricsCollector(registry);

    assertThat(registry.get("rabbitmq.supervisor.connections").gauge().value()).isZero();
    collector.openConnection();
    assertThat(registry.get("rabbitmq.supervisor.connections").gauge().value()).isEqualTo(1);
    collector.closeConnection();
    assertThat(registry.get("rabbitmq.supervisor.connections").gauge().value()).isZero();

    assertThat(registry.get("rabbitmq.supervisor.workers").gauge().value()).isZero();
    collector.openWorker();
    collector.openWorker();
    assertThat(registry.get("rabbitmq.supervisor.workers").gauge().value()).isEqualTo(2);
    collector.closeWorker();
    assertThat(registry.get("rabbitmq.supervisor.workers").gauge().value()).isEqualTo(1);

    assertThat(registry.get("rabbitmq.supervisor.channels").gauge().value()).isZero();
    collector.openChannel();
    collector.openChannel();
    collector.openChannel();
    collector.closeChannel();
    assertThat(registry.get("rabbitmq.supervisor.channels").gauge().value()).isEqualTo(2);

    assertThat(registry.get("rabbitmq.supervisor.connection_attempt_failures").counter().count())
        .isZero();
    collector.connectionAttemptFailure();
    collector.connectionAttemptFailure();
    assertThat(registry.get("rabbitmq.supervisor.connection_attempt_failures").counter().count())
        .isEqualTo(2.0);

    assertThat(registry.get("rabbitmq.supervisor.blocked_connections").gauge().value()).isZero();
    collector.blocked();
    assertThat(registry.get("rabbitmq.supervisor.blocked_connections").gauge().value())
        .isEqualTo(1);
    assertThat(registry.get("rabbitmq.supervisor.blocked").counter().count()).isEqualTo(1.0);
    collector.unblocked();
    assertThat(registry.get("rabbitmq.supervisor.blocked_connections").gauge().value()).isZero();
    assertThat(registry.get("rabbitmq.supervisor.unblocked").counter().count()).isEqualTo(1.0);

    collector.task(MetricsCollector.TaskOutcome.EXECUTED);
    collector.task(MetricsCollector.TaskOutcome.EXECUTED);
    collector.task(MetricsCollector.TaskOutcome.FAILED);
    collector.task(MetricsCollector.TaskOutcome.REJECTED);
    assertThat(registry.get("rabbitmq.supervisor.tasks_executed").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("rabbitmq.supervisor.tasks_failed").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("rabbitmq.supervisor.tasks_rejected").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void tagsAndPrefix() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector = new MicrometerMetricsCollector(registry, "app", "env", "test");
    collector.openConnection();
    assertThat(registry.get("app.connections").tag("env", "test").gauge().value()).isEqualTo(1);
  }

  @Test
  void prometheus() {
    PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    MetricsCollector collector = new MicrometerMetricsCollector(registry);

    collector.openConnection();
    collector.openConnection();
    collector.closeConnection();

    collector.openWorker();
    collector.openChannel();

    collector.blocked();

    collector.task(MetricsCollector.TaskOutcome.EXECUTED);
    collector.task(MetricsCollector.TaskOutcome.EXECUTED);
    collector.task(MetricsCollector.TaskOutcome.REJECTED);

    String scrape = registry.scrape();
    Stream.of(
            "# TYPE rabbitmq_supervisor_connections gauge",
            "rabbitmq_supervisor_connections 1.0",
            "# TYPE rabbitmq_supervisor_workers gauge",
            "rabbitmq_supervisor_workers 1.0",
            "# TYPE rabbitmq_supervisor_channels gauge",
            "rabbitmq_supervisor_channels 1.0",
            "rabbitmq_supervisor_blocked_connections 1.0",
            "# TYPE rabbitmq_supervisor_blocked_total counter",
            "rabbitmq_supervisor_blocked_total 1.0",
            "# TYPE rabbitmq_supervisor_tasks_executed_total counter",
            "rabbitmq_supervisor_tasks_executed_total 2.0",
            "rabbitmq_supervisor_tasks_rejected_total 1.0")
        .forEach(expected -> assertThat(scrape).contains(expected));
  }
}
