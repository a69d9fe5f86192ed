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
package com.rabbitmq.supervisor.impl;

import com.rabbitmq.supervisor.ChannelSetup;
import com.rabbitmq.supervisor.ChannelWorker;
import com.rabbitmq.supervisor.ChannelWorkerBuilder;
import com.rabbitmq.supervisor.PendingWorkPolicy;
import com.rabbitmq.supervisor.Resource;
import com.rabbitmq.supervisor.SupervisorException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

class AmqpChannelWorkerBuilder implements ChannelWorkerBuilder {

  private static final Duration CREATION_TIMEOUT = Duration.ofSeconds(60);

  private final AmqpConnectionSupervisor supervisor;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private String name;
  private ChannelSetup setup = ChannelSetup.NO_OP;
  private PendingWorkPolicy noChannelPolicy = PendingWorkPolicy.QUEUE;
  private PendingWorkPolicy blockedPolicy = PendingWorkPolicy.QUEUE;

  AmqpChannelWorkerBuilder(AmqpConnectionSupervisor supervisor) {
    this.supervisor = supervisor;
  }

  @Override
  public ChannelWorkerBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public ChannelWorkerBuilder setup(ChannelSetup setup) {
    this.setup = setup == null ? ChannelSetup.NO_OP : setup;
    return this;
  }

  @Override
  public ChannelWorkerBuilder noChannelPolicy(PendingWorkPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Policy cannot be null");
    }
    this.noChannelPolicy = policy;
    return this;
  }

  @Override
  public ChannelWorkerBuilder blockedPolicy(PendingWorkPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Policy cannot be null");
    }
    this.blockedPolicy = policy;
    return this;
  }

  @Override
  public ChannelWorkerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public CompletableFuture<ChannelWorker> create() {
    return this.supervisor.createChannel(this.duplicate());
  }

  @Override
  public ChannelWorker build() {
    try {
      return this.create().get(CREATION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SupervisorException("Interrupted while creating channel worker", e);
    } catch (ExecutionException e) {
      throw ExceptionUtils.convert(e);
    } catch (TimeoutException e) {
      throw new SupervisorException(
          "Channel worker not created after %d second(s)", CREATION_TIMEOUT.toSeconds());
    }
  }

  // the supervisor may process the creation after the application has changed this instance
  private AmqpChannelWorkerBuilder duplicate() {
    AmqpChannelWorkerBuilder copy = new AmqpChannelWorkerBuilder(this.supervisor);
    copy.name = this.name;
    copy.setup = this.setup;
    copy.noChannelPolicy = this.noChannelPolicy;
    copy.blockedPolicy = this.blockedPolicy;
    copy.listeners.addAll(this.listeners);
    return copy;
  }

  String name() {
    return this.name;
  }

  ChannelSetup setup() {
    return this.setup;
  }

  PendingWorkPolicy noChannelPolicy() {
    return this.noChannelPolicy;
  }

  PendingWorkPolicy blockedPolicy() {
    return this.blockedPolicy;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
