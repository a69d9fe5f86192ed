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

import static com.rabbitmq.supervisor.impl.ExceptionUtils.exceptionMessage;
import static com.rabbitmq.supervisor.impl.Utils.closeIfOpen;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.supervisor.ChannelSetup;
import com.rabbitmq.supervisor.ChannelTask;
import com.rabbitmq.supervisor.ChannelWorker;
import com.rabbitmq.supervisor.PendingWorkPolicy;
import com.rabbitmq.supervisor.SupervisorException;
import com.rabbitmq.supervisor.metrics.MetricsCollector;
import com.rabbitmq.supervisor.metrics.MetricsCollector.TaskOutcome;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChannelWorker} owning at most one channel of its supervisor connection.
 *
 * <p>The supervisor pushes channels and flow control notifications to the worker, the worker
 * asks the supervisor for a new channel when its channel gets invalidated. Tasks are executed in
 * submission order on the worker mailbox.
 */
final class AmqpChannelWorker extends ResourceBase implements ChannelWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpChannelWorker.class);

  private final AmqpConnectionSupervisor supervisor;
  private final String name;
  private final ChannelSetup setup;
  private final PendingWorkPolicy noChannelPolicy;
  private final PendingWorkPolicy blockedPolicy;
  private final MetricsCollector metricsCollector;
  private final EventLoop.Client<WorkerState> mailbox;
  private volatile boolean blocked = false;
  private volatile Channel currentChannel;

  AmqpChannelWorker(
      AmqpConnectionSupervisor supervisor,
      String name,
      AmqpChannelWorkerBuilder parameters,
      EventLoop eventLoop) {
    super(parameters.listeners());
    this.supervisor = supervisor;
    this.name = name;
    this.setup = parameters.setup();
    this.noChannelPolicy = parameters.noChannelPolicy();
    this.blockedPolicy = parameters.blockedPolicy();
    this.metricsCollector = supervisor.metricsCollector();
    this.mailbox = eventLoop.register(name, new WorkerState());
  }

  @Override
  public CompletableFuture<Void> submit(ChannelTask task) {
    if (task == null) {
      throw new IllegalArgumentException("Task cannot be null");
    }
    PendingTask pendingTask = new PendingTask(task);
    if (!this.tell(s -> this.onTask(s, pendingTask))) {
      this.reject(pendingTask, this.closedException());
    }
    return pendingTask.result;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public boolean isBlocked() {
    return this.blocked;
  }

  @Override
  public void close() {
    this.tell(s -> this.terminate(s, true));
  }

  // messages from the supervisor

  void channel(Channel channel) {
    if (!this.tell(s -> this.onChannel(s, channel))) {
      closeIfOpen(channel);
    }
  }

  void invalidated() {
    this.tell(this::onInvalidated);
  }

  void blocked(String reason) {
    this.tell(s -> this.onBlocked(s, reason));
  }

  void unblocked() {
    this.tell(this::onUnblocked);
  }

  CompletableFuture<Void> closeFromSupervisor() {
    try {
      return this.mailbox.submit(s -> this.terminate(s, false));
    } catch (IllegalStateException e) {
      LOGGER.debug("Worker '{}' already closed", this.name);
      return CompletableFuture.completedFuture(null);
    }
  }

  Channel channel() {
    return this.currentChannel;
  }

  private boolean tell(Consumer<WorkerState> message) {
    try {
      this.mailbox.submit(message);
      return true;
    } catch (IllegalStateException e) {
      LOGGER.debug("Worker '{}' is closed, ignoring message", this.name);
      return false;
    }
  }

  private void onChannel(WorkerState s, Channel channel) {
    if (s.closed) {
      closeIfOpen(channel);
      return;
    }
    if (s.channel == channel) {
      return;
    }
    if (s.channel != null) {
      LOGGER.debug("Worker '{}' replacing channel {} with {}", this.name, s.channel, channel);
      closeIfOpen(s.channel);
      if (s.channel == this.currentChannel) {
        this.metricsCollector.closeChannel();
      }
    }
    s.channel = channel;
    this.currentChannel = null;
    channel.addShutdownListener(
        cause -> this.tell(st -> this.onChannelShutdown(st, channel, cause)));
    try {
      this.setup.setup(channel, this);
    } catch (Exception e) {
      LOGGER.warn(
          "Error while setting up channel of worker '{}', waiting for the next channel: {}",
          this.name,
          exceptionMessage(e));
      s.channel = null;
      closeIfOpen(channel);
      this.state(State.DISCONNECTED, e);
      return;
    }
    this.currentChannel = channel;
    this.metricsCollector.openChannel();
    this.state(State.CONNECTED);
    this.drain(s);
  }

  private void onInvalidated(WorkerState s) {
    if (s.closed) {
      return;
    }
    LOGGER.debug("Channel of worker '{}' invalidated, asking for a new one", this.name);
    closeIfOpen(s.channel);
    this.dropChannel(s, null);
    s.blockedReason = null;
    this.blocked = false;
    this.askForChannel();
  }

  private void onChannelShutdown(WorkerState s, Channel channel, ShutdownSignalException cause) {
    if (s.closed || s.channel != channel) {
      return;
    }
    if (ExceptionUtils.initiatedByApplication(cause)) {
      LOGGER.debug("Channel of worker '{}' closed by the application", this.name);
      this.dropChannel(s, null);
    } else if (ExceptionUtils.hardError(cause)) {
      LOGGER.debug(
          "Connection of worker '{}' failed ({}), waiting for the supervisor",
          this.name,
          exceptionMessage(cause));
      this.dropChannel(s, cause);
    } else {
      LOGGER.info("Channel of worker '{}' closed: {}", this.name, exceptionMessage(cause));
      this.dropChannel(s, cause);
      this.askForChannel();
    }
  }

  private void askForChannel() {
    CompletableFuture<Channel> reply;
    try {
      reply = this.supervisor.provideChannel();
    } catch (SupervisorException e) {
      LOGGER.debug("Cannot ask for channel for worker '{}': {}", this.name, exceptionMessage(e));
      return;
    }
    reply.whenComplete(
        (channel, ex) -> {
          if (ex == null) {
            this.tell(s -> this.onProvidedChannel(s, channel));
          } else {
            LOGGER.debug(
                "No channel for worker '{}' ({}), waiting for reconnection",
                this.name,
                exceptionMessage(ex));
          }
        });
  }

  private void onProvidedChannel(WorkerState s, Channel channel) {
    if (s.channel == null) {
      this.onChannel(s, channel);
    } else {
      // the supervisor pushed one after reconnecting
      closeIfOpen(channel);
    }
  }

  private void onBlocked(WorkerState s, String reason) {
    if (s.closed) {
      return;
    }
    s.blockedReason = reason;
    this.blocked = true;
    LOGGER.debug("Worker '{}' blocked: {}", this.name, reason);
  }

  private void onUnblocked(WorkerState s) {
    if (s.closed) {
      return;
    }
    s.blockedReason = null;
    this.blocked = false;
    LOGGER.debug("Worker '{}' unblocked, {} pending task(s)", this.name, s.pending.size());
    this.drain(s);
  }

  private void onTask(WorkerState s, PendingTask task) {
    if (s.closed) {
      this.reject(task, this.closedException());
    } else if (s.canRun()) {
      s.pending.offer(task);
      this.drain(s);
    } else if (s.blockedReason != null && s.hasOpenChannel()) {
      if (this.blockedPolicy == PendingWorkPolicy.QUEUE) {
        s.pending.offer(task);
      } else {
        this.reject(task, new SupervisorException.ConnectionBlockedException(s.blockedReason));
      }
    } else {
      if (this.noChannelPolicy == PendingWorkPolicy.QUEUE) {
        s.pending.offer(task);
      } else {
        this.reject(
            task,
            new SupervisorException.ChannelUnavailableException(
                "Worker '%s' has no channel", this.name));
      }
    }
  }

  private void drain(WorkerState s) {
    while (s.canRun() && !s.pending.isEmpty()) {
      PendingTask task = s.pending.poll();
      try {
        task.task.run(s.channel);
        this.metricsCollector.task(TaskOutcome.EXECUTED);
        task.result.complete(null);
      } catch (Exception e) {
        LOGGER.debug("Task of worker '{}' failed: {}", this.name, exceptionMessage(e));
        this.metricsCollector.task(TaskOutcome.FAILED);
        task.result.completeExceptionally(e);
      }
    }
  }

  private void dropChannel(WorkerState s, Throwable cause) {
    if (s.channel != null && s.channel == this.currentChannel) {
      this.metricsCollector.closeChannel();
    }
    s.channel = null;
    this.currentChannel = null;
    this.state(State.DISCONNECTED, cause);
  }

  private void terminate(WorkerState s, boolean unregister) {
    if (s.closed) {
      return;
    }
    s.closed = true;
    LOGGER.debug("Closing worker '{}', {} pending task(s)", this.name, s.pending.size());
    PendingTask task;
    while ((task = s.pending.poll()) != null) {
      this.reject(task, this.closedException());
    }
    if (s.channel != null) {
      closeIfOpen(s.channel);
      if (s.channel == this.currentChannel) {
        this.metricsCollector.closeChannel();
      }
      s.channel = null;
      this.currentChannel = null;
    }
    this.metricsCollector.closeWorker();
    this.mailbox.close();
    if (unregister) {
      this.supervisor.removeWorker(this);
    }
    this.state(State.CLOSED);
  }

  private void reject(PendingTask task, SupervisorException exception) {
    this.metricsCollector.task(TaskOutcome.REJECTED);
    task.result.completeExceptionally(exception);
  }

  private SupervisorException closedException() {
    return new SupervisorException.SupervisorClosedException(
        "Worker '" + this.name + "' is closed");
  }

  @Override
  public String toString() {
    return this.name;
  }

  private static final class WorkerState {

    private Channel channel;
    private String blockedReason;
    private boolean closed = false;
    private final Deque<PendingTask> pending = new ArrayDeque<>();

    private boolean hasOpenChannel() {
      return this.channel != null && this.channel.isOpen();
    }

    private boolean canRun() {
      return hasOpenChannel() && this.blockedReason == null;
    }
  }

  private static final class PendingTask {

    private final ChannelTask task;
    private final CompletableFuture<Void> result = new CompletableFuture<>();

    private PendingTask(ChannelTask task) {
      this.task = task;
    }
  }
}
