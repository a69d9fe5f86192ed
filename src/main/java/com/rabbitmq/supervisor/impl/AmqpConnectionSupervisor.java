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
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.supervisor.BackOffDelayPolicy;
import com.rabbitmq.supervisor.ChannelWorker;
import com.rabbitmq.supervisor.ChannelWorkerBuilder;
import com.rabbitmq.supervisor.ConnectionSetup;
import com.rabbitmq.supervisor.ConnectionSupervisor;
import com.rabbitmq.supervisor.SupervisorException;
import com.rabbitmq.supervisor.impl.Utils.StopWatch;
import com.rabbitmq.supervisor.metrics.MetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConnectionSupervisor extends ResourceBase implements ConnectionSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnectionSupervisor.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final String name;
  private final String label;
  private final ConnectionFactory connectionFactory;
  private final BackOffDelayPolicy delayPolicy;
  private final ConnectionSetup connectionSetup;
  private final boolean blockedConnectionHandling;
  private final MetricsCollector metricsCollector;
  private final ExecutorService executorService;
  private final boolean internalExecutor;
  private final ScheduledExecutorService scheduledExecutorService;
  private final boolean internalScheduledExecutor;
  private final EventLoop eventLoop;
  private final EventLoop.Client<SupervisorState> mailbox;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong workerIdSequence = new AtomicLong(0);

  // confined to the event loop
  private final Map<String, AmqpChannelWorker> workers = new LinkedHashMap<>();
  private volatile ScheduledFuture<?> reconnectTask;
  private int failedAttempts = 0;
  private Throwable transitionCause;

  AmqpConnectionSupervisor(AmqpConnectionSupervisorBuilder builder) {
    super(builder.listeners());
    this.id = ID_SEQUENCE.getAndIncrement();
    this.name = builder.name() == null ? "rabbitmq-supervisor-" + this.id : builder.name();
    this.connectionFactory = builder.connectionFactory();
    this.label = Utils.connectionLabel(this.connectionFactory);
    this.delayPolicy = builder.backOffDelayPolicy();
    this.connectionSetup = builder.setup();
    this.blockedConnectionHandling = builder.blockedConnectionHandling();
    this.metricsCollector = builder.metricsCollector();
    String threadPrefix = this.name + "-";
    if (builder.executorService() == null) {
      this.executorService = Executors.newCachedThreadPool(Utils.threadFactory(threadPrefix));
      this.internalExecutor = true;
    } else {
      this.executorService = builder.executorService();
      this.internalExecutor = false;
    }
    if (builder.scheduledExecutorService() == null) {
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(1, Utils.threadFactory(threadPrefix + "scheduler-"));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = builder.scheduledExecutorService();
      this.internalScheduledExecutor = false;
    }
    this.eventLoop = new EventLoop(this.executorService);
    this.mailbox = this.eventLoop.register(this.name, SupervisorState.DISCONNECTED);
    LOGGER.debug(
        "Created supervisor '{}' for {} (delay policy {})", this.name, this.label, this.delayPolicy);
    if (builder.connectOnStart()) {
      this.connect();
    }
  }

  @Override
  public void connect() {
    checkNotClosed();
    this.send(Connect.INSTANCE);
  }

  @Override
  public ChannelWorkerBuilder channelWorkerBuilder() {
    checkNotClosed();
    return new AmqpChannelWorkerBuilder(this);
  }

  @Override
  public CompletableFuture<Channel> provideChannel() {
    checkNotClosed();
    CompletableFuture<Channel> reply = new CompletableFuture<>();
    this.send(new ProvideChannel(reply));
    return reply;
  }

  @Override
  public void queueBlocked(String reason) {
    checkNotClosed();
    this.send(new QueueBlocked(null, reason));
  }

  @Override
  public void queueUnblocked() {
    checkNotClosed();
    this.send(new QueueUnblocked(null));
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing supervisor '{}'", this.name);
      Close close = new Close();
      CompletableFuture<Void> closeProcessed = this.send(close);
      if (this.mailbox.inLoop()) {
        // called from a setup callback or a listener, the close message is behind this task
        LOGGER.debug("Supervisor '{}' closed from its own mailbox", this.name);
        closeProcessed
            .thenCompose(v -> close.workersClosed)
            .whenComplete((v, e) -> this.releaseResources());
        return;
      }
      try {
        closeProcessed.get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        close.workersClosed.get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException | TimeoutException e) {
        LOGGER.warn(
            "Supervisor '{}' did not close properly in {} second(s): {}",
            this.name,
            CLOSE_TIMEOUT.toSeconds(),
            exceptionMessage(e));
      }
      this.releaseResources();
    }
  }

  private void releaseResources() {
    this.eventLoop.close();
    if (this.internalScheduledExecutor) {
      this.scheduledExecutorService.shutdownNow();
    }
    if (this.internalExecutor) {
      this.executorService.shutdownNow();
    }
    LOGGER.debug("Supervisor '{}' has been closed", this.name);
  }

  // internal API

  CompletableFuture<ChannelWorker> createChannel(AmqpChannelWorkerBuilder parameters) {
    checkNotClosed();
    CompletableFuture<ChannelWorker> reply = new CompletableFuture<>();
    this.send(new CreateChannel(parameters, reply));
    return reply;
  }

  void removeWorker(AmqpChannelWorker worker) {
    this.send(new RemoveWorker(worker));
  }

  CompletableFuture<Void> queueBlocked(Connection connection, String reason) {
    return this.send(new QueueBlocked(connection, reason));
  }

  CompletableFuture<Void> queueUnblocked(Connection connection) {
    return this.send(new QueueUnblocked(connection));
  }

  CompletableFuture<Void> send(Message message) {
    try {
      return this.mailbox.transition(state -> this.process(state, message));
    } catch (IllegalStateException e) {
      SupervisorException closedException = closedException();
      message.reject(closedException);
      return CompletableFuture.failedFuture(closedException);
    }
  }

  SupervisorState currentState() {
    return this.mailbox.state();
  }

  boolean reconnectionScheduled() {
    ScheduledFuture<?> task = this.reconnectTask;
    return task != null && !task.isDone();
  }

  private SupervisorState process(SupervisorState current, Message message) {
    this.transitionCause = null;
    SupervisorState next;
    if (current instanceof SupervisorState.Closed) {
      next = whenClosed(message);
    } else if (current instanceof SupervisorState.Connected) {
      next = whenConnected((SupervisorState.Connected) current, message);
    } else {
      next = whenDisconnected(message);
    }
    if (current.getClass() != next.getClass()) {
      this.onTransition(current, next);
    }
    return next;
  }

  private SupervisorState whenDisconnected(Message message) {
    if (message instanceof Connect) {
      return this.attemptConnection();
    } else if (message instanceof CreateChannel) {
      CreateChannel create = (CreateChannel) message;
      AmqpChannelWorker worker = this.newWorker(create);
      if (worker != null) {
        LOGGER.debug("Creating worker '{}' in disconnected state", worker.name());
        create.reply.complete(worker);
      }
      return SupervisorState.DISCONNECTED;
    } else if (message instanceof ProvideChannel) {
      LOGGER.debug("Cannot create channel for supervisor '{}' in disconnected state", this.name);
      ((ProvideChannel) message)
          .reply
          .completeExceptionally(
              new SupervisorException.ChannelUnavailableException(
                  "Supervisor '%s' is disconnected", this.name));
      return SupervisorState.DISCONNECTED;
    } else if (message instanceof RemoveWorker) {
      this.unregister(((RemoveWorker) message).worker);
      return SupervisorState.DISCONNECTED;
    } else if (message instanceof Close) {
      return this.terminate(null, (Close) message);
    } else {
      // shutdown signals of previous connections and flow control
      LOGGER.debug("Ignoring {} in disconnected state", message);
      return SupervisorState.DISCONNECTED;
    }
  }

  private SupervisorState whenConnected(SupervisorState.Connected state, Message message) {
    Connection connection = state.connection();
    if (message instanceof Connect) {
      LOGGER.debug("Supervisor '{}' already connected", this.name);
      return state;
    } else if (message instanceof ProvideChannel) {
      ProvideChannel provide = (ProvideChannel) message;
      try {
        provide.reply.complete(createChannel(connection));
        return state;
      } catch (Exception e) {
        this.reconnect(connection, e);
        provide.reply.completeExceptionally(
            new SupervisorException.ChannelUnavailableException(
                "Could not create channel: " + exceptionMessage(e), e));
        return SupervisorState.DISCONNECTED;
      }
    } else if (message instanceof CreateChannel) {
      CreateChannel create = (CreateChannel) message;
      if (this.nameInUse(create)) {
        return state;
      }
      Channel channel;
      try {
        channel = createChannel(connection);
      } catch (Exception e) {
        AmqpChannelWorker worker = this.newWorker(create);
        this.reconnect(connection, e);
        LOGGER.debug("Created worker '{}' without channel", worker.name());
        create.reply.complete(worker);
        return SupervisorState.DISCONNECTED;
      }
      AmqpChannelWorker worker = this.newWorker(create);
      LOGGER.debug("Creating worker '{}' with channel {}", worker.name(), channel);
      worker.channel(channel);
      if (state.blocked()) {
        worker.blocked(state.blockedReason());
      }
      create.reply.complete(worker);
      return state;
    } else if (message instanceof ShutdownSignal) {
      ShutdownSignal signal = (ShutdownSignal) message;
      if (signal.connection != connection) {
        LOGGER.debug("Ignoring shutdown signal of previous connection {}", signal.connection);
        return state;
      }
      this.transitionCause = signal.cause;
      if (state.blocked()) {
        // the next connection starts unblocked
        this.workers.values().forEach(AmqpChannelWorker::unblocked);
      }
      if (ExceptionUtils.initiatedByApplication(signal.cause)) {
        LOGGER.debug("Connection of supervisor '{}' closed by the application", this.name);
      } else {
        this.reconnect(connection, signal.cause);
      }
      return SupervisorState.DISCONNECTED;
    } else if (message instanceof QueueBlocked) {
      QueueBlocked blocked = (QueueBlocked) message;
      if (blocked.isStale(connection)) {
        return state;
      }
      String reason = blocked.reason == null ? "unknown" : blocked.reason;
      this.workers.values().forEach(w -> w.blocked(reason));
      LOGGER.debug("Connection of supervisor '{}' blocked by broker: {}", this.name, reason);
      this.metricsCollector.blocked();
      return state.blocked(reason);
    } else if (message instanceof QueueUnblocked) {
      if (((QueueUnblocked) message).isStale(connection)) {
        return state;
      }
      this.workers.values().forEach(AmqpChannelWorker::unblocked);
      LOGGER.debug("Connection of supervisor '{}' unblocked by broker", this.name);
      if (state.blocked()) {
        this.metricsCollector.unblocked();
      }
      return state.unblocked();
    } else if (message instanceof RemoveWorker) {
      this.unregister(((RemoveWorker) message).worker);
      return state;
    } else if (message instanceof Close) {
      return this.terminate(connection, (Close) message);
    } else {
      LOGGER.debug("Unexpected message {} in connected state", message);
      return state;
    }
  }

  private SupervisorState whenClosed(Message message) {
    message.reject(closedException());
    return SupervisorState.CLOSED;
  }

  private void onTransition(SupervisorState from, SupervisorState to) {
    if (from instanceof SupervisorState.Disconnected && to instanceof SupervisorState.Connected) {
      LOGGER.info("Supervisor '{}' connected to {}", this.name, this.label);
      this.metricsCollector.openConnection();
    } else if (from instanceof SupervisorState.Connected) {
      if (to instanceof SupervisorState.Disconnected) {
        LOGGER.warn("Supervisor '{}' lost connection to {}", this.name, this.label);
      }
      if (((SupervisorState.Connected) from).blocked()) {
        // flow control does not survive the connection
        this.metricsCollector.unblocked();
      }
      this.metricsCollector.closeConnection();
    }
    this.state(to.resourceState(), this.transitionCause);
  }

  private SupervisorState attemptConnection() {
    StopWatch stopWatch = new StopWatch();
    Connection connection = null;
    try {
      LOGGER.debug("Connecting '{}' to {}...", this.name, this.label);
      connection = this.connectionFactory.newConnection(this.name);
      LOGGER.debug("Setting up new connection {}", connection);
      Connection c = connection;
      connection.addShutdownListener(cause -> this.send(new ShutdownSignal(c, cause)));
      if (this.blockedConnectionHandling) {
        BlockedConnectionSupport.register(connection, this);
      }
      this.connectionSetup.setup(connection, this);
    } catch (Exception e) {
      closeIfOpen(connection);
      this.metricsCollector.connectionAttemptFailure();
      Duration delay = this.delayPolicy.delay(this.failedAttempts++);
      LOGGER.error(
          "Cannot connect '{}' to {}, retrying in {} ms: {}",
          this.name,
          this.label,
          delay.toMillis(),
          exceptionMessage(e));
      this.transitionCause = e;
      this.scheduleReconnect(delay);
      return SupervisorState.DISCONNECTED;
    }
    this.cancelReconnect();
    this.failedAttempts = 0;
    LOGGER.debug("Connection attempt for '{}' took {}", this.name, stopWatch.stop());
    for (AmqpChannelWorker worker : this.workers.values()) {
      this.provision(worker, connection);
    }
    return SupervisorState.connected(connection);
  }

  private void provision(AmqpChannelWorker worker, Connection connection) {
    try {
      worker.channel(createChannel(connection));
    } catch (Exception e) {
      LOGGER.debug(
          "Could not create channel for worker '{}': {}", worker.name(), exceptionMessage(e));
      worker.invalidated();
    }
  }

  private void reconnect(Connection broken, Throwable cause) {
    LOGGER.debug(
        "Closing broken connection {} of supervisor '{}' ({})",
        broken,
        this.name,
        exceptionMessage(cause));
    this.transitionCause = cause;
    closeIfOpen(broken);
    this.send(Connect.INSTANCE);
    this.workers.values().forEach(AmqpChannelWorker::invalidated);
  }

  private SupervisorState terminate(Connection connection, Close close) {
    this.cancelReconnect();
    List<CompletableFuture<Void>> closings = new ArrayList<>(this.workers.size());
    for (AmqpChannelWorker worker : this.workers.values()) {
      closings.add(worker.closeFromSupervisor());
    }
    this.workers.clear();
    if (connection != null) {
      LOGGER.info("Closing connection of supervisor '{}' to {}", this.name, this.label);
      closeIfOpen(connection);
    }
    this.mailbox.close();
    CompletableFuture.allOf(closings.toArray(new CompletableFuture<?>[0]))
        .whenComplete((v, e) -> close.workersClosed.complete(null));
    return SupervisorState.CLOSED;
  }

  private void scheduleReconnect(Duration delay) {
    this.cancelReconnect();
    this.reconnectTask =
        this.scheduledExecutorService.schedule(
            () -> {
              this.send(Connect.INSTANCE);
            },
            delay.toMillis(),
            TimeUnit.MILLISECONDS);
  }

  private void cancelReconnect() {
    ScheduledFuture<?> task = this.reconnectTask;
    if (task != null) {
      task.cancel(false);
      this.reconnectTask = null;
    }
  }

  private static Channel createChannel(Connection connection) throws Exception {
    Channel channel = connection.createChannel();
    if (channel == null) {
      throw new SupervisorException.SupervisorConnectionException(
          "No channel number available on connection " + connection, null);
    }
    return channel;
  }

  private boolean nameInUse(CreateChannel create) {
    String requested = create.parameters.name();
    if (requested != null && this.workers.containsKey(requested)) {
      create.reply.completeExceptionally(
          new SupervisorException.WorkerNameAlreadyInUseException(requested));
      return true;
    } else {
      return false;
    }
  }

  /** Returns null if the requested name is already in use. */
  private AmqpChannelWorker newWorker(CreateChannel create) {
    if (this.nameInUse(create)) {
      return null;
    }
    String workerName = create.parameters.name();
    while (workerName == null || this.workers.containsKey(workerName)) {
      workerName = this.name + "-worker-" + this.workerIdSequence.getAndIncrement();
    }
    AmqpChannelWorker worker =
        new AmqpChannelWorker(this, workerName, create.parameters, this.eventLoop);
    this.workers.put(workerName, worker);
    this.metricsCollector.openWorker();
    return worker;
  }

  private void unregister(AmqpChannelWorker worker) {
    if (this.workers.remove(worker.name(), worker)) {
      LOGGER.debug("Worker '{}' unregistered from supervisor '{}'", worker.name(), this.name);
    }
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  private SupervisorException closedException() {
    return new SupervisorException.SupervisorClosedException(
        "Supervisor '" + this.name + "' is closed");
  }

  @Override
  public String toString() {
    return this.name;
  }

  abstract static class Message {

    void reject(SupervisorException exception) {}
  }

  static final class Connect extends Message {

    static final Connect INSTANCE = new Connect();

    private Connect() {}

    @Override
    public String toString() {
      return "Connect";
    }
  }

  static final class CreateChannel extends Message {

    private final AmqpChannelWorkerBuilder parameters;
    private final CompletableFuture<ChannelWorker> reply;

    private CreateChannel(
        AmqpChannelWorkerBuilder parameters, CompletableFuture<ChannelWorker> reply) {
      this.parameters = parameters;
      this.reply = reply;
    }

    @Override
    void reject(SupervisorException exception) {
      this.reply.completeExceptionally(exception);
    }

    @Override
    public String toString() {
      return "CreateChannel{name=" + parameters.name() + '}';
    }
  }

  static final class ProvideChannel extends Message {

    private final CompletableFuture<Channel> reply;

    private ProvideChannel(CompletableFuture<Channel> reply) {
      this.reply = reply;
    }

    @Override
    void reject(SupervisorException exception) {
      this.reply.completeExceptionally(exception);
    }

    @Override
    public String toString() {
      return "ProvideChannel";
    }
  }

  static final class ShutdownSignal extends Message {

    private final Connection connection;
    private final ShutdownSignalException cause;

    ShutdownSignal(Connection connection, ShutdownSignalException cause) {
      this.connection = connection;
      this.cause = cause;
    }

    @Override
    public String toString() {
      return "ShutdownSignal{" + exceptionMessage(cause) + '}';
    }
  }

  /** Flow control messages, the connection is null when they come from the application. */
  static final class QueueBlocked extends Message {

    private final Connection connection;
    private final String reason;

    private QueueBlocked(Connection connection, String reason) {
      this.connection = connection;
      this.reason = reason;
    }

    private boolean isStale(Connection current) {
      return this.connection != null && this.connection != current;
    }

    @Override
    public String toString() {
      return "QueueBlocked{reason=" + reason + '}';
    }
  }

  static final class QueueUnblocked extends Message {

    private final Connection connection;

    private QueueUnblocked(Connection connection) {
      this.connection = connection;
    }

    private boolean isStale(Connection current) {
      return this.connection != null && this.connection != current;
    }

    @Override
    public String toString() {
      return "QueueUnblocked";
    }
  }

  static final class RemoveWorker extends Message {

    private final AmqpChannelWorker worker;

    private RemoveWorker(AmqpChannelWorker worker) {
      this.worker = worker;
    }

    @Override
    public String toString() {
      return "RemoveWorker{" + worker.name() + '}';
    }
  }

  static final class Close extends Message {

    private final CompletableFuture<Void> workersClosed = new CompletableFuture<>();

    private Close() {}

    @Override
    void reject(SupervisorException exception) {
      this.workersClosed.complete(null);
    }

    @Override
    public String toString() {
      return "Close";
    }
  }
}
