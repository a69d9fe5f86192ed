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

import com.rabbitmq.supervisor.SupervisorException;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tasks of registered clients on an executor.
 *
 * <p>Each client has its own mailbox: its tasks run one at a time, in submission order, and are
 * the only ones to access the client state. Tasks of different clients run concurrently.
 */
final class EventLoop implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);

  private static final int MAX_TASKS_PER_RUN = 64;

  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Executor executor;

  EventLoop(Executor executor) {
    this.executor = executor;
  }

  <S> Client<S> register(String name, S initialState) {
    if (this.closed.get()) {
      throw new IllegalStateException("Event loop is closed");
    }
    return new Client<>(this, name, initialState);
  }

  @Override
  public void close() {
    this.closed.set(true);
  }

  private boolean closed() {
    return this.closed.get();
  }

  private static final AtomicLong CLIENT_ID_SEQUENCE = new AtomicLong();

  static class Client<S> implements AutoCloseable {

    private final long id;
    private final String name;
    private final EventLoop loop;
    private final Queue<ClientTask<S>> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile S state;
    private volatile Thread runner;

    private Client(EventLoop loop, String name, S initialState) {
      this.id = CLIENT_ID_SEQUENCE.getAndIncrement();
      this.loop = loop;
      this.name = name;
      this.state = initialState;
    }

    /**
     * Enqueue a task that can change the client state.
     *
     * @param task the task, returns the new state
     * @return future completed after the task has run
     */
    CompletableFuture<Void> transition(UnaryOperator<S> task) {
      if (this.closed.get() || this.loop.closed()) {
        throw new IllegalStateException("Event loop client " + this.name + " is closed");
      }
      ClientTask<S> clientTask = new ClientTask<>(task);
      this.mailbox.offer(clientTask);
      this.schedule();
      return clientTask.completion;
    }

    /**
     * Enqueue a task that does not change the client state reference.
     *
     * @param task the task
     * @return future completed after the task has run
     */
    CompletableFuture<Void> submit(Consumer<S> task) {
      return this.transition(
          s -> {
            task.accept(s);
            return s;
          });
    }

    S state() {
      return this.state;
    }

    String name() {
      return this.name;
    }

    /** Whether the caller runs inside a task of this client. */
    boolean inLoop() {
      return Thread.currentThread().equals(this.runner);
    }

    /** No task is accepted after this call, tasks already enqueued still run. */
    @Override
    public void close() {
      this.closed.set(true);
    }

    private void schedule() {
      if (this.scheduled.compareAndSet(false, true)) {
        try {
          this.loop.executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
          this.scheduled.set(false);
          LOGGER.debug("Executor rejected mailbox processing of {}", this.name);
          this.failPending(e);
        }
      }
    }

    private void drain() {
      this.runner = Thread.currentThread();
      try {
        int processed = 0;
        ClientTask<S> task;
        while (processed < MAX_TASKS_PER_RUN && (task = this.mailbox.poll()) != null) {
          processed++;
          try {
            S newState = task.task.apply(this.state);
            this.state = newState;
            task.completion.complete(null);
          } catch (Exception e) {
            LOGGER.warn("Error during processing of task for {}", this.name, e);
            task.completion.completeExceptionally(e);
          }
        }
      } finally {
        this.runner = null;
        this.scheduled.set(false);
      }
      if (!this.mailbox.isEmpty()) {
        this.schedule();
      }
    }

    private void failPending(Exception cause) {
      ClientTask<S> task;
      while ((task = this.mailbox.poll()) != null) {
        task.completion.completeExceptionally(
            new SupervisorException.SupervisorClosedException(
                "Task of " + this.name + " could not run: " + cause.getMessage()));
      }
    }

    @Override
    public String toString() {
      return this.name + " (" + this.id + ")";
    }
  }

  private static class ClientTask<S> {

    private final UnaryOperator<S> task;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private ClientTask(UnaryOperator<S> task) {
      this.task = task;
    }
  }
}
