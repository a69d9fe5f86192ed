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
package com.rabbitmq.supervisor;

import java.util.concurrent.CompletableFuture;

/**
 * Unit of work bound to at most one channel at a time.
 *
 * <p>A worker gets its channels from its {@link ConnectionSupervisor}. It drops its channel when
 * the connection goes away and gets a new one once the supervisor has reconnected. Tasks submitted
 * in the meantime are either queued or failed, depending on the configured {@link
 * PendingWorkPolicy}.
 *
 * @see ConnectionSupervisor#channelWorkerBuilder()
 */
public interface ChannelWorker extends AutoCloseable, Resource {

  /**
   * Submit a task to run against the channel.
   *
   * <p>Tasks run in submission order.
   *
   * @param task the task
   * @return future completed when the task has run, exceptionally if it failed or could not run
   */
  CompletableFuture<Void> submit(ChannelTask task);

  /**
   * The name of the worker, unique for a given supervisor.
   *
   * @return the name
   */
  String name();

  /**
   * The current state of the worker.
   *
   * <p>{@link State#CONNECTED} means the worker holds a channel.
   *
   * @return current state
   */
  State state();

  /**
   * Whether the broker has blocked the connection.
   *
   * @return true if the connection is blocked
   */
  boolean isBlocked();

  /** Close the worker and its channel, and unregister it from its supervisor. */
  @Override
  void close();
}
