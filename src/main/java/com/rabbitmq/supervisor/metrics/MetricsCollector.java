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

/** Interface to collect execution data of the supervisor and its workers. */
public interface MetricsCollector {

  /** Called when the supervisor opens a connection. */
  void openConnection();

  /** Called when the supervisor loses or closes its connection. */
  void closeConnection();

  /** Called when a connection attempt fails. */
  void connectionAttemptFailure();

  /** Called when a {@link com.rabbitmq.supervisor.ChannelWorker} gets a channel. */
  void openChannel();

  /** Called when a {@link com.rabbitmq.supervisor.ChannelWorker} drops or closes its channel. */
  void closeChannel();

  /** Called when a new {@link com.rabbitmq.supervisor.ChannelWorker} is registered. */
  void openWorker();

  /** Called when a {@link com.rabbitmq.supervisor.ChannelWorker} is closed. */
  void closeWorker();

  /** Called when the broker blocks the connection. */
  void blocked();

  /** Called when the broker unblocks the connection. */
  void unblocked();

  /**
   * Called when a {@link com.rabbitmq.supervisor.ChannelTask} has been handled.
   *
   * @param outcome outcome of the task
   */
  void task(TaskOutcome outcome);

  /** Outcome of a task submitted to a worker. */
  enum TaskOutcome {
    /** The task ran successfully. */
    EXECUTED,
    /** The task ran and threw an exception. */
    FAILED,
    /** The task could not run and was not queued. */
    REJECTED
  }
}
