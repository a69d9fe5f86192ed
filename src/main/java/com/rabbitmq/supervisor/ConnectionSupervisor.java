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

import com.rabbitmq.client.Channel;
import java.util.concurrent.CompletableFuture;

/**
 * Supervisor of a single logical connection to a RabbitMQ broker.
 *
 * <p>The supervisor connects on creation and reconnects after a network failure or a
 * broker-initiated shutdown, waiting a fixed delay between attempts and retrying indefinitely. It
 * owns the {@link ChannelWorker}s created with {@link #channelWorkerBuilder()} and gives each of
 * them a fresh channel every time the connection is re-established.
 *
 * <p>All operations are asynchronous: they enqueue a message the supervisor processes in order,
 * one at a time.
 *
 * <p>Instances are created with a {@link ConnectionSupervisorBuilder}.
 */
public interface ConnectionSupervisor extends AutoCloseable, Resource {

  /**
   * Ask the supervisor to connect.
   *
   * <p>This is a no-op if the supervisor is already connected. A failed attempt schedules a new
   * one.
   */
  void connect();

  /**
   * Create a builder to configure and create a {@link ChannelWorker}.
   *
   * @return the channel worker builder
   */
  ChannelWorkerBuilder channelWorkerBuilder();

  /**
   * Ask for a new channel on the current connection.
   *
   * <p>The returned future completes exceptionally with a {@link
   * SupervisorException.ChannelUnavailableException} if the supervisor is disconnected or if the
   * channel creation fails. A failed channel creation also triggers the recovery of the
   * connection.
   *
   * @return future of the channel
   */
  CompletableFuture<Channel> provideChannel();

  /**
   * Notify the supervisor that the broker blocked the connection.
   *
   * <p>All the workers get the notification, as well as the workers created while the connection
   * stays blocked. Ignored if the supervisor is not connected.
   *
   * @param reason the reason sent by the broker
   */
  void queueBlocked(String reason);

  /**
   * Notify the supervisor that the broker unblocked the connection.
   *
   * <p>Ignored if the supervisor is not connected.
   */
  void queueUnblocked();

  /**
   * The current state of the supervisor.
   *
   * @return current state
   */
  State state();

  /**
   * The name of the supervisor.
   *
   * @return the name
   */
  String name();

  /** Close the connection, the workers, and stop reconnecting. */
  @Override
  void close();
}
