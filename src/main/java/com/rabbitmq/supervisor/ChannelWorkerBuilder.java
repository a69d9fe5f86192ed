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

/** Builder for {@link ChannelWorker} instances. */
public interface ChannelWorkerBuilder {

  /**
   * The name of the worker.
   *
   * <p>It must be unique for the supervisor. A name is generated if none is set.
   *
   * @param name the name
   * @return this builder instance
   */
  ChannelWorkerBuilder name(String name);

  /**
   * Callback to run each time the worker gets a new channel.
   *
   * @param setup the callback
   * @return this builder instance
   */
  ChannelWorkerBuilder setup(ChannelSetup setup);

  /**
   * What to do with tasks submitted when the worker has no channel.
   *
   * <p>Default is {@link PendingWorkPolicy#QUEUE}.
   *
   * @param policy the policy
   * @return this builder instance
   */
  ChannelWorkerBuilder noChannelPolicy(PendingWorkPolicy policy);

  /**
   * What to do with tasks submitted when the broker blocked the connection.
   *
   * <p>Default is {@link PendingWorkPolicy#QUEUE}.
   *
   * @param policy the policy
   * @return this builder instance
   */
  ChannelWorkerBuilder blockedPolicy(PendingWorkPolicy policy);

  /**
   * Add {@link Resource.StateListener}s to the worker.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ChannelWorkerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Ask the supervisor to create the worker.
   *
   * <p>The future completes once the supervisor has registered the worker, whether or not a
   * channel could be given to it. It completes exceptionally with a {@link
   * SupervisorException.WorkerNameAlreadyInUseException} if the name is taken.
   *
   * @return future of the worker
   */
  CompletableFuture<ChannelWorker> create();

  /**
   * Create the worker and wait for the supervisor to register it.
   *
   * @return the worker
   * @see #create()
   */
  ChannelWorker build();
}
