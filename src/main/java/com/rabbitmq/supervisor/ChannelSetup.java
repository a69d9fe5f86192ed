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

/**
 * Callback run each time a {@link ChannelWorker} receives a new channel.
 *
 * <p>It is the place to declare queues, bindings, or to start consumers, as the channel and its
 * server-side state are lost when the connection goes away.
 *
 * @see ChannelWorkerBuilder#setup(ChannelSetup)
 */
@FunctionalInterface
public interface ChannelSetup {

  /** Callback that does nothing. */
  ChannelSetup NO_OP = (channel, worker) -> {};

  /**
   * Set up the new channel.
   *
   * @param channel the channel
   * @param worker the worker the channel has been given to
   * @throws Exception if the setup fails
   */
  void setup(Channel channel, ChannelWorker worker) throws Exception;
}
