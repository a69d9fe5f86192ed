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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

  private Utils() {}

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory;

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this.backingThreadFactory = Executors.defaultThreadFactory();
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  static ThreadFactory threadFactory(String prefix) {
    return new NamedThreadFactory(prefix);
  }

  static String connectionLabel(ConnectionFactory factory) {
    if (factory == null) {
      return "<no connection factory>";
    }
    String virtualHost = factory.getVirtualHost();
    if ("/".equals(virtualHost)) {
      virtualHost = "%2f";
    }
    return factory.getHost() + ":" + factory.getPort() + "/" + virtualHost;
  }

  /** Closes the connection if it is open. Errors are logged and swallowed. */
  static void closeIfOpen(Connection connection) {
    if (connection != null) {
      try {
        if (connection.isOpen()) {
          connection.close();
        }
      } catch (Exception e) {
        LOGGER.debug(
            "Error while closing connection {}: {}",
            connection,
            ExceptionUtils.exceptionMessage(e));
      }
    }
  }

  /** Closes the channel if it is open. Errors are logged and swallowed. */
  static void closeIfOpen(Channel channel) {
    if (channel != null) {
      try {
        if (channel.isOpen()) {
          channel.close();
        }
      } catch (Exception e) {
        LOGGER.debug(
            "Error while closing channel {}: {}", channel, ExceptionUtils.exceptionMessage(e));
      }
    }
  }

  static class StopWatch {

    private final long start = System.nanoTime();

    Duration stop() {
      return Duration.ofNanos(System.nanoTime() - start);
    }
  }
}
