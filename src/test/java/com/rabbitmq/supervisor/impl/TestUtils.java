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

import static org.assertj.core.api.Assertions.fail;

import com.rabbitmq.supervisor.Resource;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

final class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration POLLING_INTERVAL = Duration.ofMillis(20);

  private TestUtils() {}

  @FunctionalInterface
  interface Condition {
    boolean check() throws Exception;
  }

  static Duration waitAtMost(Condition condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, null);
  }

  static Duration waitAtMost(Condition condition, Supplier<String> message) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, message);
  }

  static Duration waitAtMost(Duration timeout, Condition condition) {
    return waitAtMost(timeout, condition, null);
  }

  /**
   * Polls the condition until it is true or the timeout expires.
   *
   * <p>An exception thrown by the condition counts as false, the last one is attached to the
   * failure.
   *
   * @return how long the condition took to become true
   */
  static Duration waitAtMost(Duration timeout, Condition condition, Supplier<String> message) {
    long start = System.nanoTime();
    long deadline = start + timeout.toNanos();
    Exception lastError = null;
    while (true) {
      try {
        if (condition.check()) {
          return Duration.ofNanos(System.nanoTime() - start);
        }
        lastError = null;
      } catch (Exception e) {
        lastError = e;
      }
      if (System.nanoTime() > deadline) {
        break;
      }
      pause(POLLING_INTERVAL);
    }
    String description = message == null ? "condition still false" : message.get();
    String failure = String.format("After %d ms: %s", timeout.toMillis(), description);
    if (lastError == null) {
      fail(failure);
    } else {
      fail(failure, lastError);
    }
    return timeout;
  }

  /** For negative checks, gives asynchronous processing a chance to happen. */
  static void pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while pausing", e);
    }
  }

  static Resource.StateListener stateListener(Resource.State state, Sync sync) {
    return context -> {
      if (context.currentState() == state) {
        sync.down();
      }
    };
  }

  static Sync sync() {
    return sync(1);
  }

  static Sync sync(int count) {
    return new Sync(count);
  }

  /** Count-down latch with a readable description in assertion messages. */
  static final class Sync {

    private final int count;
    private final CountDownLatch latch;

    private Sync(int count) {
      this.count = count;
      this.latch = new CountDownLatch(count);
    }

    void down() {
      this.latch.countDown();
    }

    boolean await(Duration timeout) {
      try {
        return this.latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for " + this, e);
      }
    }

    boolean hasCompleted() {
      return this.latch.getCount() == 0;
    }

    @Override
    public String toString() {
      return "sync " + (this.count - this.latch.getCount()) + "/" + this.count;
    }
  }
}
