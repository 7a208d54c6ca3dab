/*
 * Copyright 2024 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.grpc.intercept;

import java.time.Duration;
import javax.annotation.Nullable;

/**
 * Provides RPC-related information and action, shared by the client-side call handle and the
 * server-side {@link ServicerContext}.
 */
public interface RpcContext {

  /**
   * Returns {@code true} if the RPC is still in progress.
   */
  boolean isActive();

  /**
   * Returns the time remaining before the RPC times out, or {@code null} if it has no timeout.
   */
  @Nullable
  Duration getTimeRemaining();

  /**
   * Cancels the RPC. Idempotent and has no effect if the RPC has already terminated.
   *
   * @return {@code true} if this call moved the RPC into the cancelled state
   */
  boolean cancel();

  /**
   * Registers a callback to be run when the RPC terminates.
   *
   * @return {@code true} if the callback was registered, {@code false} if the RPC had already
   *     terminated and the callback will not run
   */
  boolean addCallback(Runnable callback);
}
