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

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Interface for intercepting incoming calls while their handler is resolved, before the handler
 * runs.
 *
 * <p>Implementers use this mechanism to add cross-cutting behavior to server-side calls. Common
 * example of such behavior include:
 * <ul>
 * <li>Enforcing authentication and authorization</li>
 * <li>Logging and monitoring server side calls</li>
 * <li>Delegating calls to other servers</li>
 * </ul>
 */
@ThreadSafe
public interface ServerInterceptor {

  /**
   * Intercepts the handler lookup of an incoming call.
   *
   * <p>The interceptor may return what {@code continuation} resolves, possibly after passing it
   * different details; return a different handler, such as one that rejects the call; or throw.
   *
   * @param continuation the rest of the chain, ending in the real handler lookup
   * @param handlerCallDetails the method and metadata of the incoming call
   * @return the handler to run, or {@code null} if the method is not found
   */
  @Nullable
  RpcMethodHandler<?, ?> interceptService(
      ServiceContinuation continuation, HandlerCallDetails handlerCallDetails);
}
