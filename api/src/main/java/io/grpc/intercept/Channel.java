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

import javax.annotation.concurrent.ThreadSafe;

/**
 * A Channel provides an abstraction over the transport layer that is designed to be consumed by
 * stub implementations. It binds a method name and its marshallers to a callable of the method's
 * call shape, and reports connectivity state changes.
 *
 * <p>Applications can add common cross-cutting behaviors to stubs by decorating Channel
 * implementations with {@link ClientInterceptor}s. It is expected that most application code
 * will not use this class directly but rather work with stubs that have been bound to a Channel
 * that was decorated during application initialization.
 */
@ThreadSafe
public interface Channel {

  /**
   * Creates a callable for a unary-unary method.
   *
   * @param method the fully qualified name of the method
   * @param requestMarshaller the marshaller for request messages
   * @param responseMarshaller the marshaller for response messages
   */
  <ReqT, RespT> UnaryUnaryMultiCallable<ReqT, RespT> unaryUnary(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller);

  /**
   * Creates a callable for a unary-stream method.
   */
  <ReqT, RespT> UnaryStreamMultiCallable<ReqT, RespT> unaryStream(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller);

  /**
   * Creates a callable for a stream-unary method.
   */
  <ReqT, RespT> StreamUnaryMultiCallable<ReqT, RespT> streamUnary(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller);

  /**
   * Creates a callable for a stream-stream method.
   */
  <ReqT, RespT> StreamStreamMultiCallable<ReqT, RespT> streamStream(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller);

  /**
   * Registers {@code listener} to be notified of every connectivity state change.
   *
   * @param tryToConnect whether the channel should attempt to connect immediately
   */
  void subscribe(ConnectivityListener listener, boolean tryToConnect);

  /**
   * Stops notifying {@code listener}. Has no effect if it was never subscribed.
   */
  void unsubscribe(ConnectivityListener listener);

  /**
   * Receives connectivity state changes of a {@link Channel}.
   */
  interface ConnectivityListener {
    void onStateChanged(ConnectivityState newState);
  }
}
