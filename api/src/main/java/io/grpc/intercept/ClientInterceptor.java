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

import java.util.Iterator;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Interface for intercepting outgoing calls before they are dispatched by a {@link Channel}.
 *
 * <p>Implementers use this mechanism to add cross-cutting behavior to {@link Channel} and
 * stub implementations. Common examples of such behavior include:
 * <ul>
 * <li>Logging and monitoring call behavior</li>
 * <li>Adding metadata for proxies to observe</li>
 * <li>Request and response rewriting</li>
 * <li>Serving a call without reaching the server, e.g. from a cache</li>
 * </ul>
 *
 * <p>An interceptor declares the call shapes it handles through {@link #interceptedMethodTypes}
 * and overrides the matching {@code intercept} methods. Calls of any other shape go straight to
 * the next channel without involving the interceptor. An interceptor that declares no shape at
 * all is rejected by {@code ClientInterceptors.intercept}.
 *
 * <p>Each {@code intercept} method receives a continuation that stands for the rest of the chain
 * including the real call. It may invoke the continuation once (the common case), zero times
 * (short-circuit; any request iterator it was given is then its own to drain or discard) or more
 * than once (fan-out, in which case it alone reconciles the results). The real call reads its
 * method, timeout, metadata and credentials from the {@link CallDetails} passed to the innermost
 * continuation, so handing a derived value to the continuation is how an interceptor edits the
 * call.
 *
 * <p>Exceptions thrown from an {@code intercept} method reach the application unchanged.
 */
@ThreadSafe
public interface ClientInterceptor {

  /**
   * The call shapes this interceptor handles. Must not be empty, and must not change over the
   * lifetime of the interceptor.
   */
  Set<MethodType> interceptedMethodTypes();

  /**
   * Intercepts a unary-unary call. The default passes the call through unchanged.
   *
   * @param continuation the rest of the chain
   * @param callDetails the details of the call as seen by this interceptor
   * @param request the request message
   * @return the call handle; its result is what the application receives
   */
  default <ReqT, RespT> RpcFuture<RespT> interceptUnaryUnary(
      UnaryUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    return continuation.proceed(callDetails, request);
  }

  /**
   * Intercepts a unary-stream call. The default passes the call through unchanged.
   */
  default <ReqT, RespT> ResponseStream<RespT> interceptUnaryStream(
      UnaryStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    return continuation.proceed(callDetails, request);
  }

  /**
   * Intercepts a stream-unary call. The default passes the call and the request iterator through
   * unchanged.
   */
  default <ReqT, RespT> RpcFuture<RespT> interceptStreamUnary(
      StreamUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    return continuation.proceed(callDetails, requests);
  }

  /**
   * Intercepts a stream-stream call. The default passes the call and the request iterator through
   * unchanged.
   */
  default <ReqT, RespT> ResponseStream<RespT> interceptStreamStream(
      StreamStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    return continuation.proceed(callDetails, requests);
  }

  /**
   * The rest of the chain of a unary-unary call.
   */
  interface UnaryUnaryContinuation<ReqT, RespT> {
    /**
     * Issues the call with the given details and request.
     *
     * @throws InvalidCallException if {@code callDetails} is not a unary-unary call
     */
    RpcFuture<RespT> proceed(CallDetails<ReqT, RespT> callDetails, ReqT request);
  }

  /**
   * The rest of the chain of a unary-stream call.
   */
  interface UnaryStreamContinuation<ReqT, RespT> {
    /**
     * Issues the call with the given details and request.
     *
     * @throws InvalidCallException if {@code callDetails} is not a unary-stream call
     */
    ResponseStream<RespT> proceed(CallDetails<ReqT, RespT> callDetails, ReqT request);
  }

  /**
   * The rest of the chain of a stream-unary call.
   */
  interface StreamUnaryContinuation<ReqT, RespT> {
    /**
     * Issues the call with the given details, sending every message {@code requests} yields.
     *
     * @throws InvalidCallException if {@code callDetails} is not a stream-unary call
     */
    RpcFuture<RespT> proceed(CallDetails<ReqT, RespT> callDetails, Iterator<ReqT> requests);
  }

  /**
   * The rest of the chain of a stream-stream call.
   */
  interface StreamStreamContinuation<ReqT, RespT> {
    /**
     * Issues the call with the given details, sending every message {@code requests} yields.
     *
     * @throws InvalidCallException if {@code callDetails} is not a stream-stream call
     */
    ResponseStream<RespT> proceed(CallDetails<ReqT, RespT> callDetails, Iterator<ReqT> requests);
  }
}
