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

import io.grpc.intercept.RpcMethodHandler.StreamStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.StreamUnaryBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryUnaryBehavior;
import java.util.Iterator;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Interface for intercepting the invocation of a resolved {@link RpcMethodHandler} on the server.
 *
 * <p>Where a {@link ServerInterceptor} decides which handler serves a call, a
 * {@code ServerCallInterceptor} runs around the handler's behavior each time it serves one. It
 * sees the request (or request iterator) and the {@link ServicerContext}, and produces the
 * response (or response iterator) the client receives. It may call {@code next} once, not at all
 * (answering the call itself), or replace the request and response messages.
 *
 * <p>Every method defaults to calling {@code next} unchanged, so implementations override only
 * the shapes they care about. Interceptors are applied to a handler with
 * {@code RpcMethodHandlers.intercept}.
 */
@ThreadSafe
public interface ServerCallInterceptor {

  /**
   * Intercepts one unary-unary call.
   *
   * @param next the wrapped behavior
   * @param request the request message
   * @param context the context of the call being served
   * @return the response sent to the client
   */
  default <ReqT, RespT> RespT interceptUnaryUnary(
      UnaryUnaryBehavior<ReqT, RespT> next, ReqT request, ServicerContext context) {
    return next.invoke(request, context);
  }

  /**
   * Intercepts one unary-stream call. Responses are pulled from the returned iterator after this
   * method returns.
   */
  default <ReqT, RespT> Iterator<RespT> interceptUnaryStream(
      UnaryStreamBehavior<ReqT, RespT> next, ReqT request, ServicerContext context) {
    return next.invoke(request, context);
  }

  /**
   * Intercepts one stream-unary call.
   */
  default <ReqT, RespT> RespT interceptStreamUnary(
      StreamUnaryBehavior<ReqT, RespT> next, Iterator<ReqT> requests, ServicerContext context) {
    return next.invoke(requests, context);
  }

  /**
   * Intercepts one stream-stream call. Responses are pulled from the returned iterator after this
   * method returns.
   */
  default <ReqT, RespT> Iterator<RespT> interceptStreamStream(
      StreamStreamBehavior<ReqT, RespT> next, Iterator<ReqT> requests, ServicerContext context) {
    return next.invoke(requests, context);
  }
}
