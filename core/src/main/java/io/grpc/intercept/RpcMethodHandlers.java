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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Lists;
import io.grpc.intercept.RpcMethodHandler.StreamStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.StreamUnaryBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryUnaryBehavior;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Utility methods for wrapping {@link RpcMethodHandler}s with {@link ServerCallInterceptor}s.
 */
public final class RpcMethodHandlers {

  // Prevent instantiation
  private RpcMethodHandlers() {}

  /**
   * Create a new handler of the same shape and marshallers as {@code handler} whose behavior runs
   * through {@code interceptors}. The first interceptor sees each call first.
   *
   * @param handler the handler to wrap.
   * @param interceptors array of interceptors to apply.
   * @return a wrapped version of {@code handler}, or {@code handler} itself if there are no
   *     interceptors.
   */
  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> intercept(
      RpcMethodHandler<ReqT, RespT> handler, ServerCallInterceptor... interceptors) {
    return intercept(handler, Arrays.asList(interceptors));
  }

  /**
   * Create a new handler of the same shape and marshallers as {@code handler} whose behavior runs
   * through {@code interceptors}. The first interceptor sees each call first.
   *
   * @param handler the handler to wrap.
   * @param interceptors list of interceptors to apply.
   * @return a wrapped version of {@code handler}, or {@code handler} itself if there are no
   *     interceptors.
   */
  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> intercept(
      RpcMethodHandler<ReqT, RespT> handler, List<? extends ServerCallInterceptor> interceptors) {
    checkNotNull(handler, "handler");
    checkNotNull(interceptors, "interceptors");
    for (ServerCallInterceptor interceptor : interceptors) {
      checkNotNull(interceptor, "interceptor");
    }
    for (ServerCallInterceptor interceptor : Lists.reverse(interceptors)) {
      handler = wrap(handler, interceptor);
    }
    return handler;
  }

  /**
   * Returns a {@link ServerInterceptor} that wraps every handler resolved further down the lookup
   * chain with {@code interceptor}. Lookups that resolve no handler are left as they are.
   */
  public static ServerInterceptor forEveryHandler(final ServerCallInterceptor interceptor) {
    checkNotNull(interceptor, "interceptor");
    return new ServerInterceptor() {
      @Nullable
      @Override
      public RpcMethodHandler<?, ?> interceptService(
          ServiceContinuation continuation, HandlerCallDetails handlerCallDetails) {
        RpcMethodHandler<?, ?> handler = continuation.proceed(handlerCallDetails);
        return handler == null ? null : wrap(handler, interceptor);
      }

      @Override
      public String toString() {
        return "ForEveryHandler{" + interceptor + "}";
      }
    };
  }

  private static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> wrap(
      RpcMethodHandler<ReqT, RespT> handler, final ServerCallInterceptor interceptor) {
    Marshaller<ReqT> requestMarshaller = handler.getRequestMarshaller();
    Marshaller<RespT> responseMarshaller = handler.getResponseMarshaller();
    switch (handler.getMethodType()) {
      case UNARY_UNARY: {
        final UnaryUnaryBehavior<ReqT, RespT> next = handler.getUnaryUnary();
        return RpcMethodHandler.unaryUnary(
            (request, context) -> interceptor.interceptUnaryUnary(next, request, context),
            requestMarshaller, responseMarshaller);
      }
      case UNARY_STREAM: {
        final UnaryStreamBehavior<ReqT, RespT> next = handler.getUnaryStream();
        return RpcMethodHandler.unaryStream(
            (request, context) -> interceptor.interceptUnaryStream(next, request, context),
            requestMarshaller, responseMarshaller);
      }
      case STREAM_UNARY: {
        final StreamUnaryBehavior<ReqT, RespT> next = handler.getStreamUnary();
        return RpcMethodHandler.streamUnary(
            (requests, context) -> interceptor.interceptStreamUnary(next, requests, context),
            requestMarshaller, responseMarshaller);
      }
      case STREAM_STREAM: {
        final StreamStreamBehavior<ReqT, RespT> next = handler.getStreamStream();
        return RpcMethodHandler.streamStream(
            (requests, context) -> interceptor.interceptStreamStream(next, requests, context),
            requestMarshaller, responseMarshaller);
      }
      default:
        throw new AssertionError("Unknown method type: " + handler.getMethodType());
    }
  }
}
