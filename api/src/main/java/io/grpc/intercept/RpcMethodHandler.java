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

import com.google.common.base.MoreObjects;
import java.util.Iterator;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The implementation of one method of a service: its call shape, its marshallers and the behavior
 * the transport runs for each call.
 *
 * <p>Exactly one of the four behaviors is set, the one matching {@link #getMethodType}. A
 * {@code null} marshaller means messages are passed to and from the behavior unconverted.
 *
 * @param <ReqT> type of the request message
 * @param <RespT> type of the response message
 */
@Immutable
public final class RpcMethodHandler<ReqT, RespT> {

  private final MethodType methodType;
  @Nullable
  private final Marshaller<ReqT> requestMarshaller;
  @Nullable
  private final Marshaller<RespT> responseMarshaller;
  @Nullable
  private final UnaryUnaryBehavior<ReqT, RespT> unaryUnary;
  @Nullable
  private final UnaryStreamBehavior<ReqT, RespT> unaryStream;
  @Nullable
  private final StreamUnaryBehavior<ReqT, RespT> streamUnary;
  @Nullable
  private final StreamStreamBehavior<ReqT, RespT> streamStream;

  private RpcMethodHandler(
      MethodType methodType,
      @Nullable Marshaller<ReqT> requestMarshaller,
      @Nullable Marshaller<RespT> responseMarshaller,
      @Nullable UnaryUnaryBehavior<ReqT, RespT> unaryUnary,
      @Nullable UnaryStreamBehavior<ReqT, RespT> unaryStream,
      @Nullable StreamUnaryBehavior<ReqT, RespT> streamUnary,
      @Nullable StreamStreamBehavior<ReqT, RespT> streamStream) {
    this.methodType = methodType;
    this.requestMarshaller = requestMarshaller;
    this.responseMarshaller = responseMarshaller;
    this.unaryUnary = unaryUnary;
    this.unaryStream = unaryStream;
    this.streamUnary = streamUnary;
    this.streamStream = streamStream;
  }

  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> unaryUnary(
      UnaryUnaryBehavior<ReqT, RespT> behavior,
      @Nullable Marshaller<ReqT> requestMarshaller,
      @Nullable Marshaller<RespT> responseMarshaller) {
    return new RpcMethodHandler<>(MethodType.UNARY_UNARY, requestMarshaller, responseMarshaller,
        checkNotNull(behavior, "behavior"), null, null, null);
  }

  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> unaryStream(
      UnaryStreamBehavior<ReqT, RespT> behavior,
      @Nullable Marshaller<ReqT> requestMarshaller,
      @Nullable Marshaller<RespT> responseMarshaller) {
    return new RpcMethodHandler<>(MethodType.UNARY_STREAM, requestMarshaller, responseMarshaller,
        null, checkNotNull(behavior, "behavior"), null, null);
  }

  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> streamUnary(
      StreamUnaryBehavior<ReqT, RespT> behavior,
      @Nullable Marshaller<ReqT> requestMarshaller,
      @Nullable Marshaller<RespT> responseMarshaller) {
    return new RpcMethodHandler<>(MethodType.STREAM_UNARY, requestMarshaller, responseMarshaller,
        null, null, checkNotNull(behavior, "behavior"), null);
  }

  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> streamStream(
      StreamStreamBehavior<ReqT, RespT> behavior,
      @Nullable Marshaller<ReqT> requestMarshaller,
      @Nullable Marshaller<RespT> responseMarshaller) {
    return new RpcMethodHandler<>(MethodType.STREAM_STREAM, requestMarshaller, responseMarshaller,
        null, null, null, checkNotNull(behavior, "behavior"));
  }

  /**
   * Returns a handler of the given shape whose behavior fails every call with {@code error}
   * without reading any request. Used by interceptors that reject calls.
   */
  public static <ReqT, RespT> RpcMethodHandler<ReqT, RespT> failing(
      MethodType methodType, final RpcException error) {
    checkNotNull(methodType, "methodType");
    checkNotNull(error, "error");
    switch (methodType) {
      case UNARY_UNARY:
        return unaryUnary((request, context) -> {
          throw error;
        }, null, null);
      case UNARY_STREAM:
        return unaryStream((request, context) -> {
          throw error;
        }, null, null);
      case STREAM_UNARY:
        return streamUnary((requests, context) -> {
          throw error;
        }, null, null);
      case STREAM_STREAM:
        return streamStream((requests, context) -> {
          throw error;
        }, null, null);
      default:
        throw new AssertionError("Unknown method type: " + methodType);
    }
  }

  public MethodType getMethodType() {
    return methodType;
  }

  public boolean isRequestStreaming() {
    return methodType.isRequestStreaming();
  }

  public boolean isResponseStreaming() {
    return methodType.isResponseStreaming();
  }

  @Nullable
  public Marshaller<ReqT> getRequestMarshaller() {
    return requestMarshaller;
  }

  @Nullable
  public Marshaller<RespT> getResponseMarshaller() {
    return responseMarshaller;
  }

  /**
   * Returns the behavior of a unary-unary handler, {@code null} for any other shape.
   */
  @Nullable
  public UnaryUnaryBehavior<ReqT, RespT> getUnaryUnary() {
    return unaryUnary;
  }

  @Nullable
  public UnaryStreamBehavior<ReqT, RespT> getUnaryStream() {
    return unaryStream;
  }

  @Nullable
  public StreamUnaryBehavior<ReqT, RespT> getStreamUnary() {
    return streamUnary;
  }

  @Nullable
  public StreamStreamBehavior<ReqT, RespT> getStreamStream() {
    return streamStream;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("methodType", methodType)
        .add("requestMarshaller", requestMarshaller)
        .add("responseMarshaller", responseMarshaller)
        .toString();
  }

  /**
   * Serves one unary-unary call.
   */
  public interface UnaryUnaryBehavior<ReqT, RespT> {
    RespT invoke(ReqT request, ServicerContext context);
  }

  /**
   * Serves one unary-stream call.
   */
  public interface UnaryStreamBehavior<ReqT, RespT> {
    Iterator<RespT> invoke(ReqT request, ServicerContext context);
  }

  /**
   * Serves one stream-unary call.
   */
  public interface StreamUnaryBehavior<ReqT, RespT> {
    RespT invoke(Iterator<ReqT> requests, ServicerContext context);
  }

  /**
   * Serves one stream-stream call.
   */
  public interface StreamStreamBehavior<ReqT, RespT> {
    Iterator<RespT> invoke(Iterator<ReqT> requests, ServicerContext context);
  }
}
