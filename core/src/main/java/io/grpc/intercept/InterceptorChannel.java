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
import com.google.common.collect.Sets;
import java.util.Set;

/**
 * A {@link Channel} that runs calls of the shapes its interceptor declares through that
 * interceptor and binds all other calls directly on the underlying channel.
 */
final class InterceptorChannel implements Channel {
  private final Channel channel;
  private final ClientInterceptor interceptor;
  private final Set<MethodType> methodTypes;

  InterceptorChannel(Channel channel, ClientInterceptor interceptor) {
    this.channel = checkNotNull(channel, "channel");
    this.interceptor = checkNotNull(interceptor, "interceptor");
    this.methodTypes = Sets.immutableEnumSet(interceptor.interceptedMethodTypes());
  }

  @Override
  public <ReqT, RespT> UnaryUnaryMultiCallable<ReqT, RespT> unaryUnary(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller) {
    if (!methodTypes.contains(MethodType.UNARY_UNARY)) {
      return channel.unaryUnary(method, requestMarshaller, responseMarshaller);
    }
    return new InterceptingUnaryUnaryCallable<>(
        channel, method, requestMarshaller, responseMarshaller, interceptor);
  }

  @Override
  public <ReqT, RespT> UnaryStreamMultiCallable<ReqT, RespT> unaryStream(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller) {
    if (!methodTypes.contains(MethodType.UNARY_STREAM)) {
      return channel.unaryStream(method, requestMarshaller, responseMarshaller);
    }
    return new InterceptingUnaryStreamCallable<>(
        channel, method, requestMarshaller, responseMarshaller, interceptor);
  }

  @Override
  public <ReqT, RespT> StreamUnaryMultiCallable<ReqT, RespT> streamUnary(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller) {
    if (!methodTypes.contains(MethodType.STREAM_UNARY)) {
      return channel.streamUnary(method, requestMarshaller, responseMarshaller);
    }
    return new InterceptingStreamUnaryCallable<>(
        channel, method, requestMarshaller, responseMarshaller, interceptor);
  }

  @Override
  public <ReqT, RespT> StreamStreamMultiCallable<ReqT, RespT> streamStream(
      String method, Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller) {
    if (!methodTypes.contains(MethodType.STREAM_STREAM)) {
      return channel.streamStream(method, requestMarshaller, responseMarshaller);
    }
    return new InterceptingStreamStreamCallable<>(
        channel, method, requestMarshaller, responseMarshaller, interceptor);
  }

  @Override
  public void subscribe(ConnectivityListener listener, boolean tryToConnect) {
    channel.subscribe(listener, tryToConnect);
  }

  @Override
  public void unsubscribe(ConnectivityListener listener) {
    channel.unsubscribe(listener);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("interceptor", interceptor)
        .add("channel", channel)
        .toString();
  }

  /**
   * Throws {@link InvalidCallException} unless {@code callDetails} describes a call of the
   * {@code expected} shape.
   */
  static void checkMethodType(MethodType expected, CallDetails<?, ?> callDetails) {
    checkNotNull(callDetails, "callDetails");
    if (callDetails.getMethodType() != expected) {
      throw new InvalidCallException(expected, callDetails.getMethodType());
    }
  }
}
