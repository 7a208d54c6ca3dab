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

import java.util.Iterator;

/**
 * A stream-stream callable that runs each call through one {@link ClientInterceptor} before it
 * reaches the next channel.
 */
final class InterceptingStreamStreamCallable<ReqT, RespT>
    implements StreamStreamMultiCallable<ReqT, RespT> {
  private final Channel next;
  private final String method;
  private final Marshaller<ReqT> requestMarshaller;
  private final Marshaller<RespT> responseMarshaller;
  private final ClientInterceptor interceptor;

  InterceptingStreamStreamCallable(
      Channel next, String method, Marshaller<ReqT> requestMarshaller,
      Marshaller<RespT> responseMarshaller, ClientInterceptor interceptor) {
    this.next = next;
    this.method = method;
    this.requestMarshaller = requestMarshaller;
    this.responseMarshaller = responseMarshaller;
    this.interceptor = interceptor;
  }

  @Override
  public ResponseStream<RespT> call(Iterator<ReqT> requests, CallOptions options) {
    CallDetails<ReqT, RespT> callDetails = CallDetails.<ReqT, RespT>newBuilder()
        .setMethod(method)
        .setMethodType(MethodType.STREAM_STREAM)
        .setRequestMarshaller(requestMarshaller)
        .setResponseMarshaller(responseMarshaller)
        .setCallOptions(options)
        .build();
    ResponseStream<RespT> responses =
        interceptor.interceptStreamStream(this::proceed, callDetails, requests);
    return checkNotNull(responses, "%s returned null for %s", interceptor, method);
  }

  private ResponseStream<RespT> proceed(
      CallDetails<ReqT, RespT> callDetails, Iterator<ReqT> requests) {
    InterceptorChannel.checkMethodType(MethodType.STREAM_STREAM, callDetails);
    return next.<ReqT, RespT>streamStream(
            callDetails.getMethod(),
            callDetails.getRequestMarshaller(),
            callDetails.getResponseMarshaller())
        .call(requests, callDetails.getCallOptions());
  }
}
