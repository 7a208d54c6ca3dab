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
 * A stream-unary callable that runs each call through one {@link ClientInterceptor} before it
 * reaches the next channel. The request iterator is handed on as given; it is consumed only by
 * whoever issues the real call, or by an interceptor that chooses to.
 */
final class InterceptingStreamUnaryCallable<ReqT, RespT>
    implements StreamUnaryMultiCallable<ReqT, RespT> {
  private final Channel next;
  private final String method;
  private final Marshaller<ReqT> requestMarshaller;
  private final Marshaller<RespT> responseMarshaller;
  private final ClientInterceptor interceptor;

  InterceptingStreamUnaryCallable(
      Channel next, String method, Marshaller<ReqT> requestMarshaller,
      Marshaller<RespT> responseMarshaller, ClientInterceptor interceptor) {
    this.next = next;
    this.method = method;
    this.requestMarshaller = requestMarshaller;
    this.responseMarshaller = responseMarshaller;
    this.interceptor = interceptor;
  }

  @Override
  public RespT call(Iterator<ReqT> requests, CallOptions options) {
    return withCall(requests, options).getResponse();
  }

  @Override
  public CallResult<RespT> withCall(Iterator<ReqT> requests, CallOptions options) {
    RpcFuture<RespT> outcome =
        interceptor.interceptStreamUnary(this::proceedWithCall, newCallDetails(options), requests);
    checkNotNull(outcome, "%s returned null for %s", interceptor, method);
    return CallResult.create(RpcOutcomes.await(outcome), outcome);
  }

  @Override
  public RpcFuture<RespT> future(Iterator<ReqT> requests, CallOptions options) {
    RpcFuture<RespT> outcome =
        interceptor.interceptStreamUnary(this::proceedFuture, newCallDetails(options), requests);
    return checkNotNull(outcome, "%s returned null for %s", interceptor, method);
  }

  private RpcFuture<RespT> proceedWithCall(
      CallDetails<ReqT, RespT> callDetails, Iterator<ReqT> requests) {
    StreamUnaryMultiCallable<ReqT, RespT> callable = bind(callDetails);
    CallResult<RespT> result;
    try {
      result = callable.withCall(requests, callDetails.getCallOptions());
    } catch (RuntimeException e) {
      return RpcOutcomes.failed(e);
    }
    return RpcOutcomes.completed(result);
  }

  private RpcFuture<RespT> proceedFuture(
      CallDetails<ReqT, RespT> callDetails, Iterator<ReqT> requests) {
    return bind(callDetails).future(requests, callDetails.getCallOptions());
  }

  private StreamUnaryMultiCallable<ReqT, RespT> bind(CallDetails<ReqT, RespT> callDetails) {
    InterceptorChannel.checkMethodType(MethodType.STREAM_UNARY, callDetails);
    return next.streamUnary(
        callDetails.getMethod(),
        callDetails.getRequestMarshaller(),
        callDetails.getResponseMarshaller());
  }

  private CallDetails<ReqT, RespT> newCallDetails(CallOptions options) {
    return CallDetails.<ReqT, RespT>newBuilder()
        .setMethod(method)
        .setMethodType(MethodType.STREAM_UNARY)
        .setRequestMarshaller(requestMarshaller)
        .setResponseMarshaller(responseMarshaller)
        .setCallOptions(options)
        .build();
  }
}
