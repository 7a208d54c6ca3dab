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

/**
 * A unary-unary callable that runs each call through one {@link ClientInterceptor} before it
 * reaches the next channel.
 */
final class InterceptingUnaryUnaryCallable<ReqT, RespT>
    implements UnaryUnaryMultiCallable<ReqT, RespT> {
  private final Channel next;
  private final String method;
  private final Marshaller<ReqT> requestMarshaller;
  private final Marshaller<RespT> responseMarshaller;
  private final ClientInterceptor interceptor;

  InterceptingUnaryUnaryCallable(
      Channel next, String method, Marshaller<ReqT> requestMarshaller,
      Marshaller<RespT> responseMarshaller, ClientInterceptor interceptor) {
    this.next = next;
    this.method = method;
    this.requestMarshaller = requestMarshaller;
    this.responseMarshaller = responseMarshaller;
    this.interceptor = interceptor;
  }

  @Override
  public RespT call(ReqT request, CallOptions options) {
    return withCall(request, options).getResponse();
  }

  @Override
  public CallResult<RespT> withCall(ReqT request, CallOptions options) {
    RpcFuture<RespT> outcome =
        interceptor.interceptUnaryUnary(this::proceedWithCall, newCallDetails(options), request);
    checkNotNull(outcome, "%s returned null for %s", interceptor, method);
    return CallResult.create(RpcOutcomes.await(outcome), outcome);
  }

  @Override
  public RpcFuture<RespT> future(ReqT request, CallOptions options) {
    RpcFuture<RespT> outcome =
        interceptor.interceptUnaryUnary(this::proceedFuture, newCallDetails(options), request);
    return checkNotNull(outcome, "%s returned null for %s", interceptor, method);
  }

  private RpcFuture<RespT> proceedWithCall(CallDetails<ReqT, RespT> callDetails, ReqT request) {
    UnaryUnaryMultiCallable<ReqT, RespT> callable = bind(callDetails);
    CallResult<RespT> result;
    try {
      result = callable.withCall(request, callDetails.getCallOptions());
    } catch (RuntimeException e) {
      return RpcOutcomes.failed(e);
    }
    return RpcOutcomes.completed(result);
  }

  private RpcFuture<RespT> proceedFuture(CallDetails<ReqT, RespT> callDetails, ReqT request) {
    return bind(callDetails).future(request, callDetails.getCallOptions());
  }

  private UnaryUnaryMultiCallable<ReqT, RespT> bind(CallDetails<ReqT, RespT> callDetails) {
    InterceptorChannel.checkMethodType(MethodType.UNARY_UNARY, callDetails);
    return next.unaryUnary(
        callDetails.getMethod(),
        callDetails.getRequestMarshaller(),
        callDetails.getResponseMarshaller());
  }

  private CallDetails<ReqT, RespT> newCallDetails(CallOptions options) {
    return CallDetails.<ReqT, RespT>newBuilder()
        .setMethod(method)
        .setMethodType(MethodType.UNARY_UNARY)
        .setRequestMarshaller(requestMarshaller)
        .setResponseMarshaller(responseMarshaller)
        .setCallOptions(options)
        .build();
  }
}
