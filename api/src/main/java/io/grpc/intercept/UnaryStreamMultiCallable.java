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

/**
 * Affords invoking a unary-stream method.
 *
 * @param <ReqT> type of the request message
 * @param <RespT> type of the response messages
 */
public interface UnaryStreamMultiCallable<ReqT, RespT> {

  /**
   * Invokes the method.
   *
   * @return the stream of responses, which is also the call handle
   */
  ResponseStream<RespT> call(ReqT request, CallOptions options);

  default ResponseStream<RespT> call(ReqT request) {
    return call(request, CallOptions.DEFAULT);
  }
}
