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
import javax.annotation.concurrent.Immutable;

/**
 * The response of a completed single-response RPC together with its {@link Call} handle.
 *
 * @param <RespT> type of the response message
 */
@Immutable
public final class CallResult<RespT> {
  private final RespT response;
  private final Call call;

  private CallResult(RespT response, Call call) {
    this.response = response;
    this.call = call;
  }

  public static <RespT> CallResult<RespT> create(RespT response, Call call) {
    return new CallResult<>(response, checkNotNull(call, "call"));
  }

  public RespT getResponse() {
    return response;
  }

  public Call getCall() {
    return call;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("response", response)
        .add("call", call)
        .toString();
  }
}
