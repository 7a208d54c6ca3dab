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
 * The call shape of a method: whether the client sends one request or a stream of them, and
 * whether the server answers with one response or a stream of them.
 */
public enum MethodType {
  /**
   * One request message followed by one response message.
   */
  UNARY_UNARY(false, false),

  /**
   * One request message followed by zero or more response messages.
   */
  UNARY_STREAM(false, true),

  /**
   * Zero or more request messages followed by one response message.
   */
  STREAM_UNARY(true, false),

  /**
   * Zero or more request and response messages arbitrarily interleaved in time.
   */
  STREAM_STREAM(true, true);

  private final boolean requestStreaming;
  private final boolean responseStreaming;

  MethodType(boolean requestStreaming, boolean responseStreaming) {
    this.requestStreaming = requestStreaming;
    this.responseStreaming = responseStreaming;
  }

  /**
   * Returns {@code true} if the client sends a stream of request messages.
   */
  public final boolean isRequestStreaming() {
    return requestStreaming;
  }

  /**
   * Returns {@code true} if the server answers with a stream of response messages.
   */
  public final boolean isResponseStreaming() {
    return responseStreaming;
  }

  /**
   * Returns the method type with the given streaming flags.
   */
  public static MethodType forStreaming(boolean requestStreaming, boolean responseStreaming) {
    if (requestStreaming) {
      return responseStreaming ? STREAM_STREAM : STREAM_UNARY;
    }
    return responseStreaming ? UNARY_STREAM : UNARY_UNARY;
  }
}
