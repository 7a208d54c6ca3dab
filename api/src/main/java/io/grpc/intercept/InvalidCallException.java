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
 * Thrown when call details handed to a continuation describe a call shape other than the one the
 * continuation issues, for example a stream-stream {@link MethodType} passed to the continuation
 * of a unary-unary call. The call is not issued.
 */
public final class InvalidCallException extends IllegalStateException {

  private static final long serialVersionUID = -3187625480321473520L;

  private final MethodType expected;
  private final MethodType actual;

  public InvalidCallException(MethodType expected, MethodType actual) {
    super("Call details describe a " + actual + " call, but the call is " + expected);
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * The call shape of the continuation that rejected the details.
   */
  public MethodType getExpected() {
    return expected;
  }

  /**
   * The call shape the rejected details claimed.
   */
  public MethodType getActual() {
    return actual;
  }
}
