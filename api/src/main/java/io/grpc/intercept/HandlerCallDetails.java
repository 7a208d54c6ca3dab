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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import javax.annotation.CheckReturnValue;
import javax.annotation.concurrent.Immutable;

/**
 * What is known about an incoming call when its handler is looked up: the method name and the
 * metadata the client sent.
 */
@Immutable
@CheckReturnValue
public final class HandlerCallDetails {
  private final String method;
  private final Metadata invocationMetadata;

  private HandlerCallDetails(String method, Metadata invocationMetadata) {
    this.method = method;
    this.invocationMetadata = invocationMetadata;
  }

  public static HandlerCallDetails create(String method, Metadata invocationMetadata) {
    checkNotNull(method, "method");
    checkArgument(!method.isEmpty(), "method must not be empty");
    return new HandlerCallDetails(method, checkNotNull(invocationMetadata, "invocationMetadata"));
  }

  /**
   * The fully qualified name of the method called.
   */
  public String getMethod() {
    return method;
  }

  /**
   * The metadata sent by the client.
   */
  public Metadata getInvocationMetadata() {
    return invocationMetadata;
  }

  public HandlerCallDetails withMethod(String method) {
    return create(method, invocationMetadata);
  }

  public HandlerCallDetails withInvocationMetadata(Metadata invocationMetadata) {
    return create(method, invocationMetadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HandlerCallDetails)) {
      return false;
    }
    HandlerCallDetails that = (HandlerCallDetails) o;
    return method.equals(that.method) && invocationMetadata.equals(that.invocationMetadata);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(method, invocationMetadata);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("method", method)
        .add("invocationMetadata", invocationMetadata)
        .toString();
  }
}
