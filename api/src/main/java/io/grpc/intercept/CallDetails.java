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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Everything needed to issue one RPC, independent of the interceptors it passes through: the
 * method, its call shape, its marshallers, and the timeout, metadata and credentials supplied by
 * the caller.
 *
 * <p>A {@code CallDetails} is never modified. An interceptor that wants the call to go out
 * differently derives a new value with {@link #toBuilder} or one of the {@code with} methods and
 * passes that to its continuation; every field it does not set is carried over unchanged. The
 * real call reads its arguments from the value handed to the innermost continuation.
 *
 * @param <ReqT> type of the request message
 * @param <RespT> type of the response message
 */
@Immutable
@CheckReturnValue
public final class CallDetails<ReqT, RespT> {

  private final String method;
  private final MethodType methodType;
  private final Marshaller<ReqT> requestMarshaller;
  private final Marshaller<RespT> responseMarshaller;
  @Nullable
  private final Duration timeout;
  private final Metadata metadata;
  @Nullable
  private final CallCredentials credentials;

  private CallDetails(Builder<ReqT, RespT> builder) {
    this.method = builder.method;
    this.methodType = builder.methodType;
    this.requestMarshaller = builder.requestMarshaller;
    this.responseMarshaller = builder.responseMarshaller;
    this.timeout = builder.timeout;
    this.metadata = builder.metadata;
    this.credentials = builder.credentials;
  }

  /**
   * Creates a new builder. Method, method type and both marshallers must be set before
   * {@link Builder#build}; metadata defaults to {@link Metadata#EMPTY}.
   */
  public static <ReqT, RespT> Builder<ReqT, RespT> newBuilder() {
    return new Builder<>();
  }

  /**
   * Returns a builder pre-populated with every field of this value.
   */
  public Builder<ReqT, RespT> toBuilder() {
    return new Builder<ReqT, RespT>()
        .setMethod(method)
        .setMethodType(methodType)
        .setRequestMarshaller(requestMarshaller)
        .setResponseMarshaller(responseMarshaller)
        .setTimeout(timeout)
        .setMetadata(metadata)
        .setCredentials(credentials);
  }

  /**
   * The fully qualified name of the method, e.g. {@code /package.Service/Method}.
   */
  public String getMethod() {
    return method;
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

  public Marshaller<ReqT> getRequestMarshaller() {
    return requestMarshaller;
  }

  public Marshaller<RespT> getResponseMarshaller() {
    return responseMarshaller;
  }

  /**
   * Returns the timeout or {@code null} if the call has none.
   */
  @Nullable
  public Duration getTimeout() {
    return timeout;
  }

  /**
   * Returns the metadata to send with the call. Never {@code null}.
   */
  public Metadata getMetadata() {
    return metadata;
  }

  @Nullable
  public CallCredentials getCredentials() {
    return credentials;
  }

  /**
   * Returns the timeout, metadata and credentials of this value as {@link CallOptions}, in the
   * form a {@link Channel} callable accepts them.
   */
  public CallOptions getCallOptions() {
    return CallOptions.DEFAULT
        .withTimeout(timeout)
        .withMetadata(metadata)
        .withCallCredentials(credentials);
  }

  public CallDetails<ReqT, RespT> withMethod(String method) {
    return toBuilder().setMethod(method).build();
  }

  public CallDetails<ReqT, RespT> withTimeout(@Nullable Duration timeout) {
    return toBuilder().setTimeout(timeout).build();
  }

  public CallDetails<ReqT, RespT> withTimeout(long duration, TimeUnit unit) {
    return toBuilder().setTimeout(duration, unit).build();
  }

  public CallDetails<ReqT, RespT> withMetadata(Metadata metadata) {
    return toBuilder().setMetadata(metadata).build();
  }

  public CallDetails<ReqT, RespT> withCredentials(@Nullable CallCredentials credentials) {
    return toBuilder().setCredentials(credentials).build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CallDetails)) {
      return false;
    }
    CallDetails<?, ?> that = (CallDetails<?, ?>) o;
    return method.equals(that.method)
        && methodType == that.methodType
        && requestMarshaller == that.requestMarshaller
        && responseMarshaller == that.responseMarshaller
        && Objects.equal(timeout, that.timeout)
        && metadata.equals(that.metadata)
        && Objects.equal(credentials, that.credentials);
  }

  @Override
  public int hashCode() {
    // Marshallers are compared by identity.
    return Objects.hashCode(
        method,
        methodType,
        System.identityHashCode(requestMarshaller),
        System.identityHashCode(responseMarshaller),
        timeout,
        metadata,
        credentials);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("method", method)
        .add("methodType", methodType)
        .add("timeout", timeout)
        .add("metadata", metadata)
        .add("credentials", credentials)
        .toString();
  }

  /**
   * Builder for {@link CallDetails}. Not thread-safe.
   */
  public static final class Builder<ReqT, RespT> {
    private String method;
    private MethodType methodType;
    private Marshaller<ReqT> requestMarshaller;
    private Marshaller<RespT> responseMarshaller;
    private Duration timeout;
    private Metadata metadata = Metadata.EMPTY;
    private CallCredentials credentials;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setMethod(String method) {
      this.method = method;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setMethodType(MethodType methodType) {
      this.methodType = methodType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setRequestMarshaller(Marshaller<ReqT> requestMarshaller) {
      this.requestMarshaller = requestMarshaller;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setResponseMarshaller(Marshaller<RespT> responseMarshaller) {
      this.responseMarshaller = responseMarshaller;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setTimeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setTimeout(long duration, TimeUnit unit) {
      return setTimeout(Duration.ofNanos(checkNotNull(unit, "unit").toNanos(duration)));
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setMetadata(Metadata metadata) {
      this.metadata = metadata;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setCredentials(@Nullable CallCredentials credentials) {
      this.credentials = credentials;
      return this;
    }

    /**
     * Sets timeout, metadata and credentials from {@code options}.
     */
    @CanIgnoreReturnValue
    public Builder<ReqT, RespT> setCallOptions(CallOptions options) {
      checkNotNull(options, "options");
      return setTimeout(options.getTimeout())
          .setMetadata(options.getMetadata())
          .setCredentials(options.getCredentials());
    }

    public CallDetails<ReqT, RespT> build() {
      checkNotNull(method, "method");
      checkArgument(!method.isEmpty(), "method must not be empty");
      checkNotNull(methodType, "methodType");
      checkNotNull(requestMarshaller, "requestMarshaller");
      checkNotNull(responseMarshaller, "responseMarshaller");
      checkNotNull(metadata, "metadata");
      if (timeout != null) {
        checkArgument(!timeout.isNegative(), "timeout must not be negative: %s", timeout);
      }
      return new CallDetails<>(this);
    }
  }
}
