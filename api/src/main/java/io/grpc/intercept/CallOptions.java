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
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The optional per-call arguments an application passes when it invokes a method: timeout,
 * metadata and credentials.
 *
 * <p>A field that is not set is {@code null}, except metadata which is {@link Metadata#EMPTY}.
 */
@Immutable
@CheckReturnValue
public final class CallOptions {
  /**
   * A blank {@code CallOptions} that all fields are not set.
   */
  public static final CallOptions DEFAULT = new CallOptions(new Builder());

  @Nullable
  private final Duration timeout;

  private final Metadata metadata;

  @Nullable
  private final CallCredentials credentials;

  private CallOptions(Builder builder) {
    this.timeout = builder.timeout;
    this.metadata = builder.metadata;
    this.credentials = builder.credentials;
  }

  private static final class Builder {
    Duration timeout;
    Metadata metadata = Metadata.EMPTY;
    CallCredentials credentials;

    private CallOptions build() {
      return new CallOptions(this);
    }
  }

  /**
   * Returns a new {@code CallOptions} with the given timeout.
   *
   * @param timeout the timeout or {@code null} for unsetting the timeout.
   */
  public CallOptions withTimeout(@Nullable Duration timeout) {
    if (timeout != null) {
      checkArgument(!timeout.isNegative(), "timeout must not be negative: %s", timeout);
    }
    Builder builder = toBuilder(this);
    builder.timeout = timeout;
    return builder.build();
  }

  /**
   * Returns a new {@code CallOptions} with a timeout of the given {@code duration}.
   */
  public CallOptions withTimeout(long duration, TimeUnit unit) {
    checkNotNull(unit, "unit");
    return withTimeout(Duration.ofNanos(unit.toNanos(duration)));
  }

  /**
   * Returns the timeout or {@code null} if the timeout is not set.
   */
  @Nullable
  public Duration getTimeout() {
    return timeout;
  }

  /**
   * Returns a new {@code CallOptions} with the given metadata, replacing any metadata set before.
   */
  public CallOptions withMetadata(Metadata metadata) {
    Builder builder = toBuilder(this);
    builder.metadata = checkNotNull(metadata, "metadata");
    return builder.build();
  }

  /**
   * Returns the metadata to send with the call. Never {@code null}.
   */
  public Metadata getMetadata() {
    return metadata;
  }

  /**
   * Returns a new {@code CallOptions} with the given call credentials.
   */
  public CallOptions withCallCredentials(@Nullable CallCredentials credentials) {
    Builder builder = toBuilder(this);
    builder.credentials = credentials;
    return builder.build();
  }

  /**
   * Returns the call credentials or {@code null} if none are set.
   */
  @Nullable
  public CallCredentials getCredentials() {
    return credentials;
  }

  /**
   * Copy CallOptions.
   */
  private static Builder toBuilder(CallOptions other) {
    Builder builder = new Builder();
    builder.timeout = other.timeout;
    builder.metadata = other.metadata;
    builder.credentials = other.credentials;
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CallOptions)) {
      return false;
    }
    CallOptions that = (CallOptions) o;
    return Objects.equal(timeout, that.timeout)
        && metadata.equals(that.metadata)
        && Objects.equal(credentials, that.credentials);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(timeout, metadata, credentials);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timeout", timeout)
        .add("metadata", metadata)
        .add("credentials", credentials)
        .toString();
  }
}
