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

package io.grpc.intercept.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.intercept.CallDetails;
import io.grpc.intercept.ClientInterceptor;
import io.grpc.intercept.ForwardingResponseStream.SimpleForwardingResponseStream;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.ResponseStream;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcFuture;
import io.grpc.intercept.StatusCode;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link ClientInterceptor} that logs when calls start and when they terminate, with their
 * status code and how long they took.
 *
 * <p>Single-response calls are logged as complete when their handle completes. Response streams
 * are logged as complete when the application has read them to the end, or when reading fails.
 * Exceptions thrown further down the chain are logged and rethrown unchanged.
 */
@ThreadSafe
public final class LoggingClientInterceptor implements ClientInterceptor {
  private static final Logger logger = Logger.getLogger(LoggingClientInterceptor.class.getName());

  private final Level level;
  private final Ticker ticker;
  private final Set<MethodType> methodTypes;

  private LoggingClientInterceptor(Builder builder) {
    this.level = builder.level;
    this.ticker = builder.ticker;
    this.methodTypes = Sets.immutableEnumSet(builder.methodTypes);
  }

  /**
   * Returns an interceptor logging every call shape at {@link Level#FINE}.
   */
  public static LoggingClientInterceptor create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public Set<MethodType> interceptedMethodTypes() {
    return methodTypes;
  }

  @Override
  public <ReqT, RespT> RpcFuture<RespT> interceptUnaryUnary(
      UnaryUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    if (!logger.isLoggable(level)) {
      return continuation.proceed(callDetails, request);
    }
    CallLog log = new CallLog(callDetails);
    RpcFuture<RespT> outcome;
    try {
      outcome = continuation.proceed(callDetails, request);
    } catch (RuntimeException e) {
      log.failed(e);
      throw e;
    }
    return log.watch(outcome);
  }

  @Override
  public <ReqT, RespT> ResponseStream<RespT> interceptUnaryStream(
      UnaryStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    if (!logger.isLoggable(level)) {
      return continuation.proceed(callDetails, request);
    }
    CallLog log = new CallLog(callDetails);
    ResponseStream<RespT> responses;
    try {
      responses = continuation.proceed(callDetails, request);
    } catch (RuntimeException e) {
      log.failed(e);
      throw e;
    }
    return new LoggingResponseStream<>(responses, log);
  }

  @Override
  public <ReqT, RespT> RpcFuture<RespT> interceptStreamUnary(
      StreamUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    if (!logger.isLoggable(level)) {
      return continuation.proceed(callDetails, requests);
    }
    CallLog log = new CallLog(callDetails);
    RpcFuture<RespT> outcome;
    try {
      outcome = continuation.proceed(callDetails, requests);
    } catch (RuntimeException e) {
      log.failed(e);
      throw e;
    }
    return log.watch(outcome);
  }

  @Override
  public <ReqT, RespT> ResponseStream<RespT> interceptStreamStream(
      StreamStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    if (!logger.isLoggable(level)) {
      return continuation.proceed(callDetails, requests);
    }
    CallLog log = new CallLog(callDetails);
    ResponseStream<RespT> responses;
    try {
      responses = continuation.proceed(callDetails, requests);
    } catch (RuntimeException e) {
      log.failed(e);
      throw e;
    }
    return new LoggingResponseStream<>(responses, log);
  }

  @Override
  public String toString() {
    return "LoggingClientInterceptor{level=" + level + ", methodTypes=" + methodTypes + "}";
  }

  /**
   * The log lines of one call. The terminal line is written at most once.
   */
  private final class CallLog {
    private final MethodType methodType;
    private final String method;
    private final Stopwatch stopwatch;
    private final AtomicBoolean terminated = new AtomicBoolean();

    CallLog(CallDetails<?, ?> callDetails) {
      this.methodType = callDetails.getMethodType();
      this.method = callDetails.getMethod();
      this.stopwatch = Stopwatch.createStarted(ticker);
      logger.log(level, "{0} call to {1} started", new Object[] {methodType, method});
    }

    <V> RpcFuture<V> watch(RpcFuture<V> outcome) {
      Futures.addCallback(outcome, new FutureCallback<V>() {
        @Override
        public void onSuccess(V result) {
          completed(StatusCode.OK);
        }

        @Override
        public void onFailure(Throwable t) {
          failed(t);
        }
      }, MoreExecutors.directExecutor());
      return outcome;
    }

    void completed(StatusCode code) {
      if (terminated.compareAndSet(false, true)) {
        logger.log(level, "{0} call to {1} completed with {2} in {3} ms",
            new Object[] {methodType, method, code, stopwatch.elapsed(TimeUnit.MILLISECONDS)});
      }
    }

    void failed(Throwable t) {
      if (terminated.compareAndSet(false, true)) {
        StatusCode code = t instanceof RpcException
            ? ((RpcException) t).getCode()
            : StatusCode.UNKNOWN;
        logger.log(level, String.format("%s call to %s failed with %s in %d ms",
            methodType, method, code, stopwatch.elapsed(TimeUnit.MILLISECONDS)), t);
      }
    }
  }

  private static final class LoggingResponseStream<V> extends SimpleForwardingResponseStream<V> {
    private final CallLog log;

    LoggingResponseStream(ResponseStream<V> delegate, CallLog log) {
      super(delegate);
      this.log = log;
    }

    @Override
    public boolean hasNext() {
      boolean hasNext;
      try {
        hasNext = super.hasNext();
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
      if (!hasNext) {
        log.completed(getCode());
      }
      return hasNext;
    }

    @Override
    public V next() {
      try {
        return super.next();
      } catch (NoSuchElementException e) {
        log.completed(getCode());
        throw e;
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
    }
  }

  /**
   * Builder for {@link LoggingClientInterceptor}. Not thread-safe.
   */
  public static final class Builder {
    private Level level = Level.FINE;
    private Ticker ticker = Ticker.systemTicker();
    private Set<MethodType> methodTypes = EnumSet.allOf(MethodType.class);

    private Builder() {}

    /**
     * Sets the level calls are logged at. Defaults to {@link Level#FINE}.
     */
    @CanIgnoreReturnValue
    public Builder setLevel(Level level) {
      this.level = checkNotNull(level, "level");
      return this;
    }

    /**
     * Sets the time source used to measure call durations.
     */
    @CanIgnoreReturnValue
    public Builder setTicker(Ticker ticker) {
      this.ticker = checkNotNull(ticker, "ticker");
      return this;
    }

    /**
     * Restricts logging to calls of the given shapes. Defaults to all shapes.
     */
    @CanIgnoreReturnValue
    public Builder setMethodTypes(Set<MethodType> methodTypes) {
      checkNotNull(methodTypes, "methodTypes");
      checkArgument(!methodTypes.isEmpty(), "methodTypes must not be empty");
      this.methodTypes = EnumSet.copyOf(methodTypes);
      return this;
    }

    public LoggingClientInterceptor build() {
      return new LoggingClientInterceptor(this);
    }
  }
}
