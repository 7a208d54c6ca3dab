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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ForwardingIterator;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.intercept.HandlerCallDetails;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcMethodHandler;
import io.grpc.intercept.RpcMethodHandler.StreamStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.StreamUnaryBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryStreamBehavior;
import io.grpc.intercept.RpcMethodHandler.UnaryUnaryBehavior;
import io.grpc.intercept.RpcMethodHandlers;
import io.grpc.intercept.ServerCallInterceptor;
import io.grpc.intercept.ServerInterceptor;
import io.grpc.intercept.ServiceContinuation;
import io.grpc.intercept.ServicerContext;
import io.grpc.intercept.StatusCode;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link ServerInterceptor} that logs when the handler of each served call starts and when it
 * terminates, with its status code and how long it took.
 *
 * <p>The interceptor wraps whatever handler the rest of the lookup chain resolves. Single-response
 * calls are logged as complete when the behavior returns. Streamed responses are logged as
 * complete when the iterator the behavior returned is exhausted, or when pulling from it fails.
 * Exceptions thrown by the behavior are logged and rethrown unchanged.
 */
@ThreadSafe
public final class LoggingServerInterceptor implements ServerInterceptor {
  private static final Logger logger = Logger.getLogger(LoggingServerInterceptor.class.getName());

  private final Level level;
  private final Ticker ticker;

  private LoggingServerInterceptor(Builder builder) {
    this.level = builder.level;
    this.ticker = builder.ticker;
  }

  /**
   * Returns an interceptor logging at {@link Level#FINE}.
   */
  public static LoggingServerInterceptor create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Nullable
  @Override
  public RpcMethodHandler<?, ?> interceptService(
      ServiceContinuation continuation, HandlerCallDetails handlerCallDetails) {
    RpcMethodHandler<?, ?> handler = continuation.proceed(handlerCallDetails);
    if (handler == null || !logger.isLoggable(level)) {
      return handler;
    }
    return RpcMethodHandlers.intercept(
        handler, new HandlerLogger(handler.getMethodType(), handlerCallDetails.getMethod()));
  }

  @Override
  public String toString() {
    return "LoggingServerInterceptor{level=" + level + "}";
  }

  /**
   * Logs every call served by one resolved handler.
   */
  private final class HandlerLogger implements ServerCallInterceptor {
    private final MethodType methodType;
    private final String method;

    HandlerLogger(MethodType methodType, String method) {
      this.methodType = methodType;
      this.method = method;
    }

    @Override
    public <ReqT, RespT> RespT interceptUnaryUnary(
        UnaryUnaryBehavior<ReqT, RespT> next, ReqT request, ServicerContext context) {
      CallLog log = new CallLog(methodType, method);
      RespT response;
      try {
        response = next.invoke(request, context);
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
      log.completed();
      return response;
    }

    @Override
    public <ReqT, RespT> Iterator<RespT> interceptUnaryStream(
        UnaryStreamBehavior<ReqT, RespT> next, ReqT request, ServicerContext context) {
      CallLog log = new CallLog(methodType, method);
      Iterator<RespT> responses;
      try {
        responses = next.invoke(request, context);
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
      return new LoggingIterator<>(responses, log);
    }

    @Override
    public <ReqT, RespT> RespT interceptStreamUnary(
        StreamUnaryBehavior<ReqT, RespT> next, Iterator<ReqT> requests, ServicerContext context) {
      CallLog log = new CallLog(methodType, method);
      RespT response;
      try {
        response = next.invoke(requests, context);
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
      log.completed();
      return response;
    }

    @Override
    public <ReqT, RespT> Iterator<RespT> interceptStreamStream(
        StreamStreamBehavior<ReqT, RespT> next, Iterator<ReqT> requests, ServicerContext context) {
      CallLog log = new CallLog(methodType, method);
      Iterator<RespT> responses;
      try {
        responses = next.invoke(requests, context);
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
      return new LoggingIterator<>(responses, log);
    }

    @Override
    public String toString() {
      return "HandlerLogger{" + methodType + " " + method + "}";
    }
  }

  /**
   * The log lines of one served call. The terminal line is written at most once.
   */
  private final class CallLog {
    private final MethodType methodType;
    private final String method;
    private final Stopwatch stopwatch;
    private final AtomicBoolean terminated = new AtomicBoolean();

    CallLog(MethodType methodType, String method) {
      this.methodType = methodType;
      this.method = method;
      this.stopwatch = Stopwatch.createStarted(ticker);
      logger.log(level, "{0} call to {1} received", new Object[] {methodType, method});
    }

    void completed() {
      if (terminated.compareAndSet(false, true)) {
        logger.log(level, "{0} call to {1} completed with {2} in {3} ms", new Object[] {
            methodType, method, StatusCode.OK, stopwatch.elapsed(TimeUnit.MILLISECONDS)});
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

  private static final class LoggingIterator<V> extends ForwardingIterator<V> {
    private final Iterator<V> delegate;
    private final CallLog log;

    LoggingIterator(Iterator<V> delegate, CallLog log) {
      this.delegate = checkNotNull(delegate, "responses");
      this.log = log;
    }

    @Override
    protected Iterator<V> delegate() {
      return delegate;
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
        log.completed();
      }
      return hasNext;
    }

    @Override
    public V next() {
      try {
        return super.next();
      } catch (NoSuchElementException e) {
        log.completed();
        throw e;
      } catch (RuntimeException e) {
        log.failed(e);
        throw e;
      }
    }
  }

  /**
   * Builder for {@link LoggingServerInterceptor}. Not thread-safe.
   */
  public static final class Builder {
    private Level level = Level.FINE;
    private Ticker ticker = Ticker.systemTicker();

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

    public LoggingServerInterceptor build() {
      return new LoggingServerInterceptor(this);
    }
  }
}
