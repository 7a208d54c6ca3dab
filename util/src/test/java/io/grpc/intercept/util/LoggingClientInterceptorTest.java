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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.base.Ticker;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import io.grpc.intercept.CallDetails;
import io.grpc.intercept.Metadata;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.ResponseStream;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcFuture;
import io.grpc.intercept.StatusCode;
import io.grpc.intercept.testing.FakeResponseStream;
import io.grpc.intercept.testing.SettableRpcFuture;
import io.grpc.intercept.testing.StringMarshaller;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link LoggingClientInterceptor}.
 */
@RunWith(JUnit4.class)
public class LoggingClientInterceptorTest {
  private static final String METHOD = "/test.Echo/Say";

  private final Logger logger = Logger.getLogger(LoggingClientInterceptor.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler = new Handler() {
    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  };
  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = new Ticker() {
    @Override
    public long read() {
      return nanos.get();
    }
  };
  private final LoggingClientInterceptor interceptor =
      LoggingClientInterceptor.newBuilder().setTicker(ticker).build();

  private Level savedLevel;

  @Before
  public void setUp() {
    savedLevel = logger.getLevel();
    logger.setLevel(Level.ALL);
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
    logger.setLevel(savedLevel);
  }

  @Test
  public void defaults() {
    LoggingClientInterceptor defaults = LoggingClientInterceptor.create();

    assertThat(defaults.interceptedMethodTypes()).containsExactlyElementsIn(MethodType.values());
    assertThat(defaults.toString()).contains("level=FINE");
  }

  @Test
  public void logsUnaryCompletion() {
    SettableRpcFuture<String> future = new SettableRpcFuture<>();

    RpcFuture<String> outcome = interceptor.interceptUnaryUnary(
        (details, request) -> future, details(MethodType.UNARY_UNARY), "hi");

    assertSame(future, outcome);
    assertThat(messages()).containsExactly("UNARY_UNARY call to /test.Echo/Say started");

    nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(25));
    future.set("hello");

    assertThat(messages()).containsExactly(
        "UNARY_UNARY call to /test.Echo/Say started",
        "UNARY_UNARY call to /test.Echo/Say completed with OK in 25 ms").inOrder();
    assertEquals(Level.FINE, records.get(1).getLevel());
  }

  @Test
  public void logsFailedOutcome() {
    SettableRpcFuture<String> future = new SettableRpcFuture<>();
    RpcException error = new RpcException(StatusCode.UNAVAILABLE, "down");

    interceptor.interceptStreamUnary(
        (details, requests) -> future, details(MethodType.STREAM_UNARY), Iterators.forArray("a"));
    nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(7));
    future.setException(error);

    assertThat(records).hasSize(2);
    assertEquals(
        "STREAM_UNARY call to /test.Echo/Say failed with UNAVAILABLE in 7 ms", message(1));
    assertSame(error, records.get(1).getThrown());
  }

  @Test
  public void logsAndRethrowsContinuationException() {
    IllegalStateException error = new IllegalStateException("boom");

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> interceptor.interceptUnaryUnary((details, request) -> {
          throw error;
        }, details(MethodType.UNARY_UNARY), "hi"));

    assertSame(error, thrown);
    assertEquals("UNARY_UNARY call to /test.Echo/Say failed with UNKNOWN in 0 ms", message(1));
    assertSame(error, records.get(1).getThrown());
  }

  @Test
  public void logsStreamCompletionOnceExhausted() {
    ResponseStream<String> responses = interceptor.interceptUnaryStream(
        (details, request) -> new FakeResponseStream<>(Iterators.forArray("a", "b")),
        details(MethodType.UNARY_STREAM), "hi");

    assertThat(records).hasSize(1);
    nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(3));
    assertThat(ImmutableList.copyOf(responses)).containsExactly("a", "b").inOrder();
    assertFalse(responses.hasNext());

    assertThat(messages()).containsExactly(
        "UNARY_STREAM call to /test.Echo/Say started",
        "UNARY_STREAM call to /test.Echo/Say completed with OK in 3 ms").inOrder();
  }

  @Test
  public void logsStreamFailure() {
    final RpcException error = new RpcException(StatusCode.DATA_LOSS);
    Iterator<String> failing = new AbstractIterator<String>() {
      private boolean sent;

      @Override
      protected String computeNext() {
        if (!sent) {
          sent = true;
          return "first";
        }
        throw error;
      }
    };
    ResponseStream<String> responses = interceptor.interceptStreamStream(
        (details, requests) -> new FakeResponseStream<>(failing),
        details(MethodType.STREAM_STREAM), Iterators.forArray("a"));

    assertEquals("first", responses.next());
    assertSame(error, assertThrows(RpcException.class, responses::hasNext));

    assertEquals(
        "STREAM_STREAM call to /test.Echo/Say failed with DATA_LOSS in 0 ms", message(1));
    assertSame(error, records.get(1).getThrown());
  }

  @Test
  public void logsAtConfiguredLevel() {
    LoggingClientInterceptor warning = LoggingClientInterceptor.newBuilder()
        .setLevel(Level.WARNING)
        .setTicker(ticker)
        .build();
    SettableRpcFuture<String> future = new SettableRpcFuture<>();
    future.set("done");

    warning.interceptUnaryUnary(
        (details, request) -> future, details(MethodType.UNARY_UNARY), "hi");

    assertThat(records).hasSize(2);
    assertEquals(Level.WARNING, records.get(0).getLevel());
    assertEquals(Level.WARNING, records.get(1).getLevel());
  }

  @Test
  public void passesThroughWhenLevelDisabled() {
    logger.setLevel(Level.INFO);
    ResponseStream<String> stream = new FakeResponseStream<>(Iterators.forArray("a"));

    ResponseStream<String> responses = interceptor.interceptUnaryStream(
        (details, request) -> stream, details(MethodType.UNARY_STREAM), "hi");

    assertSame(stream, responses);
    assertThat(records).isEmpty();
  }

  @Test
  public void restrictsMethodTypes() {
    LoggingClientInterceptor unaryOnly = LoggingClientInterceptor.newBuilder()
        .setMethodTypes(EnumSet.of(MethodType.UNARY_UNARY))
        .build();

    assertThat(unaryOnly.interceptedMethodTypes()).containsExactly(MethodType.UNARY_UNARY);
    LoggingClientInterceptor.Builder builder = LoggingClientInterceptor.newBuilder();
    assertThrows(IllegalArgumentException.class,
        () -> builder.setMethodTypes(EnumSet.noneOf(MethodType.class)));
    assertTrue(records.isEmpty());
  }

  private List<String> messages() {
    List<String> messages = new ArrayList<>();
    for (int i = 0; i < records.size(); i++) {
      messages.add(message(i));
    }
    return messages;
  }

  private String message(int index) {
    return new SimpleFormatter().formatMessage(records.get(index));
  }

  private static CallDetails<String, String> details(MethodType methodType) {
    return CallDetails.<String, String>newBuilder()
        .setMethod(METHOD)
        .setMethodType(methodType)
        .setRequestMarshaller(StringMarshaller.INSTANCE)
        .setResponseMarshaller(StringMarshaller.INSTANCE)
        .setMetadata(Metadata.EMPTY)
        .build();
  }
}
