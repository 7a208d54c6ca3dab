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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An ordered sequence of key/value pairs sent along with a call.
 *
 * <p>Keys are case insensitive and are stored in lower case. A key may appear more than once;
 * the order in which entries were added is preserved and is significant to the receiver.
 *
 * <p>Instances are immutable. Methods that "add" entries return a new instance and leave the
 * receiver untouched.
 */
@Immutable
public final class Metadata implements Iterable<Metadata.Entry> {

  /**
   * Metadata without any entries.
   */
  public static final Metadata EMPTY = new Metadata(ImmutableList.<Entry>of());

  private final ImmutableList<Entry> entries;

  private Metadata(ImmutableList<Entry> entries) {
    this.entries = entries;
  }

  /**
   * Returns metadata holding a single entry.
   */
  public static Metadata of(String key, String value) {
    return new Metadata(ImmutableList.of(new Entry(key, value)));
  }

  /**
   * Returns metadata holding the two given entries, in order.
   */
  public static Metadata of(String key1, String value1, String key2, String value2) {
    return new Metadata(ImmutableList.of(new Entry(key1, value1), new Entry(key2, value2)));
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns a copy of this metadata with the given entry appended after all existing entries.
   */
  public Metadata with(String key, String value) {
    return toBuilder().add(key, value).build();
  }

  /**
   * Returns a copy of this metadata with all entries of {@code other} appended, in order.
   */
  public Metadata withAll(Metadata other) {
    checkNotNull(other, "other");
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return toBuilder().addAll(other).build();
  }

  public Builder toBuilder() {
    return new Builder().addAll(this);
  }

  /**
   * Returns the last value added for {@code key}, or {@code null} if there is none.
   */
  @Nullable
  public String get(String key) {
    String normalized = normalize(key);
    String value = null;
    for (Entry entry : entries) {
      if (entry.key.equals(normalized)) {
        value = entry.value;
      }
    }
    return value;
  }

  /**
   * Returns every value added for {@code key}, in the order they were added.
   */
  public List<String> getAll(String key) {
    String normalized = normalize(key);
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (Entry entry : entries) {
      if (entry.key.equals(normalized)) {
        values.add(entry.value);
      }
    }
    return values.build();
  }

  /**
   * Returns {@code true} if at least one entry uses {@code key}.
   */
  public boolean containsKey(String key) {
    return get(key) != null;
  }

  /**
   * Returns the distinct keys in order of first appearance.
   */
  public Set<String> keys() {
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (Entry entry : entries) {
      keys.add(entry.key);
    }
    return keys.build();
  }

  public List<Entry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Iterator<Entry> iterator() {
    return entries.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Metadata)) {
      return false;
    }
    return entries.equals(((Metadata) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "Metadata(" + entries + ")";
  }

  private static String normalize(String key) {
    checkNotNull(key, "key");
    checkArgument(!key.isEmpty(), "key must not be empty");
    return key.toLowerCase(Locale.ROOT);
  }

  /**
   * A single key/value pair.
   */
  @Immutable
  public static final class Entry {
    private final String key;
    private final String value;

    Entry(String key, String value) {
      this.key = normalize(key);
      this.value = checkNotNull(value, "value");
    }

    public String getKey() {
      return key;
    }

    public String getValue() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Entry)) {
        return false;
      }
      Entry that = (Entry) o;
      return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(key, value);
    }

    @Override
    public String toString() {
      return key + "=" + value;
    }
  }

  /**
   * Collects entries in order. Not thread-safe.
   */
  public static final class Builder {
    private final ImmutableList.Builder<Entry> entries = ImmutableList.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(String key, String value) {
      entries.add(new Entry(key, value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Metadata metadata) {
      entries.addAll(checkNotNull(metadata, "metadata").entries);
      return this;
    }

    public Metadata build() {
      ImmutableList<Entry> built = entries.build();
      return built.isEmpty() ? EMPTY : new Metadata(built);
    }
  }
}
