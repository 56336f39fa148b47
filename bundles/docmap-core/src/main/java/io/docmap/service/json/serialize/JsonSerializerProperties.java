/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.docmap.service.json.serialize;

import io.docmap.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * JsonSerializer properties.
 * </p>
 */
public final class JsonSerializerProperties {

  // ============== Class constants. =================

  /**
   * {@link LogWrapper} reference.
   */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(JsonSerializerProperties.class));

  /** NO maps to false. */
  private static final boolean NO = false;

  // ============ Serialization constants. ===============

  /** Serialization parameter: yes/no. */
  public static final Object[] S_INDENT = {"indent", NO};

  /** Specific serialization parameter: number of spaces to indent. */
  public static final Object[] S_INDENT_SPACES = {"indent-spaces", 2};

  /** Specific serialization parameter: number of levels added to each level, may be negative. */
  public static final Object[] S_OFFSET = {"offset", 0};

  /** Specific serialization parameter: line separator. */
  public static final Object[] S_NEWLINE = {"newline", "\n"};

  /** Properties. */
  private final ConcurrentMap<String, Object> props = new ConcurrentHashMap<>();

  /**
   * Constructor.
   */
  public JsonSerializerProperties() {
    try {
      for (final Field f : getClass().getFields()) {
        final Object obj = f.get(null);
        if (!(obj instanceof final Object[] arr)) {
          continue;
        }
        props.put(arr[0].toString(), arr[1]);
      }
    } catch (final IllegalArgumentException | IllegalAccessException e) {
      LOGWRAPPER.error(e.getMessage(), e);
      throw new IllegalStateException(e);
    }
  }

  /**
   * Sets a property.
   *
   * @param property one of the {@code S_*} constants
   * @param value    the new value
   * @return this properties instance
   */
  public JsonSerializerProperties set(final Object[] property, final Object value) {
    requireNonNull(value);
    checkArgument(property[1].getClass().isInstance(value), "Property %s requires a value of type %s: %s",
                  property[0], property[1].getClass().getSimpleName(), value);
    props.put(property[0].toString(), value);
    return this;
  }

  /**
   * Get properties map.
   *
   * @return ConcurrentMap with key/value property pairs.
   */
  public ConcurrentMap<String, Object> getProps() {
    return props;
  }
}
