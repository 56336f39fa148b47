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

import io.docmap.service.map.CanonicalValue;
import io.docmap.service.map.Mapping;
import io.docmap.service.map.Scalar;
import io.docmap.service.map.Sequence;
import io.docmap.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;
import static io.docmap.service.json.serialize.JsonSerializerProperties.S_INDENT;
import static io.docmap.service.json.serialize.JsonSerializerProperties.S_INDENT_SPACES;
import static io.docmap.service.json.serialize.JsonSerializerProperties.S_NEWLINE;
import static io.docmap.service.json.serialize.JsonSerializerProperties.S_OFFSET;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Serializes a {@link CanonicalValue} into the JSON-format.
 * </p>
 *
 * <p>
 * Without pretty printing no whitespace is emitted at all. With pretty printing each entry of a
 * mapping and each item of a sequence starts a new line, indented by
 * {@code max(0, level + offset) * indentSpaces} spaces, where the root value is on level 0. Nested
 * mappings which are empty or hold a single entry whose value again fits on one line are kept on
 * one line, for instance {@code { "@name": "xxx" }}.
 * </p>
 */
public final class JsonSerializer {

  /**
   * {@link LogWrapper} reference.
   */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(JsonSerializer.class));

  /**
   * Indent output.
   */
  private final boolean indent;

  /**
   * Number of spaces to indent.
   */
  private final int indentSpaces;

  /**
   * Number of levels added to each level, may be negative.
   */
  private final int offset;

  /**
   * Line separator.
   */
  private final String newLine;

  /**
   * Private constructor.
   *
   * @param builder builder of the JSON serializer
   */
  private JsonSerializer(final Builder builder) {
    indent = builder.indent;
    indentSpaces = builder.indentSpaces;
    offset = builder.offset;
    newLine = builder.newLine;
  }

  /**
   * Serializes a value.
   *
   * @param value the value to serialize
   * @return the JSON string
   */
  public String serialize(final CanonicalValue value) {
    final StringBuilder out = new StringBuilder();
    serialize(value, out);
    return out.toString();
  }

  /**
   * Serializes a value.
   *
   * @param value the value to serialize
   * @param out   the target to append to
   * @throws UncheckedIOException if the target fails
   */
  public void serialize(final CanonicalValue value, final Appendable out) {
    requireNonNull(value);
    requireNonNull(out);
    try {
      new Emitter(out).emitRoot(value);
    } catch (final IOException e) {
      LOGWRAPPER.error(e.getMessage(), e);
      throw new UncheckedIOException(e);
    }
  }

  public boolean isPrettyPrint() {
    return indent;
  }

  public int getIndentSpaces() {
    return indentSpaces;
  }

  public int getOffset() {
    return offset;
  }

  /**
   * Determines if a mapping fits on a single line: it is empty or holds exactly one entry whose
   * value is a scalar or again such a mapping.
   */
  private static boolean isLeaf(final Mapping mapping) {
    if (mapping.isEmpty()) {
      return true;
    }
    if (mapping.size() > 1) {
      return false;
    }
    final CanonicalValue value = mapping.entries().values().iterator().next();
    return value instanceof Scalar || (value instanceof Mapping nested && isLeaf(nested));
  }

  /**
   * Writes a single value. Holds the state of one serialization.
   */
  private final class Emitter {

    /**
     * Target to append to.
     */
    private final Appendable out;

    private Emitter(final Appendable out) {
      this.out = out;
    }

    void emitRoot(final CanonicalValue value) throws IOException {
      indent(0);
      emitValue(value, 0);
    }

    private void emitValue(final CanonicalValue value, final int level) throws IOException {
      if (value instanceof Scalar scalar) {
        out.append(StringValue.quote(scalar.value()));
      } else if (value instanceof Mapping mapping) {
        emitMapping(mapping, level);
      } else if (value instanceof Sequence sequence) {
        emitSequence(sequence, level);
      } else {
        throw new IllegalStateException("Value kind not known: " + value.getClass().getName());
      }
    }

    private void emitMapping(final Mapping mapping, final int level) throws IOException {
      final boolean inline = indent && (mapping.isEmpty() || (level > 0 && isLeaf(mapping)));

      appendObjectStart();
      boolean first = true;
      for (final Map.Entry<String, CanonicalValue> entry : mapping.entries().entrySet()) {
        if (!first) {
          appendSeparator();
        }
        first = false;

        if (inline) {
          out.append(' ');
        } else {
          newLine(level + 1);
        }
        appendObjectKey(StringValue.quote(entry.getKey()));
        emitValue(entry.getValue(), level + 1);
      }
      if (inline) {
        out.append(' ');
      } else {
        newLine(level);
      }
      appendObjectEnd();
    }

    private void emitSequence(final Sequence sequence, final int level) throws IOException {
      appendArrayStart();
      if (sequence.isEmpty()) {
        if (indent) {
          out.append(' ');
        }
        appendArrayEnd();
        return;
      }

      boolean first = true;
      for (final CanonicalValue item : sequence.items()) {
        if (!first) {
          appendSeparator();
        }
        first = false;
        newLine(level + 1);
        emitValue(item, level + 1);
      }
      newLine(level);
      appendArrayEnd();
    }

    /**
     * Indentation of output.
     *
     * @param level the nesting level
     * @throws IOException if can't indent output
     */
    private void indent(final int level) throws IOException {
      if (indent) {
        final int spaces = Math.max(0, level + offset) * indentSpaces;
        for (int i = 0; i < spaces; i++) {
          out.append(' ');
        }
      }
    }

    private void newLine(final int level) throws IOException {
      if (indent) {
        out.append(newLine);
        indent(level);
      }
    }

    private void appendObjectStart() throws IOException {
      out.append('{');
    }

    private void appendObjectEnd() throws IOException {
      out.append('}');
    }

    private void appendArrayStart() throws IOException {
      out.append('[');
    }

    private void appendArrayEnd() throws IOException {
      out.append(']');
    }

    private void appendObjectKey(final String key) throws IOException {
      out.append(key);
      if (indent) {
        out.append(": ");
      } else {
        out.append(':');
      }
    }

    private void appendSeparator() throws IOException {
      out.append(',');
    }
  }

  /**
   * Creates a new builder, by default without pretty printing.
   *
   * @return a new builder
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Creates a new builder, initialized from properties.
   *
   * @param properties {@link JsonSerializerProperties} to use
   * @return a new builder
   */
  public static Builder newBuilder(final JsonSerializerProperties properties) {
    return new Builder(properties);
  }

  /**
   * Builder to setup the {@link JsonSerializer}.
   */
  public static final class Builder {
    /**
     * Intermediate boolean for indentation, not necessary.
     */
    private boolean indent;

    /**
     * Intermediate number of spaces to indent, not necessary.
     */
    private int indentSpaces = 2;

    /**
     * Number of levels added to each level.
     */
    private int offset;

    /**
     * Line separator.
     */
    private String newLine = "\n";

    /**
     * Constructor.
     */
    public Builder() {
    }

    /**
     * Constructor.
     *
     * @param properties {@link JsonSerializerProperties} to use
     */
    public Builder(final JsonSerializerProperties properties) {
      final ConcurrentMap<?, ?> map = requireNonNull(properties.getProps());
      indent = requireNonNull((Boolean) map.get(S_INDENT[0]));
      indentSpaces(requireNonNull((Integer) map.get(S_INDENT_SPACES[0])));
      offset = requireNonNull((Integer) map.get(S_OFFSET[0]));
      newLine(requireNonNull((String) map.get(S_NEWLINE[0])));
    }

    /**
     * Pretty prints the output.
     *
     * @return this reference
     */
    public Builder prettyPrint() {
      indent = true;
      return this;
    }

    /**
     * Sets if the output is pretty printed or not.
     *
     * @param prettyPrint {@code true}, if the output is pretty printed
     * @return this reference
     */
    public Builder prettyPrint(final boolean prettyPrint) {
      indent = prettyPrint;
      return this;
    }

    /**
     * Sets the number of spaces per level.
     *
     * @param indentSpaces number of spaces, at least zero
     * @return this reference
     */
    public Builder indentSpaces(final int indentSpaces) {
      checkArgument(indentSpaces >= 0, "indentSpaces must be >= 0!");
      this.indentSpaces = indentSpaces;
      return this;
    }

    /**
     * Sets the number of levels added to each level before indenting. A negative offset reduces
     * the indentation, never below zero.
     *
     * @param offset the offset
     * @return this reference
     */
    public Builder offset(final int offset) {
      this.offset = offset;
      return this;
    }

    /**
     * Sets the line separator used for pretty printing.
     *
     * @param newLine the line separator
     * @return this reference
     */
    public Builder newLine(final String newLine) {
      this.newLine = requireNonNull(newLine);
      return this;
    }

    /**
     * Building new {@link JsonSerializer} instance.
     *
     * @return a new {@link JsonSerializer} instance
     */
    public JsonSerializer build() {
      return new JsonSerializer(this);
    }
  }
}
