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

package io.docmap.service;

import com.google.common.base.MoreObjects;
import io.docmap.service.json.serialize.JsonSerializer;
import io.docmap.service.map.MapWriter;
import io.docmap.service.map.NodeLabels;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Immutable options of a write operation.
 */
public final class DocumentWriterOptions {

  /**
   * Compact JSON with the default labels.
   */
  public static final DocumentWriterOptions DEFAULT = newBuilder().build();

  private final WriterFormat format;

  private final boolean prettyPrint;

  private final int indentSpaces;

  private final int offset;

  private final String newLine;

  private final NodeLabels labels;

  private DocumentWriterOptions(final Builder builder) {
    format = builder.format;
    prettyPrint = builder.prettyPrint;
    indentSpaces = builder.indentSpaces;
    offset = builder.offset;
    newLine = builder.newLine;
    labels = builder.labels;
  }

  public WriterFormat format() {
    return format;
  }

  public boolean prettyPrint() {
    return prettyPrint;
  }

  public int indentSpaces() {
    return indentSpaces;
  }

  public int offset() {
    return offset;
  }

  public String newLine() {
    return newLine;
  }

  public NodeLabels labels() {
    return labels;
  }

  /**
   * Creates the structure builder configured by these options.
   *
   * @return a new map writer
   */
  public MapWriter newMapWriter() {
    return MapWriter.newBuilder().labels(labels).build();
  }

  /**
   * Creates the text renderer configured by these options.
   *
   * @return a new JSON serializer
   */
  public JsonSerializer newJsonSerializer() {
    return JsonSerializer.newBuilder()
                         .prettyPrint(prettyPrint)
                         .indentSpaces(indentSpaces)
                         .offset(offset)
                         .newLine(newLine)
                         .build();
  }

  /**
   * Creates a builder initialized with these options.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return newBuilder().format(format)
                       .prettyPrint(prettyPrint)
                       .indentSpaces(indentSpaces)
                       .offset(offset)
                       .newLine(newLine)
                       .labels(labels);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("format", format)
                      .add("prettyPrint", prettyPrint)
                      .add("indentSpaces", indentSpaces)
                      .add("offset", offset)
                      .add("labels", labels)
                      .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder of {@link DocumentWriterOptions}.
   */
  public static final class Builder {

    private WriterFormat format = WriterFormat.JSON;

    private boolean prettyPrint;

    private int indentSpaces = 2;

    private int offset;

    private String newLine = "\n";

    private NodeLabels labels = NodeLabels.DEFAULT;

    private Builder() {
    }

    public Builder format(final WriterFormat format) {
      this.format = requireNonNull(format);
      return this;
    }

    public Builder prettyPrint(final boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public Builder indentSpaces(final int indentSpaces) {
      checkArgument(indentSpaces >= 0, "indentSpaces must be >= 0!");
      this.indentSpaces = indentSpaces;
      return this;
    }

    public Builder offset(final int offset) {
      this.offset = offset;
      return this;
    }

    public Builder newLine(final String newLine) {
      this.newLine = requireNonNull(newLine);
      return this;
    }

    public Builder labels(final NodeLabels labels) {
      this.labels = requireNonNull(labels);
      return this;
    }

    public DocumentWriterOptions build() {
      return new DocumentWriterOptions(this);
    }
  }
}
