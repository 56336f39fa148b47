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

import io.docmap.node.interfaces.Node;
import io.docmap.service.map.CanonicalValue;
import io.docmap.service.map.Mapping;

import static java.util.Objects.requireNonNull;

/**
 * Entry points to write a document tree.
 */
public final class DocumentWriters {

  private DocumentWriters() {
    throw new AssertionError();
  }

  /**
   * Builds the canonical value of a node with the default labels.
   *
   * @param node the root of the subtree
   * @return the canonical value
   * @throws io.docmap.exception.UnsupportedNodeKindException if a node has an unsupported kind
   */
  public static Mapping build(final Node node) {
    return build(node, DocumentWriterOptions.DEFAULT);
  }

  /**
   * Builds the canonical value of a node.
   *
   * @param node    the root of the subtree
   * @param options options, only the labels are used
   * @return the canonical value
   * @throws io.docmap.exception.UnsupportedNodeKindException if a node has an unsupported kind
   */
  public static Mapping build(final Node node, final DocumentWriterOptions options) {
    return options.newMapWriter().write(node);
  }

  /**
   * Renders a canonical value as JSON.
   *
   * @param value   the value
   * @param options rendering options
   * @return the JSON string
   */
  public static String render(final CanonicalValue value, final DocumentWriterOptions options) {
    return options.newJsonSerializer().serialize(value);
  }

  /**
   * Builds and renders a node as JSON.
   *
   * @param node    the root of the subtree
   * @param options options
   * @return the JSON string
   * @throws io.docmap.exception.UnsupportedNodeKindException if a node has an unsupported kind
   */
  public static String writeText(final Node node, final DocumentWriterOptions options) {
    return render(build(node, options), options);
  }

  /**
   * Writes a node in the format of the options.
   *
   * @param node    the root of the subtree
   * @param options options
   * @return a {@code Map<String, Object>} for {@link WriterFormat#MAP}, a {@code String} for
   *         {@link WriterFormat#JSON}
   * @throws io.docmap.exception.UnsupportedNodeKindException if a node has an unsupported kind
   */
  public static Object write(final Node node, final DocumentWriterOptions options) {
    requireNonNull(options);
    return switch (options.format()) {
      case MAP -> build(node, options).toJava();
      case JSON -> writeText(node, options);
    };
  }
}
