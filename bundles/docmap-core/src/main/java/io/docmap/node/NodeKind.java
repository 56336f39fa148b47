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

package io.docmap.node;

import java.util.HashMap;
import java.util.Map;

/**
 * Enumeration for different nodes. All nodes are determined by a unique id, the DOM node type
 * number.
 */
public enum NodeKind {

  /**
   * Node kind is element.
   */
  ELEMENT((byte) 1, "#element"),

  /**
   * Node kind is attribute.
   */
  ATTRIBUTE((byte) 2, "#attribute"),

  /**
   * Node kind is text.
   */
  TEXT((byte) 3, "#text"),

  /**
   * Node kind is a CDATA section.
   */
  CDATA_SECTION((byte) 4, "#cdata-section"),

  /**
   * Node kind is an entity reference.
   */
  ENTITY_REFERENCE((byte) 5, "#entity-reference"),

  /**
   * Node kind is an entity.
   */
  ENTITY((byte) 6, "#entity"),

  /**
   * Node kind is processing instruction.
   */
  PROCESSING_INSTRUCTION((byte) 7, "#processing-instruction"),

  /**
   * Node kind is comment.
   */
  COMMENT((byte) 8, "#comment"),

  /**
   * Node kind is document root.
   */
  DOCUMENT((byte) 9, "#document"),

  /**
   * Node kind is a document type declaration.
   */
  DOCUMENT_TYPE((byte) 10, "#doctype"),

  /**
   * Node kind is a document fragment.
   */
  DOCUMENT_FRAGMENT((byte) 11, "#document-fragment"),

  /**
   * Node kind is a notation.
   */
  NOTATION((byte) 12, "#notation");

  /**
   * Identifier.
   */
  private final byte id;

  /**
   * Generic node name of nodes of this kind.
   */
  private final String defaultName;

  /**
   * Mapping of keys -> nodes.
   */
  private static final Map<Byte, NodeKind> INSTANCEFORID = new HashMap<>();

  static {
    for (final NodeKind node : values()) {
      INSTANCEFORID.put(node.id, node);
    }
  }

  /**
   * Constructor.
   *
   * @param id          unique identifier
   * @param defaultName generic node name
   */
  NodeKind(final byte id, final String defaultName) {
    this.id = id;
    this.defaultName = defaultName;
  }

  /**
   * Get the nodeKind.
   *
   * @return the unique kind
   */
  public byte getId() {
    return id;
  }

  /**
   * Get the generic node name, used by nodes that do not carry a name of their own.
   *
   * @return the generic node name
   */
  public String getDefaultName() {
    return defaultName;
  }

  /**
   * Public method to get the related node based on the identifier.
   *
   * @param id the identifier for the node
   * @return the related node or {@code null} if no kind uses the identifier
   */
  public static NodeKind getKind(final byte id) {
    return INSTANCEFORID.get(id);
  }
}
