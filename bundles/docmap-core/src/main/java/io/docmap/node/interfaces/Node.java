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

package io.docmap.node.interfaces;

import io.docmap.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * A node of an in-memory document tree. Children are owned by their parent, the parent reference
 * is a plain back-reference.
 */
public interface Node {

  /**
   * Gets the kind of the node.
   *
   * @return kind of node
   */
  NodeKind getKind();

  /**
   * Gets the name of the node, the qualified name for elements and attributes, the target for
   * processing instructions and the generic kind name otherwise.
   *
   * @return the node name
   */
  String getNodeName();

  /**
   * Gets the parent node.
   *
   * @return the parent or {@code null} for a detached node
   */
  @Nullable
  Node getParent();

  /**
   * Gets the children in document order.
   *
   * @return an unmodifiable view of the children
   */
  List<Node> getChildren();

  /**
   * Gets the attributes in insertion order. Only elements have attributes.
   *
   * @return an unmodifiable view of the attributes, each of kind {@link NodeKind#ATTRIBUTE}
   */
  default Collection<? extends Node> getAttributes() {
    return List.of();
  }

  /**
   * Determines if the node has a parent.
   *
   * @return {@code true}, if the node has a parent, {@code false} otherwise
   */
  default boolean hasParent() {
    return getParent() != null;
  }

  /**
   * Determines if the node has children.
   *
   * @return {@code true}, if the node has at least one child, {@code false} otherwise
   */
  default boolean hasChildren() {
    return !getChildren().isEmpty();
  }

  /**
   * Gets the number of children.
   *
   * @return number of children
   */
  default int getChildCount() {
    return getChildren().size();
  }
}
