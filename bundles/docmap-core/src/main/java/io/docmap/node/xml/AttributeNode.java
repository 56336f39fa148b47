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

package io.docmap.node.xml;

import com.google.common.base.MoreObjects;
import io.docmap.node.NodeKind;
import io.docmap.node.interfaces.NameNode;
import io.docmap.node.interfaces.Node;
import io.docmap.node.interfaces.ValueNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An attribute of an element. Attributes are not children of their element, the element owns them
 * in a separate ordered set.
 */
public final class AttributeNode implements NameNode, ValueNode {

  private final String name;

  private String value;

  private @Nullable ElementNode owner;

  /**
   * Constructor.
   *
   * @param name  qualified name of the attribute
   * @param value string value of the attribute
   */
  public AttributeNode(final String name, final String value) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ATTRIBUTE;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getValue() {
    return value;
  }

  @Override
  public void setValue(final String value) {
    this.value = requireNonNull(value);
  }

  /**
   * Gets the element the attribute belongs to.
   *
   * @return the owner element or {@code null}
   */
  public @Nullable ElementNode getOwnerElement() {
    return owner;
  }

  void setOwnerElement(final ElementNode owner) {
    this.owner = owner;
  }

  @Override
  public @Nullable Node getParent() {
    return owner;
  }

  @Override
  public List<Node> getChildren() {
    return List.of();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("value", value).toString();
  }
}
