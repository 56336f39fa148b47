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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Node representing an XML element. Attributes are kept unique by qualified name in insertion
 * order.
 */
public final class ElementNode extends AbstractStructNode implements NameNode {

  private final String name;

  /**
   * Attributes, keyed by qualified name.
   */
  private final Map<String, AttributeNode> attributes = new LinkedHashMap<>();

  /**
   * Constructor.
   *
   * @param name qualified name of the element
   */
  public ElementNode(final String name) {
    requireNonNull(name);
    checkArgument(!name.isEmpty(), "Element name must not be empty.");
    this.name = name;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * Sets an attribute. If an attribute with the same name exists its value is replaced and it
   * keeps its position.
   *
   * @param attributeName  qualified name of the attribute
   * @param attributeValue string value
   * @return the new or updated attribute
   */
  public AttributeNode setAttribute(final String attributeName, final String attributeValue) {
    requireNonNull(attributeName);
    checkArgument(!attributeName.isEmpty(), "Attribute name must not be empty.");
    final AttributeNode existing = attributes.get(attributeName);
    if (existing != null) {
      existing.setValue(attributeValue);
      return existing;
    }
    final AttributeNode attribute = new AttributeNode(attributeName, attributeValue);
    attribute.setOwnerElement(this);
    attributes.put(attributeName, attribute);
    return attribute;
  }

  /**
   * Gets an attribute by its qualified name.
   *
   * @param attributeName qualified name
   * @return the attribute or {@code null}
   */
  public @Nullable AttributeNode getAttribute(final String attributeName) {
    return attributes.get(attributeName);
  }

  /**
   * Gets the attributes in insertion order.
   *
   * @return an unmodifiable view of the attributes
   */
  @Override
  public Collection<AttributeNode> getAttributes() {
    return Collections.unmodifiableCollection(attributes.values());
  }

  public int getAttributeCount() {
    return attributes.size();
  }

  @Override
  protected void checkChild(final AbstractNode child) {
    checkArgument(!(child instanceof XmlDocumentRootNode) && !(child instanceof DocumentTypeNode),
                  "An element must not contain %s nodes.", child.getKind());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("attributeCount", attributes.size())
                      .add("childCount", getChildCount())
                      .toString();
  }
}
