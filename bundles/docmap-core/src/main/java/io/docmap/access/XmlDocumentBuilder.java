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

package io.docmap.access;

import io.docmap.node.interfaces.Node;
import io.docmap.node.xml.AbstractStructNode;
import io.docmap.node.xml.CDataSectionNode;
import io.docmap.node.xml.CommentNode;
import io.docmap.node.xml.DocumentTypeNode;
import io.docmap.node.xml.ElementNode;
import io.docmap.node.xml.PINode;
import io.docmap.node.xml.TextNode;
import io.docmap.node.xml.XmlDocumentRootNode;
import io.docmap.service.DocumentWriterOptions;
import io.docmap.service.DocumentWriters;
import io.docmap.service.WriterFormat;
import io.docmap.service.map.Mapping;
import io.docmap.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Builds a document tree through a cursor. Inserting an element moves the cursor to the new
 * element, inserting attributes and leaf nodes leaves it where it is.
 * </p>
 *
 * <pre>
 * final String json = XmlDocumentBuilder.create()
 *                                       .insertElementAsLastChild("people")
 *                                       .insertElementAsLastChild("person", Map.of("name", "xxx"))
 *                                       .moveToParent()
 *                                       .insertTextAsLastChild("hello")
 *                                       .toJson();
 * </pre>
 *
 * <p>
 * Values of any type are converted with {@link String#valueOf(Object)}. A {@link Supplier} is
 * evaluated once on insertion and its result converted.
 * </p>
 */
public final class XmlDocumentBuilder {

  /**
   * {@link LogWrapper} reference.
   */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(XmlDocumentBuilder.class));

  private final XmlDocumentRootNode document;

  /**
   * The node the cursor is located at, either the document or an element.
   */
  private AbstractStructNode current;

  private XmlDocumentBuilder(final XmlDocumentRootNode document) {
    this.document = document;
    this.current = document;
  }

  /**
   * Creates a builder of a new, empty document. The cursor is located at the document root.
   *
   * @return a new builder
   */
  public static XmlDocumentBuilder create() {
    return new XmlDocumentBuilder(new XmlDocumentRootNode());
  }

  /**
   * Inserts an element as the last child of the current node and moves to it.
   *
   * @param name qualified name
   * @return this builder
   * @throws IllegalStateException if the current node is the document which already has a document
   *         element
   */
  public XmlDocumentBuilder insertElementAsLastChild(final String name) {
    current = current.appendChild(new ElementNode(name));
    return this;
  }

  /**
   * Inserts an element with attributes as the last child of the current node and moves to it.
   *
   * @param name       qualified name
   * @param attributes attributes in iteration order of the map
   * @return this builder
   */
  public XmlDocumentBuilder insertElementAsLastChild(final String name, final Map<String, ?> attributes) {
    requireNonNull(attributes);
    insertElementAsLastChild(name);
    return insertAttributes(attributes);
  }

  /**
   * Sets an attribute of the current element. Setting an existing attribute replaces its value.
   *
   * @param name  qualified name
   * @param value the value
   * @return this builder
   * @throws IllegalStateException if the cursor is not located at an element
   */
  public XmlDocumentBuilder insertAttribute(final String name, final Object value) {
    checkState(current instanceof ElementNode, "Attributes can only be inserted on elements, not on %s.",
               current.getKind());
    ((ElementNode) current).setAttribute(name, stringValue(value));
    return this;
  }

  /**
   * Sets attributes of the current element.
   *
   * @param attributes attributes in iteration order of the map
   * @return this builder
   */
  public XmlDocumentBuilder insertAttributes(final Map<String, ?> attributes) {
    attributes.forEach(this::insertAttribute);
    return this;
  }

  public XmlDocumentBuilder insertTextAsLastChild(final Object value) {
    current.appendChild(new TextNode(stringValue(value)));
    return this;
  }

  public XmlDocumentBuilder insertCommentAsLastChild(final Object value) {
    current.appendChild(new CommentNode(stringValue(value)));
    return this;
  }

  public XmlDocumentBuilder insertCDataAsLastChild(final Object value) {
    current.appendChild(new CDataSectionNode(stringValue(value)));
    return this;
  }

  /**
   * Inserts a processing instruction as the last child of the current node.
   *
   * @param target the target
   * @param data   the content
   * @return this builder
   */
  public XmlDocumentBuilder insertPIAsLastChild(final String target, final Object data) {
    current.appendChild(new PINode(target, stringValue(data)));
    return this;
  }

  /**
   * Inserts a document type declaration into the document. The cursor doesn't move.
   *
   * @param name     name of the document type
   * @param publicId public identifier
   * @param systemId system identifier
   * @return this builder
   */
  public XmlDocumentBuilder insertDocumentType(final String name, final String publicId, final String systemId) {
    document.appendChild(new DocumentTypeNode(name, publicId, systemId));
    return this;
  }

  /**
   * Moves the cursor to the parent of the current node.
   *
   * @return this builder
   * @throws IllegalStateException if the cursor is located at the document root
   */
  public XmlDocumentBuilder moveToParent() {
    final Node parent = current.getParent();
    checkState(parent != null, "The document root has no parent.");
    current = (AbstractStructNode) parent;
    return this;
  }

  public XmlDocumentBuilder moveToDocumentRoot() {
    current = document;
    return this;
  }

  /**
   * Moves the cursor to the document element.
   *
   * @return this builder
   * @throws IllegalStateException if the document is empty
   */
  public XmlDocumentBuilder moveToDocumentElement() {
    final ElementNode documentElement = document.getDocumentElement();
    checkState(documentElement != null, "The document has no document element.");
    current = documentElement;
    return this;
  }

  public Node getCurrentNode() {
    return current;
  }

  public XmlDocumentRootNode getDocument() {
    return document;
  }

  /**
   * Writes the whole document, regardless of the cursor position.
   *
   * @param options the write options
   * @return a {@code Map<String, Object>} or a {@code String}, depending on the format
   */
  public Object end(final DocumentWriterOptions options) {
    LOGWRAPPER.debug("Writing document with options {}.", options);
    return DocumentWriters.write(document, options);
  }

  /**
   * Builds the canonical value of the whole document with the default labels.
   *
   * @return the canonical value
   */
  public Mapping toMapping() {
    return DocumentWriters.build(document);
  }

  /**
   * Writes the whole document into plain Java collections.
   *
   * @return the document as insertion ordered maps, lists and strings
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> toMap() {
    return (Map<String, Object>) end(DocumentWriterOptions.newBuilder().format(WriterFormat.MAP).build());
  }

  /**
   * Writes the whole document as compact JSON.
   *
   * @return the JSON string
   */
  public String toJson() {
    return (String) end(DocumentWriterOptions.DEFAULT);
  }

  /**
   * Writes the whole document as JSON.
   *
   * @param options the write options, the format is ignored
   * @return the JSON string
   */
  public String toJson(final DocumentWriterOptions options) {
    return (String) end(options.toBuilder().format(WriterFormat.JSON).build());
  }

  private static String stringValue(final Object value) {
    requireNonNull(value);
    if (value instanceof Supplier<?> supplier) {
      return String.valueOf(requireNonNull(supplier.get()));
    }
    return String.valueOf(value);
  }
}
