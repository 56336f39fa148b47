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

package io.docmap.service.map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.docmap.exception.DocMapException;
import io.docmap.node.NodeKind;
import io.docmap.node.interfaces.NameNode;
import io.docmap.node.interfaces.Node;
import io.docmap.node.interfaces.ValueNode;
import io.docmap.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Converts a document tree into a {@link CanonicalValue}.
 * </p>
 *
 * <p>
 * Attributes are stored first, as {@code @name}, followed by the children in document order.
 * Text children are numbered {@code #1, #2, ...}, comments, processing instructions and CDATA
 * sections are stored under {@code !}, {@code ?} and {@code $}. Siblings sharing a label are
 * grouped into a {@link Sequence} at the position of the first occurrence. An element without
 * attributes and with a single text child collapses into the text itself, an element without
 * attributes and children into an empty {@link Mapping}.
 * </p>
 *
 * <p>
 * The writer is stateless and may be shared. The tree must not be modified while it is written.
 * </p>
 */
public final class MapWriter {

  /**
   * {@link LogWrapper} reference.
   */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(MapWriter.class));

  /**
   * Labels of the non-element nodes.
   */
  private final NodeLabels labels;

  /**
   * Private constructor.
   *
   * @param builder builder of the writer
   */
  private MapWriter(final Builder builder) {
    labels = builder.labels;
  }

  /**
   * Writes a node and its subtree. A document is represented by its document element, an element
   * by a single entry keyed by its name and any other node by a single entry keyed by its label.
   *
   * @param node the root of the subtree to write
   * @return the canonical value
   * @throws io.docmap.exception.UnsupportedNodeKindException if a node of the subtree has an
   *         unsupported kind
   */
  public Mapping write(final Node node) {
    requireNonNull(node);
    LOGWRAPPER.debug("Writing subtree of {}.", node);

    final Mapping mapping = switch (NodeKindValidator.checkSupported(node)) {
      case DOCUMENT -> writeDocument(node);
      case ELEMENT -> Mapping.of(nameOf(node), buildElement(node));
      case TEXT -> Mapping.of(labels.textKey(1), Scalar.of(valueOf(node)));
      case COMMENT, PROCESSING_INSTRUCTION, CDATA_SECTION -> Mapping.of(fixedLabel(node.getKind()), buildLeaf(node));
      case DOCUMENT_TYPE -> Mapping.empty();
      // $CASES-OMITTED$
      default -> throw new IllegalStateException("Node kind not known!");
    };

    if (LOGWRAPPER.isDebugEnabled()) {
      LOGWRAPPER.debug("Wrote {} nodes of the subtree of {} into {} top-level entries.", countNodes(node), node,
                       mapping.size());
    }
    return mapping;
  }

  private static int countNodes(final Node node) {
    int count = 1 + node.getAttributes().size();
    for (final Node child : node.getChildren()) {
      count += countNodes(child);
    }
    return count;
  }

  /**
   * Writes a node and its subtree into plain Java collections.
   *
   * @param node the root of the subtree to write
   * @return insertion ordered maps, lists and strings
   * @see CanonicalValue#toJava()
   */
  public Map<String, Object> toJava(final Node node) {
    return write(node).toJava();
  }

  private Mapping writeDocument(final Node document) {
    Mapping mapping = Mapping.empty();
    for (final Node child : document.getChildren()) {
      // Only the document element is represented. Document types, comments and processing
      // instructions on the document level are dropped.
      if (NodeKindValidator.checkSupported(child) == NodeKind.ELEMENT && mapping.isEmpty()) {
        mapping = Mapping.of(nameOf(child), buildElement(child));
      }
    }
    return mapping;
  }

  /**
   * Builds the value of an element.
   *
   * @param element the element
   * @return a {@link Scalar} if the element collapses, a {@link Mapping} otherwise
   */
  private CanonicalValue buildElement(final Node element) {
    final var attributes = element.getAttributes();
    final List<Node> children = element.getChildren();

    if (attributes.isEmpty()) {
      if (children.isEmpty()) {
        return Mapping.empty();
      }
      if (children.size() == 1 && NodeKindValidator.checkSupported(children.get(0)) == NodeKind.TEXT) {
        return Scalar.of(valueOf(children.get(0)));
      }
    }

    // Values per label; the first occurrence of a label fixes its position.
    final Map<String, List<CanonicalValue>> entries = new LinkedHashMap<>();

    for (final Node attribute : attributes) {
      if (attribute.getKind() != NodeKind.ATTRIBUTE) {
        throw new DocMapException("Attribute of element '%s' has kind %s.", nameOf(element), attribute.getKind());
      }
      add(entries, labels.attributeKey(nameOf(attribute)), Scalar.of(valueOf(attribute)));
    }

    int textNumber = 0;
    for (final Node child : children) {
      switch (NodeKindValidator.checkSupported(child)) {
        case ELEMENT -> add(entries, nameOf(child), buildElement(child));
        case TEXT -> add(entries, labels.textKey(++textNumber), Scalar.of(valueOf(child)));
        case COMMENT, PROCESSING_INSTRUCTION, CDATA_SECTION -> add(entries, fixedLabel(child.getKind()),
                                                                  buildLeaf(child));
        case DOCUMENT, DOCUMENT_TYPE -> {
          // Not allowed inside elements by the tree, nothing to represent.
        }
        // $CASES-OMITTED$
        default -> throw new IllegalStateException("Node kind not known!");
      }
    }

    final ImmutableMap.Builder<String, CanonicalValue> mapping = ImmutableMap.builderWithExpectedSize(entries.size());
    entries.forEach((label, values) -> mapping.put(label,
                                                   values.size() == 1
                                                       ? values.get(0)
                                                       : new Sequence(ImmutableList.copyOf(values))));
    return new Mapping(mapping.build());
  }

  private static void add(final Map<String, List<CanonicalValue>> entries, final String label,
      final CanonicalValue value) {
    entries.computeIfAbsent(label, unused -> new ArrayList<>(1)).add(value);
  }

  private Scalar buildLeaf(final Node node) {
    if (node.getKind() == NodeKind.PROCESSING_INSTRUCTION) {
      return Scalar.of(nameOf(node) + " " + valueOf(node));
    }
    return Scalar.of(valueOf(node));
  }

  private String fixedLabel(final NodeKind kind) {
    return switch (kind) {
      case COMMENT -> labels.commentKey();
      case PROCESSING_INSTRUCTION -> labels.instructionKey();
      case CDATA_SECTION -> labels.cdataKey();
      // $CASES-OMITTED$
      default -> throw new IllegalStateException("No fixed label for node kind " + kind);
    };
  }

  private static String nameOf(final Node node) {
    if (node instanceof NameNode nameNode) {
      return nameNode.getName();
    }
    throw new DocMapException("Node of kind %s doesn't provide a name: %s", node.getKind(), node);
  }

  private static String valueOf(final Node node) {
    if (node instanceof ValueNode valueNode) {
      return valueNode.getValue();
    }
    throw new DocMapException("Node of kind %s doesn't provide a value: %s", node.getKind(), node);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder with default labels
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder to set up the {@link MapWriter}.
   */
  public static final class Builder {

    /**
     * Labels of the non-element nodes.
     */
    private NodeLabels labels = NodeLabels.DEFAULT;

    private Builder() {
    }

    /**
     * Sets the labels of the non-element nodes.
     *
     * @param labels the labels
     * @return this builder instance
     */
    public Builder labels(final NodeLabels labels) {
      this.labels = requireNonNull(labels);
      return this;
    }

    /**
     * Builds a new {@link MapWriter} instance.
     *
     * @return a new {@link MapWriter} instance
     */
    public MapWriter build() {
      return new MapWriter(this);
    }
  }
}
