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
import io.docmap.node.interfaces.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The document root node. It holds at most one element, the document element, besides document
 * types, comments and processing instructions.
 */
public final class XmlDocumentRootNode extends AbstractStructNode {

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }

  @Override
  public String getNodeName() {
    return NodeKind.DOCUMENT.getDefaultName();
  }

  /**
   * Gets the document element.
   *
   * @return the first element child or {@code null} if the document is empty
   */
  public @Nullable ElementNode getDocumentElement() {
    for (final Node child : getChildren()) {
      if (child instanceof ElementNode element) {
        return element;
      }
    }
    return null;
  }

  @Override
  protected void checkChild(final AbstractNode child) {
    checkArgument(!(child instanceof TextNode) && !(child instanceof CDataSectionNode)
                      && !(child instanceof XmlDocumentRootNode), "A document must not contain %s nodes.",
                  child.getKind());
    if (child instanceof ElementNode) {
      checkState(getDocumentElement() == null, "The document already has a document element.");
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("childCount", getChildCount()).toString();
  }
}
