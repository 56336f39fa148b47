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

import static java.util.Objects.requireNonNull;

/**
 * Document type declaration. Only allowed as a child of the document root.
 */
public final class DocumentTypeNode extends AbstractNode implements NameNode {

  private final String name;

  private final String publicId;

  private final String systemId;

  /**
   * Constructor.
   *
   * @param name     name of the document type, usually the document element name
   * @param publicId public identifier, may be empty
   * @param systemId system identifier, may be empty
   */
  public DocumentTypeNode(final String name, final String publicId, final String systemId) {
    this.name = requireNonNull(name);
    this.publicId = requireNonNull(publicId);
    this.systemId = requireNonNull(systemId);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT_TYPE;
  }

  @Override
  public String getName() {
    return name;
  }

  public String getPublicId() {
    return publicId;
  }

  public String getSystemId() {
    return systemId;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("publicId", publicId)
                      .add("systemId", systemId)
                      .toString();
  }
}
