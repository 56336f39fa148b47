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

import io.docmap.exception.UnsupportedNodeKindException;
import io.docmap.node.NodeKind;
import io.docmap.node.interfaces.Node;
import io.docmap.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Guards the writers against node kinds they are not able to represent. The check is done for
 * every visited node, not only the root of a subtree.
 */
public final class NodeKindValidator {

  /**
   * {@link LogWrapper} reference.
   */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(NodeKindValidator.class));

  private static final Set<NodeKind> SUPPORTED_KINDS = EnumSet.of(NodeKind.DOCUMENT,
                                                                  NodeKind.ELEMENT,
                                                                  NodeKind.TEXT,
                                                                  NodeKind.CDATA_SECTION,
                                                                  NodeKind.COMMENT,
                                                                  NodeKind.PROCESSING_INSTRUCTION,
                                                                  NodeKind.DOCUMENT_TYPE);

  private NodeKindValidator() {
    throw new AssertionError();
  }

  /**
   * Determines if a kind can be written.
   *
   * @param kind the node kind
   * @return {@code true}, if nodes of this kind are supported, {@code false} otherwise
   */
  public static boolean isSupported(final NodeKind kind) {
    return kind != null && SUPPORTED_KINDS.contains(kind);
  }

  /**
   * Checks the kind of a node.
   *
   * @param node the node to check
   * @return the supported kind of the node
   * @throws UnsupportedNodeKindException if the kind of the node isn't supported
   */
  public static NodeKind checkSupported(final Node node) {
    requireNonNull(node);
    final NodeKind kind = node.getKind();
    if (!isSupported(kind)) {
      LOGWRAPPER.error("Unsupported node kind {} of node {}.", kind, node);
      throw new UnsupportedNodeKindException(kind, node.getNodeName());
    }
    return kind;
  }
}
