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

package io.docmap.exception;

import io.docmap.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown if a writer encounters a node whose kind it is not able to represent. The whole write
 * operation is aborted, no partial result is returned.
 */
public final class UnsupportedNodeKindException extends DocMapException {

  private static final long serialVersionUID = 1L;

  /**
   * The rejected kind, {@code null} if the node didn't report any kind.
   */
  private final @Nullable NodeKind nodeKind;

  /**
   * Constructor.
   *
   * @param nodeKind the rejected kind
   * @param nodeName the name of the rejected node
   */
  public UnsupportedNodeKindException(final @Nullable NodeKind nodeKind, final String nodeName) {
    super("Node kind not known: %s (node '%s')", nodeKind, nodeName);
    this.nodeKind = nodeKind;
  }

  public @Nullable NodeKind getNodeKind() {
    return nodeKind;
  }
}
