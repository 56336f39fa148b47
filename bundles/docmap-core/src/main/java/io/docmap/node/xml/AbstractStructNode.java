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

import io.docmap.node.interfaces.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Skeletal implementation of a node, which owns an ordered list of children.
 *
 * <p><strong>This class is not part of the public API and might change.</strong></p>
 */
public abstract class AbstractStructNode extends AbstractNode {

  /**
   * Children in document order.
   */
  private final List<Node> children = new ArrayList<>();

  @Override
  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Appends a child as the last child of this node.
   *
   * @param child the child to append
   * @param <T>   type of the child
   * @return the appended child
   * @throws IllegalStateException if the child is already attached to another node
   */
  public <T extends AbstractNode> T appendChild(final T child) {
    requireNonNull(child);
    checkChild(child);
    child.setParent(this);
    children.add(child);
    return child;
  }

  /**
   * Checks if a child is allowed to be appended. Subclasses restrict the content model.
   *
   * @param child the child about to be appended
   */
  protected void checkChild(final AbstractNode child) {
  }
}
