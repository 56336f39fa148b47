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
import io.docmap.node.interfaces.ValueNode;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Processing instruction node. The name is the target, the value the data.
 */
public final class PINode extends AbstractNode implements NameNode, ValueNode {

  private final String target;

  private String data;

  /**
   * Constructor.
   *
   * @param target the target of the processing instruction
   * @param data   the content, may be empty
   */
  public PINode(final String target, final String data) {
    requireNonNull(target);
    checkArgument(!target.isEmpty(), "Processing instruction target must not be empty.");
    this.target = target;
    this.data = requireNonNull(data);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PROCESSING_INSTRUCTION;
  }

  @Override
  public String getName() {
    return target;
  }

  public String getTarget() {
    return target;
  }

  @Override
  public String getValue() {
    return data;
  }

  @Override
  public void setValue(final String value) {
    this.data = requireNonNull(value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("target", target).add("data", data).toString();
  }
}
