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
import com.google.common.collect.ImmutableSet;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Labels under which non-element nodes are stored in a {@link Mapping}. No label may produce a key
 * of another kind of node: the prefixes don't overlap and no fixed key starts with a prefix.
 *
 * @param attributePrefix prefixed to an attribute name
 * @param textPrefix      prefixed to the running number of a text node
 * @param commentKey      key of comments
 * @param instructionKey  key of processing instructions
 * @param cdataKey        key of CDATA sections
 */
public record NodeLabels(String attributePrefix, String textPrefix, String commentKey, String instructionKey,
    String cdataKey) {

  /**
   * {@code @name}, {@code #1}, {@code !}, {@code ?} and {@code $}.
   */
  public static final NodeLabels DEFAULT = new NodeLabels("@", "#", "!", "?", "$");

  public NodeLabels {
    requireNonNull(attributePrefix);
    requireNonNull(textPrefix);
    requireNonNull(commentKey);
    requireNonNull(instructionKey);
    requireNonNull(cdataKey);
    checkArgument(!attributePrefix.isEmpty() && !textPrefix.isEmpty(), "Prefixes must not be empty.");
    checkArgument(!commentKey.isEmpty() && !instructionKey.isEmpty() && !cdataKey.isEmpty(),
                  "Keys must not be empty.");
    checkArgument(ImmutableSet.of(commentKey, instructionKey, cdataKey).size() == 3,
                  "Comment, instruction and CDATA keys must be distinct: %s, %s, %s", commentKey, instructionKey,
                  cdataKey);
    checkArgument(!attributePrefix.startsWith(textPrefix) && !textPrefix.startsWith(attributePrefix),
                  "Attribute prefix '%s' and text prefix '%s' overlap.", attributePrefix, textPrefix);
    for (final String key : ImmutableList.of(commentKey, instructionKey, cdataKey)) {
      checkArgument(!key.startsWith(attributePrefix) && !key.startsWith(textPrefix),
                    "Key '%s' may clash with attribute or text keys.", key);
    }
  }

  public String attributeKey(final String attributeName) {
    return attributePrefix + attributeName;
  }

  public String textKey(final int number) {
    return textPrefix + number;
  }
}
