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

package io.docmap.service.json.serialize;

/**
 * Escapes string values and object keys for the JSON output. Only the quotation mark, the reverse
 * solidus and control characters are escaped.
 */
public final class StringValue {

  private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

  private StringValue() {
    throw new AssertionError();
  }

  public static String escape(final String value) {
    StringBuilder sb = null;
    final int len = value.length();

    for (int i = 0; i < len; i++) {
      final char ch = value.charAt(i);
      final String replacement = replacementFor(ch);
      if (replacement == null) {
        if (sb != null) {
          sb.append(ch);
        }
        continue;
      }
      if (sb == null) {
        sb = new StringBuilder(len + 16);
        sb.append(value, 0, i);
      }
      sb.append(replacement);
    }
    return sb == null ? value : sb.toString();
  }

  /**
   * Escapes and quotes a value.
   *
   * @param value the value
   * @return the escaped value in quotation marks
   */
  public static String quote(final String value) {
    return "\"" + escape(value) + "\"";
  }

  private static String replacementFor(final char ch) {
    switch (ch) {
      case '"':
        return "\\\"";
      case '\\':
        return "\\\\";
      case '\b':
        return "\\b";
      case '\f':
        return "\\f";
      case '\n':
        return "\\n";
      case '\r':
        return "\\r";
      case '\t':
        return "\\t";
      default:
        if (ch < 0x20) {
          return "\\u00" + HEX_DIGITS[ch >> 4] + HEX_DIGITS[ch & 0xF];
        }
        return null;
    }
  }
}
