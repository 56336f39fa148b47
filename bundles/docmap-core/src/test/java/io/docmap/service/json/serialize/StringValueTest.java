package io.docmap.service.json.serialize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public final class StringValueTest {

  @Test
  public void escapeFormfeed() {
    assertEquals("\\f", StringValue.escape("\f"), "Form feed character '\\f' should be escaped");
  }

  @Test
  public void escapeTab() {
    assertEquals("\\t", StringValue.escape("\t"), "Tab character '\\t' should be escaped");
  }

  @Test
  public void escapeBackspace() {
    assertEquals("\\b", StringValue.escape("\b"), "Backspace character '\\b' should be escaped");
  }

  @Test
  public void escapeQuoteAndBackslash() {
    assertEquals("\\\" bla \\\\ \\n\\r", StringValue.escape("\" bla \\ \n\r"));
  }

  @Test
  public void escapeOtherControlCharacters() {
    assertEquals("\\u0000\\u001f\\u000b", StringValue.escape("\u0000\u001f\u000b"));
  }

  @Test
  public void keepSolidusAndMarkup() {
    assertEquals("a/b <c> & 'd'", StringValue.escape("a/b <c> & 'd'"));
  }

  @Test
  public void escapeEmoji() {
    assertEquals("💣  ", StringValue.escape("💣  "), "Bomb emoji should not be escaped");
  }

  @Test
  public void unchangedValueIsNotCopied() {
    final String value = "plain value";
    assertSame(value, StringValue.escape(value));
  }

  @Test
  public void quote() {
    assertEquals("\"a\\\"b\"", StringValue.quote("a\"b"));
  }
}
