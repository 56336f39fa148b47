package io.docmap.access;

import io.docmap.node.NodeKind;
import io.docmap.node.xml.ElementNode;
import io.docmap.service.DocumentWriterOptions;
import io.docmap.service.WriterFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class XmlDocumentBuilderTest {

  @Test
  @DisplayName("the cursor follows inserted elements only")
  public void testCursor() {
    final XmlDocumentBuilder builder = XmlDocumentBuilder.create();
    assertSame(builder.getDocument(), builder.getCurrentNode());

    builder.insertElementAsLastChild("root").insertTextAsLastChild("t").insertCommentAsLastChild("c");
    assertEquals(NodeKind.ELEMENT, builder.getCurrentNode().getKind());
    assertEquals(2, builder.getCurrentNode().getChildCount());

    builder.moveToParent();
    assertSame(builder.getDocument(), builder.getCurrentNode());

    builder.moveToDocumentElement();
    assertSame(builder.getDocument().getDocumentElement(), builder.getCurrentNode());
  }

  @Test
  @DisplayName("values are converted to strings, suppliers evaluated once")
  public void testValueConversion() {
    final AtomicInteger calls = new AtomicInteger();
    final Supplier<Integer> lazy = () -> {
      calls.incrementAndGet();
      return 42;
    };

    final XmlDocumentBuilder builder = XmlDocumentBuilder.create()
                                                         .insertElementAsLastChild("root")
                                                         .insertAttribute("flag", true)
                                                         .insertAttribute("lazy", lazy)
                                                         .insertElementAsLastChild("n")
                                                         .insertTextAsLastChild(1.5)
                                                         .moveToParent()
                                                         .insertElementAsLastChild("id")
                                                         .insertTextAsLastChild(lazy);

    assertEquals(2, calls.get());
    assertEquals(Map.of("root", Map.of("@flag", "true", "@lazy", "42", "n", "1.5", "id", "42")), builder.toMap());
    assertEquals(2, calls.get());
  }

  @Test
  @DisplayName("setting an attribute again replaces its value in place")
  public void testReplaceAttribute() {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("a", "1");
    attributes.put("b", "2");

    final XmlDocumentBuilder builder =
        XmlDocumentBuilder.create().insertElementAsLastChild("root", attributes).insertAttribute("a", "3");

    final ElementNode root = (ElementNode) builder.getCurrentNode();
    assertEquals(2, root.getAttributeCount());
    assertEquals("{\"root\":{\"@a\":\"3\",\"@b\":\"2\"}}", builder.toJson());
  }

  @Test
  @DisplayName("the whole document is written regardless of the cursor")
  public void testEndWritesWholeDocument() {
    final XmlDocumentBuilder builder = XmlDocumentBuilder.create()
                                                         .insertElementAsLastChild("root")
                                                         .insertElementAsLastChild("a")
                                                         .insertElementAsLastChild("b");

    assertEquals("{\"root\":{\"a\":{\"b\":{}}}}", builder.end(DocumentWriterOptions.DEFAULT));
    assertEquals(Map.of("root", Map.of("a", Map.of("b", Map.of()))),
                 builder.end(DocumentWriterOptions.newBuilder().format(WriterFormat.MAP).build()));
    assertEquals("{\n  \"root\": { \"a\": { \"b\": { } } }\n}",
                 builder.toJson(DocumentWriterOptions.newBuilder().prettyPrint(true).format(WriterFormat.MAP).build()));
  }

  @Test
  @DisplayName("invalid cursor operations are rejected")
  public void testInvalidOperations() {
    final XmlDocumentBuilder builder = XmlDocumentBuilder.create();

    assertThrows(IllegalStateException.class, builder::moveToParent);
    assertThrows(IllegalStateException.class, builder::moveToDocumentElement);
    assertThrows(IllegalStateException.class, () -> builder.insertAttribute("a", "b"));
    assertThrows(IllegalArgumentException.class, () -> builder.insertTextAsLastChild("text"));

    builder.insertElementAsLastChild("root").moveToParent();
    assertThrows(IllegalStateException.class, () -> builder.insertElementAsLastChild("second"));
    assertThrows(NullPointerException.class, () -> builder.insertCommentAsLastChild(null));
  }

  @Test
  @DisplayName("document level nodes keep their order in the tree")
  public void testDocumentLevelNodes() {
    final XmlDocumentBuilder builder = XmlDocumentBuilder.create()
                                                         .insertDocumentType("root", "", "root.dtd")
                                                         .insertCommentAsLastChild("c")
                                                         .insertElementAsLastChild("root");

    assertEquals(List.of(NodeKind.DOCUMENT_TYPE, NodeKind.COMMENT, NodeKind.ELEMENT),
                 builder.getDocument().getChildren().stream().map(node -> node.getKind()).toList());
    assertNull(XmlDocumentBuilder.create().getDocument().getDocumentElement());
  }
}
