package io.docmap.service;

import io.docmap.access.XmlDocumentBuilder;
import io.docmap.exception.UnsupportedNodeKindException;
import io.docmap.node.NodeKind;
import io.docmap.node.xml.AlienNode;
import io.docmap.node.xml.ElementNode;
import io.docmap.node.xml.XmlDocumentRootNode;
import io.docmap.service.map.Mapping;
import io.docmap.service.map.NodeLabels;
import io.docmap.service.map.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class DocumentWritersTest {

  private XmlDocumentRootNode document;

  @BeforeEach
  public void setUp() {
    document = XmlDocumentBuilder.create()
                                 .insertElementAsLastChild("people")
                                 .insertTextAsLastChild("hello")
                                 .insertElementAsLastChild("person", Map.of("name", "xxx"))
                                 .moveToParent()
                                 .insertElementAsLastChild("person", Map.of("name", "yyy"))
                                 .moveToParent()
                                 .insertTextAsLastChild("world")
                                 .getDocument();
  }

  @Test
  @DisplayName("build returns the canonical value")
  public void testBuild() {
    final Mapping people = (Mapping) DocumentWriters.build(document).get("people");

    assertEquals(List.of("#1", "person", "#2"), List.copyOf(people.keys()));
    assertEquals(Scalar.of("world"), people.get("#2"));
  }

  @Test
  @DisplayName("write in the map format")
  public void testWriteMap() {
    final Object written =
        DocumentWriters.write(document, DocumentWriterOptions.newBuilder().format(WriterFormat.MAP).build());

    assertEquals(Map.of("people",
                        Map.of("#1", "hello", "person", List.of(Map.of("@name", "xxx"), Map.of("@name", "yyy")), "#2",
                               "world")), written);
  }

  @Test
  @DisplayName("write in the JSON format")
  public void testWriteJson() {
    final DocumentWriterOptions options = DocumentWriterOptions.newBuilder().prettyPrint(true).build();

    assertEquals("""
                     {
                       "people": {
                         "#1": "hello",
                         "person": [
                           { "@name": "xxx" },
                           { "@name": "yyy" }
                         ],
                         "#2": "world"
                       }
                     }""", DocumentWriters.write(document, options));
  }

  @Test
  @DisplayName("writeText composes build and render")
  public void testWriteText() {
    final DocumentWriterOptions options = DocumentWriterOptions.newBuilder().offset(3).indentSpaces(1).build();

    assertEquals(DocumentWriters.render(DocumentWriters.build(document), options),
                 DocumentWriters.writeText(document, options));
    assertEquals("{\"people\":{\"#1\":\"hello\",\"person\":[{\"@name\":\"xxx\"},{\"@name\":\"yyy\"}],\"#2\":\"world\"}}",
                 DocumentWriters.writeText(document, options));
  }

  @Test
  @DisplayName("labels of the options are used")
  public void testLabels() {
    final DocumentWriterOptions options =
        DocumentWriterOptions.newBuilder().labels(new NodeLabels("-", "text", "!", "?", "$")).build();

    assertEquals("{\"people\":{\"text1\":\"hello\",\"person\":[{\"-name\":\"xxx\"},{\"-name\":\"yyy\"}],\"text2\":\"world\"}}",
                 DocumentWriters.writeText(document, options));
  }

  @Test
  @DisplayName("an unknown node results in an error instead of partial output")
  public void testUnknownNode() {
    final ElementNode people = document.getDocumentElement();
    people.appendChild(new AlienNode(NodeKind.ENTITY_REFERENCE));

    assertThrows(UnsupportedNodeKindException.class,
                 () -> DocumentWriters.writeText(document, DocumentWriterOptions.DEFAULT));
    assertThrows(UnsupportedNodeKindException.class, () -> DocumentWriters.write(document,
                                                                                 DocumentWriterOptions.newBuilder()
                                                                                                      .format(WriterFormat.MAP)
                                                                                                      .build()));
  }

  @Test
  @DisplayName("options can be copied and modified")
  public void testOptionsToBuilder() {
    final DocumentWriterOptions options =
        DocumentWriterOptions.newBuilder().prettyPrint(true).offset(-2).indentSpaces(4).build();
    final DocumentWriterOptions copy = options.toBuilder().format(WriterFormat.MAP).build();

    assertEquals(WriterFormat.MAP, copy.format());
    assertEquals(-2, copy.offset());
    assertEquals(4, copy.indentSpaces());
    assertEquals(true, copy.prettyPrint());
    assertThrows(IllegalArgumentException.class, () -> DocumentWriterOptions.newBuilder().indentSpaces(-1));
  }
}
