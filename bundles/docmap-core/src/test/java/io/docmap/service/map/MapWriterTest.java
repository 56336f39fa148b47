package io.docmap.service.map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.docmap.access.XmlDocumentBuilder;
import io.docmap.exception.DocMapException;
import io.docmap.exception.UnsupportedNodeKindException;
import io.docmap.node.NodeKind;
import io.docmap.node.xml.AlienNode;
import io.docmap.node.xml.CommentNode;
import io.docmap.node.xml.ElementNode;
import io.docmap.node.xml.PINode;
import io.docmap.node.xml.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class MapWriterTest {

  private MapWriter writer;

  @BeforeEach
  public void setUp() {
    writer = MapWriter.newBuilder().build();
  }

  private static Mapping body(final Mapping written, final String name) {
    return assertInstanceOf(Mapping.class, written.get(name));
  }

  @Nested
  @DisplayName("Collapsing and grouping")
  class CollapsingAndGrouping {

    @Test
    @DisplayName("an element with a single text child collapses into the text")
    public void testSingleTextChildCollapses() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("ele")
                                            .insertTextAsLastChild("x");

      final Mapping written = writer.write(builder.getDocument());

      assertEquals(Map.of("root", Map.of("ele", "x")), written.toJava());
      assertEquals(Scalar.of("x"), body(written, "root").get("ele"));
    }

    @Test
    @DisplayName("an element without attributes and children is an empty mapping")
    public void testEmptyElement() {
      final var builder = XmlDocumentBuilder.create().insertElementAsLastChild("root");

      final Mapping written = writer.write(builder.getDocument());

      assertSame(Mapping.empty(), written.get("root"));
    }

    @Test
    @DisplayName("same-named siblings are grouped into a sequence")
    public void testDuplicateTagNames() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("person", Map.of("name", "xxx"))
                                            .moveToParent()
                                            .insertElementAsLastChild("person", Map.of("name", "yyy"));

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      final Sequence persons = assertInstanceOf(Sequence.class, root.get("person"));
      assertEquals(2, persons.size());
      assertEquals(Map.of("@name", "xxx"), persons.get(0).toJava());
      assertEquals(Map.of("@name", "yyy"), persons.get(1).toJava());
    }

    @Test
    @DisplayName("a single occurrence is never wrapped into a sequence")
    public void testSingleOccurrenceNotWrapped() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("a", Map.of("k", "v"))
                                            .moveToParent()
                                            .insertElementAsLastChild("b")
                                            .insertTextAsLastChild("text");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertInstanceOf(Mapping.class, root.get("a"));
      assertInstanceOf(Scalar.class, root.get("b"));
    }

    @Test
    @DisplayName("three occurrences keep their document order")
    public void testSequenceKeepsDocumentOrder() {
      final var builder = XmlDocumentBuilder.create().insertElementAsLastChild("list");
      for (int i = 0; i < 3; i++) {
        builder.insertElementAsLastChild("item").insertTextAsLastChild(i).moveToParent();
      }

      final Mapping written = writer.write(builder.getDocument());

      assertEquals(Map.of("list", Map.of("item", List.of("0", "1", "2"))), written.toJava());
    }
  }

  @Nested
  @DisplayName("Mixed content")
  class MixedContent {

    @Test
    @DisplayName("text children are numbered around elements")
    public void testMixedContent() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertTextAsLastChild("hello")
                                            .insertElementAsLastChild("p")
                                            .moveToParent()
                                            .insertTextAsLastChild("world");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(List.of("#1", "p", "#2"), List.copyOf(root.keys()));
      assertEquals(Scalar.of("hello"), root.get("#1"));
      assertSame(Mapping.empty(), root.get("p"));
      assertEquals(Scalar.of("world"), root.get("#2"));
    }

    @Test
    @DisplayName("the first occurrence fixes the position of a group")
    public void testInterspersedDuplicatesCannotPreserveOrder() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertTextAsLastChild("hello")
                                            .insertElementAsLastChild("p")
                                            .moveToParent()
                                            .insertTextAsLastChild("world")
                                            .insertElementAsLastChild("p");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(List.of("#1", "p", "#2"), List.copyOf(root.keys()));
      final Sequence paragraphs = assertInstanceOf(Sequence.class, root.get("p"));
      assertEquals(List.of(Mapping.empty(), Mapping.empty()), paragraphs.items());
    }

    @Test
    @DisplayName("only text children are counted")
    public void testTextNumberingSkipsOtherKinds() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertCommentAsLastChild("c")
                                            .insertTextAsLastChild("one")
                                            .insertCDataAsLastChild("raw")
                                            .insertElementAsLastChild("e")
                                            .moveToParent()
                                            .insertTextAsLastChild("two")
                                            .insertTextAsLastChild("three");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(List.of("!", "#1", "$", "e", "#2", "#3"), List.copyOf(root.keys()));
      assertEquals(Scalar.of("three"), root.get("#3"));
    }

    @Test
    @DisplayName("a single text child is numbered if the element has attributes")
    public void testTextWithAttributeIsNumbered() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root", Map.of("lang", "en"))
                                            .insertTextAsLastChild("hello");

      final Mapping written = writer.write(builder.getDocument());

      assertEquals(Map.of("root", Map.of("@lang", "en", "#1", "hello")), written.toJava());
    }
  }

  @Nested
  @DisplayName("Attributes and leaf nodes")
  class AttributesAndLeafNodes {

    @Test
    @DisplayName("attributes precede children regardless of the insertion order")
    public void testAttributesFirst() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("child")
                                            .moveToParent()
                                            .insertAttribute("b", "2")
                                            .insertTextAsLastChild("text")
                                            .insertAttribute("a", 1);

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(List.of("@b", "@a", "child", "#1"), List.copyOf(root.keys()));
      assertEquals(Scalar.of("1"), root.get("@a"));
    }

    @Test
    @DisplayName("empty attribute values are kept")
    public void testEmptyAttributeValue() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root", Map.of("xmlns", "myns"))
                                            .insertElementAsLastChild("foo")
                                            .moveToParent()
                                            .insertElementAsLastChild("bar", Map.of("xmlns", ""));

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(Scalar.of("myns"), root.get("@xmlns"));
      assertSame(Mapping.empty(), root.get("foo"));
      assertEquals(Map.of("@xmlns", ""), root.get("bar").toJava());
    }

    @Test
    @DisplayName("comments, processing instructions and CDATA sections use fixed labels")
    public void testFixedLabels() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("person")
                                            .insertPIAsLastChild("pi", "mypi")
                                            .insertCommentAsLastChild("Good guy")
                                            .insertCDataAsLastChild("well formed! <>&");

      final Mapping person = body(writer.write(builder.getDocument()), "person");

      assertEquals(Scalar.of("pi mypi"), person.get("?"));
      assertEquals(Scalar.of("Good guy"), person.get("!"));
      assertEquals(Scalar.of("well formed! <>&"), person.get("$"));
    }

    @Test
    @DisplayName("a processing instruction without data keeps the separator")
    public void testProcessingInstructionWithoutData() {
      final ElementNode element = new ElementNode("root");
      element.appendChild(new PINode("target", ""));

      assertEquals(Map.of("root", Map.of("?", "target ")), writer.toJava(element));
    }

    @Test
    @DisplayName("a single comment child doesn't collapse")
    public void testSingleCommentDoesNotCollapse() {
      final ElementNode element = new ElementNode("root");
      element.appendChild(new CommentNode("note"));

      assertEquals(Map.of("root", Map.of("!", "note")), writer.toJava(element));
    }

    @Test
    @DisplayName("repeated comments are grouped like repeated elements")
    public void testRepeatedCommentsAreGrouped() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertCommentAsLastChild("first")
                                            .insertElementAsLastChild("e")
                                            .moveToParent()
                                            .insertCommentAsLastChild("second")
                                            .insertPIAsLastChild("a", "1")
                                            .insertPIAsLastChild("b", "2")
                                            .insertCDataAsLastChild("x")
                                            .insertCDataAsLastChild("y");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(List.of("!", "e", "?", "$"), List.copyOf(root.keys()));
      assertEquals(List.of("first", "second"), root.get("!").toJava());
      assertEquals(List.of("a 1", "b 2"), root.get("?").toJava());
      assertEquals(List.of("x", "y"), root.get("$").toJava());
    }

    @Test
    @DisplayName("labels are configurable")
    public void testCustomLabels() {
      final MapWriter customWriter =
          MapWriter.newBuilder().labels(new NodeLabels("_", "text", "comment", "pi", "cdata")).build();
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root", Map.of("id", "1"))
                                            .insertTextAsLastChild("t")
                                            .insertCommentAsLastChild("c");

      final Mapping root = body(customWriter.write(builder.getDocument()), "root");

      assertEquals(List.of("_id", "text1", "comment"), List.copyOf(root.keys()));
    }

    @Test
    @DisplayName("fixed labels must be distinct")
    public void testLabelsMustBeDistinct() {
      assertThrows(IllegalArgumentException.class, () -> new NodeLabels("@", "#", "!", "!", "$"));
    }

    @Test
    @DisplayName("overlapping labels are rejected so that attributes and texts never share a key")
    public void testOverlappingLabelsAreRejected() {
      // "#1" would be produced by the attribute "1" and the first text child alike.
      assertThrows(IllegalArgumentException.class, () -> new NodeLabels("#", "#", "!", "?", "$"));
      assertThrows(IllegalArgumentException.class, () -> new NodeLabels("t", "text", "!", "?", "$"));
      assertThrows(IllegalArgumentException.class, () -> new NodeLabels("!", "#", "!x", "?", "$"));
      assertThrows(IllegalArgumentException.class, () -> new NodeLabels("@", "#", "!", "#?", "$"));
    }

    @Test
    @DisplayName("an attribute named like a text number keeps its own entry")
    public void testAttributeDoesNotMergeWithText() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root", Map.of("1", "attr"))
                                            .insertTextAsLastChild("text");

      final Mapping root = body(writer.write(builder.getDocument()), "root");

      assertEquals(Scalar.of("attr"), root.get("@1"));
      assertEquals(Scalar.of("text"), root.get("#1"));
    }
  }

  @Nested
  @DisplayName("Roots")
  class Roots {

    @Test
    @DisplayName("document types are skipped")
    public void testDocumentType() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertDocumentType("root", "pub", "sys")
                                            .insertElementAsLastChild("root");

      assertEquals(Map.of("root", Map.of()), writer.toJava(builder.getDocument()));
    }

    @Test
    @DisplayName("a document is represented by its document element only")
    public void testDocumentLevelNodes() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertCommentAsLastChild("prolog")
                                            .insertPIAsLastChild("xml-stylesheet", "href=\"a.xsl\"")
                                            .insertElementAsLastChild("root")
                                            .moveToParent()
                                            .insertCommentAsLastChild("epilog");

      final Mapping written = writer.write(builder.getDocument());

      assertEquals(List.of("root"), List.copyOf(written.keys()));
    }

    @Test
    @DisplayName("an empty document is an empty mapping")
    public void testEmptyDocument() {
      assertTrue(writer.write(XmlDocumentBuilder.create().getDocument()).isEmpty());
    }

    @Test
    @DisplayName("writing an element keeps its name as the only key")
    public void testElementRoot() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("ele")
                                            .insertTextAsLastChild("x");

      final Mapping written = writer.write(builder.moveToDocumentElement().getCurrentNode());

      assertEquals(Map.of("root", Map.of("ele", "x")), written.toJava());
    }

    @Test
    @DisplayName("writing a leaf node uses its label")
    public void testLeafRoots() {
      assertEquals(Map.of("#1", "t"), writer.toJava(new TextNode("t")));
      assertEquals(Map.of("!", "c"), writer.toJava(new CommentNode("c")));
      assertEquals(Map.of("?", "a b"), writer.toJava(new PINode("a", "b")));
    }
  }

  @Nested
  @DisplayName("Unsupported nodes")
  class UnsupportedNodes {

    @Test
    @DisplayName("an unknown node aborts the whole write")
    public void testUnknownNode() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root")
                                            .insertElementAsLastChild("a")
                                            .insertElementAsLastChild("b");
      ((ElementNode) builder.getCurrentNode()).appendChild(new AlienNode(NodeKind.ENTITY_REFERENCE));

      final var e = assertThrows(UnsupportedNodeKindException.class, () -> writer.write(builder.getDocument()));
      assertEquals(NodeKind.ENTITY_REFERENCE, e.getNodeKind());
    }

    @Test
    @DisplayName("an unknown sole child doesn't collapse")
    public void testUnknownSoleChild() {
      final ElementNode element = new ElementNode("root");
      element.appendChild(new AlienNode(NodeKind.DOCUMENT_FRAGMENT));

      assertThrows(UnsupportedNodeKindException.class, () -> writer.write(element));
    }

    @Test
    @DisplayName("the kind is checked on every visit")
    public void testKindCheckedOnEveryVisit() {
      final ElementNode element = new ElementNode("root");
      final AlienNode alien = element.appendChild(new AlienNode(NodeKind.COMMENT));
      element.appendChild(new TextNode("text"));

      assertThrows(DocMapException.class, () -> writer.write(element));

      alien.setKind(NodeKind.NOTATION);
      assertThrows(UnsupportedNodeKindException.class, () -> writer.write(element));
    }

    @Test
    @DisplayName("a root of an unknown kind is rejected")
    public void testUnknownRoot() {
      assertThrows(UnsupportedNodeKindException.class, () -> writer.write(new AlienNode(NodeKind.ENTITY)));
      assertThrows(UnsupportedNodeKindException.class, () -> writer.write(new AlienNode(null)));
    }
  }

  @Nested
  @DisplayName("Logging")
  class Logging {

    private Logger logger;

    private ListAppender<ILoggingEvent> appender;

    private Level previousLevel;

    @BeforeEach
    public void setUp() {
      logger = (Logger) LoggerFactory.getLogger(MapWriter.class);
      previousLevel = logger.getLevel();
      logger.setLevel(Level.DEBUG);
      appender = new ListAppender<>();
      appender.start();
      logger.addAppender(appender);
    }

    @AfterEach
    public void tearDown() {
      logger.detachAppender(appender);
      logger.setLevel(previousLevel);
    }

    @Test
    @DisplayName("the number of written nodes is logged at debug level")
    public void testNodeCountIsLogged() {
      final var builder = XmlDocumentBuilder.create()
                                            .insertElementAsLastChild("root", Map.of("id", "1"))
                                            .insertTextAsLastChild("text");

      writer.write(builder.getDocument());

      assertTrue(appender.list.stream()
                              .map(ILoggingEvent::getFormattedMessage)
                              .anyMatch(message -> message.startsWith("Wrote 4 nodes of the subtree")));
    }
  }
}
