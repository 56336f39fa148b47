package io.docmap.node;

import io.docmap.service.map.NodeKindValidator;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NodeKindTest {

  @Test
  public void testIdentifiers() {
    for (final NodeKind kind : NodeKind.values()) {
      assertEquals(kind, NodeKind.getKind(kind.getId()));
      assertEquals(kind.ordinal() + 1, kind.getId());
    }
    assertNull(NodeKind.getKind((byte) 13));
  }

  @Test
  public void testSupportedKinds() {
    final EnumSet<NodeKind> unsupported = EnumSet.of(NodeKind.ATTRIBUTE,
                                                     NodeKind.ENTITY_REFERENCE,
                                                     NodeKind.ENTITY,
                                                     NodeKind.DOCUMENT_FRAGMENT,
                                                     NodeKind.NOTATION);
    for (final NodeKind kind : NodeKind.values()) {
      assertEquals(!unsupported.contains(kind), NodeKindValidator.isSupported(kind), kind.name());
    }
    assertFalse(NodeKindValidator.isSupported(null));
    assertTrue(NodeKindValidator.isSupported(NodeKind.DOCUMENT_TYPE));
  }
}
