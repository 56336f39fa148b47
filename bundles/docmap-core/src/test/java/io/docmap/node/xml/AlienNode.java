package io.docmap.node.xml;

import io.docmap.node.NodeKind;

/**
 * Leaf node reporting an arbitrary kind, to simulate nodes a writer doesn't know.
 */
public final class AlienNode extends AbstractNode {

  private NodeKind kind;

  public AlienNode(final NodeKind kind) {
    this.kind = kind;
  }

  public void setKind(final NodeKind kind) {
    this.kind = kind;
  }

  @Override
  public NodeKind getKind() {
    return kind;
  }

  @Override
  public String getNodeName() {
    return "alien";
  }
}
