package me.christianrobert.cljtojs.transformer.util;

import me.christianrobert.cljtojs.transformer.tree.SourceNode;

/**
 * Formats source syntax trees into human-readable, indented text.
 *
 * <p>Sequence links are not printed; their elements appear as siblings of the enclosing
 * composite. Leaf wrappers are folded into the atom they box.</p>
 *
 * <p>Example output for {@code (if ready? :go [1 2])}:</p>
 * <pre>
 * list
 *   symbol "if"
 *   symbol "ready?"
 *   keyword ":go"
 *   vector
 *     number "1"
 *     number "2"
 * </pre>
 */
public class SourceTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a source tree into human-readable text.
   *
   * @param tree Root of the tree (a form or a sequence of forms)
   * @return Formatted string representation
   */
  public static String format(SourceNode tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SourceNode node, int depth, StringBuilder sb) {
    switch (node.getKind()) {
      case SEQUENCE -> {
        for (SourceNode element : node.elements()) {
          formatNode(element, depth, sb);
        }
      }
      case LEAF -> {
        if (node.getLeft() == null) {
          appendLine(sb, depth, "leaf (empty)");
        } else {
          formatNode(node.getLeft(), depth, sb);
        }
      }
      case LIST, VECTOR, MACRO -> {
        String line = node.getKind().name().toLowerCase();
        if (node.getPosition() != null) {
          line += " @" + node.getPosition();
        }
        appendLine(sb, depth, line);
        for (SourceNode element : node.elements()) {
          formatNode(element, depth + 1, sb);
        }
      }
      default -> appendLine(sb, depth,
          node.getKind().name().toLowerCase() + " \"" + escapeAndTruncate(node.getText()) + "\"");
    }
  }

  private static void appendLine(StringBuilder sb, int depth, String line) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(line).append("\n");
  }

  /**
   * Escapes and truncates text for display.
   */
  static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
