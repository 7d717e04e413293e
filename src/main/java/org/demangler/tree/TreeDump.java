package org.demangler.tree;

/**
 * Utility class for dumping a demangled tree in a readable, indented form.
 * Used for debug logging and test failure messages.
 */
public final class TreeDump {

	private static final String INDENT = "  ";

	private TreeDump() {}

	/**
	 * Dumps a subtree, one node per line. A line shows the kind and, if present, the quoted text.
	 * @param root The root of the subtree.
	 * @return The dump, with lines separated by {@code '\n'}.
	 */
	public static String dump(Node root) {
		StringBuilder sb = new StringBuilder();
		dump(root, 0, sb);
		return sb.toString();
	}

	private static void dump(Node node, int depth, StringBuilder sb) {
		if (depth > 0) sb.append('\n');
		sb.append(INDENT.repeat(depth)).append(node.getKind());
		if (node.hasText()) {
			sb.append(" \"").append(escape(node.getText())).append('"');
		}
		for (Node child : node) {
			dump(child, depth + 1, sb);
		}
	}

	private static String escape(String s) { return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n"); }
}
