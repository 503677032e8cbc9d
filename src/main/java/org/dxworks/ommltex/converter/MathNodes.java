package org.dxworks.ommltex.converter;

import org.dxworks.ommltex.model.MathNode;
import org.dxworks.ommltex.model.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public final class MathNodes {

    private MathNodes() {}

    public static MathNode findFirstChild(MathNode parent, NodeKind kind) {
        if (parent == null) return null;
        for (MathNode child : parent.getChildren()) {
            if (child.is(kind)) {
                return child;
            }
        }
        return null;
    }

    public static List<MathNode> findAllChildren(MathNode parent, NodeKind kind) {
        List<MathNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (MathNode child : parent.getChildren()) {
            if (child.is(kind)) {
                result.add(child);
            }
        }
        return result;
    }

    /** Depth-first, pre-order; the start node itself is not considered. */
    public static MathNode findFirstDescendant(MathNode root, NodeKind kind) {
        if (root == null) return null;
        Deque<MathNode> stack = new ArrayDeque<>();
        pushChildrenReversed(stack, root);

        while (!stack.isEmpty()) {
            MathNode node = stack.pop();
            if (node.is(kind)) {
                return node;
            }
            pushChildrenReversed(stack, node);
        }
        return null;
    }

    public static boolean hasDescendant(MathNode root, NodeKind kind) {
        return findFirstDescendant(root, kind) != null;
    }

    /**
     * Concatenated literal text of every text run under {@code root}, in document order.
     */
    public static String plainText(MathNode root) {
        if (root == null) return "";
        if (root.is(NodeKind.TEXT_RUN)) return root.getText();
        StringBuilder sb = new StringBuilder();
        for (MathNode child : root.getChildren()) {
            sb.append(plainText(child));
        }
        return sb.toString();
    }

    private static void pushChildrenReversed(Deque<MathNode> stack, MathNode node) {
        List<MathNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
