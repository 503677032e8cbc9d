package org.dxworks.ommltex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a parsed OMML expression tree.
 *
 * <p>Nodes are built once by the reader (or by hand through {@link #builder(NodeKind)})
 * and are read-only afterwards: the children list and the attribute map are unmodifiable.
 * Property elements of OMML ({@code m:fPr}, {@code m:dPr}, ...) are not children;
 * their values live in {@link #getAttributes()} keyed by the property's local name.</p>
 */
public final class MathNode {

    public static final String ATTR_CHR = "chr";
    public static final String ATTR_BEGIN_CHR = "begChr";
    public static final String ATTR_END_CHR = "endChr";
    public static final String ATTR_SEPARATOR_CHR = "sepChr";
    public static final String ATTR_DEGREE_HIDE = "degHide";
    public static final String ATTR_SCRIPT = "scr";
    public static final String ATTR_POSITION = "pos";

    private final NodeKind kind;
    private final String tag;
    private final Map<String, String> attributes;
    private final String text;
    private final List<MathNode> children;
    private MathNode parent;

    private MathNode(NodeKind kind, String tag, Map<String, String> attributes, String text, List<MathNode> children) {
        this.kind = kind;
        this.tag = tag;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = text;
        this.children = List.copyOf(children);
        for (MathNode child : this.children) {
            if (child.parent != null) {
                throw new IllegalStateException("Node <" + child.tag + "> already belongs to <" + child.parent.tag + ">");
            }
            child.parent = this;
        }
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /** Text-run leaf with the given literal text. */
    public static MathNode run(String text) {
        return builder(NodeKind.TEXT_RUN).text(text).build();
    }

    public static MathNode of(NodeKind kind, MathNode... children) {
        Builder builder = builder(kind);
        for (MathNode child : children) {
            builder.child(child);
        }
        return builder.build();
    }

    public NodeKind getKind() {
        return kind;
    }

    /** Local element name as found in the source document. */
    public String getTag() {
        return tag;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /** Literal text for text-run leaves, empty for every other node. */
    public String getText() {
        return text;
    }

    public List<MathNode> getChildren() {
        return children;
    }

    /** Enclosing node, {@code null} for a root. */
    public MathNode getParent() {
        return parent;
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return "MathNode{" + tag + (text.isEmpty() ? "" : ", '" + text + "'") + ", children=" + children.size() + "}";
    }

    public static final class Builder {
        private final NodeKind kind;
        private String tag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String text = "";
        private final List<MathNode> children = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = kind == null ? NodeKind.UNKNOWN : kind;
            this.tag = this.kind.getTag();
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder attribute(String name, String value) {
            if (name != null && value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public Builder text(String text) {
            this.text = text == null ? "" : text;
            return this;
        }

        public Builder child(MathNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        public Builder children(List<MathNode> nodes) {
            for (MathNode node : nodes) {
                child(node);
            }
            return this;
        }

        public MathNode build() {
            return new MathNode(kind, tag == null ? "unknown" : tag, attributes, text, children);
        }
    }
}
