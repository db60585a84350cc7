package org.dxworks.ouxml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable element of a parsed OU-XML document.
 * <p>
 * Text follows the lxml convention: {@code text} is the character data before the first child
 * element and {@code tail} is the character data that follows this element inside its parent.
 * A node only knows its parent to answer {@link #getParentKind()}.
 */
public final class ContentNode {

    private final String namespaceUri;
    private final String tag;
    private final NodeKind kind;
    private final String text;
    private final String tail;
    private final Map<String, String> attributes;
    private final List<ContentNode> children;
    private ContentNode parent;

    public ContentNode(String tag, String text, String tail,
                       Map<String, String> attributes, List<ContentNode> children) {
        this(null, tag, text, tail, attributes, children);
    }

    public ContentNode(String namespaceUri, String tag, String text, String tail,
                       Map<String, String> attributes, List<ContentNode> children) {
        this.namespaceUri = namespaceUri;
        this.tag = tag;
        this.kind = NodeKind.fromTag(tag);
        this.text = text;
        this.tail = tail;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children == null ? List.of() : List.copyOf(children);
        for (ContentNode child : this.children) {
            if (child.parent != null) {
                throw new IllegalArgumentException("Node <" + child.tag + "> already belongs to <" + child.parent.tag + ">");
            }
            child.parent = this;
        }
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    /** Namespace of the element, or {@code null} when it has none. */
    public String getNamespaceUri() {
        return namespaceUri;
    }

    public String getTag() {
        return tag;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getTail() {
        return tail;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public List<ContentNode> getChildren() {
        return children;
    }

    /** Kind of the enclosing element, or {@code null} for a root node. */
    public NodeKind getParentKind() {
        return parent == null ? null : parent.kind;
    }

    public String getParentTag() {
        return parent == null ? null : parent.tag;
    }

    public ContentNode findFirstChild(NodeKind childKind) {
        for (ContentNode child : children) {
            if (child.kind == childKind) {
                return child;
            }
        }
        return null;
    }

    public List<ContentNode> findAllChildren(NodeKind childKind) {
        List<ContentNode> result = new ArrayList<>();
        for (ContentNode child : children) {
            if (child.kind == childKind) {
                result.add(child);
            }
        }
        return result;
    }

    /** All character data inside this element, excluding its own tail. */
    public String getTextContent() {
        StringBuilder sb = new StringBuilder();
        if (text != null) {
            sb.append(text);
        }
        for (ContentNode child : children) {
            sb.append(child.getTextContent());
            if (child.tail != null) {
                sb.append(child.tail);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "<" + tag + ">";
    }

    public static final class Builder {
        private final String tag;
        private String namespaceUri;
        private String text;
        private String tail;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<ContentNode> children = new ArrayList<>();

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder namespace(String namespaceUri) {
            this.namespaceUri = namespaceUri;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder tail(String tail) {
            this.tail = tail;
            return this;
        }

        public Builder attribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder child(ContentNode child) {
            children.add(child);
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public ContentNode build() {
            return new ContentNode(namespaceUri, tag, text, tail, attributes, children);
        }
    }
}
