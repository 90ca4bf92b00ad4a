package org.treefix.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * In-memory {@link SyntaxTree} built from {@link MutableNode}s.
 * <p>
 * Every mutation bumps the modification stamp, detaches removed subtrees and moves the
 * live {@link RangeMarker}s along with the text. The tree performs no locking of its own;
 * callers serialize mutations, e.g. through an {@code IMutationScheduler}.
 */
public final class MutableSyntaxTree implements SyntaxTree {

    private final MutableNode root;
    private final List<TrackingRangeMarker> markers = new ArrayList<>();
    private volatile long modificationStamp;

    /**
     * Constructs a tree around a detached root node.
     * @param root The root node.
     */
    public MutableSyntaxTree(MutableNode root) {
        Objects.requireNonNull(root, "root");
        if (root.isValid() || root.parent().isPresent()) {
            throw new IllegalStateException("Root node is already attached");
        }
        this.root = root;
        root.attachTo(this);
    }

    @Override
    public MutableNode root() {
        return root;
    }

    @Override
    public String text() {
        return root.text();
    }

    @Override
    public long modificationStamp() {
        return modificationStamp;
    }

    @Override
    public RangeMarker createRangeMarker(TextRange range) {
        if (range.endOffset() > root.length()) {
            throw new IllegalArgumentException("Range " + range + " exceeds text length " + root.length());
        }
        TrackingRangeMarker marker = new TrackingRangeMarker(range.startOffset(), range.endOffset());
        markers.add(marker);
        return marker;
    }

    /**
     * Replaces the text of a leaf node.
     * @param leaf The leaf to change.
     * @param newText The new text.
     */
    public void setText(MutableNode leaf, String newText) {
        requireOwned(leaf);
        if (!leaf.isLeaf()) {
            throw new IllegalArgumentException("Only leaf nodes carry text: " + leaf);
        }
        TextRange range = leaf.textRange();
        leaf.updateText(Objects.requireNonNull(newText, "newText"));
        changed(range, newText.length());
    }

    /**
     * Replaces a node, detaching it and its subtree.
     * @param node The node to replace.
     * @param replacement A detached node taking its place.
     */
    public void replace(MutableNode node, MutableNode replacement) {
        MutableNode parent = requireNonRoot(node);
        TextRange range = node.textRange();
        List<MutableNode> siblings = parent.mutableChildren();
        int index = siblings.indexOf(node);
        node.detach();
        replacement.adoptBy(parent);
        siblings.set(index, replacement);
        changed(range, replacement.length());
    }

    /**
     * Removes a node from the tree, detaching it and its subtree.
     * @param node The node to delete.
     */
    public void delete(MutableNode node) {
        MutableNode parent = requireNonRoot(node);
        TextRange range = node.textRange();
        parent.mutableChildren().remove(node);
        node.detach();
        changed(range, 0);
    }

    /**
     * Inserts a detached node as a child of a composite node.
     * @param parent The new parent.
     * @param index The position among the parent's children.
     * @param child The node to insert.
     */
    public void insertChild(MutableNode parent, int index, MutableNode child) {
        requireOwned(parent);
        if (parent.isLeaf()) {
            throw new IllegalArgumentException("Cannot add children to leaf " + parent);
        }
        List<MutableNode> siblings = parent.mutableChildren();
        int offset = index < siblings.size()
                ? siblings.get(index).startOffset()
                : parent.startOffset() + parent.length();
        child.adoptBy(parent);
        siblings.add(index, child);
        changed(new TextRange(offset, offset), child.length());
    }

    /**
     * Collects all nodes of the given kind in depth-first, pre-order.
     * @param kind The kind to look for.
     * @return The matching nodes.
     */
    public List<MutableNode> nodesOfKind(String kind) {
        List<MutableNode> result = new ArrayList<>();
        visit(root, node -> {
            if (node.kind().equals(kind)) {
                result.add(node);
            }
        });
        return result;
    }

    private static void visit(MutableNode node, Consumer<MutableNode> visitor) {
        visitor.accept(node);
        for (MutableNode child : node.children()) {
            visit(child, visitor);
        }
    }

    private void requireOwned(MutableNode node) {
        if (node.tree() != this) {
            throw new IllegalArgumentException("Node does not belong to this tree: " + node);
        }
    }

    private MutableNode requireNonRoot(MutableNode node) {
        requireOwned(node);
        return node.parent().orElseThrow(() -> new IllegalArgumentException("The root node cannot be replaced or deleted"));
    }

    private void changed(TextRange replaced, int newLength) {
        modificationStamp++;
        for (TrackingRangeMarker marker : markers) {
            marker.onEdit(replaced.startOffset(), replaced.endOffset(), newLength);
        }
        markers.removeIf(marker -> !marker.isValid());
    }

    private final class TrackingRangeMarker implements RangeMarker {

        private int start;
        private int end;
        private boolean valid = true;

        private TrackingRangeMarker(int start, int end) {
            this.start = start;
            this.end = end;
        }

        @Override
        public boolean isValid() {
            return valid;
        }

        @Override
        public TextRange range() {
            if (!valid) {
                throw new IllegalStateException("Range marker is no longer valid");
            }
            return new TextRange(start, end);
        }

        @Override
        public void dispose() {
            valid = false;
            markers.remove(this);
        }

        void onEdit(int editStart, int editEnd, int newLength) {
            int delta = newLength - (editEnd - editStart);
            if (editEnd <= start) {
                start += delta;
                end += delta;
                return;
            }
            if (editStart >= end) {
                return;
            }
            if (editStart == start && editEnd == end && newLength == 0) {
                valid = false;
            } else if (editStart >= start && editEnd <= end) {
                end += delta;
            } else if (editStart <= start && editEnd >= end) {
                valid = false;
            } else if (editStart < start) {
                start = editStart + newLength;
                end += delta;
            } else {
                end = editStart;
            }
        }
    }
}
