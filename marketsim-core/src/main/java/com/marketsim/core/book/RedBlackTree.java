package com.marketsim.core.book;

import java.util.function.Consumer;

/**
 * <h1>Intrusive Red-Black Tree of Price Levels</h1>
 *
 * <p>
 * Keeps one side of the book ordered by price in <b>O(log N)</b>. The
 * {@link PriceLevel} <i>is</i> the node: it carries its own left, right and
 * parent pointers, so inserting a level links pointers and allocates nothing.
 * </p>
 *
 * <h2>The Rules</h2>
 * <ol>
 * <li><b>Every node is either RED or BLACK.</b></li>
 * <li><b>The root is BLACK.</b></li>
 * <li><b>A RED node has no RED child.</b></li>
 * <li><b>Every root-to-leaf path has the same number of BLACK nodes.</b></li>
 * </ol>
 *
 * <p>
 * Together the rules bound the height at 2·log2(N+1), which is what makes
 * {@link #min()} / {@link #max()} cheap enough to call on every match step.
 * </p>
 */
public class RedBlackTree {

    private static final boolean RED = true;
    private static final boolean BLACK = false;

    private PriceLevel root;
    private int size;

    public PriceLevel getRoot() {
        return root;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Binary search by price.
     */
    public PriceLevel find(long price) {
        PriceLevel current = root;
        while (current != null) {
            if (price == current.price) {
                return current;
            }
            current = price < current.price ? current.left : current.right;
        }
        return null;
    }

    /**
     * Lowest price: the best ask.
     */
    public PriceLevel min() {
        return root == null ? null : leftmost(root);
    }

    /**
     * Highest price: the best bid.
     */
    public PriceLevel max() {
        return root == null ? null : rightmost(root);
    }

    /**
     * Links {@code node} into the tree.
     *
     * @return false when a level with the same price is already present
     */
    public boolean insert(PriceLevel node) {
        node.left = null;
        node.right = null;
        node.parent = null;
        node.color = RED;

        PriceLevel parent = null;
        PriceLevel current = root;
        while (current != null) {
            parent = current;
            if (node.price == current.price) {
                return false;
            }
            current = node.price < current.price ? current.left : current.right;
        }

        node.parent = parent;
        if (parent == null) {
            root = node;
        } else if (node.price < parent.price) {
            parent.left = node;
        } else {
            parent.right = node;
        }
        size++;
        fixAfterInsert(node);
        return true;
    }

    /**
     * Unlinks {@code z}. Nodes that are not members of this tree are ignored.
     */
    public void remove(PriceLevel z) {
        if (z == null || find(z.price) != z) {
            return;
        }

        PriceLevel y = z;
        boolean removedColor = y.color;
        PriceLevel x;
        PriceLevel xParent;

        if (z.left == null) {
            x = z.right;
            xParent = z.parent;
            transplant(z, z.right);
        } else if (z.right == null) {
            x = z.left;
            xParent = z.parent;
            transplant(z, z.left);
        } else {
            // Two children: the in-order successor takes z's place and colour.
            y = leftmost(z.right);
            removedColor = y.color;
            x = y.right;
            if (y.parent == z) {
                xParent = y;
            } else {
                xParent = y.parent;
                transplant(y, y.right);
                y.right = z.right;
                y.right.parent = y;
            }
            transplant(z, y);
            y.left = z.left;
            y.left.parent = y;
            y.color = z.color;
        }

        z.left = null;
        z.right = null;
        z.parent = null;
        size--;

        if (removedColor == BLACK) {
            fixAfterRemove(x, xParent);
        }
    }

    /**
     * Next higher price, or null.
     */
    public PriceLevel successor(PriceLevel node) {
        if (node.right != null) {
            return leftmost(node.right);
        }
        PriceLevel p = node.parent;
        PriceLevel child = node;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    /**
     * Next lower price, or null.
     */
    public PriceLevel predecessor(PriceLevel node) {
        if (node.left != null) {
            return rightmost(node.left);
        }
        PriceLevel p = node.parent;
        PriceLevel child = node;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    /**
     * Visits up to {@code limit} levels starting from the best price:
     * ascending for asks, descending for bids.
     */
    public void forEach(boolean ascending, int limit, Consumer<PriceLevel> visitor) {
        PriceLevel node = ascending ? min() : max();
        int visited = 0;
        while (node != null && visited < limit) {
            visitor.accept(node);
            visited++;
            node = ascending ? successor(node) : predecessor(node);
        }
    }

    // =========================================================================
    // Rebalancing
    // =========================================================================

    /**
     * A freshly inserted node is RED; the only rule it can break is "no RED
     * child of a RED parent". Either the uncle is RED and recolouring pushes
     * the problem two levels up, or one or two rotations settle it locally.
     */
    private void fixAfterInsert(PriceLevel node) {
        while (node != root && isRed(node.parent)) {
            PriceLevel parent = node.parent;
            PriceLevel grandparent = parent.parent;

            if (parent == grandparent.left) {
                PriceLevel uncle = grandparent.right;
                if (isRed(uncle)) {
                    parent.color = BLACK;
                    uncle.color = BLACK;
                    grandparent.color = RED;
                    node = grandparent;
                } else {
                    if (node == parent.right) {
                        node = parent;
                        rotateLeft(node);
                        parent = node.parent;
                    }
                    parent.color = BLACK;
                    grandparent.color = RED;
                    rotateRight(grandparent);
                }
            } else {
                PriceLevel uncle = grandparent.left;
                if (isRed(uncle)) {
                    parent.color = BLACK;
                    uncle.color = BLACK;
                    grandparent.color = RED;
                    node = grandparent;
                } else {
                    if (node == parent.left) {
                        node = parent;
                        rotateRight(node);
                        parent = node.parent;
                    }
                    parent.color = BLACK;
                    grandparent.color = RED;
                    rotateLeft(grandparent);
                }
            }
        }
        root.color = BLACK;
    }

    /**
     * Removing a BLACK node leaves the path through {@code x} one BLACK short.
     * {@code x} may be null (an empty leaf), so its parent is tracked separately.
     */
    private void fixAfterRemove(PriceLevel x, PriceLevel parent) {
        while (x != root && isBlack(x)) {
            if (x == parent.left) {
                PriceLevel sibling = parent.right;
                if (isRed(sibling)) {
                    sibling.color = BLACK;
                    parent.color = RED;
                    rotateLeft(parent);
                    sibling = parent.right;
                }
                if (isBlack(sibling.left) && isBlack(sibling.right)) {
                    sibling.color = RED;
                    x = parent;
                    parent = x.parent;
                } else {
                    if (isBlack(sibling.right)) {
                        sibling.left.color = BLACK;
                        sibling.color = RED;
                        rotateRight(sibling);
                        sibling = parent.right;
                    }
                    sibling.color = parent.color;
                    parent.color = BLACK;
                    if (sibling.right != null) {
                        sibling.right.color = BLACK;
                    }
                    rotateLeft(parent);
                    x = root;
                    parent = null;
                }
            } else {
                PriceLevel sibling = parent.left;
                if (isRed(sibling)) {
                    sibling.color = BLACK;
                    parent.color = RED;
                    rotateRight(parent);
                    sibling = parent.left;
                }
                if (isBlack(sibling.right) && isBlack(sibling.left)) {
                    sibling.color = RED;
                    x = parent;
                    parent = x.parent;
                } else {
                    if (isBlack(sibling.left)) {
                        sibling.right.color = BLACK;
                        sibling.color = RED;
                        rotateLeft(sibling);
                        sibling = parent.left;
                    }
                    sibling.color = parent.color;
                    parent.color = BLACK;
                    if (sibling.left != null) {
                        sibling.left.color = BLACK;
                    }
                    rotateRight(parent);
                    x = root;
                    parent = null;
                }
            }
        }
        if (x != null) {
            x.color = BLACK;
        }
    }

    /**
     * <pre>
     *      P            R
     *     / \          / \
     *    a   R   ==&gt;  P   c
     *       / \      / \
     *      b   c    a   b
     * </pre>
     */
    private void rotateLeft(PriceLevel p) {
        PriceLevel r = p.right;
        p.right = r.left;
        if (r.left != null) {
            r.left.parent = p;
        }
        r.parent = p.parent;
        if (p.parent == null) {
            root = r;
        } else if (p == p.parent.left) {
            p.parent.left = r;
        } else {
            p.parent.right = r;
        }
        r.left = p;
        p.parent = r;
    }

    /**
     * Mirror of {@link #rotateLeft}.
     */
    private void rotateRight(PriceLevel p) {
        PriceLevel l = p.left;
        p.left = l.right;
        if (l.right != null) {
            l.right.parent = p;
        }
        l.parent = p.parent;
        if (p.parent == null) {
            root = l;
        } else if (p == p.parent.right) {
            p.parent.right = l;
        } else {
            p.parent.left = l;
        }
        l.right = p;
        p.parent = l;
    }

    /**
     * Hangs {@code v} where {@code u} was. {@code u}'s own pointers are left alone.
     */
    private void transplant(PriceLevel u, PriceLevel v) {
        if (u.parent == null) {
            root = v;
        } else if (u == u.parent.left) {
            u.parent.left = v;
        } else {
            u.parent.right = v;
        }
        if (v != null) {
            v.parent = u.parent;
        }
    }

    private static PriceLevel leftmost(PriceLevel node) {
        while (node.left != null) {
            node = node.left;
        }
        return node;
    }

    private static PriceLevel rightmost(PriceLevel node) {
        while (node.right != null) {
            node = node.right;
        }
        return node;
    }

    private static boolean isRed(PriceLevel p) {
        return p != null && p.color == RED;
    }

    private static boolean isBlack(PriceLevel p) {
        return p == null || p.color == BLACK;
    }
}
