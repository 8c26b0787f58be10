package rbtree;

import java.util.AbstractMap;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Sorted map backed by a red-black tree.
 *
 * Every public operation leaves the tree satisfying the red-black rules:
 * the root is black, no red node has a red child, and every path from a node
 * down to an empty child position crosses the same number of black nodes.
 * Together these bound the height by 2*log2(n+1), so put, get and remove are
 * logarithmic in the worst case.
 *
 * Not thread-safe. Callers that share an instance must lock externally, and
 * must not mutate the map while one of its iterators is in use.
 */
public class RBTreeMap<K extends Comparable<? super K>, V> implements Iterable<Map.Entry<K,V>> {
    //--------------------------------------------------------------------------------
    // Class: Color, Node
    //--------------------------------------------------------------------------------
    enum Color { RED, BLACK }

    static final class Node<E extends Comparable<? super E>, V> implements Map.Entry<E,V> {
        final E key;
        V value;
        Color color;
        Node<E,V> left;
        Node<E,V> right;
        Node<E,V> parent;   // back-reference for fixup and traversal, never owning

        Node(final E key, final V value, final Node<E,V> parent) {
            this.key = key;
            this.value = value;
            this.parent = parent;
            this.color = Color.RED;
        }

        @Override
        public E getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        /** PRECONDITION: value CANNOT BE NULL **/
        @Override
        public V setValue(final V value) {
            if (value == null) throw new NullPointerException();
            final V old = this.value;
            this.value = value;
            return old;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof Map.Entry)) return false;
            final Map.Entry<?,?> e = (Map.Entry<?,?>) o;
            return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
        }

        @Override
        public int hashCode() {
            return key.hashCode() ^ value.hashCode();
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }

//--------------------------------------------------------------------------------
// DICTIONARY
//--------------------------------------------------------------------------------
    Node<K,V> root;
    private int size;
    private int modCount;   // structural changes only, checked by iterators

    public RBTreeMap() {
        // empty tree: no root, no sentinel nodes
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - get / containsKey / at   : lookup
// - put / replaceAt          : insert or overwrite
// - remove                   : delete
//--------------------------------------------------------------------------------

    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return size == 0;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean containsKey(final K key) {
        return get(key) != null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final V get(final K key) {
        if (key == null) throw new NullPointerException();
        final Node<K,V> n = search(key);
        return (n != null) ? n.value : null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final Map.Entry<K,V> getEntry(final K key) {
        if (key == null) throw new NullPointerException();
        return exportEntry(search(key));
    }

    /**
     * Indexed access: the caller asserts that {@code key} is present.
     *
     * @throws NoSuchElementException if the key is not in the map
     */
    public final V at(final K key) {
        if (key == null) throw new NullPointerException();
        final Node<K,V> n = search(key);
        if (n == null) throw new NoSuchElementException("key not found: " + key);
        return n.value;
    }

    /**
     * Overwrites the value of a key the caller asserts is present.
     *
     * @return the value previously stored under {@code key}
     * @throws NoSuchElementException if the key is not in the map
     */
    public final V replaceAt(final K key, final V value) {
        if (key == null || value == null) throw new NullPointerException();
        final Node<K,V> n = search(key);
        if (n == null) throw new NoSuchElementException("key not found: " + key);
        final V old = n.value;
        n.value = value;
        return old;
    }

    // Insert key to dictionary, returns the previous value associated with the specified key,
    // or null if there was no mapping for the key
    /** PRECONDITION: key, value CANNOT BE NULL **/
    public final V put(final K key, final V value) {
        if (key == null || value == null) throw new NullPointerException();

        /** SEARCH **/
        Node<K,V> p = null;
        Node<K,V> l = root;
        int cmp = 0;
        while (l != null) {
            p = l;
            cmp = key.compareTo(l.key);
            if (cmp < 0) {
                l = l.left;
            } else if (cmp > 0) {
                l = l.right;
            } else {
                // key already in the tree, overwrite in place, no structural change
                final V old = l.value;
                l.value = value;
                return old;
            }
        }
        /** END SEARCH **/

        final Node<K,V> newNode = new Node<>(key, value, p);
        if (p == null) {
            root = newNode;
        } else if (cmp < 0) {
            p.left = newNode;
        } else {
            p.right = newNode;
        }
        size++;
        modCount++;
        fixAfterInsert(newNode);
        return null;
    }

    // Delete key from dictionary, return the associated value when successful, null otherwise
    /** PRECONDITION: key CANNOT BE NULL **/
    public final V remove(final K key) {
        if (key == null) throw new NullPointerException();
        final Node<K,V> z = search(key);
        if (z == null) return null;
        final V old = z.value;
        deleteNode(z);
        return old;
    }

    public final void clear() {
        modCount++;
        size = 0;
        root = null;
    }

    public final Map.Entry<K,V> firstEntry() {
        return exportEntry(minimum(root));
    }

    public final Map.Entry<K,V> lastEntry() {
        return exportEntry(maximum(root));
    }

    public final Map.Entry<K,V> pollFirstEntry() {
        final Node<K,V> n = minimum(root);
        final Map.Entry<K,V> result = exportEntry(n);
        if (n != null) deleteNode(n);
        return result;
    }

    public final Map.Entry<K,V> pollLastEntry() {
        final Node<K,V> n = maximum(root);
        final Map.Entry<K,V> result = exportEntry(n);
        if (n != null) deleteNode(n);
        return result;
    }

//--------------------------------------------------------------------------------
// ITERATION
// - iterator / descendingIterator : entries, live values, structure read-only
// - keys / values / descending    : restartable views
//--------------------------------------------------------------------------------

    @Override
    public final Iterator<Map.Entry<K,V>> iterator() {
        return new EntryIterator(minimum(root), true);
    }

    public final Iterator<Map.Entry<K,V>> descendingIterator() {
        return new EntryIterator(maximum(root), false);
    }

    public final Iterable<Map.Entry<K,V>> descending() {
        return this::descendingIterator;
    }

    public final Iterable<K> keys() {
        return () -> new KeyIterator(minimum(root));
    }

    public final Iterable<V> values() {
        return () -> new ValueIterator(minimum(root));
    }

    private abstract class NodeIterator<T> implements Iterator<T> {
        private Node<K,V> next;
        private final boolean ascending;
        private final int expectedModCount;

        NodeIterator(final Node<K,V> first, final boolean ascending) {
            this.next = first;
            this.ascending = ascending;
            this.expectedModCount = modCount;
        }

        @Override
        public final boolean hasNext() {
            return next != null;
        }

        final Node<K,V> nextNode() {
            if (modCount != expectedModCount) throw new ConcurrentModificationException();
            final Node<K,V> e = next;
            if (e == null) throw new NoSuchElementException();
            next = ascending ? successor(e) : predecessor(e);
            return e;
        }
    }

    private final class EntryIterator extends NodeIterator<Map.Entry<K,V>> {
        EntryIterator(final Node<K,V> first, final boolean ascending) {
            super(first, ascending);
        }

        @Override
        public Map.Entry<K,V> next() {
            return nextNode();
        }
    }

    private final class KeyIterator extends NodeIterator<K> {
        KeyIterator(final Node<K,V> first) {
            super(first, true);
        }

        @Override
        public K next() {
            return nextNode().key;
        }
    }

    private final class ValueIterator extends NodeIterator<V> {
        ValueIterator(final Node<K,V> first) {
            super(first, true);
        }

        @Override
        public V next() {
            return nextNode().value;
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        for (Node<K,V> n = minimum(root); n != null; n = successor(n)) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(n.key).append('=').append(n.value);
        }
        return sb.append('}').toString();
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
// - search
// - fixAfterInsert
// - deleteNode / fixAfterDelete
// - rotateLeft / rotateRight
//--------------------------------------------------------------------------------

    final Node<K,V> search(final K key) {
        Node<K,V> l = root;
        while (l != null) {
            final int cmp = key.compareTo(l.key);
            if (cmp < 0) l = l.left;
            else if (cmp > 0) l = l.right;
            else return l;
        }
        return null;
    }

    private void fixAfterInsert(Node<K,V> x) {
        Node<K,V> p;
        while ((p = x.parent) != null && p.color == Color.RED) {
            // p is red, so it is not the root and gp exists
            final Node<K,V> gp = p.parent;
            if (p == gp.left) {
                final Node<K,V> uncle = gp.right;
                if (colorOf(uncle) == Color.RED) {
                    p.color = Color.BLACK;
                    uncle.color = Color.BLACK;
                    gp.color = Color.RED;
                    x = gp;
                    continue;
                }
                if (x == p.right) {
                    // triangle: turn it into a line first
                    rotateLeft(p);
                    x = p;
                    p = x.parent;
                }
                p.color = Color.BLACK;
                gp.color = Color.RED;
                rotateRight(gp);
            } else {
                final Node<K,V> uncle = gp.left;
                if (colorOf(uncle) == Color.RED) {
                    p.color = Color.BLACK;
                    uncle.color = Color.BLACK;
                    gp.color = Color.RED;
                    x = gp;
                    continue;
                }
                if (x == p.left) {
                    rotateRight(p);
                    x = p;
                    p = x.parent;
                }
                p.color = Color.BLACK;
                gp.color = Color.RED;
                rotateLeft(gp);
            }
        }
        root.color = Color.BLACK;
    }

    private void deleteNode(final Node<K,V> z) {
        Node<K,V> x;            // node now occupying the vacated position, may be null
        Node<K,V> xParent;      // parent of that position, tracked because x may be null
        Color removedColor;

        if (z.left == null) {
            x = z.right;
            xParent = z.parent;
            removedColor = z.color;
            transplant(z, z.right);
        } else if (z.right == null) {
            x = z.left;
            xParent = z.parent;
            removedColor = z.color;
            transplant(z, z.left);
        } else {
            // keys are final, so the in-order successor is relinked into z's place
            // instead of having its key copied into z
            final Node<K,V> y = minimum(z.right);
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
        modCount++;

        if (removedColor == Color.BLACK) fixAfterDelete(x, xParent);
    }

    private void fixAfterDelete(Node<K,V> x, Node<K,V> parent) {
        // x's side of parent is one black short; the sibling is never null
        while (x != root && colorOf(x) == Color.BLACK) {
            if (x == parent.left) {
                Node<K,V> sib = parent.right;
                if (colorOf(sib) == Color.RED) {
                    sib.color = Color.BLACK;
                    parent.color = Color.RED;
                    rotateLeft(parent);
                    sib = parent.right;
                }
                if (colorOf(sib.left) == Color.BLACK && colorOf(sib.right) == Color.BLACK) {
                    sib.color = Color.RED;
                    x = parent;
                    parent = x.parent;
                } else {
                    if (colorOf(sib.right) == Color.BLACK) {
                        // only the near nephew is red
                        sib.left.color = Color.BLACK;
                        sib.color = Color.RED;
                        rotateRight(sib);
                        sib = parent.right;
                    }
                    sib.color = parent.color;
                    parent.color = Color.BLACK;
                    sib.right.color = Color.BLACK;
                    rotateLeft(parent);
                    x = root;
                }
            } else {
                Node<K,V> sib = parent.left;
                if (colorOf(sib) == Color.RED) {
                    sib.color = Color.BLACK;
                    parent.color = Color.RED;
                    rotateRight(parent);
                    sib = parent.left;
                }
                if (colorOf(sib.left) == Color.BLACK && colorOf(sib.right) == Color.BLACK) {
                    sib.color = Color.RED;
                    x = parent;
                    parent = x.parent;
                } else {
                    if (colorOf(sib.left) == Color.BLACK) {
                        sib.right.color = Color.BLACK;
                        sib.color = Color.RED;
                        rotateLeft(sib);
                        sib = parent.left;
                    }
                    sib.color = parent.color;
                    parent.color = Color.BLACK;
                    sib.left.color = Color.BLACK;
                    rotateRight(parent);
                    x = root;
                }
            }
        }
        if (x != null) x.color = Color.BLACK;
    }

    // Put v (possibly null) in u's position under u's parent
    private void transplant(final Node<K,V> u, final Node<K,V> v) {
        if (u.parent == null) {
            root = v;
        } else if (u == u.parent.left) {
            u.parent.left = v;
        } else {
            u.parent.right = v;
        }
        if (v != null) v.parent = u.parent;
    }

    final void rotateLeft(final Node<K,V> x) {
        final Node<K,V> y = x.right;
        if (y == null) throw new IllegalStateException("rotateLeft needs a right child at " + x.key);
        x.right = y.left;
        if (y.left != null) y.left.parent = x;
        y.parent = x.parent;
        if (x.parent == null) {
            root = y;
        } else if (x == x.parent.left) {
            x.parent.left = y;
        } else {
            x.parent.right = y;
        }
        y.left = x;
        x.parent = y;
    }

    final void rotateRight(final Node<K,V> x) {
        final Node<K,V> y = x.left;
        if (y == null) throw new IllegalStateException("rotateRight needs a left child at " + x.key);
        x.left = y.right;
        if (y.right != null) y.right.parent = x;
        y.parent = x.parent;
        if (x.parent == null) {
            root = y;
        } else if (x == x.parent.right) {
            x.parent.right = y;
        } else {
            x.parent.left = y;
        }
        y.right = x;
        x.parent = y;
    }

    private static Color colorOf(final Node<?,?> n) {
        return (n == null) ? Color.BLACK : n.color;
    }

    private static <E extends Comparable<? super E>, T> Map.Entry<E,T> exportEntry(final Node<E,T> n) {
        return (n == null) ? null : new AbstractMap.SimpleImmutableEntry<>(n.key, n.value);
    }

    static <E extends Comparable<? super E>, T> Node<E,T> minimum(Node<E,T> n) {
        if (n == null) return null;
        while (n.left != null) n = n.left;
        return n;
    }

    static <E extends Comparable<? super E>, T> Node<E,T> maximum(Node<E,T> n) {
        if (n == null) return null;
        while (n.right != null) n = n.right;
        return n;
    }

    static <E extends Comparable<? super E>, T> Node<E,T> successor(final Node<E,T> n) {
        if (n.right != null) return minimum(n.right);
        Node<E,T> child = n;
        Node<E,T> p = n.parent;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    static <E extends Comparable<? super E>, T> Node<E,T> predecessor(final Node<E,T> n) {
        if (n.left != null) return maximum(n.left);
        Node<E,T> child = n;
        Node<E,T> p = n.parent;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    /**
     * Walks the whole tree and checks every red-black and ordering rule, plus
     * parent links and the cached size.
     *
     * @return the number of black nodes on each root-to-leaf path
     * @throws IllegalStateException naming the first rule found broken
     */
    public int verifyInvariants() {
        if (root == null) {
            if (size != 0) throw new IllegalStateException("empty tree but size is " + size);
            return 0;
        }
        if (root.parent != null) throw new IllegalStateException("root " + root.key + " has a parent link");
        if (root.color != Color.BLACK) throw new IllegalStateException("root " + root.key + " is not black");
        final int[] count = new int[1];
        final int blackHeight = verify(root, null, null, count);
        if (count[0] != size) {
            throw new IllegalStateException("size is " + size + " but tree holds " + count[0] + " nodes");
        }
        return blackHeight;
    }

    private int verify(final Node<K,V> n, final K lo, final K hi, final int[] count) {
        if (n == null) return 0;
        count[0]++;
        if (n.color == null) throw new IllegalStateException("node " + n.key + " has no color");
        if ((lo != null && n.key.compareTo(lo) <= 0) || (hi != null && n.key.compareTo(hi) >= 0)) {
            throw new IllegalStateException("key " + n.key + " out of order, expected within (" + lo + ", " + hi + ")");
        }
        if (n.color == Color.RED && (colorOf(n.left) == Color.RED || colorOf(n.right) == Color.RED)) {
            throw new IllegalStateException("red node " + n.key + " has a red child");
        }
        if ((n.left != null && n.left.parent != n) || (n.right != null && n.right.parent != n)) {
            throw new IllegalStateException("broken parent link below " + n.key);
        }
        final int lh = verify(n.left, lo, n.key, count);
        final int rh = verify(n.right, n.key, hi, count);
        if (lh != rh) {
            throw new IllegalStateException("black-height mismatch at " + n.key + ": left " + lh + ", right " + rh);
        }
        return lh + (n.color == Color.BLACK ? 1 : 0);
    }

    public boolean isValidRedBlackTree() {
        try {
            verifyInvariants();
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }

    public int height() {
        return height(root);
    }

    private int height(final Node<K,V> n) {
        if (n == null) return 0;
        return 1 + Math.max(height(n.left), height(n.right));
    }

    public int sizeStructural() {
        return sizeStructural(root);
    }

    private int sizeStructural(final Node<K,V> n) {
        if (n == null) return 0;
        return 1 + sizeStructural(n.left) + sizeStructural(n.right);
    }

    K rootKey() {
        return (root != null) ? root.key : null;
    }
}
