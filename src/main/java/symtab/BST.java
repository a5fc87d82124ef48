package symtab;

import org.apache.log4j.Logger;

import java.util.ArrayDeque;
import java.util.LinkedList;
import java.util.Queue;

/**
 * An ordered symbol table of generic key-value pairs, backed by an unbalanced
 * binary search tree whose nodes cache the size of their own subtree.
 *
 * <p>Supports {@code put}, {@code get}, {@code contains}, {@code delete},
 * {@code size} and {@code isEmpty}, plus the ordered operations {@code min},
 * {@code max}, {@code floor}, {@code ceiling}, {@code rank}, {@code select},
 * range counting and range enumeration.
 *
 * <p>Values cannot be {@code null}: {@code put(key, null)} is equivalent to
 * {@code delete(key)}. Keys are compared only through {@code compareTo};
 * {@code equals} and {@code hashCode} are never called.
 *
 * <p>Every operation other than {@code size}/{@code isEmpty} takes time
 * proportional to the height of the tree, which is linear in the worst case.
 * Deletion uses Hibbard's algorithm. Not thread-safe.
 */
public class BST<K extends Comparable<? super K>, V> {
    private static final Logger log = Logger.getLogger(BST.class);

    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final class Node<E, T> {
        final E key;
        T value;
        Node<E,T> left, right;
        int count;            // number of nodes in the subtree rooted here

        Node(final E key, final T value) {
            this.key = key;
            this.value = value;
            this.count = 1;
        }
    }

    private Node<K,V> root;

    public BST() {
    }

    // adopts a prebuilt tree as is, without checking it
    BST(final Node<K,V> root) {
        this.root = root;
    }

//--------------------------------------------------------------------------------
// SIZE
//--------------------------------------------------------------------------------

    public final int size() {
        return size(root);
    }

    public final boolean isEmpty() {
        return size() == 0;
    }

    private static int size(final Node<?,?> x) {
        return (x == null) ? 0 : x.count;
    }

//--------------------------------------------------------------------------------
// DICTIONARY
// - get      : value or null
// - contains : boolean
// - put      : insert or overwrite; null value deletes
// - delete   : idempotent
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean contains(final K key) {
        if (key == null) throw new IllegalArgumentException("argument to contains() is null");
        return get(key) != null;
    }

    /**
     * Returns the value associated with {@code key}, or {@code null} if the
     * key is not in the table.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     */
    public final V get(final K key) {
        if (key == null) throw new IllegalArgumentException("argument to get() is null");
        Node<K,V> x = root;
        while (x != null) {
            int cmp = key.compareTo(x.key);
            if      (cmp < 0) x = x.left;
            else if (cmp > 0) x = x.right;
            else              return x.value;
        }
        return null;
    }

    /**
     * Associates {@code value} with {@code key}, replacing any previous value.
     * A {@code null} value removes the key.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     */
    public final void put(final K key, final V value) {
        if (key == null) throw new IllegalArgumentException("calls put() with a null key");
        if (value == null) {
            delete(key);
            return;
        }
        root = put(root, key, value);
        assert check();
    }

    private Node<K,V> put(final Node<K,V> x, final K key, final V value) {
        if (x == null) return new Node<>(key, value);
        int cmp = key.compareTo(x.key);
        if      (cmp < 0) x.left  = put(x.left,  key, value);
        else if (cmp > 0) x.right = put(x.right, key, value);
        else              x.value = value;
        x.count = 1 + size(x.left) + size(x.right);
        return x;
    }

    /**
     * Removes {@code key} and its value. Does nothing if the key is absent.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     */
    public final void delete(final K key) {
        if (key == null) throw new IllegalArgumentException("calls delete() with a null key");
        if (isEmpty()) return;
        // one-node table: detach the root instead of recursing
        if (size() == 1) {
            if (key.compareTo(root.key) == 0) root = null;
        } else {
            root = delete(root, key);
        }
        assert check();
    }

    private Node<K,V> delete(Node<K,V> x, final K key) {
        if (x == null) return null;

        int cmp = key.compareTo(x.key);
        if      (cmp < 0) x.left  = delete(x.left,  key);
        else if (cmp > 0) x.right = delete(x.right, key);
        else {
            if (x.right == null) return x.left;
            if (x.left  == null) return x.right;
            // Hibbard: successor takes the place of x
            Node<K,V> t = x;
            x = min(t.right);
            x.right = deleteMin(t.right);
            x.left = t.left;
            if (log.isDebugEnabled())
                log.debug("replaced " + t.key + " with successor " + x.key);
        }
        x.count = 1 + size(x.left) + size(x.right);
        return x;
    }

    /**
     * Removes the smallest key and its value.
     *
     * @throws EmptySymbolTableException if the table is empty
     */
    public final void deleteMin() {
        if (isEmpty()) throw new EmptySymbolTableException("Symbol table underflow");
        root = deleteMin(root);
        assert check();
    }

    private Node<K,V> deleteMin(final Node<K,V> x) {
        if (x.left == null) return x.right;
        x.left = deleteMin(x.left);
        x.count = 1 + size(x.left) + size(x.right);
        return x;
    }

    /**
     * Removes the largest key and its value.
     *
     * @throws EmptySymbolTableException if the table is empty
     */
    public final void deleteMax() {
        if (isEmpty()) throw new EmptySymbolTableException("Symbol table underflow");
        root = deleteMax(root);
        assert check();
    }

    private Node<K,V> deleteMax(final Node<K,V> x) {
        if (x.right == null) return x.left;
        x.right = deleteMax(x.right);
        x.count = 1 + size(x.left) + size(x.right);
        return x;
    }

    /** Empties the table by repeatedly removing the minimum. */
    public final void clear() {
        while (!isEmpty()) deleteMin();
    }

//--------------------------------------------------------------------------------
// ORDERED OPERATIONS
//--------------------------------------------------------------------------------

    /** @throws EmptySymbolTableException if the table is empty */
    public final K min() {
        if (isEmpty()) throw new EmptySymbolTableException("calls min() with empty symbol table");
        return min(root).key;
    }

    private Node<K,V> min(final Node<K,V> x) {
        return (x.left == null) ? x : min(x.left);
    }

    /** @throws EmptySymbolTableException if the table is empty */
    public final K max() {
        if (isEmpty()) throw new EmptySymbolTableException("calls max() with empty symbol table");
        return max(root).key;
    }

    private Node<K,V> max(final Node<K,V> x) {
        return (x.right == null) ? x : max(x.right);
    }

    /**
     * Returns the largest key less than or equal to {@code key}.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     * @throws EmptySymbolTableException if the table is empty
     * @throws KeyNotFoundException if every key is greater than {@code key}
     */
    public final K floor(final K key) {
        if (key == null) throw new IllegalArgumentException("argument to floor() is null");
        if (isEmpty()) throw new EmptySymbolTableException("calls floor() with empty symbol table");
        Node<K,V> x = floor(root, key);
        if (x == null) throw new KeyNotFoundException("floor of " + key + " does not exist");
        return x.key;
    }

    private Node<K,V> floor(final Node<K,V> x, final K key) {
        if (x == null) return null;
        int cmp = key.compareTo(x.key);
        if (cmp == 0) return x;
        if (cmp <  0) return floor(x.left, key);
        Node<K,V> t = floor(x.right, key);
        return (t != null) ? t : x;
    }

    /**
     * Returns the smallest key greater than or equal to {@code key}.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     * @throws EmptySymbolTableException if the table is empty
     * @throws KeyNotFoundException if every key is less than {@code key}
     */
    public final K ceiling(final K key) {
        if (key == null) throw new IllegalArgumentException("argument to ceiling() is null");
        if (isEmpty()) throw new EmptySymbolTableException("calls ceiling() with empty symbol table");
        Node<K,V> x = ceiling(root, key);
        if (x == null) throw new KeyNotFoundException("ceiling of " + key + " does not exist");
        return x.key;
    }

    private Node<K,V> ceiling(final Node<K,V> x, final K key) {
        if (x == null) return null;
        int cmp = key.compareTo(x.key);
        if (cmp == 0) return x;
        if (cmp >  0) return ceiling(x.right, key);
        Node<K,V> t = ceiling(x.left, key);
        return (t != null) ? t : x;
    }

    /**
     * Returns the key of the given 0-based order position.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= k < size()}
     */
    public final K select(final int k) {
        if (k < 0 || k >= size())
            throw new IndexOutOfBoundsException("select(" + k + ") with size " + size());
        return select(root, k).key;
    }

    private Node<K,V> select(final Node<K,V> x, final int k) {
        int t = size(x.left);
        if      (t > k) return select(x.left,  k);
        else if (t < k) return select(x.right, k - t - 1);
        else            return x;
    }

    /**
     * Returns the number of keys strictly less than {@code key}.
     *
     * @throws IllegalArgumentException if {@code key} is {@code null}
     */
    public final int rank(final K key) {
        if (key == null) throw new IllegalArgumentException("argument to rank() is null");
        return rank(key, root);
    }

    private int rank(final K key, final Node<K,V> x) {
        if (x == null) return 0;
        int cmp = key.compareTo(x.key);
        if      (cmp < 0) return rank(key, x.left);
        else if (cmp > 0) return 1 + size(x.left) + rank(key, x.right);
        else              return size(x.left);
    }

    /**
     * Returns the number of keys in {@code [lo, hi]}.
     *
     * @throws IllegalArgumentException if either bound is {@code null}
     */
    public final int size(final K lo, final K hi) {
        if (lo == null) throw new IllegalArgumentException("first argument to size() is null");
        if (hi == null) throw new IllegalArgumentException("second argument to size() is null");

        if (lo.compareTo(hi) > 0) return 0;
        if (contains(hi)) return rank(hi) - rank(lo) + 1;
        else              return rank(hi) - rank(lo);
    }

//--------------------------------------------------------------------------------
// TRAVERSAL
//--------------------------------------------------------------------------------

    /** All keys in ascending order; empty if the table is empty. */
    public final Iterable<K> keys() {
        if (isEmpty()) return new ArrayDeque<>();
        return keys(min(), max());
    }

    /**
     * Keys in {@code [lo, hi]} in ascending order.
     *
     * @throws IllegalArgumentException if either bound is {@code null}
     */
    public final Iterable<K> keys(final K lo, final K hi) {
        if (lo == null) throw new IllegalArgumentException("first argument to keys() is null");
        if (hi == null) throw new IllegalArgumentException("second argument to keys() is null");

        Queue<K> queue = new ArrayDeque<>();
        keys(root, queue, lo, hi);
        return queue;
    }

    private void keys(final Node<K,V> x, final Queue<K> queue, final K lo, final K hi) {
        if (x == null) return;
        int cmplo = lo.compareTo(x.key);
        int cmphi = hi.compareTo(x.key);
        if (cmplo < 0) keys(x.left, queue, lo, hi);
        if (cmplo <= 0 && cmphi >= 0) queue.add(x.key);
        if (cmphi > 0) keys(x.right, queue, lo, hi);
    }

    /** Length of the longest root-to-leaf path; -1 for an empty table. */
    public final int height() {
        return height(root);
    }

    private int height(final Node<K,V> x) {
        if (x == null) return -1;
        return 1 + Math.max(height(x.left), height(x.right));
    }

    /** Keys in breadth-first order, for diagnostics. */
    public final Iterable<K> levelOrder() {
        Queue<K> keys = new ArrayDeque<>();
        // LinkedList because ArrayDeque rejects the null child placeholders
        Queue<Node<K,V>> queue = new LinkedList<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Node<K,V> x = queue.remove();
            if (x == null) continue;
            keys.add(x.key);
            queue.add(x.left);
            queue.add(x.right);
        }
        return keys;
    }

    /**
     *
     * INTEGRITY CHECK (FOR TESTBED)
     *
     */

    final boolean check() {
        boolean ordered = isBST();
        boolean sized = isSizeConsistent();
        // select() trusts the counts, so ranks are only checked on consistent sizes
        boolean ranked = sized && isRankConsistent();
        if (!ordered) log.warn("Not in symmetric order");
        if (!sized)   log.warn("Subtree counts not consistent");
        else if (!ranked) log.warn("Ranks not consistent");
        return ordered && sized && ranked;
    }

    // strict order also rules out a node being reachable twice
    final boolean isBST() {
        return isBST(root, null, null);
    }

    // every key in the subtree lies strictly between min and max (null = unbounded)
    private boolean isBST(final Node<K,V> x, final K min, final K max) {
        if (x == null) return true;
        if (min != null && x.key.compareTo(min) <= 0) return false;
        if (max != null && x.key.compareTo(max) >= 0) return false;
        return isBST(x.left, min, x.key) && isBST(x.right, x.key, max);
    }

    final boolean isSizeConsistent() {
        return isSizeConsistent(root);
    }

    private boolean isSizeConsistent(final Node<K,V> x) {
        if (x == null) return true;
        if (x.count != 1 + size(x.left) + size(x.right)) return false;
        return isSizeConsistent(x.left) && isSizeConsistent(x.right);
    }

    final boolean isRankConsistent() {
        for (int i = 0; i < size(); i++)
            if (i != rank(select(i))) return false;
        for (K key : keys())
            if (key.compareTo(select(rank(key))) != 0) return false;
        return true;
    }
}
