package symtab;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class BSTBasicTests {

    @Test
    void sanity_behavesLikeMap() {
        BST<Integer,Integer> map = new BST<>();

        // empty
        assertNull(map.get(5));
        assertTrue(map.isEmpty());

        // insert new
        map.put(5, 50);
        assertEquals(50, map.get(5));
        assertEquals(1, map.size());

        // overwrite in place, size unchanged
        map.put(5, 55);
        assertEquals(55, map.get(5));
        assertEquals(1, map.size());

        map.delete(5);
        assertNull(map.get(5));
        assertFalse(map.contains(5));
        assertTrue(map.isEmpty());

        map.delete(5); // deleting again is a no-op
        assertTrue(map.isEmpty());
    }

    @Test
    void put_null_value_deletes() {
        BST<String,Integer> st = new BST<>();
        st.put("a", 1);
        st.put("b", 2);
        st.put("c", 3);

        st.put("b", null);
        assertFalse(st.contains("b"));
        assertEquals(2, st.size());
        assertEquals(List.of("a", "c"), toList(st.keys()));

        // absent key with null value: nothing to delete
        st.put("zz", null);
        assertEquals(2, st.size());
    }

    @Test
    void delete_twice_is_idempotent() {
        BST<Integer,Integer> t = new BST<>();
        for (int k : new int[]{4, 2, 6, 1, 3, 5, 7}) t.put(k, k);

        t.delete(2);
        List<Integer> shape = toList(t.levelOrder());
        int size = t.size();

        t.delete(2);
        assertEquals(shape, toList(t.levelOrder()), "second delete must not touch the tree");
        assertEquals(size, t.size());
        assertTrue(t.check());
    }

    @Test
    void delete_missing_key_from_one_node_table_keeps_it() {
        BST<String,Integer> st = new BST<>();
        st.put("B", 1);
        st.delete("A");
        assertEquals(1, st.size());
        assertEquals(1, st.get("B"));

        st.delete("B");
        assertTrue(st.isEmpty());
        assertEquals(-1, st.height());
    }

    @Test
    void deleting_root_of_two_node_tree_keeps_right_child() {
        BST<String,Integer> st = new BST<>();
        st.put("A", 0);
        st.put("B", 1);
        assertEquals(List.of("A", "B"), toList(st.levelOrder()), "A is root, B its right child");

        st.delete("A");
        assertEquals(1, st.size());
        assertEquals(1, st.get("B"));
        assertFalse(st.contains("A"));
        assertEquals(0, st.height());
    }

    @Test
    void deleteMin_and_deleteMax() {
        BST<Integer,String> t = new BST<>();
        for (int k : new int[]{50, 25, 75, 10, 30, 60, 80}) t.put(k, "v" + k);

        t.deleteMin();
        assertEquals(25, t.min());
        t.deleteMax();
        assertEquals(75, t.max());
        assertEquals(5, t.size());

        t.clear();
        assertTrue(t.isEmpty());
        assertNull(t.get(50));
        assertFalse(t.keys().iterator().hasNext());
    }

    @Test
    void height_tracks_shape() {
        BST<Integer,Integer> t = new BST<>();
        assertEquals(-1, t.height());
        t.put(1, 1);
        assertEquals(0, t.height());

        // ascending inserts degenerate into a right spine
        for (int i = 2; i <= 10; i++) t.put(i, i);
        assertEquals(9, t.height());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), toList(t.levelOrder()));
    }

    @RepeatedTest(5)
    void randomized_vs_TreeMap(RepetitionInfo info) {
        BST<Integer,Integer> t = new BST<>();
        TreeMap<Integer,Integer> ref = new TreeMap<>();
        Random rnd = new Random(12345L + info.getCurrentRepetition());

        for (int i = 0; i < 2000; i++) {
            int k = rnd.nextInt(200);
            int op = rnd.nextInt(5);

            if (op <= 1) {
                t.put(k, k * 7);
                ref.put(k, k * 7);
            } else if (op == 2) {
                t.delete(k);
                ref.remove(k);
            } else if (op == 3) {
                t.put(k, null);
                ref.remove(k);
            } else if (!ref.isEmpty()) {
                if (rnd.nextBoolean()) { t.deleteMin(); ref.pollFirstEntry(); }
                else                   { t.deleteMax(); ref.pollLastEntry(); }
            }

            assertEquals(ref.size(), t.size(), "size");
            assertEquals(ref.get(k), t.get(k), "get " + k);

            int a = rnd.nextInt(200);
            assertEquals(ref.containsKey(a), t.contains(a), "contains " + a);
            assertEquals(ref.headMap(a).size(), t.rank(a), "rank " + a);

            if (!ref.isEmpty()) {
                int idx = rnd.nextInt(ref.size());
                assertEquals(nthKey(ref, idx), t.select(idx), "select(" + idx + ")");
                assertEquals(ref.firstKey(), t.min());
                assertEquals(ref.lastKey(), t.max());
            }
        }

        assertTrue(t.check());
        assertEquals(new ArrayList<>(ref.keySet()), toList(t.keys()));
    }

    /* ---- helpers ---- */

    static <T> List<T> toList(Iterable<T> it) {
        List<T> out = new ArrayList<>();
        for (T x : it) out.add(x);
        return out;
    }

    private static <K extends Comparable<? super K>,V> K nthKey(TreeMap<K,V> tm, int n0based) {
        int i = 0;
        for (K k : tm.keySet()) {
            if (i++ == n0based) return k;
        }
        return null;
    }
}
