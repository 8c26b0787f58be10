package rbtree;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the red-black rules after mixed insert/remove sequences, and the
 * height bound that follows from them.
 */
class RedBlackInvariantTest {

    private static double maxHeight(int n) {
        return 2 * (Math.log(n + 1) / Math.log(2));
    }

    @RepeatedTest(5)
    void invariants_hold_after_every_operation(RepetitionInfo info) {
        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        Random rnd = new Random(1000L + info.getCurrentRepetition());

        for (int i = 0; i < 3000; i++) {
            int k = rnd.nextInt(500);
            if (rnd.nextInt(100) < 55) {
                t.put(k, i);
            } else {
                t.remove(k);
            }
            assertDoesNotThrow(() -> { t.verifyInvariants(); }, "after op " + i + " on key " + k);
        }
    }

    @RepeatedTest(3)
    void matches_hash_map_at_every_step(RepetitionInfo info) {
        RBTreeMap<Integer,String> t = new RBTreeMap<>();
        Map<Integer,String> ref = new HashMap<>();
        Random rnd = new Random(77L * info.getCurrentRepetition());

        for (int i = 0; i < 5000; i++) {
            int k = rnd.nextInt(300);
            switch (rnd.nextInt(4)) {
                case 0:
                case 1:
                    assertEquals(ref.put(k, "v" + i), t.put(k, "v" + i), "put " + k);
                    break;
                case 2:
                    assertEquals(ref.remove(k), t.remove(k), "remove " + k);
                    break;
                default:
                    break;
            }
            int probe = rnd.nextInt(300);
            assertEquals(ref.get(probe), t.get(probe), "get " + probe);
            assertEquals(ref.containsKey(probe), t.containsKey(probe), "containsKey " + probe);
            assertEquals(ref.size(), t.size(), "size");
            assertEquals(ref.isEmpty(), t.isEmpty(), "isEmpty");
        }
        t.verifyInvariants();
    }

    @Test
    void height_bound_for_random_inserts_up_to_10000() {
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) keys.add(i);
        Collections.shuffle(keys, new Random(2024));

        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        int n = 0;
        for (Integer k : keys) {
            t.put(k, k);
            n++;
            int h = t.height();
            assertTrue(h <= maxHeight(n), "height " + h + " exceeds bound for n=" + n);
        }
        t.verifyInvariants();
    }

    @Test
    void height_bound_for_sorted_inserts() {
        // ascending input is the worst case for an unbalanced BST
        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        for (int n = 1; n <= 10_000; n++) {
            t.put(n, n);
            if (n % 100 == 0) {
                assertTrue(t.height() <= maxHeight(n), "height " + t.height() + " for n=" + n);
            }
        }
        t.verifyInvariants();

        RBTreeMap<Integer,Integer> d = new RBTreeMap<>();
        for (int n = 10_000; n >= 1; n--) d.put(n, n);
        assertTrue(d.height() <= maxHeight(10_000));
        d.verifyInvariants();
    }

    @Test
    void height_bound_survives_deletions() {
        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        for (int i = 0; i < 8192; i++) t.put(i, i);
        // delete every other key, then a contiguous block, to hit the deletion fixup cases
        for (int i = 0; i < 8192; i += 2) t.remove(i);
        for (int i = 1; i < 4096; i += 2) t.remove(i);

        assertEquals(2048, t.size());
        assertTrue(t.height() <= maxHeight(t.size()));
        t.verifyInvariants();
    }

    @Test
    void black_height_of_small_trees() {
        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        assertEquals(0, t.verifyInvariants());
        t.put(1, 1);
        assertEquals(1, t.verifyInvariants());
        t.put(2, 2);
        t.put(3, 3);
        // 2 black at the root, 1 and 3 red
        assertEquals(2, t.rootKey());
        assertEquals(1, t.verifyInvariants());
        t.put(4, 4);
        // uncle recoloring pushes 1 and 3 to black
        assertEquals(2, t.verifyInvariants());
    }

    @Test
    void validator_detects_broken_trees() {
        RBTreeMap<Integer,Integer> t = new RBTreeMap<>();
        for (int i = 1; i <= 7; i++) t.put(i, i);
        assertTrue(t.isValidRedBlackTree());

        t.root.color = RBTreeMap.Color.RED;
        IllegalStateException e = assertThrows(IllegalStateException.class, t::verifyInvariants);
        assertTrue(e.getMessage().contains("not black"), e.getMessage());
        assertFalse(t.isValidRedBlackTree());
        t.root.color = RBTreeMap.Color.BLACK;

        // flipping a leaf to black unbalances the black-height
        RBTreeMap.Node<Integer,Integer> leaf = RBTreeMap.minimum(t.root);
        RBTreeMap.Color saved = leaf.color;
        leaf.color = (saved == RBTreeMap.Color.RED) ? RBTreeMap.Color.BLACK : RBTreeMap.Color.RED;
        assertFalse(t.isValidRedBlackTree());
        leaf.color = saved;
        assertTrue(t.isValidRedBlackTree());
    }
}
