package bench;

import rbtree.RBTreeMap;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

public class MicroBench {

    // Common surface so both maps run the identical workload
    interface KV {
        void insert(int k);
        void delete(int k);
        Integer get(int k);
        int size();
    }

    static class RedBlackKV implements KV {
        private final RBTreeMap<Integer,Integer> map = new RBTreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public void delete(int k) { map.remove(k); }
        public Integer get(int k) { return map.get(k); }
        public int size() { return map.size(); }
    }

    static class JdkTreeMapKV implements KV {
        private final TreeMap<Integer,Integer> map = new TreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public void delete(int k) { map.remove(k); }
        public Integer get(int k) { return map.get(k); }
        public int size() { return map.size(); }
    }

    static long run(KV ds, int seconds, int keyRange) {
        // Preload half the key range
        for (int i = 0; i < keyRange; i += 2) ds.insert(i);

        Random rnd = new Random(42);
        long ops = 0;
        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        while (System.nanoTime() < endAt) {
            int k = rnd.nextInt(keyRange);
            int r = rnd.nextInt(100);
            // 80% gets, 10% inserts, 10% deletes
            if (r < 80) { ds.get(k); }
            else if (r < 90) { ds.insert(k); }
            else { ds.delete(k); }
            ops++;
        }
        return ops;
    }

    public static void main(String[] args) {
        int seconds = (args.length >= 1) ? Integer.parseInt(args[0]) : 3;
        int keyRange = (args.length >= 2) ? Integer.parseInt(args[1]) : 200_000;

        KV[] structures = { new RedBlackKV(), new JdkTreeMapKV() };
        String[] names = { "RBTreeMap", "java.util.TreeMap" };

        for (int i = 0; i < structures.length; i++) {
            long totalOps = run(structures[i], seconds, keyRange);
            double mopsPerSec = totalOps / (double)seconds / 1_000_000.0;
            System.out.printf("%-18s Time=%ds, KeyRange=%d, TotalOps=%d, FinalSize=%d, Throughput=%.2f Mops/s%n",
                    names[i], seconds, keyRange, totalOps, structures[i].size(), mopsPerSec);
        }
    }
}
