package io.syncvault.integrity;

import io.syncvault.util.Hashing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collection-level fingerprint built by pairwise hashing of record checksums.
 *
 * <p>Each level hashes the concatenation of adjacent hex digests; an odd trailing digest is
 * paired with itself. {@link #root(List)} hashes the list in the order given, while
 * {@link #rootByKey(Map)} first orders the checksums by primary key so physical storage order
 * never influences the result.
 */
public final class MerkleFingerprint {
    /** Root of an empty collection: SHA-256 of the empty byte string. */
    public static final String EMPTY_ROOT = Hashing.sha256Hex(new byte[0]);

    private MerkleFingerprint() {
    }

    public static String root(List<String> checksums) {
        if (checksums == null || checksums.isEmpty()) {
            return EMPTY_ROOT;
        }
        List<String> level = new ArrayList<>(checksums);
        do {
            level = nextLevel(level);
        } while (level.size() > 1);
        return level.get(0);
    }

    public static String rootByKey(Map<String, String> checksumsByKey) {
        return root(new ArrayList<>(new TreeMap<>(checksumsByKey).values()));
    }

    /**
     * All levels from the leaves up to the root, for callers that want to descend into the
     * first differing subtree.
     */
    public static List<List<String>> levels(List<String> checksums) {
        List<List<String>> out = new ArrayList<>();
        if (checksums == null || checksums.isEmpty()) {
            out.add(List.of(EMPTY_ROOT));
            return out;
        }
        List<String> level = List.copyOf(checksums);
        out.add(level);
        do {
            level = List.copyOf(nextLevel(level));
            out.add(level);
        } while (level.size() > 1);
        return out;
    }

    private static List<String> nextLevel(List<String> level) {
        List<String> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            String left = level.get(i);
            String right = i + 1 < level.size() ? level.get(i + 1) : left;
            next.add(Hashing.sha256Hex(left + right));
        }
        return next;
    }
}
