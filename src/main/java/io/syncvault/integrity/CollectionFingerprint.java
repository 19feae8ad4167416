package io.syncvault.integrity;

import io.syncvault.handler.CollectionHandler;
import io.syncvault.model.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Checksums of every record in a collection, ordered by primary key, and the Merkle root
 * derived from them.
 */
public record CollectionFingerprint(
        String collection,
        long count,
        String root,
        SortedMap<String, String> checksumsByKey
) {
    public CollectionFingerprint {
        checksumsByKey = Collections.unmodifiableSortedMap(new TreeMap<>(checksumsByKey));
    }

    public static CollectionFingerprint of(String collection, Iterable<Record> records, Set<String> exclude) {
        SortedMap<String, String> checksums = new TreeMap<>();
        for (Record record : records) {
            checksums.put(record.key(), RecordChecksums.checksum(record, exclude));
        }
        return new CollectionFingerprint(collection, checksums.size(), MerkleFingerprint.rootByKey(checksums), checksums);
    }

    public static CollectionFingerprint read(CollectionHandler handler, String collection, Set<String> exclude) {
        try (Stream<Record> records = handler.readRecords(collection)) {
            return of(collection, records::iterator, exclude);
        }
    }

    public static CollectionFingerprint empty(String collection) {
        return new CollectionFingerprint(collection, 0L, MerkleFingerprint.EMPTY_ROOT, new TreeMap<>());
    }

    public boolean matches(CollectionFingerprint other) {
        return count == other.count && root.equals(other.root);
    }

    /**
     * Key-level differences of {@code replica} relative to this fingerprint.
     */
    public KeyDifferences diff(CollectionFingerprint replica) {
        List<String> missing = new ArrayList<>();
        List<String> mismatched = new ArrayList<>();
        for (Map.Entry<String, String> entry : checksumsByKey.entrySet()) {
            String other = replica.checksumsByKey.get(entry.getKey());
            if (other == null) {
                missing.add(entry.getKey());
            } else if (!other.equals(entry.getValue())) {
                mismatched.add(entry.getKey());
            }
        }
        List<String> extra = new ArrayList<>();
        for (String key : replica.checksumsByKey.keySet()) {
            if (!checksumsByKey.containsKey(key)) {
                extra.add(key);
            }
        }
        return new KeyDifferences(missing, extra, mismatched);
    }

    public record KeyDifferences(List<String> missing, List<String> extra, List<String> mismatched) {
        public KeyDifferences {
            missing = List.copyOf(missing);
            extra = List.copyOf(extra);
            mismatched = List.copyOf(mismatched);
        }

        public boolean isEmpty() {
            return missing.isEmpty() && extra.isEmpty() && mismatched.isEmpty();
        }
    }
}
