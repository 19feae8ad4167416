package io.syncvault.integrity;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.Record;
import io.syncvault.util.Hashing;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parity data for one collection. Records are spread over {@code blockCount} groups by a hash of
 * their primary key, so adding or removing a record only disturbs its own group. Each group is
 * serialized as the canonical JSON of its records, one per line in key order. The set keeps each
 * block's SHA-256 and length plus the XOR parity of all blocks: enough to name the groups that
 * diverged on a replica and to rebuild one of them from the others.
 */
public record ParitySet(
        String collection,
        int blockCount,
        List<String> blockChecksums,
        List<Integer> blockLengths,
        byte[] parity
) {
    public ParitySet {
        if (blockCount < 1) {
            throw new IllegalArgumentException("blockCount must be >= 1");
        }
        blockChecksums = List.copyOf(blockChecksums);
        blockLengths = List.copyOf(blockLengths);
        if (blockChecksums.size() != blockCount || blockLengths.size() != blockCount) {
            throw new IllegalArgumentException("expected " + blockCount + " block descriptors");
        }
        parity = parity.clone();
    }

    public static ParitySet build(String collection, Iterable<Record> records, int blockCount, Set<String> exclude) {
        List<byte[]> blocks = blocks(records, blockCount, exclude);
        List<String> checksums = new ArrayList<>(blockCount);
        List<Integer> lengths = new ArrayList<>(blockCount);
        for (byte[] block : blocks) {
            checksums.add(Hashing.sha256Hex(block));
            lengths.add(block.length);
        }
        return new ParitySet(collection, blockCount, checksums, lengths, ParityBlocks.computeParity(blocks));
    }

    public static List<byte[]> blocks(Iterable<Record> records, int blockCount, Set<String> exclude) {
        List<Map<String, String>> groups = new ArrayList<>(blockCount);
        for (int i = 0; i < blockCount; i++) {
            groups.add(new TreeMap<>());
        }
        for (Record record : records) {
            groups.get(blockOf(record.key(), blockCount)).put(record.key(), RecordChecksums.canonicalJson(record, exclude));
        }
        List<byte[]> out = new ArrayList<>(blockCount);
        for (Map<String, String> group : groups) {
            StringBuilder sb = new StringBuilder();
            for (String line : group.values()) {
                sb.append(line).append('\n');
            }
            out.add(sb.toString().getBytes(StandardCharsets.UTF_8));
        }
        return out;
    }

    public static int blockOf(String key, int blockCount) {
        byte[] digest = Hashing.sha256(key.getBytes(StandardCharsets.UTF_8));
        int value = ((digest[0] & 0xff) << 24) | ((digest[1] & 0xff) << 16) | ((digest[2] & 0xff) << 8) | (digest[3] & 0xff);
        return Math.floorMod(value, blockCount);
    }

    public byte[] parity() {
        return parity.clone();
    }

    public boolean verify(List<byte[]> currentBlocks) {
        return failedBlocks(currentBlocks).isEmpty() && ParityBlocks.verifyParity(currentBlocks, parity);
    }

    /**
     * Indexes of the blocks whose content no longer matches the recorded checksum.
     */
    public List<Integer> failedBlocks(List<byte[]> currentBlocks) {
        if (currentBlocks.size() != blockCount) {
            throw new IllegalArgumentException("expected " + blockCount + " blocks, got " + currentBlocks.size());
        }
        List<Integer> failed = new ArrayList<>();
        for (int i = 0; i < blockCount; i++) {
            if (!Hashing.sha256Hex(currentBlocks.get(i)).equals(blockChecksums.get(i))) {
                failed.add(i);
            }
        }
        return failed;
    }

    /**
     * Rebuilds block {@code index} from the other blocks and the parity.
     *
     * @throws IllegalStateException when another block is also corrupt, so the result cannot be trusted
     */
    public byte[] recover(List<byte[]> currentBlocks, int index) {
        if (index < 0 || index >= blockCount) {
            throw new IllegalArgumentException("block index out of range: " + index);
        }
        if (currentBlocks.size() != blockCount) {
            throw new IllegalArgumentException("expected " + blockCount + " blocks, got " + currentBlocks.size());
        }
        List<byte[]> survivors = new ArrayList<>(blockCount - 1);
        for (int i = 0; i < currentBlocks.size(); i++) {
            if (i != index) {
                survivors.add(currentBlocks.get(i));
            }
        }
        byte[] recovered = ParityBlocks.recover(survivors, parity, blockLengths.get(index));
        if (!Hashing.sha256Hex(recovered).equals(blockChecksums.get(index))) {
            throw new IllegalStateException("block " + index + " of " + collection
                    + " cannot be rebuilt: more than one block diverged");
        }
        return recovered;
    }

    /**
     * Parses a block back into records carrying their canonical content.
     */
    public static List<Record> decodeBlock(byte[] block, String keyField) {
        List<Record> out = new ArrayList<>();
        String text = new String(block, StandardCharsets.UTF_8);
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                out.add(Record.of(keyField, (ObjectNode) Jsons.compactMapper().readTree(line)));
            } catch (IOException e) {
                throw new IllegalArgumentException("Malformed parity block line", e);
            }
        }
        return out;
    }
}
