package io.syncvault.integrity;

import java.util.Arrays;
import java.util.List;

/**
 * XOR parity over a set of byte blocks. Shorter blocks are right-padded with zero bytes to the
 * longest block before combining, so the parity is as long as the longest block.
 */
public final class ParityBlocks {

    private ParityBlocks() {
    }

    public static byte[] computeParity(List<byte[]> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return new byte[0];
        }
        int maxLength = 0;
        for (byte[] block : blocks) {
            maxLength = Math.max(maxLength, block.length);
        }
        byte[] parity = new byte[maxLength];
        for (byte[] block : blocks) {
            xorInto(parity, block);
        }
        return parity;
    }

    public static boolean verifyParity(List<byte[]> blocks, byte[] parity) {
        return Arrays.equals(computeParity(blocks), parity);
    }

    /**
     * Rebuilds the single block missing from {@code survivors}. The result has the parity's
     * length; trailing padding is only removed by {@link #recover(List, byte[], int)}.
     */
    public static byte[] recover(List<byte[]> survivors, byte[] parity) {
        int length = parity.length;
        for (byte[] block : survivors) {
            length = Math.max(length, block.length);
        }
        byte[] out = new byte[length];
        xorInto(out, parity);
        for (byte[] block : survivors) {
            xorInto(out, block);
        }
        return out;
    }

    public static byte[] recover(List<byte[]> survivors, byte[] parity, int originalLength) {
        byte[] padded = recover(survivors, parity);
        if (originalLength < 0 || originalLength > padded.length) {
            throw new IllegalArgumentException("originalLength " + originalLength
                    + " outside recovered block of " + padded.length + " bytes");
        }
        return Arrays.copyOf(padded, originalLength);
    }

    private static void xorInto(byte[] target, byte[] block) {
        for (int i = 0; i < block.length; i++) {
            target[i] ^= block[i];
        }
    }
}
