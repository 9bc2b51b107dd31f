package cn.lihongjie.torrentfs.common.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Locates raw element boundaries inside bencoded bytes without decoding them.
 * Only used on input that has already been validated by a full decode.
 */
final class BencodeSlices {

    /**
     * Returns the raw encoding of the value stored under {@code key} in the top-level
     * dictionary, or null if the key is absent or the bytes are not a dictionary.
     */
    static byte[] rawValue(byte[] dict, String key) {
        if (dict.length == 0 || dict[0] != 'd') return null;
        byte[] wanted = key.getBytes(StandardCharsets.ISO_8859_1);
        int i = 1;
        while (i < dict.length && dict[i] != 'e') {
            int keyEnd = elementEnd(dict, i);
            if (keyEnd < 0) return null;
            int colon = indexOf(dict, (byte) ':', i);
            int valueStart = keyEnd + 1;
            int valueEnd = elementEnd(dict, valueStart);
            if (valueEnd < 0) return null;
            if (Arrays.equals(dict, colon + 1, keyEnd + 1, wanted, 0, wanted.length)) {
                return Arrays.copyOfRange(dict, valueStart, valueEnd + 1);
            }
            i = valueEnd + 1;
        }
        return null;
    }

    /** 返回从 offset 开始的元素最后一个字节的位置，失败返回 -1 */
    static int elementEnd(byte[] buf, int offset) {
        if (offset >= buf.length) return -1;
        byte b = buf[offset];
        if (b == 'i') {
            return indexOf(buf, (byte) 'e', offset + 1);
        }
        if (b == 'l' || b == 'd') {
            int i = offset + 1;
            while (i < buf.length) {
                if (buf[i] == 'e') return i;
                int end = elementEnd(buf, i);
                if (end < 0) return -1;
                i = end + 1;
            }
            return -1;
        }
        if (b >= '0' && b <= '9') {
            int colon = indexOf(buf, (byte) ':', offset);
            if (colon < 0) return -1;
            int len;
            try {
                len = Integer.parseInt(new String(buf, offset, colon - offset, StandardCharsets.US_ASCII));
            } catch (NumberFormatException e) {
                return -1;
            }
            long end = (long) colon + len;
            return end < buf.length ? (int) end : -1;
        }
        return -1;
    }

    private static int indexOf(byte[] buf, byte target, int from) {
        for (int i = from; i < buf.length; i++) {
            if (buf[i] == target) return i;
        }
        return -1;
    }

    private BencodeSlices() {
    }
}
