package cn.lihongjie.torrentfs.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hash工具类
 */
public class HashUtils {

    /**
     * 字节数组转十六进制字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * 计算SHA1
     */
    public static byte[] sha1(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not found", e);
        }
    }

    /**
     * InfoHash = SHA1(info 字典原始编码)，十六进制
     */
    public static String infoHash(byte[] infoBytes) {
        return bytesToHex(sha1(infoBytes));
    }

    private HashUtils() {
        // 工具类，禁止实例化
    }
}
