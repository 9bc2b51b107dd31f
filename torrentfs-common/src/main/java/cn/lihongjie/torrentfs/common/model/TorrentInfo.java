package cn.lihongjie.torrentfs.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 种子定义：bencode 编码后的 info 字典
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentInfo {

    /**
     * 名称（单文件时为文件名，多文件时为目录名）
     */
    private String name;

    /**
     * 分片大小（字节）
     */
    private long pieceLength;

    /**
     * 所有分片 SHA-1 摘要的拼接，每段20字节
     */
    private byte[] pieces;

    /**
     * 单文件模式下的文件大小；多文件模式为 null
     */
    private Long length;

    /**
     * 多文件模式下的文件列表；单文件模式为 null
     */
    private List<FileEntry> files;

    /**
     * private 标记
     */
    private boolean privateFlag;

    /**
     * 总大小（字节）
     */
    public long totalLength() {
        if (files == null) {
            return length != null ? length : 0L;
        }
        long total = 0L;
        for (FileEntry f : files) {
            total += f.getLength();
        }
        return total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {

        /**
         * 文件大小（字节）
         */
        private long length;

        /**
         * 路径分段
         */
        private List<String> path;
    }
}
