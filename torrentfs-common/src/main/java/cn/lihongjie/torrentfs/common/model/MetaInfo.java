package cn.lihongjie.torrentfs.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 种子文件（.torrent）的完整内容
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetaInfo {

    /**
     * info 字典的原始编码
     */
    private byte[] infoBytes;

    private String announce;

    /**
     * Tracker 分层列表
     */
    private List<List<String>> announceList;

    private String comment;

    private String createdBy;

    /**
     * 创建时间（Unix 秒）
     */
    private Long creationDate;

    /**
     * Web seed 地址
     */
    private List<String> urlList;
}
