package cn.lihongjie.torrentfs.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 加载后的种子描述，交给下载组件使用
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentSpec {

    /**
     * InfoHash (40位十六进制字符串)
     */
    private String infoHash;

    private byte[] infoBytes;

    private String displayName;

    private TorrentInfo info;

    private List<List<String>> trackers;

    private List<String> webseeds;

    private String comment;

    private String createdBy;

    private Long creationDate;
}
