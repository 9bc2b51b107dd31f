package cn.lihongjie.torrentfs.store.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 种子目录配置
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "torrentfs")
public class TorrentFsProperties {

    /**
     * 种子文件与白名单所在目录
     */
    private String dir = "./snapshots";

    /**
     * Tracker 分层列表，加载种子时覆盖文件自带的 announce-list
     */
    private List<List<String>> trackers = List.of(
        List.of("udp://tracker.opentrackr.org:1337/announce"),
        List.of("udp://open.stealth.si:80/announce", "udp://tracker.openbittorrent.com:6969/announce")
    );

    /**
     * 写入 "created by" 字段的值
     */
    private String createdBy = "torrentfs";
}
