package cn.lihongjie.torrentfs.store.config;

import cn.lihongjie.torrentfs.common.codec.BencodeTorrentCodec;
import cn.lihongjie.torrentfs.common.codec.TorrentCodec;
import cn.lihongjie.torrentfs.common.exception.TorrentStorageException;
import cn.lihongjie.torrentfs.store.fs.TorrentDirectory;
import cn.lihongjie.torrentfs.store.service.AtomicTorrentStore;
import cn.lihongjie.torrentfs.store.service.DownloadWhitelist;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 种子存储相关 Bean
 */
@Slf4j
@Configuration
public class TorrentFsConfig {

    @Bean
    public TorrentCodec torrentCodec() {
        return new BencodeTorrentCodec();
    }

    @Bean
    public TorrentDirectory torrentDirectory(TorrentFsProperties properties) {
        Path path = Paths.get(properties.getDir());
        try {
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                log.info("Created torrent directory: {}", path.toAbsolutePath());
            }
        } catch (IOException e) {
            log.error("Failed to create torrent directory {}", path.toAbsolutePath(), e);
            throw new TorrentStorageException("create torrent directory " + path, e);
        }
        return new TorrentDirectory(path);
    }

    @Bean
    public AtomicTorrentStore atomicTorrentStore(TorrentDirectory torrentDirectory, TorrentCodec torrentCodec,
                                                 TorrentFsProperties properties) {
        log.info("Torrent store at {} with {} tracker tiers", torrentDirectory.root(), properties.getTrackers().size());
        return new AtomicTorrentStore(torrentDirectory, torrentCodec, properties.getTrackers(), properties.getCreatedBy());
    }

    @Bean
    public DownloadWhitelist downloadWhitelist(TorrentDirectory torrentDirectory, ObjectMapper objectMapper) {
        return new DownloadWhitelist(torrentDirectory, objectMapper);
    }
}
