package cn.lihongjie.torrentfs.store.runner;

import cn.lihongjie.torrentfs.store.service.AtomicTorrentStore;
import cn.lihongjie.torrentfs.store.service.DownloadWhitelist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Logs the state of the torrent directory once the context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TorrentDirectoryReporter implements ApplicationRunner {

    private final AtomicTorrentStore store;
    private final DownloadWhitelist whitelist;

    @Override
    public void run(ApplicationArguments args) {
        List<String> names = store.names();
        log.info("Torrent directory holds {} descriptors", names.size());

        List<String> orphans = store.orphanTempFiles();
        if (!orphans.isEmpty()) {
            // interrupted writes; never read, overwritten by the next write of the same name
            log.warn("Found {} leftover temp files: {}", orphans.size(), orphans);
        }

        Optional<List<String>> patterns = whitelist.whitelist();
        if (patterns.isPresent()) {
            log.info("Download-once mode active, whitelist={}", patterns.get());
        } else {
            log.info("New downloads are allowed");
        }
    }
}
