package cn.lihongjie.torrentfs.store.service;

import cn.lihongjie.torrentfs.common.constants.TorrentFileNames;
import cn.lihongjie.torrentfs.common.exception.TorrentDecodeException;
import cn.lihongjie.torrentfs.common.exception.TorrentFsException;
import cn.lihongjie.torrentfs.common.exception.TorrentStorageException;
import cn.lihongjie.torrentfs.store.fs.TorrentDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * "Download once" gate.
 * <p>
 * No whitelist file: every new download is allowed. Once the file exists (even as an
 * empty array) only names containing one of its patterns may start a new download;
 * seeding and repairing files already on disk is not affected.
 */
@Slf4j
@RequiredArgsConstructor
public class DownloadWhitelist {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final TorrentDirectory directory;
    private final ObjectMapper objectMapper;

    /**
     * Applies {@code remove} then {@code add} to the stored whitelist and rewrites it atomically.
     * Calling this the first time switches the node into download-once mode.
     *
     * @return the stored whitelist, sorted and without duplicates
     * @throws WhitelistWriteException if the new whitelist could not be written
     */
    public List<String> prohibitNewDownloads(Collection<String> add, Collection<String> remove) {
        return directory.withLock(() -> {
            Path path = path();
            TreeSet<String> patterns = new TreeSet<>(read(path).orElse(List.of()));
            if (remove != null) {
                remove.stream().filter(Objects::nonNull).forEach(patterns::remove);
            }
            if (add != null) {
                add.stream().filter(Objects::nonNull).forEach(patterns::add);
            }
            List<String> whitelist = new ArrayList<>(patterns);

            byte[] json;
            try {
                json = objectMapper.writeValueAsBytes(whitelist);
            } catch (JsonProcessingException e) {
                throw new TorrentFsException("marshal download whitelist", e);
            }
            try {
                directory.writeAtomically(path, json);
            } catch (TorrentStorageException e) {
                throw new WhitelistWriteException(whitelist, e);
            }
            log.info("Download whitelist updated: {} patterns", whitelist.size());
            return whitelist;
        });
    }

    public boolean newDownloadsAreProhibited(String name) {
        Objects.requireNonNull(name, "name");
        return directory.withLock(() -> read(path())
                .map(whitelist -> whitelist.stream().noneMatch(name::contains))
                .orElse(false));
    }

    /**
     * The current whitelist, or empty if download-once mode has not been entered.
     */
    public Optional<List<String>> whitelist() {
        return directory.withLock(() -> read(path()));
    }

    private Path path() {
        return directory.resolve(TorrentFileNames.PROHIBIT_NEW_DOWNLOADS);
    }

    private Optional<List<String>> read(Path path) {
        if (!directory.exists(path)) {
            return Optional.empty();
        }
        byte[] bytes = directory.read("read download whitelist", path);
        if (bytes.length == 0) {
            return Optional.of(List.of());
        }
        try {
            List<String> whitelist = objectMapper.readValue(bytes, STRING_LIST);
            return Optional.of(whitelist != null ? whitelist.stream().filter(Objects::nonNull).toList() : List.of());
        } catch (IOException e) {
            throw new TorrentDecodeException("unmarshal download whitelist " + path, e);
        }
    }
}
