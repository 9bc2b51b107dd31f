package cn.lihongjie.torrentfs.store.service;

import cn.lihongjie.torrentfs.common.codec.TorrentCodec;
import cn.lihongjie.torrentfs.common.constants.TorrentFileNames;
import cn.lihongjie.torrentfs.common.exception.TorrentDecodeException;
import cn.lihongjie.torrentfs.common.model.MetaInfo;
import cn.lihongjie.torrentfs.common.model.TorrentInfo;
import cn.lihongjie.torrentfs.common.model.TorrentSpec;
import cn.lihongjie.torrentfs.store.fs.TorrentDirectory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe create/load/delete of .torrent files in one directory.
 * <p>
 * Every public method holds the directory lock for its whole duration. Files become
 * visible under their final name only through an atomic rename, so readers never see
 * a partially written descriptor.
 */
@Slf4j
public class AtomicTorrentStore {

    private final TorrentDirectory directory;
    private final TorrentCodec codec;
    private final List<List<String>> trackers;
    private final String createdBy;

    public AtomicTorrentStore(TorrentDirectory directory, TorrentCodec codec,
                              List<List<String>> trackers, String createdBy) {
        this.directory = directory;
        this.codec = codec;
        this.trackers = copyTiers(trackers);
        this.createdBy = createdBy;
    }

    /**
     * Never throws: a blank, unrepresentable or out-of-directory name simply reports {@code false}.
     */
    public boolean exists(String name) {
        Path path;
        try {
            path = directory.resolve(TorrentFileNames.canonical(name));
        } catch (IllegalArgumentException e) {
            log.debug("exists({}): {}", name, e.getMessage());
            return false;
        }
        return directory.withLock(() -> directory.exists(path));
    }

    public void delete(String name) {
        Path path = directory.resolve(TorrentFileNames.canonical(name));
        directory.withLock(() -> {
            directory.delete("delete torrent", path);
            return null;
        });
        log.info("Deleted torrent {}", path.getFileName());
    }

    /**
     * Writes {@code bytes} as the descriptor for {@code name} unless one already exists,
     * then loads whichever file is on disk. Racing callers converge on a single writer.
     *
     * @throws IllegalArgumentException if {@code bytes} is empty
     * @throws TorrentDecodeException   if {@code bytes} (or the existing file) is not a valid torrent
     */
    public CreateResult create(String name, byte[] bytes) {
        String fileName = TorrentFileNames.canonical(name);
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Refusing to write 0 bytes to torrent file: " + fileName);
        }
        Path path = directory.resolve(fileName);
        return directory.withLock(() -> {
            boolean created = false;
            if (!directory.exists(path)) {
                validate(fileName, bytes);
                directory.writeAtomically(path, bytes);
                created = true;
                log.info("Created torrent {} ({} bytes)", fileName, bytes.length);
            } else {
                log.debug("Torrent {} already exists, loading existing file", fileName);
            }
            return new CreateResult(load(path), created);
        });
    }

    /**
     * Builds a descriptor from {@code info} plus the auxiliary fields of {@code additional}
     * (may be null) and writes it under the info name.
     *
     * @return true if this call wrote the file, false if it already existed
     */
    public boolean createFromDefinition(TorrentInfo info, MetaInfo additional) {
        String fileName = TorrentFileNames.canonical(info.getName());
        MetaInfo metaInfo = codec.createMetaInfo(info, additional, trackers, createdBy);
        byte[] payload = codec.encode(metaInfo);

        Path path = directory.resolve(fileName);
        return directory.withLock(() -> {
            if (directory.exists(path)) {
                log.debug("Torrent {} already exists, skipping", fileName);
                return false;
            }
            directory.writeAtomically(path, payload);
            log.info("Created torrent {} from definition, infoHash={}", fileName,
                    codec.toSpec(metaInfo).getInfoHash());
            return true;
        });
    }

    public TorrentSpec loadByName(String name) {
        Path path = directory.resolve(TorrentFileNames.canonical(name));
        return directory.withLock(() -> load(path));
    }

    public TorrentSpec loadByPath(Path path) {
        Path canonical = Path.of(TorrentFileNames.canonical(path.toString()));
        return directory.withLock(() -> load(canonical));
    }

    /**
     * Canonical names of all descriptors in the directory, sorted. Temp files are never listed.
     */
    public List<String> names() {
        return directory.withLock(() -> directory.list(f -> f.endsWith(TorrentFileNames.TORRENT_EXT)));
    }

    /**
     * Leftovers of writes interrupted before their rename.
     */
    public List<String> orphanTempFiles() {
        return directory.withLock(() -> directory.list(TorrentFileNames::isTempFile));
    }

    private TorrentSpec load(Path path) {
        byte[] bytes = directory.read("load torrent", path);
        try {
            MetaInfo metaInfo = codec.decode(bytes);
            // configured trackers win over whatever the file carries
            metaInfo.setAnnounceList(copyTiers(trackers));
            TorrentSpec spec = codec.toSpec(metaInfo);
            log.debug("Loaded torrent {} infoHash={}", path.getFileName(), spec.getInfoHash());
            return spec;
        } catch (TorrentDecodeException e) {
            throw new TorrentDecodeException("load torrent " + path + ": " + e.getMessage(), e);
        }
    }

    private void validate(String fileName, byte[] bytes) {
        try {
            codec.toSpec(codec.decode(bytes));
        } catch (TorrentDecodeException e) {
            throw new TorrentDecodeException("create torrent " + fileName + ": " + e.getMessage(), e);
        }
    }

    private static List<List<String>> copyTiers(List<List<String>> tiers) {
        List<List<String>> copy = new ArrayList<>();
        if (tiers != null) {
            for (List<String> tier : tiers) {
                copy.add(List.copyOf(tier));
            }
        }
        return copy;
    }
}
