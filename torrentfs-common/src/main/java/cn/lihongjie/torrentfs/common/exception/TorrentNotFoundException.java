package cn.lihongjie.torrentfs.common.exception;

import java.nio.file.Path;

/**
 * The named descriptor has no backing file.
 */
public class TorrentNotFoundException extends TorrentFsException {

    private final Path path;

    public TorrentNotFoundException(String operation, Path path, Throwable cause) {
        super(operation + ": no such file " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
