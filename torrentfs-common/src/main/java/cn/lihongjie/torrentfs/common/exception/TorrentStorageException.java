package cn.lihongjie.torrentfs.common.exception;

/**
 * I/O failure at the filesystem boundary (open, write, fsync, rename, remove).
 */
public class TorrentStorageException extends TorrentFsException {

    public TorrentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
