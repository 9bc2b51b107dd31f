package cn.lihongjie.torrentfs.common.exception;

/**
 * Base type for failures raised by the torrent descriptor store and codec.
 */
public class TorrentFsException extends RuntimeException {

    public TorrentFsException(String message) {
        super(message);
    }

    public TorrentFsException(String message, Throwable cause) {
        super(message, cause);
    }
}
