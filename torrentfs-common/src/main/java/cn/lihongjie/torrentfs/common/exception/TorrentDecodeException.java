package cn.lihongjie.torrentfs.common.exception;

/**
 * Bytes are not a valid descriptor (or whitelist) encoding.
 */
public class TorrentDecodeException extends TorrentFsException {

    public TorrentDecodeException(String message) {
        super(message);
    }

    public TorrentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
