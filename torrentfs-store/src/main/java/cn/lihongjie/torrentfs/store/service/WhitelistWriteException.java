package cn.lihongjie.torrentfs.store.service;

import cn.lihongjie.torrentfs.common.exception.TorrentStorageException;

import java.util.List;

/**
 * The whitelist could not be persisted. {@link #getWhitelist()} holds the set that would have been stored.
 */
public class WhitelistWriteException extends TorrentStorageException {

    private final List<String> whitelist;

    public WhitelistWriteException(List<String> whitelist, Throwable cause) {
        super("write download whitelist: " + cause.getMessage(), cause);
        this.whitelist = List.copyOf(whitelist);
    }

    public List<String> getWhitelist() {
        return whitelist;
    }
}
