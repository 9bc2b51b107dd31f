package cn.lihongjie.torrentfs.store.service;

import cn.lihongjie.torrentfs.common.model.TorrentSpec;

/**
 * Outcome of {@link AtomicTorrentStore#create}: the loaded descriptor and whether this call wrote it.
 */
public record CreateResult(TorrentSpec spec, boolean created) {
}
