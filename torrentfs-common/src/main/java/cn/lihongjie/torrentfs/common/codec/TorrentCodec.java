package cn.lihongjie.torrentfs.common.codec;

import cn.lihongjie.torrentfs.common.exception.TorrentDecodeException;
import cn.lihongjie.torrentfs.common.model.MetaInfo;
import cn.lihongjie.torrentfs.common.model.TorrentInfo;
import cn.lihongjie.torrentfs.common.model.TorrentSpec;

import java.util.List;

/**
 * Encodes and decodes .torrent descriptors.
 */
public interface TorrentCodec {

    /**
     * @throws TorrentDecodeException if the bytes are not a bencoded dictionary with an info dictionary
     */
    MetaInfo decode(byte[] bytes);

    byte[] encode(MetaInfo metaInfo);

    byte[] encodeInfo(TorrentInfo info);

    /**
     * @throws TorrentDecodeException if the bytes are not a valid info dictionary
     */
    TorrentInfo decodeInfo(byte[] infoBytes);

    /**
     * Builds a descriptor for {@code info}. Fields of {@code additional} (may be null) are copied,
     * then the announce list, creator and creation date are overwritten.
     */
    MetaInfo createMetaInfo(TorrentInfo info, MetaInfo additional, List<List<String>> trackers, String createdBy);

    /**
     * @throws TorrentDecodeException if the embedded info dictionary is malformed
     */
    TorrentSpec toSpec(MetaInfo metaInfo);
}
