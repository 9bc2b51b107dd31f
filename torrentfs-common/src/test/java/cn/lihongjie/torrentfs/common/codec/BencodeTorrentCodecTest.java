package cn.lihongjie.torrentfs.common.codec;

import cn.lihongjie.torrentfs.common.exception.TorrentDecodeException;
import cn.lihongjie.torrentfs.common.model.MetaInfo;
import cn.lihongjie.torrentfs.common.model.TorrentInfo;
import cn.lihongjie.torrentfs.common.model.TorrentSpec;
import cn.lihongjie.torrentfs.common.util.HashUtils;
import com.dampcake.bencode.Bencode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class BencodeTorrentCodecTest {

    private final BencodeTorrentCodec codec = new BencodeTorrentCodec();
    private final Bencode bencode = new Bencode();

    private static Map<String, Object> singleFileInfo(String name) {
        Map<String, Object> info = new TreeMap<>();
        info.put("name", name);
        info.put("piece length", 16384L);
        info.put("pieces", "aaaaaaaaaaaaaaaaaaaa");
        info.put("length", 100L);
        return info;
    }

    @Test
    @DisplayName("Decoding keeps the info dictionary bytes verbatim")
    void decodeKeepsRawInfoBytes() {
        Map<String, Object> info = singleFileInfo("file.bin");
        Map<String, Object> root = new TreeMap<>();
        root.put("announce", "udp://a:1/announce");
        root.put("comment", "hello");
        root.put("creation date", 1700000000L);
        root.put("info", info);
        byte[] bytes = bencode.encode(root);

        MetaInfo mi = codec.decode(bytes);

        assertArrayEquals(bencode.encode(info), mi.getInfoBytes());
        assertEquals("udp://a:1/announce", mi.getAnnounce());
        assertEquals("hello", mi.getComment());
        assertEquals(1700000000L, mi.getCreationDate());
        assertArrayEquals(bytes, codec.encode(mi), "re-encoding a canonical torrent must be lossless");
    }

    @Test
    void toSpecComputesInfoHashAndName() {
        Map<String, Object> root = new TreeMap<>();
        root.put("announce", "udp://a:1/announce");
        root.put("info", singleFileInfo("file.bin"));
        root.put("url-list", "https://seed.example/file.bin");

        TorrentSpec spec = codec.toSpec(codec.decode(bencode.encode(root)));

        assertEquals(HashUtils.infoHash(bencode.encode(singleFileInfo("file.bin"))), spec.getInfoHash());
        assertEquals(40, spec.getInfoHash().length());
        assertEquals("file.bin", spec.getDisplayName());
        assertEquals(100L, spec.getInfo().totalLength());
        assertEquals(List.of(List.of("udp://a:1/announce")), spec.getTrackers(), "announce is used when announce-list is absent");
        assertEquals(List.of("https://seed.example/file.bin"), spec.getWebseeds());
    }

    @Test
    void multiFileInfoAndUtf8Names() {
        Map<String, Object> f1 = new TreeMap<>();
        f1.put("length", 10L);
        f1.put("path", List.of("子", "a.txt"));
        Map<String, Object> f2 = new TreeMap<>();
        f2.put("length", 20L);
        f2.put("path", List.of("b.txt"));
        Map<String, Object> info = new TreeMap<>();
        info.put("name", "目录");
        info.put("piece length", 16384L);
        info.put("pieces", "bbbbbbbbbbbbbbbbbbbb");
        info.put("files", List.of(f1, f2));

        TorrentInfo decoded = codec.decodeInfo(bencode.encode(info));

        assertEquals("目录", decoded.getName());
        assertNull(decoded.getLength());
        assertEquals(2, decoded.getFiles().size());
        assertEquals(List.of("子", "a.txt"), decoded.getFiles().get(0).getPath());
        assertEquals(30L, decoded.totalLength());
        assertArrayEquals(bencode.encode(info), codec.encodeInfo(decoded));
    }

    @Test
    @DisplayName("Binary piece hashes survive encode/decode")
    void binaryPiecesArePreserved() {
        byte[] pieces = new byte[40];
        for (int i = 0; i < pieces.length; i++) {
            pieces[i] = (byte) (255 - i * 5);
        }
        TorrentInfo info = TorrentInfo.builder()
                .name("v1-000000-000500-headers.seg")
                .pieceLength(2 * 1024 * 1024)
                .pieces(pieces)
                .length(123456L)
                .build();

        TorrentInfo back = codec.decodeInfo(codec.encodeInfo(info));

        assertArrayEquals(pieces, back.getPieces());
        assertEquals(info, back);
    }

    @Test
    void createMetaInfoOverridesTrackersAndStampsCreator() {
        TorrentInfo info = TorrentInfo.builder().name("x.seg").pieceLength(1024).pieces(new byte[20]).length(5L).build();
        MetaInfo additional = MetaInfo.builder()
                .comment("aux")
                .announceList(List.of(List.of("udp://stale:1/announce")))
                .urlList(List.of("https://seed.example/"))
                .build();
        List<List<String>> trackers = List.of(List.of("udp://t1:1/announce"), List.of("udp://t2:2/announce"));

        MetaInfo mi = codec.createMetaInfo(info, additional, trackers, "tester");

        assertEquals(trackers, mi.getAnnounceList());
        assertEquals("tester", mi.getCreatedBy());
        assertEquals("aux", mi.getComment());
        assertEquals(List.of("https://seed.example/"), mi.getUrlList());
        assertNotNull(mi.getCreationDate());
        assertArrayEquals(codec.encodeInfo(info), mi.getInfoBytes());
        assertEquals(List.of(List.of("udp://stale:1/announce")), additional.getAnnounceList(), "input must not be mutated");

        MetaInfo reread = codec.decode(codec.encode(mi));
        assertEquals(trackers, reread.getAnnounceList());
        assertArrayEquals(mi.getInfoBytes(), reread.getInfoBytes());
    }

    @Test
    void rejectsInvalidDescriptors() {
        assertThrows(TorrentDecodeException.class, () -> codec.decode(new byte[0]));
        assertThrows(TorrentDecodeException.class, () -> codec.decode("not bencode".getBytes()));
        assertThrows(TorrentDecodeException.class, () -> codec.decode(bencode.encode(List.of("not-a-dict"))));
        assertThrows(TorrentDecodeException.class, () -> codec.decode(bencode.encode(Map.of("announce", "x"))));
        assertThrows(TorrentDecodeException.class, () -> codec.decode(bencode.encode(Map.of("info", "not-a-dict"))));
    }

    @Test
    void rejectsMalformedFileList() {
        Map<String, Object> info = singleFileInfo("bad");
        info.remove("length");
        info.put("files", "oops");
        assertThrows(TorrentDecodeException.class, () -> codec.decodeInfo(bencode.encode(info)));
    }
}
