package cn.lihongjie.torrentfs.common.codec;

import cn.lihongjie.torrentfs.common.exception.TorrentDecodeException;
import cn.lihongjie.torrentfs.common.model.MetaInfo;
import cn.lihongjie.torrentfs.common.model.TorrentInfo;
import cn.lihongjie.torrentfs.common.model.TorrentSpec;
import cn.lihongjie.torrentfs.common.util.HashUtils;
import com.dampcake.bencode.Bencode;
import com.dampcake.bencode.Type;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link TorrentCodec} backed by the dampcake bencode library.
 * <p>
 * Byte strings are decoded as ISO-8859-1 so binary values (pieces, info dictionary)
 * survive a decode/encode cycle unchanged; text fields are re-read as UTF-8.
 */
public class BencodeTorrentCodec implements TorrentCodec {

    private static final String INFO_KEY = "info";
    private static final byte[] INFO_KEY_ENCODED = "4:info".getBytes(StandardCharsets.US_ASCII);

    private final Bencode bencode = new Bencode(StandardCharsets.ISO_8859_1);

    @Override
    public MetaInfo decode(byte[] bytes) {
        Map<String, Object> root = decodeDictionary(bytes, "torrent");
        if (!(root.get(INFO_KEY) instanceof Map)) {
            throw new TorrentDecodeException("Torrent has no info dictionary");
        }
        byte[] infoBytes = BencodeSlices.rawValue(bytes, INFO_KEY);
        if (infoBytes == null) {
            throw new TorrentDecodeException("Unable to locate info dictionary bytes");
        }

        return MetaInfo.builder()
                .infoBytes(infoBytes)
                .announce(text(root.get("announce")))
                .announceList(tiers(root.get("announce-list")))
                .comment(text(root.get("comment")))
                .createdBy(text(root.get("created by")))
                .creationDate(number(root.get("creation date")))
                .urlList(urlList(root.get("url-list")))
                .build();
    }

    @Override
    public byte[] encode(MetaInfo metaInfo) {
        if (metaInfo.getInfoBytes() == null || metaInfo.getInfoBytes().length == 0) {
            throw new IllegalArgumentException("MetaInfo has no info bytes");
        }
        TreeMap<String, Object> root = new TreeMap<>();
        putText(root, "announce", metaInfo.getAnnounce());
        if (metaInfo.getAnnounceList() != null && !metaInfo.getAnnounceList().isEmpty()) {
            List<List<String>> tiers = new ArrayList<>();
            for (List<String> tier : metaInfo.getAnnounceList()) {
                tiers.add(tier.stream().map(BencodeTorrentCodec::latin1).toList());
            }
            root.put("announce-list", tiers);
        }
        putText(root, "comment", metaInfo.getComment());
        putText(root, "created by", metaInfo.getCreatedBy());
        if (metaInfo.getCreationDate() != null) {
            root.put("creation date", metaInfo.getCreationDate());
        }
        if (metaInfo.getUrlList() != null && !metaInfo.getUrlList().isEmpty()) {
            root.put("url-list", metaInfo.getUrlList().stream().map(BencodeTorrentCodec::latin1).toList());
        }

        // info is spliced in verbatim so the info hash never changes on re-encode
        byte[] head = bencode.encode(root.headMap(INFO_KEY));
        byte[] tail = bencode.encode(root.tailMap(INFO_KEY, false));
        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length + tail.length + metaInfo.getInfoBytes().length + 8);
        out.write('d');
        out.write(head, 1, head.length - 2);
        out.writeBytes(INFO_KEY_ENCODED);
        out.writeBytes(metaInfo.getInfoBytes());
        out.write(tail, 1, tail.length - 2);
        out.write('e');
        return out.toByteArray();
    }

    @Override
    public byte[] encodeInfo(TorrentInfo info) {
        if (info.getName() == null || info.getName().isBlank()) {
            throw new IllegalArgumentException("Torrent info must have a name");
        }
        TreeMap<String, Object> dict = new TreeMap<>();
        dict.put("name", latin1(info.getName()));
        dict.put("piece length", info.getPieceLength());
        dict.put("pieces", binaryString(info.getPieces() != null ? info.getPieces() : new byte[0]));
        if (info.getFiles() != null) {
            List<Object> files = new ArrayList<>();
            for (TorrentInfo.FileEntry f : info.getFiles()) {
                Map<String, Object> fm = new TreeMap<>();
                fm.put("length", f.getLength());
                fm.put("path", f.getPath().stream().map(BencodeTorrentCodec::latin1).toList());
                files.add(fm);
            }
            dict.put("files", files);
        } else {
            dict.put("length", info.getLength() != null ? info.getLength() : 0L);
        }
        if (info.isPrivateFlag()) {
            dict.put("private", 1L);
        }
        return bencode.encode(dict);
    }

    @Override
    public TorrentInfo decodeInfo(byte[] infoBytes) {
        Map<String, Object> dict = decodeDictionary(infoBytes, "info");
        TorrentInfo.TorrentInfoBuilder builder = TorrentInfo.builder()
                .name(text(dict.get("name")))
                .pieceLength(number(dict.get("piece length"), 0L))
                .pieces(binary(dict.get("pieces")))
                .privateFlag(number(dict.get("private"), 0L) == 1L);

        Object filesObj = dict.get("files");
        if (filesObj == null) {
            builder.length(number(dict.get("length"), 0L));
            return builder.build();
        }
        if (!(filesObj instanceof List)) {
            throw new TorrentDecodeException("info.files is not a list");
        }
        List<TorrentInfo.FileEntry> files = new ArrayList<>();
        for (Object f : (List<?>) filesObj) {
            if (!(f instanceof Map)) {
                throw new TorrentDecodeException("info.files entry is not a dictionary");
            }
            Map<?, ?> fm = (Map<?, ?>) f;
            List<String> path = new ArrayList<>();
            if (fm.get("path") instanceof List) {
                for (Object pe : (List<?>) fm.get("path")) {
                    path.add(text(pe));
                }
            }
            files.add(TorrentInfo.FileEntry.builder()
                    .length(number(fm.get("length"), 0L))
                    .path(path)
                    .build());
        }
        return builder.files(files).build();
    }

    @Override
    public MetaInfo createMetaInfo(TorrentInfo info, MetaInfo additional, List<List<String>> trackers, String createdBy) {
        MetaInfo.MetaInfoBuilder builder = additional != null ? additional.toBuilder() : MetaInfo.builder();
        return builder
                .announceList(trackers != null ? copyTiers(trackers) : null)
                .createdBy(createdBy)
                .creationDate(Instant.now().getEpochSecond())
                .infoBytes(encodeInfo(info))
                .build();
    }

    @Override
    public TorrentSpec toSpec(MetaInfo metaInfo) {
        TorrentInfo info = decodeInfo(metaInfo.getInfoBytes());
        List<List<String>> trackers = metaInfo.getAnnounceList();
        if ((trackers == null || trackers.isEmpty()) && metaInfo.getAnnounce() != null) {
            trackers = List.of(List.of(metaInfo.getAnnounce()));
        }
        return TorrentSpec.builder()
                .infoHash(HashUtils.infoHash(metaInfo.getInfoBytes()))
                .infoBytes(metaInfo.getInfoBytes())
                .displayName(info.getName())
                .info(info)
                .trackers(trackers != null ? trackers : List.of())
                .webseeds(metaInfo.getUrlList() != null ? metaInfo.getUrlList() : List.of())
                .comment(metaInfo.getComment())
                .createdBy(metaInfo.getCreatedBy())
                .creationDate(metaInfo.getCreationDate())
                .build();
    }

    private Map<String, Object> decodeDictionary(byte[] bytes, String what) {
        if (bytes == null || bytes.length == 0) {
            throw new TorrentDecodeException("Empty " + what + " bytes");
        }
        Object decoded;
        try {
            decoded = bencode.decode(bytes, Type.DICTIONARY);
        } catch (RuntimeException e) {
            throw new TorrentDecodeException("Failed to decode " + what + " dictionary", e);
        }
        if (!(decoded instanceof Map)) {
            throw new TorrentDecodeException(what + " is not a dictionary");
        }
        @SuppressWarnings("unchecked") Map<String, Object> dict = (Map<String, Object>) decoded;
        return dict;
    }

    private static List<List<String>> tiers(Object v) {
        if (!(v instanceof List)) return null;
        List<List<String>> tiers = new ArrayList<>();
        for (Object tier : (List<?>) v) {
            if (tier instanceof List) {
                List<String> urls = new ArrayList<>();
                for (Object url : (List<?>) tier) {
                    urls.add(text(url));
                }
                tiers.add(urls);
            }
        }
        return tiers;
    }

    // url-list is either a single string or a list of strings
    private static List<String> urlList(Object v) {
        if (v == null) return null;
        if (v instanceof List) {
            List<String> urls = new ArrayList<>();
            for (Object url : (List<?>) v) {
                urls.add(text(url));
            }
            return urls;
        }
        String single = text(v);
        return single == null || single.isEmpty() ? List.of() : List.of(single);
    }

    private static List<List<String>> copyTiers(List<List<String>> tiers) {
        List<List<String>> copy = new ArrayList<>(tiers.size());
        for (List<String> tier : tiers) {
            copy.add(List.copyOf(tier));
        }
        return copy;
    }

    private static void putText(Map<String, Object> dict, String key, String value) {
        if (value != null) {
            dict.put(key, latin1(value));
        }
    }

    private static String text(Object v) {
        if (v == null) return null;
        if (v instanceof String) {
            return new String(((String) v).getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
        }
        return v.toString();
    }

    private static byte[] binary(Object v) {
        if (v instanceof String) return ((String) v).getBytes(StandardCharsets.ISO_8859_1);
        return new byte[0];
    }

    private static Long number(Object v) {
        return v instanceof Number ? ((Number) v).longValue() : null;
    }

    private static long number(Object v, long fallback) {
        return v instanceof Number ? ((Number) v).longValue() : fallback;
    }

    private static String latin1(String utf8) {
        return new String(utf8.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
    }

    private static String binaryString(byte[] raw) {
        return new String(raw, StandardCharsets.ISO_8859_1);
    }
}
