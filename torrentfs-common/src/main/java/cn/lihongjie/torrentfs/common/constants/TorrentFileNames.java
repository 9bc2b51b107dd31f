package cn.lihongjie.torrentfs.common.constants;

/**
 * 种子目录中的文件名约定
 */
public class TorrentFileNames {

    /**
     * 种子文件后缀
     */
    public static final String TORRENT_EXT = ".torrent";

    /**
     * 原子写入时使用的临时文件后缀
     */
    public static final String TMP_EXT = ".tmp";

    /**
     * 下载白名单文件；存在即表示进入 "download once" 模式
     */
    public static final String PROHIBIT_NEW_DOWNLOADS = "prohibit_new_downloads.lock";

    /**
     * Appends the torrent extension unless the name already carries it.
     */
    public static String canonical(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Torrent name must not be blank");
        }
        return name.endsWith(TORRENT_EXT) ? name : name + TORRENT_EXT;
    }

    public static boolean isTempFile(String fileName) {
        return fileName.endsWith(TMP_EXT);
    }

    private TorrentFileNames() {
        // 工具类，禁止实例化
    }
}
