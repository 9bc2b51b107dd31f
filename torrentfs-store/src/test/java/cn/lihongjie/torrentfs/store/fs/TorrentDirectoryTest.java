package cn.lihongjie.torrentfs.store.fs;

import cn.lihongjie.torrentfs.common.exception.TorrentNotFoundException;
import cn.lihongjie.torrentfs.common.exception.TorrentStorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TorrentDirectoryTest {

    @TempDir
    Path dir;

    @Test
    void atomicWriteReplacesTargetAndLeavesNoTempFile() throws Exception {
        TorrentDirectory directory = new TorrentDirectory(dir);
        Path target = directory.resolve("a.torrent");

        directory.writeAtomically(target, "first".getBytes(StandardCharsets.UTF_8));
        directory.writeAtomically(target, "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", Files.readString(target));
        assertFalse(Files.exists(dir.resolve("a.torrent.tmp")));
    }

    @Test
    void atomicWriteCreatesSubDirectories() throws Exception {
        TorrentDirectory directory = new TorrentDirectory(dir);
        Path target = directory.resolve("history/v1-accounts.0-32.ef.torrent");

        directory.writeAtomically(target, new byte[]{1, 2, 3});

        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(target));
    }

    @Test
    void failedWriteKeepsPreviousContent() throws Exception {
        TorrentDirectory directory = new TorrentDirectory(dir);
        Path target = directory.resolve("a.torrent");
        Files.writeString(target, "old");
        // a directory squatting on the temp name makes the open fail
        Files.createDirectories(dir.resolve("a.torrent.tmp").resolve("blocker"));

        assertThrows(TorrentStorageException.class, () -> directory.writeAtomically(target, new byte[]{9}));
        assertEquals("old", Files.readString(target));
    }

    @Test
    void resolveStaysInsideRoot() {
        TorrentDirectory directory = new TorrentDirectory(dir);

        assertEquals(dir.toAbsolutePath().normalize().resolve("sub").resolve("a.torrent"),
                directory.resolve("sub/./a.torrent"));
        assertThrows(IllegalArgumentException.class, () -> directory.resolve("/etc/a.torrent"));
        assertThrows(IllegalArgumentException.class, () -> directory.resolve("../a.torrent"));
        assertThrows(IllegalArgumentException.class, () -> directory.resolve("."));
        assertThrows(IllegalArgumentException.class, () -> directory.resolve("a\u0000.torrent"));
    }

    @Test
    void readAndDeleteReportMissingFiles() {
        TorrentDirectory directory = new TorrentDirectory(dir);
        Path missing = directory.resolve("missing.torrent");

        TorrentNotFoundException e = assertThrows(TorrentNotFoundException.class, () -> directory.read("load", missing));
        assertEquals(missing, e.getPath());
        assertThrows(TorrentNotFoundException.class, () -> directory.delete("delete", missing));
    }

    @Test
    void listFiltersAndSorts() throws Exception {
        TorrentDirectory directory = new TorrentDirectory(dir);
        Files.writeString(dir.resolve("b.torrent"), "x");
        Files.writeString(dir.resolve("a.torrent"), "x");
        Files.writeString(dir.resolve("c.torrent.tmp"), "x");
        Files.createDirectories(dir.resolve("d.torrent"));

        assertEquals(List.of("a.torrent", "b.torrent"), directory.list(n -> n.endsWith(".torrent")));
        assertEquals(List.of(), new TorrentDirectory(dir.resolve("nope")).list(n -> true));
    }
}
