package cn.lihongjie.torrentfs.store.fs;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide registry handing out one lock per managed directory, so every
 * store or whitelist bound to the same directory serializes on the same lock.
 */
public final class DirectoryLocks {

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    public static ReentrantLock lockFor(Path dir) {
        return LOCKS.computeIfAbsent(dir.toAbsolutePath().normalize(), k -> new ReentrantLock());
    }

    private DirectoryLocks() {
    }
}
