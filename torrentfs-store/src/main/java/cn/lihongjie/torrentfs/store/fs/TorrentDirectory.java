package cn.lihongjie.torrentfs.store.fs;

import cn.lihongjie.torrentfs.common.constants.TorrentFileNames;
import cn.lihongjie.torrentfs.common.exception.TorrentNotFoundException;
import cn.lihongjie.torrentfs.common.exception.TorrentStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * The managed directory shared by the descriptor store and the download whitelist.
 * <p>
 * Callers wrap every operation in {@link #withLock(Supplier)}; the file helpers
 * below assume the lock is already held.
 */
@Slf4j
public class TorrentDirectory {

    private final Path root;
    private final ReentrantLock lock;

    public TorrentDirectory(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.lock = DirectoryLocks.lockFor(this.root);
    }

    public Path root() {
        return root;
    }

    /**
     * Resolves a file name (optionally with sub-directories) inside the managed directory.
     *
     * @throws IllegalArgumentException if the name is not a valid path or points outside the directory
     */
    public Path resolve(String fileName) {
        Path path;
        try {
            path = root.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid file name: " + fileName, e);
        }
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("File name escapes " + root + ": " + fileName);
        }
        return path;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    public byte[] read(String operation, Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new TorrentNotFoundException(operation, path, e);
        } catch (IOException e) {
            throw new TorrentStorageException(operation + ": read " + path, e);
        }
    }

    public void delete(String operation, Path path) {
        try {
            Files.delete(path);
        } catch (NoSuchFileException e) {
            throw new TorrentNotFoundException(operation, path, e);
        } catch (IOException e) {
            throw new TorrentStorageException(operation + ": remove " + path, e);
        }
    }

    /**
     * Writes {@code payload} to {@code <target>.tmp}, forces it to disk, then renames it over
     * {@code target}. A crash before the rename leaves only the temp file behind.
     */
    public void writeAtomically(Path target, byte[] payload) {
        Path tmp = target.resolveSibling(target.getFileName() + TorrentFileNames.TMP_EXT);
        try {
            Files.createDirectories(target.getParent());
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(payload);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new TorrentStorageException("write " + target, e);
        }
        log.debug("Wrote {} bytes to {}", payload.length, target);
    }

    /**
     * Top-level regular file names matching {@code filter}, sorted.
     */
    public List<String> list(Predicate<String> filter) {
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(filter)
                    .sorted()
                    .toList();
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new TorrentStorageException("list " + root, e);
        }
    }
}
