// file: storage/src/main/java/io/docsync/storage/StoreLock.java
package io.docsync.storage;

import io.docsync.core.StoreException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Exclusive OS-level lock on a store directory, so only one process (and one
 * store instance per JVM) appends to its WAL at a time.
 */
final class StoreLock implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StoreLock.class.getName());
    static final String FILE_NAME = "LOCK";

    private final FileChannel channel;
    private final FileLock lock;

    private StoreLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    static StoreLock acquire(Path dir) {
        Path file = dir.resolve(FILE_NAME);
        FileChannel ch;
        try {
            ch = FileChannel.open(file, CREATE, WRITE);
        } catch (IOException e) {
            throw new StoreException(StoreException.Reason.IO, "Cannot open lock file " + file, e);
        }
        try {
            FileLock l = ch.tryLock();
            if (l == null) {
                closeQuietly(ch);
                throw new StoreException(StoreException.Reason.LOCKED, "Store " + dir + " is locked by another process");
            }
            return new StoreLock(ch, l);
        } catch (OverlappingFileLockException e) {
            closeQuietly(ch);
            throw new StoreException(StoreException.Reason.LOCKED, "Store " + dir + " is already open in this process", e);
        } catch (IOException e) {
            closeQuietly(ch);
            throw new StoreException(StoreException.Reason.IO, "Cannot lock " + file, e);
        }
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) lock.release();
        } catch (IOException e) {
            throw new StoreException(StoreException.Reason.IO, "Cannot release store lock", e);
        } finally {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(FileChannel ch) {
        try {
            ch.close();
        } catch (IOException e) {
            // the OS drops the lock together with the descriptor
            log.log(Level.FINE, "Closing store lock channel failed", e);
        }
    }
}
