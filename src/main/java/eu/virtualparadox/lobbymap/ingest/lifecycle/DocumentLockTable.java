package eu.virtualparadox.lobbymap.ingest.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed mutex table: one fair lock per document id, created on demand and dropped once nobody holds
 * or waits for it.
 */
@Component
public class DocumentLockTable {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until the lock for {@code documentId} is held.
     *
     * @return handle to release with {@link Handle#close()}
     * @throws InterruptedException if interrupted while waiting; the lock is not held then
     */
    public Handle acquire(final String documentId) throws InterruptedException {
        final boolean[] contended = new boolean[1];
        final Entry entry = locks.compute(documentId, (key, existing) -> {
            final Entry e = existing == null ? new Entry() : existing;
            contended[0] = e.users > 0;
            e.users++;
            return e;
        });

        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            leave(documentId);
            throw e;
        }
        return new Handle(documentId, entry, contended[0]);
    }

    /**
     * @return number of ids with a holder or waiter
     */
    int size() {
        return locks.size();
    }

    private void leave(final String documentId) {
        locks.computeIfPresent(documentId, (key, e) -> --e.users == 0 ? null : e);
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    /**
     * A held document lock.
     */
    public final class Handle implements AutoCloseable {

        private final String documentId;
        private final Entry entry;
        private final boolean waited;
        private boolean released;

        private Handle(final String documentId, final Entry entry, final boolean waited) {
            this.documentId = documentId;
            this.entry = entry;
            this.waited = waited;
        }

        /**
         * @return {@code true} if another request held or awaited the lock when this one arrived
         */
        public boolean waited() {
            return waited;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            entry.lock.unlock();
            leave(documentId);
        }
    }
}
