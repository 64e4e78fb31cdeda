package dev.issuebench.results;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Immutable result list whose {@link #append} shares storage with the list it extends.
 *
 * <p>Each log is a prefix view of a backing list. Appending to the newest log of a backing list
 * adds in place; appending to an older prefix copies that prefix into a fresh backing list, so
 * every log keeps seeing exactly its own elements.
 */
final class ResultLog extends AbstractList<AttemptResult> implements RandomAccess {
    // shared by every log built on the same prefix, guarded by itself
    private final List<AttemptResult> storage;
    private final int size;

    private ResultLog(List<AttemptResult> storage, int size) {
        this.storage = storage;
        this.size = size;
    }

    static ResultLog copyOf(Collection<? extends AttemptResult> results) {
        if (results instanceof ResultLog) {
            return (ResultLog) results;
        }
        var storage = new ArrayList<AttemptResult>(results.size());
        for (var result : results) {
            storage.add(Objects.requireNonNull(result, "result"));
        }
        return new ResultLog(storage, storage.size());
    }

    ResultLog append(AttemptResult result) {
        Objects.requireNonNull(result, "result");
        synchronized (storage) {
            if (storage.size() == size) {
                storage.add(result);
                return new ResultLog(storage, size + 1);
            }
            var branch = new ArrayList<AttemptResult>(size + 1);
            branch.addAll(storage.subList(0, size));
            branch.add(result);
            return new ResultLog(branch, size + 1);
        }
    }

    @Override
    public AttemptResult get(int index) {
        Objects.checkIndex(index, size);
        synchronized (storage) {
            return storage.get(index);
        }
    }

    @Override
    public int size() {
        return size;
    }
}
