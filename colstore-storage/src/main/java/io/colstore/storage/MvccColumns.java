package io.colstore.storage;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.longs.LongArrayList;

/**
 * Per row versioning of a chunk: the transaction holding the row, and the commit ids
 * the row becomes visible and invisible at.
 */
public class MvccColumns {
    public static final long MAX_COMMIT_ID = Long.MAX_VALUE;

    private final LongArrayList tids = new LongArrayList();
    private final LongArrayList beginCids = new LongArrayList();
    private final LongArrayList endCids = new LongArrayList();

    public int size() {
        return tids.size();
    }

    /**
     * Slots allocated for rows, including those not used yet.
     */
    public int capacity() {
        return tids.elements().length;
    }

    /**
     * Appends <code>rowCount</code> rows visible from <code>beginCid</code>.
     */
    public void grow(int rowCount, long beginCid) {
        for (int i = 0; i < rowCount; i++) {
            tids.add(0L);
            beginCids.add(beginCid);
            endCids.add(MAX_COMMIT_ID);
        }
    }

    public long tid(int row) {
        return tids.getLong(row);
    }

    public void setTid(int row, long tid) {
        tids.set(row, tid);
    }

    public long beginCid(int row) {
        return beginCids.getLong(row);
    }

    public void setBeginCid(int row, long cid) {
        beginCids.set(row, cid);
    }

    public long endCid(int row) {
        return endCids.getLong(row);
    }

    /**
     * Marks a row deleted from commit <code>cid</code> on.
     */
    public void setEndCid(int row, long cid) {
        endCids.set(row, cid);
    }

    /**
     * Drops rows beyond <code>rowCount</code> and releases unused slots.
     */
    public void shrink(int rowCount) {
        Preconditions.checkArgument(rowCount <= size(), "Can not shrink %s rows to %s", size(), rowCount);
        tids.size(rowCount);
        beginCids.size(rowCount);
        endCids.size(rowCount);
        tids.trim();
        beginCids.trim();
        endCids.trim();
    }
}
