package com.snowman.balance.service;

import com.snowman.balance.model.PastBalanceRecord;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily paged view of one user's history, oldest record first. Nothing is read until
 * iteration starts, and every {@link #iterator()} call starts again from the first record.
 */
public final class BalanceHistory implements Iterable<PastBalanceRecord> {

    @FunctionalInterface
    public interface PageSource {
        List<PastBalanceRecord> fetch(long afterId, int limit);
    }

    private final PageSource source;
    private final int pageSize;

    public BalanceHistory(PageSource source, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.source = source;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<PastBalanceRecord> iterator() {
        return new PagingIterator();
    }

    public Stream<PastBalanceRecord> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public List<PastBalanceRecord> toList() {
        return stream().toList();
    }

    private final class PagingIterator implements Iterator<PastBalanceRecord> {
        private List<PastBalanceRecord> page = List.of();
        private int index;
        private long afterId;
        private boolean lastPage;

        @Override
        public boolean hasNext() {
            if (index < page.size()) {
                return true;
            }
            if (lastPage) {
                return false;
            }
            page = source.fetch(afterId, pageSize);
            index = 0;
            lastPage = page.size() < pageSize;
            if (page.isEmpty()) {
                return false;
            }
            afterId = page.get(page.size() - 1).id();
            return true;
        }

        @Override
        public PastBalanceRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(index++);
        }
    }
}
