/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cpcl.paging;

import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.model.KeyedRow;
import org.cpcl.model.Row;
import org.cpcl.model.RowKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily walks a server-paginated sequence of rows, yielding each row once.
 *
 * <p>Every page after the first starts at the key of the previous page's last row, inclusively,
 * so its first row repeats the boundary and is dropped. The boundary is kept as the raw key bytes
 * the server returned. Rows without columns are deleted rows;
 * they move the boundary but are never yielded. A page shorter than requested is the last one.
 *
 * <p>A page is committed to the cursor only after it was fetched in full. A failing fetch
 * exhausts the iterator and propagates the failure unchanged. Not thread-safe.
 */
public abstract class PagingIterator implements Iterator<KeyedRow> {

    private static final Logger log = LoggerFactory.getLogger(PagingIterator.class);

    public static final int DEFAULT_PAGE_SIZE = 100;

    public enum State {
        UNSTARTED,
        ACTIVE,
        EXHAUSTED
    }

    private final ByteBuffer startKey;
    private final int pageSize;
    private final Integer rowCountLimit;

    private final Deque<KeyedRow> buffer = new ArrayDeque<>();
    private State state = State.UNSTARTED;
    private ByteBuffer nextStartKey;
    private int rowsSeen;
    private int pagesFetched;
    private boolean lastPage;
    private KeyedRow lookahead;

    /**
     * @param startKey      the key to start at, inclusive; {@code null} or empty for the beginning
     * @param pageSize      rows requested per page, at least 2
     * @param rowCountLimit the maximum number of rows to yield, {@code null} for no limit
     */
    protected PagingIterator(String startKey, int pageSize, Integer rowCountLimit) {
        if (pageSize < 2) {
            throw new CpclInvalidArgumentException("Page size must be at least 2, got " + pageSize);
        }
        if (rowCountLimit != null && rowCountLimit < 0) {
            throw new CpclInvalidArgumentException("Row count limit cannot be negative, got " + rowCountLimit);
        }
        this.startKey = RowKeys.encode(startKey);
        this.pageSize = pageSize;
        this.rowCountLimit = rowCountLimit;
    }

    /**
     * Fetches one page.
     *
     * @param startKey the raw first key of the page, inclusive; empty for the beginning
     * @param count    the number of rows to request
     * @return the rows in key order, deleted rows included
     */
    protected abstract List<KeyedRow> fetchPage(ByteBuffer startKey, int count);

    /**
     * Resets the cursor and fetches the first page.
     */
    public void rewind() {
        buffer.clear();
        lookahead = null;
        nextStartKey = startKey;
        rowsSeen = 0;
        pagesFetched = 0;
        lastPage = false;
        state = State.ACTIVE;

        if (rowCountLimit != null && rowCountLimit == 0) {
            state = State.EXHAUSTED;
            return;
        }
        loadPage();
    }

    /**
     * Moves to the next row.
     *
     * @return the row, or empty once iteration is over
     */
    public Optional<KeyedRow> advance() {
        if (lookahead != null) {
            KeyedRow row = lookahead;
            lookahead = null;
            return Optional.of(row);
        }
        if (state == State.UNSTARTED) {
            rewind();
        }

        while (state == State.ACTIVE) {
            if (rowCountLimit != null && rowsSeen >= rowCountLimit) {
                finish();
                break;
            }
            if (buffer.isEmpty()) {
                if (lastPage) {
                    finish();
                    break;
                }
                loadPage();
                continue;
            }

            KeyedRow row = buffer.poll();
            if (row.row().isEmpty()) {
                log.trace("Skipping deleted row {}", row.key());
                continue;
            }
            rowsSeen++;
            return Optional.of(row);
        }
        return Optional.empty();
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = advance().orElse(null);
        }
        return lookahead != null;
    }

    @Override
    public KeyedRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        KeyedRow row = lookahead;
        lookahead = null;
        return row;
    }

    /**
     * Rewinds and collects every remaining row. Meant for small result sets only.
     *
     * @return rows by key, in iteration order
     */
    public Map<String, Row> getAll() {
        rewind();
        Map<String, Row> rows = new LinkedHashMap<>();
        Optional<KeyedRow> row = advance();
        while (row.isPresent()) {
            rows.put(row.get().key(), row.get().row());
            row = advance();
        }
        return rows;
    }

    public Stream<KeyedRow> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public State getState() {
        return state;
    }

    public int getRowsSeen() {
        return rowsSeen;
    }

    public int getPageSize() {
        return pageSize;
    }

    public Optional<Integer> getRowCountLimit() {
        return Optional.ofNullable(rowCountLimit);
    }

    private void loadPage() {
        boolean firstPage = pagesFetched == 0;
        int requested = firstPage ? firstPageSize() : nextPageSize();
        ByteBuffer boundary = nextStartKey;

        List<KeyedRow> page;
        try {
            page = fetchPage(boundary.duplicate(), requested);
        } catch (RuntimeException e) {
            buffer.clear();
            state = State.EXHAUSTED;
            throw e;
        }
        pagesFetched++;

        int first = 0;
        if (!firstPage && !page.isEmpty() && page.get(0).rawKey().equals(boundary)) {
            first = 1;
        }
        List<KeyedRow> fresh = page.subList(first, page.size());

        lastPage = page.size() < requested || (!firstPage && fresh.isEmpty());
        if (!page.isEmpty()) {
            nextStartKey = page.get(page.size() - 1).rawKey();
        }
        buffer.addAll(fresh);

        log.debug("Fetched page {} from \"{}\": {} rows requested, {} returned, {} new{}",
                pagesFetched, RowKeys.decode(boundary), requested, page.size(), fresh.size(), lastPage ? ", last page" : "");
    }

    private int firstPageSize() {
        return rowCountLimit == null ? pageSize : Math.min(pageSize, rowCountLimit);
    }

    private int nextPageSize() {
        return rowCountLimit == null ? pageSize : Math.min(pageSize, rowCountLimit - rowsSeen + 1);
    }

    private void finish() {
        buffer.clear();
        state = State.EXHAUSTED;
    }
}
