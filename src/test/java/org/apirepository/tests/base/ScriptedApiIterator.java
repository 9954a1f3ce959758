package org.apirepository.tests.base;

import org.apirepository.iterator.ApiIterator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory greedy cursor with scripted faults, recording how it was driven.
 */
public class ScriptedApiIterator<T> implements ApiIterator<T> {

    private final List<T> elements;
    private int index = 0;
    private int pageSize;

    private int moveNextCalls = 0;
    private int moveNextTrueCount = 0;
    /** 1-based moveNext() call that throws; 0 for never */
    private int failOnMoveNext = 0;
    /** Cursor index at which current() throws; -1 for never */
    private int failOnCurrentAt = -1;

    private final List<Integer> pageSizeHistory = new ArrayList<>();

    @SafeVarargs
    public ScriptedApiIterator(int pageSize, T... elements) {
        this.pageSize = pageSize;
        this.elements = new ArrayList<>(Arrays.asList(elements));
    }

    public ScriptedApiIterator<T> failOnMoveNext(int call) {
        this.failOnMoveNext = call;
        return this;
    }

    public ScriptedApiIterator<T> failOnCurrentAt(int position) {
        this.failOnCurrentAt = position;
        return this;
    }

    @Override
    public T current() {
        if (index == failOnCurrentAt) {
            throw new IllegalStateException("record at position " + index + " could not be decoded");
        }
        return index < elements.size() ? elements.get(index) : null;
    }

    @Override
    public boolean moveNext() {
        moveNextCalls++;
        if (moveNextCalls == failOnMoveNext) {
            throw new IllegalStateException("remote fault on moveNext #" + moveNextCalls);
        }
        if (index + 1 < elements.size()) {
            index++;
            moveNextTrueCount++;
            return true;
        }
        index = elements.size();
        return false;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void setPageSize(int pageSize) {
        pageSizeHistory.add(pageSize);
        this.pageSize = pageSize;
    }

    public int getMoveNextCalls() {
        return moveNextCalls;
    }

    public int getMoveNextTrueCount() {
        return moveNextTrueCount;
    }

    /** Every value passed to setPageSize, in call order. */
    public List<Integer> getPageSizeHistory() {
        return pageSizeHistory;
    }
}
