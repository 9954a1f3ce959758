package org.apirepository.iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * {@link ApiIterator} over a remote resource served in pages.
 * <p>
 * Holds one page of records in memory and calls a {@link PageFetcher} when the page is used up.
 * The cursor starts on the first element of the initial page, which the caller has already fetched
 * (REST APIs hand out the first page from a different call than the follow-up pages).
 * </p>
 *
 * - A page shorter than the requested size is treated as the last one.
 * - Follow-up pages start on a multiple of the current page size, so APIs paging by page number
 *   see consistent pages. After a page-size change the records of the aligned page that were
 *   already returned are dropped, so nothing is skipped or repeated.
 */
public class PagedApiIterator<T> implements ApiIterator<T> {

    private static final Logger logger = LoggerFactory.getLogger(PagedApiIterator.class);

    /** Current page of records */
    private List<T> rows;
    /** Cursor position within the current page */
    private int index = 0;
    /** Number of records received so far, i.e. position of the next record to fetch */
    private int offset;
    /** Page size used for the next fetch */
    private int pageSize;
    /** False once a short or empty page was received */
    private boolean hasMore;
    /** Number of follow-up pages requested so far */
    private int fetchCount = 0;

    /** Callback for retrieving the next page from the remote source */
    private final PageFetcher<T> pageFetcher;

    /**
     * Creates an iterator positioned on the first element of {@code firstPage}.
     *
     * @param firstPage   already fetched first page, may be empty
     * @param pageSize    page size the first page was requested with
     * @param pageFetcher callback for the follow-up pages
     */
    public PagedApiIterator(List<T> firstPage, int pageSize, PageFetcher<T> pageFetcher) {
        this.rows = firstPage == null ? Collections.emptyList() : firstPage;
        this.pageSize = pageSize;
        this.offset = rows.size();
        this.hasMore = !rows.isEmpty() && rows.size() >= pageSize;
        this.pageFetcher = pageFetcher;
    }

    @Override
    public T current() {
        return index < rows.size() ? rows.get(index) : null;
    }

    @Override
    public boolean moveNext() {
        if (index + 1 < rows.size()) {
            index++;
            return true;
        }
        if (!hasMore) {
            index = rows.size();
            return false;
        }

        int requested = pageSize;
        // align to the current page size, dropping records already returned
        int skip = requested > 0 ? offset % requested : 0;
        int pageOffset = offset - skip;
        logger.debug("Fetching page at offset {} with page size {} (skipping {})", pageOffset, requested, skip);
        List<T> page = pageFetcher.fetch(pageOffset, requested);
        fetchCount++;

        if (page == null || page.size() <= skip) {
            hasMore = false;
            rows = Collections.emptyList();
            index = 0;
            return false;
        }

        rows = skip == 0 ? page : page.subList(skip, page.size());
        index = 0;
        offset = pageOffset + page.size();
        hasMore = page.size() >= requested;
        return true;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    /**
     * Number of follow-up pages fetched through the {@link PageFetcher}; the initial page is not counted.
     */
    public int getFetchCount() {
        return fetchCount;
    }

    /**
     * Position of the next record to fetch; the next page request starts at or before it.
     */
    public int getOffset() {
        return offset;
    }
}
