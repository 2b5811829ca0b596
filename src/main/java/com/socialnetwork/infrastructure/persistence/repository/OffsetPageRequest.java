package com.socialnetwork.infrastructure.persistence.repository;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/**
 * PageRequest addressed by raw offset/limit, for endpoints that take {@code offset}
 * rather than a page number. The offset need not be a multiple of the limit.
 */
public class OffsetPageRequest extends PageRequest {

    private final long offset;

    private OffsetPageRequest(long offset, int limit) {
        super((int) (offset / limit), limit, Sort.unsorted());
        this.offset = offset;
    }

    public static OffsetPageRequest of(long offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return new OffsetPageRequest(offset, limit);
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof OffsetPageRequest other
                && super.equals(obj)
                && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.hashCode(offset);
    }
}
