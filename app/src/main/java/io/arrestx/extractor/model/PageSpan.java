package io.arrestx.extractor.model;

/**
 * First and last page touched while a record was being built.
 */
public record PageSpan(int firstPage, int lastPage) {

    public PageSpan {
        if (firstPage < 0 || lastPage < firstPage) {
            throw new IllegalArgumentException("Invalid page span [" + firstPage + ", " + lastPage + "]");
        }
    }

    public static PageSpan single(int page) {
        return new PageSpan(page, page);
    }

    public PageSpan extendTo(int page) {
        if (page < firstPage) {
            return new PageSpan(page, lastPage);
        }
        return page > lastPage ? new PageSpan(firstPage, page) : this;
    }
}
