package com.flagship.fund_ledger.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing together with the pagination metadata. Pages are
 * numbered from 1.
 */
@Value
public class PagedResponse<T> {

    @JsonProperty("data")
    List<T> data;

    @JsonProperty("page")
    int page;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("total")
    long total;

    @JsonProperty("pages")
    int pages;

    public static <T> PagedResponse<T> of(List<T> data, int page, int limit, long total) {
        return new PagedResponse<>(data, page, limit, total, (int) Math.ceil((double) total / limit));
    }

    public <R> PagedResponse<R> map(Function<T, R> mapper) {
        return new PagedResponse<>(data.stream().map(mapper).toList(), page, limit, total, pages);
    }

    /**
     * @throws IllegalArgumentException if page is below 1 or limit outside 1..200
     */
    public static void validate(int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (limit < 1 || limit > 200) {
            throw new IllegalArgumentException("limit must be between 1 and 200");
        }
    }
}
