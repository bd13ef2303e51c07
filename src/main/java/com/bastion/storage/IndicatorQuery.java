package com.bastion.storage;

import com.bastion.domain.IndicatorType;

/**
 * Filter and paging parameters for indicator listings. Null filters match
 * everything.
 */
public class IndicatorQuery {

    private IndicatorType type;
    private String source;
    private Boolean active;
    private String search;
    private int page = 1;
    private int limit = 50;

    public IndicatorQuery() {
    }

    public IndicatorQuery type(IndicatorType type) {
        this.type = type;
        return this;
    }

    public IndicatorQuery source(String source) {
        this.source = source;
        return this;
    }

    public IndicatorQuery active(Boolean active) {
        this.active = active;
        return this;
    }

    public IndicatorQuery search(String search) {
        this.search = search;
        return this;
    }

    public IndicatorQuery page(int page) {
        this.page = page;
        return this;
    }

    public IndicatorQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    public IndicatorType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Boolean getActive() {
        return active;
    }

    public String getSearch() {
        return search;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }
}
