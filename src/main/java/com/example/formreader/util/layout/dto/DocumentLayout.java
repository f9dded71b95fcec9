package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析后的文档（只包含非空页面）
 */
public final class DocumentLayout {

    private final List<PageLayout> pages;

    public DocumentLayout(List<PageLayout> pages) {
        this.pages = Collections.unmodifiableList(new ArrayList<>(pages));
    }

    public List<PageLayout> getPages() {
        return pages;
    }

    /**
     * 按页码查找，不存在时返回 null
     */
    public PageLayout getPage(int pageNumber) {
        for (PageLayout page : pages) {
            if (page.getPageNumber() == pageNumber) {
                return page;
            }
        }
        return null;
    }
}
