package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析后的页面
 *
 * lines 只包含表格以外的文本行；表格内的行只出现在 tables 中。
 */
public final class PageLayout {

    private final int pageNumber;
    private final List<Line> lines;
    private final List<FormWidget> widgets;
    private final List<ParsedTable> tables;

    public PageLayout(int pageNumber, List<Line> lines, List<FormWidget> widgets, List<ParsedTable> tables) {
        this.pageNumber = pageNumber;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.widgets = Collections.unmodifiableList(new ArrayList<>(widgets));
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public List<Line> getLines() {
        return lines;
    }

    public List<FormWidget> getWidgets() {
        return widgets;
    }

    public List<ParsedTable> getTables() {
        return tables;
    }

    @Override
    public String toString() {
        return String.format("PageLayout{page=%d, lines=%d, widgets=%d, tables=%d}",
                pageNumber, lines.size(), widgets.size(), tables.size());
    }
}
