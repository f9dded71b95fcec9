package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单页原始提取数据（解析流程的输入）
 */
public final class ScrapedPage {

    private final List<Span> spans;
    private final List<FormWidget> widgets;
    private final List<ScrapedTable> tables;

    public ScrapedPage(List<Span> spans, List<? extends FormWidget> widgets, List<ScrapedTable> tables) {
        this.spans = copyOf(spans);
        this.widgets = copyOf(widgets);
        this.tables = copyOf(tables);
    }

    public static ScrapedPage empty() {
        return new ScrapedPage(null, null, null);
    }

    private static <T> List<T> copyOf(List<? extends T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<T>(source));
    }

    public List<Span> getSpans() {
        return spans;
    }

    public List<FormWidget> getWidgets() {
        return widgets;
    }

    public List<ScrapedTable> getTables() {
        return tables;
    }

    /**
     * 既无文本也无控件的页面不产生输出
     */
    public boolean isEmpty() {
        return spans.isEmpty() && widgets.isEmpty();
    }
}
