package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.PageBlock;
import com.example.formreader.util.layout.dto.PageLayout;
import com.example.formreader.util.layout.dto.ParsedTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 页面格式化：把文本行和表格按垂直位置合并，输出阅读顺序的页面文本
 *
 * 输出格式：
 * <pre>
 * Page # N
 *
 * 行1
 * 表格
 * 行2
 * </pre>
 */
public class PageFormatter {

    /** 按顶部 y 升序；稳定排序，顶部相同时文本行在表格之前 */
    static final Comparator<PageBlock> BY_TOP = Comparator.comparingDouble(b -> b.getRect().y0);

    private final WidgetSpanProcessor widgetProcessor;

    public PageFormatter(WidgetSpanProcessor widgetProcessor) {
        this.widgetProcessor = widgetProcessor;
    }

    /**
     * 渲染一页
     */
    public String formatPage(PageLayout page, RenderMode mode) {
        List<String> result = new ArrayList<>();
        result.add("Page # " + page.getPageNumber() + "\n");

        for (PageBlock block : sortByVerticalPosition(page)) {
            if (block instanceof ParsedTable) {
                result.add(TableProcessor.formatTable((ParsedTable) block, mode));
            } else {
                result.add(processTextLine((Line) block, mode));
            }
        }

        return String.join("\n", result) + "\n";
    }

    /**
     * 文本行与表格合并后按顶部 y 排序
     */
    public static List<PageBlock> sortByVerticalPosition(PageLayout page) {
        List<PageBlock> blocks = new ArrayList<>(page.getLines().size() + page.getTables().size());
        blocks.addAll(page.getLines());
        blocks.addAll(page.getTables());
        blocks.sort(BY_TOP);
        return blocks;
    }

    String processTextLine(Line line, RenderMode mode) {
        Line checked = widgetProcessor.handleWidgetSpanIntersections(line, mode);
        return WidgetSpanProcessor.renderLine(checked, mode);
    }
}
