package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.DocumentLayout;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.PageLayout;
import com.example.formreader.util.layout.dto.ParseResult;
import com.example.formreader.util.layout.dto.ScrapedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 文档组装器
 *
 * 每页依次经过：行聚类 → 表格检测 → 控件叠加 → 渲染 → 汇总，
 * 页面之间互不依赖。汇总结果：
 * <ul>
 *   <li>全文文本（每页以 "Page # N" 开头）</li>
 *   <li>文本字段值，按 "Text"（正文）和 "Table"（表格内）两组存放</li>
 * </ul>
 *
 * 使用方式：
 * <pre>
 * DocumentParser parser = new DocumentParser(LayoutConfig.loadDefault());
 * ParseResult result = parser.parse(scrapedPages, RenderMode.LABEL);
 * </pre>
 */
public class DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    private final TextLineGrouper lineGrouper;
    private final TableProcessor tableProcessor;
    private final PageFormatter pageFormatter;

    public DocumentParser(LayoutConfig config) {
        this(new TextLineGrouper(config), new TableProcessor(config),
                new PageFormatter(new WidgetSpanProcessor(config)));
    }

    public DocumentParser(TextLineGrouper lineGrouper, TableProcessor tableProcessor, PageFormatter pageFormatter) {
        this.lineGrouper = lineGrouper;
        this.tableProcessor = tableProcessor;
        this.pageFormatter = pageFormatter;
    }

    /**
     * 单页解析结果（页面内部使用，汇总后丢弃）
     */
    static class PageOutcome {
        final PageLayout page;
        final String text;
        final Map<String, String> textFields;
        final Map<String, String> tableFields;

        PageOutcome(PageLayout page, String text, Map<String, String> textFields, Map<String, String> tableFields) {
            this.page = page;
            this.text = text;
            this.textFields = textFields;
            this.tableFields = tableFields;
        }
    }

    /**
     * 解析整个文档
     *
     * @param scrapedPages 按页顺序的提取数据，页码为下标 + 1
     * @param mode 渲染模式
     * @return 全文文本、两组字段值和解析后的文档；空页面不出现在结果中
     */
    public ParseResult parse(List<ScrapedPage> scrapedPages, RenderMode mode) {
        long startTime = System.currentTimeMillis();

        StringBuilder documentText = new StringBuilder();
        Map<String, String> textFields = new LinkedHashMap<>();
        Map<String, String> tableFields = new LinkedHashMap<>();
        List<PageLayout> pages = new ArrayList<>();
        List<Integer> skippedPages = new ArrayList<>();

        for (int i = 0; i < scrapedPages.size(); i++) {
            int pageNumber = i + 1;
            ScrapedPage scraped = scrapedPages.get(i);

            if (scraped == null || scraped.isEmpty()) {
                log.debug("第 {} 页没有文本和控件，跳过", pageNumber);
                continue;
            }

            PageOutcome outcome;
            try {
                outcome = parsePage(pageNumber, scraped, mode);
            } catch (RuntimeException e) {
                log.error("第 {} 页解析失败，已跳过: {}", pageNumber, e.getMessage(), e);
                skippedPages.add(pageNumber);
                continue;
            }

            // 汇总只在这里进行，页面解析本身不写共享状态
            pages.add(outcome.page);
            documentText.append(outcome.text);
            tableFields.putAll(outcome.tableFields);
            textFields.putAll(outcome.textFields);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("文档解析完成: 输入 {} 页, 输出 {} 页, 跳过 {} 页, 文本字段 {} 个, 表格字段 {} 个, 耗时 {} ms",
                scrapedPages.size(), pages.size(), skippedPages.size(), textFields.size(), tableFields.size(), elapsed);

        return new ParseResult(documentText.toString(), textFields, tableFields,
                new DocumentLayout(pages), skippedPages);
    }

    /**
     * 解析单页
     */
    PageOutcome parsePage(int pageNumber, ScrapedPage scraped, RenderMode mode) {
        List<Line> lines = lineGrouper.groupPage(scraped.getSpans(), scraped.getWidgets());

        TableProcessor.Detection detection = tableProcessor.detect(lines, scraped.getTables());

        PageLayout page = new PageLayout(pageNumber, detection.remainingLines, scraped.getWidgets(), detection.tables);
        String text = pageFormatter.formatPage(page, mode);

        Map<String, String> tableFields = WidgetSpanProcessor.extractTextWidgets(detection.tableWidgets);

        Set<FormWidget> inTable = Collections.newSetFromMap(new IdentityHashMap<FormWidget, Boolean>());
        inTable.addAll(detection.tableWidgets);
        List<FormWidget> freeWidgets = new ArrayList<>();
        for (FormWidget widget : scraped.getWidgets()) {
            if (!inTable.contains(widget)) {
                freeWidgets.add(widget);
            }
        }
        Map<String, String> textFields = WidgetSpanProcessor.extractTextWidgets(freeWidgets);

        log.debug("第 {} 页: {} 行, {} 个表格, {} 个控件", pageNumber,
                detection.remainingLines.size(), detection.tables.size(), scraped.getWidgets().size());

        return new PageOutcome(page, text, textFields, tableFields);
    }
}
