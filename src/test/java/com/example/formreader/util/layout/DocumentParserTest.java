package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Element;
import com.example.formreader.util.layout.dto.FieldType;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.ParseResult;
import com.example.formreader.util.layout.dto.ParsedTable;
import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.ScrapedPage;
import com.example.formreader.util.layout.dto.ScrapedTable;
import com.example.formreader.util.layout.dto.Span;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.example.formreader.util.layout.LayoutFixtures.rect;
import static com.example.formreader.util.layout.LayoutFixtures.span;
import static com.example.formreader.util.layout.LayoutFixtures.textWidget;
import static com.example.formreader.util.layout.LayoutFixtures.widget;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentParserTest {

    private final LayoutConfig config = LayoutConfig.loadDefault();
    private final DocumentParser parser = new DocumentParser(config);

    private final ScrapedTable itemsTable = new ScrapedTable(rect(0, 100, 200, 200),
            Arrays.asList(rect(0, 100, 100, 120), rect(100, 100, 200, 120)),
            Arrays.asList("Item", "Qty"));

    @Test
    void emptyPageProducesNoOutput() {
        ScrapedPage hello = new ScrapedPage(Collections.singletonList(span("Hello", 0, 10, 40, 20)),
                Collections.<FormWidget>emptyList(), Collections.<ScrapedTable>emptyList());

        ParseResult result = parser.parse(Arrays.asList(ScrapedPage.empty(), hello), RenderMode.PLAIN);

        assertThat(result.getDocument().getPages()).hasSize(1);
        assertThat(result.getDocument().getPage(1)).isNull();
        assertThat(result.getDocument().getPage(2)).isNotNull();
        assertThat(result.getDocumentText()).isEqualTo("Page # 2\n\nHello\n");
        assertThat(result.getSkippedPages()).isEmpty();
    }

    @Test
    void pageWithOnlyTablesIsEmpty() {
        ScrapedPage tablesOnly = new ScrapedPage(Collections.<Span>emptyList(), Collections.<FormWidget>emptyList(),
                Collections.singletonList(itemsTable));

        ParseResult result = parser.parse(Collections.singletonList(tablesOnly), RenderMode.PLAIN);

        assertThat(result.getDocumentText()).isEmpty();
        assertThat(result.getDocument().getPages()).isEmpty();
    }

    @Test
    void fieldsAreSplitIntoTextAndTableBuckets() {
        FormWidget name = textWidget("name", "Jane", 60, 10, 160, 20);
        FormWidget qty = textWidget("qty_1", "3", 105, 140, 150, 150);
        FormWidget agree = widget("agree", FieldType.CHECK_BOX, "Yes", 0, 300, 8, 308);
        ScrapedPage page = new ScrapedPage(Arrays.asList(
                span("Name: __________", 0, 10, 160, 20),
                span("Item", 5, 105, 40, 115), span("Qty", 105, 105, 130, 115),
                span("Apples", 5, 140, 50, 150)),
                Arrays.asList(name, qty, agree), Collections.singletonList(itemsTable));

        ParseResult result = parser.parse(Collections.singletonList(page), RenderMode.PLAIN);

        assertThat(result.getFieldValues()).containsOnlyKeys(ParseResult.BUCKET_TEXT, ParseResult.BUCKET_TABLE);
        assertThat(result.getTextFields()).containsOnlyKeys("name").containsEntry("name", "Jane");
        assertThat(result.getTableFields()).containsOnlyKeys("qty_1").containsEntry("qty_1", "3");
        assertThat(result.getDocumentText()).isEqualTo(
                "Page # 1\n\n"
                        + "Name: [Jane]\n"
                        + "+--------+-----+\n"
                        + "| Item   | Qty |\n"
                        + "+========+=====+\n"
                        + "| Apples | 3   |\n"
                        + "+--------+-----+\n"
                        + "[ON]\n");
    }

    @Test
    void laterPagesOverrideFieldValues() {
        ScrapedPage first = new ScrapedPage(Collections.<Span>emptyList(),
                Collections.singletonList(textWidget("name", "Jane", 0, 10, 50, 20)),
                Collections.<ScrapedTable>emptyList());
        ScrapedPage second = new ScrapedPage(Collections.<Span>emptyList(),
                Collections.singletonList(textWidget("name", "John", 0, 10, 50, 20)),
                Collections.<ScrapedTable>emptyList());

        ParseResult result = parser.parse(Arrays.asList(first, second), RenderMode.LABEL);

        assertThat(result.getTextFields()).containsEntry("name", "John");
        assertThat(result.getDocumentText()).isEqualTo("Page # 1\n\n[name: Jane]\nPage # 2\n\n[name: John]\n");
    }

    @Test
    void failingPageDoesNotStopOtherPages() {
        FormWidget broken = new FormWidget() {
            @Override
            public String getFieldName() {
                return "broken";
            }

            @Override
            public FieldType getFieldType() {
                return FieldType.TEXT;
            }

            @Override
            public String getFieldValue() {
                return "x";
            }

            @Override
            public Rect getRect() {
                throw new IllegalStateException("widget detached from page");
            }
        };
        ScrapedPage bad = new ScrapedPage(Collections.singletonList(span("Lost", 0, 10, 40, 20)),
                Collections.singletonList(broken), Collections.<ScrapedTable>emptyList());
        ScrapedPage good = new ScrapedPage(Collections.singletonList(span("Kept", 0, 10, 40, 20)),
                Collections.<FormWidget>emptyList(), Collections.<ScrapedTable>emptyList());

        ParseResult result = parser.parse(Arrays.asList(bad, good), RenderMode.PLAIN);

        assertThat(result.getSkippedPages()).containsExactly(1);
        assertThat(result.getDocumentText()).isEqualTo("Page # 2\n\nKept\n");
        assertThat(result.getTextFields()).doesNotContainKey("broken");
    }

    @Test
    void everySpanEndsUpInALineOrATableOrIsADuplicate() {
        List<Span> spans = Arrays.asList(
                span("Name:", 0, 10, 40, 20), span("Jane", 60, 10, 100, 20),
                span("Item", 5, 105, 40, 115), span("Qty", 105, 105, 130, 115),
                span("Apples", 5, 140, 50, 150), span("3", 105, 140, 115, 150),
                span("Footer", 0, 300, 40, 310));
        List<FormWidget> widgets = Collections.singletonList(textWidget("name", "Jane", 60, 10, 160, 20));

        List<Line> lines = new TextLineGrouper(config).groupPage(spans, widgets);
        TableProcessor tableProcessor = new TableProcessor(config);
        List<Line> tableLines = tableProcessor.findTextLinesInTables(lines, Collections.singletonList(itemsTable));
        List<Line> remaining = TableProcessor.removeTableLines(lines, tableLines);

        List<Span> inLines = spansOf(remaining);
        List<Span> inTables = spansOf(tableLines);

        // 唯一被丢弃的是与控件值重复的 "Jane"
        assertThat(inLines.size() + inTables.size() + 1).isEqualTo(spans.size());
        assertThat(inLines).extracting(Span::getText).containsExactly("Name:", "Footer");
        assertThat(inTables).extracting(Span::getText).containsExactly("Item", "Qty", "Apples", "3");
    }

    @Test
    void parsedPageKeepsTablesOutOfLines() {
        ScrapedPage page = new ScrapedPage(Arrays.asList(
                span("Item", 5, 105, 40, 115), span("Qty", 105, 105, 130, 115),
                span("Apples", 5, 140, 50, 150), span("Footer", 0, 300, 40, 310)),
                Collections.<FormWidget>emptyList(), Collections.singletonList(itemsTable));

        ParseResult result = parser.parse(Collections.singletonList(page), RenderMode.LABEL);

        List<ParsedTable> tables = result.getDocument().getPage(1).getTables();
        assertThat(tables).hasSize(1);
        assertThat(result.getDocument().getPage(1).getLines()).hasSize(1);
        assertThat(result.getDocumentText()).isEqualTo(
                "Page # 1\n\n"
                        + "Item | Qty\n"
                        + "---------------\n"
                        + "Apples | N/A\n"
                        + "Footer\n");
    }

    private static List<Span> spansOf(List<Line> lines) {
        final List<Span> spans = new ArrayList<>();
        for (Line line : lines) {
            for (Element element : line.getElements()) {
                element.accept(new Element.Visitor<Void>() {
                    @Override
                    public Void visitText(Span span) {
                        spans.add(span);
                        return null;
                    }

                    @Override
                    public Void visitField(FormWidget widget) {
                        return null;
                    }
                });
            }
        }
        return spans;
    }
}
