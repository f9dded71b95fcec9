package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Element;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.ParsedTable;
import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.ScrapedTable;
import com.example.formreader.util.layout.dto.Span;
import com.example.formreader.util.layout.dto.TableColumn;
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
 * 表格检测与分列
 *
 * 流程：
 * ① 归属：行矩形落在表格边界框内（带容差）即为表格行
 * ② 抽取：表格行从页面普通行中移除，只在表格中输出
 * ③ 去表头：与任一表头单元格（完全或部分）重合的行丢弃
 * ④ 分列：按表头顺序，左边落在表头单元格左右边之间的元素归入该列
 *    （不保证一个元素只进一列，列范围重叠时会重复出现）
 * ⑤ 渲染：普通网格 / 带字段名的竖线分隔格式
 */
public class TableProcessor {

    private static final Logger log = LoggerFactory.getLogger(TableProcessor.class);

    private final double insideTolerance;

    public TableProcessor(LayoutConfig config) {
        this.insideTolerance = config.RECT_INSIDE_TOLERANCE;
    }

    /**
     * 表格检测结果
     */
    public static class Detection {
        /** 表格以外的文本行（保持原有顺序） */
        public final List<Line> remainingLines;
        /** 解析后的表格（与输入表格结构顺序一致） */
        public final List<ParsedTable> tables;
        /** 所有表格行上的控件 */
        public final List<FormWidget> tableWidgets;

        Detection(List<Line> remainingLines, List<ParsedTable> tables, List<FormWidget> tableWidgets) {
            this.remainingLines = remainingLines;
            this.tables = tables;
            this.tableWidgets = tableWidgets;
        }
    }

    // ========== 检测与分列 ==========

    /**
     * 在一页的行中识别表格行并分列
     *
     * @param lines 页面上的全部行
     * @param scrapedTables 提取层给出的表格结构
     */
    public Detection detect(List<Line> lines, List<ScrapedTable> scrapedTables) {
        if (scrapedTables == null || scrapedTables.isEmpty()) {
            return new Detection(new ArrayList<>(lines), Collections.<ParsedTable>emptyList(),
                    Collections.<FormWidget>emptyList());
        }

        List<Line> tableLines = findTextLinesInTables(lines, scrapedTables);
        List<Line> remaining = removeTableLines(lines, tableLines);

        List<ParsedTable> parsed = new ArrayList<>(scrapedTables.size());
        for (ScrapedTable table : scrapedTables) {
            parsed.add(parseScrapedTable(tableLines, table));
        }

        log.debug("表格检测: {} 个表格, {} 行归入表格, {} 行保留", scrapedTables.size(), tableLines.size(), remaining.size());
        return new Detection(remaining, parsed, collectWidgets(tableLines));
    }

    /**
     * ① 落在任一表格内的行
     */
    List<Line> findTextLinesInTables(List<Line> lines, List<ScrapedTable> tables) {
        List<Line> result = new ArrayList<>();
        for (Line line : lines) {
            for (ScrapedTable table : tables) {
                if (GeometryUtils.isRectInside(table.getBbox(), line.getRect(), insideTolerance)) {
                    result.add(line);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * ② 从页面行中移除表格行（按对象身份）
     */
    static List<Line> removeTableLines(List<Line> lines, List<Line> tableLines) {
        Set<Line> tableSet = Collections.newSetFromMap(new IdentityHashMap<Line, Boolean>());
        tableSet.addAll(tableLines);

        List<Line> remaining = new ArrayList<>();
        for (Line line : lines) {
            if (!tableSet.contains(line)) {
                remaining.add(line);
            }
        }
        return remaining;
    }

    private ParsedTable parseScrapedTable(List<Line> tableLines, ScrapedTable table) {
        List<TableColumn> columns = table.getColumns();
        List<Line> bodyRows = deleteDuplicatesInHeader(filterLinesInsideTable(tableLines, table), columns);
        return new ParsedTable(columns, splitWordsIntoColumns(bodyRows, columns), table.getBbox());
    }

    private List<Line> filterLinesInsideTable(List<Line> lines, ScrapedTable table) {
        List<Line> result = new ArrayList<>();
        for (Line line : lines) {
            if (GeometryUtils.isRectInside(table.getBbox(), line.getRect(), insideTolerance)) {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * ③ 去掉表头自身的文本行
     */
    List<Line> deleteDuplicatesInHeader(List<Line> rows, List<TableColumn> columns) {
        List<Line> result = new ArrayList<>();
        for (Line row : rows) {
            boolean isHeader = false;
            for (TableColumn column : columns) {
                Rect cell = column.getHeaderCell();
                if (GeometryUtils.isRectInside(cell, row.getRect(), insideTolerance)
                        || GeometryUtils.isPartiallyInside(cell, row.getRect())) {
                    isHeader = true;
                    break;
                }
            }
            if (!isHeader) {
                result.add(row);
            }
        }
        return result;
    }

    /**
     * ④ 分列：每行、每列一个单元格
     */
    static List<List<List<Element>>> splitWordsIntoColumns(List<Line> rows, List<TableColumn> columns) {
        List<List<List<Element>>> table = new ArrayList<>(rows.size());
        for (Line row : rows) {
            List<List<Element>> cells = new ArrayList<>(columns.size());
            for (TableColumn column : columns) {
                List<Element> cell = new ArrayList<>();
                for (Element element : row.getElements()) {
                    if (GeometryUtils.isWordInColumn(element.getRect(), column.getHeaderCell())) {
                        cell.add(element);
                    }
                }
                cells.add(cell);
            }
            table.add(cells);
        }
        return table;
    }

    private static List<FormWidget> collectWidgets(List<Line> tableLines) {
        final List<FormWidget> widgets = new ArrayList<>();
        for (Line line : tableLines) {
            for (Element element : line.getElements()) {
                element.accept(new Element.Visitor<Void>() {
                    @Override
                    public Void visitText(Span span) {
                        return null;
                    }

                    @Override
                    public Void visitField(FormWidget widget) {
                        widgets.add(widget);
                        return null;
                    }
                });
            }
        }
        return widgets;
    }

    // ========== 单元格文本 ==========

    /**
     * 单元格文本：元素文本空格连接；空单元格返回 null
     *
     * 普通模式下控件贡献显示值，标注模式下贡献 "字段名: 值"。
     */
    public static String extractCellText(List<Element> cell, final RenderMode mode) {
        List<String> words = new ArrayList<>();
        for (Element element : cell) {
            String word = element.accept(new Element.Visitor<String>() {
                @Override
                public String visitText(Span span) {
                    return span.getText();
                }

                @Override
                public String visitField(FormWidget widget) {
                    return WidgetSpanProcessor.getWidgetValue(widget, mode);
                }
            });
            if (word != null && !word.isEmpty()) {
                words.add(word);
            }
        }
        return words.isEmpty() ? null : String.join(" ", words);
    }

    /**
     * 表格按行转换为 表头名 → 单元格文本，空单元格为 N/A
     */
    public static List<Map<String, String>> toRowMaps(ParsedTable table, RenderMode mode) {
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> headers = table.getHeaderNames();
        for (List<List<Element>> row : table.getRows()) {
            Map<String, String> rowData = new LinkedHashMap<>();
            for (int i = 0; i < row.size() && i < headers.size(); i++) {
                String text = extractCellText(row.get(i), mode);
                rowData.put(headers.get(i), text != null ? text : WidgetSpanProcessor.EMPTY_VALUE);
            }
            rows.add(rowData);
        }
        return rows;
    }

    // ========== 渲染 ==========

    /**
     * 按模式渲染表格
     */
    public static String formatTable(ParsedTable table, RenderMode mode) {
        return mode == RenderMode.LABEL ? formatTableWithLabels(table) : formatTableToGrid(table);
    }

    /**
     * 普通模式：带边框的对齐网格
     *
     * <pre>
     * +------+-----+
     * | Name | Age |
     * +======+=====+
     * | Jane | 30  |
     * +------+-----+
     * </pre>
     * 全空的行不输出；没有列时返回空串。
     */
    public static String formatTableToGrid(ParsedTable table) {
        int columnCount = table.getColumnCount();
        if (columnCount == 0) {
            return "";
        }

        List<String> headers = table.getHeaderNames();
        List<List<String>> body = new ArrayList<>();
        for (List<List<Element>> row : table.getRows()) {
            List<String> cells = new ArrayList<>(columnCount);
            boolean hasText = false;
            for (List<Element> cell : row) {
                String text = extractCellText(cell, RenderMode.PLAIN);
                hasText |= text != null;
                cells.add(text != null ? text : "");
            }
            if (hasText) {
                body.add(cells);
            }
        }

        int[] widths = new int[columnCount];
        for (int c = 0; c < columnCount; c++) {
            widths[c] = headers.get(c).length();
            for (List<String> row : body) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }

        String border = gridBorder(widths, '-');
        List<String> out = new ArrayList<>();
        out.add(border);
        out.add(gridRow(headers, widths));
        if (body.isEmpty()) {
            out.add(border);
        } else {
            out.add(gridBorder(widths, '='));
            for (List<String> row : body) {
                out.add(gridRow(row, widths));
                out.add(border);
            }
        }
        return String.join("\n", out);
    }

    /**
     * 标注模式：竖线分隔，字段以 "字段名: 值" 输出，空单元格为 N/A
     *
     * <pre>
     * Name | Age
     * ---------------
     * name_1: Jane | 30
     * </pre>
     * 没有列或没有正文行时返回空串。
     */
    public static String formatTableWithLabels(ParsedTable table) {
        if (table.getColumnCount() == 0 || table.getRows().isEmpty()) {
            return "";
        }

        String headerLine = String.join(" | ", table.getHeaderNames());
        List<String> out = new ArrayList<>();
        out.add(headerLine);
        out.add(repeat('-', headerLine.length() + 5));
        for (List<List<Element>> row : table.getRows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (List<Element> cell : row) {
                String text = extractCellText(cell, RenderMode.LABEL);
                cells.add(text != null ? text : WidgetSpanProcessor.EMPTY_VALUE);
            }
            out.add(String.join(" | ", cells));
        }
        return String.join("\n", out);
    }

    private static String gridBorder(int[] widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(repeat(fill, width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String gridRow(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int c = 0; c < widths.length; c++) {
            String cell = cells.get(c);
            sb.append(' ').append(cell).append(repeat(' ', widths[c] - cell.length() + 1)).append('|');
        }
        return sb.toString();
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
