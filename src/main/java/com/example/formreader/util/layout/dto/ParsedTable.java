package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析后的表格
 *
 * rows 中每一行按列给出一个单元格，单元格是元素列表（可以为空）。
 */
public final class ParsedTable implements PageBlock {

    private final List<String> headerNames;
    private final List<List<List<Element>>> rows;
    private final Rect rect;

    public ParsedTable(List<TableColumn> columns, List<List<List<Element>>> rows, Rect rect) {
        List<String> names = new ArrayList<>(columns.size());
        for (TableColumn column : columns) {
            names.add(column.getName());
        }
        this.headerNames = Collections.unmodifiableList(names);

        List<List<List<Element>>> frozenRows = new ArrayList<>(rows.size());
        for (List<List<Element>> row : rows) {
            List<List<Element>> frozenRow = new ArrayList<>(row.size());
            for (List<Element> cell : row) {
                frozenRow.add(Collections.unmodifiableList(new ArrayList<>(cell)));
            }
            frozenRows.add(Collections.unmodifiableList(frozenRow));
        }
        this.rows = Collections.unmodifiableList(frozenRows);
        this.rect = rect;
    }

    public List<String> getHeaderNames() {
        return headerNames;
    }

    public List<List<List<Element>>> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return headerNames.size();
    }

    @Override
    public Rect getRect() {
        return rect;
    }

    @Override
    public String toString() {
        return String.format("ParsedTable{headers=%s, rows=%d, rect=%s}", headerNames, rows.size(), rect);
    }
}
