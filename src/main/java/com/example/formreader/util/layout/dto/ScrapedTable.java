package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 提取层给出的表格结构：表格边界框 + 表头（单元格矩形与名称）
 *
 * cells 与 names 按列一一对应；names 比 cells 短时缺失的名称视为空串。
 */
public final class ScrapedTable {

    private final Rect bbox;
    private final List<Rect> headerCells;
    private final List<String> headerNames;

    public ScrapedTable(Rect bbox, List<Rect> headerCells, List<String> headerNames) {
        this.bbox = bbox;
        this.headerCells = headerCells != null
                ? Collections.unmodifiableList(new ArrayList<>(headerCells))
                : Collections.<Rect>emptyList();
        this.headerNames = headerNames != null
                ? Collections.unmodifiableList(new ArrayList<>(headerNames))
                : Collections.<String>emptyList();
    }

    public Rect getBbox() {
        return bbox;
    }

    public List<Rect> getHeaderCells() {
        return headerCells;
    }

    public List<String> getHeaderNames() {
        return headerNames;
    }

    /**
     * 表头列（按表头单元格顺序）
     */
    public List<TableColumn> getColumns() {
        List<TableColumn> columns = new ArrayList<>(headerCells.size());
        for (int i = 0; i < headerCells.size(); i++) {
            String name = i < headerNames.size() && headerNames.get(i) != null ? headerNames.get(i) : "";
            columns.add(new TableColumn(name, headerCells.get(i)));
        }
        return columns;
    }

    @Override
    public String toString() {
        return "ScrapedTable{bbox=" + bbox + ", headerNames=" + headerNames + "}";
    }
}
