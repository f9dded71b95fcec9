package com.example.formreader.util.layout.dto;

/**
 * 表格列：表头单元格矩形 + 表头名称，作为列槽位
 */
public final class TableColumn {

    private final String name;
    private final Rect headerCell;

    public TableColumn(String name, Rect headerCell) {
        this.name = name;
        this.headerCell = headerCell;
    }

    public String getName() {
        return name;
    }

    public Rect getHeaderCell() {
        return headerCell;
    }

    @Override
    public String toString() {
        return "TableColumn{name='" + name + "', headerCell=" + headerCell + "}";
    }
}
