package com.example.formreader.util.layout.dto;

/**
 * 页面上按垂直位置排序的块（文本行或表格）
 */
public interface PageBlock {

    /**
     * 用于垂直排序的边界框，取 y0 作为顶部
     */
    Rect getRect();
}
