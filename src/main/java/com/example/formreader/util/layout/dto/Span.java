package com.example.formreader.util.layout.dto;

/**
 * 文本片段：一段提取出的文本及其边界框
 *
 * 不可变。叠加表单值时生成新的 Span，原对象不修改。
 */
public final class Span {

    private final String text;
    private final Rect rect;

    public Span(String text, Rect rect) {
        this.text = text != null ? text : "";
        this.rect = rect;
    }

    public String getText() {
        return text;
    }

    public Rect getRect() {
        return rect;
    }

    /**
     * 保留位置，替换文本
     */
    public Span withText(String newText) {
        return new Span(newText, rect);
    }

    @Override
    public String toString() {
        return "Span{text='" + text + "', rect=" + rect + "}";
    }
}
