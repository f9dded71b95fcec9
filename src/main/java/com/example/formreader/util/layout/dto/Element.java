package com.example.formreader.util.layout.dto;

/**
 * 行内元素：文本片段或表单控件
 *
 * <ul>
 *   <li>{@link TextElement} 包装一个 {@link Span}</li>
 *   <li>{@link FieldElement} 引用一个 {@link FormWidget}</li>
 * </ul>
 *
 * 只有这两种子类（构造函数私有），区分类型统一通过 {@link Visitor}。
 */
public abstract class Element {

    private Element() {
    }

    public static Element text(Span span) {
        return new TextElement(span);
    }

    public static Element field(FormWidget widget) {
        return new FieldElement(widget);
    }

    public abstract Rect getRect();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitText(Span span);

        R visitField(FormWidget widget);
    }

    public static final class TextElement extends Element {
        private final Span span;

        private TextElement(Span span) {
            this.span = span;
        }

        public Span getSpan() {
            return span;
        }

        @Override
        public Rect getRect() {
            return span.getRect();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(span);
        }

        @Override
        public String toString() {
            return "Text(" + span.getText() + ")";
        }
    }

    public static final class FieldElement extends Element {
        private final FormWidget widget;

        private FieldElement(FormWidget widget) {
            this.widget = widget;
        }

        public FormWidget getWidget() {
            return widget;
        }

        @Override
        public Rect getRect() {
            return widget.getRect();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitField(widget);
        }

        @Override
        public String toString() {
            return "Field(" + widget.getFieldName() + ")";
        }
    }
}
