package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 文本行：共享同一垂直带的一组元素，按 x0 从左到右
 *
 * rect 固定为种子元素（按 y 排序后行内第一个元素）的矩形，只用于垂直定位，
 * 不根据全部成员重新计算。构建完成后不可修改。
 */
public final class Line implements PageBlock {

    private final List<Element> elements;
    private final Rect rect;

    private Line(List<Element> elements, Rect rect) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.rect = rect;
    }

    public static Line of(List<Element> elements, Rect rect) {
        return new Line(elements, rect);
    }

    public static Builder builder(Rect seed) {
        return new Builder(seed);
    }

    public List<Element> getElements() {
        return elements;
    }

    @Override
    public Rect getRect() {
        return rect;
    }

    @Override
    public String toString() {
        return "Line{elements=" + elements + ", rect=" + rect + "}";
    }

    /**
     * 行构建器，build() 之后返回新的不可变 Line
     */
    public static final class Builder {
        private final Rect seed;
        private final List<Element> elements = new ArrayList<>();

        private Builder(Rect seed) {
            this.seed = seed;
        }

        public Builder add(Element element) {
            elements.add(element);
            return this;
        }

        public Rect getSeed() {
            return seed;
        }

        public List<Element> getElements() {
            return elements;
        }

        public Line build() {
            return new Line(elements, seed);
        }
    }
}
