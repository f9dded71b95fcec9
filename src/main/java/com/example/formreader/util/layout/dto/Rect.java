package com.example.formreader.util.layout.dto;

import java.util.Objects;

/**
 * 页面矩形（轴对齐）
 *
 * 坐标系：原点在页面左上角，y 轴向下递增。
 * 调用方保证 x1 >= x0、y1 >= y0，这里不做运行时校验；
 * 传入退化矩形时几何判断的结果没有定义（garbage in, garbage out）。
 */
public final class Rect {

    public final double x0;
    public final double y0;
    public final double x1;
    public final double y1;

    public Rect(double x0, double y0, double x1, double y1) {
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    public double getWidth() {
        return x1 - x0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rect)) return false;
        Rect rect = (Rect) o;
        return Double.compare(rect.x0, x0) == 0
                && Double.compare(rect.y0, y0) == 0
                && Double.compare(rect.x1, x1) == 0
                && Double.compare(rect.y1, y1) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x0, y0, x1, y1);
    }

    @Override
    public String toString() {
        return String.format("Rect[%.2f, %.2f, %.2f, %.2f]", x0, y0, x1, y1);
    }
}
