package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Rect;

/**
 * 矩形几何判断工具类
 *
 * <h3>坐标系说明</h3>
 * <ul>
 *   <li>原点：页面左上角</li>
 *   <li>Y轴向下递增（y0 为上边，y1 为下边）</li>
 * </ul>
 *
 * 所有方法都是全函数，不抛异常；矩形必须满足 x1 >= x0、y1 >= y0，
 * 否则结果没有定义。
 */
public final class GeometryUtils {

    /** 默认容差（pt） */
    public static final double DEFAULT_TOLERANCE = 5.0;

    private GeometryUtils() {
    }

    /**
     * 是否同一行：上边或下边的差小于容差
     */
    public static boolean isSameLine(Rect a, Rect b) {
        return isSameLine(a, b, DEFAULT_TOLERANCE);
    }

    public static boolean isSameLine(Rect a, Rect b, double tolerance) {
        return Math.abs(a.y0 - b.y0) < tolerance || Math.abs(a.y1 - b.y1) < tolerance;
    }

    /**
     * inner 的四个坐标都落在 outer 向四周扩展 tolerance 后的范围内
     */
    public static boolean isRectInside(Rect outer, Rect inner) {
        return isRectInside(outer, inner, DEFAULT_TOLERANCE);
    }

    public static boolean isRectInside(Rect outer, Rect inner, double tolerance) {
        double left = outer.x0 - tolerance;
        double right = outer.x1 + tolerance;
        double top = outer.y0 - tolerance;
        double bottom = outer.y1 + tolerance;

        return between(inner.x0, left, right)
                && between(inner.y0, top, bottom)
                && between(inner.x1, left, right)
                && between(inner.y1, top, bottom);
    }

    /**
     * 部分包含：左右边都在 outer 内，且下边不超过 outer 的下边
     *
     * 不检查 y0，用于识别向下延伸出表头单元格的重复表头行。
     */
    public static boolean isPartiallyInside(Rect outer, Rect inner) {
        return outer.x0 <= inner.x0 && outer.x1 >= inner.x1 && outer.y1 >= inner.y1;
    }

    /**
     * 单词是否属于某列：只看单词左边是否落在列的左右边之间
     */
    public static boolean isWordInColumn(Rect word, Rect column) {
        return column.x0 <= word.x0 && word.x0 <= column.x1;
    }

    /**
     * 两个矩形的交集，两个方向都有正的重叠时返回交集矩形，否则返回 null
     */
    public static Rect intersection(Rect a, Rect b) {
        double x0 = Math.max(a.x0, b.x0);
        double y0 = Math.max(a.y0, b.y0);
        double x1 = Math.min(a.x1, b.x1);
        double y1 = Math.min(a.y1, b.y1);

        if (x0 < x1 && y0 < y1) {
            return new Rect(x0, y0, x1, y1);
        }
        return null;
    }

    public static boolean intersects(Rect a, Rect b) {
        return intersection(a, b) != null;
    }

    private static boolean between(double value, double low, double high) {
        return low <= value && value <= high;
    }
}
