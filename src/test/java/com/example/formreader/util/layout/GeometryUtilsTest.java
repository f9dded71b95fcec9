package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Rect;
import org.junit.jupiter.api.Test;

import static com.example.formreader.util.layout.LayoutFixtures.rect;
import static org.assertj.core.api.Assertions.assertThat;

class GeometryUtilsTest {

    @Test
    void sameLineWhenTopOrBottomWithinTolerance() {
        assertThat(GeometryUtils.isSameLine(rect(0, 10, 50, 20), rect(60, 13, 90, 40))).isTrue();
        assertThat(GeometryUtils.isSameLine(rect(0, 10, 50, 20), rect(60, 0, 90, 22))).isTrue();
        assertThat(GeometryUtils.isSameLine(rect(0, 10, 50, 20), rect(60, 30, 90, 40))).isFalse();
    }

    @Test
    void sameLineToleranceIsStrict() {
        assertThat(GeometryUtils.isSameLine(rect(0, 0, 10, 10), rect(0, 5, 10, 15), 5)).isFalse();
        assertThat(GeometryUtils.isSameLine(rect(0, 0, 10, 10), rect(0, 4.9, 10, 14.9), 5)).isTrue();
    }

    @Test
    void rectInsideIsReflexive() {
        Rect r = rect(12.5, 40, 99, 41);
        assertThat(GeometryUtils.isRectInside(r, r, 0)).isTrue();
        assertThat(GeometryUtils.isRectInside(r, r)).isTrue();
    }

    @Test
    void rectInsideHonoursTolerance() {
        Rect outer = rect(100, 100, 200, 200);
        assertThat(GeometryUtils.isRectInside(outer, rect(96, 98, 204, 205))).isTrue();
        assertThat(GeometryUtils.isRectInside(outer, rect(94, 100, 150, 150))).isFalse();
        assertThat(GeometryUtils.isRectInside(outer, rect(96, 98, 204, 205), 0)).isFalse();
    }

    @Test
    void partiallyInsideIgnoresTopEdge() {
        Rect header = rect(0, 50, 100, 70);
        assertThat(GeometryUtils.isPartiallyInside(header, rect(10, 0, 90, 65))).isTrue();
        assertThat(GeometryUtils.isPartiallyInside(header, rect(10, 60, 90, 75))).isFalse();
        assertThat(GeometryUtils.isPartiallyInside(header, rect(-1, 55, 90, 65))).isFalse();
    }

    @Test
    void wordInColumnLooksAtLeftEdgeOnly() {
        Rect column = rect(100, 0, 200, 20);
        assertThat(GeometryUtils.isWordInColumn(rect(100, 30, 400, 40), column)).isTrue();
        assertThat(GeometryUtils.isWordInColumn(rect(200, 30, 210, 40), column)).isTrue();
        assertThat(GeometryUtils.isWordInColumn(rect(99, 30, 150, 40), column)).isFalse();
    }

    @Test
    void intersectionIsSymmetric() {
        Rect a = rect(0, 0, 50, 50);
        Rect b = rect(30, 20, 80, 90);
        assertThat(GeometryUtils.intersection(a, b))
                .isEqualTo(GeometryUtils.intersection(b, a))
                .isEqualTo(rect(30, 20, 50, 50));
    }

    @Test
    void touchingRectanglesDoNotIntersect() {
        Rect a = rect(0, 0, 50, 50);
        assertThat(GeometryUtils.intersection(a, rect(50, 0, 60, 50))).isNull();
        assertThat(GeometryUtils.intersection(rect(50, 0, 60, 50), a)).isNull();
        assertThat(GeometryUtils.intersects(a, rect(0, 60, 50, 70))).isFalse();
    }
}
