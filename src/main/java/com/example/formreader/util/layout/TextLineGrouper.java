package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Element;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.Span;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 文本行聚类器
 *
 * 算法：
 * 1. 所有元素按 y0 升序（稳定排序）
 * 2. 顺序扫描，以当前行第一个元素的矩形为种子；与种子同行则加入，否则收行并以该元素开新行
 * 3. 收行时按 x0 升序，并删除与同行控件显示值相同的文本（控件绘制在普通文本上方产生的重复）
 *
 * 种子矩形在整行内固定不变，有轻微垂直漂移的行可能被切成两行。
 */
public class TextLineGrouper {

    static final Comparator<Element> BY_Y0 = Comparator.comparingDouble(e -> e.getRect().y0);
    static final Comparator<Element> BY_X0 = Comparator.comparingDouble(e -> e.getRect().x0);

    private final double sameLineTolerance;

    public TextLineGrouper(LayoutConfig config) {
        this.sameLineTolerance = config.SAME_LINE_TOLERANCE;
    }

    /**
     * 把一页的文本片段和控件组合成有序的行
     */
    public List<Line> groupPage(Collection<Span> spans, Collection<? extends FormWidget> widgets) {
        List<Element> elements = new ArrayList<>();
        for (Span span : spans) {
            elements.add(Element.text(span));
        }
        for (FormWidget widget : widgets) {
            elements.add(Element.field(widget));
        }
        return group(elements);
    }

    /**
     * 把无序元素聚成行，行按种子 y0 升序
     */
    public List<Line> group(List<Element> elements) {
        List<Line> lines = new ArrayList<>();
        if (elements == null || elements.isEmpty()) {
            return lines;
        }

        List<Element> sorted = new ArrayList<>(elements);
        sorted.sort(BY_Y0);

        Line.Builder current = Line.builder(sorted.get(0).getRect()).add(sorted.get(0));
        for (Element element : sorted.subList(1, sorted.size())) {
            if (GeometryUtils.isSameLine(current.getSeed(), element.getRect(), sameLineTolerance)) {
                current.add(element);
            } else {
                lines.add(closeLine(current));
                current = Line.builder(element.getRect()).add(element);
            }
        }
        lines.add(closeLine(current));

        return lines;
    }

    private Line closeLine(Line.Builder builder) {
        List<Element> elements = builder.getElements();
        elements.sort(BY_X0);
        removeWidgetDuplicates(elements);
        return builder.build();
    }

    /**
     * 删除文本与同行某个控件显示值相同的文本元素，保留控件
     *
     * 显示值按普通模式计算（复选框为 ON / OFF，未填写的文本框为 N/A），
     * 所以复选框旁边的 "Yes" 之类的标签不会被当成重复。
     */
    static void removeWidgetDuplicates(List<Element> elements) {
        final Set<String> widgetValues = new HashSet<>();
        for (Element element : elements) {
            element.accept(new Element.Visitor<Void>() {
                @Override
                public Void visitText(Span span) {
                    return null;
                }

                @Override
                public Void visitField(FormWidget widget) {
                    String display = WidgetSpanProcessor.getWidgetValue(widget, RenderMode.PLAIN).trim();
                    if (!display.isEmpty()) {
                        widgetValues.add(display);
                    }
                    return null;
                }
            });
        }
        if (widgetValues.isEmpty()) {
            return;
        }

        elements.removeIf(element -> element.accept(new Element.Visitor<Boolean>() {
            @Override
            public Boolean visitText(Span span) {
                return widgetValues.contains(span.getText().trim());
            }

            @Override
            public Boolean visitField(FormWidget widget) {
                return false;
            }
        }));
    }
}
