package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.Element;
import com.example.formreader.util.layout.dto.FieldType;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.Line;
import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.Span;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 控件与文本片段的叠加处理
 *
 * 表单控件常常绘制在下划线（"______"）之类的占位文本上方。
 * 对每个文本片段，找到第一个与之相交的控件，把相交区域按比例换算成字符下标，
 * 用 "[控件值]" 替换这一段文本，并去掉残留的下划线。
 */
public class WidgetSpanProcessor {

    /** 未填写的文本字段显示值 */
    public static final String EMPTY_VALUE = "N/A";

    public static final String CHECKBOX_ON = "ON";
    public static final String CHECKBOX_OFF = "OFF";

    private final int toleranceBefore;
    private final int toleranceAfter;

    public WidgetSpanProcessor(LayoutConfig config) {
        this.toleranceBefore = config.OVERLAY_TOLERANCE_BEFORE;
        this.toleranceAfter = config.OVERLAY_TOLERANCE_AFTER;
    }

    /**
     * 控件显示值
     *
     * <ul>
     *   <li>文本框/下拉框：值，未填写为 N/A</li>
     *   <li>复选框：ON / OFF</li>
     *   <li>其它类型：空串</li>
     * </ul>
     * 标注模式下加 "字段名: " 前缀（其它类型仍为空串）。
     */
    public static String getWidgetValue(FormWidget widget, RenderMode mode) {
        String value;
        FieldType type = widget.getFieldType() != null ? widget.getFieldType() : FieldType.OTHER;
        switch (type) {
            case TEXT:
            case COMBO_BOX:
                value = widget.hasValue() ? widget.getFieldValue() : EMPTY_VALUE;
                break;
            case CHECK_BOX:
                value = isChecked(widget) ? CHECKBOX_ON : CHECKBOX_OFF;
                break;
            default:
                return "";
        }

        if (mode == RenderMode.LABEL) {
            return widget.getFieldName() + ": " + value;
        }
        return value;
    }

    /**
     * 复选框是否勾选：有值且不是 "Off"
     */
    static boolean isChecked(FormWidget widget) {
        return widget.hasValue() && !"Off".equalsIgnoreCase(widget.getFieldValue().trim());
    }

    /**
     * 从控件列表中收集已填写的文本字段（字段名 → 值）
     */
    public static Map<String, String> extractTextWidgets(Collection<? extends FormWidget> widgets) {
        Map<String, String> result = new LinkedHashMap<>();
        for (FormWidget widget : widgets) {
            if (widget.getFieldType() == FieldType.TEXT && widget.hasValue()) {
                result.put(widget.getFieldName(), widget.getFieldValue());
            }
        }
        return result;
    }

    /**
     * 处理一行中控件与文本片段的相交
     *
     * @param line 原始行
     * @param mode 渲染模式（决定替换进去的控件显示值）
     * @return 新的行：被覆盖的片段换成替换后的文本，未匹配的控件单独追加，按 x0 排序
     */
    public Line handleWidgetSpanIntersections(Line line, RenderMode mode) {
        final List<Span> spans = new ArrayList<>();
        final List<FormWidget> widgets = new ArrayList<>();
        for (Element element : line.getElements()) {
            element.accept(new Element.Visitor<Void>() {
                @Override
                public Void visitText(Span span) {
                    spans.add(span);
                    return null;
                }

                @Override
                public Void visitField(FormWidget widget) {
                    widgets.add(widget);
                    return null;
                }
            });
        }

        Set<FormWidget> consumed = Collections.newSetFromMap(new IdentityHashMap<FormWidget, Boolean>());
        List<Element> updated = new ArrayList<>();

        for (Span span : spans) {
            FormWidget match = null;
            for (FormWidget widget : widgets) {
                if (!consumed.contains(widget) && GeometryUtils.intersects(span.getRect(), widget.getRect())) {
                    match = widget;
                    break;
                }
            }
            if (match != null) {
                consumed.add(match);
                updated.add(Element.text(replaceTextInSpan(span, match, mode)));
            } else {
                updated.add(Element.text(span));
            }
        }

        for (FormWidget widget : widgets) {
            if (!consumed.contains(widget)) {
                updated.add(Element.field(widget));
            }
        }

        updated.sort(TextLineGrouper.BY_X0);
        return Line.of(updated, line.getRect());
    }

    /**
     * 用控件值替换片段中与控件相交的那一段文字
     *
     * 下标按相交区域 x 范围在片段宽度上线性插值，起点加 toleranceBefore、
     * 终点减 toleranceAfter，避免吃掉相邻字符。
     */
    Span replaceTextInSpan(Span span, FormWidget widget, RenderMode mode) {
        Rect intersection = GeometryUtils.intersection(span.getRect(), widget.getRect());
        if (intersection == null) {
            return span;
        }

        String text = span.getText();
        int length = text.length();
        Rect rect = span.getRect();
        double width = rect.getWidth();

        // 有正的交集时片段宽度一定大于 0
        int start = (int) Math.floor((intersection.x0 - rect.x0) / width * length) + toleranceBefore;
        int end = (int) Math.floor((intersection.x1 - rect.x0) / width * length) - toleranceAfter;
        start = clamp(start, 0, length);
        end = clamp(end, start, length);

        String before = removeUnderscores(text.substring(0, start));
        String after = removeUnderscores(text.substring(end));

        String newText = before + "[" + getWidgetValue(widget, mode) + "]" + after;
        return span.withText(newText.trim());
    }

    /**
     * 删除占位用的下划线
     */
    static String removeUnderscores(String text) {
        return text.replace("_", "");
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * 渲染一行：片段输出文本，独立控件输出 "[显示值]"，空格连接
     */
    public static String renderLine(Line line, final RenderMode mode) {
        List<String> parts = new ArrayList<>();
        for (Element element : line.getElements()) {
            parts.add(element.accept(new Element.Visitor<String>() {
                @Override
                public String visitText(Span span) {
                    return span.getText();
                }

                @Override
                public String visitField(FormWidget widget) {
                    return "[" + getWidgetValue(widget, mode) + "]";
                }
            }));
        }
        return String.join(" ", parts);
    }
}
