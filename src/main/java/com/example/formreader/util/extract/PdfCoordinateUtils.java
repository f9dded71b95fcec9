package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.Rect;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.TextPosition;

import java.util.List;

/**
 * PDF坐标转换工具类
 *
 * <h3>坐标系说明</h3>
 * <ul>
 *   <li><b>DirAdj坐标系</b>: TextPosition.getXDirAdj/getYDirAdj 返回的坐标
 *     <ul>
 *       <li>已包含所有变换（CTM + Text Matrix + Font Matrix）</li>
 *       <li>原点在页面左上角，YDirAdj 为基线位置</li>
 *     </ul>
 *   </li>
 *   <li><b>PDF用户空间</b>: 注释（控件）矩形使用的坐标系
 *     <ul>
 *       <li>原点：左下角</li>
 *       <li>Y轴向上递增</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * 版面解析统一使用左上角原点、Y轴向下的坐标（与 DirAdj 一致），
 * 控件矩形需要按裁剪框翻转。
 */
public final class PdfCoordinateUtils {

    private PdfCoordinateUtils() {
    }

    /**
     * 从 TextPosition 列表计算边界框（左上角原点）
     *
     * <ul>
     *   <li>顶部 = 基线 - 字高</li>
     *   <li>底部 = 基线</li>
     * </ul>
     *
     * @return 边界框，列表为空时返回 null
     */
    public static Rect computeBoundingBox(List<TextPosition> positions) {
        if (positions == null || positions.isEmpty()) {
            return null;
        }

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;

        for (TextPosition tp : positions) {
            double x = tp.getXDirAdj();
            double baseline = tp.getYDirAdj();

            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x + tp.getWidthDirAdj());
            minY = Math.min(minY, baseline - tp.getHeightDir());
            maxY = Math.max(maxY, baseline);
        }

        return new Rect(minX, minY, maxX, maxY);
    }

    /**
     * PDF用户空间矩形 → 左上角原点坐标
     *
     * @param rect 用户空间矩形（左下角原点）
     * @param cropBox 页面裁剪框
     */
    public static Rect toTopLeft(PDRectangle rect, PDRectangle cropBox) {
        double x0 = rect.getLowerLeftX() - cropBox.getLowerLeftX();
        double x1 = rect.getUpperRightX() - cropBox.getLowerLeftX();
        double y0 = cropBox.getUpperRightY() - rect.getUpperRightY();
        double y1 = cropBox.getUpperRightY() - rect.getLowerLeftY();
        return new Rect(x0, y0, x1, y1);
    }
}
