package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.BasicFormWidget;
import com.example.formreader.util.layout.dto.FieldType;
import com.example.formreader.util.layout.dto.Rect;

/**
 * 从 AcroForm 读取的控件（一个字段的一个 Widget 注释）
 *
 * 同一字段可以有多个 Widget（例如在多处重复显示），每个 Widget 单独一个对象，共享字段名和值。
 */
public class PdfFormWidget extends BasicFormWidget {

    /** 所在页面索引（从 0 开始） */
    private final int pageIndex;

    /** PDF 字段类型（/FT：Tx、Ch、Btn、Sig） */
    private final String pdfFieldType;

    public PdfFormWidget(String fieldName, FieldType fieldType, String fieldValue, Rect rect,
                         int pageIndex, String pdfFieldType) {
        super(fieldName, fieldType, fieldValue, rect);
        this.pageIndex = pageIndex;
        this.pdfFieldType = pdfFieldType;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public String getPdfFieldType() {
        return pdfFieldType;
    }

    @Override
    public String toString() {
        return String.format("PdfFormWidget{name=%s, type=%s(%s), value=%s, page=%d, rect=%s}",
                getFieldName(), getFieldType(), pdfFieldType, getFieldValue(), pageIndex, getRect());
    }
}
