package com.example.formreader.util.layout.dto;

/**
 * 表单控件（Widget）的最小能力接口
 *
 * 控件由外部文档模型持有，解析流程只保存引用，只读取以下四项。
 */
public interface FormWidget {

    /**
     * 字段名
     */
    String getFieldName();

    /**
     * 字段类型
     */
    FieldType getFieldType();

    /**
     * 当前值，未填写时为 null 或空串
     */
    String getFieldValue();

    /**
     * 控件在页面上的边界框（左上角原点）
     */
    Rect getRect();

    /**
     * 是否已填写
     */
    default boolean hasValue() {
        String value = getFieldValue();
        return value != null && !value.isEmpty();
    }
}
