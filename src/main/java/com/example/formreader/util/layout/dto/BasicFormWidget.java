package com.example.formreader.util.layout.dto;

/**
 * FormWidget 的简单实现（提取层和测试使用）
 */
public class BasicFormWidget implements FormWidget {

    private final String fieldName;
    private final FieldType fieldType;
    private final String fieldValue;
    private final Rect rect;

    public BasicFormWidget(String fieldName, FieldType fieldType, String fieldValue, Rect rect) {
        this.fieldName = fieldName;
        this.fieldType = fieldType != null ? fieldType : FieldType.OTHER;
        this.fieldValue = fieldValue;
        this.rect = rect;
    }

    @Override
    public String getFieldName() {
        return fieldName;
    }

    @Override
    public FieldType getFieldType() {
        return fieldType;
    }

    @Override
    public String getFieldValue() {
        return fieldValue;
    }

    @Override
    public Rect getRect() {
        return rect;
    }

    @Override
    public String toString() {
        return String.format("FormWidget{name=%s, type=%s, value=%s, rect=%s}",
                fieldName, fieldType, fieldValue, rect);
    }
}
