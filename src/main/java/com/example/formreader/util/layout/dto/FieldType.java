package com.example.formreader.util.layout.dto;

/**
 * 表单字段类型
 */
public enum FieldType {
    /**
     * 文本框
     */
    TEXT,

    /**
     * 下拉框
     */
    COMBO_BOX,

    /**
     * 复选框
     */
    CHECK_BOX,

    /**
     * 其它类型（单选按钮、签名、按钮等），显示值为空
     */
    OTHER
}
