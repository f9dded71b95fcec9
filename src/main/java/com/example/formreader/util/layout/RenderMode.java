package com.example.formreader.util.layout;

/**
 * 文本渲染模式
 */
public enum RenderMode {
    /**
     * 普通模式：字段只输出值
     */
    PLAIN("plain"),

    /**
     * 标注模式：字段输出 "字段名: 值"，下游可以追溯到具体字段
     */
    LABEL("label");

    private final String value;

    RenderMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 从字符串解析
     */
    public static RenderMode fromString(String str) {
        for (RenderMode mode : values()) {
            if (mode.value.equalsIgnoreCase(str)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("未知的渲染模式: " + str);
    }
}
