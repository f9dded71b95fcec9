package com.example.formreader.util.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * 版面解析全局配置类
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用）
 * 2. 支持从 JSON 文件部分覆盖
 * 3. 容错回退（JSON 解析失败时使用默认值）
 */
public class LayoutConfig {

    private static final Logger log = LoggerFactory.getLogger(LayoutConfig.class);

    // ========== 几何判断相关 ==========

    /** 同行判定容差（pt，上边或下边之差小于该值视为同一行） */
    public double SAME_LINE_TOLERANCE = 5.0;

    /** 包含判定容差（pt，外框向四周扩展的距离） */
    public double RECT_INSIDE_TOLERANCE = 5.0;

    // ========== 控件叠加相关 ==========

    /** 替换区间起点向后的字符偏移 */
    public int OVERLAY_TOLERANCE_BEFORE = 2;

    /** 替换区间终点向前的字符偏移 */
    public int OVERLAY_TOLERANCE_AFTER = 1;

    // ========== 字段校验相关 ==========

    /** 正文字段最大长度 */
    public int MAX_LENGTH_IN_TEXT = 120;

    /** 表格字段最大长度 */
    public int MAX_LENGTH_IN_TABLE = 70;

    // ========== 表格定位相关 ==========

    /** lattice 未找到表格时是否用 stream 算法兜底（stream 会把普通文本也识别成表格，默认关闭） */
    public boolean TABULA_STREAM_FALLBACK = false;

    /**
     * 私有构造函数（使用工厂方法创建）
     */
    private LayoutConfig() {
    }

    /**
     * 加载默认配置
     */
    public static LayoutConfig loadDefault() {
        return new LayoutConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static LayoutConfig loadFromJson(String jsonPath) {
        LayoutConfig config = new LayoutConfig();

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode json = mapper.readTree(new File(jsonPath));

            if (json.has("SAME_LINE_TOLERANCE")) {
                config.SAME_LINE_TOLERANCE = json.get("SAME_LINE_TOLERANCE").asDouble();
            }
            if (json.has("RECT_INSIDE_TOLERANCE")) {
                config.RECT_INSIDE_TOLERANCE = json.get("RECT_INSIDE_TOLERANCE").asDouble();
            }
            if (json.has("OVERLAY_TOLERANCE_BEFORE")) {
                config.OVERLAY_TOLERANCE_BEFORE = json.get("OVERLAY_TOLERANCE_BEFORE").asInt();
            }
            if (json.has("OVERLAY_TOLERANCE_AFTER")) {
                config.OVERLAY_TOLERANCE_AFTER = json.get("OVERLAY_TOLERANCE_AFTER").asInt();
            }
            if (json.has("MAX_LENGTH_IN_TEXT")) {
                config.MAX_LENGTH_IN_TEXT = json.get("MAX_LENGTH_IN_TEXT").asInt();
            }
            if (json.has("MAX_LENGTH_IN_TABLE")) {
                config.MAX_LENGTH_IN_TABLE = json.get("MAX_LENGTH_IN_TABLE").asInt();
            }
            if (json.has("TABULA_STREAM_FALLBACK")) {
                config.TABULA_STREAM_FALLBACK = json.get("TABULA_STREAM_FALLBACK").asBoolean();
            }

            log.info("已加载版面配置: {}", jsonPath);

        } catch (Exception e) {
            log.warn("版面配置加载失败，使用默认配置: {}", e.getMessage());
        }

        return config;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("LayoutConfig{\n");
        sb.append("  SAME_LINE_TOLERANCE=").append(SAME_LINE_TOLERANCE).append(",\n");
        sb.append("  RECT_INSIDE_TOLERANCE=").append(RECT_INSIDE_TOLERANCE).append(",\n");
        sb.append("  OVERLAY_TOLERANCE_BEFORE=").append(OVERLAY_TOLERANCE_BEFORE).append(",\n");
        sb.append("  OVERLAY_TOLERANCE_AFTER=").append(OVERLAY_TOLERANCE_AFTER).append(",\n");
        sb.append("  MAX_LENGTH_IN_TEXT=").append(MAX_LENGTH_IN_TEXT).append(",\n");
        sb.append("  MAX_LENGTH_IN_TABLE=").append(MAX_LENGTH_IN_TABLE).append(",\n");
        sb.append("  TABULA_STREAM_FALLBACK=").append(TABULA_STREAM_FALLBACK).append("\n");
        sb.append("}");
        return sb.toString();
    }
}
