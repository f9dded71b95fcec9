package com.example.formreader.util.validate;

import com.example.formreader.util.layout.LayoutConfig;
import com.example.formreader.util.layout.dto.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 字段长度校验
 *
 * 表格单元格比正文窄，两个分组使用不同的最大长度：
 * <ul>
 *   <li>Table：MAX_LENGTH_IN_TABLE（默认 70）</li>
 *   <li>Text：MAX_LENGTH_IN_TEXT（默认 120）</li>
 * </ul>
 *
 * 返回 字段名 → {"Max length": "Perhaps the line is too long"}，没有超长字段时返回空 Map。
 */
public class FieldLengthValidator {

    private static final Logger log = LoggerFactory.getLogger(FieldLengthValidator.class);

    public static final String ERROR_KEY = "Max length";
    public static final String ERROR_MESSAGE = "Perhaps the line is too long";

    private final int maxLengthInText;
    private final int maxLengthInTable;

    public FieldLengthValidator(LayoutConfig config) {
        this.maxLengthInText = config.MAX_LENGTH_IN_TEXT;
        this.maxLengthInTable = config.MAX_LENGTH_IN_TABLE;
    }

    /**
     * 校验两组字段值
     *
     * @param fieldValues 分组名 → (字段名 → 值)
     * @throws IllegalArgumentException 出现未知的分组名
     */
    public Map<String, Map<String, String>> validate(Map<String, Map<String, String>> fieldValues) {
        Map<String, Map<String, String>> errors = new LinkedHashMap<>();

        for (Map.Entry<String, Map<String, String>> bucket : fieldValues.entrySet()) {
            int maxLength = maxLengthFor(bucket.getKey());
            for (Map.Entry<String, String> field : bucket.getValue().entrySet()) {
                String value = field.getValue();
                if (value != null && value.length() > maxLength) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put(ERROR_KEY, ERROR_MESSAGE);
                    errors.put(field.getKey(), error);
                }
            }
        }

        if (!errors.isEmpty()) {
            log.warn("字段长度校验未通过: {}", errors.keySet());
        }
        return errors;
    }

    int maxLengthFor(String bucket) {
        if (ParseResult.BUCKET_TABLE.equals(bucket)) {
            return maxLengthInTable;
        }
        if (ParseResult.BUCKET_TEXT.equals(bucket)) {
            return maxLengthInText;
        }
        throw new IllegalArgumentException("未知的字段分组: " + bucket);
    }
}
