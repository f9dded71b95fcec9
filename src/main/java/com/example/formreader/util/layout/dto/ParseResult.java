package com.example.formreader.util.layout.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析结果
 *
 * fieldValues 固定两个分组：
 * <ul>
 *   <li>{@link #BUCKET_TEXT}：正文中的文本字段</li>
 *   <li>{@link #BUCKET_TABLE}：表格中的文本字段</li>
 * </ul>
 * 两个分组的校验规则（最大长度）不同，所以分开存放。
 */
public final class ParseResult {

    public static final String BUCKET_TEXT = "Text";
    public static final String BUCKET_TABLE = "Table";

    private final String documentText;
    private final Map<String, Map<String, String>> fieldValues;
    private final DocumentLayout document;
    private final List<Integer> skippedPages;

    public ParseResult(String documentText,
                       Map<String, String> textFields,
                       Map<String, String> tableFields,
                       DocumentLayout document,
                       List<Integer> skippedPages) {
        this.documentText = documentText;
        Map<String, Map<String, String>> buckets = new LinkedHashMap<>();
        buckets.put(BUCKET_TEXT, Collections.unmodifiableMap(new LinkedHashMap<>(textFields)));
        buckets.put(BUCKET_TABLE, Collections.unmodifiableMap(new LinkedHashMap<>(tableFields)));
        this.fieldValues = Collections.unmodifiableMap(buckets);
        this.document = document;
        this.skippedPages = Collections.unmodifiableList(new ArrayList<>(skippedPages));
    }

    public String getDocumentText() {
        return documentText;
    }

    public Map<String, Map<String, String>> getFieldValues() {
        return fieldValues;
    }

    public Map<String, String> getTextFields() {
        return fieldValues.get(BUCKET_TEXT);
    }

    public Map<String, String> getTableFields() {
        return fieldValues.get(BUCKET_TABLE);
    }

    public DocumentLayout getDocument() {
        return document;
    }

    /**
     * 解析过程中出错而被跳过的页码
     */
    public List<Integer> getSkippedPages() {
        return skippedPages;
    }
}
