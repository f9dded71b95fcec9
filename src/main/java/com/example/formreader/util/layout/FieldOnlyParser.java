package com.example.formreader.util.layout;

import com.example.formreader.util.layout.dto.DocumentLayout;
import com.example.formreader.util.layout.dto.ParseResult;
import com.example.formreader.util.layout.dto.ScrapedPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 只解析表单字段，不做版面重建
 *
 * 收集所有页面上已填写的文本字段（同名字段后者覆盖前者），
 * 文档文本为这些字段的 JSON 对象，字段全部放在 "Text" 分组。
 */
public class FieldOnlyParser {

    private static final Logger log = LoggerFactory.getLogger(FieldOnlyParser.class);

    private final ObjectMapper objectMapper;

    public FieldOnlyParser() {
        this(new ObjectMapper());
    }

    public FieldOnlyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParseResult parse(List<ScrapedPage> pages) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (ScrapedPage page : pages) {
            if (page != null) {
                fields.putAll(WidgetSpanProcessor.extractTextWidgets(page.getWidgets()));
            }
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            // String → String 的 Map 序列化不应失败
            throw new IllegalStateException("字段序列化失败", e);
        }

        log.info("字段解析完成: {} 页, {} 个文本字段", pages.size(), fields.size());
        return new ParseResult(json, fields, Collections.<String, String>emptyMap(),
                new DocumentLayout(Collections.emptyList()), Collections.<Integer>emptyList());
    }
}
