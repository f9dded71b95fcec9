package com.example.formreader.config;

import com.example.formreader.util.extract.PdfPageScraper;
import com.example.formreader.util.extract.TabulaTableLocator;
import com.example.formreader.util.layout.DocumentParser;
import com.example.formreader.util.layout.FieldOnlyParser;
import com.example.formreader.util.layout.LayoutConfig;
import com.example.formreader.util.layout.RenderMode;
import com.example.formreader.util.validate.FieldCommentAnnotator;
import com.example.formreader.util.validate.FieldLengthValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 版面解析组件装配
 *
 * formreader.layout.config-path 为空时使用默认配置，否则从 JSON 文件部分覆盖。
 */
@Slf4j
@Configuration
public class FormReaderConfig {

    @Value("${formreader.layout.config-path:}")
    private String layoutConfigPath;

    @Value("${formreader.render-mode:plain}")
    private String renderMode;

    @Bean
    public LayoutConfig layoutConfig() {
        if (layoutConfigPath == null || layoutConfigPath.trim().isEmpty()) {
            log.info("未指定版面配置文件，使用默认配置");
            return LayoutConfig.loadDefault();
        }
        return LayoutConfig.loadFromJson(layoutConfigPath.trim());
    }

    @Bean
    public RenderMode defaultRenderMode() {
        RenderMode mode = RenderMode.fromString(renderMode.trim());
        log.info("默认渲染模式: {}", mode.getValue());
        return mode;
    }

    @Bean
    public DocumentParser documentParser(LayoutConfig layoutConfig) {
        return new DocumentParser(layoutConfig);
    }

    @Bean
    public FieldOnlyParser fieldOnlyParser(ObjectMapper objectMapper) {
        return new FieldOnlyParser(objectMapper);
    }

    @Bean
    public FieldLengthValidator fieldLengthValidator(LayoutConfig layoutConfig) {
        return new FieldLengthValidator(layoutConfig);
    }

    @Bean
    public FieldCommentAnnotator fieldCommentAnnotator() {
        return new FieldCommentAnnotator();
    }

    @Bean
    public PdfPageScraper pdfPageScraper(LayoutConfig layoutConfig) {
        return new PdfPageScraper(new TabulaTableLocator(layoutConfig.TABULA_STREAM_FALLBACK));
    }
}
