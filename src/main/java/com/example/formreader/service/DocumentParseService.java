package com.example.formreader.service;

import com.example.formreader.util.extract.PdfPageScraper;
import com.example.formreader.util.layout.DocumentParser;
import com.example.formreader.util.layout.FieldOnlyParser;
import com.example.formreader.util.layout.RenderMode;
import com.example.formreader.util.layout.dto.ParseResult;
import com.example.formreader.util.layout.dto.ScrapedPage;
import com.example.formreader.util.validate.FieldCommentAnnotator;
import com.example.formreader.util.validate.FieldLengthValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 表单文档解析服务
 * 提供PDF版面文本重建、表单字段提取和字段长度校验
 */
@Slf4j
@Service
public class DocumentParseService {

    private final PdfPageScraper pageScraper;
    private final DocumentParser documentParser;
    private final FieldOnlyParser fieldOnlyParser;
    private final FieldLengthValidator fieldLengthValidator;
    private final FieldCommentAnnotator fieldCommentAnnotator;
    private final RenderMode defaultRenderMode;

    public DocumentParseService(PdfPageScraper pageScraper,
                                DocumentParser documentParser,
                                FieldOnlyParser fieldOnlyParser,
                                FieldLengthValidator fieldLengthValidator,
                                FieldCommentAnnotator fieldCommentAnnotator,
                                RenderMode defaultRenderMode) {
        this.pageScraper = pageScraper;
        this.documentParser = documentParser;
        this.fieldOnlyParser = fieldOnlyParser;
        this.fieldLengthValidator = fieldLengthValidator;
        this.fieldCommentAnnotator = fieldCommentAnnotator;
        this.defaultRenderMode = defaultRenderMode;
    }

    /**
     * 解析已提取的页面数据
     *
     * @param pages 按页顺序的提取数据
     * @param mode 渲染模式，null 时使用配置的默认模式
     */
    public ParseResult parse(List<ScrapedPage> pages, RenderMode mode) {
        return documentParser.parse(pages, mode != null ? mode : defaultRenderMode);
    }

    /**
     * 解析PDF文件
     *
     * @param pdfFile PDF文件
     * @param mode 渲染模式，null 时使用配置的默认模式
     * @throws IOException 文件不存在或无法读取
     */
    public ParseResult parsePdf(File pdfFile, RenderMode mode) throws IOException {
        log.info("开始解析PDF: {}", pdfFile.getAbsolutePath());

        List<ScrapedPage> pages = pageScraper.scrape(pdfFile);
        ParseResult result = parse(pages, mode);

        if (!result.getSkippedPages().isEmpty()) {
            log.warn("PDF解析有页面被跳过: {}, 页码: {}", pdfFile.getName(), result.getSkippedPages());
        }
        log.info("PDF解析完成: {}, 文本长度: {}", pdfFile.getName(), result.getDocumentText().length());
        return result;
    }

    /**
     * 异步解析PDF文件
     */
    @Async
    public CompletableFuture<ParseResult> parsePdfAsync(File pdfFile, RenderMode mode) {
        try {
            return CompletableFuture.completedFuture(parsePdf(pdfFile, mode));
        } catch (IOException e) {
            log.error("异步解析PDF失败: {}", pdfFile.getAbsolutePath(), e);
            CompletableFuture<ParseResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    /**
     * 只提取表单字段（文档文本为字段值 JSON）
     *
     * @throws IOException 文件不存在或无法读取
     */
    public ParseResult parseFields(File pdfFile) throws IOException {
        return fieldOnlyParser.parse(pageScraper.scrapeWidgets(pdfFile));
    }

    /**
     * 检查表单字段长度
     *
     * 需要完整的版面解析来区分表格内外的字段：表格内字段按表格上限校验，其它按正文上限校验。
     *
     * @return 字段名 → 错误说明，全部通过时为空
     * @throws IOException 文件不存在或无法读取
     */
    public Map<String, Map<String, String>> checkFields(File pdfFile) throws IOException {
        ParseResult fields = documentParser.parse(pageScraper.scrape(pdfFile), defaultRenderMode);
        Map<String, Map<String, String>> errors = fieldLengthValidator.validate(fields.getFieldValues());
        log.info("字段检查完成: {}, 正文字段 {} 个, 表格字段 {} 个, 超长 {} 个",
                pdfFile.getName(), fields.getTextFields().size(), fields.getTableFields().size(), errors.size());
        return errors;
    }

    /**
     * 检查表单字段长度，并把结果作为注释写入新的PDF（原文件名_checked.pdf）
     *
     * @return 带注释的PDF文件
     * @throws IOException 文件不存在或无法读写
     */
    public File checkAndAnnotate(File pdfFile) throws IOException {
        return fieldCommentAnnotator.annotate(pdfFile, checkFields(pdfFile));
    }
}
