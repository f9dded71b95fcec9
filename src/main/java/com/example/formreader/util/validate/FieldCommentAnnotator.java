package com.example.formreader.util.validate;

import com.example.formreader.util.extract.PdfPageScraper;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationText;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把字段校验结果作为便签注释写回PDF
 *
 * 便签放在页面右边缘、与控件顶部对齐，输出文件名为 原文件名_checked.pdf。
 */
public class FieldCommentAnnotator {

    private static final Logger log = LoggerFactory.getLogger(FieldCommentAnnotator.class);

    /** 便签距页面右边缘的距离（pt） */
    static final float COMMENT_OFFSET_RIGHT = 25f;

    /** 便签图标尺寸（pt） */
    static final float COMMENT_SIZE = 20f;

    /**
     * 为出错字段添加注释
     *
     * @param pdfFile 原PDF
     * @param errors 字段名 → 错误说明（FieldLengthValidator 的输出）
     * @return 带注释的新文件（与原文件同目录）
     * @throws IOException 文件不存在或无法读写
     */
    public File annotate(File pdfFile, Map<String, Map<String, String>> errors) throws IOException {
        if (!pdfFile.exists()) {
            throw new IOException("PDF文件不存在: " + pdfFile.getPath());
        }
        File output = new File(pdfFile.getAbsoluteFile().getParentFile(), checkedFileName(pdfFile.getName()));

        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            int added = 0;
            PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
            if (acroForm != null && !errors.isEmpty()) {
                Map<COSDictionary, Integer> widgetPages = PdfPageScraper.indexWidgetPages(document);
                for (PDField field : acroForm.getFieldTree()) {
                    Map<String, String> fieldErrors = errors.get(field.getFullyQualifiedName());
                    if (fieldErrors == null || !(field instanceof PDTerminalField)) {
                        continue;
                    }
                    for (PDAnnotationWidget widget : ((PDTerminalField) field).getWidgets()) {
                        Integer pageIndex = widgetPages.get(widget.getCOSObject());
                        if (pageIndex == null || widget.getRectangle() == null) {
                            continue;
                        }
                        addComment(document.getPage(pageIndex), widget.getRectangle(), formatComment(fieldErrors));
                        added++;
                    }
                }
            }

            document.save(output);
            log.info("已添加字段注释 {} 个: {}", added, output.getAbsolutePath());
        }
        return output;
    }

    private static void addComment(PDPage page, PDRectangle widgetRect, String contents) throws IOException {
        PDRectangle mediaBox = page.getMediaBox();
        float x = mediaBox.getUpperRightX() - COMMENT_OFFSET_RIGHT;
        float top = widgetRect.getUpperRightY();

        PDAnnotationText note = new PDAnnotationText();
        note.setName(PDAnnotationText.NAME_NOTE);
        note.setRectangle(new PDRectangle(x, top - COMMENT_SIZE, COMMENT_SIZE, COMMENT_SIZE));
        note.setContents(contents);
        note.setPrinted(true);

        page.getAnnotations().add(note);
    }

    /**
     * 错误说明拼成注释文本，每条一行："Max length: Perhaps the line is too long"
     */
    static String formatComment(Map<String, String> fieldErrors) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> entry : fieldErrors.entrySet()) {
            lines.add(entry.getKey() + ": " + entry.getValue());
        }
        return String.join("\n", lines);
    }

    static String checkedFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "_checked";
        }
        return fileName.substring(0, dot) + "_checked" + fileName.substring(dot);
    }
}
