package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.FieldType;
import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.ScrapedPage;
import com.example.formreader.util.layout.dto.ScrapedTable;
import com.example.formreader.util.layout.dto.Span;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDCheckBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDComboBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * PDF 页面提取器：把 PDF 文件转换为版面解析的输入
 *
 * 每页提取三类数据：
 * <ul>
 *   <li>文本片段：单词级，见 {@link WordSpanStripper}</li>
 *   <li>表单控件：AcroForm 终端字段的 Widget 注释</li>
 *   <li>表格结构：由 {@link TableLocator} 给出（默认 Tabula）</li>
 * </ul>
 * 所有坐标都是左上角原点。
 */
public class PdfPageScraper {

    private static final Logger log = LoggerFactory.getLogger(PdfPageScraper.class);

    private final TableLocator tableLocator;

    public PdfPageScraper() {
        this(new TabulaTableLocator());
    }

    public PdfPageScraper(TableLocator tableLocator) {
        this.tableLocator = tableLocator;
    }

    /**
     * 提取全部页面（文本 + 控件 + 表格）
     *
     * @throws IOException 文件不存在或无法解析
     */
    public List<ScrapedPage> scrape(File pdfFile) throws IOException {
        checkExists(pdfFile);
        long startTime = System.currentTimeMillis();

        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            int pageCount = document.getNumberOfPages();
            List<List<PdfFormWidget>> widgetsByPage = extractWidgets(document);
            WordSpanStripper stripper = new WordSpanStripper();

            List<ScrapedPage> pages = new ArrayList<>(pageCount);
            for (int i = 0; i < pageCount; i++) {
                List<Span> spans = stripper.extractPage(document, i);
                List<ScrapedTable> tables = tableLocator.locate(document, i);
                pages.add(new ScrapedPage(spans, widgetsByPage.get(i), tables));
                log.debug("第 {} 页: {} 个单词, {} 个控件, {} 个表格",
                        i + 1, spans.size(), widgetsByPage.get(i).size(), tables.size());
            }

            log.info("PDF提取完成: {}, {} 页, 耗时 {} ms",
                    pdfFile.getName(), pageCount, System.currentTimeMillis() - startTime);
            return pages;
        }
    }

    /**
     * 只提取表单控件（不提取文本和表格）
     *
     * @throws IOException 文件不存在或无法解析
     */
    public List<ScrapedPage> scrapeWidgets(File pdfFile) throws IOException {
        checkExists(pdfFile);

        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            List<ScrapedPage> pages = new ArrayList<>();
            for (List<PdfFormWidget> widgets : extractWidgets(document)) {
                pages.add(new ScrapedPage(Collections.<Span>emptyList(), widgets,
                        Collections.<ScrapedTable>emptyList()));
            }
            log.info("PDF控件提取完成: {}, {} 页", pdfFile.getName(), pages.size());
            return pages;
        }
    }

    private static void checkExists(File pdfFile) throws IOException {
        if (pdfFile == null || !pdfFile.exists()) {
            throw new IOException("PDF文件不存在: " + (pdfFile != null ? pdfFile.getPath() : null));
        }
    }

    // ========== 表单控件 ==========

    /**
     * 按页收集控件，返回列表的下标即页面索引
     */
    static List<List<PdfFormWidget>> extractWidgets(PDDocument document) throws IOException {
        int pageCount = document.getNumberOfPages();
        List<List<PdfFormWidget>> result = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            result.add(new ArrayList<PdfFormWidget>());
        }

        PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
        if (acroForm == null) {
            return result;
        }

        Map<COSDictionary, Integer> widgetPages = indexWidgetPages(document);

        for (PDField field : acroForm.getFieldTree()) {
            if (!(field instanceof PDTerminalField)) {
                continue;
            }
            FieldType type = mapFieldType(field);
            String value = readFieldValue(field);

            for (PDAnnotationWidget widget : ((PDTerminalField) field).getWidgets()) {
                Integer pageIndex = widgetPages.get(widget.getCOSObject());
                PDRectangle rectangle = widget.getRectangle();
                if (pageIndex == null || rectangle == null) {
                    log.debug("控件 {} 没有所在页面或位置，跳过", field.getFullyQualifiedName());
                    continue;
                }

                PDPage page = document.getPage(pageIndex);
                Rect rect = PdfCoordinateUtils.toTopLeft(rectangle, page.getCropBox());
                result.get(pageIndex).add(new PdfFormWidget(field.getFullyQualifiedName(), type, value, rect,
                        pageIndex, field.getFieldType()));
            }
        }

        return result;
    }

    /**
     * Widget 注释 → 所在页面索引（按对象身份）
     *
     * Widget 的 /P 是可选项，只能从页面的注释列表反查。
     */
    public static Map<COSDictionary, Integer> indexWidgetPages(PDDocument document) throws IOException {
        Map<COSDictionary, Integer> widgetPages = new IdentityHashMap<>();
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            for (PDAnnotation annotation : document.getPage(i).getAnnotations()) {
                if (annotation instanceof PDAnnotationWidget) {
                    widgetPages.put(annotation.getCOSObject(), i);
                }
            }
        }
        return widgetPages;
    }

    /**
     * PDFBox 字段类 → 字段类型
     */
    static FieldType mapFieldType(PDField field) {
        if (field instanceof PDTextField) {
            return FieldType.TEXT;
        }
        if (field instanceof PDComboBox) {
            return FieldType.COMBO_BOX;
        }
        if (field instanceof PDCheckBox) {
            return FieldType.CHECK_BOX;
        }
        return FieldType.OTHER;
    }

    /**
     * 字段当前值
     *
     * 复选框勾选时返回导出值（on 状态名），未勾选返回 null；
     * 下拉框多个值用 ", " 连接。
     */
    static String readFieldValue(PDField field) {
        if (field instanceof PDCheckBox) {
            PDCheckBox checkBox = (PDCheckBox) field;
            return checkBox.isChecked() ? checkBox.getOnValue() : null;
        }
        if (field instanceof PDComboBox) {
            List<String> values = ((PDComboBox) field).getValue();
            return values.isEmpty() ? null : String.join(", ", values);
        }
        return field.getValueAsString();
    }
}
