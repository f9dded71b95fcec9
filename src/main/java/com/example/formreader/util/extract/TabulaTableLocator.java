package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.ScrapedTable;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.BasicExtractionAlgorithm;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Tabula 的表格定位
 *
 * 先用 lattice（有线框）算法；开启 streamFallback 时，lattice 没有结果再用 stream（无线框）兜底。
 * 每个表格的第一行作为表头。
 */
public class TabulaTableLocator implements TableLocator {

    private static final Logger log = LoggerFactory.getLogger(TabulaTableLocator.class);

    private final SpreadsheetExtractionAlgorithm lattice = new SpreadsheetExtractionAlgorithm();
    private final BasicExtractionAlgorithm stream = new BasicExtractionAlgorithm();
    private final boolean streamFallback;

    public TabulaTableLocator() {
        this(false);
    }

    public TabulaTableLocator(boolean streamFallback) {
        this.streamFallback = streamFallback;
    }

    @Override
    public List<ScrapedTable> locate(PDDocument document, int pageIndex) {
        List<ScrapedTable> tables = new ArrayList<>();

        try {
            // ObjectExtractor.close() 会关闭文档，这里不关闭
            ObjectExtractor oe = new ObjectExtractor(document);
            Page tabulaPage = oe.extract(pageIndex + 1);
            if (tabulaPage == null) {
                log.debug("[Tabula] 页面 {} 未找到", pageIndex);
                return tables;
            }

            List<Table> tabulaTables = lattice.extract(tabulaPage);
            if (tabulaTables.isEmpty() && streamFallback) {
                tabulaTables = stream.extract(tabulaPage);
                log.debug("[Tabula] 第 {} 页 lattice 无结果, stream 提取到 {} 个表格", pageIndex + 1, tabulaTables.size());
            }
            for (Table tabulaTable : tabulaTables) {
                ScrapedTable table = convertTabulaTable(tabulaTable);
                if (table != null) {
                    tables.add(table);
                }
            }
            log.debug("[Tabula] 第 {} 页提取到 {} 个表格", pageIndex + 1, tables.size());

        } catch (Exception | LinkageError e) {
            // Tabula 基于 PDFBox 2 编译，遇到不兼容的 PDFBox API 时按无表格处理
            log.warn("[Tabula] 第 {} 页表格提取失败: {}", pageIndex + 1, e.toString());
        }

        return tables;
    }

    /**
     * Tabula 表格 → 表格结构（边界框 + 第一行表头）
     *
     * 没有行或第一行没有有效单元格时返回 null。
     */
    @SuppressWarnings("rawtypes")
    static ScrapedTable convertTabulaTable(Table tabulaTable) {
        List<List<RectangularTextContainer>> rows = tabulaTable.getRows();
        if (rows.isEmpty()) {
            return null;
        }

        List<Rect> headerCells = new ArrayList<>();
        List<String> headerNames = new ArrayList<>();
        for (RectangularTextContainer cell : rows.get(0)) {
            // 合并单元格在 Tabula 中以零尺寸的占位单元格出现
            if (cell.getWidth() <= 0 || cell.getHeight() <= 0) {
                continue;
            }
            headerCells.add(new Rect(cell.getLeft(), cell.getTop(), cell.getRight(), cell.getBottom()));
            headerNames.add(normalizeHeader(cell.getText()));
        }
        if (headerCells.isEmpty()) {
            return null;
        }

        Rect bbox = new Rect(tabulaTable.getLeft(), tabulaTable.getTop(),
                tabulaTable.getRight(), tabulaTable.getBottom());
        return new ScrapedTable(bbox, headerCells, headerNames);
    }

    /**
     * 表头文本：换行替换为空格，去掉首尾空白
     */
    static String normalizeHeader(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s*\\r?\\n\\s*", " ").trim();
    }
}
