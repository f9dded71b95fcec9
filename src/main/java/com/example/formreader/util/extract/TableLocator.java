package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.ScrapedTable;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.List;

/**
 * 页面表格定位
 *
 * 返回每个表格的边界框和表头（单元格矩形 + 名称），坐标为左上角原点。
 */
public interface TableLocator {

    /**
     * @param document 已打开的文档（调用方负责关闭）
     * @param pageIndex 页面索引（从 0 开始）
     */
    List<ScrapedTable> locate(PDDocument document, int pageIndex) throws IOException;
}
