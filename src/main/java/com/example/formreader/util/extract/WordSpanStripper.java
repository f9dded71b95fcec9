package com.example.formreader.util.extract;

import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.Span;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 单词级文本片段提取器
 *
 * 重写 writeString 捕获每个单词的文本和边界框（左上角原点），空白单词跳过。
 * 每次只提取一页。
 */
public class WordSpanStripper extends PDFTextStripper {

    private final List<Span> spans = new ArrayList<>();

    public WordSpanStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    /**
     * 提取指定页（从 0 开始）的单词
     */
    public List<Span> extractPage(PDDocument document, int pageIndex) throws IOException {
        spans.clear();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        getText(document);
        return new ArrayList<>(spans);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (text == null || text.trim().isEmpty()) {
            return;
        }
        Rect rect = PdfCoordinateUtils.computeBoundingBox(textPositions);
        if (rect == null) {
            return;
        }
        spans.add(new Span(text, rect));
    }
}
