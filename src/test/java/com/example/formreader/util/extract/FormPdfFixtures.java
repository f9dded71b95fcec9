package com.example.formreader.util.extract;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;

import java.io.File;
import java.io.IOException;

/**
 * 测试用PDF表单
 *
 * 第 1 页（Letter，792pt 高）：
 * <ul>
 *   <li>文本 "Name: __________"，基线 y=700</li>
 *   <li>文本框 name = value，矩形 (90, 697) - (210, 709)</li>
 *   <li>文本框 city（未填写），矩形 (90, 647) - (210, 659)</li>
 * </ul>
 * 第 2 页为空白页。
 *
 * 表格页（Letter）：100..400 × 660..700 的 2×2 线框表格，左上角坐标为 (100, 92) - (400, 132)，
 * 列分界 x=250，行分界 y=680。
 */
public final class FormPdfFixtures {

    private FormPdfFixtures() {
    }

    public static File createSimpleForm(File target, String value) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            doc.addPage(new PDPage(PDRectangle.LETTER));

            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(font, 12);
                cs.newLineAtOffset(50, 700);
                cs.showText("Name: __________");
                cs.endText();
            }

            PDAcroForm form = new PDAcroForm(doc);
            doc.getDocumentCatalog().setAcroForm(form);
            PDResources resources = new PDResources();
            resources.put(COSName.HELV, font);
            form.setDefaultResources(resources);
            form.setDefaultAppearance("/Helv 0 Tf 0 g");

            PDTextField name = addTextField(form, page, "name", new PDRectangle(90, 697, 120, 12));
            addTextField(form, page, "city", new PDRectangle(90, 647, 120, 12));
            name.setValue(value);

            doc.save(target);
        }
        return target;
    }

    /**
     * 线框表格：表头 Name | Age，正文 Jane | 30
     */
    public static File createGridTable(File target) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);

            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                drawGrid(cs);
                showText(cs, font, 110, 686, "Name");
                showText(cs, font, 260, 686, "Age");
                showText(cs, font, 110, 666, "Jane");
                showText(cs, font, 260, 666, "30");
            }

            doc.save(target);
        }
        return target;
    }

    /**
     * 线框表格：表头 Name | Note，正文 Jane | 文本框 note_1 = noteValue
     */
    public static File createTableForm(File target, String noteValue) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);

            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                drawGrid(cs);
                showText(cs, font, 110, 686, "Name");
                showText(cs, font, 260, 686, "Note");
                showText(cs, font, 110, 666, "Jane");
            }

            PDAcroForm form = new PDAcroForm(doc);
            doc.getDocumentCatalog().setAcroForm(form);
            PDResources resources = new PDResources();
            resources.put(COSName.HELV, font);
            form.setDefaultResources(resources);
            form.setDefaultAppearance("/Helv 0 Tf 0 g");

            PDTextField note = addTextField(form, page, "note_1", new PDRectangle(255, 664, 140, 10));
            note.setValue(noteValue);

            doc.save(target);
        }
        return target;
    }

    private static void drawGrid(PDPageContentStream cs) throws IOException {
        cs.setLineWidth(1f);
        for (float y : new float[]{700f, 680f, 660f}) {
            cs.moveTo(100f, y);
            cs.lineTo(400f, y);
        }
        for (float x : new float[]{100f, 250f, 400f}) {
            cs.moveTo(x, 660f);
            cs.lineTo(x, 700f);
        }
        cs.stroke();
    }

    private static void showText(PDPageContentStream cs, PDType1Font font, float x, float y, String text)
            throws IOException {
        cs.beginText();
        cs.setFont(font, 10);
        cs.newLineAtOffset(x, y);
        cs.showText(text);
        cs.endText();
    }

    private static PDTextField addTextField(PDAcroForm form, PDPage page, String name, PDRectangle rect)
            throws IOException {
        PDTextField field = new PDTextField(form);
        field.setPartialName(name);
        field.setDefaultAppearance("/Helv 10 Tf 0 g");
        form.getFields().add(field);

        PDAnnotationWidget widget = field.getWidgets().get(0);
        widget.setRectangle(rect);
        widget.setPage(page);
        widget.setPrinted(true);
        page.getAnnotations().add(widget);
        return field;
    }
}
