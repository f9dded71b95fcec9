package com.example.formreader;

import com.example.formreader.service.DocumentParseService;
import com.example.formreader.util.layout.RenderMode;
import com.example.formreader.util.layout.dto.FormWidget;
import com.example.formreader.util.layout.dto.ParseResult;
import com.example.formreader.util.layout.dto.Rect;
import com.example.formreader.util.layout.dto.ScrapedPage;
import com.example.formreader.util.layout.dto.ScrapedTable;
import com.example.formreader.util.layout.dto.Span;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FormReaderApplicationTest {

    @Autowired
    private DocumentParseService documentParseService;

    @Autowired
    private RenderMode defaultRenderMode;

    @Test
    void contextLoads() {
        assertThat(documentParseService).isNotNull();
        // src/test/resources/application.properties
        assertThat(defaultRenderMode).isEqualTo(RenderMode.LABEL);
    }

    @Test
    void nullModeFallsBackToConfiguredMode() {
        ScrapedPage page = new ScrapedPage(Collections.singletonList(new Span("Hello", new Rect(0, 0, 30, 10))),
                Collections.<FormWidget>emptyList(), Collections.<ScrapedTable>emptyList());

        ParseResult result = documentParseService.parse(Collections.singletonList(page), null);

        assertThat(result.getDocumentText()).isEqualTo("Page # 1\n\nHello\n");
    }
}
